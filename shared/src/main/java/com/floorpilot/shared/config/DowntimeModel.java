package com.floorpilot.shared.config;

/**
 * Stochastic downtime event, rolled once per completed unit.
 *
 * A triggered event lasts {@code max(minMinutes, uniform(maxMinutes / 2, maxMinutes))}.
 */
public record DowntimeModel(double probability, double minMinutes, double maxMinutes) {

    public DowntimeModel {
        if (probability < 0.0 || probability > 1.0) {
            throw new InvalidConfigurationException("Downtime probability must be in [0,1]: " + probability);
        }
        if (minMinutes < 0 || maxMinutes < 0) {
            throw new InvalidConfigurationException("Downtime durations must be non-negative");
        }
        if (probability > 0.0 && Math.max(minMinutes, maxMinutes) <= 0.0) {
            throw new InvalidConfigurationException("A downtime event that can occur needs a positive duration");
        }
    }

    public static DowntimeModel never() {
        return new DowntimeModel(0.0, 0.0, 0.0);
    }

    /**
     * Maps a uniform draw in [0,1) to a duration.
     */
    public double durationFor(double uniformDraw) {
        double sampled = 0.5 * maxMinutes + uniformDraw * 0.5 * maxMinutes;
        return Math.max(minMinutes, sampled);
    }
}
