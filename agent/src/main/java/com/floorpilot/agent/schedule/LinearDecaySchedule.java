package com.floorpilot.agent.schedule;

import com.floorpilot.shared.config.InvalidConfigurationException;

/**
 * Straight line from {@code start} at episode 0 to {@code floor} at
 * {@code horizon}, then held at {@code floor}.
 */
public final class LinearDecaySchedule implements DecaySchedule {

    private final double start;
    private final double floor;
    private final int horizon;

    public LinearDecaySchedule(double start, double floor, int horizon) {
        if (floor < 0 || start < floor) {
            throw new InvalidConfigurationException(
                "Decay needs 0 <= floor <= start, got start=" + start + " floor=" + floor);
        }
        if (horizon <= 0) {
            throw new InvalidConfigurationException("Decay horizon must be positive: " + horizon);
        }
        this.start = start;
        this.floor = floor;
        this.horizon = horizon;
    }

    @Override
    public double valueAt(int episodeIndex) {
        if (episodeIndex >= horizon) {
            return floor;
        }
        double ratio = Math.max(0, episodeIndex) / (double) horizon;
        return start + ratio * (floor - start);
    }

    public double start() {
        return start;
    }

    public double floor() {
        return floor;
    }

    public int horizon() {
        return horizon;
    }
}
