package com.floorpilot.agent.schedule;

import com.floorpilot.shared.config.InvalidConfigurationException;

/**
 * Fast linear drop from {@code start} to {@code knee} over the first
 * {@code splitFraction} of the horizon, then a slow linear drop to
 * {@code floor}. Held at {@code floor} from the horizon on.
 */
public final class TwoPhaseDecaySchedule implements DecaySchedule {

    private static final double DEFAULT_KNEE = 0.3;
    private static final double DEFAULT_SPLIT = 0.3;

    private final double start;
    private final double knee;
    private final double floor;
    private final int horizon;
    private final int splitPoint;

    public TwoPhaseDecaySchedule(double start, double floor, int horizon) {
        this(start, Math.min(start, Math.max(DEFAULT_KNEE, floor)), floor, horizon, DEFAULT_SPLIT);
    }

    public TwoPhaseDecaySchedule(double start, double knee, double floor, int horizon, double splitFraction) {
        if (!(floor >= 0 && floor <= knee && knee <= start)) {
            throw new InvalidConfigurationException(
                "Two-phase decay needs 0 <= floor <= knee <= start, got " + start + "/" + knee + "/" + floor);
        }
        if (horizon <= 0) {
            throw new InvalidConfigurationException("Decay horizon must be positive: " + horizon);
        }
        if (splitFraction <= 0 || splitFraction >= 1) {
            throw new InvalidConfigurationException("splitFraction must be in (0,1): " + splitFraction);
        }
        this.start = start;
        this.knee = knee;
        this.floor = floor;
        this.horizon = horizon;
        this.splitPoint = Math.max(1, (int) (splitFraction * horizon));
    }

    @Override
    public double valueAt(int episodeIndex) {
        if (episodeIndex >= horizon) {
            return floor;
        }
        int episode = Math.max(0, episodeIndex);
        if (episode <= splitPoint) {
            return start + (episode / (double) splitPoint) * (knee - start);
        }
        int remaining = horizon - splitPoint;
        if (remaining <= 0) {
            return floor;
        }
        return knee + ((episode - splitPoint) / (double) remaining) * (floor - knee);
    }
}
