package com.floorpilot.agent.schedule;

/**
 * Deterministic, non-increasing function of the training episode index.
 */
@FunctionalInterface
public interface DecaySchedule {

    double valueAt(int episodeIndex);

    static DecaySchedule constant(double value) {
        return episodeIndex -> value;
    }
}
