package com.floorpilot.agent.schedule;

import com.floorpilot.shared.config.InvalidConfigurationException;

/**
 * Discount factor plus exploration and learning-rate schedules for one agent.
 */
public record LearningSchedule(double discount, DecaySchedule exploration, DecaySchedule learningRate) {

    public LearningSchedule {
        if (discount < 0.0 || discount > 1.0) {
            throw new InvalidConfigurationException("Discount factor must be in [0,1]: " + discount);
        }
        if (exploration == null || learningRate == null) {
            throw new InvalidConfigurationException("Exploration and learning-rate schedules are required");
        }
    }

    /**
     * Training defaults: epsilon 1.0 to 0.05 in two phases, alpha 0.1 to 0.01
     * linearly, both over {@code episodes - 1} episodes; gamma 0.99.
     */
    public static LearningSchedule standard(int episodes) {
        int horizon = Math.max(1, episodes - 1);
        return new LearningSchedule(0.99,
            new TwoPhaseDecaySchedule(1.0, 0.05, horizon),
            new LinearDecaySchedule(0.1, 0.01, horizon));
    }

    /**
     * Fixed alpha and gamma, no exploration decay. Used for evaluation and tests.
     */
    public static LearningSchedule fixed(double discount, double epsilon, double alpha) {
        return new LearningSchedule(discount, DecaySchedule.constant(epsilon), DecaySchedule.constant(alpha));
    }
}
