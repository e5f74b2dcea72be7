package com.floorpilot.shared.config;

import java.util.Arrays;

/**
 * Cutoffs used to discretize continuous observations.
 *
 * Time-remaining and shortfall cutoffs are fractions of the day length and
 * of the daily target respectively; skill cutoffs are absolute values in [0,1].
 * Each array must be strictly increasing. A value equal to a cutoff falls into
 * the lower bucket, so {@code n} cutoffs always yield {@code n + 1} buckets.
 */
public final class BucketThresholds {

    private final double[] timeRemainingFractions;
    private final double[] shortfallFractions;
    private final double[] skillCutoffs;

    public BucketThresholds(double[] timeRemainingFractions, double[] shortfallFractions, double[] skillCutoffs) {
        this.timeRemainingFractions = checked("timeRemainingFractions", timeRemainingFractions);
        this.shortfallFractions = checked("shortfallFractions", shortfallFractions);
        this.skillCutoffs = checked("skillCutoffs", skillCutoffs);
    }

    /**
     * Four time buckets, four shortfall buckets, three skill buckets.
     */
    public static BucketThresholds defaults() {
        return new BucketThresholds(
            new double[] {0.0, 0.25, 0.5},
            new double[] {0.0, 1.0 / 3.0, 2.0 / 3.0},
            new double[] {0.3, 0.7});
    }

    private static double[] checked(String name, double[] cutoffs) {
        if (cutoffs == null || cutoffs.length == 0) {
            throw new InvalidConfigurationException(name + " must contain at least one cutoff");
        }
        for (int i = 1; i < cutoffs.length; i++) {
            if (cutoffs[i] <= cutoffs[i - 1]) {
                throw new InvalidConfigurationException(name + " must be strictly increasing: "
                    + Arrays.toString(cutoffs));
            }
        }
        return cutoffs.clone();
    }

    public double[] timeRemainingFractions() {
        return timeRemainingFractions.clone();
    }

    public double[] shortfallFractions() {
        return shortfallFractions.clone();
    }

    public double[] skillCutoffs() {
        return skillCutoffs.clone();
    }

    public int timeBucketCount() {
        return timeRemainingFractions.length + 1;
    }

    public int shortfallBucketCount() {
        return shortfallFractions.length + 1;
    }

    public int skillBucketCount() {
        return skillCutoffs.length + 1;
    }
}
