package com.floorpilot.simulation.service;

/**
 * Maps continuous values onto ordinal buckets.
 */
public final class Bucketing {

    private Bucketing() {
        // Utility class - prevent instantiation
    }

    /**
     * Index of the bucket holding {@code value}: the number of cutoffs strictly
     * below it. A value equal to a cutoff lands in the lower bucket, and every
     * value lands in exactly one of {@code cutoffs.length + 1} buckets.
     *
     * @param cutoffs strictly increasing bucket boundaries
     */
    public static int bucketOf(double value, double[] cutoffs) {
        int bucket = 0;
        for (double cutoff : cutoffs) {
            if (value > cutoff) {
                bucket++;
            } else {
                break;
            }
        }
        return bucket;
    }

    /**
     * Index of the bucket holding {@code value} over closed-open intervals
     * {@code [cutoff_i, cutoff_i+1)}: the number of cutoffs at or below it. A
     * value equal to a cutoff lands in the upper bucket.
     *
     * @param cutoffs strictly increasing bucket boundaries
     */
    public static int bucketOfClosedOpen(double value, double[] cutoffs) {
        int bucket = 0;
        for (double cutoff : cutoffs) {
            if (value >= cutoff) {
                bucket++;
            } else {
                break;
            }
        }
        return bucket;
    }

    /**
     * Scales fractional cutoffs to an absolute range.
     */
    public static double[] scale(double[] fractions, double range) {
        double[] scaled = new double[fractions.length];
        for (int i = 0; i < fractions.length; i++) {
            scaled[i] = fractions[i] * range;
        }
        return scaled;
    }
}
