package com.floorpilot.training.model;

/**
 * Production relative to the daily target.
 */
public enum PerformanceBand {
    EXCELLENT("≥120% of target"),
    GOOD("100-120% of target"),
    FAIR("80-100% of target"),
    POOR("<80% of target");

    private final String label;

    PerformanceBand(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static PerformanceBand classify(int produced, int target) {
        double ratio = (double) produced / target;
        if (ratio >= 1.2) {
            return EXCELLENT;
        }
        if (ratio >= 1.0) {
            return GOOD;
        }
        if (ratio >= 0.8) {
            return FAIR;
        }
        return POOR;
    }
}
