package com.floorpilot.simulation.model;

/**
 * Daily goal of good parts and the running totals for the current episode.
 */
public class ProductionTarget {

    private final int dailyTarget;
    private int goodParts;
    private int defectiveParts;
    private boolean halfwayPassed;
    private boolean eightyPercentPassed;

    public ProductionTarget(int dailyTarget) {
        if (dailyTarget <= 0) {
            throw new IllegalArgumentException("Daily target must be positive: " + dailyTarget);
        }
        this.dailyTarget = dailyTarget;
    }

    public void reset() {
        goodParts = 0;
        defectiveParts = 0;
        halfwayPassed = false;
        eightyPercentPassed = false;
    }

    public void recordGood() {
        goodParts++;
    }

    public void recordDefective() {
        defectiveParts++;
    }

    /**
     * True once per episode, the first time good parts reach half the target.
     */
    public boolean passHalfway() {
        if (halfwayPassed || goodParts < 0.5 * dailyTarget) {
            return false;
        }
        halfwayPassed = true;
        return true;
    }

    /**
     * True once per episode, the first time good parts reach 80% of the target.
     */
    public boolean passEightyPercent() {
        if (eightyPercentPassed || goodParts < 0.8 * dailyTarget) {
            return false;
        }
        eightyPercentPassed = true;
        return true;
    }

    public int dailyTarget() {
        return dailyTarget;
    }

    public int goodParts() {
        return goodParts;
    }

    public int defectiveParts() {
        return defectiveParts;
    }

    public int shortfall() {
        return Math.max(0, dailyTarget - goodParts);
    }

    public boolean isMet() {
        return goodParts >= dailyTarget;
    }
}
