package com.floorpilot.shared.model;

/**
 * Scheduling priority of a machine. Higher priority machines are offered
 * to the assignment policy first.
 */
public enum PriorityClass {
    LOW(0),
    MEDIUM(1),
    HIGH(2);

    private final int level;

    PriorityClass(int level) {
        this.level = level;
    }

    public int level() {
        return level;
    }

    public static PriorityClass fromLevel(int level) {
        for (PriorityClass priority : values()) {
            if (priority.level == level) {
                return priority;
            }
        }
        throw new IllegalArgumentException("Unknown priority level: " + level);
    }
}
