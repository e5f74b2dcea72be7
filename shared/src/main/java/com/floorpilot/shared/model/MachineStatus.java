package com.floorpilot.shared.model;

/**
 * Status of a machine on the simulated floor.
 *
 * The ordinal-independent {@link #code()} is the value carried in the
 * discretized decision state, so reordering constants never changes keys
 * stored in a persisted value table.
 */
public enum MachineStatus {
    IDLE(0),
    BUSY(1),
    BROKEN(2),
    MAINTENANCE(3);

    private final int code;

    MachineStatus(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * Returns true if the machine can take a new operator assignment.
     */
    public boolean isAssignable() {
        return this == IDLE;
    }

    /**
     * Returns true if the machine is out of service (broken or under maintenance).
     */
    public boolean isDown() {
        return this == BROKEN || this == MAINTENANCE;
    }

    /**
     * Number of distinct status codes.
     */
    public static int codeCount() {
        return values().length;
    }
}
