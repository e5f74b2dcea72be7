package com.floorpilot.simulation.model;

/**
 * Why an action was replaced by "leave idle".
 */
public enum IllegalActionReason {
    NONE,
    OUT_OF_RANGE,
    OPERATOR_BUSY,
    OPERATOR_OVER_CAPACITY;

    public boolean isIllegal() {
        return this != NONE;
    }
}
