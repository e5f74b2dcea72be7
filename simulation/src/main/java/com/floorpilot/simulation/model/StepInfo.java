package com.floorpilot.simulation.model;

/**
 * Side channel returned with every step, for logging and diagnostics.
 */
public record StepInfo(
    int machineId,
    int action,
    int assignedOperator,
    IllegalActionReason illegalReason,
    boolean idledWithEligibleOperator,
    double elapsedMinutes,
    int shiftIndex,
    int goodPartsThisStep,
    int defectivePartsThisStep,
    int goodPartsTotal,
    int defectivePartsTotal,
    int breakdowns,
    int maintenanceStops
) {

    public boolean illegalAction() {
        return illegalReason.isIllegal();
    }
}
