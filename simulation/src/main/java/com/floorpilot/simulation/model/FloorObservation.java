package com.floorpilot.simulation.model;

import com.floorpilot.shared.model.MachineStatus;

import java.util.List;

/**
 * Raw, undiscretized view of the floor at a decision point.
 */
public record FloorObservation(
    int awaitingMachine,
    double elapsedMinutes,
    int shiftIndex,
    int goodParts,
    List<Boolean> operatorFree,
    List<MachineStatus> machineStatuses
) {

    public FloorObservation {
        operatorFree = List.copyOf(operatorFree);
        machineStatuses = List.copyOf(machineStatuses);
    }
}
