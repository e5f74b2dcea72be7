package com.floorpilot.simulation.model;

import com.floorpilot.shared.model.MachineStatus;

import java.util.List;

/**
 * One frame of a recorded episode timeline.
 *
 * @param machineOperators operator bound to each machine, or -1
 * @param operatorSkills   skill of that operator on the machine, or -1.0
 */
public record FloorSnapshot(
    double timeMinutes,
    int shiftIndex,
    List<Integer> machineOperators,
    List<Double> operatorSkills,
    List<MachineStatus> machineStatuses,
    int goodParts
) {

    public FloorSnapshot {
        machineOperators = List.copyOf(machineOperators);
        operatorSkills = List.copyOf(operatorSkills);
        machineStatuses = List.copyOf(machineStatuses);
    }
}
