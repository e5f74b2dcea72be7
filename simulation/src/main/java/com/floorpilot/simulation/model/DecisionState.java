package com.floorpilot.simulation.model;

import java.util.List;

/**
 * Discretized observation used as the value table key.
 *
 * Raw observations that differ only within a bucket width map to equal keys.
 * Collections are copied into immutable lists so that equality and hashing
 * compare contents, never array identity.
 *
 * @param machineId         machine awaiting assignment, or {@link #NO_MACHINE}
 * @param priority          priority level of that machine (0 when none awaits)
 * @param shiftIndex        current shift
 * @param timeBucket        bucketed minutes remaining in the day
 * @param shortfallBucket   bucketed good parts still missing from the daily target
 * @param availabilityMask  bit {@code i} set when operator {@code i} is free
 * @param skillBuckets      per operator skill bucket on the awaiting machine
 * @param machineStatuses   per machine status code
 */
public record DecisionState(
    int machineId,
    int priority,
    int shiftIndex,
    int timeBucket,
    int shortfallBucket,
    int availabilityMask,
    List<Integer> skillBuckets,
    List<Integer> machineStatuses
) {

    public static final int NO_MACHINE = -1;

    public DecisionState {
        if (machineId < NO_MACHINE) {
            throw new IllegalArgumentException("machineId out of range: " + machineId);
        }
        if (priority < 0 || shiftIndex < 0 || timeBucket < 0 || shortfallBucket < 0 || availabilityMask < 0) {
            throw new IllegalArgumentException("Decision state fields must be non-negative");
        }
        skillBuckets = List.copyOf(skillBuckets);
        machineStatuses = List.copyOf(machineStatuses);
    }

    public boolean hasAwaitingMachine() {
        return machineId != NO_MACHINE;
    }

    public boolean operatorAvailable(int operatorId) {
        return (availabilityMask & (1 << operatorId)) != 0;
    }
}
