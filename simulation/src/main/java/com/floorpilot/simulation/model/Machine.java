package com.floorpilot.simulation.model;

import com.floorpilot.shared.model.MachineStatus;
import com.floorpilot.shared.model.PriorityClass;

/**
 * A machine on the floor and its status machine:
 * {@code IDLE -> BUSY -> IDLE} on completion, {@code BUSY -> BROKEN -> MAINTENANCE -> IDLE}
 * after a breakdown, {@code BUSY -> MAINTENANCE -> IDLE} for a maintenance stop.
 *
 * A machine is BUSY exactly while an operator is bound to it.
 */
public class Machine {

    private final int id;
    private final PriorityClass priority;
    private MachineStatus status = MachineStatus.IDLE;
    private int operatorId = Operator.UNBOUND;
    private int lastOperatorId = Operator.UNBOUND;
    private double remainingMinutes;
    private double downUntilMinute;
    private double followUpMaintenanceMinutes;

    public Machine(int id, PriorityClass priority) {
        this.id = id;
        this.priority = priority;
    }

    public void reset() {
        status = MachineStatus.IDLE;
        operatorId = Operator.UNBOUND;
        lastOperatorId = Operator.UNBOUND;
        remainingMinutes = 0.0;
        downUntilMinute = 0.0;
        followUpMaintenanceMinutes = 0.0;
    }

    public int id() {
        return id;
    }

    public PriorityClass priority() {
        return priority;
    }

    public MachineStatus status() {
        return status;
    }

    public int operatorId() {
        return operatorId;
    }

    public int lastOperatorId() {
        return lastOperatorId;
    }

    public double remainingMinutes() {
        return remainingMinutes;
    }

    public double downUntilMinute() {
        return downUntilMinute;
    }

    /**
     * Starts a unit with the given operator.
     */
    public void assign(int operatorId, double processMinutes) {
        if (!status.isAssignable()) {
            throw new IllegalStateException("Machine " + id + " cannot take an operator while " + status);
        }
        this.operatorId = operatorId;
        this.lastOperatorId = operatorId;
        this.remainingMinutes = processMinutes;
        this.status = MachineStatus.BUSY;
    }

    public void work(double minutes) {
        if (status == MachineStatus.BUSY) {
            remainingMinutes -= minutes;
        }
    }

    public boolean isUnitComplete(double tolerance) {
        return status == MachineStatus.BUSY && remainingMinutes <= tolerance;
    }

    /**
     * Unbinds the operator and returns the machine to IDLE.
     *
     * @return the released operator id
     */
    public int release() {
        int released = detachOperator();
        status = MachineStatus.IDLE;
        return released;
    }

    /**
     * Forces the machine to BROKEN, releasing any bound operator. Once the repair
     * is over the machine spends {@code followUpMaintenance} minutes in MAINTENANCE.
     *
     * @param followUpMaintenance must be positive; every repair ends in MAINTENANCE
     * @return the released operator id, or {@link Operator#UNBOUND}
     */
    public int breakDown(double nowMinute, double repairMinutes, double followUpMaintenance) {
        if (followUpMaintenance <= 0.0) {
            throw new IllegalArgumentException("Follow-up maintenance must be positive: " + followUpMaintenance);
        }
        int released = detachOperator();
        status = MachineStatus.BROKEN;
        downUntilMinute = nowMinute + repairMinutes;
        followUpMaintenanceMinutes = followUpMaintenance;
        return released;
    }

    /**
     * Forces the machine to MAINTENANCE, releasing any bound operator.
     *
     * @return the released operator id, or {@link Operator#UNBOUND}
     */
    public int startMaintenance(double nowMinute, double maintenanceMinutes) {
        int released = detachOperator();
        status = MachineStatus.MAINTENANCE;
        downUntilMinute = nowMinute + maintenanceMinutes;
        followUpMaintenanceMinutes = 0.0;
        return released;
    }

    /**
     * Moves a down machine along BROKEN -> MAINTENANCE -> IDLE once its
     * current downtime has elapsed.
     *
     * @return true if the status changed
     */
    public boolean advanceDowntime(double nowMinute, double tolerance) {
        if (!status.isDown() || nowMinute + tolerance < downUntilMinute) {
            return false;
        }
        if (status == MachineStatus.BROKEN) {
            status = MachineStatus.MAINTENANCE;
            downUntilMinute = downUntilMinute + followUpMaintenanceMinutes;
            followUpMaintenanceMinutes = 0.0;
        } else {
            status = MachineStatus.IDLE;
            followUpMaintenanceMinutes = 0.0;
        }
        return true;
    }

    private int detachOperator() {
        int released = operatorId;
        operatorId = Operator.UNBOUND;
        remainingMinutes = 0.0;
        return released;
    }
}
