package com.floorpilot.simulation.model;

import java.util.Arrays;

/**
 * A floor operator. Bound to at most one machine at a time; accumulates
 * busy minutes per shift, which the per-shift capacity limit is checked against.
 */
public class Operator {

    public static final int UNBOUND = -1;

    private final int id;
    private final double[] busyMinutesPerShift;
    private int machineId = UNBOUND;

    public Operator(int id, int shiftCount) {
        this.id = id;
        this.busyMinutesPerShift = new double[shiftCount];
    }

    public void reset() {
        machineId = UNBOUND;
        Arrays.fill(busyMinutesPerShift, 0.0);
    }

    public int id() {
        return id;
    }

    public boolean isFree() {
        return machineId == UNBOUND;
    }

    public int machineId() {
        return machineId;
    }

    public void bind(int machineId) {
        if (!isFree()) {
            throw new IllegalStateException("Operator " + id + " is already bound to machine " + this.machineId);
        }
        this.machineId = machineId;
    }

    public void release() {
        machineId = UNBOUND;
    }

    public void addBusyMinutes(double[] minutesPerShift) {
        for (int shift = 0; shift < busyMinutesPerShift.length; shift++) {
            busyMinutesPerShift[shift] += minutesPerShift[shift];
        }
    }

    public double busyMinutes(int shiftIndex) {
        return busyMinutesPerShift[shiftIndex];
    }
}
