package com.floorpilot.simulation.model;

/**
 * Single source of simulated time for one episode (one working day).
 *
 * Elapsed time only moves forward and never passes the day length.
 */
public class ShiftClock {

    private final double dayLengthMinutes;
    private final int shiftCount;
    private final double shiftLengthMinutes;
    private double elapsedMinutes;

    public ShiftClock(double dayLengthMinutes, int shiftCount) {
        if (dayLengthMinutes <= 0 || shiftCount <= 0) {
            throw new IllegalArgumentException("Day length and shift count must be positive");
        }
        this.dayLengthMinutes = dayLengthMinutes;
        this.shiftCount = shiftCount;
        this.shiftLengthMinutes = dayLengthMinutes / shiftCount;
    }

    public void reset() {
        elapsedMinutes = 0.0;
    }

    /**
     * Moves the clock forward, stopping at the end of the day.
     *
     * @return the minutes actually advanced
     */
    public double advance(double minutes) {
        if (minutes < 0 || Double.isNaN(minutes)) {
            throw new IllegalArgumentException("Clock cannot move backwards: " + minutes);
        }
        double advanced = Math.min(minutes, remainingMinutes());
        elapsedMinutes += advanced;
        return advanced;
    }

    public double elapsedMinutes() {
        return elapsedMinutes;
    }

    public double remainingMinutes() {
        return Math.max(0.0, dayLengthMinutes - elapsedMinutes);
    }

    public double dayLengthMinutes() {
        return dayLengthMinutes;
    }

    public int shiftCount() {
        return shiftCount;
    }

    public boolean isEndOfDay() {
        return elapsedMinutes >= dayLengthMinutes;
    }

    /**
     * Shift the current minute belongs to; the last shift also owns the
     * final instant of the day.
     */
    public int shiftIndex() {
        return shiftAt(elapsedMinutes);
    }

    public int shiftAt(double minute) {
        int index = (int) Math.floor(minute / shiftLengthMinutes);
        return Math.max(0, Math.min(index, shiftCount - 1));
    }

    /**
     * Shift that contains the last moment of an interval ending at {@code minute},
     * so work that stops exactly on a shift boundary belongs to the earlier shift.
     */
    public int shiftEndingAt(double minute) {
        int index = (int) Math.ceil(minute / shiftLengthMinutes) - 1;
        return Math.max(0, Math.min(index, shiftCount - 1));
    }

    /**
     * Splits the interval [from, to) into minutes per shift.
     */
    public double[] minutesPerShift(double from, double to) {
        double[] perShift = new double[shiftCount];
        for (int shift = 0; shift < shiftCount; shift++) {
            double start = shift * shiftLengthMinutes;
            double end = shift == shiftCount - 1 ? Double.POSITIVE_INFINITY : (shift + 1) * shiftLengthMinutes;
            perShift[shift] = Math.max(0.0, Math.min(to, end) - Math.max(from, start));
        }
        return perShift;
    }
}
