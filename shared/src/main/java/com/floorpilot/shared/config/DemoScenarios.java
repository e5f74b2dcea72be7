package com.floorpilot.shared.config;

import java.util.List;

/**
 * Ready-made floor configurations.
 */
public final class DemoScenarios {

    private DemoScenarios() {
        // Utility class - prevent instantiation
    }

    /**
     * Four machines (press, lathe, welding, packing), six operators with
     * uneven skills and three 8-hour shifts. Daily target of 90 good parts.
     */
    public static FactoryConfig demoFactory() {
        double shiftLength = 480.0;
        int shifts = 3;
        return FactoryConfig.builder()
            .machineCount(4)
            .operatorCount(6)
            .machineTypes(List.of("press", "lathe", "welding", "packing"))
            .machinePriorities(1, 2, 1, 0)
            .skillMatrix(new double[][] {
                {0.95, 0.35, 0.15, 0.20},
                {0.25, 0.90, 0.65, 0.55},
                {0.55, 0.30, 0.95, 0.85},
                {0.45, 0.50, 0.48, 0.52},
                {0.70, 0.65, 0.55, 0.92},
                {0.88, 0.58, 0.42, 0.68},
            })
            .dayLengthMinutes(shifts * shiftLength)
            .shiftCount(shifts)
            .operatorShiftCapacityMinutes(new double[][] {
                {480, 460, 480},
                {460, 480, 460},
                {440, 420, 440},
                {460, 460, 460},
                {480, 440, 480},
                {470, 450, 470},
            })
            .baseProcessTimes(6.0, 7.0, 9.0, 5.0)
            .minProcessTimes(10.0, 45.0, 75.0, 25.0)
            .breakdown(new DowntimeModel(0.02, 60.0, 2 * shiftLength))
            .maintenance(new DowntimeModel(0.01, 30.0, 2 * shiftLength))
            .defectBaseProbability(0.5)
            .fatigueThresholdRatio(0.8)
            .idleTickMinutes(1.0)
            .dailyTarget(90)
            .build();
    }

    /**
     * One machine, one operator, no breakdowns and a single shift. A unit takes
     * exactly {@code processMinutes} when the operator's skill is 1.0.
     */
    public static FactoryConfig singleStation(double skill, double dayLengthMinutes,
                                              double processMinutes, int dailyTarget) {
        return FactoryConfig.builder()
            .machineCount(1)
            .operatorCount(1)
            .machineTypes(List.of("station"))
            .machinePriorities(2)
            .skillMatrix(new double[][] {{skill}})
            .dayLengthMinutes(dayLengthMinutes)
            .shiftCount(1)
            .operatorShiftCapacityMinutes(new double[][] {{dayLengthMinutes}})
            .baseProcessTimes(processMinutes)
            .minProcessTimes(processMinutes)
            .dailyTarget(dailyTarget)
            .build();
    }
}
