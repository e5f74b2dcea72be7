package com.floorpilot.shared.config;

import com.floorpilot.shared.model.PriorityClass;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Static description of a simulated factory floor.
 *
 * Instances are immutable and fully validated: {@link Builder#build()} throws
 * {@link InvalidConfigurationException} for any combination that would leave
 * the simulation undefined (no machines, skills outside [0,1], negative
 * capacities and so on). Machine {@code i} runs machine type
 * {@code i % machineTypes().size()}; skills and process times are indexed by
 * machine type.
 */
public final class FactoryConfig {

    /** The decision state packs operator availability into an int. */
    public static final int MAX_OPERATORS = 31;

    private final int machineCount;
    private final int operatorCount;
    private final List<String> machineTypes;
    private final int[] machinePriorities;
    private final double[][] skillMatrix;
    private final double dayLengthMinutes;
    private final int shiftCount;
    private final double[][] operatorShiftCapacityMinutes;
    private final double[] baseProcessTimes;
    private final double[] minProcessTimes;
    private final DowntimeModel breakdown;
    private final DowntimeModel maintenance;
    private final double defectBaseProbability;
    private final double fatigueThresholdRatio;
    private final double idleTickMinutes;
    private final int dailyTarget;
    private final RewardWeights rewardWeights;
    private final BucketThresholds bucketThresholds;

    private FactoryConfig(Builder builder) {
        this.machineCount = builder.machineCount;
        this.operatorCount = builder.operatorCount;
        this.machineTypes = List.copyOf(builder.machineTypes);
        this.machinePriorities = builder.machinePriorities.clone();
        this.skillMatrix = deepCopy(builder.skillMatrix);
        this.dayLengthMinutes = builder.dayLengthMinutes;
        this.shiftCount = builder.shiftCount;
        this.operatorShiftCapacityMinutes = deepCopy(builder.operatorShiftCapacityMinutes);
        this.baseProcessTimes = builder.baseProcessTimes.clone();
        this.minProcessTimes = builder.minProcessTimes.clone();
        this.breakdown = builder.breakdown;
        this.maintenance = builder.maintenance;
        this.defectBaseProbability = builder.defectBaseProbability;
        this.fatigueThresholdRatio = builder.fatigueThresholdRatio;
        this.idleTickMinutes = builder.idleTickMinutes;
        this.dailyTarget = builder.dailyTarget;
        this.rewardWeights = builder.rewardWeights;
        this.bucketThresholds = builder.bucketThresholds;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder pre-filled with this configuration, for deriving variants.
     */
    public Builder toBuilder() {
        return new Builder()
            .machineCount(machineCount)
            .operatorCount(operatorCount)
            .machineTypes(machineTypes)
            .machinePriorities(machinePriorities.clone())
            .skillMatrix(deepCopy(skillMatrix))
            .dayLengthMinutes(dayLengthMinutes)
            .shiftCount(shiftCount)
            .operatorShiftCapacityMinutes(deepCopy(operatorShiftCapacityMinutes))
            .baseProcessTimes(baseProcessTimes.clone())
            .minProcessTimes(minProcessTimes.clone())
            .breakdown(breakdown)
            .maintenance(maintenance)
            .defectBaseProbability(defectBaseProbability)
            .fatigueThresholdRatio(fatigueThresholdRatio)
            .idleTickMinutes(idleTickMinutes)
            .dailyTarget(dailyTarget)
            .rewardWeights(rewardWeights)
            .bucketThresholds(bucketThresholds);
    }

    public int machineCount() {
        return machineCount;
    }

    public int operatorCount() {
        return operatorCount;
    }

    /**
     * Size of the static action space: one action per operator plus "leave idle".
     */
    public int actionCount() {
        return operatorCount + 1;
    }

    public List<String> machineTypes() {
        return machineTypes;
    }

    public int machineTypeIndex(int machineId) {
        return machineId % machineTypes.size();
    }

    public String machineTypeName(int machineId) {
        return machineTypes.get(machineTypeIndex(machineId));
    }

    public PriorityClass priority(int machineId) {
        return PriorityClass.fromLevel(machinePriorities[machineId]);
    }

    /**
     * Skill of an operator on the type of the given machine, in [0,1].
     */
    public double skill(int operatorId, int machineId) {
        return skillMatrix[operatorId][machineTypeIndex(machineId)];
    }

    public double dayLengthMinutes() {
        return dayLengthMinutes;
    }

    public int shiftCount() {
        return shiftCount;
    }

    public double shiftLengthMinutes() {
        return dayLengthMinutes / shiftCount;
    }

    public double capacityMinutes(int operatorId, int shiftIndex) {
        return operatorShiftCapacityMinutes[operatorId][shiftIndex];
    }

    /**
     * Minutes one unit takes on a machine for an operator. Higher skill shortens
     * the time down to the machine type's physical minimum.
     */
    public double processTimeMinutes(int operatorId, int machineId) {
        int type = machineTypeIndex(machineId);
        double raw = baseProcessTimes[type] / Math.max(skill(operatorId, machineId), 0.1);
        return Math.max(raw, minProcessTimes[type]);
    }

    /**
     * Probability that a finished unit is defective; decreases with skill.
     */
    public double defectProbability(int operatorId, int machineId) {
        return Math.max(0.0, defectBaseProbability - skill(operatorId, machineId));
    }

    public DowntimeModel breakdown() {
        return breakdown;
    }

    public DowntimeModel maintenance() {
        return maintenance;
    }

    public double fatigueThresholdRatio() {
        return fatigueThresholdRatio;
    }

    public double idleTickMinutes() {
        return idleTickMinutes;
    }

    public int dailyTarget() {
        return dailyTarget;
    }

    public RewardWeights rewardWeights() {
        return rewardWeights;
    }

    public BucketThresholds bucketThresholds() {
        return bucketThresholds;
    }

    private static double[][] deepCopy(double[][] source) {
        double[][] copy = new double[source.length][];
        for (int i = 0; i < source.length; i++) {
            copy[i] = source[i].clone();
        }
        return copy;
    }

    public static final class Builder {
        private int machineCount;
        private int operatorCount;
        private List<String> machineTypes;
        private int[] machinePriorities;
        private double[][] skillMatrix;
        private double dayLengthMinutes;
        private int shiftCount = 1;
        private double[][] operatorShiftCapacityMinutes;
        private double[] baseProcessTimes;
        private double[] minProcessTimes;
        private DowntimeModel breakdown = DowntimeModel.never();
        private DowntimeModel maintenance = DowntimeModel.never();
        private double defectBaseProbability = 0.5;
        private double fatigueThresholdRatio = 0.8;
        private double idleTickMinutes = 1.0;
        private int dailyTarget;
        private RewardWeights rewardWeights = RewardWeights.defaults();
        private BucketThresholds bucketThresholds = BucketThresholds.defaults();

        private Builder() {
        }

        public Builder machineCount(int machineCount) {
            this.machineCount = machineCount;
            return this;
        }

        public Builder operatorCount(int operatorCount) {
            this.operatorCount = operatorCount;
            return this;
        }

        public Builder machineTypes(List<String> machineTypes) {
            this.machineTypes = machineTypes == null ? null : new ArrayList<>(machineTypes);
            return this;
        }

        public Builder machinePriorities(int... machinePriorities) {
            this.machinePriorities = machinePriorities;
            return this;
        }

        public Builder skillMatrix(double[][] skillMatrix) {
            this.skillMatrix = skillMatrix;
            return this;
        }

        public Builder dayLengthMinutes(double dayLengthMinutes) {
            this.dayLengthMinutes = dayLengthMinutes;
            return this;
        }

        public Builder shiftCount(int shiftCount) {
            this.shiftCount = shiftCount;
            return this;
        }

        public Builder operatorShiftCapacityMinutes(double[][] capacities) {
            this.operatorShiftCapacityMinutes = capacities;
            return this;
        }

        public Builder baseProcessTimes(double... baseProcessTimes) {
            this.baseProcessTimes = baseProcessTimes;
            return this;
        }

        public Builder minProcessTimes(double... minProcessTimes) {
            this.minProcessTimes = minProcessTimes;
            return this;
        }

        public Builder breakdown(DowntimeModel breakdown) {
            this.breakdown = breakdown;
            return this;
        }

        public Builder maintenance(DowntimeModel maintenance) {
            this.maintenance = maintenance;
            return this;
        }

        public Builder defectBaseProbability(double defectBaseProbability) {
            this.defectBaseProbability = defectBaseProbability;
            return this;
        }

        public Builder fatigueThresholdRatio(double fatigueThresholdRatio) {
            this.fatigueThresholdRatio = fatigueThresholdRatio;
            return this;
        }

        public Builder idleTickMinutes(double idleTickMinutes) {
            this.idleTickMinutes = idleTickMinutes;
            return this;
        }

        public Builder dailyTarget(int dailyTarget) {
            this.dailyTarget = dailyTarget;
            return this;
        }

        public Builder rewardWeights(RewardWeights rewardWeights) {
            this.rewardWeights = rewardWeights;
            return this;
        }

        public Builder bucketThresholds(BucketThresholds bucketThresholds) {
            this.bucketThresholds = bucketThresholds;
            return this;
        }

        public FactoryConfig build() {
            if (machineCount <= 0) {
                throw new InvalidConfigurationException("machineCount must be positive: " + machineCount);
            }
            if (operatorCount <= 0 || operatorCount > MAX_OPERATORS) {
                throw new InvalidConfigurationException(
                    "operatorCount must be in [1, " + MAX_OPERATORS + "]: " + operatorCount);
            }
            if (dayLengthMinutes <= 0 || Double.isNaN(dayLengthMinutes)) {
                throw new InvalidConfigurationException("dayLengthMinutes must be positive: " + dayLengthMinutes);
            }
            if (shiftCount <= 0) {
                throw new InvalidConfigurationException("shiftCount must be positive: " + shiftCount);
            }
            if (dailyTarget <= 0) {
                throw new InvalidConfigurationException("dailyTarget must be positive: " + dailyTarget);
            }
            if (machineTypes == null) {
                machineTypes = new ArrayList<>();
                for (int i = 0; i < machineCount; i++) {
                    machineTypes.add("machine-" + i);
                }
            }
            if (machineTypes.isEmpty()) {
                throw new InvalidConfigurationException("At least one machine type is required");
            }
            int typeCount = machineTypes.size();

            if (machinePriorities == null) {
                machinePriorities = new int[machineCount];
            }
            if (machinePriorities.length != machineCount) {
                throw new InvalidConfigurationException("machinePriorities needs one entry per machine");
            }
            for (int priority : machinePriorities) {
                if (priority < PriorityClass.LOW.level() || priority > PriorityClass.HIGH.level()) {
                    throw new InvalidConfigurationException("Machine priority out of range: " + priority);
                }
            }

            requireMatrix("skillMatrix", skillMatrix, operatorCount, typeCount);
            for (double[] row : skillMatrix) {
                for (double skill : row) {
                    if (!(skill >= 0.0 && skill <= 1.0)) {
                        throw new InvalidConfigurationException("Skill values must be in [0,1]: " + skill);
                    }
                }
            }

            if (operatorShiftCapacityMinutes == null) {
                operatorShiftCapacityMinutes = new double[operatorCount][shiftCount];
                for (double[] row : operatorShiftCapacityMinutes) {
                    Arrays.fill(row, dayLengthMinutes / shiftCount);
                }
            }
            requireMatrix("operatorShiftCapacityMinutes", operatorShiftCapacityMinutes, operatorCount, shiftCount);
            for (double[] row : operatorShiftCapacityMinutes) {
                for (double capacity : row) {
                    if (capacity < 0 || Double.isNaN(capacity)) {
                        throw new InvalidConfigurationException("Operator capacity must be non-negative: " + capacity);
                    }
                }
            }

            if (baseProcessTimes == null || baseProcessTimes.length != typeCount) {
                throw new InvalidConfigurationException("baseProcessTimes needs one entry per machine type");
            }
            if (minProcessTimes == null) {
                minProcessTimes = baseProcessTimes.clone();
            }
            if (minProcessTimes.length != typeCount) {
                throw new InvalidConfigurationException("minProcessTimes needs one entry per machine type");
            }
            for (int i = 0; i < typeCount; i++) {
                if (baseProcessTimes[i] <= 0 || minProcessTimes[i] <= 0) {
                    throw new InvalidConfigurationException("Process times must be positive for type "
                        + machineTypes.get(i));
                }
            }

            if (breakdown == null || maintenance == null) {
                throw new InvalidConfigurationException("Downtime models are required");
            }
            if (defectBaseProbability < 0.0 || defectBaseProbability > 1.0) {
                throw new InvalidConfigurationException(
                    "defectBaseProbability must be in [0,1]: " + defectBaseProbability);
            }
            if (fatigueThresholdRatio <= 0.0 || fatigueThresholdRatio >= 1.0) {
                throw new InvalidConfigurationException(
                    "fatigueThresholdRatio must be in (0,1): " + fatigueThresholdRatio);
            }
            if (idleTickMinutes <= 0) {
                throw new InvalidConfigurationException("idleTickMinutes must be positive: " + idleTickMinutes);
            }
            if (rewardWeights == null || bucketThresholds == null) {
                throw new InvalidConfigurationException("Reward weights and bucket thresholds are required");
            }
            return new FactoryConfig(this);
        }

        private static void requireMatrix(String name, double[][] matrix, int rows, int columns) {
            if (matrix == null || matrix.length != rows) {
                throw new InvalidConfigurationException(name + " must have " + rows + " rows");
            }
            for (double[] row : matrix) {
                if (row == null || row.length != columns) {
                    throw new InvalidConfigurationException(name + " rows must have " + columns + " columns");
                }
            }
        }
    }
}
