package com.floorpilot.training.config;

import com.floorpilot.shared.config.RewardWeights;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * Externalized settings bound from {@code floorpilot.*}.
 *
 * With {@code scenario: demo} the floor comes from the built-in demo factory and
 * only {@code rewards} is applied on top; {@code scenario: custom} builds the
 * floor entirely from {@code factory}.
 */
@ConfigurationProperties(prefix = "floorpilot")
public class FloorPilotProperties {

    private String scenario = "demo";
    private Factory factory = new Factory();
    private Rewards rewards = new Rewards();
    private Learning learning = new Learning();
    private Run run = new Run();

    public String getScenario() { return scenario; }
    public void setScenario(String scenario) { this.scenario = scenario; }
    public Factory getFactory() { return factory; }
    public void setFactory(Factory factory) { this.factory = factory; }
    public Rewards getRewards() { return rewards; }
    public void setRewards(Rewards rewards) { this.rewards = rewards; }
    public Learning getLearning() { return learning; }
    public void setLearning(Learning learning) { this.learning = learning; }
    public Run getRun() { return run; }
    public void setRun(Run run) { this.run = run; }

    public static class Factory {
        private int machineCount;
        private int operatorCount;
        private List<String> machineTypes;
        private List<Integer> machinePriorities;
        private List<List<Double>> skillMatrix;
        private double dayLengthMinutes;
        private int shiftCount = 1;
        private List<List<Double>> operatorShiftCapacityMinutes;
        private List<Double> baseProcessTimes;
        private List<Double> minProcessTimes;
        private Downtime breakdown = new Downtime();
        private Downtime maintenance = new Downtime();
        private double defectBaseProbability = 0.5;
        private double fatigueThresholdRatio = 0.8;
        private double idleTickMinutes = 1.0;
        private int dailyTarget;

        public int getMachineCount() { return machineCount; }
        public void setMachineCount(int machineCount) { this.machineCount = machineCount; }
        public int getOperatorCount() { return operatorCount; }
        public void setOperatorCount(int operatorCount) { this.operatorCount = operatorCount; }
        public List<String> getMachineTypes() { return machineTypes; }
        public void setMachineTypes(List<String> machineTypes) { this.machineTypes = machineTypes; }
        public List<Integer> getMachinePriorities() { return machinePriorities; }
        public void setMachinePriorities(List<Integer> machinePriorities) { this.machinePriorities = machinePriorities; }
        public List<List<Double>> getSkillMatrix() { return skillMatrix; }
        public void setSkillMatrix(List<List<Double>> skillMatrix) { this.skillMatrix = skillMatrix; }
        public double getDayLengthMinutes() { return dayLengthMinutes; }
        public void setDayLengthMinutes(double dayLengthMinutes) { this.dayLengthMinutes = dayLengthMinutes; }
        public int getShiftCount() { return shiftCount; }
        public void setShiftCount(int shiftCount) { this.shiftCount = shiftCount; }
        public List<List<Double>> getOperatorShiftCapacityMinutes() { return operatorShiftCapacityMinutes; }
        public void setOperatorShiftCapacityMinutes(List<List<Double>> capacities) { this.operatorShiftCapacityMinutes = capacities; }
        public List<Double> getBaseProcessTimes() { return baseProcessTimes; }
        public void setBaseProcessTimes(List<Double> baseProcessTimes) { this.baseProcessTimes = baseProcessTimes; }
        public List<Double> getMinProcessTimes() { return minProcessTimes; }
        public void setMinProcessTimes(List<Double> minProcessTimes) { this.minProcessTimes = minProcessTimes; }
        public Downtime getBreakdown() { return breakdown; }
        public void setBreakdown(Downtime breakdown) { this.breakdown = breakdown; }
        public Downtime getMaintenance() { return maintenance; }
        public void setMaintenance(Downtime maintenance) { this.maintenance = maintenance; }
        public double getDefectBaseProbability() { return defectBaseProbability; }
        public void setDefectBaseProbability(double p) { this.defectBaseProbability = p; }
        public double getFatigueThresholdRatio() { return fatigueThresholdRatio; }
        public void setFatigueThresholdRatio(double ratio) { this.fatigueThresholdRatio = ratio; }
        public double getIdleTickMinutes() { return idleTickMinutes; }
        public void setIdleTickMinutes(double idleTickMinutes) { this.idleTickMinutes = idleTickMinutes; }
        public int getDailyTarget() { return dailyTarget; }
        public void setDailyTarget(int dailyTarget) { this.dailyTarget = dailyTarget; }
    }

    public static class Downtime {
        private double probability;
        private double minMinutes;
        private double maxMinutes;

        public double getProbability() { return probability; }
        public void setProbability(double probability) { this.probability = probability; }
        public double getMinMinutes() { return minMinutes; }
        public void setMinMinutes(double minMinutes) { this.minMinutes = minMinutes; }
        public double getMaxMinutes() { return maxMinutes; }
        public void setMaxMinutes(double maxMinutes) { this.maxMinutes = maxMinutes; }
    }

    public static class Rewards {
        private static final RewardWeights DEFAULTS = RewardWeights.defaults();
        private double goodPart = DEFAULTS.goodPart();
        private double highSkillBonus = DEFAULTS.highSkillBonus();
        private double assignmentBonus = DEFAULTS.assignmentBonus();
        private double idlePenalty = DEFAULTS.idlePenalty();
        private double defectPenalty = DEFAULTS.defectPenalty();
        private double illegalPenalty = DEFAULTS.illegalPenalty();
        private double targetBonus = DEFAULTS.targetBonus();
        private double shortfallPenalty = DEFAULTS.shortfallPenalty();
        private double fatiguePenalty = DEFAULTS.fatiguePenalty();
        private double switchPenalty = DEFAULTS.switchPenalty();
        private double overCapacityPenalty = DEFAULTS.overCapacityPenalty();
        private double lowSkillPenalty = DEFAULTS.lowSkillPenalty();
        private double halfwayBonus = DEFAULTS.halfwayBonus();
        private double eightyPercentBonus = DEFAULTS.eightyPercentBonus();

        public RewardWeights toWeights() {
            return new RewardWeights(goodPart, highSkillBonus, assignmentBonus, idlePenalty, defectPenalty,
                illegalPenalty, targetBonus, shortfallPenalty, fatiguePenalty, switchPenalty,
                overCapacityPenalty, lowSkillPenalty, halfwayBonus, eightyPercentBonus);
        }

        public double getGoodPart() { return goodPart; }
        public void setGoodPart(double goodPart) { this.goodPart = goodPart; }
        public double getHighSkillBonus() { return highSkillBonus; }
        public void setHighSkillBonus(double highSkillBonus) { this.highSkillBonus = highSkillBonus; }
        public double getAssignmentBonus() { return assignmentBonus; }
        public void setAssignmentBonus(double assignmentBonus) { this.assignmentBonus = assignmentBonus; }
        public double getIdlePenalty() { return idlePenalty; }
        public void setIdlePenalty(double idlePenalty) { this.idlePenalty = idlePenalty; }
        public double getDefectPenalty() { return defectPenalty; }
        public void setDefectPenalty(double defectPenalty) { this.defectPenalty = defectPenalty; }
        public double getIllegalPenalty() { return illegalPenalty; }
        public void setIllegalPenalty(double illegalPenalty) { this.illegalPenalty = illegalPenalty; }
        public double getTargetBonus() { return targetBonus; }
        public void setTargetBonus(double targetBonus) { this.targetBonus = targetBonus; }
        public double getShortfallPenalty() { return shortfallPenalty; }
        public void setShortfallPenalty(double shortfallPenalty) { this.shortfallPenalty = shortfallPenalty; }
        public double getFatiguePenalty() { return fatiguePenalty; }
        public void setFatiguePenalty(double fatiguePenalty) { this.fatiguePenalty = fatiguePenalty; }
        public double getSwitchPenalty() { return switchPenalty; }
        public void setSwitchPenalty(double switchPenalty) { this.switchPenalty = switchPenalty; }
        public double getOverCapacityPenalty() { return overCapacityPenalty; }
        public void setOverCapacityPenalty(double overCapacityPenalty) { this.overCapacityPenalty = overCapacityPenalty; }
        public double getLowSkillPenalty() { return lowSkillPenalty; }
        public void setLowSkillPenalty(double lowSkillPenalty) { this.lowSkillPenalty = lowSkillPenalty; }
        public double getHalfwayBonus() { return halfwayBonus; }
        public void setHalfwayBonus(double halfwayBonus) { this.halfwayBonus = halfwayBonus; }
        public double getEightyPercentBonus() { return eightyPercentBonus; }
        public void setEightyPercentBonus(double eightyPercentBonus) { this.eightyPercentBonus = eightyPercentBonus; }
    }

    public static class Learning {
        private double discount = 0.99;
        private String explorationDecay = "two-phase";
        private double epsilonStart = 1.0;
        private double epsilonFloor = 0.05;
        private double alphaStart = 0.1;
        private double alphaFloor = 0.01;
        /** Episodes over which epsilon and alpha decay; defaults to episodes - 1. */
        private Integer decayEpisodes;

        public double getDiscount() { return discount; }
        public void setDiscount(double discount) { this.discount = discount; }
        public String getExplorationDecay() { return explorationDecay; }
        public void setExplorationDecay(String explorationDecay) { this.explorationDecay = explorationDecay; }
        public double getEpsilonStart() { return epsilonStart; }
        public void setEpsilonStart(double epsilonStart) { this.epsilonStart = epsilonStart; }
        public double getEpsilonFloor() { return epsilonFloor; }
        public void setEpsilonFloor(double epsilonFloor) { this.epsilonFloor = epsilonFloor; }
        public double getAlphaStart() { return alphaStart; }
        public void setAlphaStart(double alphaStart) { this.alphaStart = alphaStart; }
        public double getAlphaFloor() { return alphaFloor; }
        public void setAlphaFloor(double alphaFloor) { this.alphaFloor = alphaFloor; }
        public Integer getDecayEpisodes() { return decayEpisodes; }
        public void setDecayEpisodes(Integer decayEpisodes) { this.decayEpisodes = decayEpisodes; }
    }

    public static class Run {
        /** train, evaluate, test or none. */
        private String mode = "train";
        private int episodes = 10000;
        private int evaluationEpisodes = 100;
        private long trainingSeed = 42;
        private long evaluationSeed = 123;
        private long agentSeed = 7;
        private int logEvery = 100;
        private int recordEvery = 100;
        private int maxStepsPerEpisode = 10000;
        private int movingAverageWindow = 200;
        private String tablePath = "q_table.json";
        private String outputDir = "outputs";

        public String getMode() { return mode; }
        public void setMode(String mode) { this.mode = mode; }
        public int getEpisodes() { return episodes; }
        public void setEpisodes(int episodes) { this.episodes = episodes; }
        public int getEvaluationEpisodes() { return evaluationEpisodes; }
        public void setEvaluationEpisodes(int evaluationEpisodes) { this.evaluationEpisodes = evaluationEpisodes; }
        public long getTrainingSeed() { return trainingSeed; }
        public void setTrainingSeed(long trainingSeed) { this.trainingSeed = trainingSeed; }
        public long getEvaluationSeed() { return evaluationSeed; }
        public void setEvaluationSeed(long evaluationSeed) { this.evaluationSeed = evaluationSeed; }
        public long getAgentSeed() { return agentSeed; }
        public void setAgentSeed(long agentSeed) { this.agentSeed = agentSeed; }
        public int getLogEvery() { return logEvery; }
        public void setLogEvery(int logEvery) { this.logEvery = logEvery; }
        public int getRecordEvery() { return recordEvery; }
        public void setRecordEvery(int recordEvery) { this.recordEvery = recordEvery; }
        public int getMaxStepsPerEpisode() { return maxStepsPerEpisode; }
        public void setMaxStepsPerEpisode(int maxStepsPerEpisode) { this.maxStepsPerEpisode = maxStepsPerEpisode; }
        public int getMovingAverageWindow() { return movingAverageWindow; }
        public void setMovingAverageWindow(int movingAverageWindow) { this.movingAverageWindow = movingAverageWindow; }
        public String getTablePath() { return tablePath; }
        public void setTablePath(String tablePath) { this.tablePath = tablePath; }
        public String getOutputDir() { return outputDir; }
        public void setOutputDir(String outputDir) { this.outputDir = outputDir; }
    }
}
