package com.floorpilot.training.config;

import com.floorpilot.agent.schedule.DecaySchedule;
import com.floorpilot.agent.schedule.LearningSchedule;
import com.floorpilot.agent.schedule.LinearDecaySchedule;
import com.floorpilot.agent.schedule.TwoPhaseDecaySchedule;
import com.floorpilot.shared.config.DemoScenarios;
import com.floorpilot.shared.config.DowntimeModel;
import com.floorpilot.shared.config.FactoryConfig;
import com.floorpilot.shared.config.InvalidConfigurationException;
import com.floorpilot.shared.util.MetricsCollector;
import com.floorpilot.shared.util.StatisticsReducer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
@EnableConfigurationProperties(FloorPilotProperties.class)
public class SimulationConfig {

    private static final Logger log = LoggerFactory.getLogger(SimulationConfig.class);

    @Bean
    public FactoryConfig factoryConfig(FloorPilotProperties properties) {
        FactoryConfig.Builder builder;
        String scenario = properties.getScenario() == null ? "demo" : properties.getScenario().trim().toLowerCase();
        switch (scenario) {
            case "demo" -> builder = DemoScenarios.demoFactory().toBuilder();
            case "custom" -> builder = customFloor(properties.getFactory());
            default -> throw new InvalidConfigurationException("Unknown scenario: " + properties.getScenario());
        }
        FactoryConfig config = builder.rewardWeights(properties.getRewards().toWeights()).build();
        log.info("Factory floor '{}': {} machines, {} operators, {} shifts, target {}",
            scenario, config.machineCount(), config.operatorCount(), config.shiftCount(), config.dailyTarget());
        return config;
    }

    @Bean
    public LearningSchedule learningSchedule(FloorPilotProperties properties) {
        FloorPilotProperties.Learning learning = properties.getLearning();
        int horizon = learning.getDecayEpisodes() != null
            ? learning.getDecayEpisodes()
            : Math.max(1, properties.getRun().getEpisodes() - 1);

        DecaySchedule exploration;
        String decay = learning.getExplorationDecay() == null ? "two-phase" : learning.getExplorationDecay();
        switch (decay) {
            case "two-phase" -> exploration =
                new TwoPhaseDecaySchedule(learning.getEpsilonStart(), learning.getEpsilonFloor(), horizon);
            case "linear" -> exploration =
                new LinearDecaySchedule(learning.getEpsilonStart(), learning.getEpsilonFloor(), horizon);
            case "constant" -> exploration = DecaySchedule.constant(learning.getEpsilonStart());
            default -> throw new InvalidConfigurationException("Unknown exploration decay: " + decay);
        }
        DecaySchedule learningRate =
            new LinearDecaySchedule(learning.getAlphaStart(), learning.getAlphaFloor(), horizon);
        return new LearningSchedule(learning.getDiscount(), exploration, learningRate);
    }

    @Bean
    public MetricsCollector metricsCollector() {
        return new MetricsCollector();
    }

    @Bean
    public StatisticsReducer statisticsReducer() {
        return new StatisticsReducer();
    }

    static FactoryConfig.Builder customFloor(FloorPilotProperties.Factory factory) {
        FactoryConfig.Builder builder = FactoryConfig.builder()
            .machineCount(factory.getMachineCount())
            .operatorCount(factory.getOperatorCount())
            .dayLengthMinutes(factory.getDayLengthMinutes())
            .shiftCount(factory.getShiftCount())
            .defectBaseProbability(factory.getDefectBaseProbability())
            .fatigueThresholdRatio(factory.getFatigueThresholdRatio())
            .idleTickMinutes(factory.getIdleTickMinutes())
            .dailyTarget(factory.getDailyTarget())
            .breakdown(toDowntime(factory.getBreakdown()))
            .maintenance(toDowntime(factory.getMaintenance()));
        if (factory.getMachineTypes() != null) {
            builder.machineTypes(factory.getMachineTypes());
        }
        if (factory.getMachinePriorities() != null) {
            builder.machinePriorities(factory.getMachinePriorities().stream().mapToInt(Integer::intValue).toArray());
        }
        if (factory.getSkillMatrix() != null) {
            builder.skillMatrix(toMatrix(factory.getSkillMatrix()));
        }
        if (factory.getOperatorShiftCapacityMinutes() != null) {
            builder.operatorShiftCapacityMinutes(toMatrix(factory.getOperatorShiftCapacityMinutes()));
        }
        if (factory.getBaseProcessTimes() != null) {
            builder.baseProcessTimes(toArray(factory.getBaseProcessTimes()));
        }
        if (factory.getMinProcessTimes() != null) {
            builder.minProcessTimes(toArray(factory.getMinProcessTimes()));
        }
        return builder;
    }

    private static DowntimeModel toDowntime(FloorPilotProperties.Downtime downtime) {
        if (downtime == null || downtime.getProbability() == 0.0) {
            return DowntimeModel.never();
        }
        return new DowntimeModel(downtime.getProbability(), downtime.getMinMinutes(), downtime.getMaxMinutes());
    }

    private static double[][] toMatrix(List<List<Double>> rows) {
        double[][] matrix = new double[rows.size()][];
        for (int i = 0; i < rows.size(); i++) {
            matrix[i] = toArray(rows.get(i));
        }
        return matrix;
    }

    private static double[] toArray(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).toArray();
    }
}
