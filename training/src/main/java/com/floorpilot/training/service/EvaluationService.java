package com.floorpilot.training.service;

import com.floorpilot.agent.QLearningAgent;
import com.floorpilot.agent.schedule.LearningSchedule;
import com.floorpilot.shared.config.FactoryConfig;
import com.floorpilot.shared.util.StatisticsReducer;
import com.floorpilot.simulation.model.DecisionState;
import com.floorpilot.simulation.service.FactoryEnvironment;
import com.floorpilot.training.config.FloorPilotProperties;
import com.floorpilot.training.model.EpisodeResult;
import com.floorpilot.training.model.EvaluationReport;
import com.floorpilot.training.model.PerformanceBand;
import com.floorpilot.training.persistence.TimelineExporter;
import com.floorpilot.training.persistence.ValueTableStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.ToDoubleFunction;

/**
 * Runs a trained policy greedily and summarizes how it performs.
 */
@Service
public class EvaluationService {

    private static final Logger log = LoggerFactory.getLogger(EvaluationService.class);

    private final FactoryConfig factoryConfig;
    private final LearningSchedule learningSchedule;
    private final FloorPilotProperties.Run run;
    private final EpisodeRunner episodeRunner;
    private final ValueTableStore tableStore;
    private final TimelineExporter timelineExporter;
    private final StatisticsReducer statistics;

    public EvaluationService(FactoryConfig factoryConfig, LearningSchedule learningSchedule,
                             FloorPilotProperties properties, EpisodeRunner episodeRunner,
                             ValueTableStore tableStore, TimelineExporter timelineExporter,
                             StatisticsReducer statistics) {
        this.factoryConfig = factoryConfig;
        this.learningSchedule = learningSchedule;
        this.run = properties.getRun();
        this.episodeRunner = episodeRunner;
        this.tableStore = tableStore;
        this.timelineExporter = timelineExporter;
        this.statistics = statistics;
    }

    /**
     * Loads the stored table and evaluates it on the evaluation seed.
     *
     * @return empty when no table has been trained yet
     */
    public Optional<EvaluationReport> evaluateStored(boolean exportTimeline) {
        Path tablePath = Path.of(run.getTablePath());
        Optional<Map<DecisionState, double[]>> stored = tableStore.load(tablePath, factoryConfig.actionCount());
        if (stored.isEmpty()) {
            log.warn("No value table at {}; run training first", tablePath);
            return Optional.empty();
        }
        QLearningAgent agent = new QLearningAgent(factoryConfig.actionCount(), learningSchedule, run.getAgentSeed());
        agent.restore(stored.get());
        FactoryEnvironment env = new FactoryEnvironment(factoryConfig, run.getEvaluationSeed());

        EvaluationReport report = evaluate(env, agent, run.getEvaluationEpisodes(),
            exportTimeline ? Path.of(run.getOutputDir()).resolve("evaluation_timeline.json") : null);
        logReport(report);
        return Optional.of(report);
    }

    /**
     * Runs {@code episodes} greedy episodes. The agent's table is left unchanged.
     *
     * @param timelinePath where to write the first episode's timeline, or null to skip it
     */
    public EvaluationReport evaluate(FactoryEnvironment env, QLearningAgent agent, int episodes, Path timelinePath) {
        if (episodes <= 0) {
            throw new IllegalArgumentException("episodes must be positive: " + episodes);
        }
        int target = env.config().dailyTarget();
        List<EpisodeResult> results = new ArrayList<>(episodes);
        Map<PerformanceBand, Integer> bands = new EnumMap<>(PerformanceBand.class);
        for (PerformanceBand band : PerformanceBand.values()) {
            bands.put(band, 0);
        }
        int targetMet = 0;
        int truncated = 0;

        for (int episode = 0; episode < episodes; episode++) {
            boolean record = timelinePath != null && episode == 0;
            EpisodeResult result = episodeRunner.evaluate(env, agent, episode, record, run.getMaxStepsPerEpisode());
            results.add(result);
            if (record) {
                timelineExporter.export("Greedy evaluation episode (" + result.goodParts() + " good parts)",
                    env.config(), result.timeline(), timelinePath);
            }
            if (result.goodParts() >= target) {
                targetMet++;
            }
            if (result.truncated()) {
                truncated++;
            }
            bands.merge(PerformanceBand.classify(result.goodParts(), target), 1, Integer::sum);
            log.debug("Evaluation episode {}: return {}, good parts {}", episode, result.totalReturn(),
                result.goodParts());
        }

        return new EvaluationReport(episodes, target,
            summarize(results, EpisodeResult::totalReturn),
            summarize(results, EpisodeResult::goodParts),
            summarize(results, EpisodeResult::defectiveParts),
            targetMet, truncated, bands);
    }

    private EvaluationReport.Summary summarize(List<EpisodeResult> results, ToDoubleFunction<EpisodeResult> metric) {
        double[] values = results.stream().mapToDouble(metric).toArray();
        return new EvaluationReport.Summary(statistics.mean(values), statistics.standardDeviation(values),
            statistics.min(values), statistics.median(values), statistics.max(values));
    }

    private void logReport(EvaluationReport report) {
        log.info("Evaluated {} episodes against a target of {}", report.episodes(), report.dailyTarget());
        log.info("Return: {} ± {} (min {}, median {}, max {})",
            format(report.returns().mean()), format(report.returns().standardDeviation()),
            format(report.returns().min()), format(report.returns().median()), format(report.returns().max()));
        log.info("Good parts: {} ± {} (min {}, median {}, max {})",
            format(report.production().mean()), format(report.production().standardDeviation()),
            format(report.production().min()), format(report.production().median()),
            format(report.production().max()));
        log.info("Target met in {}/{} episodes ({}%)", report.targetMetEpisodes(), report.episodes(),
            format(100.0 * report.targetMetRate()));
        log.info("Mean target attainment: {}%",
            format(100.0 * statistics.boundedRatio(report.production().mean(), report.dailyTarget())));
        for (PerformanceBand band : PerformanceBand.values()) {
            log.info("  {}: {} episodes", band.label(), report.bands().get(band));
        }
        if (report.truncatedEpisodes() > 0) {
            log.warn("{} episodes were cut off by the step cap", report.truncatedEpisodes());
        }
    }

    private static String format(double value) {
        return String.format("%.2f", value);
    }
}
