package com.floorpilot.training.service;

import com.floorpilot.agent.QLearningAgent;
import com.floorpilot.agent.schedule.LearningSchedule;
import com.floorpilot.shared.config.FactoryConfig;
import com.floorpilot.shared.util.MetricsCollector;
import com.floorpilot.shared.util.StatisticsReducer;
import com.floorpilot.simulation.service.FactoryEnvironment;
import com.floorpilot.training.config.FloorPilotProperties;
import com.floorpilot.training.model.EpisodeResult;
import com.floorpilot.training.model.TrainingReport;
import com.floorpilot.training.persistence.TimelineExporter;
import com.floorpilot.training.persistence.TrainingCurveWriter;
import com.floorpilot.training.persistence.ValueTableStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Trains a fresh agent on the configured floor, then persists the value
 * table, the training curves and the best recorded timeline.
 */
@Service
public class TrainingService {

    private static final Logger log = LoggerFactory.getLogger(TrainingService.class);

    private final FactoryConfig factoryConfig;
    private final LearningSchedule learningSchedule;
    private final FloorPilotProperties.Run run;
    private final EpisodeRunner episodeRunner;
    private final ValueTableStore tableStore;
    private final TrainingCurveWriter curveWriter;
    private final TimelineExporter timelineExporter;
    private final MetricsCollector metrics;
    private final StatisticsReducer statistics;

    public TrainingService(FactoryConfig factoryConfig, LearningSchedule learningSchedule,
                           FloorPilotProperties properties, EpisodeRunner episodeRunner,
                           ValueTableStore tableStore, TrainingCurveWriter curveWriter,
                           TimelineExporter timelineExporter, MetricsCollector metrics,
                           StatisticsReducer statistics) {
        this.factoryConfig = factoryConfig;
        this.learningSchedule = learningSchedule;
        this.run = properties.getRun();
        this.episodeRunner = episodeRunner;
        this.tableStore = tableStore;
        this.curveWriter = curveWriter;
        this.timelineExporter = timelineExporter;
        this.metrics = metrics;
        this.statistics = statistics;
    }

    public TrainingReport train() {
        FactoryEnvironment env = new FactoryEnvironment(factoryConfig, run.getTrainingSeed());
        QLearningAgent agent = new QLearningAgent(factoryConfig.actionCount(), learningSchedule, run.getAgentSeed());
        return train(env, agent, run.getEpisodes());
    }

    public TrainingReport train(FactoryEnvironment env, QLearningAgent agent, int episodes) {
        if (episodes <= 0) {
            throw new IllegalArgumentException("episodes must be positive: " + episodes);
        }
        log.info("Training for {} episodes on {} machines / {} operators (target {})",
            episodes, factoryConfig.machineCount(), factoryConfig.operatorCount(), factoryConfig.dailyTarget());

        List<EpisodeResult> results = new ArrayList<>(episodes);
        EpisodeResult best = null;
        int logEvery = Math.max(1, run.getLogEvery());
        int recordEvery = Math.max(1, run.getRecordEvery());

        try (MetricsCollector.Span ignored = metrics.startSpan("train.run")) {
            for (int episode = 0; episode < episodes; episode++) {
                boolean record = episode % recordEvery == 0;
                EpisodeResult result = episodeRunner.train(env, agent, episode, record, run.getMaxStepsPerEpisode());
                results.add(result);
                recordMetrics(result);

                if (record && (best == null || result.totalReturn() > best.totalReturn())) {
                    best = result;
                }
                if ((episode + 1) % logEvery == 0) {
                    List<EpisodeResult> window = results.subList(results.size() - logEvery, results.size());
                    log.info("Episode {}/{} | mean return {} | mean good parts {} | epsilon {} | alpha {} | states {}",
                        episode + 1, episodes,
                        String.format("%.2f", meanReturn(window)),
                        String.format("%.2f", meanProduction(window)),
                        String.format("%.3f", agent.epsilon()),
                        String.format("%.4f", agent.learningRate()),
                        agent.valueTable().size());
                }
            }
        }

        Path outputDir = Path.of(run.getOutputDir());
        Path tablePath = Path.of(run.getTablePath());
        tableStore.save(agent.valueTable(), tablePath);
        curveWriter.write(results, Math.max(1, run.getMovingAverageWindow()), outputDir.resolve("training_curves.csv"));
        if (best != null && !best.timeline().isEmpty()) {
            timelineExporter.export("Best recorded training episode " + best.episode() + " (return "
                + String.format("%.2f", best.totalReturn()) + ", " + best.goodParts() + " good parts)",
                factoryConfig, best.timeline(), outputDir.resolve("best_timeline.json"));
        }

        List<EpisodeResult> tail = results.subList(Math.max(0, results.size() - logEvery), results.size());
        TrainingReport report = new TrainingReport(episodes, agent.valueTable().size(), meanReturn(tail),
            meanProduction(tail), best == null ? -1 : best.episode(), best == null ? 0.0 : best.totalReturn(),
            best == null ? 0 : best.goodParts(), tablePath);
        log.info("Training finished: {} states learned, recent mean good parts {} of target {}",
            report.statesLearned(), String.format("%.2f", report.recentMeanProduction()), factoryConfig.dailyTarget());
        return report;
    }

    private void recordMetrics(EpisodeResult result) {
        metrics.incrementCounter("train.episodes");
        metrics.incrementCounter("train.steps", result.steps());
        metrics.incrementCounter("train.illegal_actions", result.illegalActions());
        metrics.incrementCounter("train.good_parts", result.goodParts());
        metrics.incrementCounter("train.defective_parts", result.defectiveParts());
        metrics.incrementCounter("train.breakdowns", result.breakdowns());
        if (result.truncated()) {
            metrics.incrementCounter("train.truncated");
        }
        metrics.recordGauge("train.return", result.totalReturn());
    }

    private double meanReturn(List<EpisodeResult> results) {
        return statistics.mean(results.stream().mapToDouble(EpisodeResult::totalReturn).toArray());
    }

    private double meanProduction(List<EpisodeResult> results) {
        return statistics.mean(results.stream().mapToDouble(EpisodeResult::goodParts).toArray());
    }
}
