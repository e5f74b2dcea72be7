package com.floorpilot.training.model;

import java.nio.file.Path;

/**
 * @param recentMeanReturn     mean return over the last logging window
 * @param recentMeanProduction mean good parts over the last logging window
 * @param bestRecordedEpisode  recorded episode with the highest return, whose timeline was kept, or -1
 */
public record TrainingReport(
    int episodes,
    int statesLearned,
    double recentMeanReturn,
    double recentMeanProduction,
    int bestRecordedEpisode,
    double bestRecordedReturn,
    int bestRecordedProduction,
    Path tablePath
) {
}
