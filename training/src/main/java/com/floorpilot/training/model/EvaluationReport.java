package com.floorpilot.training.model;

import java.util.Map;

/**
 * Aggregate of a batch of greedy episodes.
 */
public record EvaluationReport(
    int episodes,
    int dailyTarget,
    Summary returns,
    Summary production,
    Summary defects,
    int targetMetEpisodes,
    int truncatedEpisodes,
    Map<PerformanceBand, Integer> bands
) {

    public EvaluationReport {
        bands = Map.copyOf(bands);
    }

    public double targetMetRate() {
        return episodes == 0 ? 0.0 : (double) targetMetEpisodes / episodes;
    }

    public record Summary(double mean, double standardDeviation, double min, double median, double max) {
    }
}
