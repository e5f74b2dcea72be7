package com.floorpilot.training.model;

import com.floorpilot.simulation.model.FloorSnapshot;

import java.util.List;

/**
 * Outcome of one simulated day.
 *
 * @param truncated the step cap was hit before the day ended
 * @param timeline  recorded frames, empty unless recording was requested
 */
public record EpisodeResult(
    int episode,
    double totalReturn,
    int goodParts,
    int defectiveParts,
    int steps,
    int illegalActions,
    int idleWithEligibleOperator,
    int breakdowns,
    double finalTimeMinutes,
    boolean truncated,
    List<FloorSnapshot> timeline
) {

    public EpisodeResult {
        timeline = timeline == null ? List.of() : List.copyOf(timeline);
    }
}
