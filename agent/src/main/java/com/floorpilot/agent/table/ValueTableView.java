package com.floorpilot.agent.table;

import com.floorpilot.simulation.model.DecisionState;

import java.util.Map;

/**
 * Read-only access to learned action values, for persistence and reporting.
 */
public interface ValueTableView {

    int actionCount();

    int size();

    boolean contains(DecisionState state);

    /**
     * Copy of the action values for a state; all zeros if the state was never seen.
     */
    double[] values(DecisionState state);

    /**
     * Independent copy of every entry, in first-seen order.
     */
    Map<DecisionState, double[]> snapshot();
}
