package com.floorpilot.agent.table;

import com.floorpilot.simulation.model.DecisionState;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Lazily populated mapping from decision state to one value per action.
 *
 * A state gets a zero vector the first time a value is written for it and
 * keeps it for the table's lifetime. Reads of unseen states return zeros
 * without inserting anything.
 */
public class ValueTable implements ValueTableView {

    private final int actionCount;
    private final Map<DecisionState, double[]> rows = new LinkedHashMap<>();

    public ValueTable(int actionCount) {
        if (actionCount <= 0) {
            throw new IllegalArgumentException("actionCount must be positive: " + actionCount);
        }
        this.actionCount = actionCount;
    }

    /**
     * Live row for a state, inserting a zero vector on first access.
     */
    double[] row(DecisionState state) {
        if (state == null) {
            throw new IllegalArgumentException("state must not be null");
        }
        return rows.computeIfAbsent(state, s -> new double[actionCount]);
    }

    /**
     * Row for a state without inserting it; unseen states read as all zeros.
     */
    private double[] lookup(DecisionState state) {
        if (state == null) {
            throw new IllegalArgumentException("state must not be null");
        }
        double[] values = rows.get(state);
        return values != null ? values : new double[actionCount];
    }

    public double value(DecisionState state, int action) {
        return lookup(state)[action];
    }

    public void setValue(DecisionState state, int action, double value) {
        row(state)[action] = value;
    }

    public double maxValue(DecisionState state) {
        double[] values = lookup(state);
        double best = values[0];
        for (int a = 1; a < values.length; a++) {
            best = Math.max(best, values[a]);
        }
        return best;
    }

    /**
     * Highest-valued action; ties go to the lowest index.
     */
    public int bestAction(DecisionState state) {
        double[] values = lookup(state);
        int best = 0;
        for (int a = 1; a < values.length; a++) {
            if (values[a] > values[best]) {
                best = a;
            }
        }
        return best;
    }

    /**
     * Replaces the table contents.
     *
     * @throws IllegalArgumentException if any vector has the wrong length
     */
    public void replaceWith(Map<DecisionState, double[]> entries) {
        for (Map.Entry<DecisionState, double[]> entry : entries.entrySet()) {
            if (entry.getValue() == null || entry.getValue().length != actionCount) {
                throw new IllegalArgumentException("Expected " + actionCount + " action values for " + entry.getKey());
            }
        }
        rows.clear();
        entries.forEach((state, values) -> rows.put(state, values.clone()));
    }

    public void clear() {
        rows.clear();
    }

    @Override
    public int actionCount() {
        return actionCount;
    }

    @Override
    public int size() {
        return rows.size();
    }

    @Override
    public boolean contains(DecisionState state) {
        return rows.containsKey(state);
    }

    @Override
    public double[] values(DecisionState state) {
        double[] values = rows.get(state);
        return values == null ? new double[actionCount] : values.clone();
    }

    @Override
    public Map<DecisionState, double[]> snapshot() {
        Map<DecisionState, double[]> copy = new LinkedHashMap<>();
        rows.forEach((state, values) -> copy.put(state, values.clone()));
        return Collections.unmodifiableMap(copy);
    }
}
