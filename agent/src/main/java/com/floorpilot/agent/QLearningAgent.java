package com.floorpilot.agent;

import com.floorpilot.agent.schedule.LearningSchedule;
import com.floorpilot.agent.table.ValueTable;
import com.floorpilot.agent.table.ValueTableView;
import com.floorpilot.simulation.model.DecisionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Random;

/**
 * Tabular Q-learning with epsilon-greedy exploration.
 *
 * Epsilon and alpha come from the {@link LearningSchedule} and change only
 * through {@link #beginEpisode(int)}, so a run is a deterministic function of
 * the schedule, the seed and the environment. Each agent owns its table and
 * random source; nothing is shared between instances. Not thread-safe.
 */
public class QLearningAgent {

    private static final Logger log = LoggerFactory.getLogger(QLearningAgent.class);

    private final int actionCount;
    private final LearningSchedule schedule;
    private final Random random;
    private final ValueTable table;

    private int episodeIndex;
    private double epsilon;
    private double alpha;

    public QLearningAgent(int actionCount, LearningSchedule schedule, long seed) {
        this(actionCount, schedule, new Random(seed));
    }

    public QLearningAgent(int actionCount, LearningSchedule schedule, Random random) {
        this.actionCount = actionCount;
        this.schedule = schedule;
        this.random = random;
        this.table = new ValueTable(actionCount);
        beginEpisode(0);
    }

    /**
     * Sets epsilon and alpha for the given training episode.
     */
    public void beginEpisode(int episodeIndex) {
        this.episodeIndex = episodeIndex;
        this.epsilon = schedule.exploration().valueAt(episodeIndex);
        this.alpha = schedule.learningRate().valueAt(episodeIndex);
    }

    /**
     * Epsilon-greedy choice over the full action space. With {@code greedy}
     * set, exploration is skipped and the result depends only on the table.
     */
    public int selectAction(DecisionState state, boolean greedy) {
        if (!greedy && random.nextDouble() < epsilon) {
            return random.nextInt(actionCount);
        }
        return table.bestAction(state);
    }

    /**
     * {@code Q(s,a) += alpha * (r + gamma * max Q(s',.) * (1 - terminal) - Q(s,a))}.
     */
    public void update(DecisionState state, int action, double reward, DecisionState nextState, boolean terminal) {
        if (action < 0 || action >= actionCount) {
            throw new IllegalArgumentException("action out of range: " + action);
        }
        double current = table.value(state, action);
        double bootstrap = terminal ? 0.0 : schedule.discount() * table.maxValue(nextState);
        table.setValue(state, action, current + alpha * (reward + bootstrap - current));
    }

    /**
     * Replaces the learned values, e.g. with a table restored from disk.
     */
    public void restore(Map<DecisionState, double[]> entries) {
        table.replaceWith(entries);
        log.info("Restored {} states into the value table", table.size());
    }

    public ValueTableView valueTable() {
        return table;
    }

    public int actionCount() {
        return actionCount;
    }

    public int episodeIndex() {
        return episodeIndex;
    }

    public double epsilon() {
        return epsilon;
    }

    public double learningRate() {
        return alpha;
    }

    public double discount() {
        return schedule.discount();
    }
}
