package com.floorpilot.training.service;

import com.floorpilot.agent.QLearningAgent;
import com.floorpilot.agent.schedule.LearningSchedule;
import com.floorpilot.shared.config.DemoScenarios;
import com.floorpilot.shared.config.FactoryConfig;
import com.floorpilot.simulation.service.FactoryEnvironment;
import com.floorpilot.training.model.EpisodeResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class EpisodeRunnerTest {

    private final EpisodeRunner runner = new EpisodeRunner();
    private FactoryEnvironment env;
    private QLearningAgent agent;

    @BeforeEach
    void setUp() {
        FactoryConfig config = DemoScenarios.singleStation(1.0, 10.0, 5.0, 1);
        env = new FactoryEnvironment(config, 3L);
        agent = new QLearningAgent(config.actionCount(), LearningSchedule.fixed(0.9, 0.0, 0.5), 3L);
    }

    @Test
    void test_greedy_episode_summary() {
        EpisodeResult result = runner.evaluate(env, agent, 0, false, 100);
        assertEquals(1, result.goodParts());
        assertEquals(2, result.steps());
        assertEquals(5.0 + 82.0, result.totalReturn(), 1e-9);
        assertEquals(0, result.illegalActions());
        assertEquals(0, result.idleWithEligibleOperator());
        assertEquals(10.0, result.finalTimeMinutes(), 1e-9);
        assertFalse(result.truncated());
        assertTrue(result.timeline().isEmpty());
    }

    @Test
    void test_evaluation_leaves_table_untouched() {
        runner.evaluate(env, agent, 0, false, 100);
        assertEquals(0, agent.valueTable().size());
    }

    @Test
    void test_training_episode_updates_table() {
        EpisodeResult result = runner.train(env, agent, 4, false, 100);
        assertEquals(4, result.episode());
        assertEquals(4, agent.episodeIndex());
        assertTrue(agent.valueTable().size() > 0);
    }

    @Test
    void test_recorded_episode_carries_timeline() {
        EpisodeResult result = runner.evaluate(env, agent, 0, true, 100);
        assertFalse(result.timeline().isEmpty());
        assertEquals(0.0, result.timeline().get(0).timeMinutes(), 1e-9);
    }

    @Test
    void test_step_cap_truncates_episode() {
        EpisodeResult result = runner.evaluate(env, agent, 0, false, 1);
        assertTrue(result.truncated());
        assertEquals(1, result.steps());
        assertEquals(5.0, result.finalTimeMinutes(), 1e-9);
    }

    @Test
    void test_non_positive_step_cap_rejected() {
        assertThrows(IllegalArgumentException.class, () -> runner.evaluate(env, agent, 0, false, 0));
    }
}
