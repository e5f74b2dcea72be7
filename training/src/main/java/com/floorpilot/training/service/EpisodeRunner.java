package com.floorpilot.training.service;

import com.floorpilot.agent.QLearningAgent;
import com.floorpilot.simulation.model.DecisionState;
import com.floorpilot.simulation.model.StepResult;
import com.floorpilot.simulation.service.FactoryEnvironment;
import com.floorpilot.training.model.EpisodeResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Drives the reset / select / step / update loop for a single day.
 */
@Component
public class EpisodeRunner {

    private static final Logger log = LoggerFactory.getLogger(EpisodeRunner.class);

    /**
     * Runs one exploring episode and updates the agent after every step.
     */
    public EpisodeResult train(FactoryEnvironment env, QLearningAgent agent, int episode,
                               boolean record, int maxSteps) {
        agent.beginEpisode(episode);
        return run(env, agent, episode, record, maxSteps, true);
    }

    /**
     * Runs one greedy episode without touching the value table.
     */
    public EpisodeResult evaluate(FactoryEnvironment env, QLearningAgent agent, int episode,
                                  boolean record, int maxSteps) {
        return run(env, agent, episode, record, maxSteps, false);
    }

    private EpisodeResult run(FactoryEnvironment env, QLearningAgent agent, int episode,
                              boolean record, int maxSteps, boolean learn) {
        if (maxSteps <= 0) {
            throw new IllegalArgumentException("maxSteps must be positive: " + maxSteps);
        }
        DecisionState state = env.reset(record);
        double totalReturn = 0.0;
        int steps = 0;
        int illegal = 0;
        int idled = 0;
        int breakdowns = 0;
        boolean terminal = env.isTerminal();

        while (!terminal && steps < maxSteps) {
            int action = agent.selectAction(state, !learn);
            StepResult result = env.step(action);
            if (learn) {
                agent.update(state, action, result.reward(), result.state(), result.terminal());
            }
            totalReturn += result.reward();
            if (result.info().illegalAction()) {
                illegal++;
            }
            if (result.info().idledWithEligibleOperator()) {
                idled++;
            }
            breakdowns += result.info().breakdowns();
            state = result.state();
            terminal = result.terminal();
            steps++;
        }

        boolean truncated = !terminal;
        if (truncated) {
            log.warn("Episode {} hit the step cap of {} at minute {}", episode, maxSteps, env.elapsedMinutes());
        }
        if (record) {
            env.stopRecording();
        }
        return new EpisodeResult(episode, totalReturn, env.goodParts(), env.defectiveParts(), steps,
            illegal, idled, breakdowns, env.elapsedMinutes(), truncated, record ? env.history() : null);
    }
}
