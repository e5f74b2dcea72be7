package com.floorpilot.simulation.service;

import com.floorpilot.shared.config.RewardWeights;
import com.floorpilot.simulation.model.Transition;

/**
 * Scores a transition. All components are additive; nothing here is random.
 */
public class RewardModel {

    private final RewardWeights weights;

    public RewardModel(RewardWeights weights) {
        this.weights = weights;
    }

    public double reward(Transition transition) {
        double reward = weights.goodPart() * transition.goodParts()
            - weights.defectPenalty() * transition.defectiveParts();

        if (transition.assigned()) {
            reward += weights.assignmentBonus();
            if (transition.assignedHighSkill()) {
                reward += weights.highSkillBonus();
            }
            if (transition.operatorSwitched()) {
                reward -= weights.switchPenalty();
            }
        }
        if (transition.illegalAction()) {
            reward -= weights.illegalPenalty();
        }
        if (transition.idledWithEligibleOperator()) {
            reward -= weights.idlePenalty();
        }
        reward -= weights.fatiguePenalty() * transition.fatigue();
        reward -= weights.overCapacityPenalty() * transition.overCapacityRatio();
        reward -= weights.lowSkillPenalty() * transition.lowSkillUnits();
        if (transition.halfwayReached()) {
            reward += weights.halfwayBonus();
        }
        if (transition.eightyPercentReached()) {
            reward += weights.eightyPercentBonus();
        }

        if (transition.terminal()) {
            reward += terminalReward(transition.producedTotal(), transition.dailyTarget());
        }
        return reward;
    }

    /**
     * End-of-day component: a bonus when the target is met, otherwise a
     * penalty per missing part.
     */
    public double terminalReward(int produced, int target) {
        if (produced >= target) {
            return weights.targetBonus() * Math.min(1.0, (double) produced / target);
        }
        return -weights.shortfallPenalty() * (target - produced);
    }
}
