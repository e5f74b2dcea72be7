package com.floorpilot.shared.config;

/**
 * Fixed reward shaping weights. None of these are learned.
 *
 * @param goodPart            reward per good part completed in a step
 * @param highSkillBonus      bonus when the assigned operator is in the high skill bucket
 * @param assignmentBonus     bonus for staffing the awaiting machine
 * @param idlePenalty         penalty for leaving the awaiting machine idle while an eligible operator is free
 * @param defectPenalty       penalty per defective part
 * @param illegalPenalty      penalty for an action substituted with idle; should exceed {@code defectPenalty}
 * @param targetBonus         terminal bonus, scaled by {@code min(1, produced / target)}
 * @param shortfallPenalty    terminal penalty per part short of target
 * @param fatiguePenalty      penalty scaled by operator fatigue at unit completion
 * @param switchPenalty       penalty for replacing the previous operator of a machine
 * @param overCapacityPenalty penalty scaled by {@code (worked - capacity) / capacity} at unit completion
 * @param lowSkillPenalty     penalty per unit completed by an operator in the low skill bucket
 * @param halfwayBonus        one-time bonus when good parts first reach half the target
 * @param eightyPercentBonus  one-time bonus when good parts first reach 80% of the target
 */
public record RewardWeights(
    double goodPart,
    double highSkillBonus,
    double assignmentBonus,
    double idlePenalty,
    double defectPenalty,
    double illegalPenalty,
    double targetBonus,
    double shortfallPenalty,
    double fatiguePenalty,
    double switchPenalty,
    double overCapacityPenalty,
    double lowSkillPenalty,
    double halfwayBonus,
    double eightyPercentBonus
) {

    public RewardWeights {
        double[] all = {goodPart, highSkillBonus, assignmentBonus, idlePenalty, defectPenalty,
            illegalPenalty, targetBonus, shortfallPenalty, fatiguePenalty, switchPenalty,
            overCapacityPenalty, lowSkillPenalty, halfwayBonus, eightyPercentBonus};
        for (double weight : all) {
            if (weight < 0 || Double.isNaN(weight) || Double.isInfinite(weight)) {
                throw new InvalidConfigurationException(
                    "Reward weights must be finite and non-negative (sign is applied by the reward model)");
            }
        }
        if (illegalPenalty <= defectPenalty) {
            throw new InvalidConfigurationException(
                "illegalPenalty (" + illegalPenalty + ") must be larger than defectPenalty (" + defectPenalty + ")");
        }
    }

    /**
     * Core weights only; over-capacity, low-skill and milestone terms are off.
     */
    public RewardWeights(double goodPart, double highSkillBonus, double assignmentBonus, double idlePenalty,
                         double defectPenalty, double illegalPenalty, double targetBonus, double shortfallPenalty,
                         double fatiguePenalty, double switchPenalty) {
        this(goodPart, highSkillBonus, assignmentBonus, idlePenalty, defectPenalty, illegalPenalty, targetBonus,
            shortfallPenalty, fatiguePenalty, switchPenalty, 0.0, 0.0, 0.0, 0.0);
    }

    public static RewardWeights defaults() {
        return new RewardWeights(3.0, 1.5, 0.5, 1.0, 10.0, 12.0, 80.0, 0.3, 0.5, 0.5);
    }
}
