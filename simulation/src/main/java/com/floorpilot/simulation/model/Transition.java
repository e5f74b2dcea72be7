package com.floorpilot.simulation.model;

/**
 * Everything the reward model needs to score one step.
 *
 * @param assigned                  an operator was bound to the awaiting machine
 * @param assignedHighSkill         the bound operator is in the top skill bucket for that machine
 * @param operatorSwitched          the bound operator differs from the machine's previous operator
 * @param illegalAction             the chosen action was replaced by "leave idle"
 * @param idledWithEligibleOperator the awaiting machine stayed idle while an eligible operator was free
 * @param goodParts                 good parts completed during the step
 * @param defectiveParts            defective parts completed during the step
 * @param fatigue                   summed fatigue of operators who completed a unit during the step
 * @param terminal                  the day ended during the step
 * @param producedTotal             good parts produced so far in the episode
 * @param dailyTarget               daily production target
 * @param overCapacityRatio         summed {@code (worked - capacity) / capacity} of operators who
 *                                  completed a unit past their shift capacity
 * @param lowSkillUnits             units completed by operators in the low skill bucket
 * @param halfwayReached            good parts reached half the target for the first time this episode
 * @param eightyPercentReached      good parts reached 80% of the target for the first time this episode
 */
public record Transition(
    boolean assigned,
    boolean assignedHighSkill,
    boolean operatorSwitched,
    boolean illegalAction,
    boolean idledWithEligibleOperator,
    int goodParts,
    int defectiveParts,
    double fatigue,
    boolean terminal,
    int producedTotal,
    int dailyTarget,
    double overCapacityRatio,
    int lowSkillUnits,
    boolean halfwayReached,
    boolean eightyPercentReached
) {

    public Transition(boolean assigned, boolean assignedHighSkill, boolean operatorSwitched, boolean illegalAction,
                      boolean idledWithEligibleOperator, int goodParts, int defectiveParts, double fatigue,
                      boolean terminal, int producedTotal, int dailyTarget) {
        this(assigned, assignedHighSkill, operatorSwitched, illegalAction, idledWithEligibleOperator, goodParts,
            defectiveParts, fatigue, terminal, producedTotal, dailyTarget, 0.0, 0, false, false);
    }
}
