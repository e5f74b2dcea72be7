package com.floorpilot.simulation.service;

import com.floorpilot.shared.config.FactoryConfig;
import com.floorpilot.shared.model.MachineStatus;
import com.floorpilot.simulation.model.DecisionState;
import com.floorpilot.simulation.model.FloorObservation;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns raw floor observations into {@link DecisionState} keys.
 *
 * Pure and deterministic. Time remaining is bucketed against the day length,
 * production shortfall against the daily target and skill against absolute
 * cutoffs, all taken from {@link FactoryConfig#bucketThresholds()}. Time and
 * shortfall values on a cutoff fall into the lower bucket; skill buckets are
 * closed-open, so a skill equal to the high cutoff counts as high.
 */
public class StateEncoder {

    private final FactoryConfig config;
    private final double[] timeCutoffs;
    private final double[] shortfallCutoffs;
    private final double[] skillCutoffs;

    public StateEncoder(FactoryConfig config) {
        this.config = config;
        this.timeCutoffs = Bucketing.scale(config.bucketThresholds().timeRemainingFractions(),
            config.dayLengthMinutes());
        this.shortfallCutoffs = Bucketing.scale(config.bucketThresholds().shortfallFractions(),
            config.dailyTarget());
        this.skillCutoffs = config.bucketThresholds().skillCutoffs();
    }

    public DecisionState encode(FloorObservation observation) {
        int machineId = observation.awaitingMachine();
        boolean awaiting = machineId != DecisionState.NO_MACHINE;

        double remaining = Math.max(0.0, config.dayLengthMinutes() - observation.elapsedMinutes());
        int shortfall = Math.max(0, config.dailyTarget() - observation.goodParts());

        int availabilityMask = 0;
        List<Integer> skillBuckets = new ArrayList<>(config.operatorCount());
        for (int op = 0; op < config.operatorCount(); op++) {
            if (observation.operatorFree().get(op)) {
                availabilityMask |= 1 << op;
            }
            skillBuckets.add(awaiting ? skillBucket(config.skill(op, machineId)) : 0);
        }

        List<Integer> statusCodes = new ArrayList<>(config.machineCount());
        for (MachineStatus status : observation.machineStatuses()) {
            statusCodes.add(status.code());
        }

        int shift = Math.max(0, Math.min(observation.shiftIndex(), config.shiftCount() - 1));
        return new DecisionState(
            machineId,
            awaiting ? config.priority(machineId).level() : 0,
            shift,
            Bucketing.bucketOf(remaining, timeCutoffs),
            Bucketing.bucketOf(shortfall, shortfallCutoffs),
            availabilityMask,
            skillBuckets,
            statusCodes);
    }

    public int skillBucket(double skill) {
        return Bucketing.bucketOfClosedOpen(skill, skillCutoffs);
    }

    public boolean isHighSkill(double skill) {
        return skillBucket(skill) == highSkillBucket();
    }

    public boolean isLowSkill(double skill) {
        return skillCutoffs.length > 0 && skillBucket(skill) == 0;
    }

    public int highSkillBucket() {
        return skillCutoffs.length;
    }
}
