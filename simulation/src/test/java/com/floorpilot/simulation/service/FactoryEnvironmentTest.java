package com.floorpilot.simulation.service;

import com.floorpilot.shared.config.DemoScenarios;
import com.floorpilot.shared.config.DowntimeModel;
import com.floorpilot.shared.config.FactoryConfig;
import com.floorpilot.shared.config.RewardWeights;
import com.floorpilot.shared.model.MachineStatus;
import com.floorpilot.simulation.model.DecisionState;
import com.floorpilot.simulation.model.IllegalActionReason;
import com.floorpilot.simulation.model.Operator;
import com.floorpilot.simulation.model.StepResult;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class FactoryEnvironmentTest {

    private static FactoryConfig station() {
        return DemoScenarios.singleStation(1.0, 10.0, 5.0, 1);
    }

    private static FactoryConfig twoMachinesTwoOperators() {
        return FactoryConfig.builder()
            .machineCount(2)
            .operatorCount(2)
            .skillMatrix(new double[][] {{1.0, 1.0}, {0.5, 0.5}})
            .dayLengthMinutes(60)
            .baseProcessTimes(5.0, 5.0)
            .dailyTarget(4)
            .build();
    }

    /** Every draw returns the same value, which makes stochastic events predictable. */
    private static final class FixedRandom extends Random {
        private final double value;

        FixedRandom(double value) {
            this.value = value;
        }

        @Override
        public double nextDouble() {
            return value;
        }
    }

    @Test
    void test_single_station_day_produces_one_good_part() {
        FactoryEnvironment env = new FactoryEnvironment(station(), 1L);
        assertEquals(0, env.currentState().machineId());

        StepResult first = env.step(0);
        assertFalse(first.terminal());
        assertEquals(5.0, env.elapsedMinutes(), 1e-9);
        assertEquals(1, first.info().goodPartsThisStep());
        // good part, assignment and high-skill bonus
        assertEquals(3.0 + 0.5 + 1.5, first.reward(), 1e-9);

        StepResult second = env.step(0);
        assertTrue(second.terminal());
        assertEquals(10.0, env.elapsedMinutes(), 1e-9);
        // the unit finishing at closing time is not counted
        assertEquals(1, env.goodParts());
        assertEquals(0.5 + 1.5 + 80.0, second.reward(), 1e-9);
        assertFalse(first.info().idledWithEligibleOperator());
        assertFalse(second.info().idledWithEligibleOperator());
        assertEquals(Operator.UNBOUND, env.operatorMachine(0));
    }

    @Test
    void test_out_of_range_action_is_substituted_and_penalized() {
        FactoryEnvironment env = new FactoryEnvironment(station(), 1L);
        StepResult result = assertDoesNotThrow(() -> env.step(env.actionCount()));
        assertEquals(IllegalActionReason.OUT_OF_RANGE, result.info().illegalReason());
        assertTrue(result.info().illegalAction());
        assertEquals(Operator.UNBOUND, result.info().assignedOperator());
        // illegal penalty plus idling while the operator was free
        assertEquals(-12.0 - 1.0, result.reward(), 1e-9);
        assertEquals(MachineStatus.IDLE, env.machineStatus(0));
        assertEquals(1.0, env.elapsedMinutes(), 1e-9);

        StepResult negative = env.step(-1);
        assertEquals(IllegalActionReason.OUT_OF_RANGE, negative.info().illegalReason());
    }

    @Test
    void test_idle_action_with_free_operator_costs_idle_penalty() {
        FactoryEnvironment env = new FactoryEnvironment(station(), 1L);
        StepResult result = env.step(env.idleAction());
        assertFalse(result.info().illegalAction());
        assertTrue(result.info().idledWithEligibleOperator());
        assertEquals(-1.0, result.reward(), 1e-9);
    }

    @Test
    void test_busy_operator_cannot_take_second_machine() {
        FactoryEnvironment env = new FactoryEnvironment(twoMachinesTwoOperators(), 1L);
        StepResult first = env.step(0);
        assertEquals(0.0, env.elapsedMinutes(), 1e-9);
        assertEquals(1, first.state().machineId());
        assertFalse(first.state().operatorAvailable(0));

        StepResult second = env.step(0);
        assertEquals(IllegalActionReason.OPERATOR_BUSY, second.info().illegalReason());
        assertTrue(second.info().idledWithEligibleOperator());
        assertEquals(1, second.info().machineId());
        assertEquals(Operator.UNBOUND, second.info().assignedOperator());
        // both machines were offered, so the clock moved to the first completion
        assertEquals(5.0, env.elapsedMinutes(), 1e-9);
        assertEquals(-12.0 - 1.0 + 3.0, second.reward(), 1e-9);
        assertEquals(MachineStatus.IDLE, env.machineStatus(1));
    }

    @Test
    void test_over_capacity_operator_is_not_eligible() {
        FactoryConfig config = FactoryConfig.builder()
            .machineCount(1)
            .operatorCount(1)
            .skillMatrix(new double[][] {{1.0}})
            .dayLengthMinutes(20)
            .operatorShiftCapacityMinutes(new double[][] {{3.0}})
            .baseProcessTimes(5.0)
            .dailyTarget(2)
            .build();
        FactoryEnvironment env = new FactoryEnvironment(config, 1L);
        env.step(0);
        assertEquals(5.0, env.operatorBusyMinutes(0, 0), 1e-9);

        StepResult result = env.step(0);
        assertEquals(IllegalActionReason.OPERATOR_OVER_CAPACITY, result.info().illegalReason());
        assertFalse(result.info().idledWithEligibleOperator());
        assertEquals(-12.0, result.reward(), 1e-9);
    }

    @Test
    void test_breakdown_releases_operator_and_machine_recovers() {
        FactoryConfig config = DemoScenarios.singleStation(1.0, 30.0, 5.0, 3).toBuilder()
            .breakdown(new DowntimeModel(0.5, 3.0, 4.0))
            .build();
        FactoryEnvironment env = new FactoryEnvironment(config, new FixedRandom(0.0));

        StepResult result = env.step(0);
        assertEquals(1, result.info().breakdowns());
        assertEquals(1, env.goodParts());
        assertEquals(MachineStatus.BROKEN, env.machineStatus(0));
        assertEquals(Operator.UNBOUND, env.machineOperator(0));
        assertEquals(Operator.UNBOUND, env.operatorMachine(0));
        assertFalse(result.state().hasAwaitingMachine());

        // nothing awaits, so any in-range action is a no-op
        StepResult wait = env.step(0);
        assertEquals(IllegalActionReason.NONE, wait.info().illegalReason());
        assertEquals(0.0, wait.reward(), 1e-9);

        List<MachineStatus> seen = new ArrayList<>();
        double maintenanceFrom = -1.0;
        while (env.machineStatus(0) != MachineStatus.IDLE) {
            env.step(env.idleAction());
            MachineStatus status = env.machineStatus(0);
            if (status == MachineStatus.MAINTENANCE && maintenanceFrom < 0) {
                maintenanceFrom = env.elapsedMinutes();
            }
            seen.add(status);
        }
        // repair lasts max(3, 2 + 0 * 2) = 3 minutes after the completion at minute 5;
        // with no maintenance model its second half is spent in MAINTENANCE
        assertTrue(seen.contains(MachineStatus.MAINTENANCE));
        assertEquals(6.5, maintenanceFrom, 1e-6);
        assertEquals(8.0, env.elapsedMinutes(), 1e-6);
        assertEquals(0, env.awaitingMachine());
    }

    @Test
    void test_breakdown_is_followed_by_configured_maintenance() {
        FactoryConfig config = DemoScenarios.singleStation(1.0, 30.0, 5.0, 3).toBuilder()
            .breakdown(new DowntimeModel(0.5, 3.0, 4.0))
            .maintenance(new DowntimeModel(0.0, 2.0, 6.0))
            .build();
        FactoryEnvironment env = new FactoryEnvironment(config, new FixedRandom(0.0));

        env.step(0);
        assertEquals(MachineStatus.BROKEN, env.machineStatus(0));

        double maintenanceFrom = -1.0;
        while (env.machineStatus(0) != MachineStatus.IDLE) {
            env.step(env.idleAction());
            if (env.machineStatus(0) == MachineStatus.MAINTENANCE && maintenanceFrom < 0) {
                maintenanceFrom = env.elapsedMinutes();
            }
        }
        // broken from 5 to 8, then the maintenance minimum of 2 minutes
        assertEquals(8.0, maintenanceFrom, 1e-6);
        assertEquals(10.0, env.elapsedMinutes(), 1e-6);
    }

    @Test
    void test_maintenance_stop_releases_operator_and_machine_recovers() {
        FactoryConfig config = DemoScenarios.singleStation(1.0, 30.0, 5.0, 3).toBuilder()
            .maintenance(new DowntimeModel(0.5, 2.0, 6.0))
            .build();
        FactoryEnvironment env = new FactoryEnvironment(config, new FixedRandom(0.0));

        StepResult result = env.step(0);
        assertEquals(0, result.info().breakdowns());
        assertEquals(1, result.info().maintenanceStops());
        assertEquals(1, env.goodParts());
        assertEquals(MachineStatus.MAINTENANCE, env.machineStatus(0));
        assertEquals(Operator.UNBOUND, env.machineOperator(0));
        assertEquals(Operator.UNBOUND, env.operatorMachine(0));
        assertFalse(result.state().hasAwaitingMachine());

        while (env.machineStatus(0) != MachineStatus.IDLE) {
            assertEquals(MachineStatus.MAINTENANCE, env.machineStatus(0));
            env.step(env.idleAction());
        }
        // maintenance lasts max(2, 3 + 0 * 3) = 3 minutes after the completion at minute 5
        assertEquals(8.0, env.elapsedMinutes(), 1e-6);
        assertEquals(0, env.awaitingMachine());
    }

    @Test
    void test_reset_is_idempotent() {
        FactoryEnvironment env = new FactoryEnvironment(DemoScenarios.demoFactory(), 42L);
        DecisionState initial = env.currentState();
        Random actions = new Random(3);
        for (int i = 0; i < 50; i++) {
            env.step(actions.nextInt(env.actionCount()));
        }
        DecisionState first = env.reset();
        DecisionState second = env.reset();
        assertEquals(first, second);
        assertEquals(initial, first);
        assertEquals(0.0, env.elapsedMinutes());
        assertEquals(0, env.goodParts());
        assertFalse(env.isTerminal());
    }

    @Test
    void test_floor_invariants_hold_under_random_play() {
        FactoryConfig demo = DemoScenarios.demoFactory();
        FactoryEnvironment env = new FactoryEnvironment(demo, 7L);
        Random actions = new Random(11);
        double previous = env.elapsedMinutes();
        boolean terminal = false;
        int steps = 0;

        while (!terminal && steps < 200_000) {
            StepResult result = env.step(actions.nextInt(env.actionCount() + 2) - 1);
            terminal = result.terminal();
            steps++;

            assertTrue(env.elapsedMinutes() >= previous, "time went backwards");
            previous = env.elapsedMinutes();
            assertEquals(env.elapsedMinutes() >= demo.dayLengthMinutes(), terminal);

            for (int m = 0; m < demo.machineCount(); m++) {
                int op = env.machineOperator(m);
                if (op != Operator.UNBOUND) {
                    assertEquals(m, env.operatorMachine(op), "machine and operator disagree");
                    assertEquals(MachineStatus.BUSY, env.machineStatus(m));
                } else {
                    assertNotEquals(MachineStatus.BUSY, env.machineStatus(m));
                }
            }
            for (int op = 0; op < demo.operatorCount(); op++) {
                int machine = env.operatorMachine(op);
                if (machine != Operator.UNBOUND) {
                    assertEquals(op, env.machineOperator(machine), "operator bound to two machines");
                }
            }
            if (result.state().hasAwaitingMachine()) {
                assertEquals(MachineStatus.IDLE, env.machineStatus(result.state().machineId()));
            }
        }
        assertTrue(terminal);
        assertEquals(demo.dayLengthMinutes(), env.elapsedMinutes(), 1e-9);
    }

    @Test
    void test_step_after_day_end_is_inert() {
        FactoryEnvironment env = new FactoryEnvironment(station(), 1L);
        env.step(0);
        env.step(0);
        assertTrue(env.isTerminal());

        StepResult after = env.step(0);
        assertTrue(after.terminal());
        assertEquals(0.0, after.reward());
        assertEquals(10.0, env.elapsedMinutes(), 1e-9);
    }

    @Test
    void test_same_seed_reproduces_trajectory() {
        List<Double> first = rollout(99L);
        List<Double> second = rollout(99L);
        assertEquals(first, second);
    }

    @Test
    void test_reseed_reproduces_trajectory() {
        FactoryEnvironment env = new FactoryEnvironment(DemoScenarios.demoFactory(), 5L);
        List<Double> before = play(env, new Random(2));
        env.reset(5L);
        List<Double> after = play(env, new Random(2));
        assertEquals(before, after);
    }

    @Test
    void test_recording_captures_timeline() {
        FactoryEnvironment env = new FactoryEnvironment(station(), 1L);
        env.reset(true);
        env.step(0);
        env.step(0);
        assertFalse(env.history().isEmpty());
        assertEquals(10.0, env.history().get(env.history().size() - 1).timeMinutes(), 1e-9);

        env.reset(false);
        env.step(0);
        assertTrue(env.history().isEmpty());
    }

    private static List<Double> rollout(long seed) {
        return play(new FactoryEnvironment(DemoScenarios.demoFactory(), seed), new Random(4));
    }

    private static List<Double> play(FactoryEnvironment env, Random actions) {
        List<Double> trace = new ArrayList<>();
        boolean terminal = false;
        while (!terminal) {
            StepResult result = env.step(actions.nextInt(env.actionCount()));
            trace.add(result.reward());
            trace.add(env.elapsedMinutes());
            terminal = result.terminal();
        }
        trace.add((double) env.goodParts());
        return trace;
    }

    private static RewardWeights onlyExtras(double overCapacity, double lowSkill, double halfway, double eighty) {
        return new RewardWeights(0.0, 0.0, 0.0, 0.0, 0.0, 1.0, 0.0, 0.0, 0.0, 0.0,
            overCapacity, lowSkill, halfway, eighty);
    }

    @Test
    void test_milestone_bonuses_paid_once_when_crossed() {
        FactoryConfig config = DemoScenarios.singleStation(1.0, 30.0, 5.0, 4).toBuilder()
            .rewardWeights(onlyExtras(0.0, 0.0, 10.0, 20.0))
            .build();
        FactoryEnvironment env = new FactoryEnvironment(config, 5L);

        double[] rewards = new double[5];
        for (int i = 0; i < rewards.length; i++) {
            rewards[i] = env.step(0).reward();
        }
        // parts 1..5 complete at minutes 5..25; 2 of 4 is halfway, 4 of 4 passes 80%
        assertArrayEquals(new double[] {0.0, 10.0, 0.0, 20.0, 0.0}, rewards, 1e-9);
        assertEquals(5, env.goodParts());
    }

    @Test
    void test_low_skill_unit_is_penalized() {
        FactoryConfig config = DemoScenarios.singleStation(0.2, 60.0, 5.0, 3).toBuilder()
            .rewardWeights(onlyExtras(0.0, 2.0, 0.0, 0.0))
            .build();
        FactoryEnvironment env = new FactoryEnvironment(config, 5L);

        StepResult result = env.step(0);
        // 5 / 0.2 = 25 minutes per unit
        assertEquals(25.0, env.elapsedMinutes(), 1e-9);
        assertEquals(-2.0, result.reward(), 1e-9);
    }

    @Test
    void test_unit_overrunning_capacity_is_penalized() {
        FactoryConfig config = DemoScenarios.singleStation(1.0, 20.0, 5.0, 3).toBuilder()
            .operatorShiftCapacityMinutes(new double[][] {{4.0}})
            .rewardWeights(onlyExtras(4.0, 0.0, 0.0, 0.0))
            .build();
        FactoryEnvironment env = new FactoryEnvironment(config, 5L);

        StepResult result = env.step(0);
        // 5 minutes worked against 4 of capacity: (5 - 4) / 4 = 0.25
        assertEquals(-1.0, result.reward(), 1e-9);
    }
}
