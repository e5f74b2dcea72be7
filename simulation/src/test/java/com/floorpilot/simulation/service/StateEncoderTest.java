package com.floorpilot.simulation.service;

import com.floorpilot.shared.config.DemoScenarios;
import com.floorpilot.shared.config.FactoryConfig;
import com.floorpilot.shared.model.MachineStatus;
import com.floorpilot.simulation.model.DecisionState;
import com.floorpilot.simulation.model.FloorObservation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class StateEncoderTest {

    private FactoryConfig config;
    private StateEncoder encoder;

    @BeforeEach
    void setUp() {
        config = FactoryConfig.builder()
            .machineCount(2)
            .operatorCount(3)
            .machinePriorities(2, 0)
            .skillMatrix(new double[][] {{0.9, 0.1}, {0.5, 0.3}, {0.2, 0.7}})
            .dayLengthMinutes(400)
            .shiftCount(2)
            .baseProcessTimes(5, 5)
            .dailyTarget(9)
            .build();
        encoder = new StateEncoder(config);
    }

    private FloorObservation observation(int machine, double elapsed, int good) {
        return new FloorObservation(machine, elapsed, elapsed >= 200 ? 1 : 0, good,
            List.of(true, false, true), List.of(MachineStatus.IDLE, MachineStatus.BUSY));
    }

    @Test
    void test_encodes_awaiting_machine() {
        DecisionState state = encoder.encode(observation(0, 0, 0));
        assertEquals(0, state.machineId());
        assertEquals(2, state.priority());
        assertEquals(0b101, state.availabilityMask());
        assertEquals(List.of(2, 1, 0), state.skillBuckets());
        assertEquals(List.of(0, 1), state.machineStatuses());
        // 400 minutes remaining > 200
        assertEquals(3, state.timeBucket());
        // shortfall 9 > 6
        assertEquals(3, state.shortfallBucket());
    }

    @Test
    void test_boundary_values_fall_into_lower_bucket() {
        // 100 minutes remaining sits exactly on the D/4 cutoff
        DecisionState state = encoder.encode(observation(0, 300, 3));
        assertEquals(1, state.timeBucket());
        // shortfall 6 sits exactly on the 2T/3 cutoff
        assertEquals(2, state.shortfallBucket());
    }

    @Test
    void test_day_end_and_target_met_use_bucket_zero() {
        DecisionState state = encoder.encode(observation(0, 400, 12));
        assertEquals(0, state.timeBucket());
        assertEquals(0, state.shortfallBucket());
    }

    @Test
    void test_skill_cutoffs_are_closed_open() {
        assertEquals(0, encoder.skillBucket(0.29));
        assertEquals(1, encoder.skillBucket(0.3));
        assertEquals(1, encoder.skillBucket(0.69));
        assertEquals(2, encoder.skillBucket(0.7));
        assertTrue(encoder.isHighSkill(0.7));
        assertFalse(encoder.isHighSkill(0.69));
        assertTrue(encoder.isLowSkill(0.29));
        assertFalse(encoder.isLowSkill(0.3));
    }

    @Test
    void test_demo_operator_at_high_cutoff_counts_as_high_skill() {
        FactoryConfig demo = DemoScenarios.demoFactory();
        StateEncoder demoEncoder = new StateEncoder(demo);
        // operator 4 on the press machine has skill 0.70
        assertEquals(0.70, demo.skill(4, 0), 1e-9);
        assertTrue(demoEncoder.isHighSkill(demo.skill(4, 0)));
    }

    @Test
    void test_no_awaiting_machine_zeroes_machine_fields() {
        DecisionState state = encoder.encode(observation(DecisionState.NO_MACHINE, 10, 0));
        assertFalse(state.hasAwaitingMachine());
        assertEquals(0, state.priority());
        assertEquals(List.of(0, 0, 0), state.skillBuckets());
    }

    @Test
    void test_encoding_is_deterministic() {
        assertEquals(encoder.encode(observation(1, 50, 2)), encoder.encode(observation(1, 50, 2)));
    }

    @Test
    void test_observations_within_a_bucket_share_a_key() {
        assertEquals(encoder.encode(observation(0, 10, 0)), encoder.encode(observation(0, 20, 0)));
    }
}
