package com.floorpilot.simulation.model;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class OperatorTest {

    @Test
    void test_operator_binds_to_one_machine_at_a_time() {
        Operator operator = new Operator(0, 1);
        operator.bind(3);
        assertFalse(operator.isFree());
        assertEquals(3, operator.machineId());
        assertThrows(IllegalStateException.class, () -> operator.bind(1));
        operator.release();
        assertTrue(operator.isFree());
    }

    @Test
    void test_busy_minutes_per_shift() {
        Operator operator = new Operator(0, 2);
        operator.addBusyMinutes(new double[] {10, 5});
        operator.addBusyMinutes(new double[] {0, 5});
        assertEquals(10.0, operator.busyMinutes(0), 1e-9);
        assertEquals(10.0, operator.busyMinutes(1), 1e-9);
        operator.reset();
        assertEquals(0.0, operator.busyMinutes(1), 1e-9);
    }

    @Test
    void test_production_target_tracks_shortfall() {
        ProductionTarget target = new ProductionTarget(3);
        target.recordGood();
        target.recordDefective();
        assertEquals(2, target.shortfall());
        assertFalse(target.isMet());
        target.recordGood();
        target.recordGood();
        assertTrue(target.isMet());
        assertEquals(0, target.shortfall());
    }

    @Test
    void test_milestones_pass_once_per_episode() {
        ProductionTarget target = new ProductionTarget(5);
        target.recordGood();
        target.recordGood();
        assertFalse(target.passHalfway());
        target.recordGood();
        assertTrue(target.passHalfway());
        assertFalse(target.passHalfway());
        assertFalse(target.passEightyPercent());
        target.recordGood();
        assertTrue(target.passEightyPercent());
        assertFalse(target.passEightyPercent());

        target.reset();
        for (int i = 0; i < 5; i++) {
            target.recordGood();
        }
        assertTrue(target.passHalfway());
        assertTrue(target.passEightyPercent());
    }
}
