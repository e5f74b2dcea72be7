package com.floorpilot.shared.model;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class PriorityClassTest {

    @Test
    void test_from_level_round_trips() {
        for (PriorityClass priority : PriorityClass.values()) {
            assertEquals(priority, PriorityClass.fromLevel(priority.level()));
        }
    }

    @Test
    void test_unknown_level_rejected() {
        assertThrows(IllegalArgumentException.class, () -> PriorityClass.fromLevel(7));
    }

    @Test
    void test_only_idle_machines_are_assignable() {
        assertTrue(MachineStatus.IDLE.isAssignable());
        assertFalse(MachineStatus.BUSY.isAssignable());
        assertTrue(MachineStatus.BROKEN.isDown());
        assertTrue(MachineStatus.MAINTENANCE.isDown());
        assertFalse(MachineStatus.IDLE.isDown());
        assertEquals(4, MachineStatus.codeCount());
    }
}
