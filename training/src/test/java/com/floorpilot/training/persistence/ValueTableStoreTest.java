package com.floorpilot.training.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.floorpilot.agent.QLearningAgent;
import com.floorpilot.agent.schedule.LearningSchedule;
import com.floorpilot.simulation.model.DecisionState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class ValueTableStoreTest {

    @TempDir
    Path tempDir;

    private ValueTableStore store;
    private QLearningAgent agent;

    private static final DecisionState AWAITING =
        new DecisionState(2, 1, 1, 3, 2, 0b101, List.of(2, 0, 1), List.of(1, 0, 0, 3));
    private static final DecisionState NOTHING_AWAITS =
        new DecisionState(DecisionState.NO_MACHINE, 0, 2, 0, 0, 0, List.of(0, 0, 0), List.of(1, 1, 2, 1));

    @BeforeEach
    void setUp() {
        store = new ValueTableStore(new ObjectMapper());
        agent = new QLearningAgent(4, LearningSchedule.fixed(0.9, 0.0, 1.0), 1L);
        agent.update(AWAITING, 1, 7.5, AWAITING, true);
        agent.update(NOTHING_AWAITS, 3, -2.25, NOTHING_AWAITS, true);
    }

    @Test
    void test_saved_table_restores_into_fresh_agent() {
        Path path = tempDir.resolve("nested").resolve("q_table.json");
        store.save(agent.valueTable(), path);
        assertTrue(Files.exists(path));

        Map<DecisionState, double[]> loaded = store.load(path, 4).orElseThrow();
        QLearningAgent restored = new QLearningAgent(4, LearningSchedule.fixed(0.9, 0.0, 0.1), 2L);
        restored.restore(loaded);

        assertEquals(2, restored.valueTable().size());
        assertArrayEquals(new double[] {0, 7.5, 0, 0}, restored.valueTable().values(AWAITING), 1e-12);
        assertArrayEquals(new double[] {0, 0, 0, -2.25}, restored.valueTable().values(NOTHING_AWAITS), 1e-12);
        assertEquals(1, restored.selectAction(AWAITING, true));
    }

    @Test
    void test_missing_file_is_empty() {
        assertEquals(Optional.empty(), store.load(tempDir.resolve("absent.json"), 4));
    }

    @Test
    void test_action_count_mismatch_rejected() {
        Path path = tempDir.resolve("q_table.json");
        store.save(agent.valueTable(), path);
        assertThrows(IllegalStateException.class, () -> store.load(path, 7));
    }

    @Test
    void test_corrupt_file_reported() throws Exception {
        Path path = tempDir.resolve("q_table.json");
        Files.writeString(path, "{not json");
        assertThrows(UncheckedIOException.class, () -> store.load(path, 4));
    }
}
