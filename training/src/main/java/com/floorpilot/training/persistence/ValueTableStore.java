package com.floorpilot.training.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.floorpilot.agent.table.ValueTableView;
import com.floorpilot.simulation.model.DecisionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Saves and restores learned action values as JSON.
 *
 * The file holds the action count and a list of {@code {state, values}}
 * entries, since decision states are structured and cannot be JSON map keys.
 */
@Component
public class ValueTableStore {

    private static final Logger log = LoggerFactory.getLogger(ValueTableStore.class);

    private final ObjectMapper objectMapper;

    public ValueTableStore(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void save(ValueTableView table, Path path) {
        List<Entry> entries = new ArrayList<>(table.size());
        table.snapshot().forEach((state, values) -> entries.add(new Entry(state, values)));
        try {
            createParent(path);
            objectMapper.writerWithDefaultPrettyPrinter()
                .writeValue(path.toFile(), new TableFile(table.actionCount(), entries));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to save value table to " + path, e);
        }
        log.info("Saved {} states to {}", entries.size(), path);
    }

    /**
     * @return the stored entries, or empty if no file exists at {@code path}
     * @throws IllegalStateException if the file was written for a different action count
     */
    public Optional<Map<DecisionState, double[]>> load(Path path, int expectedActionCount) {
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        TableFile file;
        try {
            file = objectMapper.readValue(path.toFile(), new TypeReference<TableFile>() {});
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read value table from " + path, e);
        }
        if (file.actionCount() != expectedActionCount) {
            throw new IllegalStateException("Value table at " + path + " has " + file.actionCount()
                + " actions, expected " + expectedActionCount);
        }
        Map<DecisionState, double[]> entries = new LinkedHashMap<>();
        for (Entry entry : file.entries()) {
            entries.put(entry.state(), entry.values());
        }
        log.debug("Read {} states from {}", entries.size(), path);
        return Optional.of(entries);
    }

    static void createParent(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }

    record TableFile(int actionCount, List<Entry> entries) {
    }

    record Entry(DecisionState state, double[] values) {
    }
}
