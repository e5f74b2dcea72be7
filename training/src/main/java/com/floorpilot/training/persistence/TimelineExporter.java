package com.floorpilot.training.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.floorpilot.shared.config.FactoryConfig;
import com.floorpilot.simulation.model.FloorSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes a recorded episode timeline as JSON for offline plotting.
 */
@Component
public class TimelineExporter {

    private static final Logger log = LoggerFactory.getLogger(TimelineExporter.class);

    private final ObjectMapper objectMapper;

    public TimelineExporter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void export(String title, FactoryConfig config, List<FloorSnapshot> frames, Path path) {
        List<String> machines = new ArrayList<>(config.machineCount());
        for (int m = 0; m < config.machineCount(); m++) {
            machines.add(config.machineTypeName(m));
        }
        Timeline timeline = new Timeline(title, config.dayLengthMinutes(), config.shiftCount(),
            config.dailyTarget(), machines, frames);
        try {
            ValueTableStore.createParent(path);
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), timeline);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write timeline to " + path, e);
        }
        log.info("Wrote {} timeline frames to {}", frames.size(), path);
    }

    record Timeline(String title, double dayLengthMinutes, int shiftCount, int dailyTarget,
                    List<String> machines, List<FloorSnapshot> frames) {
    }
}
