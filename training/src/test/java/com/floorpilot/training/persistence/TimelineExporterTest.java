package com.floorpilot.training.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.floorpilot.shared.config.DemoScenarios;
import com.floorpilot.shared.config.FactoryConfig;
import com.floorpilot.simulation.service.FactoryEnvironment;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class TimelineExporterTest {

    @TempDir
    Path tempDir;

    @Test
    void test_exports_recorded_frames() throws Exception {
        FactoryConfig config = DemoScenarios.singleStation(1.0, 10.0, 5.0, 1);
        FactoryEnvironment env = new FactoryEnvironment(config, 1L);
        env.reset(true);
        env.step(0);
        env.step(0);

        ObjectMapper mapper = new ObjectMapper();
        Path path = tempDir.resolve("timeline.json");
        new TimelineExporter(mapper).export("station day", config, env.history(), path);

        JsonNode root = mapper.readTree(path.toFile());
        assertEquals("station day", root.get("title").asText());
        assertEquals("station", root.get("machines").get(0).asText());
        assertEquals(env.history().size(), root.get("frames").size());
        JsonNode first = root.get("frames").get(0);
        assertEquals(0.0, first.get("timeMinutes").asDouble(), 1e-9);
        assertEquals("IDLE", first.get("machineStatuses").get(0).asText());
        JsonNode last = root.get("frames").get(root.get("frames").size() - 1);
        assertEquals(1, last.get("goodParts").asInt());
    }
}
