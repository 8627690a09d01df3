package com.lorasim.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lorasim.core.model.NodeState;
import com.lorasim.core.scheduler.StopSignal;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SimulationReportWriterTest {

    private final SimulationReportWriter writer = new SimulationReportWriter();

    private static SimulationReport report(Path outdir) {
        return new SimulationReport(
                Duration.ofMillis(12_500),
                StopSignal.Reason.DURATION_ELAPSED,
                List.of(
                        NodeReport.answered("ND01", NodeState.parse("get_state,900,ND02,5,48.1,11.5")),
                        NodeReport.noResponse("ND02"),
                        NodeReport.unknown("ND09")),
                Set.of("ND09"),
                7,
                outdir.resolve("sim_output.log"));
    }

    @Test
    void writesFinalStatesJson(@TempDir Path outdir) throws Exception {
        Path written = writer.write(report(outdir), outdir);

        assertEquals(outdir.resolve("final_states.json"), written);
        JsonNode json = new ObjectMapper().readTree(written.toFile());
        assertEquals("DURATION_ELAPSED", json.get("stopReason").asText());
        assertEquals(12.5, json.get("elapsedSeconds").asDouble());
        assertEquals(7, json.get("eventsApplied").asInt());
        assertEquals("ND09", json.get("unknownDestinations").get(0).asText());

        JsonNode nodes = json.get("nodes");
        assertEquals(3, nodes.size());
        JsonNode first = nodes.get(0);
        assertTrue(first.get("responded").asBoolean());
        assertEquals("900", first.get("uptimeMs").asText());
        assertEquals("ND02", first.get("entries").get(0).get("name").asText());
        assertEquals("48.1", first.get("entries").get(0).get("latitude").asText());

        JsonNode silent = nodes.get(1);
        assertFalse(silent.get("responded").asBoolean());
        assertFalse(silent.has("entries"));
        assertFalse(nodes.get(2).get("configured").asBoolean());
    }

    @Test
    void unwritableTargetReturnsNull(@TempDir Path outdir) throws Exception {
        Path blocker = outdir.resolve("not-a-dir");
        java.nio.file.Files.writeString(blocker, "x");

        assertNull(writer.write(report(outdir), blocker));
    }
}
