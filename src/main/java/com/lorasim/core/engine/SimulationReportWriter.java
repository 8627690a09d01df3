package com.lorasim.core.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.lorasim.core.model.NodeEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes the final report of a run as JSON next to the event log.
 */
@Component
public class SimulationReportWriter {

    private static final Logger log = LoggerFactory.getLogger(SimulationReportWriter.class);

    private final ObjectMapper objectMapper;

    public SimulationReportWriter() {
        this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public ObjectNode toJson(SimulationReport report) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("stopReason", report.stopReason().name());
        root.put("elapsedSeconds", report.elapsed().toMillis() / 1000.0);
        root.put("eventsApplied", report.eventsApplied());
        ArrayNode unknown = root.putArray("unknownDestinations");
        report.unknownDestinations().stream().sorted().forEach(unknown::add);

        ArrayNode nodes = root.putArray("nodes");
        for (NodeReport node : report.nodes()) {
            ObjectNode n = nodes.addObject();
            n.put("name", node.name());
            n.put("configured", node.configured());
            n.put("spawned", node.spawned());
            n.put("responded", node.responded());
            if (node.responded()) {
                n.put("uptimeMs", node.state().uptimeMs());
                ArrayNode entries = n.putArray("entries");
                for (NodeEntry entry : node.state().entries()) {
                    entries.addObject()
                            .put("name", entry.name())
                            .put("timestamp", entry.timestamp())
                            .put("latitude", entry.latitude())
                            .put("longitude", entry.longitude());
                }
            }
        }
        return root;
    }

    /**
     * Writes {@code final_states.json} into {@code outdir}. Failures are logged; the
     * report on the console is the primary summary.
     *
     * @return the written file, or {@code null} if writing failed
     */
    public Path write(SimulationReport report, Path outdir) {
        Path target = outdir.resolve(SimulationPlan.REPORT_FILE);
        try {
            Files.createDirectories(outdir);
            objectMapper.writeValue(target.toFile(), toJson(report));
            log.info("Final report written to {}", target);
            return target;
        } catch (IOException e) {
            log.error("Could not write final report to {}: {}", target, e.getMessage(), e);
            return null;
        }
    }
}
