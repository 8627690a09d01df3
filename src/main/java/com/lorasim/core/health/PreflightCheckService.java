package com.lorasim.core.health;

import com.lorasim.core.timeline.Timeline;
import com.lorasim.core.timeline.TimelineException;
import com.lorasim.core.timeline.TimelineParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Checks that a run can start: the node program, the output directory and the timeline.
 */
@Service
public class PreflightCheckService {

    private static final Logger log = LoggerFactory.getLogger(PreflightCheckService.class);

    private final TimelineParser timelineParser;

    public PreflightCheckService(TimelineParser timelineParser) {
        this.timelineParser = timelineParser;
    }

    public List<PreflightResult> checkAll(Path executable, Path outdir, Path input, List<String> nodeNames) {
        var results = new ArrayList<PreflightResult>();
        results.add(checkExecutable(executable));
        results.add(checkOutdir(outdir));
        results.add(checkTimeline(input, nodeNames));
        return results;
    }

    PreflightResult checkExecutable(Path executable) {
        if (!Files.exists(executable)) {
            return PreflightResult.down("executable", "Node program not found: " + executable);
        }
        if (Files.isDirectory(executable) || !Files.isExecutable(executable)) {
            return PreflightResult.down("executable", "Node program is not executable: " + executable);
        }
        return PreflightResult.up("executable", "Node program " + executable);
    }

    PreflightResult checkOutdir(Path outdir) {
        if (Files.isDirectory(outdir)) {
            return Files.isWritable(outdir)
                    ? PreflightResult.up("outdir", "Output directory " + outdir + " is writable")
                    : PreflightResult.down("outdir", "Output directory " + outdir + " is not writable");
        }
        if (Files.exists(outdir)) {
            return PreflightResult.down("outdir", outdir + " exists and is not a directory");
        }
        Path parent = nearestExistingAncestor(outdir.toAbsolutePath());
        if (parent != null && Files.isDirectory(parent) && Files.isWritable(parent)) {
            return PreflightResult.up("outdir", "Output directory " + outdir + " will be created");
        }
        return PreflightResult.down("outdir", "Output directory " + outdir + " cannot be created");
    }

    /**
     * Malformed lines and destinations outside {@code nodeNames} degrade the check;
     * each one is listed as a finding.
     */
    PreflightResult checkTimeline(Path input, List<String> nodeNames) {
        Timeline timeline;
        try {
            timeline = timelineParser.load(input);
        } catch (TimelineException e) {
            log.warn("Timeline check failed: {}", e.getMessage());
            return PreflightResult.down("timeline", e.getMessage());
        }

        var unknown = new LinkedHashSet<>(timeline.destinations());
        unknown.removeAll(nodeNames);
        if (timeline.skippedLines().isEmpty() && unknown.isEmpty()) {
            return PreflightResult.up("timeline",
                    timeline.size() + " events, last at " + timeline.lastTimestamp() + "s");
        }

        var findings = new ArrayList<String>();
        for (Timeline.SkippedLine skipped : timeline.skippedLines()) {
            findings.add("line " + skipped.lineNumber() + ": " + skipped.reason());
        }
        for (String destination : unknown) {
            findings.add("unknown destination " + destination);
        }
        return PreflightResult.degraded("timeline",
                timeline.size() + " events, " + timeline.skippedLines().size() + " malformed lines, "
                        + unknown.size() + " unknown destinations",
                findings);
    }

    private static Path nearestExistingAncestor(Path path) {
        Path current = path.getParent();
        while (current != null && !Files.exists(current)) {
            current = current.getParent();
        }
        return current;
    }
}
