package com.lorasim.core.timeline;

import com.lorasim.core.model.TimelineEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the authored timeline format: one event per line,
 * {@code <timestamp>,<destination|-1>,<payload>}.
 * <p>
 * {@code #} starts a comment anywhere on a line. Blank and comment-only lines are
 * ignored. The payload is everything after the second comma, so node commands
 * keep their own commas. Malformed lines are logged with their line number and
 * skipped.
 */
@Component
public class TimelineParser {

    private static final Logger log = LoggerFactory.getLogger(TimelineParser.class);

    /**
     * Loads and sorts a timeline file.
     *
     * @throws TimelineException if the file cannot be read
     */
    public Timeline load(Path path) {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            Timeline timeline = parse(reader);
            log.info("Loaded {} timeline events from {} ({} lines skipped)",
                    timeline.size(), path, timeline.skippedLines().size());
            return timeline;
        } catch (IOException e) {
            throw new TimelineException("Cannot read timeline " + path + ": " + e.getMessage(), e);
        }
    }

    public Timeline parse(String text) {
        try {
            return parse(new StringReader(text));
        } catch (IOException e) {
            throw new TimelineException("Cannot read timeline text", e);
        }
    }

    public Timeline parse(Reader input) throws IOException {
        var events = new ArrayList<TimelineEvent>();
        var skipped = new ArrayList<Timeline.SkippedLine>();
        BufferedReader reader = input instanceof BufferedReader br ? br : new BufferedReader(input);

        String raw;
        int lineNumber = 0;
        while ((raw = reader.readLine()) != null) {
            lineNumber++;
            String line = stripComment(raw).trim();
            if (line.isEmpty()) {
                continue;
            }
            String[] parts = line.split(",", 3);
            if (parts.length < 3) {
                skip(skipped, lineNumber, line, "expected <timestamp>,<destination>,<payload>");
                continue;
            }
            double timestamp;
            try {
                timestamp = Double.parseDouble(parts[0].trim());
            } catch (NumberFormatException e) {
                skip(skipped, lineNumber, line, "invalid timestamp '" + parts[0] + "'");
                continue;
            }
            if (timestamp < 0 || Double.isNaN(timestamp) || Double.isInfinite(timestamp)) {
                skip(skipped, lineNumber, line, "timestamp must be a finite value >= 0");
                continue;
            }
            String destination = parts[1].trim();
            if (destination.isEmpty()) {
                skip(skipped, lineNumber, line, "empty destination");
                continue;
            }
            events.add(new TimelineEvent(timestamp, destination, parts[2].trim(), lineNumber));
        }
        return new Timeline(events, skipped);
    }

    private static String stripComment(String raw) {
        int hash = raw.indexOf('#');
        return hash >= 0 ? raw.substring(0, hash) : raw;
    }

    private static void skip(List<Timeline.SkippedLine> skipped, int lineNumber, String line, String reason) {
        log.warn("Skipping timeline line {}: {} ({})", lineNumber, reason, line);
        skipped.add(new Timeline.SkippedLine(lineNumber, line, reason));
    }
}
