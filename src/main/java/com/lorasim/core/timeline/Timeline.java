package com.lorasim.core.timeline;

import com.lorasim.core.model.TimelineEvent;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Time-ordered list of timeline events, plus the lines that were skipped while loading.
 * <p>
 * Events are stable-sorted by timestamp on construction, so equal timestamps
 * keep their input order.
 */
public record Timeline(
    List<TimelineEvent> events,
    List<SkippedLine> skippedLines
) {

    /**
     * A source line that could not be turned into an event.
     */
    public record SkippedLine(int lineNumber, String content, String reason) {}

    public Timeline {
        var sorted = new ArrayList<>(events);
        sorted.sort(Comparator.comparingDouble(TimelineEvent::timestamp));
        events = List.copyOf(sorted);
        skippedLines = List.copyOf(skippedLines);
    }

    public static Timeline of(List<TimelineEvent> events) {
        return new Timeline(events, List.of());
    }

    public static Timeline empty() {
        return new Timeline(List.of(), List.of());
    }

    /**
     * Node destinations referenced by the timeline, in first-appearance order
     * (connectivity updates excluded).
     */
    public Set<String> destinations() {
        var names = new LinkedHashSet<String>();
        for (TimelineEvent event : events) {
            if (!event.isConnectivityUpdate()) {
                names.add(event.destination());
            }
        }
        return names;
    }

    public double lastTimestamp() {
        return events.isEmpty() ? 0.0 : events.get(events.size() - 1).timestamp();
    }

    public int size() {
        return events.size();
    }
}
