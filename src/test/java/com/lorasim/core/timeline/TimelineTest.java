package com.lorasim.core.timeline;

import com.lorasim.core.model.TimelineEvent;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TimelineTest {

    @Test
    void ofSortsEvents() {
        var timeline = Timeline.of(List.of(
                new TimelineEvent(2, "A", "x"),
                new TimelineEvent(1, "B", "y")));

        assertEquals(List.of(1.0, 2.0), timeline.events().stream().map(TimelineEvent::timestamp).toList());
        assertEquals(2.0, timeline.lastTimestamp());
    }

    @Test
    void destinationsInFirstAppearanceOrderWithoutConnectivity() {
        var timeline = Timeline.of(List.of(
                new TimelineEvent(1, "B", "x"),
                new TimelineEvent(2, "-1", "0000"),
                new TimelineEvent(3, "A", "y"),
                new TimelineEvent(4, "B", "z")));

        assertEquals(List.of("B", "A"), List.copyOf(timeline.destinations()));
    }

    @Test
    void emptyTimeline() {
        var timeline = Timeline.empty();
        assertEquals(0, timeline.size());
        assertEquals(0.0, timeline.lastTimestamp());
    }
}
