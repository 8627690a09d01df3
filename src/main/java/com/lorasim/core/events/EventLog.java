package com.lorasim.core.events;

import java.util.List;

/**
 * The canonical, ordered record of a simulation run.
 * <p>
 * Every appended event is rendered once and written to all sinks while holding
 * a single lock, so lines from concurrent reader threads never interleave and
 * every sink sees the same order.
 * <p>
 * Sinks are passed in explicitly; the log never rebinds {@code System.out}.
 */
public class EventLog implements AutoCloseable {

    private final List<LineSink> sinks;
    private final Object writeLock = new Object();

    public EventLog(List<? extends LineSink> sinks) {
        this.sinks = List.copyOf(sinks);
    }

    /**
     * Appends one event to every sink.
     *
     * @param event the event to record
     */
    public void append(SimulationEvent event) {
        String line = event.toLogLine();
        synchronized (writeLock) {
            for (LineSink sink : sinks) {
                sink.writeLine(line);
            }
        }
    }

    @Override
    public void close() {
        synchronized (writeLock) {
            for (LineSink sink : sinks) {
                sink.close();
            }
        }
    }
}
