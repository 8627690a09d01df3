package com.lorasim.core.events;

import java.io.Closeable;

/**
 * Destination for newline-terminated log lines. Implementations flush every
 * line so the output can be tailed while the run is in progress.
 */
public interface LineSink extends Closeable {

    /**
     * Writes one line; the sink appends the line terminator.
     */
    void writeLine(String line);

    @Override
    void close();
}
