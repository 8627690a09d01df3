package com.lorasim.core.events;

import java.io.PrintStream;

/**
 * Writes lines to a {@link PrintStream}, typically the console.
 * The wrapped stream is flushed but left open on {@link #close()}.
 */
public class PrintStreamLineSink implements LineSink {

    private final PrintStream out;

    public PrintStreamLineSink(PrintStream out) {
        this.out = out;
    }

    @Override
    public synchronized void writeLine(String line) {
        out.println(line);
        out.flush();
    }

    @Override
    public synchronized void close() {
        out.flush();
    }
}
