package com.lorasim.core.events;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * In-memory {@link LineSink} for tests; lines can be awaited from other threads.
 */
public class RecordingSink implements LineSink {

    private final List<String> lines = new ArrayList<>();
    private boolean closed;

    @Override
    public synchronized void writeLine(String line) {
        lines.add(line);
        notifyAll();
    }

    @Override
    public synchronized void close() {
        closed = true;
    }

    public synchronized List<String> lines() {
        return List.copyOf(lines);
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    /**
     * Lines whose second field (the record kind) equals {@code kind}.
     */
    public List<String> linesOfKind(String kind) {
        return lines().stream()
                .filter(line -> {
                    String[] parts = line.split(",", 3);
                    return parts.length > 1 && parts[1].equals(kind);
                })
                .toList();
    }

    /**
     * Waits until a line matching {@code predicate} has been written.
     *
     * @return the first matching line, or {@code null} on timeout
     */
    public synchronized String awaitLine(Predicate<String> predicate, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            for (String line : lines) {
                if (predicate.test(line)) {
                    return line;
                }
            }
            long remainingMs = (deadline - System.nanoTime()) / 1_000_000;
            if (remainingMs <= 0) {
                return null;
            }
            wait(remainingMs);
        }
    }
}
