package com.lorasim.core.events;

import java.time.Duration;

/**
 * Monotonic elapsed-time source anchored at simulation start. Every component
 * of one run shares the same instance so log timestamps are comparable.
 */
public final class SimulationClock {

    private final long startNanos;

    private SimulationClock(long startNanos) {
        this.startNanos = startNanos;
    }

    public static SimulationClock startingNow() {
        return new SimulationClock(System.nanoTime());
    }

    public Duration elapsed() {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    public double elapsedSeconds() {
        return (System.nanoTime() - startNanos) / 1_000_000_000.0;
    }

    /**
     * Time remaining until the logical {@code timestampSeconds}; negative when it has passed.
     */
    public Duration until(double timestampSeconds) {
        long targetNanos = (long) (timestampSeconds * 1_000_000_000L);
        return Duration.ofNanos(targetNanos - (System.nanoTime() - startNanos));
    }
}
