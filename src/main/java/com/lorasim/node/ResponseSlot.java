package com.lorasim.node;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single-slot mailbox holding the most recent unconsumed response line.
 * <p>
 * Contract: "latest, not history". {@link #offer} overwrites whatever is in the
 * slot; {@link #poll} takes the value and empties the slot. A new query calls
 * {@link #clear()} first so it never sees an answer to an earlier request.
 */
public class ResponseSlot {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition filled = lock.newCondition();
    private String value;

    /**
     * Stores {@code line}, replacing any unconsumed value.
     */
    public void offer(String line) {
        lock.lock();
        try {
            value = line;
            filled.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            value = null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits up to {@code timeout} for a value and takes it.
     *
     * @return the value, or empty when the timeout elapsed first
     */
    public Optional<String> poll(Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        lock.lock();
        try {
            while (value == null) {
                if (remaining <= 0) {
                    return Optional.empty();
                }
                remaining = filled.awaitNanos(remaining);
            }
            String taken = value;
            value = null;
            return Optional.of(taken);
        } finally {
            lock.unlock();
        }
    }
}
