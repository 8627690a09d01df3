package com.lorasim.core.scheduler;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Run-wide stop flag. Set once; the first reason wins and later calls are ignored.
 * Waiters wake as soon as it is set.
 */
public class StopSignal {

    public enum Reason {
        DURATION_ELAPSED,
        OPERATOR_CANCEL,
        INTERRUPTED,
        TIMELINE_COMPLETE
    }

    private final CountDownLatch latch = new CountDownLatch(1);
    private final AtomicReference<Reason> reason = new AtomicReference<>();

    /**
     * @return {@code true} if this call set the signal
     */
    public boolean stop(Reason why) {
        if (reason.compareAndSet(null, why)) {
            latch.countDown();
            return true;
        }
        return false;
    }

    public boolean isStopped() {
        return latch.getCount() == 0;
    }

    public Optional<Reason> reason() {
        return Optional.ofNullable(reason.get());
    }

    /**
     * Waits up to {@code timeout} for the signal.
     *
     * @return {@code true} if the signal is set
     */
    public boolean awaitStop(Duration timeout) throws InterruptedException {
        return latch.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    public void awaitStop() throws InterruptedException {
        latch.await();
    }
}
