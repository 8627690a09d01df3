package com.lorasim.core.scheduler;

import com.lorasim.core.events.EventLog;
import com.lorasim.core.events.SimulationClock;
import com.lorasim.core.events.SimulationEvent;
import com.lorasim.core.metrics.SimulationMetrics;
import com.lorasim.core.model.TimelineEvent;
import com.lorasim.core.routing.ConnectivityRouter;
import com.lorasim.core.timeline.Timeline;
import com.lorasim.node.NodeHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Walks a timeline in timestamp order on its own thread, sleeping until each
 * event's logical time, and applies it either as a connectivity replacement or
 * as a command to one node.
 * <p>
 * A late event fires immediately: order is preserved, wall-clock fidelity is not.
 * Sleeps wait on the {@link StopSignal}, so a stop is observed without polling
 * and no further events are applied after it.
 */
public class EventScheduler implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(EventScheduler.class);

    private final Timeline timeline;
    private final ConnectivityRouter router;
    private final SimulationClock clock;
    private final EventLog eventLog;
    private final StopSignal stopSignal;
    private final SimulationMetrics metrics;

    private final Set<String> unknownDestinations = new LinkedHashSet<>();
    private final AtomicInteger applied = new AtomicInteger();
    private final CountDownLatch finished = new CountDownLatch(1);
    private volatile Runnable onTimelineComplete = () -> {};
    private Thread thread;

    /**
     * @param metrics optional metrics, may be {@code null}
     */
    public EventScheduler(Timeline timeline, ConnectivityRouter router, SimulationClock clock,
                          EventLog eventLog, StopSignal stopSignal, SimulationMetrics metrics) {
        this.timeline = timeline;
        this.router = router;
        this.clock = clock;
        this.eventLog = eventLog;
        this.stopSignal = stopSignal;
        this.metrics = metrics;
    }

    /**
     * Callback run once every event has been applied (not when stopped early).
     */
    public void onTimelineComplete(Runnable callback) {
        this.onTimelineComplete = callback;
    }

    public synchronized void start() {
        if (thread != null) {
            throw new IllegalStateException("Scheduler already started");
        }
        thread = new Thread(this, "event-scheduler");
        thread.setDaemon(true);
        thread.start();
    }

    public synchronized boolean isStarted() {
        return thread != null;
    }

    @Override
    public void run() {
        boolean completed = false;
        try {
            for (TimelineEvent event : timeline.events()) {
                if (stopSignal.isStopped()) {
                    break;
                }
                Duration wait = clock.until(event.timestamp());
                if (!wait.isNegative() && !wait.isZero() && stopSignal.awaitStop(wait)) {
                    break;
                }
                apply(event);
            }
            completed = !stopSignal.isStopped();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Scheduler interrupted after {} events", applied.get());
        } finally {
            finished.countDown();
        }
        if (completed) {
            log.info("Timeline complete: {} events applied", applied.get());
            onTimelineComplete.run();
        }
    }

    void apply(TimelineEvent event) {
        applied.incrementAndGet();
        if (event.isConnectivityUpdate()) {
            router.updateConnectivity(event.payload(), event.timestamp());
            return;
        }
        Optional<NodeHandle> target = router.node(event.destination());
        if (target.isEmpty()) {
            log.warn("Unknown destination '{}' at ts {} (timeline line {})",
                    event.destination(), SimulationEvent.formatSeconds(event.timestamp()), event.lineNumber());
            synchronized (unknownDestinations) {
                unknownDestinations.add(event.destination());
            }
            if (metrics != null) {
                metrics.recordUnknownDestination();
            }
            return;
        }
        target.get().send(event.payload());
        eventLog.append(SimulationEvent.sendCommand(event.timestamp(), event.destination(), event.payload()));
    }

    /**
     * Waits for the scheduler thread to finish.
     *
     * @return {@code true} if it finished within {@code timeout}
     */
    public boolean awaitFinished(Duration timeout) throws InterruptedException {
        return finished.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    /**
     * Destinations addressed by the timeline that had no running node when their event fired.
     */
    public Set<String> unknownDestinations() {
        synchronized (unknownDestinations) {
            return new LinkedHashSet<>(unknownDestinations);
        }
    }

    public int appliedCount() {
        return applied.get();
    }
}
