package com.lorasim.core.routing;

import com.lorasim.core.events.EventLog;
import com.lorasim.core.events.SimulationClock;
import com.lorasim.core.events.SimulationEvent;
import com.lorasim.node.NodeHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Fetches a node's state after it received a forwarded packet and logs it as a
 * {@code state} record, for live monitoring.
 * <p>
 * Queries run on one background worker so a delivering reader thread never waits
 * on another node's answer. At most one probe per node is pending at a time;
 * further requests for that node are dropped until it runs.
 */
public class StateProbe implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(StateProbe.class);

    private final Duration timeout;
    private final SimulationClock clock;
    private final EventLog eventLog;
    private final ExecutorService executor;
    private final Set<String> pending = ConcurrentHashMap.newKeySet();

    public StateProbe(Duration timeout, SimulationClock clock, EventLog eventLog) {
        this(timeout, clock, eventLog, Executors.newSingleThreadExecutor(r -> {
            var thread = new Thread(r, "state-probe");
            thread.setDaemon(true);
            return thread;
        }));
    }

    StateProbe(Duration timeout, SimulationClock clock, EventLog eventLog, ExecutorService executor) {
        this.timeout = timeout;
        this.clock = clock;
        this.eventLog = eventLog;
        this.executor = executor;
    }

    /**
     * Schedules a state query for {@code node} unless one is already pending.
     */
    public void request(NodeHandle node) {
        if (!pending.add(node.name())) {
            return;
        }
        try {
            executor.execute(() -> {
                pending.remove(node.name());
                node.queryState(timeout).ifPresent(response ->
                        eventLog.append(SimulationEvent.state(clock.elapsedSeconds(), node.name(), response)));
            });
        } catch (RejectedExecutionException e) {
            pending.remove(node.name());
            log.debug("State probe for {} rejected, probe is shut down", node.name());
        }
    }

    /**
     * Stops accepting probes and waits up to {@code grace} for the running one.
     */
    public void shutdown(Duration grace) {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("State probe did not finish within {}ms", grace.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        shutdown(timeout);
    }
}
