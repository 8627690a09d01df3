package com.lorasim.node;

import com.lorasim.core.events.LineSink;
import com.lorasim.core.events.SimulationEvent;
import com.lorasim.core.logging.MdcContext;
import com.lorasim.core.model.NodeState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Owns one node process and multiplexes its stdout into push events and query responses.
 *
 * <p>Threads:
 * <ul>
 *   <li>a stdout reader that timestamps every line into the node's stdout log, turns
 *       {@code transmit_packet} lines into {@code tx} records handed to the
 *       {@link PacketListener}, and offers every other line to the {@link ResponseSlot}</li>
 *   <li>a stderr reader that timestamps every line into the node's stderr log</li>
 * </ul>
 *
 * <p>Writes to stdin are serialised by a per-node lock, so concurrent senders never
 * interleave partial lines. State queries are serialised by a second per-node lock
 * that covers the whole clear/send/wait exchange.
 */
public class NodeSupervisor implements NodeHandle, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(NodeSupervisor.class);

    private final String name;
    private final Process process;
    private final LineSink stdoutLog;
    private final LineSink stderrLog;
    private final SupervisorContext context;

    private final Writer stdin;
    private final Object stdinLock = new Object();
    private final ReentrantLock queryLock = new ReentrantLock();
    private final ResponseSlot responses = new ResponseSlot();

    private Thread stdoutReader;
    private Thread stderrReader;
    private volatile boolean terminated;

    NodeSupervisor(String name, Process process, LineSink stdoutLog, LineSink stderrLog,
                   SupervisorContext context) {
        this.name = name;
        this.process = process;
        this.stdoutLog = stdoutLog;
        this.stderrLog = stderrLog;
        this.context = context;
        this.stdin = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));
    }

    /**
     * Wraps a started process and launches its background readers.
     *
     * @param name      node name, used in log records and thread names
     * @param process   the running node program
     * @param stdoutLog receives {@code <ts>,<line>} for every stdout line
     * @param stderrLog receives {@code <ts>,<line>} for every stderr line
     * @param context   run-wide collaborators
     */
    public static NodeSupervisor start(String name, Process process, LineSink stdoutLog, LineSink stderrLog,
                                       SupervisorContext context) {
        var supervisor = new NodeSupervisor(name, process, stdoutLog, stderrLog, context);
        supervisor.startReaders();
        return supervisor;
    }

    private void startReaders() {
        stdoutReader = readerThread("stdout", process.getInputStream(), this::handleStdoutLine);
        stderrReader = readerThread("stderr", process.getErrorStream(), this::handleStderrLine);
        stdoutReader.start();
        stderrReader.start();
    }

    private Thread readerThread(String stream, InputStream input, Consumer<String> handler) {
        var thread = new Thread(() -> {
            MdcContext.setNode(name);
            try (var reader = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    handler.accept(line);
                }
                log.debug("Node {} closed {}", name, stream);
            } catch (IOException e) {
                if (!terminated) {
                    log.warn("Reading {} of node {} failed: {}", stream, name, e.getMessage());
                }
            } finally {
                MdcContext.clear();
            }
        }, "node-" + name + "-" + stream);
        thread.setDaemon(true);
        return thread;
    }

    void handleStdoutLine(String line) {
        stdoutLog.writeLine(SimulationEvent.formatSeconds(context.clock().elapsedSeconds()) + "," + line);

        NodeOutput output = NodeOutputParser.classify(line);
        if (output instanceof NodeOutput.TransmitPacket packet) {
            context.eventLog().append(SimulationEvent.tx(context.clock().elapsedSeconds(), name, packet.hexData()));
            if (context.metrics() != null) {
                context.metrics().recordTransmit(name);
            }
            try {
                context.packetListener().onTransmit(name, packet.hexData());
            } catch (RuntimeException e) {
                log.error("Fan-out of packet from {} failed: {}", name, e.getMessage(), e);
            }
        } else if (output instanceof NodeOutput.MalformedTransmit malformed) {
            log.warn("Node {} emitted malformed transmit line: {}", name, malformed.line());
        } else {
            responses.offer(line);
        }
    }

    void handleStderrLine(String line) {
        stderrLog.writeLine(SimulationEvent.formatSeconds(context.clock().elapsedSeconds()) + "," + line);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public void send(String commandLine) {
        synchronized (stdinLock) {
            try {
                stdin.write(commandLine);
                stdin.write('\n');
                stdin.flush();
            } catch (IOException e) {
                if (!terminated) {
                    log.warn("Could not send '{}' to node {}: {}", commandLine, name, e.getMessage());
                }
            }
        }
    }

    @Override
    public Optional<String> queryState(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        try {
            if (!queryLock.tryLock(timeout.toNanos(), TimeUnit.NANOSECONDS)) {
                log.warn("State query to {} timed out waiting for an earlier query", name);
                return recordQuery(Optional.empty());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
        try {
            responses.clear();
            send(NodeProtocol.GET_STATE);
            while (true) {
                long remaining = deadline - System.nanoTime();
                Optional<String> line = responses.poll(Duration.ofNanos(Math.max(remaining, 0)));
                if (line.isEmpty()) {
                    log.debug("No state response from {} within {}ms", name, timeout.toMillis());
                    return recordQuery(Optional.empty());
                }
                if (NodeState.isStateResponse(line.get())) {
                    return recordQuery(line);
                }
                log.debug("Ignoring non-state response from {} while querying: {}", name, line.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        } finally {
            queryLock.unlock();
        }
    }

    private Optional<String> recordQuery(Optional<String> result) {
        if (context.metrics() != null) {
            context.metrics().recordStateQuery(result.isPresent() ? "answered" : "timeout");
        }
        return result;
    }

    public boolean isAlive() {
        return process.isAlive();
    }

    @Override
    public void terminate() {
        terminated = true;
        try {
            process.destroy();
        } catch (Exception e) {
            log.debug("Terminating node {} failed (already gone?): {}", name, e.getMessage());
        }
    }

    /**
     * Terminates the process, gives the readers a moment to drain what the process
     * wrote before exiting, then closes the per-node logs.
     */
    @Override
    public void close() {
        terminate();
        synchronized (stdinLock) {
            try {
                stdin.close();
            } catch (IOException e) {
                log.debug("Closing stdin of node {} failed: {}", name, e.getMessage());
            }
        }
        joinQuietly(stdoutReader);
        joinQuietly(stderrReader);
        stdoutLog.close();
        stderrLog.close();
    }

    private static void joinQuietly(Thread thread) {
        if (thread == null) {
            return;
        }
        try {
            thread.join(250);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
