package com.lorasim.dispatch.cli;

import com.lorasim.core.scheduler.StopSignal;
import org.jline.terminal.Attributes;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.jline.utils.NonBlockingReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Optional;

/**
 * Watches the operator's terminal and cancels the run on a single {@code ESC} or {@code q}
 * keypress. The terminal is put in raw mode while listening and restored afterwards.
 */
public class ConsoleStopListener implements Runnable, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConsoleStopListener.class);

    static final long POLL_MILLIS = 100;
    private static final long CLOSE_WAIT_MILLIS = 1000;
    private static final int ESC = 0x1b;

    private final NonBlockingReader reader;
    private final StopSignal stopSignal;
    private final Runnable onExit;
    private volatile boolean closed;
    private Thread thread;

    ConsoleStopListener(NonBlockingReader reader, StopSignal stopSignal, Runnable onExit) {
        this.reader = reader;
        this.stopSignal = stopSignal;
        this.onExit = onExit;
    }

    /**
     * Starts listening on the system terminal when stdin is one.
     */
    public static Optional<ConsoleStopListener> startOnTerminal(StopSignal stopSignal) {
        Terminal terminal;
        try {
            terminal = TerminalBuilder.builder()
                    .system(true)
                    .dumb(false)
                    .nativeSignals(false)
                    .build();
        } catch (IOException | RuntimeException e) {
            log.debug("No interactive terminal, keypress stop disabled: {}", e.getMessage());
            return Optional.empty();
        }
        Attributes previous = terminal.enterRawMode();
        var listener = new ConsoleStopListener(terminal.reader(), stopSignal, () -> {
            terminal.setAttributes(previous);
            try {
                terminal.close();
            } catch (IOException e) {
                log.debug("Closing terminal failed: {}", e.getMessage());
            }
        });
        listener.start();
        return Optional.of(listener);
    }

    static boolean isStopKey(int c) {
        return c == ESC || c == 'q' || c == 'Q';
    }

    void start() {
        thread = new Thread(this, "console-stop-listener");
        thread.setDaemon(true);
        thread.start();
    }

    @Override
    public void run() {
        try {
            while (!closed && !stopSignal.isStopped()) {
                int c = reader.read(POLL_MILLIS);
                if (c == NonBlockingReader.EOF) {
                    return;
                }
                if (c != NonBlockingReader.READ_EXPIRED && isStopKey(c)) {
                    if (stopSignal.stop(StopSignal.Reason.OPERATOR_CANCEL)) {
                        log.info("Stop requested from console");
                    }
                    return;
                }
            }
        } catch (IOException e) {
            log.debug("Console input closed: {}", e.getMessage());
        } finally {
            onExit.run();
        }
    }

    /**
     * Stops listening and waits briefly for the terminal to be restored.
     */
    @Override
    public void close() {
        closed = true;
        if (thread == null) {
            return;
        }
        try {
            thread.join(CLOSE_WAIT_MILLIS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
