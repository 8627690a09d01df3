package com.lorasim.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Line-buffered file sink. The file is truncated on open and flushed after
 * every line so external readers can follow it.
 */
public class FileLineSink implements LineSink {

    private static final Logger log = LoggerFactory.getLogger(FileLineSink.class);

    private final Path path;
    private final BufferedWriter writer;
    private boolean closed;
    private boolean writeFailureReported;

    private FileLineSink(Path path, BufferedWriter writer) {
        this.path = path;
        this.writer = writer;
    }

    /**
     * Opens (creating or truncating) the file at {@code path}.
     *
     * @throws UncheckedIOException if the file cannot be opened
     */
    public static FileLineSink open(Path path) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            return new FileLineSink(path, Files.newBufferedWriter(path, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot open log file " + path, e);
        }
    }

    @Override
    public synchronized void writeLine(String line) {
        if (closed) {
            return;
        }
        try {
            writer.write(line);
            writer.newLine();
            writer.flush();
        } catch (IOException e) {
            // A full disk should not take down reader threads; report once per sink.
            if (!writeFailureReported) {
                writeFailureReported = true;
                log.error("Write to {} failed: {}", path, e.getMessage(), e);
            }
        }
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            writer.close();
        } catch (IOException e) {
            log.warn("Could not close {}: {}", path, e.getMessage());
        }
    }
}
