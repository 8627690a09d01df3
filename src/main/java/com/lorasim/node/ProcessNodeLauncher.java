package com.lorasim.node;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Starts node programs as local operating-system processes via {@link ProcessBuilder}.
 */
public class ProcessNodeLauncher implements NodeLauncher {

    private static final Logger log = LoggerFactory.getLogger(ProcessNodeLauncher.class);

    @Override
    public Process launch(String nodeName, Path executable) {
        var builder = new ProcessBuilder(executable.toString())
                .redirectInput(ProcessBuilder.Redirect.PIPE)
                .redirectOutput(ProcessBuilder.Redirect.PIPE)
                .redirectError(ProcessBuilder.Redirect.PIPE);
        try {
            Process process = builder.start();
            log.info("Started node {} (pid {}) from {}", nodeName, process.pid(), executable);
            return process;
        } catch (IOException | SecurityException e) {
            throw new SpawnException(nodeName,
                    "Failed to start node " + nodeName + " from " + executable + ": " + e.getMessage(), e);
        }
    }
}
