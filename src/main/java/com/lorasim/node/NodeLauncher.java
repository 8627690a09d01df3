package com.lorasim.node;

import java.nio.file.Path;

/**
 * Abstraction for starting node programs.
 * Implementation: {@link ProcessNodeLauncher}; tests supply scripted processes.
 */
@FunctionalInterface
public interface NodeLauncher {

    /**
     * Starts the node program with piped stdin, stdout and stderr.
     *
     * @param nodeName   the simulated node's name
     * @param executable path of the node program
     * @return the running process
     * @throws SpawnException if the program cannot be started
     */
    Process launch(String nodeName, Path executable);
}
