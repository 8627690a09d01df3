package com.lorasim.node;

/**
 * Thrown when a node process cannot be started. Fatal for the run.
 */
public class SpawnException extends RuntimeException {

    private final String nodeName;

    public SpawnException(String nodeName, String message, Throwable cause) {
        super(message, cause);
        this.nodeName = nodeName;
    }

    public String getNodeName() {
        return nodeName;
    }
}
