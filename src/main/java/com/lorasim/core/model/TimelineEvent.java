package com.lorasim.core.model;

/**
 * One authored timeline entry.
 *
 * @param timestamp   logical seconds since simulation start, never negative
 * @param destination node name, or {@link #CONNECTIVITY_DESTINATION} for a matrix replacement
 * @param payload     command line for the node, or the connectivity bitstring
 * @param lineNumber  1-based source line, 0 when not read from a file
 */
public record TimelineEvent(
    double timestamp,
    String destination,
    String payload,
    int lineNumber
) {

    public static final String CONNECTIVITY_DESTINATION = "-1";

    public TimelineEvent {
        if (timestamp < 0 || Double.isNaN(timestamp)) {
            throw new IllegalArgumentException("timestamp must be >= 0, got " + timestamp);
        }
    }

    public TimelineEvent(double timestamp, String destination, String payload) {
        this(timestamp, destination, payload, 0);
    }

    public boolean isConnectivityUpdate() {
        return CONNECTIVITY_DESTINATION.equals(destination);
    }
}
