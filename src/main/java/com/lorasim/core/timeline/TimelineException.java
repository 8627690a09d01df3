package com.lorasim.core.timeline;

/**
 * Thrown when a timeline input cannot be read at all. Individual malformed
 * lines are skipped and reported instead.
 */
public class TimelineException extends RuntimeException {

    public TimelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
