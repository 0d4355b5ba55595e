package com.lelantos.tracker;

/**
 * Base for failures talking to the tracker API. Callers treat these as per-item failures.
 */
public class TrackerException extends RuntimeException {

    public TrackerException(String message) {
        super(message);
    }

    public TrackerException(String message, Throwable cause) {
        super(message, cause);
    }
}
