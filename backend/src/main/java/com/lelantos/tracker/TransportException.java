package com.lelantos.tracker;

/**
 * Network-level failure (connection refused or reset, timeout).
 */
public class TransportException extends TrackerException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
