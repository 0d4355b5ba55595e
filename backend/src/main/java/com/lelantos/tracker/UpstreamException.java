package com.lelantos.tracker;

/**
 * Thrown for a non-2xx, non-429 answer that persisted through the retries.
 */
public class UpstreamException extends TrackerException {

    private final int status;

    public UpstreamException(int status, String message) {
        super(message);
        this.status = status;
    }

    public int getStatus() {
        return status;
    }
}
