package com.lelantos.tracker;

/**
 * Thrown when upstream kept answering 429 until the throttle attempt cap was reached.
 */
public class ThrottledExhaustedException extends TrackerException {

    private final int attempts;

    public ThrottledExhaustedException(String message, int attempts) {
        super(message);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
