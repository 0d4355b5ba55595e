package com.lelantos.common;

/**
 * Bounded retry settings for upstream calls. Throttling (429) backs off linearly: {@code throttleBaseDelayMs * attempt}
 * (1-based). Transport and upstream failures wait a flat {@code retryDelayMs} between attempts.
 */
public final class RetryPolicy {

    private final long throttleBaseDelayMs;
    private final int maxThrottleAttempts;
    private final long retryDelayMs;
    private final int maxRetries;

    public RetryPolicy(long throttleBaseDelayMs, int maxThrottleAttempts, long retryDelayMs, int maxRetries) {
        if (maxThrottleAttempts <= 0) {
            throw new IllegalArgumentException("maxThrottleAttempts must be positive");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        this.throttleBaseDelayMs = throttleBaseDelayMs;
        this.maxThrottleAttempts = maxThrottleAttempts;
        this.retryDelayMs = retryDelayMs;
        this.maxRetries = maxRetries;
    }

    /**
     * Backoff after the given 1-based throttled attempt.
     */
    public long throttleDelayMs(int attempt) {
        return throttleBaseDelayMs * Math.max(1, attempt);
    }

    public long retryDelayMs() {
        return retryDelayMs;
    }

    public int getMaxThrottleAttempts() {
        return maxThrottleAttempts;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    /**
     * Default: 5s x attempt on 429 (3 attempts), 2s flat between transport/upstream retries (2 retries).
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(5000L, 3, 2000L, 2);
    }
}
