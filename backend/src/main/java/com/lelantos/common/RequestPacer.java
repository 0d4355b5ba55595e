package com.lelantos.common;

/**
 * Slot-reservation pacer: no two permits are handed out closer than {@code minIntervalMs} apart.
 * Not thread-safe on its own; callers serialize access (the tracker client holds a fair lock around it).
 */
public class RequestPacer {

    private final long minIntervalMs;
    private final TimeSource timeSource;
    private long nextAllowedAtMs;

    public RequestPacer(long minIntervalMs, TimeSource timeSource) {
        if (minIntervalMs < 0) {
            throw new IllegalArgumentException("minIntervalMs must not be negative");
        }
        this.minIntervalMs = minIntervalMs;
        this.timeSource = timeSource != null ? timeSource : TimeSource.system();
    }

    /**
     * Waits for the reserved slot, then reserves the next one. Returns the time the permit was granted.
     */
    public long acquire() throws InterruptedException {
        long now = timeSource.nowMillis();
        long waitMs = Math.max(0, nextAllowedAtMs - now);
        if (waitMs > 0) {
            timeSource.sleep(waitMs);
        }
        long grantedAt = Math.max(timeSource.nowMillis(), nextAllowedAtMs);
        nextAllowedAtMs = grantedAt + minIntervalMs;
        return grantedAt;
    }

    /**
     * Pushes the next slot forward by {@code delayMs} from now (or from the current reservation if later).
     * Used after a 429 so that later callers also honour the backoff.
     */
    public void pushBack(long delayMs) {
        long base = Math.max(timeSource.nowMillis(), nextAllowedAtMs);
        nextAllowedAtMs = base + Math.max(0, delayMs);
    }

    public long getNextAllowedAtMs() {
        return nextAllowedAtMs;
    }

    public long getMinIntervalMs() {
        return minIntervalMs;
    }
}
