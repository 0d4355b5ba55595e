package com.lelantos.tracker.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * SolanaTracker client settings. Documented in application.yml under lelantos.tracker.
 */
@ConfigurationProperties(prefix = "lelantos.tracker")
@Getter
@Setter
public class TrackerProperties {

    /**
     * Data API base URL.
     */
    private String baseUrl = "https://data.solanatracker.io";

    /**
     * Minimum gap between two outbound requests of one session, in ms.
     */
    private long minIntervalMs = 2000L;

    /**
     * Backoff after a 429, multiplied by the 1-based throttled attempt.
     */
    private long throttleBackoffMs = 5000L;

    /**
     * Total attempts while throttled before giving up.
     */
    private int maxThrottleAttempts = 3;

    /**
     * Flat delay between retries of transport or non-429 upstream failures.
     */
    private long retryDelayMs = 2000L;

    /**
     * Retries (excluding the initial call) for transport or non-429 upstream failures.
     */
    private int maxRetries = 2;

    /**
     * Per-request response timeout in seconds.
     */
    private int requestTimeoutSeconds = 30;

    /**
     * Idle time after which a caller's session (client, pacer and cache) is dropped.
     */
    private int sessionTtlMinutes = 60;

    /**
     * Upper bound on concurrently kept sessions.
     */
    private int maxSessions = 100;
}
