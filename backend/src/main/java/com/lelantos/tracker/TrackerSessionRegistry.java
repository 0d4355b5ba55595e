package com.lelantos.tracker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.lelantos.common.RequestPacer;
import com.lelantos.common.RetryPolicy;
import com.lelantos.common.TimeSource;
import com.lelantos.tracker.config.TrackerProperties;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * One tracker session (client and response cache) per API key. A token-overlap analysis opens a fresh, cold
 * session; follow-up lookups reuse whichever session the key currently has. All sessions of a key, replaced ones
 * included, send through the same {@link RequestLane}.
 */
@Slf4j
public class TrackerSessionRegistry {

    private final TrackerHttpClient httpClient;
    private final TrackerProperties properties;
    private final TimeSource timeSource;
    private final ObjectMapper objectMapper;
    private final Cache<String, TrackerGateway> sessions;
    // held weakly: a lane lives as long as some session of its key does
    private final Cache<String, RequestLane> lanes = Caffeine.newBuilder().weakValues().build();

    public TrackerSessionRegistry(TrackerHttpClient httpClient,
                                  TrackerProperties properties,
                                  TimeSource timeSource,
                                  ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.properties = properties;
        this.timeSource = timeSource;
        this.objectMapper = objectMapper;
        this.sessions = Caffeine.newBuilder()
                .expireAfterAccess(Duration.ofMinutes(Math.max(1, properties.getSessionTtlMinutes())))
                .maximumSize(Math.max(1, properties.getMaxSessions()))
                .build();
    }

    /**
     * Session for {@code apiKey}, created if none is live.
     */
    public TrackerGateway current(String apiKey) {
        String key = requireKey(apiKey);
        return sessions.get(key, this::open);
    }

    /**
     * Replaces any live session for {@code apiKey} with a new one whose cache starts empty.
     */
    public TrackerGateway fresh(String apiKey) {
        String key = requireKey(apiKey);
        TrackerGateway gateway = open(key);
        sessions.put(key, gateway);
        return gateway;
    }

    public long activeSessions() {
        return sessions.estimatedSize();
    }

    private TrackerGateway open(String apiKey) {
        log.debug("Opening tracker session");
        RetryPolicy retryPolicy = new RetryPolicy(
                properties.getThrottleBackoffMs(),
                properties.getMaxThrottleAttempts(),
                properties.getRetryDelayMs(),
                properties.getMaxRetries());
        RateLimitedTrackerClient client = new RateLimitedTrackerClient(
                httpClient,
                apiKey,
                lanes.get(apiKey, k -> new RequestLane(new RequestPacer(properties.getMinIntervalMs(), timeSource))),
                retryPolicy,
                new ResponseCache(),
                objectMapper);
        return new TrackerGateway(client, objectMapper);
    }

    private static String requireKey(String apiKey) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new MissingCredentialException();
        }
        return apiKey.strip();
    }
}
