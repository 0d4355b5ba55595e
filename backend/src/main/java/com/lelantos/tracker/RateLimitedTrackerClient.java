package com.lelantos.tracker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.lelantos.common.RequestPacer;
import com.lelantos.common.RetryPolicy;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Exceptions;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Serializes every call to the tracker API behind the fair lock of its {@link RequestLane}, so at most one request per
 * API key is in flight and callers are served in arrival order. Each attempt takes a slot from the lane's
 * {@link RequestPacer}; 429 answers push the pacer back by {@code backoff x attempt}, transport and upstream failures
 * by the flat retry delay. Cacheable endpoints are answered from the session {@link ResponseCache} without taking a
 * slot.
 */
@Slf4j
public class RateLimitedTrackerClient {

    private final TrackerHttpClient httpClient;
    private final String apiKey;
    private final RequestLane lane;
    private final RequestPacer pacer;
    private final RetryPolicy retryPolicy;
    private final ResponseCache cache;
    private final ObjectMapper objectMapper;
    private final AtomicLong requestCount = new AtomicLong();

    public RateLimitedTrackerClient(TrackerHttpClient httpClient,
                                    String apiKey,
                                    RequestPacer pacer,
                                    RetryPolicy retryPolicy,
                                    ResponseCache cache,
                                    ObjectMapper objectMapper) {
        this(httpClient, apiKey, new RequestLane(pacer), retryPolicy, cache, objectMapper);
    }

    /**
     * Client on a shared {@link RequestLane}; all clients on one lane take turns on its lock and pacer.
     */
    public RateLimitedTrackerClient(TrackerHttpClient httpClient,
                                    String apiKey,
                                    RequestLane lane,
                                    RetryPolicy retryPolicy,
                                    ResponseCache cache,
                                    ObjectMapper objectMapper) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new MissingCredentialException();
        }
        this.httpClient = httpClient;
        this.apiKey = apiKey.strip();
        this.lane = lane;
        this.pacer = lane.getPacer();
        this.retryPolicy = retryPolicy != null ? retryPolicy : RetryPolicy.defaultPolicy();
        this.cache = cache != null ? cache : new ResponseCache();
        this.objectMapper = objectMapper;
    }

    /**
     * Fetches {@code endpoint} for {@code subject}. Returns a JSON null node for an empty or unparsable 2xx body.
     *
     * @throws ThrottledExhaustedException when still throttled after the throttle attempt cap
     * @throws UpstreamException           for a persistent non-2xx answer
     * @throws TransportException          for a persistent network failure
     */
    public JsonNode fetch(TrackerEndpoint endpoint, String subject) {
        String key = endpoint.cacheKey(subject);
        try {
            lane.lock().lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TrackerException("Interrupted while queued for " + key, e);
        }
        try {
            if (endpoint.isCacheable()) {
                Optional<JsonNode> cached = cache.get(key);
                if (cached.isPresent()) {
                    log.debug("Cache hit for {}", key);
                    return cached.get();
                }
            }
            JsonNode body = executeWithRetry(endpoint, subject);
            if (endpoint.isCacheable() && !body.isNull()) {
                cache.put(key, body);
            }
            return body;
        } finally {
            lane.lock().unlock();
        }
    }

    private JsonNode executeWithRetry(TrackerEndpoint endpoint, String subject) {
        int throttledAttempts = 0;
        int failedAttempts = 0;
        while (true) {
            awaitSlot(endpoint, subject);
            TrackerHttpResponse response;
            try {
                requestCount.incrementAndGet();
                log.debug("GET {} [{}]", endpoint.getUriTemplate(), subject);
                response = send(endpoint, subject);
            } catch (TransportException e) {
                failedAttempts++;
                if (failedAttempts > retryPolicy.getMaxRetries()) {
                    throw new TransportException(endpoint + " " + subject + " failed after "
                            + failedAttempts + " attempts", e);
                }
                log.warn("Transport failure on {} {} ({}), retrying in {}ms", endpoint, subject, e.getMessage(),
                        retryPolicy.retryDelayMs());
                pacer.pushBack(retryPolicy.retryDelayMs());
                continue;
            }
            if (response == null) {
                throw new TransportException(endpoint + " " + subject + ": no response");
            }
            if (response.isThrottled()) {
                throttledAttempts++;
                if (throttledAttempts >= retryPolicy.getMaxThrottleAttempts()) {
                    throw new ThrottledExhaustedException("Rate limit exceeded after " + throttledAttempts
                            + " attempts for " + endpoint + " " + subject, throttledAttempts);
                }
                long backoff = retryPolicy.throttleDelayMs(throttledAttempts);
                log.warn("Rate limit 429 on {} {}. Backing off {}ms (attempt {}/{})", endpoint, subject, backoff,
                        throttledAttempts, retryPolicy.getMaxThrottleAttempts());
                pacer.pushBack(backoff);
                continue;
            }
            if (!response.isSuccess()) {
                failedAttempts++;
                if (failedAttempts > retryPolicy.getMaxRetries()) {
                    throw new UpstreamException(response.status(), "API error " + response.status() + " for "
                            + endpoint + " " + subject);
                }
                log.warn("API error {} on {} {}, retrying in {}ms", response.status(), endpoint, subject,
                        retryPolicy.retryDelayMs());
                pacer.pushBack(retryPolicy.retryDelayMs());
                continue;
            }
            return parse(endpoint, subject, response.body());
        }
    }

    private TrackerHttpResponse send(TrackerEndpoint endpoint, String subject) {
        try {
            return httpClient.get(endpoint.getUriTemplate(), subject, apiKey).block();
        } catch (TrackerException e) {
            throw e;
        } catch (RuntimeException e) {
            // block() wraps checked failures such as a connection closed mid-body
            Throwable cause = Exceptions.unwrap(e);
            throw new TransportException(endpoint + " " + subject + ": " + cause, cause);
        }
    }

    private void awaitSlot(TrackerEndpoint endpoint, String subject) {
        try {
            pacer.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TrackerException("Interrupted while waiting to call " + endpoint + " " + subject, e);
        }
    }

    private JsonNode parse(TrackerEndpoint endpoint, String subject, String body) {
        if (body == null || body.isBlank()) {
            return NullNode.getInstance();
        }
        try {
            JsonNode node = objectMapper.readTree(body);
            return node != null ? node : NullNode.getInstance();
        } catch (JsonProcessingException e) {
            log.warn("Unparsable body from {} {}: {}", endpoint, subject, e.getOriginalMessage());
            return NullNode.getInstance();
        }
    }

    /**
     * Requests actually sent upstream, retries included.
     */
    public long getRequestCount() {
        return requestCount.get();
    }

    public ResponseCache getCache() {
        return cache;
    }
}
