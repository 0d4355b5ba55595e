package com.lelantos.tracker;

import reactor.core.publisher.Mono;

/**
 * Single GET against the tracker API. Implementations report every HTTP status as a response and map network failures
 * to {@link TransportException}; retry and pacing live in {@link RateLimitedTrackerClient}.
 */
public interface TrackerHttpClient {

    Mono<TrackerHttpResponse> get(String uriTemplate, String subject, String apiKey);
}
