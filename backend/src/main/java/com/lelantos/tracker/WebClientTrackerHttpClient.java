package com.lelantos.tracker;

import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Tracker HTTP client using WebClient. The subject is expanded into the URI template (and encoded) by WebClient.
 */
public class WebClientTrackerHttpClient implements TrackerHttpClient {

    public static final String API_KEY_HEADER = "x-api-key";

    private final WebClient webClient;
    private final Duration timeout;

    public WebClientTrackerHttpClient(WebClient.Builder builder, String baseUrl, Duration timeout) {
        this.webClient = builder.clone().baseUrl(baseUrl).build();
        this.timeout = timeout;
    }

    @Override
    public Mono<TrackerHttpResponse> get(String uriTemplate, String subject, String apiKey) {
        return webClient.get()
                .uri(uriTemplate, subject)
                .header(API_KEY_HEADER, apiKey)
                .accept(MediaType.APPLICATION_JSON)
                .exchangeToMono(response -> response.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(body -> new TrackerHttpResponse(response.statusCode().value(), body)))
                .timeout(timeout)
                .onErrorMap(WebClientRequestException.class,
                        e -> new TransportException("Request to " + e.getUri() + " failed: " + e.getMessage(), e))
                .onErrorMap(TimeoutException.class,
                        e -> new TransportException("No response within " + timeout.toMillis() + "ms", e))
                .onErrorMap(e -> !(e instanceof TrackerException),
                        e -> new TransportException("Response from tracker failed: " + e.getMessage(), e));
    }
}
