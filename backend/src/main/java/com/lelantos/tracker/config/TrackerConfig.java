package com.lelantos.tracker.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lelantos.common.TimeSource;
import com.lelantos.tracker.TrackerHttpClient;
import com.lelantos.tracker.TrackerSessionRegistry;
import com.lelantos.tracker.WebClientTrackerHttpClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Tracker module wiring: HTTP client, time source and the per-key session registry.
 */
@Configuration
@EnableConfigurationProperties(TrackerProperties.class)
public class TrackerConfig {

    @Bean
    public TimeSource timeSource() {
        return TimeSource.system();
    }

    @Bean
    public TrackerHttpClient trackerHttpClient(WebClient.Builder webClientBuilder, TrackerProperties properties) {
        return new WebClientTrackerHttpClient(webClientBuilder, properties.getBaseUrl(),
                Duration.ofSeconds(Math.max(1, properties.getRequestTimeoutSeconds())));
    }

    @Bean
    public TrackerSessionRegistry trackerSessionRegistry(TrackerHttpClient trackerHttpClient,
                                                         TrackerProperties properties,
                                                         TimeSource timeSource,
                                                         ObjectMapper objectMapper) {
        return new TrackerSessionRegistry(trackerHttpClient, properties, timeSource, objectMapper);
    }
}
