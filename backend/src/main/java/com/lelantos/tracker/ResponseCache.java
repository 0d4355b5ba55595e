package com.lelantos.tracker;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.util.Optional;

/**
 * Session-scoped memo of parsed responses. No eviction and no TTL: it lives exactly as long as its client.
 */
public class ResponseCache {

    private final Cache<String, JsonNode> entries = Caffeine.newBuilder().build();

    public Optional<JsonNode> get(String key) {
        return Optional.ofNullable(entries.getIfPresent(key));
    }

    public void put(String key, JsonNode value) {
        if (key != null && value != null) {
            entries.put(key, value);
        }
    }

    public long size() {
        return entries.estimatedSize();
    }
}
