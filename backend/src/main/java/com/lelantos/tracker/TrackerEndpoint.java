package com.lelantos.tracker;

/**
 * Tracker API request kinds. Cacheable kinds are memoized per session under {@code "<cachePrefix>:<subject>"}.
 */
public enum TrackerEndpoint {
    TOKEN_INFO("info", "/tokens/{address}", true),
    /** Holder lists change too often to cache. */
    TOKEN_HOLDERS("holders", "/tokens/{address}/holders", false),
    WALLET_BASIC("basic", "/wallet/{address}/basic", false),
    WALLET_TRADES("trades", "/wallet/{address}/trades", false),
    WALLET_PNL("pnl", "/pnl/{address}", false),
    TOP_TRADERS("top", "/top-traders/{address}", true),
    FIRST_BUYERS("first-buyers", "/first-buyers/{address}", false);

    private final String cachePrefix;
    private final String uriTemplate;
    private final boolean cacheable;

    TrackerEndpoint(String cachePrefix, String uriTemplate, boolean cacheable) {
        this.cachePrefix = cachePrefix;
        this.uriTemplate = uriTemplate;
        this.cacheable = cacheable;
    }

    public String cacheKey(String subject) {
        return cachePrefix + ":" + subject;
    }

    public String getUriTemplate() {
        return uriTemplate;
    }

    public boolean isCacheable() {
        return cacheable;
    }
}
