package com.lelantos.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Behavioural labels attached to a profiled wallet.
 */
public enum WalletTag {
    WHALE("Whale"),
    EARLY_SNIPER("Early Sniper"),
    DIAMOND_HAND("Diamond Hand"),
    QUICK_FLIPPER("Quick Flipper"),
    TOP_TRADER("Top Trader"),
    /** Only assigned when no other tag applies. */
    CASUAL_TRADER("Casual Trader");

    private final String label;

    WalletTag(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
