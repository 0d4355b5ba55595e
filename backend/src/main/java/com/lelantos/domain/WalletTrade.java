package com.lelantos.domain;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One trade from a wallet's history. {@code time} and {@code pnl} are null when upstream omitted them.
 */
public record WalletTrade(String token, Instant time, String type, BigDecimal pnl) {

    public boolean isSell() {
        return "sell".equalsIgnoreCase(type);
    }

    public boolean isBuy() {
        return "buy".equalsIgnoreCase(type);
    }
}
