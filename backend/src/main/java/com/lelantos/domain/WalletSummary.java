package com.lelantos.domain;

import java.math.BigDecimal;

/**
 * Trading summary for a wallet. {@code realizedPnl} is the sum of per-trade PnL; the {@code total*} fields come from
 * the PnL endpoint when it answered, otherwise from trades.
 */
public record WalletSummary(
        BigDecimal portfolioValueUsd,
        int totalTrades,
        int winRate,
        BigDecimal realizedPnl,
        BigDecimal totalRealizedPnl,
        BigDecimal totalUnrealizedPnl,
        int profitablePositions,
        int losingPositions
) {

    public static WalletSummary empty() {
        return new WalletSummary(BigDecimal.ZERO, 0, 0, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, 0, 0);
    }
}
