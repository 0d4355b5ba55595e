package com.lelantos.domain;

import java.math.BigDecimal;
import java.util.List;

/**
 * Usable answer of the PnL endpoint: totals plus per-token positions (possibly empty).
 */
public record PnlReport(BigDecimal totalRealizedPnl, BigDecimal totalUnrealizedPnl, List<Position> positions) {

    public record Position(String token, BigDecimal realizedPnl, BigDecimal unrealizedPnl) {

        public BigDecimal totalPnl() {
            return realizedPnl.add(unrealizedPnl);
        }
    }
}
