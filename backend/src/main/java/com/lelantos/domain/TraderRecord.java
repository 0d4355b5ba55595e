package com.lelantos.domain;

import java.math.BigDecimal;

/**
 * Entry of a token's top-trader list, normalized from the several identity and count field names upstream uses.
 * {@code total} and {@code totalInvested} are null when absent.
 */
public record TraderRecord(
        String wallet,
        BigDecimal pnl,
        BigDecimal roi,
        int trades,
        BigDecimal total,
        BigDecimal totalInvested
) {
}
