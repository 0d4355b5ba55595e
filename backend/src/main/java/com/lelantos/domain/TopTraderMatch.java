package com.lelantos.domain;

import java.math.BigDecimal;

/**
 * A wallet's appearance in one token's top-trader list.
 */
public record TopTraderMatch(String token, BigDecimal pnl, BigDecimal roi, int trades) {
}
