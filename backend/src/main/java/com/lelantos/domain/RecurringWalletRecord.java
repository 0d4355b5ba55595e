package com.lelantos.domain;

import java.math.BigDecimal;
import java.util.List;

/**
 * A wallet found in the early-buyer or top-trader list of at least two tokens.
 *
 * @param occurrences number of distinct tokens the wallet appeared for
 * @param dataPoints  every first-buyer or trader entry that contributed, for drill-down
 */
public record RecurringWalletRecord(
        String address,
        RecurringWalletType type,
        int occurrences,
        List<String> tokens,
        BigDecimal totalPnl,
        BigDecimal avgRoi,
        int winRate,
        List<DataPoint> dataPoints
) {

    public record DataPoint(String token, String tokenSymbol, BigDecimal pnl, BigDecimal roi, Object entry) {
    }
}
