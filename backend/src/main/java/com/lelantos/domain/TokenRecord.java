package com.lelantos.domain;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Token metadata as resolved from the tracker API. Immutable; cached for the lifetime of one tracker session.
 *
 * @param holderCount size of the holder list fetched during analysis, null until known
 */
public record TokenRecord(
        String address,
        String name,
        String symbol,
        String image,
        BigDecimal totalSupply,
        int decimals,
        Instant creationTime,
        Integer holderCount
) {

    public TokenRecord withHolderCount(int count) {
        return new TokenRecord(address, name, symbol, image, totalSupply, decimals, creationTime, count);
    }
}
