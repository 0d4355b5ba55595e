package com.lelantos.domain;

import java.math.BigDecimal;

/**
 * One entry of a token's holder list. {@code percentage} is null when upstream did not supply one.
 */
public record HolderRecord(String walletAddress, BigDecimal amount, BigDecimal percentage) {
}
