package com.lelantos.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * One of the earliest buyers of a token, as reported by the first-buyers endpoint (times in epoch millis).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FirstBuyer(
        @JsonProperty("wallet") String wallet,
        @JsonProperty("first_buy_time") long firstBuyTime,
        @JsonProperty("first_buy") FirstBuy firstBuy,
        @JsonProperty("first_sell_time") long firstSellTime,
        @JsonProperty("last_transaction_time") long lastTransactionTime,
        @JsonProperty("held") BigDecimal held,
        @JsonProperty("sold") BigDecimal sold,
        @JsonProperty("sold_usd") BigDecimal soldUsd,
        @JsonProperty("holding") BigDecimal holding,
        @JsonProperty("realized") BigDecimal realized,
        @JsonProperty("unrealized") BigDecimal unrealized,
        @JsonProperty("total") BigDecimal total,
        @JsonProperty("total_invested") BigDecimal totalInvested,
        @JsonProperty("buy_transactions") int buyTransactions,
        @JsonProperty("sell_transactions") int sellTransactions,
        @JsonProperty("total_transactions") int totalTransactions,
        @JsonProperty("average_buy_amount") BigDecimal averageBuyAmount,
        @JsonProperty("average_sell_amount") BigDecimal averageSellAmount,
        @JsonProperty("current_value") BigDecimal currentValue,
        @JsonProperty("cost_basis") BigDecimal costBasis,
        @JsonProperty("pnl") BigDecimal pnl
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record FirstBuy(
            @JsonProperty("signature") String signature,
            @JsonProperty("amount") BigDecimal amount,
            @JsonProperty("volume_usd") BigDecimal volumeUsd,
            @JsonProperty("time") long time
    ) {
    }
}
