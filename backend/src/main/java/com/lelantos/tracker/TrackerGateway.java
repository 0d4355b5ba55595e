package com.lelantos.tracker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lelantos.domain.FirstBuyer;
import com.lelantos.domain.HolderRecord;
import com.lelantos.domain.PnlReport;
import com.lelantos.domain.TokenRecord;
import com.lelantos.domain.TraderRecord;
import com.lelantos.domain.WalletTrade;
import com.lelantos.tracker.shape.JsonFields;
import com.lelantos.tracker.shape.ResponseShapes;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Typed operations over one tracker session. Every method goes through the session's {@link RateLimitedTrackerClient}
 * and normalizes the upstream shape; {@link TrackerException}s propagate so callers decide the per-item default.
 */
@Slf4j
public class TrackerGateway {

    private final RateLimitedTrackerClient client;
    private final ObjectMapper objectMapper;

    public TrackerGateway(RateLimitedTrackerClient client, ObjectMapper objectMapper) {
        this.client = client;
        this.objectMapper = objectMapper;
    }

    /**
     * Token metadata; fields may be nested under {@code token} or flattened at the root.
     */
    public TokenRecord getTokenInfo(String tokenAddress) {
        JsonNode root = client.fetch(TrackerEndpoint.TOKEN_INFO, tokenAddress);
        return parseTokenInfo(tokenAddress, root);
    }

    public List<HolderRecord> getTokenHolders(String tokenAddress) {
        JsonNode root = client.fetch(TrackerEndpoint.TOKEN_HOLDERS, tokenAddress);
        List<HolderRecord> holders = new ArrayList<>();
        for (JsonNode h : ResponseShapes.extractList(root, ResponseShapes.HOLDERS)) {
            Optional<String> wallet = JsonFields.text(h, ResponseShapes.HOLDER_IDENTITY);
            if (wallet.isEmpty()) {
                continue;
            }
            holders.add(new HolderRecord(
                    wallet.get(),
                    JsonFields.decimal(h, "amount").orElse(BigDecimal.ZERO),
                    JsonFields.decimal(h, "percentage").orElse(null)));
        }
        return holders;
    }

    /**
     * Total portfolio value in USD ({@code total} of the basic wallet endpoint), zero when absent.
     */
    public BigDecimal getWalletPortfolioValue(String wallet) {
        JsonNode root = client.fetch(TrackerEndpoint.WALLET_BASIC, wallet);
        return JsonFields.decimal(root, "total").orElse(BigDecimal.ZERO);
    }

    public List<WalletTrade> getWalletTrades(String wallet) {
        JsonNode root = client.fetch(TrackerEndpoint.WALLET_TRADES, wallet);
        List<WalletTrade> trades = new ArrayList<>();
        for (JsonNode t : ResponseShapes.extractList(root, ResponseShapes.TRADES)) {
            trades.add(new WalletTrade(
                    tradeToken(t),
                    JsonFields.instant(t, "time", "timestamp").orElse(null),
                    JsonFields.text(t, "type").map(s -> s.toLowerCase(Locale.ROOT)).orElse(null),
                    JsonFields.decimal(t, "pnl").orElse(null)));
        }
        return trades;
    }

    /**
     * PnL report, or empty when the endpoint answered with nothing usable (null, non-object or empty object).
     */
    public Optional<PnlReport> getWalletPnl(String wallet) {
        JsonNode root = client.fetch(TrackerEndpoint.WALLET_PNL, wallet);
        return parsePnl(root);
    }

    public List<TraderRecord> getTopTraders(String tokenAddress) {
        JsonNode root = client.fetch(TrackerEndpoint.TOP_TRADERS, tokenAddress);
        List<TraderRecord> traders = new ArrayList<>();
        for (JsonNode t : ResponseShapes.extractList(root, ResponseShapes.TOP_TRADERS)) {
            Optional<String> wallet = JsonFields.text(t, ResponseShapes.TRADER_IDENTITY);
            if (wallet.isEmpty()) {
                continue;
            }
            traders.add(new TraderRecord(
                    wallet.get(),
                    JsonFields.decimal(t, "pnl").orElse(BigDecimal.ZERO),
                    JsonFields.decimal(t, "roi").orElse(BigDecimal.ZERO),
                    JsonFields.integer(t, "total_trades", "trades").orElse(0),
                    JsonFields.decimal(t, "total").orElse(null),
                    JsonFields.decimal(t, "total_invested", "totalInvested").orElse(null)));
        }
        return traders;
    }

    public List<FirstBuyer> getFirstBuyers(String tokenAddress) {
        JsonNode root = client.fetch(TrackerEndpoint.FIRST_BUYERS, tokenAddress);
        List<FirstBuyer> buyers = new ArrayList<>();
        for (JsonNode b : ResponseShapes.extractList(root, ResponseShapes.FIRST_BUYERS)) {
            try {
                FirstBuyer buyer = objectMapper.convertValue(b, FirstBuyer.class);
                if (buyer.wallet() != null && !buyer.wallet().isBlank()) {
                    buyers.add(buyer);
                }
            } catch (IllegalArgumentException e) {
                log.debug("Skipping malformed first buyer for {}: {}", tokenAddress, e.getMessage());
            }
        }
        return buyers;
    }

    public RateLimitedTrackerClient getClient() {
        return client;
    }

    static TokenRecord parseTokenInfo(String tokenAddress, JsonNode root) {
        JsonNode token = root.path("token").isObject() ? root.path("token") : root;
        String name = JsonFields.text(token, "name").orElse("Unknown");
        String symbol = JsonFields.text(token, "symbol")
                .orElse(tokenAddress.substring(0, Math.min(4, tokenAddress.length())));
        BigDecimal totalSupply = JsonFields.decimal(root, "totalSupply")
                .or(() -> JsonFields.decimal(token, "supply", "totalSupply"))
                .orElse(BigDecimal.ZERO);
        int decimals = JsonFields.integer(root, "decimals")
                .or(() -> JsonFields.integer(token, "decimals"))
                .orElse(0);
        Instant creationTime = JsonFields.instant(token, "createdAt")
                .or(() -> JsonFields.instant(root, "createdAt"))
                .or(() -> JsonFields.instant(root.path("creation"), "created_time"))
                .orElse(null);
        return new TokenRecord(tokenAddress, name, symbol, JsonFields.text(token, "image").orElse(null),
                totalSupply, decimals, creationTime, null);
    }

    static Optional<PnlReport> parsePnl(JsonNode root) {
        if (root == null || !root.isObject() || root.isEmpty()) {
            return Optional.empty();
        }
        JsonNode summary = root.path("summary");
        BigDecimal realized = JsonFields.decimal(root, "totalRealizedPnl")
                .or(() -> JsonFields.decimal(summary, "realized"))
                .orElse(BigDecimal.ZERO);
        BigDecimal unrealized = JsonFields.decimal(root, "totalUnrealizedPnl")
                .or(() -> JsonFields.decimal(summary, "unrealized"))
                .orElse(BigDecimal.ZERO);
        List<PnlReport.Position> positions = new ArrayList<>();
        JsonNode rawPositions = root.path("positions");
        if (rawPositions.isArray()) {
            for (JsonNode p : rawPositions) {
                positions.add(new PnlReport.Position(
                        JsonFields.text(p, "token", "mint").orElse(null),
                        JsonFields.decimal(p, "realizedPnl", "realized").orElse(BigDecimal.ZERO),
                        JsonFields.decimal(p, "unrealizedPnl", "unrealized").orElse(BigDecimal.ZERO)));
            }
        }
        return Optional.of(new PnlReport(realized, unrealized, positions));
    }

    private static String tradeToken(JsonNode trade) {
        JsonNode token = trade.path("token");
        if (token.isTextual()) {
            return token.asText().strip();
        }
        if (token.isObject()) {
            return JsonFields.text(token, "mint", "address").orElse(null);
        }
        return JsonFields.text(trade, "mint").orElse(null);
    }
}
