package com.lelantos.analysis;

import com.lelantos.common.TimeSource;
import com.lelantos.domain.PnlReport;
import com.lelantos.domain.TokenRecord;
import com.lelantos.domain.TopTraderMatch;
import com.lelantos.domain.WalletOverlapRecord;
import com.lelantos.domain.WalletSummary;
import com.lelantos.domain.WalletTag;
import com.lelantos.domain.WalletTrade;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Threat score (0..10) and behavioural tags for a profiled overlap wallet.
 * <ul>
 *     <li>2 per overlapping token, at most 8</li>
 *     <li>+2 portfolio above $5k</li>
 *     <li>+3 listed as a top trader of any analyzed token</li>
 *     <li>+2 first trade on a token within 10 minutes after its creation (Early Sniper)</li>
 *     <li>+2 longest holding across overlapping tokens above 1 hour</li>
 * </ul>
 */
@Component
@RequiredArgsConstructor
public class ScoringEngine {

    public static final int MAX_SCORE = 10;
    static final int POINTS_PER_TOKEN = 2;
    static final int MAX_OVERLAP_POINTS = 8;
    static final int PORTFOLIO_POINTS = 2;
    static final int TOP_TRADER_POINTS = 3;
    static final int SNIPER_POINTS = 2;
    static final int HOLDING_POINTS = 2;

    static final BigDecimal PORTFOLIO_BONUS_USD = BigDecimal.valueOf(5_000);
    static final BigDecimal WHALE_USD = BigDecimal.valueOf(20_000);
    static final Duration SNIPER_WINDOW = Duration.ofMinutes(10);
    static final Duration FLIP_WINDOW = Duration.ofMinutes(30);
    static final Duration HOLDING_BONUS = Duration.ofHours(1);
    static final Duration DIAMOND_HAND = Duration.ofHours(24);

    private final TimeSource timeSource;

    /**
     * Fills score, tags, portfolio, summary, holding duration and top-trader data on {@code overlap}.
     */
    public void apply(WalletOverlapRecord overlap,
                      WalletProfile profile,
                      List<TopTraderMatch> topTraderMatches,
                      Map<String, TokenRecord> tokenMap) {
        BigDecimal portfolio = profile.portfolioValue() != null ? profile.portfolioValue() : BigDecimal.ZERO;
        Set<WalletTag> tags = EnumSet.noneOf(WalletTag.class);
        int score = Math.min(overlap.getOverlapCount() * POINTS_PER_TOKEN, MAX_OVERLAP_POINTS);

        if (portfolio.compareTo(PORTFOLIO_BONUS_USD) > 0) {
            score += PORTFOLIO_POINTS;
        }
        if (portfolio.compareTo(WHALE_USD) > 0) {
            tags.add(WalletTag.WHALE);
        }
        if (topTraderMatches != null && !topTraderMatches.isEmpty()) {
            overlap.setTopTrader(true);
            overlap.setTopTraderMatches(List.copyOf(topTraderMatches));
            score += TOP_TRADER_POINTS;
            tags.add(WalletTag.TOP_TRADER);
        }

        TradePattern pattern = tradePattern(overlap.getTokens(), profile.trades(), tokenMap);
        if (pattern.earlySniper) {
            score += SNIPER_POINTS;
            tags.add(WalletTag.EARLY_SNIPER);
        }
        if (pattern.maxHolding.compareTo(HOLDING_BONUS) > 0) {
            score += HOLDING_POINTS;
        }
        if (pattern.maxHolding.compareTo(DIAMOND_HAND) > 0) {
            tags.add(WalletTag.DIAMOND_HAND);
        }
        if (pattern.quickFlipper) {
            tags.add(WalletTag.QUICK_FLIPPER);
        }
        if (tags.isEmpty()) {
            tags.add(WalletTag.CASUAL_TRADER);
        }

        overlap.setScore(clamp(score));
        overlap.setTags(tags);
        overlap.setPortfolioValue(portfolio);
        overlap.setMaxHoldingHours(pattern.maxHolding.toMillis() / 3_600_000d);
        overlap.setWalletSummary(summarize(portfolio, profile.trades(), profile.pnl()));
        overlap.getUnavailableData().addAll(profile.unavailable());
    }

    /**
     * Summary from the PnL report when there is one, otherwise from the signs of per-trade PnL, otherwise zeros.
     */
    public WalletSummary summarize(BigDecimal portfolioValue, List<WalletTrade> trades, PnlReport pnl) {
        List<WalletTrade> safeTrades = trades != null ? trades : List.of();
        BigDecimal portfolio = portfolioValue != null ? portfolioValue : BigDecimal.ZERO;
        BigDecimal tradePnl = BigDecimal.ZERO;
        int profitableTrades = 0;
        for (WalletTrade trade : safeTrades) {
            if (trade.pnl() != null) {
                tradePnl = tradePnl.add(trade.pnl());
                if (trade.pnl().signum() > 0) {
                    profitableTrades++;
                }
            }
        }
        int totalTrades = safeTrades.size();

        if (pnl != null) {
            int profitable = 0;
            int losing = 0;
            for (PnlReport.Position position : pnl.positions()) {
                int sign = position.totalPnl().signum();
                if (sign > 0) {
                    profitable++;
                } else if (sign < 0) {
                    losing++;
                }
            }
            return new WalletSummary(portfolio, totalTrades, percent(profitable, profitable + losing), tradePnl,
                    pnl.totalRealizedPnl(), pnl.totalUnrealizedPnl(), profitable, losing);
        }
        if (totalTrades > 0) {
            return new WalletSummary(portfolio, totalTrades, percent(profitableTrades, totalTrades), tradePnl,
                    tradePnl, BigDecimal.ZERO, profitableTrades, totalTrades - profitableTrades);
        }
        return new WalletSummary(portfolio, 0, 0, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, 0, 0);
    }

    private TradePattern tradePattern(List<String> tokens, List<WalletTrade> trades, Map<String, TokenRecord> tokenMap) {
        TradePattern pattern = new TradePattern();
        if (trades == null || trades.isEmpty()) {
            return pattern;
        }
        Instant now = Instant.ofEpochMilli(timeSource.nowMillis());
        for (String token : tokens) {
            TokenRecord info = tokenMap.get(token);
            if (info == null) {
                continue;
            }
            List<WalletTrade> tokenTrades = trades.stream()
                    .filter(t -> t.time() != null && Objects.equals(token, t.token()))
                    .sorted(Comparator.comparing(WalletTrade::time))
                    .toList();
            if (tokenTrades.isEmpty()) {
                continue;
            }
            Instant firstTrade = tokenTrades.get(0).time();

            if (info.creationTime() != null) {
                Duration sinceCreation = Duration.between(info.creationTime(), firstTrade);
                if (!sinceCreation.isNegative() && !sinceCreation.isZero()
                        && sinceCreation.compareTo(SNIPER_WINDOW) < 0) {
                    pattern.earlySniper = true;
                }
            }

            Instant firstBuy = tokenTrades.stream()
                    .filter(WalletTrade::isBuy)
                    .map(WalletTrade::time)
                    .findFirst()
                    .orElse(firstTrade);
            boolean flipped = tokenTrades.stream()
                    .filter(WalletTrade::isSell)
                    .map(t -> Duration.between(firstBuy, t.time()))
                    .anyMatch(d -> !d.isNegative() && d.compareTo(FLIP_WINDOW) < 0);
            if (flipped) {
                pattern.quickFlipper = true;
            }

            Duration held = Duration.between(firstTrade, now);
            if (held.compareTo(pattern.maxHolding) > 0) {
                pattern.maxHolding = held;
            }
        }
        return pattern;
    }

    static int clamp(int score) {
        return Math.max(0, Math.min(MAX_SCORE, score));
    }

    private static int percent(int part, int whole) {
        if (whole <= 0) {
            return 0;
        }
        return (int) Math.round(part * 100.0 / whole);
    }

    private static final class TradePattern {
        private boolean earlySniper;
        private boolean quickFlipper;
        private Duration maxHolding = Duration.ZERO;
    }
}
