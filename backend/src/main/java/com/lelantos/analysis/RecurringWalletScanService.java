package com.lelantos.analysis;

import com.lelantos.analysis.config.AnalysisProperties;
import com.lelantos.common.TimeSource;
import com.lelantos.domain.FirstBuyer;
import com.lelantos.domain.RecurringScanResult;
import com.lelantos.domain.RecurringWalletRecord;
import com.lelantos.domain.RecurringWalletType;
import com.lelantos.domain.TraderRecord;
import com.lelantos.tracker.TrackerException;
import com.lelantos.tracker.TrackerGateway;
import com.lelantos.tracker.TrackerSessionRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Finds wallets that show up among the first buyers or top traders of several tokens. Runs on the caller's current
 * tracker session so token metadata and top traders fetched by a preceding analysis come from cache.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecurringWalletScanService {

    private static final int SCALE = 8;
    private static final RoundingMode ROUNDING = RoundingMode.HALF_UP;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final TrackerSessionRegistry sessions;
    private final AnalysisProperties properties;
    private final TimeSource timeSource;

    public RecurringScanResult scan(String apiKey, List<String> tokens) {
        List<String> cleaned = TokenLists.clean(tokens);
        int minTokens = Math.max(2, properties.getMinRecurringTokens());
        if (cleaned.size() < minTokens) {
            throw new IllegalArgumentException("Please analyze at least " + minTokens
                    + " tokens to find recurring wallets");
        }
        TrackerGateway gateway = sessions.current(apiKey);
        Map<String, List<RecurringWalletRecord.DataPoint>> buyers = new LinkedHashMap<>();
        Map<String, List<RecurringWalletRecord.DataPoint>> traders = new LinkedHashMap<>();

        for (String token : cleaned) {
            String symbol = resolveSymbol(gateway, token);
            try {
                for (FirstBuyer b : gateway.getFirstBuyers(token)) {
                    BigDecimal pnl = nonZero(b.total()) ? b.total() : orZero(b.pnl());
                    buyers.computeIfAbsent(b.wallet(), w -> new ArrayList<>())
                            .add(new RecurringWalletRecord.DataPoint(token, symbol, pnl,
                                    roi(null, b.total(), b.totalInvested()), b));
                }
            } catch (TrackerException e) {
                log.warn("Failed buyers for {}: {}", symbol, e.getMessage());
            }
            try {
                for (TraderRecord t : gateway.getTopTraders(token)) {
                    BigDecimal pnl = nonZero(t.total()) ? t.total() : t.pnl();
                    traders.computeIfAbsent(t.wallet(), w -> new ArrayList<>())
                            .add(new RecurringWalletRecord.DataPoint(token, symbol, pnl,
                                    roi(t.roi(), t.total(), t.totalInvested()), t));
                }
            } catch (TrackerException e) {
                log.warn("Failed traders for {}: {}", symbol, e.getMessage());
            }
        }

        return new RecurringScanResult(
                fold(buyers, RecurringWalletType.EARLY_BUYER),
                fold(traders, RecurringWalletType.TOP_TRADER),
                Instant.ofEpochMilli(timeSource.nowMillis()));
    }

    static List<RecurringWalletRecord> fold(Map<String, List<RecurringWalletRecord.DataPoint>> byWallet,
                                            RecurringWalletType type) {
        List<RecurringWalletRecord> results = new ArrayList<>();
        byWallet.forEach((address, entries) -> {
            Set<String> distinctTokens = new LinkedHashSet<>();
            entries.forEach(e -> distinctTokens.add(e.token()));
            if (distinctTokens.size() < 2) {
                return;
            }
            BigDecimal totalPnl = BigDecimal.ZERO;
            BigDecimal totalRoi = BigDecimal.ZERO;
            int wins = 0;
            for (RecurringWalletRecord.DataPoint e : entries) {
                BigDecimal pnl = e.pnl() != null ? e.pnl() : BigDecimal.ZERO;
                totalPnl = totalPnl.add(pnl);
                totalRoi = totalRoi.add(e.roi() != null ? e.roi() : BigDecimal.ZERO);
                if (pnl.signum() > 0) {
                    wins++;
                }
            }
            results.add(new RecurringWalletRecord(
                    address,
                    type,
                    distinctTokens.size(),
                    List.copyOf(distinctTokens),
                    totalPnl,
                    totalRoi.divide(BigDecimal.valueOf(entries.size()), SCALE, ROUNDING),
                    (int) Math.round(wins * 100.0 / entries.size()),
                    List.copyOf(entries)));
        });
        results.sort(Comparator.comparingInt(RecurringWalletRecord::occurrences)
                .thenComparing(RecurringWalletRecord::totalPnl)
                .reversed());
        return results;
    }

    /**
     * Upstream ROI when non-zero, else {@code total / totalInvested * 100}, else zero.
     */
    static BigDecimal roi(BigDecimal roi, BigDecimal total, BigDecimal totalInvested) {
        if (nonZero(roi)) {
            return roi;
        }
        if (total != null && nonZero(totalInvested)) {
            return total.divide(totalInvested, SCALE, ROUNDING).multiply(HUNDRED);
        }
        return BigDecimal.ZERO;
    }

    private static String resolveSymbol(TrackerGateway gateway, String token) {
        try {
            return gateway.getTokenInfo(token).symbol();
        } catch (TrackerException e) {
            log.debug("No metadata for {}, using short address: {}", token, e.getMessage());
            return token.substring(0, Math.min(4, token.length()));
        }
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }

    private static boolean nonZero(BigDecimal value) {
        return value != null && value.signum() != 0;
    }
}
