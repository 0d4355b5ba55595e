package com.lelantos.analysis;

import com.lelantos.domain.FirstBuyer;
import com.lelantos.domain.TraderRecord;
import com.lelantos.domain.WalletSummary;
import com.lelantos.tracker.TrackerException;
import com.lelantos.tracker.TrackerSessionRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Single-subject lookups on the caller's current session. Failures degrade to empty results.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WalletLookupService {

    private final TrackerSessionRegistry sessions;
    private final ScoringEngine scoringEngine;

    public List<FirstBuyer> getFirstBuyers(String apiKey, String token) {
        try {
            return sessions.current(apiKey).getFirstBuyers(token.strip());
        } catch (TrackerException e) {
            log.warn("Failed to fetch first buyers for {}: {}", token, e.getMessage());
            return List.of();
        }
    }

    public List<TraderRecord> getTopTraders(String apiKey, String token) {
        try {
            return sessions.current(apiKey).getTopTraders(token.strip());
        } catch (TrackerException e) {
            log.warn("Failed to fetch top traders for {}: {}", token, e.getMessage());
            return List.of();
        }
    }

    /**
     * PnL-derived summary (no portfolio or trades), empty when the PnL endpoint had nothing usable or failed.
     */
    public Optional<WalletSummary> getWalletPnl(String apiKey, String wallet) {
        try {
            return sessions.current(apiKey).getWalletPnl(wallet.strip())
                    .map(report -> scoringEngine.summarize(BigDecimal.ZERO, List.of(), report));
        } catch (TrackerException e) {
            log.warn("Failed to fetch PnL for {}: {}", wallet, e.getMessage());
            return Optional.empty();
        }
    }
}
