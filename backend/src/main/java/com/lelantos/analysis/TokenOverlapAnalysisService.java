package com.lelantos.analysis;

import com.lelantos.analysis.config.AnalysisProperties;
import com.lelantos.common.TimeSource;
import com.lelantos.domain.AnalysisResult;
import com.lelantos.domain.HolderRecord;
import com.lelantos.domain.TokenRecord;
import com.lelantos.domain.TopTraderMatch;
import com.lelantos.domain.TraderRecord;
import com.lelantos.domain.WalletOverlapRecord;
import com.lelantos.tracker.TrackerException;
import com.lelantos.tracker.TrackerGateway;
import com.lelantos.tracker.TrackerSessionRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Token-overlap analysis: per token metadata, holders and top traders (in input order, through one fresh tracker
 * session), then overlap detection, deep analysis of the top candidates and final ranking.
 * <p>
 * A token whose metadata cannot be fetched is skipped; holder or top-trader failures only shrink that token's
 * contribution. Wallets beyond the deep-analysis bound keep no score and rank as score 0.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TokenOverlapAnalysisService {

    static final Comparator<WalletOverlapRecord> RANKING = Comparator
            .comparingInt((WalletOverlapRecord o) -> o.getScore() != null ? o.getScore() : 0)
            .thenComparingInt(WalletOverlapRecord::getOverlapCount)
            .reversed();

    private final TrackerSessionRegistry sessions;
    private final HolderCrossReferencer holderCrossReferencer;
    private final WalletProfiler walletProfiler;
    private final ScoringEngine scoringEngine;
    private final AnalysisProperties properties;
    private final TimeSource timeSource;

    public AnalysisResult analyzeTokens(String apiKey, List<String> tokens) {
        List<String> cleaned = TokenLists.clean(tokens);
        if (cleaned.isEmpty()) {
            throw new IllegalArgumentException("At least one token address is required");
        }
        TrackerGateway gateway = sessions.fresh(apiKey);
        log.info("Starting overlap analysis for {} tokens", cleaned.size());

        List<TokenRecord> processedTokens = new ArrayList<>();
        Map<String, TokenRecord> tokenMap = new LinkedHashMap<>();
        List<String> skippedTokens = new ArrayList<>();
        Map<String, List<TopTraderMatch>> topTraderMatches = new HashMap<>();
        OverlapIndex index = new OverlapIndex();

        for (String token : cleaned) {
            TokenRecord info;
            try {
                info = gateway.getTokenInfo(token);
            } catch (TrackerException e) {
                log.error("Failed to process {}: {}", token, e.getMessage());
                skippedTokens.add(token);
                continue;
            }
            List<HolderRecord> holders = holderCrossReferencer.fetchHolders(gateway, token);
            info = info.withHolderCount(holders.size());
            processedTokens.add(info);
            tokenMap.put(token, info);

            collectTopTraders(gateway, token, topTraderMatches);
            index.add(info, holders);
        }

        List<WalletOverlapRecord> overlaps = index.overlaps();
        log.info("Found {} overlaps across {} wallets", overlaps.size(), index.walletCount());

        int limit = Math.min(overlaps.size(), Math.max(0, properties.getDeepAnalysisLimit()));
        if (overlaps.size() > limit) {
            log.warn("Limiting deep analysis to top {} overlaps out of {}", limit, overlaps.size());
        }
        for (int i = 0; i < limit; i++) {
            WalletOverlapRecord overlap = overlaps.get(i);
            WalletProfile profile = walletProfiler.profile(gateway, overlap.getAddress());
            scoringEngine.apply(overlap, profile,
                    topTraderMatches.getOrDefault(overlap.getAddress(), List.of()), tokenMap);
        }

        overlaps.sort(RANKING);
        log.info("Analysis complete: {} tokens processed, {} skipped, {} requests sent",
                processedTokens.size(), skippedTokens.size(), gateway.getClient().getRequestCount());
        return new AnalysisResult(overlaps, processedTokens, tokenMap, skippedTokens,
                Instant.ofEpochMilli(timeSource.nowMillis()));
    }

    private static void collectTopTraders(TrackerGateway gateway, String token,
                                          Map<String, List<TopTraderMatch>> matches) {
        try {
            for (TraderRecord trader : gateway.getTopTraders(token)) {
                matches.computeIfAbsent(trader.wallet(), w -> new ArrayList<>())
                        .add(new TopTraderMatch(token, trader.pnl(), trader.roi(), trader.trades()));
            }
        } catch (TrackerException e) {
            log.warn("Failed to fetch top traders for {}: {}", token, e.getMessage());
        }
    }
}
