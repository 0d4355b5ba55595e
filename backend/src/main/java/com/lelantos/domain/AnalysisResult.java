package com.lelantos.domain;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a token-overlap analysis. Every token referenced by an overlap is a key of {@code tokenMap}.
 *
 * @param skippedTokens inputs dropped because their metadata could not be fetched
 */
public record AnalysisResult(
        List<WalletOverlapRecord> overlaps,
        List<TokenRecord> processedTokens,
        Map<String, TokenRecord> tokenMap,
        List<String> skippedTokens,
        Instant timestamp
) {
}
