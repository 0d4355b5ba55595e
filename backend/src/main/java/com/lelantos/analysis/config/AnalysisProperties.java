package com.lelantos.analysis.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Overlap analysis settings. Documented in application.yml under lelantos.analysis.
 */
@ConfigurationProperties(prefix = "lelantos.analysis")
@Getter
@Setter
public class AnalysisProperties {

    /**
     * Overlap candidates (by current ranking) that get portfolio, trade and PnL lookups. Default 50.
     */
    private int deepAnalysisLimit = 50;

    /**
     * Pause before the single re-fetch of a holder list that came back empty.
     */
    private long emptyHolderRetryDelayMs = 2000L;

    /**
     * Minimum distinct tokens for a recurring-wallet scan.
     */
    private int minRecurringTokens = 2;
}
