package com.lelantos.api.controller;

import com.lelantos.analysis.RecurringWalletScanService;
import com.lelantos.analysis.TokenOverlapAnalysisService;
import com.lelantos.api.dto.TokenListRequest;
import com.lelantos.config.AsyncConfig;
import com.lelantos.domain.AnalysisResult;
import com.lelantos.domain.RecurringScanResult;
import com.lelantos.tracker.WebClientTrackerHttpClient;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

/**
 * POST /analysis (token overlap) and POST /recurring-wallets (early buyers / top traders recurrence).
 * The caller's SolanaTracker key is forwarded from the x-api-key header.
 */
@RestController
@RequestMapping("/api/v1")
public class AnalysisController {

    private final TokenOverlapAnalysisService analysisService;
    private final RecurringWalletScanService recurringWalletScanService;
    private final Scheduler analysisScheduler;

    public AnalysisController(TokenOverlapAnalysisService analysisService,
                              RecurringWalletScanService recurringWalletScanService,
                              @Qualifier(AsyncConfig.ANALYSIS_SCHEDULER) Scheduler analysisScheduler) {
        this.analysisService = analysisService;
        this.recurringWalletScanService = recurringWalletScanService;
        this.analysisScheduler = analysisScheduler;
    }

    @PostMapping("/analysis")
    public Mono<AnalysisResult> analyze(
            @RequestHeader(name = WebClientTrackerHttpClient.API_KEY_HEADER, required = false) String apiKey,
            @Valid @RequestBody TokenListRequest request) {
        return Mono.fromCallable(() -> analysisService.analyzeTokens(apiKey, request.tokens()))
                .subscribeOn(analysisScheduler);
    }

    @PostMapping("/recurring-wallets")
    public Mono<RecurringScanResult> recurringWallets(
            @RequestHeader(name = WebClientTrackerHttpClient.API_KEY_HEADER, required = false) String apiKey,
            @Valid @RequestBody TokenListRequest request) {
        return Mono.fromCallable(() -> recurringWalletScanService.scan(apiKey, request.tokens()))
                .subscribeOn(analysisScheduler);
    }
}
