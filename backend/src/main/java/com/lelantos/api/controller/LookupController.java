package com.lelantos.api.controller;

import com.lelantos.analysis.WalletLookupService;
import com.lelantos.api.dto.ErrorBody;
import com.lelantos.api.validation.AddressValidator;
import com.lelantos.config.AsyncConfig;
import com.lelantos.tracker.WebClientTrackerHttpClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.util.concurrent.Callable;

/**
 * GET /tokens/{address}/first-buyers, GET /tokens/{address}/top-traders, GET /wallets/{address}/pnl.
 */
@RestController
@RequestMapping("/api/v1")
public class LookupController {

    private final WalletLookupService lookupService;
    private final AddressValidator addressValidator;
    private final Scheduler analysisScheduler;

    public LookupController(WalletLookupService lookupService,
                            AddressValidator addressValidator,
                            @Qualifier(AsyncConfig.ANALYSIS_SCHEDULER) Scheduler analysisScheduler) {
        this.lookupService = lookupService;
        this.addressValidator = addressValidator;
        this.analysisScheduler = analysisScheduler;
    }

    @GetMapping("/tokens/{address}/first-buyers")
    public Mono<ResponseEntity<?>> firstBuyers(
            @RequestHeader(name = WebClientTrackerHttpClient.API_KEY_HEADER, required = false) String apiKey,
            @PathVariable String address) {
        return validated(address, () -> ResponseEntity.ok(lookupService.getFirstBuyers(apiKey, address)));
    }

    @GetMapping("/tokens/{address}/top-traders")
    public Mono<ResponseEntity<?>> topTraders(
            @RequestHeader(name = WebClientTrackerHttpClient.API_KEY_HEADER, required = false) String apiKey,
            @PathVariable String address) {
        return validated(address, () -> ResponseEntity.ok(lookupService.getTopTraders(apiKey, address)));
    }

    @GetMapping("/wallets/{address}/pnl")
    public Mono<ResponseEntity<?>> walletPnl(
            @RequestHeader(name = WebClientTrackerHttpClient.API_KEY_HEADER, required = false) String apiKey,
            @PathVariable String address) {
        return validated(address, () -> lookupService.getWalletPnl(apiKey, address)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build()));
    }

    private Mono<ResponseEntity<?>> validated(String address, Callable<ResponseEntity<?>> lookup) {
        if (!addressValidator.isValidAddress(address)) {
            return Mono.just(ResponseEntity.badRequest().body(ErrorBody.of("INVALID_ADDRESS", "Invalid Solana address")));
        }
        return Mono.fromCallable(lookup).subscribeOn(analysisScheduler);
    }
}
