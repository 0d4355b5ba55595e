package com.lelantos.api.controller;

import com.lelantos.analysis.WalletLookupService;
import com.lelantos.domain.TraderRecord;
import com.lelantos.domain.WalletSummary;
import com.lelantos.tracker.MissingCredentialException;
import com.lelantos.tracker.WebClientTrackerHttpClient;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@SpringBootTest
@AutoConfigureWebTestClient
class LookupControllerTest {

    private static final String TOKEN = "DezXAZ8z7PnrnRJjz3wXBoRgixCa6xjnB7YaB1pPB263";
    private static final String WALLET = "5Q544fKrFoe6tsEbD7S8EmxGTJYAKtTVhAW5Q5pge4j1";

    @Autowired
    WebTestClient webTestClient;

    @MockBean
    WalletLookupService lookupService;

    @Test
    @DisplayName("GET top-traders returns the trader list")
    void topTraders() {
        when(lookupService.getTopTraders("test-key", TOKEN)).thenReturn(List.of(
                new TraderRecord("w1", BigDecimal.valueOf(1500), BigDecimal.valueOf(2.5), 12, null, null)));

        webTestClient.get().uri("/api/v1/tokens/{address}/top-traders", TOKEN)
                .header(WebClientTrackerHttpClient.API_KEY_HEADER, "test-key")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[0].wallet").isEqualTo("w1")
                .jsonPath("$[0].trades").isEqualTo(12);
    }

    @Test
    @DisplayName("GET first-buyers with invalid address returns 400 without calling upstream")
    void invalidAddress() {
        webTestClient.get().uri("/api/v1/tokens/{address}/first-buyers", "not-base58!")
                .header(WebClientTrackerHttpClient.API_KEY_HEADER, "test-key")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_ADDRESS");
        verifyNoInteractions(lookupService);
    }

    @Test
    @DisplayName("GET pnl returns the summary, or 404 when there is none")
    void walletPnl() {
        WalletSummary summary = new WalletSummary(BigDecimal.ZERO, 0, 75, BigDecimal.ZERO,
                BigDecimal.valueOf(900), BigDecimal.valueOf(-50), 3, 1);
        when(lookupService.getWalletPnl("test-key", WALLET)).thenReturn(Optional.of(summary));
        when(lookupService.getWalletPnl("test-key", TOKEN)).thenReturn(Optional.empty());

        webTestClient.get().uri("/api/v1/wallets/{address}/pnl", WALLET)
                .header(WebClientTrackerHttpClient.API_KEY_HEADER, "test-key")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.winRate").isEqualTo(75)
                .jsonPath("$.profitablePositions").isEqualTo(3);

        webTestClient.get().uri("/api/v1/wallets/{address}/pnl", TOKEN)
                .header(WebClientTrackerHttpClient.API_KEY_HEADER, "test-key")
                .exchange()
                .expectStatus().isNotFound();
    }

    @Test
    @DisplayName("GET without api key returns 401")
    void missingApiKey() {
        when(lookupService.getFirstBuyers(isNull(), eq(TOKEN))).thenThrow(new MissingCredentialException());

        webTestClient.get().uri("/api/v1/tokens/{address}/first-buyers", TOKEN)
                .exchange()
                .expectStatus().isUnauthorized()
                .expectBody()
                .jsonPath("$.error").isEqualTo("MISSING_API_KEY");
    }

    @Test
    @DisplayName("unexpected failure returns 500 ANALYSIS_FAILED")
    void unexpectedFailure() {
        when(lookupService.getTopTraders(any(), eq(TOKEN))).thenThrow(new IllegalStateException("boom"));

        webTestClient.get().uri("/api/v1/tokens/{address}/top-traders", TOKEN)
                .header(WebClientTrackerHttpClient.API_KEY_HEADER, "test-key")
                .exchange()
                .expectStatus().is5xxServerError()
                .expectBody()
                .jsonPath("$.error").isEqualTo("ANALYSIS_FAILED");
    }
}
