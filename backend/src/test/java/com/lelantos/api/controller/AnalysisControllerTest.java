package com.lelantos.api.controller;

import com.lelantos.tracker.TrackerEndpoint;
import com.lelantos.tracker.TrackerHttpClient;
import com.lelantos.tracker.TrackerHttpResponse;
import com.lelantos.tracker.WebClientTrackerHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.time.Duration;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

/**
 * POST /analysis and /recurring-wallets through the whole stack, with the tracker API stubbed.
 */
@SpringBootTest(properties = {
        "lelantos.tracker.min-interval-ms=0",
        "lelantos.analysis.empty-holder-retry-delay-ms=0"
})
@AutoConfigureWebTestClient
class AnalysisControllerTest {

    private static final String TOKEN_A = "DezXAZ8z7PnrnRJjz3wXBoRgixCa6xjnB7YaB1pPB263";
    private static final String TOKEN_B = "EPjFWdd5AufqSSqeM2qN1xzybapC8G4wEGGkZwyTDt1v";

    @Autowired
    WebTestClient webTestClient;

    @MockBean
    TrackerHttpClient trackerHttpClient;

    @BeforeEach
    void stubTracker() {
        webTestClient = webTestClient.mutate().responseTimeout(Duration.ofSeconds(30)).build();
        when(trackerHttpClient.get(anyString(), anyString(), anyString())).thenAnswer(inv -> {
            String uri = inv.getArgument(0);
            String subject = inv.getArgument(1);
            return Mono.just(new TrackerHttpResponse(200, body(uri, subject)));
        });
    }

    private static String body(String uri, String subject) {
        if (uri.equals(TrackerEndpoint.TOKEN_INFO.getUriTemplate())) {
            return "{\"token\": {\"name\": \"Token " + subject.substring(0, 4) + "\"}, \"totalSupply\": 1000}";
        }
        if (uri.equals(TrackerEndpoint.TOKEN_HOLDERS.getUriTemplate())) {
            return "{\"accounts\": [{\"owner\": \"shared\", \"amount\": 10}, {\"owner\": \"" + subject + "-only\", \"amount\": 5}]}";
        }
        if (uri.equals(TrackerEndpoint.WALLET_BASIC.getUriTemplate())) {
            return "{\"total\": 30000}";
        }
        if (uri.equals(TrackerEndpoint.FIRST_BUYERS.getUriTemplate())) {
            return "[{\"wallet\": \"early\", \"total\": 4}]";
        }
        return "[]";
    }

    @Test
    @DisplayName("POST /analysis returns ranked, tagged overlaps")
    void analyze() {
        String body = """
                {"tokens": ["%s", "%s"]}
                """.formatted(TOKEN_A, TOKEN_B);
        webTestClient.post().uri("/api/v1/analysis")
                .header(WebClientTrackerHttpClient.API_KEY_HEADER, "test-key")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.overlaps.length()").isEqualTo(1)
                .jsonPath("$.overlaps[0].address").isEqualTo("shared")
                .jsonPath("$.overlaps[0].score").isEqualTo(6)
                .jsonPath("$.overlaps[0].tags[0]").isEqualTo("Whale")
                .jsonPath("$.overlaps[0].walletSummary.portfolioValueUsd").isEqualTo(30000)
                .jsonPath("$.processedTokens.length()").isEqualTo(2)
                .jsonPath("$.tokenMap." + TOKEN_A + ".name").isEqualTo("Token DezX")
                .jsonPath("$.skippedTokens.length()").isEqualTo(0);
    }

    @Test
    @DisplayName("POST /recurring-wallets returns wallets recurring among first buyers")
    void recurringWallets() {
        String body = """
                {"tokens": ["%s", "%s"]}
                """.formatted(TOKEN_A, TOKEN_B);
        webTestClient.post().uri("/api/v1/recurring-wallets")
                .header(WebClientTrackerHttpClient.API_KEY_HEADER, "test-key")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.earlyBuyers[0].address").isEqualTo("early")
                .jsonPath("$.earlyBuyers[0].occurrences").isEqualTo(2)
                .jsonPath("$.earlyBuyers[0].type").isEqualTo("EARLY_BUYER")
                .jsonPath("$.topTraders.length()").isEqualTo(0);
    }

    @Test
    @DisplayName("POST /recurring-wallets with a single token returns 400")
    void recurringWalletsNeedsTwoTokens() {
        webTestClient.post().uri("/api/v1/recurring-wallets")
                .header(WebClientTrackerHttpClient.API_KEY_HEADER, "test-key")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"tokens\": [\"" + TOKEN_A + "\"]}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_REQUEST");
    }

    @Test
    @DisplayName("POST /analysis without api key returns 401")
    void missingApiKey() {
        webTestClient.post().uri("/api/v1/analysis")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"tokens\": [\"" + TOKEN_A + "\"]}")
                .exchange()
                .expectStatus().isUnauthorized()
                .expectBody()
                .jsonPath("$.error").isEqualTo("MISSING_API_KEY");
    }

    @Test
    @DisplayName("POST /analysis with an empty token list returns 400")
    void emptyTokenList() {
        webTestClient.post().uri("/api/v1/analysis")
                .header(WebClientTrackerHttpClient.API_KEY_HEADER, "test-key")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"tokens\": []}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_REQUEST");
    }

    @Test
    @DisplayName("POST /analysis with an invalid address returns 400")
    void invalidAddress() {
        webTestClient.post().uri("/api/v1/analysis")
                .header(WebClientTrackerHttpClient.API_KEY_HEADER, "test-key")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"tokens\": [\"" + TOKEN_A + "\", \"not-an-address\"]}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_ADDRESS");
    }
}
