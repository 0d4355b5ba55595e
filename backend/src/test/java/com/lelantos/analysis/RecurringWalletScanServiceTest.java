package com.lelantos.analysis;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lelantos.analysis.config.AnalysisProperties;
import com.lelantos.common.ManualTimeSource;
import com.lelantos.domain.RecurringScanResult;
import com.lelantos.domain.RecurringWalletRecord;
import com.lelantos.domain.RecurringWalletType;
import com.lelantos.tracker.ScriptedTrackerHttpClient;
import com.lelantos.tracker.TrackerEndpoint;
import com.lelantos.tracker.TrackerSessionRegistry;
import com.lelantos.tracker.config.TrackerProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.lelantos.tracker.ScriptedTrackerHttpClient.status;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecurringWalletScanServiceTest {

    private ScriptedTrackerHttpClient http;
    private RecurringWalletScanService service;

    @BeforeEach
    void setUp() {
        ManualTimeSource time = new ManualTimeSource(1_717_243_200_000L);
        http = new ScriptedTrackerHttpClient(time);
        TrackerSessionRegistry sessions = new TrackerSessionRegistry(http, new TrackerProperties(), time,
                new ObjectMapper());
        service = new RecurringWalletScanService(sessions, new AnalysisProperties(), time);

        http.respond(TrackerEndpoint.TOKEN_INFO, "tokA", "{\"token\": {\"symbol\": \"AAA\"}}");
        http.enqueue(TrackerEndpoint.TOKEN_INFO, "tokC", status(500), status(500), status(500));
        http.respond(TrackerEndpoint.FIRST_BUYERS, "tokA", """
                [{"wallet": "w1", "total": 10, "total_invested": 5}, {"wallet": "w2", "total": 0}]
                """);
        http.respond(TrackerEndpoint.FIRST_BUYERS, "tokB", """
                [{"wallet": "w1", "total": -4, "total_invested": 8}, {"wallet": "w9", "total": 1}]
                """);
        http.respond(TrackerEndpoint.FIRST_BUYERS, "tokC", "[{\"wallet\": \"w2\", \"total\": 3}]");
        http.respond(TrackerEndpoint.TOP_TRADERS, "tokA", "[{\"wallet\": \"t1\", \"pnl\": 100, \"roi\": 0.5, \"total\": 0}]");
        http.respond(TrackerEndpoint.TOP_TRADERS, "tokB", """
                {"traders": [{"owner": "t1", "pnl": 50, "roi": 0, "total": 80, "total_invested": 40}]}
                """);
    }

    @Test
    @DisplayName("early buyers recurring across tokens are aggregated and ranked")
    void recurringEarlyBuyers() {
        RecurringScanResult result = service.scan("key", List.of("tokA", "tokB", "tokC"));

        List<RecurringWalletRecord> buyers = result.earlyBuyers();
        assertThat(buyers).extracting(RecurringWalletRecord::address).containsExactly("w1", "w2");

        RecurringWalletRecord w1 = buyers.get(0);
        assertThat(w1.type()).isEqualTo(RecurringWalletType.EARLY_BUYER);
        assertThat(w1.occurrences()).isEqualTo(2);
        assertThat(w1.tokens()).containsExactly("tokA", "tokB");
        assertThat(w1.totalPnl()).isEqualByComparingTo("6");
        assertThat(w1.avgRoi()).isEqualByComparingTo("75");
        assertThat(w1.winRate()).isEqualTo(50);
        assertThat(w1.dataPoints()).extracting(RecurringWalletRecord.DataPoint::tokenSymbol)
                .containsExactly("AAA", "tokB");

        RecurringWalletRecord w2 = buyers.get(1);
        assertThat(w2.totalPnl()).isEqualByComparingTo("3");
        assertThat(w2.avgRoi()).isEqualByComparingTo("0");
        assertThat(w2.dataPoints().get(1).tokenSymbol()).isEqualTo("tokC");
    }

    @Test
    @DisplayName("early buyers fall back to pnl when total is zero or missing")
    void earlyBuyerPnlFallback() {
        http.respond(TrackerEndpoint.FIRST_BUYERS, "tokD", "[{\"wallet\": \"w5\", \"pnl\": 12}]");
        http.respond(TrackerEndpoint.FIRST_BUYERS, "tokE", "[{\"wallet\": \"w5\", \"total\": 0, \"pnl\": -2}]");

        RecurringScanResult result = service.scan("key", List.of("tokD", "tokE"));

        assertThat(result.earlyBuyers()).singleElement().satisfies(w5 -> {
            assertThat(w5.address()).isEqualTo("w5");
            assertThat(w5.totalPnl()).isEqualByComparingTo("10");
            assertThat(w5.winRate()).isEqualTo(50);
        });
    }

    @Test
    @DisplayName("top traders use total when non-zero, else pnl")
    void recurringTopTraders() {
        RecurringScanResult result = service.scan("key", List.of("tokA", "tokB"));

        assertThat(result.topTraders()).singleElement().satisfies(t1 -> {
            assertThat(t1.address()).isEqualTo("t1");
            assertThat(t1.type()).isEqualTo(RecurringWalletType.TOP_TRADER);
            assertThat(t1.totalPnl()).isEqualByComparingTo("180");
            assertThat(t1.avgRoi()).isEqualByComparingTo("100.25");
            assertThat(t1.winRate()).isEqualTo(100);
        });
    }

    @Test
    @DisplayName("needs at least two distinct tokens")
    void needsTwoTokens() {
        assertThatThrownBy(() -> service.scan("key", List.of("tokA", " tokA ")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Please analyze at least 2 tokens to find recurring wallets");
    }

    @Test
    @DisplayName("repeated scans reuse the session cache for top traders and metadata")
    void reusesSession() {
        service.scan("key", List.of("tokA", "tokB"));
        service.scan("key", List.of("tokA", "tokB"));

        assertThat(http.callsTo(TrackerEndpoint.TOP_TRADERS, "tokA")).isEqualTo(1);
        assertThat(http.callsTo(TrackerEndpoint.TOKEN_INFO, "tokA")).isEqualTo(1);
        assertThat(http.callsTo(TrackerEndpoint.FIRST_BUYERS, "tokA")).isEqualTo(2);
    }

    @Test
    @DisplayName("a wallet listed twice for one token is not recurring")
    void sameTokenTwiceIsNotRecurring() {
        Map<String, List<RecurringWalletRecord.DataPoint>> byWallet = new LinkedHashMap<>();
        byWallet.put("w", List.of(
                new RecurringWalletRecord.DataPoint("tokA", "AAA", BigDecimal.ONE, BigDecimal.ZERO, null),
                new RecurringWalletRecord.DataPoint("tokA", "AAA", BigDecimal.TEN, BigDecimal.ZERO, null)));

        assertThat(RecurringWalletScanService.fold(byWallet, RecurringWalletType.EARLY_BUYER)).isEmpty();
    }

    @Test
    @DisplayName("roi prefers upstream value, then total over invested")
    void roiFallbacks() {
        assertThat(RecurringWalletScanService.roi(new BigDecimal("1.5"), BigDecimal.TEN, BigDecimal.ONE))
                .isEqualByComparingTo("1.5");
        assertThat(RecurringWalletScanService.roi(BigDecimal.ZERO, BigDecimal.valueOf(5), BigDecimal.valueOf(20)))
                .isEqualByComparingTo("25");
        assertThat(RecurringWalletScanService.roi(null, BigDecimal.valueOf(5), BigDecimal.ZERO))
                .isEqualByComparingTo("0");
    }
}
