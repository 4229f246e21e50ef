package scanner.arbitrage.controller;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;
import scanner.arbitrage.fee.StaticFeeModel;
import scanner.arbitrage.model.ArbitrageOpportunity;
import scanner.arbitrage.model.FeeSchedule;
import scanner.arbitrage.model.FetchFailure;
import scanner.arbitrage.model.ScanReport;
import scanner.arbitrage.service.arbitrage.ScanOrchestrator;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ArbitrageControllerTest {

    private ScanOrchestrator scanOrchestrator;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        scanOrchestrator = mock(ScanOrchestrator.class);
        FeeSchedule defaultSchedule = FeeSchedule.builder().venueId("default").takerRate(new BigDecimal("0.002")).build();
        FeeSchedule okx = FeeSchedule.builder().venueId("okx").takerRate(new BigDecimal("0.0008")).build();
        StaticFeeModel feeModel = new StaticFeeModel(defaultSchedule, Map.of("okx", okx));
        client = WebTestClient.bindToRouterFunction(
                new ArbitrageController(scanOrchestrator, feeModel).arbitrageRoutes()).build();
    }

    private static ArbitrageOpportunity opportunity(String symbol, String pct) {
        return ArbitrageOpportunity.builder()
                .symbol(symbol)
                .buyVenue("binance")
                .sellVenue("okx")
                .buyPrice(BigDecimal.ONE)
                .sellPrice(BigDecimal.TEN)
                .netProfit(BigDecimal.ONE)
                .profitPercentage(new BigDecimal(pct))
                .detectedAt(Instant.parse("2024-05-01T12:00:00Z"))
                .build();
    }

    @Test
    void filtersOpportunitiesBySymbol() {
        when(scanOrchestrator.getAllArbitrageOpportunities()).thenReturn(List.of(
                opportunity("BTC/USDT", "1.5"),
                opportunity("ETH/USDT", "0.7")));

        client.get().uri("/arbitrage/opportunities?symbol=eth/usdt")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(1)
                .jsonPath("$[0].symbol").isEqualTo("ETH/USDT");

        client.get().uri("/arbitrage/opportunities")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(2);
    }

    @Test
    void listsFailuresOfLastCycle() {
        ScanReport report = ScanReport.builder()
                .opportunities(List.of())
                .failures(List.of(FetchFailure.timedOut("bybit", "BTC/USDT")))
                .build();
        when(scanOrchestrator.getLastReport()).thenReturn(report);

        client.get().uri("/arbitrage/failures")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[0].venueId").isEqualTo("bybit")
                .jsonPath("$[0].timedOut").isEqualTo(true);
    }

    @Test
    void manualScanReturnsReport() {
        ScanReport report = ScanReport.builder()
                .opportunities(List.of(opportunity("BTC/USDT", "1.5")))
                .failures(List.of())
                .quoteCount(6)
                .build();
        when(scanOrchestrator.runScanCycle()).thenReturn(Mono.just(report));

        client.post().uri("/arbitrage/scan")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.quoteCount").isEqualTo(6)
                .jsonPath("$.opportunities[0].symbol").isEqualTo("BTC/USDT");
    }

    @Test
    void showsResolvedFeeSchedule() {
        client.get().uri("/arbitrage/fees/OKX")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.takerRate").isEqualTo(0.0008);

        client.get().uri("/arbitrage/fees/kraken")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.venueId").isEqualTo("kraken")
                .jsonPath("$.takerRate").isEqualTo(0.002);
    }
}
