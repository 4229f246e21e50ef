package scanner.arbitrage.connector;

import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;
import scanner.arbitrage.config.ArbitrageProperties;
import scanner.arbitrage.model.Quote;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class SimulatedVenueConnectorTest {

    private static ArbitrageProperties.Venue venue() {
        ArbitrageProperties.Venue venue = new ArbitrageProperties.Venue();
        venue.setId("sim");
        venue.setMinLatencyMs(0);
        venue.setMaxLatencyMs(0);
        venue.setBasePrices(Map.of("BTC/USDT", new BigDecimal("100")));
        venue.setWithdrawalFees(Map.of("BTC", new BigDecimal("0.0005")));
        return venue;
    }

    @Test
    void quotesTightSpreadAroundBasePrice() {
        SimulatedVenueConnector connector = new SimulatedVenueConnector(venue(), new Random(42));

        StepVerifier.create(connector.fetchTicker("BTC/USDT"))
                .assertNext(quote -> {
                    assertThat(quote.getVenueId()).isEqualTo("sim");
                    assertThat(quote.isTradable()).isTrue();
                    assertThat(quote.getBid()).isLessThan(quote.getAsk());
                    assertThat(quote.getBid()).isBetween(new BigDecimal("99.8"), new BigDecimal("100.2"));
                    assertThat(quote.getAsk()).isBetween(new BigDecimal("99.8"), new BigDecimal("100.2"));
                    assertThat(quote.getObservedAt()).isNotNull();
                })
                .verifyComplete();
    }

    @Test
    void pricesWalkFromThePreviousTick() {
        SimulatedVenueConnector connector = new SimulatedVenueConnector(venue(), new Random(7));

        Quote first = connector.fetchTicker("BTC/USDT").block();
        Quote second = connector.fetchTicker("BTC/USDT").block();

        BigDecimal limit = first.midPrice().multiply(new BigDecimal("0.0011"));
        assertThat(second.midPrice().subtract(first.midPrice()).abs()).isLessThanOrEqualTo(limit);
    }

    @Test
    void unconfiguredSymbolStartsNearDefaultPrice() {
        SimulatedVenueConnector connector = new SimulatedVenueConnector(venue(), new Random(1));

        StepVerifier.create(connector.fetchTicker("ETH/USDT"))
                .assertNext(quote -> assertThat(quote.midPrice())
                        .isBetween(new BigDecimal("49800"), new BigDecimal("50200")))
                .verifyComplete();
    }

    @Test
    void publishesConfiguredWithdrawalFees() {
        SimulatedVenueConnector connector = new SimulatedVenueConnector(venue(), new Random(1));

        StepVerifier.create(connector.fetchTransferFees("BTC"))
                .assertNext(fees -> {
                    assertThat(fees.getVenueId()).isEqualTo("sim");
                    assertThat(fees.cheapestFixedWithdrawalFee()).hasValue(new BigDecimal("0.0005"));
                })
                .verifyComplete();
        StepVerifier.create(connector.fetchTransferFees("DOGE")).verifyComplete();
    }
}
