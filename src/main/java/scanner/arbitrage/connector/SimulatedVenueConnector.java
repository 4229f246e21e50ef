package scanner.arbitrage.connector;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import scanner.arbitrage.config.ArbitrageProperties;
import scanner.arbitrage.model.NetworkFee;
import scanner.arbitrage.model.Quote;
import scanner.arbitrage.model.TransferFees;
import scanner.arbitrage.model.VenueKind;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Demo venue producing a random walk of prices with a fixed spread and simulated network latency.
 */
@Slf4j
public class SimulatedVenueConnector implements VenueConnector {

    private static final BigDecimal DEFAULT_BASE_PRICE = new BigDecimal("50000");
    private static final BigDecimal BID_FACTOR = new BigDecimal("0.9998");
    private static final BigDecimal ASK_FACTOR = new BigDecimal("1.0002");
    private static final int PRICE_SCALE = 8;

    private final ArbitrageProperties.Venue venue;
    private final Random random;
    private final Map<String, BigDecimal> lastPrices = new ConcurrentHashMap<>();

    public SimulatedVenueConnector(ArbitrageProperties.Venue venue) {
        this(venue, new Random());
    }

    SimulatedVenueConnector(ArbitrageProperties.Venue venue, Random random) {
        this.venue = venue;
        this.random = random;
    }

    @Override
    public String venueId() {
        return venue.getId();
    }

    @Override
    public VenueKind kind() {
        return venue.getKind();
    }

    @Override
    public Mono<Quote> fetchTicker(String symbol) {
        return Mono.delay(Duration.ofMillis(nextLatencyMs()))
                .map(tick -> nextQuote(symbol));
    }

    @Override
    public Mono<TransferFees> fetchTransferFees(String asset) {
        BigDecimal fee = venue.getWithdrawalFees().get(asset);
        if (fee == null) {
            return Mono.empty();
        }
        log.debug("Simulated transfer fees for {} on {}: {}", asset, venue.getId(), fee);
        return Mono.just(TransferFees.builder()
                .venueId(venue.getId())
                .asset(asset)
                .depositNetwork("DEFAULT", NetworkFee.fixed(BigDecimal.ZERO))
                .withdrawNetwork("DEFAULT", NetworkFee.fixed(fee))
                .build());
    }

    private Quote nextQuote(String symbol) {
        BigDecimal price = lastPrices.compute(symbol, (key, last) -> {
            BigDecimal reference = last != null ? last : initialPrice(key);
            // drift within +/-0.1% per tick
            BigDecimal drift = BigDecimal.valueOf(0.999 + random.nextDouble() * 0.002);
            return reference.multiply(drift).setScale(PRICE_SCALE, RoundingMode.HALF_UP);
        });
        return Quote.builder()
                .venueId(venue.getId())
                .symbol(symbol)
                .bid(price.multiply(BID_FACTOR).setScale(PRICE_SCALE, RoundingMode.HALF_UP))
                .ask(price.multiply(ASK_FACTOR).setScale(PRICE_SCALE, RoundingMode.HALF_UP))
                .observedAt(Instant.now())
                .build();
    }

    private BigDecimal initialPrice(String symbol) {
        BigDecimal configured = venue.getBasePrices().get(symbol);
        if (configured != null) {
            return configured;
        }
        return DEFAULT_BASE_PRICE.add(BigDecimal.valueOf(random.nextDouble() * 200 - 100));
    }

    private long nextLatencyMs() {
        long min = Math.max(0, venue.getMinLatencyMs());
        long span = Math.max(0, venue.getMaxLatencyMs() - min);
        return min + (span == 0 ? 0 : random.nextInt((int) Math.min(span, Integer.MAX_VALUE - 1) + 1));
    }
}
