package scanner.arbitrage.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Top-of-book quote observed on one venue for one symbol.
 */
@Value
@Builder
public class Quote {
    String venueId;
    String symbol;
    BigDecimal bid;
    BigDecimal ask;
    Instant observedAt;

    /**
     * A quote can be scanned only when both sides are present, positive and not crossed.
     */
    public boolean isTradable() {
        return bid != null && ask != null
                && bid.signum() > 0 && ask.signum() > 0
                && bid.compareTo(ask) <= 0;
    }

    public BigDecimal midPrice() {
        if (bid == null || ask == null) {
            return bid != null ? bid : ask;
        }
        return bid.add(ask).divide(BigDecimal.valueOf(2));
    }
}
