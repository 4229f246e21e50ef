package scanner.arbitrage.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Trading and withdrawal fees of one venue. Withdrawal fees are fixed amounts in units of the
 * withdrawn asset, keyed by asset symbol.
 */
@Value
@Builder(toBuilder = true)
public class FeeSchedule {
    String venueId;
    BigDecimal takerRate;
    @Singular
    Map<String, BigDecimal> withdrawalFees;
}
