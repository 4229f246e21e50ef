package scanner.arbitrage.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Full-precision economics of buying one unit on {@code buyVenue} and selling it on
 * {@code sellVenue}. All amounts are in quote currency.
 */
@Value
@Builder
public class VenuePairResult {
    String symbol;
    String buyVenue;
    String sellVenue;
    BigDecimal buyPrice;
    BigDecimal sellPrice;
    BigDecimal buyFee;
    BigDecimal sellFee;
    BigDecimal withdrawalFee;
    BigDecimal totalCost;
    BigDecimal netRevenue;
    BigDecimal grossProfit;
    BigDecimal netProfit;
    BigDecimal profitPercentage;

    public BigDecimal getTotalFees() {
        return buyFee.add(sellFee).add(withdrawalFee);
    }
}
