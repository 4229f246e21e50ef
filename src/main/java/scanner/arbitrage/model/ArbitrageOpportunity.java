package scanner.arbitrage.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Comparator;

@Value
@Builder
public class ArbitrageOpportunity {

    public static final Comparator<ArbitrageOpportunity> BY_PROFIT_PERCENTAGE_DESC =
            Comparator.comparing(ArbitrageOpportunity::getProfitPercentage).reversed()
                    .thenComparing(ArbitrageOpportunity::getSymbol)
                    .thenComparing(ArbitrageOpportunity::getBuyVenue)
                    .thenComparing(ArbitrageOpportunity::getSellVenue);

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
    BigDecimal totalFees;
    BigDecimal netProfit;
    BigDecimal profitPercentage;
    Instant detectedAt;
}
