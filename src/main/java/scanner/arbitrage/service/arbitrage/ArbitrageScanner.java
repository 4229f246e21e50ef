package scanner.arbitrage.service.arbitrage;

import lombok.extern.slf4j.Slf4j;
import scanner.arbitrage.fee.FeeModel;
import scanner.arbitrage.model.ArbitrageOpportunity;
import scanner.arbitrage.model.FeeSchedule;
import scanner.arbitrage.model.Quote;
import scanner.arbitrage.model.VenuePairResult;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Finds fee-adjusted arbitrage between every ordered pair of venues quoting the same symbol.
 * Stateless: the result depends only on the arguments.
 */
@Slf4j
public class ArbitrageScanner {

    static final int DISPLAY_SCALE = 4;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    /**
     * Opportunities above {@code thresholdPct}, grouped by symbol in the order symbols first
     * appear in {@code quotes}. Both directions of a venue pair may be reported.
     */
    public List<ArbitrageOpportunity> scan(List<Quote> quotes, FeeModel feeModel, BigDecimal thresholdPct) {
        Objects.requireNonNull(quotes, "quotes");
        Objects.requireNonNull(feeModel, "feeModel");
        Objects.requireNonNull(thresholdPct, "thresholdPct");

        List<ArbitrageOpportunity> opportunities = new ArrayList<>();
        groupValidQuotes(quotes).forEach((symbol, symbolQuotes) -> {
            if (symbolQuotes.size() < 2) {
                log.debug("Skipping {}: fewer than two venues quoting", symbol);
                return;
            }
            for (VenuePair pair : enumeratePairs(symbolQuotes)) {
                if (pair.getBuy().getAsk().compareTo(pair.getSell().getBid()) >= 0) {
                    continue;
                }
                VenuePairResult result = evaluatePair(pair.getBuy(), pair.getSell(), feeModel);
                if (result.getNetProfit().signum() <= 0) {
                    log.debug("{} {} -> {} unprofitable after fees: {}",
                            symbol, result.getBuyVenue(), result.getSellVenue(), result.getNetProfit());
                    continue;
                }
                if (result.getProfitPercentage().compareTo(thresholdPct) <= 0) {
                    continue;
                }
                opportunities.add(toOpportunity(result, pair));
            }
        });
        return opportunities;
    }

    /**
     * Tradable quotes by symbol, one per venue. When a venue quotes a symbol more than once the
     * latest observation wins.
     */
    public Map<String, List<Quote>> groupValidQuotes(Collection<Quote> quotes) {
        Map<String, Map<String, Quote>> bySymbol = new LinkedHashMap<>();
        for (Quote quote : quotes) {
            if (quote == null || quote.getSymbol() == null || quote.getVenueId() == null || !quote.isTradable()) {
                continue;
            }
            bySymbol.computeIfAbsent(quote.getSymbol(), symbol -> new LinkedHashMap<>())
                    .merge(quote.getVenueId(), quote, ArbitrageScanner::latest);
        }
        Map<String, List<Quote>> grouped = new LinkedHashMap<>();
        bySymbol.forEach((symbol, byVenue) -> grouped.put(symbol, List.copyOf(byVenue.values())));
        return grouped;
    }

    /**
     * All ordered pairs of distinct venues: n quotes give n * (n - 1) pairs.
     */
    public List<VenuePair> enumeratePairs(List<Quote> symbolQuotes) {
        List<VenuePair> pairs = new ArrayList<>(symbolQuotes.size() * Math.max(0, symbolQuotes.size() - 1));
        for (Quote buy : symbolQuotes) {
            for (Quote sell : symbolQuotes) {
                if (!buy.getVenueId().equals(sell.getVenueId())) {
                    pairs.add(new VenuePair(buy, sell));
                }
            }
        }
        return pairs;
    }

    /**
     * Economics of buying one unit at {@code buy}'s ask and selling it at {@code sell}'s bid. The
     * withdrawal fee is charged by the buy venue and converted at the buy price.
     */
    public VenuePairResult evaluatePair(Quote buy, Quote sell, FeeModel feeModel) {
        FeeSchedule buySchedule = feeModel.resolve(buy.getVenueId());
        FeeSchedule sellSchedule = feeModel.resolve(sell.getVenueId());

        BigDecimal buyPrice = buy.getAsk();
        BigDecimal sellPrice = sell.getBid();

        BigDecimal buyFee = buyPrice.multiply(buySchedule.getTakerRate());
        BigDecimal totalCost = buyPrice.add(buyFee);
        BigDecimal sellFee = sellPrice.multiply(sellSchedule.getTakerRate());
        BigDecimal netRevenue = sellPrice.subtract(sellFee);

        BigDecimal withdrawalFeeInAsset = feeModel.withdrawalFee(buySchedule, baseAsset(buy.getSymbol()));
        BigDecimal withdrawalFee = withdrawalFeeInAsset.multiply(buyPrice);

        BigDecimal netProfit = netRevenue.subtract(totalCost).subtract(withdrawalFee);
        BigDecimal profitPercentage = totalCost.signum() == 0
                ? BigDecimal.ZERO
                : netProfit.divide(totalCost, MathContext.DECIMAL128).multiply(HUNDRED);

        return VenuePairResult.builder()
                .symbol(buy.getSymbol())
                .buyVenue(buy.getVenueId())
                .sellVenue(sell.getVenueId())
                .buyPrice(buyPrice)
                .sellPrice(sellPrice)
                .buyFee(buyFee)
                .sellFee(sellFee)
                .withdrawalFee(withdrawalFee)
                .totalCost(totalCost)
                .netRevenue(netRevenue)
                .grossProfit(sellPrice.subtract(buyPrice))
                .netProfit(netProfit)
                .profitPercentage(profitPercentage)
                .build();
    }

    static String baseAsset(String symbol) {
        int separator = symbol.indexOf('/');
        return separator < 0 ? symbol : symbol.substring(0, separator);
    }

    private static ArbitrageOpportunity toOpportunity(VenuePairResult result, VenuePair pair) {
        Instant detectedAt = latest(pair.getBuy(), pair.getSell()).getObservedAt();
        return ArbitrageOpportunity.builder()
                .symbol(result.getSymbol())
                .buyVenue(result.getBuyVenue())
                .sellVenue(result.getSellVenue())
                .buyPrice(round(result.getBuyPrice()))
                .sellPrice(round(result.getSellPrice()))
                .buyFee(round(result.getBuyFee()))
                .sellFee(round(result.getSellFee()))
                .withdrawalFee(round(result.getWithdrawalFee()))
                .totalCost(round(result.getTotalCost()))
                .netRevenue(round(result.getNetRevenue()))
                .grossProfit(round(result.getGrossProfit()))
                .totalFees(round(result.getTotalFees()))
                .netProfit(round(result.getNetProfit()))
                .profitPercentage(round(result.getProfitPercentage()))
                .detectedAt(detectedAt)
                .build();
    }

    private static Quote latest(Quote first, Quote second) {
        if (first.getObservedAt() == null) {
            return second;
        }
        if (second.getObservedAt() == null) {
            return first;
        }
        return second.getObservedAt().isAfter(first.getObservedAt()) ? second : first;
    }

    private static BigDecimal round(BigDecimal value) {
        return value.setScale(DISPLAY_SCALE, RoundingMode.HALF_UP);
    }
}
