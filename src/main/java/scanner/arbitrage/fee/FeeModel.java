package scanner.arbitrage.fee;

import scanner.arbitrage.model.FeeSchedule;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Map;

/**
 * Source of per-venue fee schedules. Lookups never fail: venues without an explicit entry get the
 * default schedule.
 */
public interface FeeModel {

    FeeSchedule resolve(String venueId);

    /**
     * Fixed withdrawal fee for {@code asset} in units of that asset, or zero when the schedule has
     * none.
     */
    default BigDecimal withdrawalFee(FeeSchedule schedule, String asset) {
        Map<String, BigDecimal> fees = schedule.getWithdrawalFees();
        if (fees == null || asset == null) {
            return BigDecimal.ZERO;
        }
        BigDecimal fee = fees.get(asset);
        if (fee == null) {
            fee = fees.get(asset.toUpperCase(Locale.ROOT));
        }
        return fee != null ? fee : BigDecimal.ZERO;
    }

    /**
     * Immutable view to use for the duration of one scan.
     */
    default FeeModel snapshot() {
        return this;
    }
}
