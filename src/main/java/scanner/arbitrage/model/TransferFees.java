package scanner.arbitrage.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.Map;
import java.util.Optional;

/**
 * Deposit and withdrawal fees of one asset on one venue, per network.
 */
@Value
@Builder
public class TransferFees {
    String venueId;
    String asset;
    @Singular("depositNetwork")
    Map<String, NetworkFee> depositNetworks;
    @Singular("withdrawNetwork")
    Map<String, NetworkFee> withdrawNetworks;

    /**
     * Cheapest fixed withdrawal fee across networks. Percentage-based networks are skipped since
     * they cannot be expressed in asset units.
     */
    public Optional<BigDecimal> cheapestFixedWithdrawalFee() {
        return withdrawNetworks.values().stream()
                .filter(fee -> !fee.isPercentage())
                .map(NetworkFee::getFee)
                .filter(fee -> fee != null && fee.signum() >= 0)
                .min(Comparator.naturalOrder());
    }
}
