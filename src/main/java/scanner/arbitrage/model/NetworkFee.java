package scanner.arbitrage.model;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class NetworkFee {
    BigDecimal fee;
    // true when the venue charges a share of the amount instead of a fixed fee
    boolean percentage;

    public static NetworkFee fixed(BigDecimal fee) {
        return new NetworkFee(fee, false);
    }
}
