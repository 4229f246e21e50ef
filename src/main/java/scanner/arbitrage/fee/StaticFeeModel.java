package scanner.arbitrage.fee;

import lombok.extern.slf4j.Slf4j;
import scanner.arbitrage.config.ArbitrageProperties;
import scanner.arbitrage.model.FeeSchedule;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Fee model backed by a fixed table. Venue ids are matched case-insensitively.
 */
@Slf4j
public class StaticFeeModel implements FeeModel {

    static final BigDecimal DEFAULT_TAKER_RATE = new BigDecimal("0.002");

    private final FeeSchedule defaultSchedule;
    private final Map<String, FeeSchedule> venueSchedules;

    public StaticFeeModel(FeeSchedule defaultSchedule, Map<String, FeeSchedule> venueSchedules) {
        this.defaultSchedule = validate(defaultSchedule);
        Map<String, FeeSchedule> byVenue = new HashMap<>();
        venueSchedules.forEach((venue, schedule) -> byVenue.put(normalize(venue), validate(schedule)));
        this.venueSchedules = Collections.unmodifiableMap(byVenue);
    }

    /**
     * Builds the model from configuration. Venue overrides inherit the taker rate and withdrawal
     * table they leave unset from the default schedule.
     */
    public static StaticFeeModel fromProperties(ArbitrageProperties.Fees fees) {
        ArbitrageProperties.Schedule configuredDefault = fees.getDefaultSchedule();
        FeeSchedule defaultSchedule = FeeSchedule.builder()
                .venueId("default")
                .takerRate(configuredDefault.getTakerRate() != null ? configuredDefault.getTakerRate() : DEFAULT_TAKER_RATE)
                .withdrawalFees(nonNull(configuredDefault.getWithdrawalFees()))
                .build();

        Map<String, FeeSchedule> venues = new HashMap<>();
        fees.getVenues().forEach((venue, override) -> venues.put(venue, FeeSchedule.builder()
                .venueId(venue)
                .takerRate(override.getTakerRate() != null ? override.getTakerRate() : defaultSchedule.getTakerRate())
                .withdrawalFees(override.getWithdrawalFees() != null
                        ? override.getWithdrawalFees()
                        : defaultSchedule.getWithdrawalFees())
                .build()));

        log.info("Fee model loaded: default taker rate {}, {} venue override(s)",
                defaultSchedule.getTakerRate(), venues.size());
        return new StaticFeeModel(defaultSchedule, venues);
    }

    @Override
    public FeeSchedule resolve(String venueId) {
        if (venueId == null) {
            return defaultSchedule;
        }
        FeeSchedule schedule = venueSchedules.get(normalize(venueId));
        if (schedule != null) {
            return schedule;
        }
        return defaultSchedule.toBuilder().venueId(venueId).build();
    }

    /**
     * Returns a copy in which the given withdrawal fees replace the configured ones for the same
     * venue and asset. Venues without an explicit schedule get one based on the default.
     */
    public StaticFeeModel withWithdrawalFees(Map<String, Map<String, BigDecimal>> feesByVenue) {
        Map<String, FeeSchedule> merged = new HashMap<>(venueSchedules);
        feesByVenue.forEach((venue, assetFees) -> {
            FeeSchedule current = resolve(venue);
            Map<String, BigDecimal> withdrawal = new HashMap<>(current.getWithdrawalFees());
            withdrawal.putAll(assetFees);
            merged.put(normalize(venue), current.toBuilder()
                    .clearWithdrawalFees()
                    .withdrawalFees(withdrawal)
                    .build());
        });
        return new StaticFeeModel(defaultSchedule, merged);
    }

    public FeeSchedule getDefaultSchedule() {
        return defaultSchedule;
    }

    private static FeeSchedule validate(FeeSchedule schedule) {
        if (schedule.getTakerRate() == null || schedule.getTakerRate().signum() < 0) {
            throw new IllegalArgumentException("Taker rate must be >= 0 for venue " + schedule.getVenueId());
        }
        schedule.getWithdrawalFees().forEach((asset, fee) -> {
            if (fee == null || fee.signum() < 0) {
                throw new IllegalArgumentException(
                        "Withdrawal fee for " + asset + " must be >= 0 on venue " + schedule.getVenueId());
            }
        });
        return schedule;
    }

    private static Map<String, BigDecimal> nonNull(Map<String, BigDecimal> fees) {
        return fees != null ? fees : Map.of();
    }

    private static String normalize(String venueId) {
        return venueId.toLowerCase(Locale.ROOT);
    }
}
