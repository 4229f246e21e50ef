package scanner.arbitrage.fee;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import scanner.arbitrage.config.ArbitrageProperties;
import scanner.arbitrage.connector.VenueConnector;
import scanner.arbitrage.connector.VenueConnectorRegistry;
import scanner.arbitrage.model.TransferFees;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Pulls live withdrawal fees from the venues and installs them in the fee model between scans.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "arbitrage.fees.refresh-enabled", havingValue = "true")
public class TransferFeeRefresher {

    private final RefreshableFeeModel feeModel;
    private final VenueConnectorRegistry venueConnectorRegistry;
    private final ArbitrageProperties properties;

    @Scheduled(fixedRateString = "${arbitrage.fees.refresh-interval:300000}")
    public void scheduledRefresh() {
        refresh().subscribe(
                updated -> log.info("Transfer fees refreshed: {} venue/asset fee(s) updated", updated),
                error -> log.error("Transfer fee refresh failed: {}", error.getMessage(), error)
        );
    }

    /**
     * Emits the number of venue/asset fees installed. Venues that fail or publish nothing keep
     * their current fees.
     */
    public Mono<Integer> refresh() {
        Set<String> assets = baseAssets(properties.getSymbols());
        List<VenueConnector> connectors = venueConnectorRegistry.getConnectors();

        return Flux.fromIterable(connectors)
                .flatMap(connector -> Flux.fromIterable(assets)
                        .flatMap(asset -> fetch(connector, asset)))
                .collectList()
                .map(this::install);
    }

    private Flux<TransferFees> fetch(VenueConnector connector, String asset) {
        return Mono.defer(() -> connector.fetchTransferFees(asset))
                .flux()
                .onErrorResume(error -> {
                    log.warn("Could not fetch transfer fees for {} from {}: {}",
                            asset, connector.venueId(), error.getMessage());
                    return Flux.empty();
                });
    }

    private int install(List<TransferFees> fetched) {
        Map<String, Map<String, BigDecimal>> byVenue = new HashMap<>();
        int count = 0;
        for (TransferFees fees : fetched) {
            BigDecimal fee = fees.cheapestFixedWithdrawalFee().orElse(null);
            if (fee == null || fees.getVenueId() == null) {
                log.debug("No fixed withdrawal network for {} on {}", fees.getAsset(), fees.getVenueId());
                continue;
            }
            byVenue.computeIfAbsent(fees.getVenueId(), venue -> new HashMap<>()).put(fees.getAsset(), fee);
            count++;
        }
        if (!byVenue.isEmpty()) {
            feeModel.update(current -> current.withWithdrawalFees(byVenue));
        }
        return count;
    }

    static Set<String> baseAssets(List<String> symbols) {
        Set<String> assets = new LinkedHashSet<>();
        for (String symbol : symbols) {
            int separator = symbol.indexOf('/');
            assets.add(separator < 0 ? symbol : symbol.substring(0, separator));
        }
        return assets;
    }
}
