package scanner.arbitrage.connector;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import scanner.arbitrage.config.ArbitrageProperties;
import scanner.arbitrage.config.VenueWebClientFactory;

@Slf4j
@Component
@RequiredArgsConstructor
public class VenueConnectorFactory {

    private final VenueWebClientFactory webClientFactory;
    private final ObjectMapper objectMapper;

    public VenueConnector create(ArbitrageProperties.Venue venue) {
        if (venue.getId() == null || venue.getId().isBlank()) {
            throw new IllegalStateException("Venue id is required");
        }
        log.info("Creating {} connector for {} venue {}", venue.getMode(), venue.getKind(), venue.getId());
        switch (venue.getMode()) {
            case SIMULATED:
                return new SimulatedVenueConnector(venue);
            case TICKER:
                requireHttpSettings(venue);
                if (venue.getTickerPath() == null) {
                    throw new IllegalStateException("ticker-path is required for venue " + venue.getId());
                }
                return new ExchangeTickerConnector(venue, webClientFactory.create(venue), objectMapper);
            case DEXSCREENER:
                requireHttpSettings(venue);
                if (venue.getChainId() == null) {
                    throw new IllegalStateException("chain-id is required for venue " + venue.getId());
                }
                return new DexScreenerConnector(venue, webClientFactory.create(venue), objectMapper);
            default:
                throw new IllegalArgumentException("Unsupported connector mode " + venue.getMode());
        }
    }

    private void requireHttpSettings(ArbitrageProperties.Venue venue) {
        if (venue.getBaseUrl() == null || venue.getBaseUrl().isBlank()) {
            throw new IllegalStateException("base-url is required for venue " + venue.getId());
        }
    }
}
