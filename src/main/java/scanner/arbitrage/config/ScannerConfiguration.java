package scanner.arbitrage.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import scanner.arbitrage.connector.VenueConnector;
import scanner.arbitrage.connector.VenueConnectorFactory;
import scanner.arbitrage.connector.VenueConnectorRegistry;
import scanner.arbitrage.fee.RefreshableFeeModel;
import scanner.arbitrage.fee.StaticFeeModel;
import scanner.arbitrage.service.aggregation.QuoteAggregator;
import scanner.arbitrage.service.arbitrage.ArbitrageScanner;

import java.util.List;

@Slf4j
@Configuration
public class ScannerConfiguration {

    @Bean
    public RefreshableFeeModel feeModel(ArbitrageProperties properties) {
        return new RefreshableFeeModel(StaticFeeModel.fromProperties(properties.getFees()));
    }

    @Bean
    public VenueConnectorRegistry venueConnectorRegistry(ArbitrageProperties properties,
                                                         VenueConnectorFactory connectorFactory) {
        List<VenueConnector> connectors = properties.getVenues().stream()
                .map(connectorFactory::create)
                .toList();
        if (connectors.size() < 2) {
            log.warn("Only {} venue(s) configured; at least two are needed to find arbitrage", connectors.size());
        }
        return new VenueConnectorRegistry(connectors);
    }

    @Bean
    public QuoteAggregator quoteAggregator(ArbitrageProperties properties) {
        return new QuoteAggregator(properties.getMaxConcurrentFetches());
    }

    @Bean
    public ArbitrageScanner arbitrageScanner() {
        return new ArbitrageScanner();
    }
}
