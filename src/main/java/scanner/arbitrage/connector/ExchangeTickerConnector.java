package scanner.arbitrage.connector;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import scanner.arbitrage.config.ArbitrageProperties;
import scanner.arbitrage.model.NetworkFee;
import scanner.arbitrage.model.Quote;
import scanner.arbitrage.model.TransferFees;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Centralized exchange book ticker over REST. The response layout is described by JSON pointers
 * in the venue configuration, e.g. {@code /bidPrice} and {@code /askPrice} for Binance.
 */
@Slf4j
public class ExchangeTickerConnector extends HttpVenueConnector {

    public ExchangeTickerConnector(ArbitrageProperties.Venue venue, WebClient webClient, ObjectMapper objectMapper) {
        super(venue, webClient, objectMapper);
    }

    @Override
    public Mono<Quote> fetchTicker(String symbol) {
        String path = venue.getTickerPath().replace("{symbol}", venueSymbol(symbol));
        return get(path).map(body -> parseTicker(body, symbol));
    }

    @Override
    public Mono<TransferFees> fetchTransferFees(String asset) {
        if (venue.getTransferFeePath() == null || venue.getTransferFeePointer() == null) {
            return Mono.empty();
        }
        String path = venue.getTransferFeePath().replace("{asset}", asset);
        return get(path).flatMap(body -> Mono.justOrEmpty(parseTransferFees(body, asset)));
    }

    Quote parseTicker(String body, String symbol) {
        JsonNode root = readTree(body);
        return Quote.builder()
                .venueId(venue.getId())
                .symbol(symbol)
                .bid(decimalAt(root, venue.getBidPointer()))
                .ask(decimalAt(root, venue.getAskPointer()))
                .observedAt(Instant.now())
                .build();
    }

    TransferFees parseTransferFees(String body, String asset) {
        BigDecimal fee = decimalAt(readTree(body), venue.getTransferFeePointer());
        if (fee == null) {
            log.debug("No withdrawal fee for {} in {} response", asset, venue.getId());
            return null;
        }
        return TransferFees.builder()
                .venueId(venue.getId())
                .asset(asset)
                .withdrawNetwork("DEFAULT", NetworkFee.fixed(fee))
                .build();
    }

    String venueSymbol(String symbol) {
        return symbol.replace("/", venue.getSymbolSeparator());
    }

    private JsonNode readTree(String body) {
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            log.error("Error parsing {} response: {}", venue.getId(), e.getMessage());
            throw new IllegalStateException("Failed to parse " + venue.getId() + " response", e);
        }
    }
}
