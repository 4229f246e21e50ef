package scanner.arbitrage.connector;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import scanner.arbitrage.config.ArbitrageProperties;
import scanner.arbitrage.model.Quote;
import scanner.arbitrage.model.TransferFees;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * DEX pool price from the DexScreener tokens API. Pools expose a single price, which is used as
 * both bid and ask.
 */
@Slf4j
public class DexScreenerConnector extends HttpVenueConnector {

    public DexScreenerConnector(ArbitrageProperties.Venue venue, WebClient webClient, ObjectMapper objectMapper) {
        super(venue, webClient, objectMapper);
    }

    @Override
    public Mono<Quote> fetchTicker(String symbol) {
        String address = venue.getTokenAddresses().get(symbol);
        if (address == null) {
            return Mono.error(new IllegalArgumentException(
                    "No token address configured for " + symbol + " on " + venue.getId()));
        }
        return get("/tokens/v1/" + venue.getChainId() + "/" + address)
                .map(body -> parseResponse(body, symbol));
    }

    @Override
    public Mono<TransferFees> fetchTransferFees(String asset) {
        return Mono.empty();
    }

    Quote parseResponse(String responseBody, String symbol) {
        JsonNode rootNode;
        try {
            rootNode = objectMapper.readTree(responseBody);
        } catch (JsonProcessingException e) {
            log.error("Error parsing DexScreener response {}", e.getMessage());
            throw new IllegalStateException("Failed to parse DexScreener response", e);
        }
        if (!rootNode.isArray() || rootNode.isEmpty()) {
            throw new IllegalStateException("Empty or invalid DexScreener response for " + symbol);
        }
        BigDecimal price = extractPrice(rootNode.get(0), symbol);
        return Quote.builder()
                .venueId(venue.getId())
                .symbol(symbol)
                .bid(price)
                .ask(price)
                .observedAt(Instant.now())
                .build();
    }

    /**
     * USD price of the pair; the native price is quoted in the pool's own token and is never used
     */
    private BigDecimal extractPrice(JsonNode pairNode, String symbol) {
        BigDecimal usd = decimalAt(pairNode, "/priceUsd");
        if (usd == null) {
            throw new IllegalStateException("No USD price in DexScreener response for " + symbol);
        }
        return usd;
    }
}
