package scanner.arbitrage.connector;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import scanner.arbitrage.config.ArbitrageProperties;
import scanner.arbitrage.model.VenueKind;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DexScreenerConnectorTest {

    private static final String WBNB = "0xbb4CdB9CBd36B01bD1cBaEBF2De08d9173bc095c";

    private final ObjectMapper objectMapper = new ObjectMapper();

    private static ArbitrageProperties.Venue pancake() {
        ArbitrageProperties.Venue venue = new ArbitrageProperties.Venue();
        venue.setId("pancakeswap");
        venue.setKind(VenueKind.DEX);
        venue.setMode(ConnectorMode.DEXSCREENER);
        venue.setBaseUrl("https://api.dexscreener.com");
        venue.setChainId("bsc");
        venue.setTokenAddresses(Map.of("BNB/USDT", WBNB));
        return venue;
    }

    @Test
    void usesFirstPairUsdPriceOnBothSides() {
        List<URI> requested = new ArrayList<>();
        String body = """
                [{"chainId":"bsc","dexId":"pancakeswap","priceNative":"1.0","priceUsd":"598.12"},
                 {"chainId":"bsc","dexId":"biswap","priceNative":"1.0","priceUsd":"597.00"}]
                """;
        WebClient webClient = WebClient.builder()
                .exchangeFunction(request -> {
                    requested.add(request.url());
                    return Mono.just(ClientResponse.create(HttpStatus.OK)
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                            .body(body)
                            .build());
                })
                .build();
        DexScreenerConnector connector = new DexScreenerConnector(pancake(), webClient, objectMapper);

        StepVerifier.create(connector.fetchTicker("BNB/USDT"))
                .assertNext(quote -> {
                    assertThat(quote.getVenueId()).isEqualTo("pancakeswap");
                    assertThat(quote.getBid()).isEqualByComparingTo("598.12");
                    assertThat(quote.getAsk()).isEqualByComparingTo("598.12");
                    assertThat(quote.isTradable()).isTrue();
                })
                .verifyComplete();
        assertThat(requested).hasSize(1);
        assertThat(requested.get(0).toString()).isEqualTo("/tokens/v1/bsc/" + WBNB);
        assertThat(connector.kind()).isEqualTo(VenueKind.DEX);
    }

    @Test
    void pairWithoutUsdPriceIsAnError() {
        DexScreenerConnector connector = new DexScreenerConnector(pancake(), WebClient.create(), objectMapper);

        assertThatThrownBy(() -> connector.parseResponse("[{\"priceNative\":\"0.0021\"}]", "BNB/USDT"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("BNB/USDT");
        assertThatThrownBy(() -> connector.parseResponse(
                "[{\"priceNative\":\"0.0021\",\"priceUsd\":\"n/a\"}]", "BNB/USDT"))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void fetchWithoutUsdPriceFails() {
        WebClient webClient = WebClient.builder()
                .exchangeFunction(request -> Mono.just(ClientResponse.create(HttpStatus.OK)
                        .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                        .body("[{\"chainId\":\"bsc\",\"priceNative\":\"0.0021\"}]")
                        .build()))
                .build();
        DexScreenerConnector connector = new DexScreenerConnector(pancake(), webClient, objectMapper);

        StepVerifier.create(connector.fetchTicker("BNB/USDT"))
                .expectError(IllegalStateException.class)
                .verify();
    }

    @Test
    void emptyPairListIsAnError() {
        DexScreenerConnector connector = new DexScreenerConnector(pancake(), WebClient.create(), objectMapper);

        assertThatThrownBy(() -> connector.parseResponse("[]", "BNB/USDT"))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> connector.parseResponse("{\"pairs\":null}", "BNB/USDT"))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> connector.parseResponse("not json", "BNB/USDT"))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void unknownTokenFailsWithoutCallingTheApi() {
        WebClient webClient = WebClient.builder()
                .exchangeFunction(request -> Mono.error(new AssertionError("unexpected request")))
                .build();
        DexScreenerConnector connector = new DexScreenerConnector(pancake(), webClient, objectMapper);

        StepVerifier.create(connector.fetchTicker("CAKE/USDT"))
                .expectError(IllegalArgumentException.class)
                .verify();
        StepVerifier.create(connector.fetchTransferFees("BNB")).verifyComplete();
    }
}
