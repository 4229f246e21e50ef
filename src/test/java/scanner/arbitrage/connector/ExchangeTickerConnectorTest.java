package scanner.arbitrage.connector;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import scanner.arbitrage.config.ArbitrageProperties;
import scanner.arbitrage.model.Quote;
import scanner.arbitrage.model.TransferFees;

import java.math.BigDecimal;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExchangeTickerConnectorTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private static ArbitrageProperties.Venue binance() {
        ArbitrageProperties.Venue venue = new ArbitrageProperties.Venue();
        venue.setId("binance");
        venue.setMode(ConnectorMode.TICKER);
        venue.setBaseUrl("https://api.binance.com");
        venue.setTickerPath("/api/v3/ticker/bookTicker?symbol={symbol}");
        venue.setMaxAttempts(2);
        venue.setInitialBackoff(1);
        venue.setMaxBackoff(5);
        return venue;
    }

    private static ArbitrageProperties.Venue okx() {
        ArbitrageProperties.Venue venue = binance();
        venue.setId("okx");
        venue.setTickerPath("/api/v5/market/ticker?instId={symbol}");
        venue.setSymbolSeparator("-");
        venue.setBidPointer("/data/0/bidPx");
        venue.setAskPointer("/data/0/askPx");
        venue.setTransferFeePath("/api/v5/asset/currencies?ccy={asset}");
        venue.setTransferFeePointer("/data/0/minFee");
        return venue;
    }

    private static WebClient respondingWith(HttpStatus status, String body, List<URI> requested) {
        return WebClient.builder()
                .exchangeFunction(request -> {
                    requested.add(request.url());
                    return Mono.just(ClientResponse.create(status)
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                            .body(body)
                            .build());
                })
                .build();
    }

    @Test
    void readsBookTickerUsingConfiguredPointers() {
        List<URI> requested = new ArrayList<>();
        String body = """
                {"symbol":"BTCUSDT","bidPrice":"64999.50","bidQty":"1.2","askPrice":"65000.10","askQty":"0.8"}
                """;
        ExchangeTickerConnector connector = new ExchangeTickerConnector(
                binance(), respondingWith(HttpStatus.OK, body, requested), objectMapper);

        StepVerifier.create(connector.fetchTicker("BTC/USDT"))
                .assertNext(quote -> {
                    assertThat(quote.getVenueId()).isEqualTo("binance");
                    assertThat(quote.getSymbol()).isEqualTo("BTC/USDT");
                    assertThat(quote.getBid()).isEqualByComparingTo("64999.50");
                    assertThat(quote.getAsk()).isEqualByComparingTo("65000.10");
                })
                .verifyComplete();

        assertThat(requested).hasSize(1);
        assertThat(requested.get(0).toString()).contains("symbol=BTCUSDT");
    }

    @Test
    void nestedPointersAndSeparator() {
        ExchangeTickerConnector connector = new ExchangeTickerConnector(okx(), WebClient.create(), objectMapper);
        String body = """
                {"code":"0","data":[{"instId":"ETH-USDT","bidPx":"3100.1","askPx":"3100.2"}]}
                """;

        Quote quote = connector.parseTicker(body, "ETH/USDT");

        assertThat(connector.venueSymbol("ETH/USDT")).isEqualTo("ETH-USDT");
        assertThat(quote.getBid()).isEqualByComparingTo("3100.1");
        assertThat(quote.getAsk()).isEqualByComparingTo("3100.2");
    }

    @Test
    void missingOrNonNumericFieldsGiveUntradableQuote() {
        ExchangeTickerConnector connector = new ExchangeTickerConnector(binance(), WebClient.create(), objectMapper);

        Quote quote = connector.parseTicker("{\"bidPrice\":\"n/a\"}", "BTC/USDT");

        assertThat(quote.getBid()).isNull();
        assertThat(quote.getAsk()).isNull();
        assertThat(quote.isTradable()).isFalse();
    }

    @Test
    void malformedBodyIsAnError() {
        ExchangeTickerConnector connector = new ExchangeTickerConnector(binance(), WebClient.create(), objectMapper);

        assertThatThrownBy(() -> connector.parseTicker("<html>busy</html>", "BTC/USDT"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("binance");
    }

    @Test
    void clientErrorsAreNotRetried() {
        AtomicInteger calls = new AtomicInteger();
        WebClient webClient = WebClient.builder()
                .exchangeFunction(request -> {
                    calls.incrementAndGet();
                    return Mono.just(ClientResponse.create(HttpStatus.BAD_REQUEST).body("{}").build());
                })
                .build();
        ExchangeTickerConnector connector = new ExchangeTickerConnector(binance(), webClient, objectMapper);

        StepVerifier.create(connector.fetchTicker("BTC/USDT"))
                .expectError(WebClientResponseException.BadRequest.class)
                .verify();
        assertThat(calls).hasValue(1);
    }

    @Test
    void serverErrorsAreRetried() {
        AtomicInteger calls = new AtomicInteger();
        WebClient webClient = WebClient.builder()
                .exchangeFunction(request -> {
                    calls.incrementAndGet();
                    return Mono.just(ClientResponse.create(HttpStatus.SERVICE_UNAVAILABLE).body("{}").build());
                })
                .build();
        ExchangeTickerConnector connector = new ExchangeTickerConnector(binance(), webClient, objectMapper);

        StepVerifier.create(connector.fetchTicker("BTC/USDT"))
                .expectError()
                .verify();
        assertThat(calls).hasValue(3);
    }

    @Test
    void readsWithdrawalFeeWhenConfigured() {
        List<URI> requested = new ArrayList<>();
        String body = """
                {"code":"0","data":[{"ccy":"BTC","chain":"BTC-Bitcoin","minFee":"0.0002"}]}
                """;
        ExchangeTickerConnector connector = new ExchangeTickerConnector(
                okx(), respondingWith(HttpStatus.OK, body, requested), objectMapper);

        StepVerifier.create(connector.fetchTransferFees("BTC"))
                .assertNext(fees -> {
                    assertThat(fees.getVenueId()).isEqualTo("okx");
                    assertThat(fees.getAsset()).isEqualTo("BTC");
                    assertThat(fees.cheapestFixedWithdrawalFee()).hasValue(new BigDecimal("0.0002"));
                })
                .verifyComplete();
        assertThat(requested).hasSize(1);
        assertThat(requested.get(0).toString()).contains("ccy=BTC");
    }

    @Test
    void noTransferFeesWithoutEndpoint() {
        ExchangeTickerConnector connector = new ExchangeTickerConnector(binance(), WebClient.create(), objectMapper);

        StepVerifier.create(connector.fetchTransferFees("BTC")).verifyComplete();

        TransferFees none = new ExchangeTickerConnector(okx(), WebClient.create(), objectMapper)
                .parseTransferFees("{\"data\":[]}", "BTC");
        assertThat(none).isNull();
    }
}
