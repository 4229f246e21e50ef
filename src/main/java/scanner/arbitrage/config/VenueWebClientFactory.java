package scanner.arbitrage.config;

import io.netty.channel.ChannelOption;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.time.Duration;

/**
 * Builds one pooled {@link WebClient} per HTTP venue.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class VenueWebClientFactory {

    private final WebClient.Builder webClientBuilder;

    @Value("${venue.http.max-connections:50}")
    private int maxConnections;

    @Value("${venue.http.max-memory-size:16777216}")
    private int maxInMemorySize;

    public WebClient create(ArbitrageProperties.Venue venue) {
        ConnectionProvider provider = ConnectionProvider.builder(venue.getId() + "-pool")
                .maxConnections(maxConnections)
                .maxIdleTime(Duration.ofSeconds(30))
                .maxLifeTime(Duration.ofMinutes(5))
                .pendingAcquireTimeout(Duration.ofSeconds(45))
                .evictInBackground(Duration.ofSeconds(30))
                .build();

        HttpClient httpClient = HttpClient.create(provider)
                .responseTimeout(Duration.ofMillis(venue.getReadTimeout()))
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, venue.getConnectTimeout());

        ExchangeStrategies exchangeStrategies = ExchangeStrategies.builder()
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(maxInMemorySize))
                .build();

        return webClientBuilder.clone()
                .baseUrl(venue.getBaseUrl())
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(exchangeStrategies)
                .filter(logRequest(venue.getId()))
                .filter(logResponse(venue.getId()))
                .build();
    }

    private ExchangeFilterFunction logRequest(String venueId) {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            if (log.isDebugEnabled()) {
                log.debug("{} Request: {} {}", venueId, clientRequest.method(), clientRequest.url());
            }
            return Mono.just(clientRequest);
        });
    }

    private ExchangeFilterFunction logResponse(String venueId) {
        return ExchangeFilterFunction.ofResponseProcessor(clientResponse -> {
            if (log.isDebugEnabled()) {
                log.debug("{} Response status: {}", venueId, clientResponse.statusCode());
            }
            return Mono.just(clientResponse);
        });
    }
}
