package scanner.arbitrage.connector;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;
import reactor.util.retry.RetryBackoffSpec;
import scanner.arbitrage.config.ArbitrageProperties;
import scanner.arbitrage.model.VenueKind;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Base class for connectors that poll a venue's REST API.
 */
@Slf4j
public abstract class HttpVenueConnector implements VenueConnector {

    protected final ArbitrageProperties.Venue venue;
    protected final WebClient webClient;
    protected final ObjectMapper objectMapper;

    protected HttpVenueConnector(ArbitrageProperties.Venue venue, WebClient webClient, ObjectMapper objectMapper) {
        this.venue = venue;
        this.webClient = webClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public String venueId() {
        return venue.getId();
    }

    @Override
    public VenueKind kind() {
        return venue.getKind();
    }

    protected Mono<String> get(String path) {
        return webClient.get()
                .uri(path)
                .retrieve()
                .bodyToMono(String.class)
                .retryWhen(createRetrySpec());
    }

    /**
     * Creates a retry specification with exponential backoff
     */
    protected RetryBackoffSpec createRetrySpec() {
        return Retry.backoff(venue.getMaxAttempts(), Duration.ofMillis(venue.getInitialBackoff()))
                .maxBackoff(Duration.ofMillis(venue.getMaxBackoff()))
                .filter(this::shouldRetryOnError)
                .doBeforeRetry(retrySignal ->
                        log.info("Retrying {} API call after error. Attempt {}/{}",
                                venue.getId(), retrySignal.totalRetries() + 1, venue.getMaxAttempts()));
    }

    /**
     * Retries rate limiting (429) and server errors (5xx) only
     */
    protected boolean shouldRetryOnError(Throwable throwable) {
        if (throwable instanceof WebClientResponseException) {
            WebClientResponseException wcre = (WebClientResponseException) throwable;
            int statusCode = wcre.getStatusCode().value();
            boolean shouldRetry = statusCode == 429 || (statusCode >= 500 && statusCode < 600);
            if (shouldRetry) {
                log.warn("Received status code {} from {} API. Will retry.", statusCode, venue.getId());
            }
            return shouldRetry;
        }
        return false;
    }

    /**
     * Reads a decimal at {@code pointer}; missing, null or non-numeric values yield {@code null}.
     */
    protected static BigDecimal decimalAt(JsonNode root, String pointer) {
        JsonNode node = root.at(pointer);
        if (node.isMissingNode() || node.isNull()) {
            return null;
        }
        String text = node.asText();
        if (text.isBlank()) {
            return null;
        }
        try {
            return new BigDecimal(text);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
