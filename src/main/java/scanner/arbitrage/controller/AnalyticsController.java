package scanner.arbitrage.controller;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.server.RouterFunction;
import org.springframework.web.reactive.function.server.RouterFunctions;
import org.springframework.web.reactive.function.server.ServerRequest;
import org.springframework.web.reactive.function.server.ServerResponse;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;
import scanner.arbitrage.service.clickhouse.QuoteTickService;

import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;

@Configuration
@RequiredArgsConstructor
@ConditionalOnProperty(name = "storage.enabled", havingValue = "true")
public class AnalyticsController {
    private final QuoteTickService service;

    @Bean
    public RouterFunction<ServerResponse> analyticsRoutes() {
        return RouterFunctions.route()
                .path("/analytics", this::buildAnalyticsRoutes)
                .build();
    }

    private RouterFunction<ServerResponse> buildAnalyticsRoutes() {
        return RouterFunctions.route()
                .GET("/ticks", this::handleGetTicks)
                .GET("/ticks/latest", this::handleLatestTick)
                .GET("/ohlcv", this::handleOhlcv)
                .build();
    }

    private Mono<ServerResponse> handleGetTicks(ServerRequest request) {
        String symbol = requiredParam(request, "symbol");
        LocalDateTime from = parseDateTime(request, "from");
        LocalDateTime to = parseDateTime(request, "to");

        return service.getTicksReactive(symbol, from, to)
                .collectList()
                .flatMap(list -> ServerResponse.ok().bodyValue(list));
    }

    private Mono<ServerResponse> handleLatestTick(ServerRequest request) {
        String symbol = requiredParam(request, "symbol");
        return service.getLatestTickReactive(symbol)
                .flatMap(tick -> ServerResponse.ok().bodyValue(tick))
                .switchIfEmpty(ServerResponse.notFound().build());
    }

    private Mono<ServerResponse> handleOhlcv(ServerRequest request) {
        String symbol = requiredParam(request, "symbol");
        LocalDateTime from = parseDateTime(request, "from");
        LocalDateTime to = parseDateTime(request, "to");
        int bucketMinutes = parseBucketMinutes(request);

        return service.getOhlcvReactive(symbol, from, to, bucketMinutes)
                .collectList()
                .flatMap(bars -> ServerResponse.ok().bodyValue(bars));
    }

    private String requiredParam(ServerRequest request, String paramName) {
        return request.queryParam(paramName)
                .orElseThrow(() -> new ServerWebInputException("Missing query parameter " + paramName));
    }

    private int parseBucketMinutes(ServerRequest request) {
        String value = request.queryParam("bucketMinutes").orElse("1");
        int bucketMinutes;
        try {
            bucketMinutes = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ServerWebInputException("Invalid bucketMinutes: " + value);
        }
        if (bucketMinutes < 1) {
            throw new ServerWebInputException("bucketMinutes must be positive");
        }
        return bucketMinutes;
    }

    private LocalDateTime parseDateTime(ServerRequest request, String paramName) {
        try {
            return LocalDateTime.parse(requiredParam(request, paramName));
        } catch (DateTimeParseException e) {
            throw new ServerWebInputException("Invalid datetime format for " + paramName);
        }
    }
}
