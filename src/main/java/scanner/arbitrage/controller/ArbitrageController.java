package scanner.arbitrage.controller;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.server.RouterFunction;
import org.springframework.web.reactive.function.server.RouterFunctions;
import org.springframework.web.reactive.function.server.ServerRequest;
import org.springframework.web.reactive.function.server.ServerResponse;
import reactor.core.publisher.Mono;
import scanner.arbitrage.fee.FeeModel;
import scanner.arbitrage.model.ArbitrageOpportunity;
import scanner.arbitrage.service.arbitrage.ScanOrchestrator;

import java.util.List;
import java.util.Optional;

@Configuration
@RequiredArgsConstructor
public class ArbitrageController {
    private final ScanOrchestrator scanOrchestrator;
    private final FeeModel feeModel;

    @Bean
    public RouterFunction<ServerResponse> arbitrageRoutes() {
        return RouterFunctions.route()
                .path("/arbitrage", this::buildArbitrageRoutes)
                .build();
    }

    private RouterFunction<ServerResponse> buildArbitrageRoutes() {
        return RouterFunctions.route()
                .GET("/opportunities", this::handleOpportunities)
                .GET("/failures", this::handleFailures)
                .POST("/scan", this::handleScan)
                .GET("/fees/{venue}", this::handleFees)
                .build();
    }

    private Mono<ServerResponse> handleOpportunities(ServerRequest request) {
        Optional<String> symbol = request.queryParam("symbol");
        List<ArbitrageOpportunity> opportunities = scanOrchestrator.getAllArbitrageOpportunities().stream()
                .filter(opportunity -> symbol.map(opportunity.getSymbol()::equalsIgnoreCase).orElse(true))
                .toList();
        return ServerResponse.ok().bodyValue(opportunities);
    }

    private Mono<ServerResponse> handleFailures(ServerRequest request) {
        return ServerResponse.ok().bodyValue(scanOrchestrator.getLastReport().getFailures());
    }

    private Mono<ServerResponse> handleScan(ServerRequest request) {
        return scanOrchestrator.runScanCycle()
                .flatMap(report -> ServerResponse.ok().bodyValue(report));
    }

    private Mono<ServerResponse> handleFees(ServerRequest request) {
        return ServerResponse.ok().bodyValue(feeModel.resolve(request.pathVariable("venue")));
    }
}
