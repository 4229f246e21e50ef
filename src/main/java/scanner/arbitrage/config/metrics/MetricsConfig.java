package scanner.arbitrage.config.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import scanner.arbitrage.service.arbitrage.metricscounter.ArbitrageOpportunityProvider;

@Configuration
public class MetricsConfig {

    @Bean
    public Counter arbitrageOpportunityCounter(MeterRegistry registry) {
        return Counter.builder("arbitrage.opportunities.detected")
                .description("Number of arbitrage opportunities detected")
                .register(registry);
    }

    @Bean
    public Gauge arbitrageOpportunitiesGauge(MeterRegistry registry, ArbitrageOpportunityProvider opportunityProvider) {
        return Gauge.builder("arbitrage.opportunities.active",
                        () -> opportunityProvider.getAllArbitrageOpportunities().size())
                .description("Opportunities reported by the latest scan cycle")
                .register(registry);
    }

    @Bean
    public Counter fetchFailureCounter(MeterRegistry registry) {
        return Counter.builder("arbitrage.fetch.failures")
                .description("Ticker fetches that failed or timed out")
                .register(registry);
    }

    @Bean
    public Counter telegramNotificationsCounter(MeterRegistry registry) {
        return Counter.builder("telegram.notifications.sent")
                .description("Number of Telegram notifications sent")
                .register(registry);
    }
}
