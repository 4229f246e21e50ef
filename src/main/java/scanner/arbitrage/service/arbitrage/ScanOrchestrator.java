package scanner.arbitrage.service.arbitrage;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.observation.annotation.Observed;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import scanner.arbitrage.config.ArbitrageProperties;
import scanner.arbitrage.config.metrics.TimerUtils;
import scanner.arbitrage.connector.VenueConnectorRegistry;
import scanner.arbitrage.fee.FeeModel;
import scanner.arbitrage.model.ArbitrageOpportunity;
import scanner.arbitrage.model.QuoteSnapshot;
import scanner.arbitrage.model.ScanReport;
import scanner.arbitrage.service.aggregation.QuoteAggregator;
import scanner.arbitrage.service.arbitrage.metricscounter.ArbitrageOpportunityProvider;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs scan cycles: collect quotes from every venue, scan them, rank the opportunities and hand
 * the report to the registered listeners.
 */
@Slf4j
@Service
public class ScanOrchestrator implements ArbitrageOpportunityProvider {

    private final QuoteAggregator quoteAggregator;
    private final ArbitrageScanner arbitrageScanner;
    private final FeeModel feeModel;
    private final VenueConnectorRegistry venueConnectorRegistry;
    private final ArbitrageProperties properties;
    private final MeterRegistry meterRegistry;
    private final Counter arbitrageOpportunityCounter;
    private final Counter fetchFailureCounter;
    private final List<ScanCycleListener> listeners;

    private final AtomicReference<ScanReport> lastReport = new AtomicReference<>(ScanReport.empty());
    private final AtomicBoolean cycleInProgress = new AtomicBoolean(false);

    public ScanOrchestrator(
            QuoteAggregator quoteAggregator,
            ArbitrageScanner arbitrageScanner,
            FeeModel feeModel,
            VenueConnectorRegistry venueConnectorRegistry,
            ArbitrageProperties properties,
            MeterRegistry meterRegistry,
            Counter arbitrageOpportunityCounter,
            Counter fetchFailureCounter,
            List<ScanCycleListener> listeners) {
        this.quoteAggregator = quoteAggregator;
        this.arbitrageScanner = arbitrageScanner;
        this.feeModel = feeModel;
        this.venueConnectorRegistry = venueConnectorRegistry;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
        this.arbitrageOpportunityCounter = arbitrageOpportunityCounter;
        this.fetchFailureCounter = fetchFailureCounter;
        this.listeners = listeners;
    }

    @Scheduled(fixedDelayString = "${arbitrage.scan-interval:10000}",
            initialDelayString = "${arbitrage.initial-delay:5000}")
    @Observed(name = "arbitrage.scan.scheduled", contextualName = "scheduled-scan-cycle")
    public void scheduledScan() {
        if (!cycleInProgress.compareAndSet(false, true)) {
            log.debug("Previous scan cycle still running, skipping this tick");
            return;
        }
        Mono.defer(this::runScanCycle)
                .doFinally(signal -> cycleInProgress.set(false))
                .subscribe(
                        report -> log.debug("Scheduled scan cycle finished with {} opportunities",
                                report.getOpportunities().size()),
                        error -> log.error("Scan cycle failed: {}", error.getMessage(), error)
                );
    }

    public Mono<ScanReport> runScanCycle() {
        Instant startedAt = Instant.now();
        log.info("Scanning {} symbol(s) across venues {}...",
                properties.getSymbols().size(), venueConnectorRegistry.getVenueIds());

        return TimerUtils.timedMono(
                        () -> quoteAggregator.collect(
                                venueConnectorRegistry.getConnectors(),
                                properties.getSymbols(),
                                properties.getFetchTimeout()),
                        meterRegistry, "arbitrage.quotes.collect")
                .map(snapshot -> completeCycle(snapshot, startedAt));
    }

    private ScanReport completeCycle(QuoteSnapshot snapshot, Instant startedAt) {
        List<ArbitrageOpportunity> ranked = arbitrageScanner
                .scan(snapshot.getQuotes(), feeModel.snapshot(), properties.getThresholdPct())
                .stream()
                .sorted(ArbitrageOpportunity.BY_PROFIT_PERCENTAGE_DESC)
                .toList();

        arbitrageOpportunityCounter.increment(ranked.size());
        fetchFailureCounter.increment(snapshot.getFailures().size());

        ScanReport report = ScanReport.builder()
                .opportunities(ranked)
                .failures(snapshot.getFailures())
                .quoteCount(snapshot.getQuotes().size())
                .startedAt(startedAt)
                .completedAt(Instant.now())
                .build();
        lastReport.set(report);

        log.info("Scan complete: {} quote(s), {} failure(s), {} opportunity(ies)",
                report.getQuoteCount(), report.getFailures().size(), ranked.size());
        ranked.forEach(this::logArbitrageOpportunity);

        notifyListeners(snapshot, report);
        return report;
    }

    private void notifyListeners(QuoteSnapshot snapshot, ScanReport report) {
        for (ScanCycleListener listener : listeners) {
            try {
                listener.onScanCompleted(snapshot, report);
            } catch (RuntimeException e) {
                log.error("Scan listener {} failed: {}", listener.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
    }

    private void logArbitrageOpportunity(ArbitrageOpportunity opportunity) {
        log.info("ARBITRAGE {}: buy {} @ {} -> sell {} @ {} | fees {} | net {} ({}%)",
                opportunity.getSymbol(),
                opportunity.getBuyVenue(), opportunity.getBuyPrice(),
                opportunity.getSellVenue(), opportunity.getSellPrice(),
                opportunity.getTotalFees(),
                opportunity.getNetProfit(),
                opportunity.getProfitPercentage());
    }

    public ScanReport getLastReport() {
        return lastReport.get();
    }

    @Override
    public List<ArbitrageOpportunity> getAllArbitrageOpportunities() {
        return lastReport.get().getOpportunities();
    }
}
