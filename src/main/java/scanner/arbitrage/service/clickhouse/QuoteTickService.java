package scanner.arbitrage.service.clickhouse;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import scanner.arbitrage.database.QuoteTickRepository;
import scanner.arbitrage.model.Quote;
import scanner.arbitrage.model.QuoteSnapshot;
import scanner.arbitrage.model.ScanReport;
import scanner.arbitrage.model.clickhouse.OhlcvBar;
import scanner.arbitrage.model.clickhouse.QuoteTickRecord;
import scanner.arbitrage.service.arbitrage.ScanCycleListener;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;

/**
 * Buffers collected quotes and writes them to ClickHouse in batches; serves range queries.
 */
@Service
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(name = "storage.enabled", havingValue = "true")
public class QuoteTickService implements ScanCycleListener {
    private final QuoteTickRepository repository;
    private final Executor jdbcExecutor;

    @Value("${clickhouse.batch-size:1000}")
    private int batchSize;

    @Value("${clickhouse.flush-interval:1000}")
    private long flushIntervalMs;

    private final Queue<QuoteTickRecord> tickBuffer = new ConcurrentLinkedQueue<>();
    private final Scheduler bufferScheduler = Schedulers.newSingle("tick-buffer");
    private Disposable flushTask;

    @PostConstruct
    public void initBuffer() {
        // ticks arriving while a slow flush is still running are skipped
        flushTask = Flux.interval(Duration.ofMillis(flushIntervalMs), bufferScheduler)
                .onBackpressureDrop()
                .concatMap(tick -> flushTicksAsync(), 1)
                .subscribe(
                        unused -> {
                        },
                        error -> log.error("Tick flush loop stopped: {}", error.getMessage(), error)
                );
    }

    @Override
    public void onScanCompleted(QuoteSnapshot snapshot, ScanReport report) {
        snapshot.getQuotes().forEach(this::bufferQuote);
        if (tickBuffer.size() >= batchSize) {
            flushTicksAsync().subscribe();
        }
    }

    public void bufferQuote(Quote quote) {
        if (quote.midPrice() == null) {
            return;
        }
        tickBuffer.add(convertToTickRecord(quote));
    }

    Mono<Void> flushTicksAsync() {
        return Mono.fromCallable(this::drainAndSave)
                .subscribeOn(Schedulers.fromExecutor(jdbcExecutor))
                .doOnNext(saved -> {
                    if (saved > 0) {
                        log.info("Saved {} quote ticks", saved);
                    }
                })
                .onErrorResume(error -> {
                    log.error("Failed to save quote ticks: {}", error.getMessage(), error);
                    return Mono.empty();
                })
                .then();
    }

    private int drainAndSave() {
        List<QuoteTickRecord> toSave = new ArrayList<>();
        QuoteTickRecord record;
        while ((record = tickBuffer.poll()) != null) {
            toSave.add(record);
        }
        if (!toSave.isEmpty()) {
            repository.saveTicksBatch(toSave);
        }
        return toSave.size();
    }

    public Flux<QuoteTickRecord> getTicksReactive(String symbol, LocalDateTime from, LocalDateTime to) {
        return Mono.fromCallable(() -> repository.findTicks(symbol, from, to))
                .subscribeOn(Schedulers.fromExecutor(jdbcExecutor))
                .flatMapMany(Flux::fromIterable);
    }

    public Mono<QuoteTickRecord> getLatestTickReactive(String symbol) {
        return Mono.fromCallable(() -> repository.findLatestTick(symbol))
                .subscribeOn(Schedulers.fromExecutor(jdbcExecutor))
                .flatMap(Mono::justOrEmpty);
    }

    public Flux<OhlcvBar> getOhlcvReactive(String symbol, LocalDateTime from, LocalDateTime to, int bucketMinutes) {
        return Mono.fromCallable(() -> repository.findOhlcv(symbol, from, to, bucketMinutes))
                .subscribeOn(Schedulers.fromExecutor(jdbcExecutor))
                .flatMapMany(Flux::fromIterable);
    }

    private QuoteTickRecord convertToTickRecord(Quote quote) {
        Instant observedAt = quote.getObservedAt() != null ? quote.getObservedAt() : Instant.now();
        return new QuoteTickRecord(
                LocalDateTime.ofInstant(observedAt, ZoneOffset.UTC),
                quote.getVenueId(),
                quote.getSymbol(),
                quote.midPrice(),
                quote.getBid(),
                quote.getAsk()
        );
    }

    @PreDestroy
    public void onDestroy() {
        if (flushTask != null) {
            flushTask.dispose();
        }
        flushTicksAsync().block(Duration.ofSeconds(10));
        bufferScheduler.dispose();
    }
}
