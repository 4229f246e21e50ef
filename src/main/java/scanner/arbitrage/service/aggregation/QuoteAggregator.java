package scanner.arbitrage.service.aggregation;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import scanner.arbitrage.connector.VenueConnector;
import scanner.arbitrage.model.FetchFailure;
import scanner.arbitrage.model.Quote;
import scanner.arbitrage.model.QuoteSnapshot;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Fetches one ticker per (venue, symbol) concurrently and merges the outcomes into a single
 * snapshot. A failed fetch is recorded and never fails the collection; fetches still running at
 * the deadline are cancelled and recorded as timed out.
 */
@Slf4j
public class QuoteAggregator {

    private final int maxConcurrentFetches;

    public QuoteAggregator(int maxConcurrentFetches) {
        if (maxConcurrentFetches < 1) {
            throw new IllegalArgumentException("maxConcurrentFetches must be positive");
        }
        this.maxConcurrentFetches = maxConcurrentFetches;
    }

    public Mono<QuoteSnapshot> collect(List<VenueConnector> venues, List<String> symbols, Duration deadline) {
        Objects.requireNonNull(venues, "venues");
        Objects.requireNonNull(symbols, "symbols");
        Objects.requireNonNull(deadline, "deadline");

        List<FetchTask> tasks = new ArrayList<>();
        for (VenueConnector venue : venues) {
            for (String symbol : symbols) {
                tasks.add(new FetchTask(tasks.size(), venue, symbol));
            }
        }
        if (tasks.isEmpty()) {
            return Mono.just(QuoteSnapshot.empty());
        }

        return Flux.fromIterable(tasks)
                .flatMap(this::fetch, maxConcurrentFetches)
                .take(deadline)
                .collectList()
                .map(outcomes -> assemble(tasks, outcomes));
    }

    private Mono<FetchOutcome> fetch(FetchTask task) {
        return Mono.defer(() -> task.venue.fetchTicker(task.symbol))
                .map(quote -> FetchOutcome.success(task, quote))
                .switchIfEmpty(Mono.fromSupplier(() -> FetchOutcome.failure(task,
                        new NoSuchElementException("No ticker returned"))))
                .onErrorResume(error -> Mono.just(FetchOutcome.failure(task, error)));
    }

    private QuoteSnapshot assemble(List<FetchTask> tasks, List<FetchOutcome> outcomes) {
        boolean[] finished = new boolean[tasks.size()];
        List<Quote> quotes = new ArrayList<>();
        List<FetchFailure> failures = new ArrayList<>();

        for (FetchOutcome outcome : outcomes) {
            finished[outcome.task.slot] = true;
            if (outcome.quote != null) {
                quotes.add(outcome.quote);
            } else {
                log.warn("Failed to fetch {} from {}: {}",
                        outcome.task.symbol, outcome.task.venueId(), outcome.error.getMessage());
                failures.add(FetchFailure.of(outcome.task.venueId(), outcome.task.symbol, outcome.error));
            }
        }
        for (FetchTask task : tasks) {
            if (!finished[task.slot]) {
                log.warn("Fetch of {} from {} abandoned at deadline", task.symbol, task.venueId());
                failures.add(FetchFailure.timedOut(task.venueId(), task.symbol));
            }
        }

        log.debug("Collected {} quote(s), {} failure(s) from {} fetch(es)",
                quotes.size(), failures.size(), tasks.size());
        return new QuoteSnapshot(List.copyOf(quotes), List.copyOf(failures));
    }

    private static final class FetchTask {
        private final int slot;
        private final VenueConnector venue;
        private final String symbol;

        private FetchTask(int slot, VenueConnector venue, String symbol) {
            this.slot = slot;
            this.venue = venue;
            this.symbol = symbol;
        }

        private String venueId() {
            return venue.venueId();
        }
    }

    private static final class FetchOutcome {
        private final FetchTask task;
        private final Quote quote;
        private final Throwable error;

        private FetchOutcome(FetchTask task, Quote quote, Throwable error) {
            this.task = task;
            this.quote = quote;
            this.error = error;
        }

        static FetchOutcome success(FetchTask task, Quote quote) {
            return new FetchOutcome(task, quote, null);
        }

        static FetchOutcome failure(FetchTask task, Throwable error) {
            return new FetchOutcome(task, null, error);
        }
    }
}
