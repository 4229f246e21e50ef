package scanner.arbitrage.model;

import lombok.Value;

import java.util.List;

/**
 * Quotes gathered in one collection round, treated as logically simultaneous, together with the
 * fetches that did not produce a quote.
 */
@Value
public class QuoteSnapshot {
    List<Quote> quotes;
    List<FetchFailure> failures;

    public static QuoteSnapshot empty() {
        return new QuoteSnapshot(List.of(), List.of());
    }
}
