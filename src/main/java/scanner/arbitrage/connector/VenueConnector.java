package scanner.arbitrage.connector;

import reactor.core.publisher.Mono;
import scanner.arbitrage.model.Quote;
import scanner.arbitrage.model.TransferFees;
import scanner.arbitrage.model.VenueKind;

/**
 * Market data access for a single venue. Implementations must tolerate concurrent calls for
 * distinct symbols; retry policy, if any, lives here rather than in the callers.
 */
public interface VenueConnector {

    String venueId();

    VenueKind kind();

    Mono<Quote> fetchTicker(String symbol);

    /**
     * Deposit and withdrawal fees for {@code asset}. Completes empty when the venue does not
     * publish them.
     */
    Mono<TransferFees> fetchTransferFees(String asset);
}
