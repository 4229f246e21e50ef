package scanner.arbitrage.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class FetchFailure {
    String venueId;
    String symbol;
    String errorType;
    String message;
    boolean timedOut;

    public static FetchFailure of(String venueId, String symbol, Throwable error) {
        return FetchFailure.builder()
                .venueId(venueId)
                .symbol(symbol)
                .errorType(error.getClass().getSimpleName())
                .message(error.getMessage())
                .timedOut(false)
                .build();
    }

    public static FetchFailure timedOut(String venueId, String symbol) {
        return FetchFailure.builder()
                .venueId(venueId)
                .symbol(symbol)
                .errorType("Timeout")
                .message("Fetch abandoned at collection deadline")
                .timedOut(true)
                .build();
    }
}
