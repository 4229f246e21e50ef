package scanner.arbitrage.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class ScanReport {
    List<ArbitrageOpportunity> opportunities;
    List<FetchFailure> failures;
    int quoteCount;
    Instant startedAt;
    Instant completedAt;

    public static ScanReport empty() {
        Instant now = Instant.now();
        return ScanReport.builder()
                .opportunities(List.of())
                .failures(List.of())
                .quoteCount(0)
                .startedAt(now)
                .completedAt(now)
                .build();
    }
}
