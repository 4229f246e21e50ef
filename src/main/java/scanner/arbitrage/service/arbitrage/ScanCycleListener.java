package scanner.arbitrage.service.arbitrage;

import scanner.arbitrage.model.QuoteSnapshot;
import scanner.arbitrage.model.ScanReport;

/**
 * Receives the outcome of every scan cycle, e.g. to persist quotes or send notifications.
 */
public interface ScanCycleListener {

    void onScanCompleted(QuoteSnapshot snapshot, ScanReport report);
}
