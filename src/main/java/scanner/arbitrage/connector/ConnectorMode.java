package scanner.arbitrage.connector;

/**
 * Adapter used to reach a venue, chosen once when the connector is built.
 */
public enum ConnectorMode {
    SIMULATED,
    TICKER,
    DEXSCREENER
}
