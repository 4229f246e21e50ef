package scanner.arbitrage.connector;

import java.util.List;

/**
 * Connectors built from configuration at startup.
 */
public class VenueConnectorRegistry {

    private final List<VenueConnector> connectors;

    public VenueConnectorRegistry(List<VenueConnector> connectors) {
        this.connectors = List.copyOf(connectors);
    }

    public List<VenueConnector> getConnectors() {
        return connectors;
    }

    public List<String> getVenueIds() {
        return connectors.stream().map(VenueConnector::venueId).toList();
    }
}
