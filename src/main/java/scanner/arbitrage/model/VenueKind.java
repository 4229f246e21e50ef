package scanner.arbitrage.model;

public enum VenueKind {
    CEX,
    DEX,
    BRIDGE
}
