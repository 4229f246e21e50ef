package scanner.arbitrage.service.arbitrage;

import lombok.Value;
import scanner.arbitrage.model.Quote;

/**
 * Directional pair: buy on {@code buy}'s venue, sell on {@code sell}'s venue.
 */
@Value
public class VenuePair {
    Quote buy;
    Quote sell;
}
