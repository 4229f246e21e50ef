package scanner.arbitrage.service.arbitrage.metricscounter;

import scanner.arbitrage.model.ArbitrageOpportunity;

import java.util.List;

public interface ArbitrageOpportunityProvider {
    List<ArbitrageOpportunity> getAllArbitrageOpportunities();
}
