package scanner.arbitrage.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import scanner.arbitrage.connector.ConnectorMode;
import scanner.arbitrage.model.VenueKind;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Data
@Configuration
@ConfigurationProperties(prefix = "arbitrage")
public class ArbitrageProperties {

    /**
     * Minimum net profit, in percent of total cost, an opportunity must exceed.
     */
    private BigDecimal thresholdPct = new BigDecimal("0.2");
    private List<String> symbols = new ArrayList<>();
    private Duration fetchTimeout = Duration.ofSeconds(5);
    private int maxConcurrentFetches = 32;
    private Fees fees = new Fees();
    private List<Venue> venues = new ArrayList<>();

    @Data
    public static class Fees {
        private Schedule defaultSchedule = Schedule.withTakerRate(new BigDecimal("0.002"));
        // keyed by venue id
        private Map<String, Schedule> venues = new HashMap<>();
        private boolean refreshEnabled = false;
    }

    @Data
    public static class Schedule {
        private BigDecimal takerRate;
        private Map<String, BigDecimal> withdrawalFees;

        static Schedule withTakerRate(BigDecimal takerRate) {
            Schedule schedule = new Schedule();
            schedule.setTakerRate(takerRate);
            schedule.setWithdrawalFees(new HashMap<>());
            return schedule;
        }
    }

    @Data
    public static class Venue {
        private String id;
        private VenueKind kind = VenueKind.CEX;
        private ConnectorMode mode = ConnectorMode.SIMULATED;

        // TICKER and DEXSCREENER
        private String baseUrl;
        private String tickerPath;
        private String symbolSeparator = "";
        private String bidPointer = "/bidPrice";
        private String askPointer = "/askPrice";
        private String transferFeePath;
        private String transferFeePointer;
        private String chainId;
        private Map<String, String> tokenAddresses = new HashMap<>();
        private int maxAttempts = 3;
        private long initialBackoff = 1000;
        private long maxBackoff = 10000;
        private int connectTimeout = 3000;
        private int readTimeout = 5000;

        // SIMULATED
        private Map<String, BigDecimal> basePrices = new HashMap<>();
        private Map<String, BigDecimal> withdrawalFees = new HashMap<>();
        private long minLatencyMs = 100;
        private long maxLatencyMs = 500;
    }
}
