package scanner.arbitrage.database;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.BeanPropertyRowMapper;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import scanner.arbitrage.model.clickhouse.OhlcvBar;
import scanner.arbitrage.model.clickhouse.QuoteTickRecord;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Low-level access to the {@code quote_ticks} table.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(name = "storage.enabled", havingValue = "true")
public class QuoteTickRepository {
    private static final String INSERT_TICK_SQL =
            "INSERT INTO quote_ticks " +
                    "(timestamp, venue, symbol, price, bid, ask) VALUES (?, ?, ?, ?, ?, ?) " +
                    "SETTINGS input_format_allow_errors_ratio = 0.1";
    private static final String SELECT_TICKS_SQL =
            "SELECT timestamp, venue, symbol, price, bid, ask " +
                    "FROM quote_ticks " +
                    "WHERE symbol = ? AND timestamp BETWEEN ? AND ? " +
                    "ORDER BY timestamp";
    private static final String SELECT_LATEST_TICK_SQL =
            "SELECT timestamp, venue, symbol, price, bid, ask " +
                    "FROM quote_ticks " +
                    "WHERE symbol = ? " +
                    "ORDER BY timestamp DESC " +
                    "LIMIT 1";
    private static final String SELECT_OHLCV_SQL =
            "SELECT toStartOfInterval(timestamp, INTERVAL ? MINUTE) AS bucket, venue, symbol, " +
                    "argMin(price, timestamp) AS open, max(price) AS high, min(price) AS low, " +
                    "argMax(price, timestamp) AS close, count() AS ticks " +
                    "FROM quote_ticks " +
                    "WHERE symbol = ? AND timestamp BETWEEN ? AND ? " +
                    "GROUP BY bucket, venue, symbol " +
                    "ORDER BY bucket, venue";

    private final JdbcTemplate clickHouseJdbcTemplate;

    public void saveTicksBatch(List<QuoteTickRecord> records) {
        log.info("Saving quote tick batch {}", records.size());
        List<Object[]> args = records.stream()
                .map(r -> new Object[]{
                        r.getTimestamp(),
                        r.getVenue(),
                        r.getSymbol(),
                        r.getPrice(),
                        r.getBid(),
                        r.getAsk()
                })
                .toList();
        clickHouseJdbcTemplate.batchUpdate(INSERT_TICK_SQL, args);
    }

    public List<QuoteTickRecord> findTicks(String symbol, LocalDateTime from, LocalDateTime to) {
        return clickHouseJdbcTemplate.query(
                SELECT_TICKS_SQL,
                new BeanPropertyRowMapper<>(QuoteTickRecord.class),
                symbol, from, to
        );
    }

    public Optional<QuoteTickRecord> findLatestTick(String symbol) {
        List<QuoteTickRecord> list = clickHouseJdbcTemplate.query(
                SELECT_LATEST_TICK_SQL,
                new BeanPropertyRowMapper<>(QuoteTickRecord.class),
                symbol
        );
        return list.isEmpty() ? Optional.empty() : Optional.of(list.get(0));
    }

    /**
     * OHLC of mid prices per venue, bucketed by {@code bucketMinutes}.
     */
    public List<OhlcvBar> findOhlcv(String symbol, LocalDateTime from, LocalDateTime to, int bucketMinutes) {
        return clickHouseJdbcTemplate.query(
                SELECT_OHLCV_SQL,
                new BeanPropertyRowMapper<>(OhlcvBar.class),
                bucketMinutes, symbol, from, to
        );
    }
}
