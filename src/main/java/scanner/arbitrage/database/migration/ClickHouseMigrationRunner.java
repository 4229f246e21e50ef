package scanner.arbitrage.database.migration;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Applies {@code classpath:/clickhouse-migrations/*.sql} in file name order, once each.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "storage.enabled", havingValue = "true")
public class ClickHouseMigrationRunner {

    private final JdbcTemplate clickHouseJdbcTemplate;

    @EventListener(ApplicationReadyEvent.class)
    public void runMigrations() {
        try {
            createMigrationsTable();

            List<String> applied = getAppliedMigrations();
            List<Resource> resources = new ArrayList<>(Arrays.asList(
                    new PathMatchingResourcePatternResolver()
                            .getResources("classpath:/clickhouse-migrations/*.sql")
            ));

            resources.sort(Comparator.comparing(r -> Objects.requireNonNull(r.getFilename()).toLowerCase()));

            for (Resource resource : resources) {
                String filename = Objects.requireNonNull(resource.getFilename());
                if (applied.contains(filename)) {
                    log.info("Migration already applied: {}", filename);
                    continue;
                }

                log.info("Applying migration: {}", filename);
                clickHouseJdbcTemplate.execute(readSql(resource));
                clickHouseJdbcTemplate.update(
                        "INSERT INTO clickhouse_migrations (filename, applied_at) VALUES (?, now())", filename);
                log.info("Migration applied: {}", filename);
            }
        } catch (IOException e) {
            log.error("Migration failed: ", e);
            throw new IllegalStateException("Cannot read ClickHouse migrations", e);
        }
    }

    private String readSql(Resource resource) throws IOException {
        try (InputStream in = resource.getInputStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private void createMigrationsTable() {
        clickHouseJdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS clickhouse_migrations (
              filename String,
              applied_at DateTime
            ) ENGINE = MergeTree()
            ORDER BY applied_at
        """);
    }

    private List<String> getAppliedMigrations() {
        return clickHouseJdbcTemplate.query("SELECT filename FROM clickhouse_migrations",
                (rs, rowNum) -> rs.getString("filename"));
    }
}
