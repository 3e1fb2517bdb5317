package trader.stablearb.database.migration;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Applies {@code classpath:/clickhouse-migrations/*.sql} in file name order, once each.
 * One statement per file.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "clickhouse.enabled", havingValue = "true")
public class ClickHouseMigrationRunner {

    private final JdbcTemplate clickHouseJdbcTemplate;

    @PostConstruct
    public void runMigrations() {
        createMigrationsTable();
        List<String> applied = getAppliedMigrations();
        List<Resource> resources;
        try {
            resources = new ArrayList<>(Arrays.asList(
                    new PathMatchingResourcePatternResolver()
                            .getResources("classpath:/clickhouse-migrations/*.sql")));
        } catch (IOException e) {
            throw new IllegalStateException("Cannot list ClickHouse migrations", e);
        }
        resources.sort(Comparator.comparing(r -> Objects.requireNonNull(r.getFilename()).toLowerCase()));

        for (Resource resource : resources) {
            String filename = Objects.requireNonNull(resource.getFilename());
            if (applied.contains(filename)) {
                log.debug("Migration already applied: {}", filename);
                continue;
            }
            log.info("Applying migration: {}", filename);
            clickHouseJdbcTemplate.execute(read(resource));
            clickHouseJdbcTemplate.update(
                    "INSERT INTO clickhouse_migrations (filename, applied_at) VALUES (?, now())", filename);
            log.info("Migration applied: {}", filename);
        }
    }

    private String read(Resource resource) {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
            return reader.lines().collect(Collectors.joining("\n"));
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read migration " + resource.getFilename(), e);
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
