package villagecompute.clipindex.testing;

import io.quarkus.test.common.QuarkusTestResourceLifecycleManager;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.utility.DockerImageName;

import java.util.HashMap;
import java.util.Map;

/**
 * Quarkus test resource that starts a PostgreSQL 16 container for database tests.
 *
 * <p>
 * The container's JDBC details override the datasource configured in application.yaml; Flyway then migrates the
 * schema at startup, so tests run against the production DDL (partial indexes, JSONB, {@code ON CONFLICT}).
 *
 * <p>
 * <b>CI Mode:</b> when the {@code QUARKUS_DATASOURCE_JDBC_URL} environment variable is set, no container is started
 * and the CI-provided database is used.
 */
public class PostgreSQLTestResource implements QuarkusTestResourceLifecycleManager {

    private PostgreSQLContainer<?> postgresContainer;
    private boolean usingCiDatabase = false;

    @Override
    public Map<String, String> start() {
        String ciJdbcUrl = System.getenv("QUARKUS_DATASOURCE_JDBC_URL");
        if (ciJdbcUrl != null && !ciJdbcUrl.isEmpty()) {
            usingCiDatabase = true;
            return Map.of();
        }

        postgresContainer = new PostgreSQLContainer<>(DockerImageName.parse("postgres:16-alpine"))
                .withDatabaseName("clipindex_test").withUsername("test").withPassword("test").withReuse(true);
        postgresContainer.start();

        // Only runtime properties can be overridden here
        Map<String, String> config = new HashMap<>();
        config.put("quarkus.datasource.username", postgresContainer.getUsername());
        config.put("quarkus.datasource.password", postgresContainer.getPassword());
        config.put("quarkus.datasource.jdbc.url", postgresContainer.getJdbcUrl());
        return config;
    }

    @Override
    public void stop() {
        if (postgresContainer != null && !usingCiDatabase) {
            postgresContainer.stop();
        }
    }
}
