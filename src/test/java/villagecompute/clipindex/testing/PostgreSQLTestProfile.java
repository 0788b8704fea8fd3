package villagecompute.clipindex.testing;

import io.quarkus.test.junit.QuarkusTestProfile;

import java.util.List;
import java.util.Map;

/**
 * Quarkus test profile for database tests against a real PostgreSQL.
 *
 * <p>
 * <b>Usage:</b>
 *
 * <pre>
 * &#64;QuarkusTest
 * &#64;TestProfile(PostgreSQLTestProfile.class)
 * class MyDatabaseTest extends BaseIntegrationTest {
 *     // test methods
 * }
 * </pre>
 *
 * <p>
 * Scheduled jobs are disabled so the dispatcher never claims rows a test is asserting on, and no S3 dev service is
 * started.
 */
public class PostgreSQLTestProfile implements QuarkusTestProfile {

    @Override
    public boolean disableGlobalTestResources() {
        return true;
    }

    @Override
    public List<TestResourceEntry> testResources() {
        return List.of(new TestResourceEntry(PostgreSQLTestResource.class));
    }

    @Override
    public Map<String, String> getConfigOverrides() {
        return Map.ofEntries(Map.entry("quarkus.scheduler.enabled", "false"),
                Map.entry("quarkus.s3.devservices.enabled", "false"),
                Map.entry("quarkus.datasource.devservices.enabled", "false"),
                Map.entry("quarkus.flyway.migrate-at-start", "true"),
                Map.entry("quarkus.hibernate-orm.database.generation", "none"),
                Map.entry("clipindex.discord.bot-token", "test-token"));
    }

    @Override
    public String getConfigProfile() {
        return "test";
    }
}
