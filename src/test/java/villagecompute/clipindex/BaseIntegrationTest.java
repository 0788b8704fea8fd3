package villagecompute.clipindex;

import io.quarkus.narayana.jta.QuarkusTransaction;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import jakarta.persistence.Query;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Abstract base class for tests that run against the PostgreSQL schema.
 *
 * <p>
 * The services under test commit in their own transactions ({@code REQUIRES_NEW} chunk writes, row locks held across
 * a claim), so a rollback-per-test transaction would hide exactly what these tests check. Instead every table is
 * truncated before each test, and fixtures are inserted in committed transactions.
 *
 * <p>
 * <b>Usage Example:</b>
 *
 * <pre>
 * &#64;QuarkusTest
 * &#64;TestProfile(PostgreSQLTestProfile.class)
 * class ScanStateServiceDatabaseTest extends BaseIntegrationTest {
 *     &#64;Test
 *     void testMarkPending() {
 *         insertScanStatus("c1", "g1", "SUCCEEDED", null, null);
 *         assertEquals(1, countRows("channel_scan_status", "status = 'SUCCEEDED'", Map.of()));
 *     }
 * }
 * </pre>
 *
 * @see villagecompute.clipindex.testing.PostgreSQLTestProfile
 */
public abstract class BaseIntegrationTest {

    @Inject
    protected EntityManager entityManager;

    /**
     * Truncates every table written by the application. Subclasses overriding this must call it first.
     */
    @BeforeEach
    protected void setUp() {
        QuarkusTransaction.requiringNew().run(() -> entityManager.createNativeQuery("""
                TRUNCATE TABLE clip_favorites, thumbnails, failed_thumbnails, clips, messages, chat_users,
                  channel_settings, guild_settings, channels, guilds, channel_scan_status, job_queue
                  RESTART IDENTITY
                """).executeUpdate());
    }

    /**
     * Hook executed after each test method. Override in subclasses if custom teardown is needed.
     */
    @AfterEach
    protected void tearDown() {
        // Subclasses can override for custom teardown
    }

    /**
     * Runs a native statement in its own committed transaction.
     */
    protected int executeCommitted(String sql, Map<String, Object> parameters) {
        return QuarkusTransaction.requiringNew().call(() -> {
            Query query = entityManager.createNativeQuery(sql);
            parameters.forEach(query::setParameter);
            return query.executeUpdate();
        });
    }

    protected long countRows(String table, String where, Map<String, Object> parameters) {
        return QuarkusTransaction.requiringNew().call(() -> {
            Query query = entityManager.createNativeQuery("SELECT COUNT(*) FROM " + table + " WHERE " + where);
            parameters.forEach(query::setParameter);
            return ((Number) query.getSingleResult()).longValue();
        });
    }

    protected void assertRowCount(long expected, String table, String where, Map<String, Object> parameters) {
        assertEquals(expected, countRows(table, where, parameters),
                "Unexpected row count in " + table + " where " + where);
    }

    protected Object selectValue(String sql, Map<String, Object> parameters) {
        return QuarkusTransaction.requiringNew().call(() -> {
            Query query = entityManager.createNativeQuery(sql);
            parameters.forEach(query::setParameter);
            return query.getSingleResult();
        });
    }

    protected void insertGuild(String guildId) {
        executeCommitted("INSERT INTO guilds (id, name) VALUES (:id, :name)", Map.of("id", guildId, "name",
                "Guild " + guildId));
    }

    protected void insertChannel(String guildId, String channelId) {
        executeCommitted("INSERT INTO channels (id, guild_id, name) VALUES (:id, :guildId, :name)",
                Map.of("id", channelId, "guildId", guildId, "name", "channel-" + channelId));
    }

    /**
     * Inserts a scan row in the given state; cursors may be null.
     */
    protected void insertScanStatus(String channelId, String guildId, String status, String forwardCursor,
            String backwardCursor) {
        QuarkusTransaction.requiringNew().run(() -> entityManager.createNativeQuery("""
                INSERT INTO channel_scan_status
                  (channel_id, guild_id, status, forward_cursor_message_id, backward_cursor_message_id)
                VALUES (:channelId, :guildId, :status, CAST(:forward AS TEXT), CAST(:backward AS TEXT))
                """).setParameter("channelId", channelId).setParameter("guildId", guildId)
                .setParameter("status", status).setParameter("forward", forwardCursor)
                .setParameter("backward", backwardCursor).executeUpdate());
    }

    protected void insertUser(String userId) {
        executeCommitted("INSERT INTO chat_users (id, username) VALUES (:id, :username)",
                Map.of("id", userId, "username", "user-" + userId));
    }

    protected void insertMessage(String guildId, String channelId, String messageId, String authorId) {
        executeCommitted("""
                INSERT INTO messages (id, guild_id, channel_id, author_id, content, timestamp)
                VALUES (:id, :guildId, :channelId, :authorId, 'hello', :timestamp)
                """, Map.of("id", messageId, "guildId", guildId, "channelId", channelId, "authorId", authorId,
                "timestamp", Instant.parse("2024-01-01T00:00:00Z")));
    }

    protected void insertClip(String guildId, String channelId, String messageId, String clipId) {
        executeCommitted("""
                INSERT INTO clips (id, message_id, guild_id, channel_id, author_id, filename, file_size, mime_type,
                                   cdn_url, expires_at)
                VALUES (:id, :messageId, :guildId, :channelId, 'u1', 'clip.mp4', 1024, 'video/mp4',
                        'https://cdn.discordapp.com/attachments/1/2/clip.mp4', :expiresAt)
                """, Map.of("id", clipId, "messageId", messageId, "guildId", guildId, "channelId", channelId,
                "expiresAt", Instant.now().plusSeconds(86_400)));
    }
}
