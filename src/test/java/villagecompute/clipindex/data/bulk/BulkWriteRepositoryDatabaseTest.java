package villagecompute.clipindex.data.bulk;

import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.test.junit.QuarkusTest;
import io.quarkus.test.junit.TestProfile;
import jakarta.inject.Inject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import villagecompute.clipindex.BaseIntegrationTest;
import villagecompute.clipindex.exceptions.ScanNotRunningException;
import villagecompute.clipindex.services.ScanStateService;
import villagecompute.clipindex.testing.PostgreSQLTestProfile;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests the generated upserts of {@link BulkWriteRepository} and the running-scan gate of
 * {@link UpsertStatementRunner} against PostgreSQL.
 */
@QuarkusTest
@TestProfile(PostgreSQLTestProfile.class)
class BulkWriteRepositoryDatabaseTest extends BaseIntegrationTest {

    private static final Instant EXPIRES_AT = Instant.parse("2030-01-01T00:00:00Z");

    @Inject
    BulkWriteRepository bulkWriteRepository;

    @Inject
    ScanStateService scanStateService;

    @Override
    @BeforeEach
    protected void setUp() {
        super.setUp();
        insertScanStatus("c1", "g1", "RUNNING", null, null);
    }

    private static Map<String, Object> user(String id, String username) {
        Map<String, Object> row = new HashMap<>();
        row.put("id", id);
        row.put("username", username);
        row.put("discriminator", "0");
        row.put("avatar_url", null);
        return row;
    }

    private static Map<String, Object> message(String id, String content) {
        Map<String, Object> row = new HashMap<>();
        row.put("id", id);
        row.put("guild_id", "g1");
        row.put("channel_id", "c1");
        row.put("author_id", "u1");
        row.put("content", content);
        row.put("timestamp", Instant.parse("2024-01-01T00:00:00Z"));
        return row;
    }

    private static Map<String, Object> clip(String id, String messageId, String cdnUrl) {
        Map<String, Object> row = new HashMap<>();
        row.put("id", id);
        row.put("message_id", messageId);
        row.put("guild_id", "g1");
        row.put("channel_id", "c1");
        row.put("author_id", "u1");
        row.put("filename", "clip.mp4");
        row.put("file_size", 2048L);
        row.put("mime_type", "video/mp4");
        row.put("cdn_url", cdnUrl);
        row.put("expires_at", EXPIRES_AT);
        row.put("settings_hash", "hash-1");
        return row;
    }

    private void writePage(String content, String cdnUrl) {
        List<Map<String, Object>> messages = new ArrayList<>();
        List<Map<String, Object>> clips = new ArrayList<>();
        for (int i = 1; i <= 3; i++) {
            messages.add(message("m" + i, content));
            clips.add(clip("clip-" + i, "m" + i, cdnUrl));
        }
        assertEquals(new BulkWriteResult(1, 0),
                bulkWriteRepository.bulkUpsert("c1", UpsertTable.CHAT_USERS, List.of(user("u1", "alice"))));
        assertEquals(new BulkWriteResult(3, 0), bulkWriteRepository.bulkUpsert("c1", UpsertTable.MESSAGES, messages));
        assertEquals(new BulkWriteResult(3, 0), bulkWriteRepository.bulkUpsert("c1", UpsertTable.CLIPS, clips));
    }

    @Test
    void testBulkUpsert_rerunningBatchKeepsRowCounts() {
        writePage("first", "https://cdn.discordapp.com/attachments/1/2/clip.mp4?ex=1");
        executeCommitted("UPDATE clips SET thumbnail_status = 'COMPLETED' WHERE id = 'clip-1'", Map.of());

        writePage("second", "https://cdn.discordapp.com/attachments/1/2/clip.mp4?ex=2");

        assertRowCount(1, "chat_users", "TRUE", Map.of());
        assertRowCount(3, "messages", "channel_id = 'c1'", Map.of());
        assertRowCount(3, "clips", "channel_id = 'c1'", Map.of());
        assertRowCount(3, "messages", "content = 'second'", Map.of());
        assertRowCount(3, "clips", "cdn_url LIKE '%ex=2'", Map.of());
        assertRowCount(1, "clips", "id = 'clip-1' AND thumbnail_status = 'COMPLETED'", Map.of());
        assertRowCount(2, "clips", "thumbnail_status = 'PENDING'", Map.of());
    }

    @Test
    void testBulkUpsert_nullsAndTimestampsBindThroughCasts() {
        Map<String, Object> row = message("m1", null);

        bulkWriteRepository.bulkUpsert("c1", UpsertTable.MESSAGES, List.of(row));

        assertRowCount(1, "messages", "id = 'm1' AND content IS NULL AND timestamp = :ts",
                Map.of("ts", Instant.parse("2024-01-01T00:00:00Z")));
    }

    @Test
    void testBulkUpsert_orphanClipFailsAloneWhileNeighboursCommit() {
        bulkWriteRepository.bulkUpsert("c1", UpsertTable.MESSAGES, List.of(message("m1", "hi")));

        BulkWriteResult result = bulkWriteRepository.bulkUpsert("c1", UpsertTable.CLIPS,
                List.of(clip("clip-1", "m1", "https://cdn/a.mp4"), clip("clip-2", "m-missing", "https://cdn/b.mp4")));

        assertEquals(new BulkWriteResult(1, 1), result);
        assertRowCount(1, "clips", "id = 'clip-1'", Map.of());
        assertRowCount(0, "clips", "id = 'clip-2'", Map.of());
    }

    @Test
    void testBulkUpsert_refusedOnceScanCancelled() {
        assertTrue(scanStateService.cancel("c1", "Cancelled by channel purge"));

        assertThrows(ScanNotRunningException.class,
                () -> bulkWriteRepository.bulkUpsert("c1", UpsertTable.MESSAGES, List.of(message("m1", "late"))));

        assertRowCount(0, "messages", "TRUE", Map.of());
    }

    @Test
    void testBulkUpsert_refusedWithoutScanRow() {
        assertThrows(ScanNotRunningException.class,
                () -> bulkWriteRepository.bulkUpsert("c-unknown", UpsertTable.MESSAGES, List.of(message("m1", "x"))));

        assertRowCount(0, "messages", "TRUE", Map.of());
    }

    @Test
    void testCancel_waitsForInFlightChunkToCommit() throws Exception {
        CountDownLatch chunkStarted = new CountDownLatch(1);
        CountDownLatch finishChunk = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            // holds the same share lock a chunk transaction takes, then writes
            Future<?> chunk = executor.submit(() -> QuarkusTransaction.requiringNew().run(() -> {
                entityManager.createNativeQuery(
                        "SELECT status FROM channel_scan_status WHERE channel_id = 'c1' FOR SHARE").getResultList();
                chunkStarted.countDown();
                try {
                    finishChunk.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException(e);
                }
                entityManager.createNativeQuery("""
                        INSERT INTO messages (id, guild_id, channel_id, author_id, timestamp)
                        VALUES ('m-inflight', 'g1', 'c1', 'u1', NOW())
                        """).executeUpdate();
            }));
            assertTrue(chunkStarted.await(10, TimeUnit.SECONDS));

            Future<Boolean> cancel = executor.submit(() -> scanStateService.cancel("c1", "Cancelled by channel purge"));
            assertThrows(TimeoutException.class, () -> cancel.get(500, TimeUnit.MILLISECONDS),
                    "Cancel must wait for the in-flight chunk");

            finishChunk.countDown();
            chunk.get(10, TimeUnit.SECONDS);
            assertTrue(cancel.get(10, TimeUnit.SECONDS));
        } finally {
            finishChunk.countDown();
            executor.shutdownNow();
        }

        // the committed chunk is visible to the purge that follows the cancel; later chunks are refused
        assertRowCount(1, "messages", "id = 'm-inflight'", Map.of());
        assertThrows(ScanNotRunningException.class,
                () -> bulkWriteRepository.bulkUpsert("c1", UpsertTable.MESSAGES, List.of(message("m2", "late"))));
    }
}
