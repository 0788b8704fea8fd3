package villagecompute.clipindex.data.bulk;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import villagecompute.clipindex.exceptions.ScanNotRunningException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link BulkWriteRepository}.
 */
class BulkWriteRepositoryTest {

    @Mock
    UpsertStatementRunner statementRunner;

    @InjectMocks
    BulkWriteRepository repository;

    private SimpleMeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        meterRegistry = new SimpleMeterRegistry();
        repository.meterRegistry = meterRegistry;
        repository.batchSize = 1000;
    }

    private static Map<String, Object> message(String id, String authorId, String content) {
        Map<String, Object> row = new HashMap<>();
        row.put("id", id);
        row.put("guild_id", "g1");
        row.put("channel_id", "c1");
        row.put("author_id", authorId);
        row.put("content", content);
        row.put("timestamp", Instant.parse("2024-01-01T00:00:00Z"));
        return row;
    }

    @Test
    void testBulkUpsert_missingRequiredColumnCountsAsFailure() {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = 0; i < 9; i++) {
            rows.add(message("m" + i, "u1", "hello"));
        }
        rows.add(message("m9", null, "no author"));
        when(statementRunner.execute(eq("c1"), anyString(), anyMap())).thenReturn(9);

        BulkWriteResult result = repository.bulkUpsert("c1", UpsertTable.MESSAGES, rows);

        assertEquals(9, result.success());
        assertEquals(1, result.failure());
        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        verify(statementRunner, times(1)).execute(eq("c1"), sql.capture(), anyMap());
        assertTrue(sql.getValue().startsWith("INSERT INTO messages"));
        assertTrue(sql.getValue().contains("ON CONFLICT (id) DO UPDATE SET content = EXCLUDED.content"));
        assertEquals(1.0, meterRegistry.get("clipindex.bulk.rows.total").tag("table", "messages")
                .tag("status", "failure").counter().count());
    }

    @Test
    void testBulkUpsert_failedChunkIsRetriedRowByRow() {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            rows.add(message("m" + i, "u1", "ok"));
        }
        rows.add(message("m-bad", "u-missing", "violates foreign key"));
        when(statementRunner.execute(eq("c1"), anyString(), anyMap())).thenAnswer(invocation -> {
            Map<String, Object> params = invocation.getArgument(2);
            if (params.containsValue("m-bad")) {
                throw new RuntimeException("insert or update violates foreign key constraint");
            }
            return 1;
        });

        BulkWriteResult result = repository.bulkUpsert("c1", UpsertTable.MESSAGES, rows);

        assertEquals(4, result.success());
        assertEquals(1, result.failure());
        // one failed chunk, then five single-row statements
        verify(statementRunner, times(6)).execute(eq("c1"), anyString(), anyMap());
    }

    @Test
    void testBulkUpsert_cancelledScanAbandonsRemainingChunks() {
        repository.batchSize = 2;
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            rows.add(message("m" + i, "u1", "x"));
        }
        when(statementRunner.execute(eq("c1"), anyString(), anyMap())).thenReturn(2)
                .thenThrow(new ScanNotRunningException("c1"));

        assertThrows(ScanNotRunningException.class, () -> repository.bulkUpsert("c1", UpsertTable.MESSAGES, rows));

        // first chunk committed, second refused, third never attempted and no row-by-row retry
        verify(statementRunner, times(2)).execute(eq("c1"), anyString(), anyMap());
    }

    @Test
    void testBulkUpsert_duplicateIdsMergedLaterWins() {
        List<Map<String, Object>> rows = List.of(message("m1", "u1", "first"), message("m1", "u1", "second"));
        when(statementRunner.execute(eq("c1"), anyString(), anyMap())).thenReturn(1);

        BulkWriteResult result = repository.bulkUpsert("c1", UpsertTable.MESSAGES, rows);

        assertEquals(new BulkWriteResult(1, 0), result);
        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> params = ArgumentCaptor.forClass(Map.class);
        verify(statementRunner).execute(eq("c1"), anyString(), params.capture());
        int contentColumn = UpsertTable.MESSAGES.getColumns().indexOf(new UpsertTable.Column("content", "TEXT"));
        assertEquals("second", params.getValue().get(UpsertTable.parameterName(0, contentColumn)));
        assertEquals(null, params.getValue().get(UpsertTable.parameterName(1, 0)));
    }

    @Test
    void testBulkUpsert_splitsIntoBatches() {
        repository.batchSize = 3;
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = 0; i < 7; i++) {
            rows.add(message("m" + i, "u1", "x"));
        }
        when(statementRunner.execute(eq("c1"), anyString(), anyMap())).thenReturn(3);

        BulkWriteResult result = repository.bulkUpsert("c1", UpsertTable.MESSAGES, rows);

        assertEquals(7, result.success());
        verify(statementRunner, times(3)).execute(eq("c1"), anyString(), anyMap());
    }

    @Test
    void testBulkUpsert_emptyInputWritesNothing() {
        assertEquals(BulkWriteResult.empty(), repository.bulkUpsert("c1", UpsertTable.CLIPS, List.of()));
        verify(statementRunner, never()).execute(anyString(), anyString(), anyMap());
    }

    @Test
    void testChunkSize_respectsBindParameterLimit() {
        repository.batchSize = 100_000;
        int columns = UpsertTable.CLIPS.getColumns().size();
        assertEquals(BulkWriteRepository.MAX_BIND_PARAMETERS / columns, repository.chunkSize(UpsertTable.CLIPS));
    }

    @Test
    void testBulkUpsert_clipDefaultsThumbnailStatus() {
        Map<String, Object> clip = new HashMap<>();
        clip.put("id", "clip1");
        clip.put("message_id", "m1");
        clip.put("guild_id", "g1");
        clip.put("channel_id", "c1");
        clip.put("author_id", "u1");
        clip.put("filename", "a.mp4");
        clip.put("file_size", 10L);
        clip.put("mime_type", "video/mp4");
        clip.put("cdn_url", "https://cdn.example/a.mp4");
        clip.put("expires_at", Instant.parse("2024-01-02T00:00:00Z"));

        Map<String, Object> params = BulkWriteRepository.parameters(UpsertTable.CLIPS, List.of(clip));
        int statusColumn = UpsertTable.CLIPS.getColumns().indexOf(new UpsertTable.Column("thumbnail_status", "TEXT"));
        assertEquals(null, params.get(UpsertTable.parameterName(0, statusColumn)));

        when(statementRunner.execute(eq("c1"), anyString(), anyMap())).thenReturn(1);
        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> captured = ArgumentCaptor.forClass(Map.class);
        repository.bulkUpsert("c1", UpsertTable.CLIPS, List.of(clip));
        verify(statementRunner).execute(eq("c1"), anyString(), captured.capture());
        assertEquals("PENDING", captured.getValue().get(UpsertTable.parameterName(0, statusColumn)));
    }
}
