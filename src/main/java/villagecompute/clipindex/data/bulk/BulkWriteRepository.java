package villagecompute.clipindex.data.bulk;

import com.google.common.collect.Lists;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.clipindex.exceptions.ScanNotRunningException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Idempotent multi-row upserts of scan output (users, messages, clips).
 *
 * <p>
 * <b>Write path:</b>
 * <ol>
 * <li>Rows missing a required column are rejected and counted as failures.</li>
 * <li>Rows sharing an {@code id} are merged in input order (later non-null values win), so a single statement never
 * touches the same key twice.</li>
 * <li>Remaining rows are split into chunks that stay below the driver's bind parameter limit and the configured batch
 * size.</li>
 * <li>Each chunk is one {@code INSERT ... ON CONFLICT (id) DO UPDATE} in its own transaction. When a chunk fails its
 * rows are retried one by one so a single bad row does not drop its neighbours.</li>
 * <li>Every chunk is gated on the channel's scan still being RUNNING (see {@link UpsertStatementRunner}); once it is
 * not, the remaining chunks are abandoned.</li>
 * </ol>
 *
 * <p>
 * Callers write parents before children (users, then messages, then clips) so foreign keys hold.
 */
@ApplicationScoped
public class BulkWriteRepository {

    private static final Logger LOG = Logger.getLogger(BulkWriteRepository.class);

    /**
     * PostgreSQL wire protocol limit on bind parameters per statement.
     */
    static final int MAX_BIND_PARAMETERS = 65_535;

    @Inject
    UpsertStatementRunner statementRunner;

    @Inject
    MeterRegistry meterRegistry;

    @ConfigProperty(
            name = "clipindex.bulk.batch-size",
            defaultValue = "1000")
    int batchSize;

    /**
     * Upserts rows produced by the running scan of {@code scanChannelId}.
     *
     * @throws ScanNotRunningException
     *             when the scan stopped being RUNNING; chunks committed before that point stay written
     */
    public BulkWriteResult bulkUpsert(String scanChannelId, UpsertTable table, List<Map<String, Object>> rows) {
        if (rows == null || rows.isEmpty()) {
            return BulkWriteResult.empty();
        }

        Instant now = Instant.now();
        int invalid = 0;
        Map<String, Map<String, Object>> merged = new LinkedHashMap<>();
        for (Map<String, Object> row : rows) {
            if (row == null || !hasRequiredColumns(table, row)) {
                invalid++;
                continue;
            }
            merged.merge(row.get("id").toString(), withDefaults(table, row, now), BulkWriteRepository::mergeRows);
        }
        if (invalid > 0) {
            LOG.warnf("Rejected %d invalid %s rows", invalid, table.getTableName());
        }

        BulkWriteResult result = new BulkWriteResult(0, invalid);
        for (List<Map<String, Object>> chunk : Lists.partition(new ArrayList<>(merged.values()),
                chunkSize(table))) {
            result = result.plus(writeChunk(scanChannelId, table, chunk));
        }

        record(table, result);
        LOG.debugf("Bulk upsert into %s: %d written, %d failed", table.getTableName(), result.success(),
                result.failure());
        return result;
    }

    /**
     * Largest chunk that respects both the bind parameter limit and the configured batch size.
     */
    int chunkSize(UpsertTable table) {
        int byParameters = MAX_BIND_PARAMETERS / table.getColumns().size();
        return Math.max(1, Math.min(batchSize, byParameters));
    }

    private BulkWriteResult writeChunk(String scanChannelId, UpsertTable table, List<Map<String, Object>> chunk) {
        try {
            statementRunner.execute(scanChannelId, table.upsertSql(chunk.size()), parameters(table, chunk));
            return new BulkWriteResult(chunk.size(), 0);
        } catch (ScanNotRunningException e) {
            LOG.infof("Dropping %d %s rows: %s", chunk.size(), table.getTableName(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            if (chunk.size() == 1) {
                LOG.errorf(e, "Failed to upsert %s row %s", table.getTableName(), chunk.get(0).get("id"));
                return new BulkWriteResult(0, 1);
            }
            LOG.warnf(e, "Chunk of %d %s rows failed, retrying row by row", chunk.size(), table.getTableName());
            BulkWriteResult perRow = BulkWriteResult.empty();
            for (Map<String, Object> row : chunk) {
                perRow = perRow.plus(writeChunk(scanChannelId, table, List.of(row)));
            }
            return perRow;
        }
    }

    static Map<String, Object> parameters(UpsertTable table, List<Map<String, Object>> chunk) {
        Map<String, Object> parameters = new HashMap<>();
        List<UpsertTable.Column> columns = table.getColumns();
        for (int row = 0; row < chunk.size(); row++) {
            Map<String, Object> values = chunk.get(row);
            for (int c = 0; c < columns.size(); c++) {
                parameters.put(UpsertTable.parameterName(row, c), values.get(columns.get(c).name()));
            }
        }
        return parameters;
    }

    private static boolean hasRequiredColumns(UpsertTable table, Map<String, Object> row) {
        for (String column : table.getRequiredColumns()) {
            Object value = row.get(column);
            if (value == null || (value instanceof String s && s.isBlank())) {
                return false;
            }
        }
        return true;
    }

    private static Map<String, Object> withDefaults(UpsertTable table, Map<String, Object> row, Instant now) {
        Map<String, Object> copy = new HashMap<>(row);
        copy.putIfAbsent("created_at", now);
        copy.putIfAbsent("updated_at", now);
        if (table == UpsertTable.CLIPS) {
            copy.putIfAbsent("thumbnail_status", "PENDING");
        }
        return copy;
    }

    private static Map<String, Object> mergeRows(Map<String, Object> earlier, Map<String, Object> later) {
        Map<String, Object> combined = new HashMap<>(earlier);
        later.forEach((k, v) -> {
            if (v != null) {
                combined.put(k, v);
            }
        });
        return combined;
    }

    private void record(UpsertTable table, BulkWriteResult result) {
        Counter.builder("clipindex.bulk.rows.total").tag("table", table.getTableName()).tag("status", "success")
                .register(meterRegistry).increment(result.success());
        Counter.builder("clipindex.bulk.rows.total").tag("table", table.getTableName()).tag("status", "failure")
                .register(meterRegistry).increment(result.failure());
    }
}
