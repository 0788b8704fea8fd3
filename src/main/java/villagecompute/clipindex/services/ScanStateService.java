package villagecompute.clipindex.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import villagecompute.clipindex.data.models.ChannelScanStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Owns the scan lifecycle row of each channel ({@code channel_scan_status}).
 *
 * <p>
 * The row is the distributed lock that guarantees at most one active scan per channel. Every transition is a single
 * conditional statement guarded by the current status ({@code WHERE status IN (...)}), so two workers can never both
 * believe they own the same channel's scan: the loser's update matches zero rows.
 *
 * <p>
 * <b>Cursor discipline:</b> {@link #recordProgress} is only called after a batch's writes committed, and it only
 * matches while the row is still RUNNING. A {@code false} return therefore doubles as a cancellation signal from
 * another worker (purge or stop).
 *
 * @see ScanState for the transition table
 */
@ApplicationScoped
public class ScanStateService {

    private static final Logger LOG = Logger.getLogger(ScanStateService.class);

    @Inject
    EntityManager entityManager;

    /**
     * Per-channel snapshot returned to pollers.
     */
    public record ScanStatusView(String channelId, ScanState status, long messageCount, long totalMessagesScanned,
            Instant updatedAt, String errorMessage) {

        static ScanStatusView of(ChannelScanStatus row) {
            return new ScanStatusView(row.channelId, row.status, row.messageCount, row.totalMessagesScanned,
                    row.updatedAt, row.errorMessage);
        }
    }

    /**
     * Creates or resets the row to PENDING. Called at enqueue time so the channel never shows as unscanned between
     * enqueue and pickup.
     *
     * @return false when a scan is already PENDING or RUNNING for the channel
     */
    @Transactional
    public boolean markPending(String guildId, String channelId) {
        Instant now = Instant.now();
        int updated = entityManager.createNativeQuery("""
                INSERT INTO channel_scan_status
                  (channel_id, guild_id, status, message_count, total_messages_scanned, created_at, updated_at)
                VALUES (:channelId, :guildId, 'PENDING', 0, 0, :now, :now)
                ON CONFLICT (channel_id) DO UPDATE
                  SET status = 'PENDING', guild_id = EXCLUDED.guild_id, error_message = NULL, updated_at = :now
                  WHERE channel_scan_status.status IN ('SUCCEEDED', 'FAILED', 'CANCELLED')
                """).setParameter("channelId", channelId).setParameter("guildId", guildId).setParameter("now", now)
                .executeUpdate();
        if (updated == 0) {
            LOG.infof("Scan already active for channel %s", channelId);
            return false;
        }
        return true;
    }

    /**
     * PENDING to RUNNING when a worker picks up the scan job.
     *
     * @return false when the row is not PENDING (cancelled meanwhile, or a duplicate delivery of a running scan)
     */
    @Transactional
    public boolean markRunning(String channelId) {
        return transition(channelId, ScanState.RUNNING, Set.of(ScanState.PENDING), null) == 1;
    }

    /**
     * Advances the cursors and counters after a batch committed.
     *
     * <p>
     * The forward cursor only moves to a newer message and the backward cursor only to an older one (snowflakes are
     * compared numerically).
     *
     * @param newestMessageId
     *            newest message id of the committed batch
     * @param oldestMessageId
     *            oldest message id of the committed batch
     * @param messagesWithClips
     *            messages of the batch that produced clips
     * @param messagesScanned
     *            messages walked in the batch
     * @return false when the scan is no longer RUNNING
     */
    @Transactional
    public boolean recordProgress(String channelId, String newestMessageId, String oldestMessageId,
            int messagesWithClips, int messagesScanned) {
        int updated = entityManager.createNativeQuery("""
                UPDATE channel_scan_status SET
                  forward_cursor_message_id = CASE
                    WHEN forward_cursor_message_id IS NULL
                      OR CAST(forward_cursor_message_id AS NUMERIC) < CAST(:newest AS NUMERIC)
                    THEN :newest ELSE forward_cursor_message_id END,
                  backward_cursor_message_id = CASE
                    WHEN backward_cursor_message_id IS NULL
                      OR CAST(backward_cursor_message_id AS NUMERIC) > CAST(:oldest AS NUMERIC)
                    THEN :oldest ELSE backward_cursor_message_id END,
                  message_count = message_count + :withClips,
                  total_messages_scanned = total_messages_scanned + :scanned,
                  updated_at = :now
                WHERE channel_id = :channelId AND status = 'RUNNING'
                """).setParameter("newest", newestMessageId).setParameter("oldest", oldestMessageId)
                .setParameter("withClips", messagesWithClips).setParameter("scanned", messagesScanned)
                .setParameter("now", Instant.now()).setParameter("channelId", channelId).executeUpdate();
        return updated == 1;
    }

    /**
     * RUNNING to SUCCEEDED.
     */
    @Transactional
    public boolean complete(String channelId) {
        return transition(channelId, ScanState.SUCCEEDED, ScanState.SUCCEEDED.allowedSources(), null) == 1;
    }

    /**
     * RUNNING to PENDING, used when auto-continue enqueues the next chunk.
     */
    @Transactional
    public boolean requeue(String channelId) {
        return transition(channelId, ScanState.PENDING, Set.of(ScanState.RUNNING), null) == 1;
    }

    /**
     * PENDING or RUNNING to FAILED with a user-visible error message.
     */
    @Transactional
    public boolean fail(String channelId, String errorMessage) {
        boolean failed = transition(channelId, ScanState.FAILED, ScanState.FAILED.allowedSources(),
                errorMessage) == 1;
        if (failed) {
            LOG.warnf("Scan for channel %s failed: %s", channelId, errorMessage);
        }
        return failed;
    }

    /**
     * PENDING or RUNNING to CANCELLED.
     *
     * @return true when an active scan was cancelled
     */
    @Transactional
    public boolean cancel(String channelId, String reason) {
        return transition(channelId, ScanState.CANCELLED, ScanState.CANCELLED.allowedSources(), reason) == 1;
    }

    /**
     * Cancels every active scan of a guild.
     *
     * @return number of scans cancelled
     */
    @Transactional
    public int cancelGuild(String guildId, String reason) {
        int cancelled = entityManager.createNativeQuery("""
                UPDATE channel_scan_status SET status = 'CANCELLED', error_message = :reason, updated_at = :now
                WHERE guild_id = :guildId AND status IN ('PENDING', 'RUNNING')
                """).setParameter("reason", reason).setParameter("now", Instant.now())
                .setParameter("guildId", guildId).executeUpdate();
        if (cancelled > 0) {
            LOG.infof("Cancelled %d active scans in guild %s", cancelled, guildId);
        }
        return cancelled;
    }

    /**
     * Clears cursors and counters of a channel whose indexed data was purged. Active rows are left alone.
     */
    @Transactional
    public void resetProgress(String channelId) {
        entityManager.createNativeQuery("""
                UPDATE channel_scan_status
                SET forward_cursor_message_id = NULL, backward_cursor_message_id = NULL,
                    message_count = 0, total_messages_scanned = 0, updated_at = :now
                WHERE channel_id = :channelId AND status NOT IN ('PENDING', 'RUNNING')
                """).setParameter("now", Instant.now()).setParameter("channelId", channelId).executeUpdate();
    }

    /**
     * Cancels scans that have not been touched for longer than {@code threshold}; their worker is assumed dead.
     *
     * @return number of recovered rows
     */
    @Transactional
    public int recoverStale(Duration threshold) {
        int recovered = entityManager.createNativeQuery("""
                UPDATE channel_scan_status
                SET status = 'CANCELLED',
                    error_message = 'Scan timed out - was stuck in ' || status || ' status for more than '
                                    || :minutes || ' minutes',
                    updated_at = :now
                WHERE status IN ('PENDING', 'RUNNING') AND updated_at < :cutoff
                """).setParameter("minutes", String.valueOf(threshold.toMinutes())).setParameter("now", Instant.now())
                .setParameter("cutoff", Instant.now().minus(threshold)).executeUpdate();
        if (recovered > 0) {
            LOG.warnf("Recovered %d stale scans (idle longer than %d minutes)", recovered, threshold.toMinutes());
        }
        return recovered;
    }

    @Transactional
    public Optional<ChannelScanStatus> find(String channelId) {
        return ChannelScanStatus.findByChannel(channelId);
    }

    @Transactional
    public Optional<ScanStatusView> getStatus(String channelId) {
        return ChannelScanStatus.findByChannel(channelId).map(ScanStatusView::of);
    }

    @Transactional
    public List<ScanStatusView> getGuildStatuses(String guildId) {
        return ChannelScanStatus.listByGuild(guildId).stream().map(ScanStatusView::of).toList();
    }

    /**
     * Number of rows per state, for health reporting.
     */
    @Transactional
    public Map<ScanState, Long> healthStats() {
        Map<ScanState, Long> stats = new EnumMap<>(ScanState.class);
        for (ScanState state : ScanState.values()) {
            stats.put(state, 0L);
        }
        @SuppressWarnings("unchecked")
        List<Object[]> rows = entityManager
                .createNativeQuery("SELECT status, COUNT(*) FROM channel_scan_status GROUP BY status")
                .getResultList();
        for (Object[] row : rows) {
            stats.put(ScanState.valueOf(row[0].toString()), ((Number) row[1]).longValue());
        }
        return stats;
    }

    private int transition(String channelId, ScanState target, Set<ScanState> sources, String errorMessage) {
        List<String> sourceNames = sources.stream().map(Enum::name).sorted().collect(Collectors.toList());
        int updated = entityManager.createNativeQuery("""
                UPDATE channel_scan_status SET status = :target, error_message = :error, updated_at = :now
                WHERE channel_id = :channelId AND status IN (:sources)
                """).setParameter("target", target.name()).setParameter("error", errorMessage)
                .setParameter("now", Instant.now()).setParameter("channelId", channelId)
                .setParameter("sources", sourceNames).executeUpdate();
        LOG.debugf("Scan transition %s -> %s for channel %s: %d row(s)", sources, target, channelId, updated);
        return updated;
    }
}
