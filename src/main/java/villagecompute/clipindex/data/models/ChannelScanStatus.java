package villagecompute.clipindex.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import villagecompute.clipindex.services.ScanState;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Scan lifecycle row of a channel.
 *
 * <p>
 * There is exactly one row per channel. It is the single source of truth for "is a scan active" across all worker
 * processes: every status change is a conditional update guarded by the current status, see
 * {@link villagecompute.clipindex.services.ScanStateService}.
 *
 * <p>
 * <b>Schema Mapping:</b>
 * <ul>
 * <li>{@code channel_id} (TEXT, PK)</li>
 * <li>{@code guild_id} (TEXT)</li>
 * <li>{@code status} (TEXT) - PENDING, RUNNING, SUCCEEDED, FAILED, CANCELLED</li>
 * <li>{@code forward_cursor_message_id} - newest committed message, resume point for forward scans</li>
 * <li>{@code backward_cursor_message_id} - oldest committed message, resume point for backfill</li>
 * <li>{@code message_count} - messages that produced at least one clip</li>
 * <li>{@code total_messages_scanned} - all messages walked</li>
 * <li>{@code error_message} - reason of the last FAILED or CANCELLED transition</li>
 * </ul>
 */
@Entity
@Table(
        name = "channel_scan_status",
        indexes = @Index(
                name = "idx_channel_scan_status_guild",
                columnList = "guild_id"))
public class ChannelScanStatus extends PanacheEntityBase {

    @Id
    @Column(
            name = "channel_id",
            nullable = false)
    public String channelId;

    @Column(
            name = "guild_id",
            nullable = false)
    public String guildId;

    @Column(
            name = "status",
            nullable = false)
    @Enumerated(EnumType.STRING)
    public ScanState status;

    @Column(
            name = "forward_cursor_message_id")
    public String forwardCursorMessageId;

    @Column(
            name = "backward_cursor_message_id")
    public String backwardCursorMessageId;

    @Column(
            name = "message_count",
            nullable = false)
    public long messageCount;

    @Column(
            name = "total_messages_scanned",
            nullable = false)
    public long totalMessagesScanned;

    @Column(
            name = "error_message")
    public String errorMessage;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    @Column(
            name = "updated_at",
            nullable = false)
    public Instant updatedAt;

    public static Optional<ChannelScanStatus> findByChannel(String channelId) {
        return findByIdOptional(channelId);
    }

    public static List<ChannelScanStatus> listByGuild(String guildId) {
        return list("guildId = ?1 ORDER BY channelId", guildId);
    }
}
