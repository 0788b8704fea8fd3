package villagecompute.clipindex.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import villagecompute.clipindex.jobs.JobType;

import java.time.Instant;
import java.util.Map;

/**
 * Panache entity backing the durable job log.
 *
 * <p>
 * Each row is one job. Rows with the same {@code stream_key} form an ordered log (ordered by {@code id}); workers
 * claim rows with {@code FOR UPDATE SKIP LOCKED} so a job is held by one consumer at a time. A claimed job that is not
 * acknowledged within the visibility window becomes claimable again.
 *
 * <p>
 * <b>Schema Mapping:</b>
 * <ul>
 * <li>{@code id} (BIGSERIAL, PK) - Sequence giving per-stream order</li>
 * <li>{@code stream_key} (TEXT) - {@code jobs:guild:{guild_id}:{job_type}}</li>
 * <li>{@code job_type} (TEXT) - wire name, kept as text so unknown types can be dead-lettered</li>
 * <li>{@code queue_priority} (INT) - priority of the job type's queue family</li>
 * <li>{@code guild_id} / {@code channel_id} (TEXT) - job target</li>
 * <li>{@code payload} (JSONB) - immutable job parameters</li>
 * <li>{@code status} (TEXT) - READY, CLAIMED, ACKED, DEAD_LETTER</li>
 * <li>{@code delivery_count} (INT) - number of times the job was handed to a consumer</li>
 * <li>{@code available_at} (TIMESTAMPTZ) - earliest claim time (used for nack backoff)</li>
 * <li>{@code claimed_by} / {@code claimed_at} - current holder and claim time</li>
 * <li>{@code acked_at} (TIMESTAMPTZ) - acknowledgement time</li>
 * <li>{@code last_error} (TEXT) - error of the last failed delivery</li>
 * <li>{@code created_at} (TIMESTAMPTZ)</li>
 * </ul>
 *
 * @see villagecompute.clipindex.services.JobQueueService for the claim protocol
 */
@Entity
@Table(
        name = "job_queue")
public class QueuedJob extends PanacheEntityBase {

    @Id
    @GeneratedValue(
            strategy = GenerationType.IDENTITY)
    @Column(
            nullable = false)
    public Long id;

    @Column(
            name = "stream_key",
            nullable = false)
    public String streamKey;

    @Column(
            name = "job_type",
            nullable = false)
    public String jobType;

    @Column(
            name = "queue_priority",
            nullable = false)
    public int queuePriority;

    @Column(
            name = "guild_id",
            nullable = false)
    public String guildId;

    @Column(
            name = "channel_id")
    public String channelId;

    @Column(
            name = "payload",
            nullable = false,
            columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    public Map<String, Object> payload;

    @Column(
            name = "status",
            nullable = false)
    @Enumerated(EnumType.STRING)
    public DeliveryStatus status;

    @Column(
            name = "delivery_count",
            nullable = false)
    public int deliveryCount;

    @Column(
            name = "available_at",
            nullable = false)
    public Instant availableAt;

    @Column(
            name = "claimed_by")
    public String claimedBy;

    @Column(
            name = "claimed_at")
    public Instant claimedAt;

    @Column(
            name = "acked_at")
    public Instant ackedAt;

    @Column(
            name = "last_error")
    public String lastError;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    /**
     * Delivery states of a queued job.
     */
    public enum DeliveryStatus {
        /**
         * Waiting to be claimed (possibly after {@code available_at}).
         */
        READY,

        /**
         * Held by a consumer until acknowledged, released or timed out.
         */
        CLAIMED,

        /**
         * Processed successfully.
         */
        ACKED,

        /**
         * Acknowledged without success (invalid or unrecoverable), kept for inspection.
         */
        DEAD_LETTER
    }

    /**
     * Builds the stream key for a guild and job type.
     */
    public static String streamKey(String guildId, JobType type) {
        return "jobs:guild:" + guildId + ":" + type.getWireName();
    }
}
