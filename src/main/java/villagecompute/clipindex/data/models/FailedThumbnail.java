package villagecompute.clipindex.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.List;

/**
 * Tracks clips whose thumbnail generation failed and when to try again.
 */
@Entity
@Table(
        name = "failed_thumbnails")
public class FailedThumbnail extends PanacheEntityBase {

    @Id
    @Column(
            name = "clip_id",
            nullable = false)
    public String clipId;

    @Column(
            name = "guild_id",
            nullable = false)
    public String guildId;

    @Column(
            name = "retry_count",
            nullable = false)
    public int retryCount;

    @Column(
            name = "next_retry_at")
    public Instant nextRetryAt;

    @Column(
            name = "last_error")
    public String lastError;

    @Column(
            name = "updated_at",
            nullable = false)
    public Instant updatedAt;

    /**
     * Failures due for another attempt. A null {@code next_retry_at} means retries are exhausted.
     */
    public static List<FailedThumbnail> findDue(Instant now, int limit) {
        return find("nextRetryAt IS NOT NULL AND nextRetryAt <= ?1 ORDER BY nextRetryAt ASC", now).page(0, limit)
                .list();
    }
}
