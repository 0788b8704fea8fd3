package villagecompute.clipindex.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.List;

/**
 * A video attachment found by a scan.
 *
 * <p>
 * <b>Schema Mapping:</b>
 * <ul>
 * <li>{@code id} (TEXT, PK) - MD5 of {@code message_id:channel_id:filename:timestamp}, stable across rescans</li>
 * <li>{@code cdn_url} / {@code expires_at} - signed attachment URL and its expiry</li>
 * <li>{@code thumbnail_status} (TEXT) - PENDING, PROCESSING, COMPLETED, FAILED</li>
 * <li>{@code settings_hash} (TEXT) - hash of the effective settings the clip was indexed with</li>
 * <li>{@code visibility} (TEXT) - PUBLIC, UNLISTED, PRIVATE (dashboard managed)</li>
 * <li>{@code archived} (BOOLEAN) - archived clips are hidden and cannot be favorited</li>
 * </ul>
 *
 * <p>
 * Scan writes go through {@link villagecompute.clipindex.data.bulk.BulkWriteRepository}; the dashboard only performs
 * narrow updates (visibility, title, archive, favorite).
 */
@Entity
@Table(
        name = "clips",
        indexes = { @Index(
                name = "idx_clips_channel",
                columnList = "channel_id"),
                @Index(
                        name = "idx_clips_guild",
                        columnList = "guild_id"),
                @Index(
                        name = "idx_clips_message",
                        columnList = "message_id") })
public class Clip extends PanacheEntityBase {

    @Id
    @Column(
            nullable = false)
    public String id;

    @Column(
            name = "message_id",
            nullable = false)
    public String messageId;

    @Column(
            name = "guild_id",
            nullable = false)
    public String guildId;

    @Column(
            name = "channel_id",
            nullable = false)
    public String channelId;

    @Column(
            name = "author_id",
            nullable = false)
    public String authorId;

    @Column(
            name = "filename",
            nullable = false)
    public String filename;

    @Column(
            name = "file_size",
            nullable = false)
    public long fileSize;

    @Column(
            name = "mime_type",
            nullable = false)
    public String mimeType;

    @Column(
            name = "cdn_url",
            nullable = false)
    public String cdnUrl;

    @Column(
            name = "expires_at",
            nullable = false)
    public Instant expiresAt;

    @Column(
            name = "thumbnail_status",
            nullable = false)
    @Enumerated(EnumType.STRING)
    public ThumbnailStatus thumbnailStatus;

    @Column(
            name = "settings_hash")
    public String settingsHash;

    @Column(
            name = "title")
    public String title;

    @Column(
            name = "visibility",
            nullable = false)
    @Enumerated(EnumType.STRING)
    public Visibility visibility;

    @Column(
            name = "archived",
            nullable = false)
    public boolean archived;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    @Column(
            name = "updated_at",
            nullable = false)
    public Instant updatedAt;

    public enum ThumbnailStatus {
        PENDING, PROCESSING, COMPLETED, FAILED
    }

    public enum Visibility {
        PUBLIC, UNLISTED, PRIVATE
    }

    public static List<Clip> findByIds(List<String> clipIds) {
        if (clipIds == null || clipIds.isEmpty()) {
            return List.of();
        }
        return list("id IN ?1", clipIds);
    }

    /**
     * Clips whose CDN URL expires before the given instant.
     */
    public static List<Clip> findExpiringBefore(Instant cutoff, int limit) {
        return find("expiresAt < ?1 ORDER BY expiresAt ASC", cutoff).page(0, limit).list();
    }

    public boolean isCdnUrlExpired(Instant now) {
        return expiresAt == null || !expiresAt.isAfter(now);
    }
}
