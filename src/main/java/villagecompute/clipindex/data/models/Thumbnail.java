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
import jakarta.persistence.UniqueConstraint;

import java.time.Instant;

/**
 * A stored thumbnail image of a clip. One row per clip and size.
 */
@Entity
@Table(
        name = "thumbnails",
        uniqueConstraints = @UniqueConstraint(
                name = "uq_thumbnails_clip_size",
                columnNames = { "clip_id", "size_type" }))
public class Thumbnail extends PanacheEntityBase {

    @Id
    @GeneratedValue(
            strategy = GenerationType.IDENTITY)
    public Long id;

    @Column(
            name = "clip_id",
            nullable = false)
    public String clipId;

    @Column(
            name = "size_type",
            nullable = false)
    @Enumerated(EnumType.STRING)
    public SizeType sizeType;

    @Column(
            name = "storage_path",
            nullable = false)
    public String storagePath;

    @Column(
            name = "width",
            nullable = false)
    public int width;

    @Column(
            name = "height",
            nullable = false)
    public int height;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    /**
     * Thumbnail variants with their pixel dimensions.
     */
    public enum SizeType {
        SMALL(320, 180), LARGE(640, 360);

        private final int width;
        private final int height;

        SizeType(int width, int height) {
            this.width = width;
            this.height = height;
        }

        public int getWidth() {
            return width;
        }

        public int getHeight() {
            return height;
        }

        public String suffix() {
            return name().toLowerCase();
        }
    }

    /**
     * Object key of a thumbnail in the thumbnail bucket.
     */
    public static String storagePath(String guildId, String clipId, SizeType sizeType) {
        return "thumbnails/guild_" + guildId + "/" + clipId + "_" + sizeType.suffix() + ".webp";
    }
}
