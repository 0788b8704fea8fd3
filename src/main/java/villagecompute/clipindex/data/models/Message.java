package villagecompute.clipindex.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

import java.time.Instant;

/**
 * An indexed chat message that carried at least one clip.
 *
 * <p>
 * {@code content} is null when the effective settings disable message content storage.
 */
@Entity
@Table(
        name = "messages",
        indexes = { @Index(
                name = "idx_messages_channel",
                columnList = "channel_id"),
                @Index(
                        name = "idx_messages_guild",
                        columnList = "guild_id") })
public class Message extends PanacheEntityBase {

    @Id
    @Column(
            nullable = false)
    public String id;

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
            name = "content")
    public String content;

    @Column(
            name = "timestamp",
            nullable = false)
    public Instant timestamp;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    @Column(
            name = "updated_at",
            nullable = false)
    public Instant updatedAt;
}
