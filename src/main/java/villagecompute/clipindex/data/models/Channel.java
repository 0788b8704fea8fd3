package villagecompute.clipindex.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * A text channel of a guild.
 *
 * <p>
 * {@code purge_cooldown} holds the earliest time the channel may be purged again.
 */
@Entity
@Table(
        name = "channels",
        indexes = @Index(
                name = "idx_channels_guild",
                columnList = "guild_id"))
public class Channel extends PanacheEntityBase {

    @Id
    @Column(
            nullable = false)
    public String id;

    @Column(
            name = "guild_id",
            nullable = false)
    public String guildId;

    @Column(
            name = "name",
            nullable = false)
    public String name;

    @Column(
            name = "message_scan_enabled",
            nullable = false)
    public boolean messageScanEnabled;

    @Column(
            name = "purge_cooldown")
    public Instant purgeCooldown;

    @Column(
            name = "deleted_at")
    public Instant deletedAt;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    @Column(
            name = "updated_at",
            nullable = false)
    public Instant updatedAt;

    public static Optional<Channel> findActive(String guildId, String channelId) {
        return find("id = ?1 AND guildId = ?2 AND deletedAt IS NULL", channelId, guildId).firstResultOptional();
    }

    public static List<Channel> listByGuild(String guildId) {
        return list("guildId", guildId);
    }

    /**
     * Returns true while {@code now} is before the purge cooldown.
     */
    public boolean isInPurgeCooldown(Instant now) {
        return purgeCooldown != null && now.isBefore(purgeCooldown);
    }
}
