package villagecompute.clipindex.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.Optional;

/**
 * A chat-platform server the bot is installed in.
 *
 * <p>
 * Guilds are never hard-deleted: a guild purge sets {@code deleted_at} so a later re-installation can detect prior
 * history.
 */
@Entity
@Table(
        name = "guilds")
public class Guild extends PanacheEntityBase {

    @Id
    @Column(
            nullable = false)
    public String id;

    @Column(
            name = "owner_id")
    public String ownerId;

    @Column(
            name = "name",
            nullable = false)
    public String name;

    @Column(
            name = "message_scan_enabled",
            nullable = false)
    public boolean messageScanEnabled;

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

    /**
     * Finds a guild that has not been soft-deleted.
     */
    public static Optional<Guild> findActive(String guildId) {
        return find("id = ?1 AND deletedAt IS NULL", guildId).firstResultOptional();
    }
}
