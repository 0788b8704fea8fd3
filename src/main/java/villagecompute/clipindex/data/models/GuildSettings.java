package villagecompute.clipindex.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;

/**
 * Guild-level scan settings.
 *
 * <p>
 * {@code default_channel_settings} applies to every channel of the guild; {@code settings} holds guild-wide values
 * and is applied on top of it.
 */
@Entity
@Table(
        name = "guild_settings")
public class GuildSettings extends PanacheEntityBase {

    @Id
    @Column(
            name = "guild_id",
            nullable = false)
    public String guildId;

    @Column(
            name = "default_channel_settings",
            columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    public Map<String, Object> defaultChannelSettings;

    @Column(
            name = "settings",
            columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    public Map<String, Object> settings;

    @Column(
            name = "updated_at",
            nullable = false)
    public Instant updatedAt;
}
