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
 * Per-channel settings overrides. Keys present here win over guild settings.
 */
@Entity
@Table(
        name = "channel_settings")
public class ChannelSettings extends PanacheEntityBase {

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
            name = "settings",
            columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    public Map<String, Object> settings;

    @Column(
            name = "updated_at",
            nullable = false)
    public Instant updatedAt;
}
