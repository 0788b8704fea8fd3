package villagecompute.clipindex.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import villagecompute.clipindex.data.models.ChannelSettings;
import villagecompute.clipindex.data.models.GuildSettings;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads and writes the persisted guild and channel settings layers.
 */
@ApplicationScoped
public class SettingsStore {

    /**
     * Raw settings layers of one channel, as stored.
     */
    public record SettingsLayers(Map<String, Object> guildDefaults, Map<String, Object> guildSettings,
            Map<String, Object> channelSettings) {
    }

    @Transactional
    public SettingsLayers load(String guildId, String channelId) {
        GuildSettings guild = GuildSettings.findById(guildId);
        ChannelSettings channel = channelId == null ? null : ChannelSettings.findById(channelId);
        return new SettingsLayers(copy(guild == null ? null : guild.defaultChannelSettings),
                copy(guild == null ? null : guild.settings), copy(channel == null ? null : channel.settings));
    }

    @Transactional
    public void saveGuildSettings(String guildId, Map<String, Object> defaultChannelSettings,
            Map<String, Object> settings) {
        GuildSettings row = GuildSettings.findById(guildId);
        if (row == null) {
            row = new GuildSettings();
            row.guildId = guildId;
        }
        row.defaultChannelSettings = copy(defaultChannelSettings);
        row.settings = copy(settings);
        row.updatedAt = Instant.now();
        row.persist();
    }

    @Transactional
    public void saveChannelSettings(String guildId, String channelId, Map<String, Object> settings) {
        ChannelSettings row = ChannelSettings.findById(channelId);
        if (row == null) {
            row = new ChannelSettings();
            row.channelId = channelId;
        }
        row.guildId = guildId;
        row.settings = copy(settings);
        row.updatedAt = Instant.now();
        row.persist();
    }

    private static Map<String, Object> copy(Map<String, Object> source) {
        return source == null ? new LinkedHashMap<>() : new LinkedHashMap<>(source);
    }
}
