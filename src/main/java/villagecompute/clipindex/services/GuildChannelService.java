package villagecompute.clipindex.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import villagecompute.clipindex.data.models.Channel;
import villagecompute.clipindex.data.models.Guild;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Guild and channel lookups plus the few guild/channel mutations the job core performs.
 */
@ApplicationScoped
public class GuildChannelService {

    private static final Logger LOG = Logger.getLogger(GuildChannelService.class);

    @Transactional
    public Optional<Guild> findActiveGuild(String guildId) {
        return Guild.findActive(guildId);
    }

    @Transactional
    public Optional<Channel> findActiveChannel(String guildId, String channelId) {
        return Channel.findActive(guildId, channelId);
    }

    @Transactional
    public List<String> listChannelIds(String guildId) {
        return Channel.listByGuild(guildId).stream().map(channel -> channel.id).toList();
    }

    @Transactional
    public void setPurgeCooldown(String channelId, Instant until) {
        Channel channel = Channel.findById(channelId);
        if (channel == null) {
            LOG.warnf("Cannot set purge cooldown, channel %s not found", channelId);
            return;
        }
        channel.purgeCooldown = until;
        channel.updatedAt = Instant.now();
    }

    /**
     * Marks the guild and its channels deleted. Rows are kept so a re-installation can see the prior history.
     */
    @Transactional
    public void softDeleteGuild(String guildId) {
        Instant now = Instant.now();
        Guild guild = Guild.findById(guildId);
        if (guild == null) {
            LOG.warnf("Cannot soft-delete guild %s, not found", guildId);
            return;
        }
        guild.deletedAt = now;
        guild.updatedAt = now;
        long channels = Channel.update("deletedAt = ?1, updatedAt = ?1 WHERE guildId = ?2 AND deletedAt IS NULL", now,
                guildId);
        LOG.infof("Soft-deleted guild %s and %d channels", guildId, channels);
    }
}
