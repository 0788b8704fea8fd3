package villagecompute.clipindex.services;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.clipindex.data.models.Channel;
import villagecompute.clipindex.exceptions.PurgeCooldownException;
import villagecompute.clipindex.integration.discord.DiscordClient;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Removes indexed data of a channel or a whole guild.
 *
 * <p>
 * <b>Channel purge:</b> rejected inside the purge cooldown; otherwise the running scan is cancelled (in-process flag
 * plus persisted CANCELLED state), thumbnail files are deleted from storage, rows are deleted in one transaction, and a
 * new cooldown is set.
 *
 * <p>
 * <b>Guild purge:</b> no cooldown. Cancels all active scans of the guild, deletes its files and rows, soft-deletes the
 * guild and asks the platform to remove the bot. Storage and leave failures are logged and do not fail the purge.
 */
@ApplicationScoped
public class PurgeCoordinator {

    private static final Logger LOG = Logger.getLogger(PurgeCoordinator.class);

    @Inject
    PurgeDataService purgeDataService;

    @Inject
    ScanStateService scanStateService;

    @Inject
    ScanCancellationRegistry cancellationRegistry;

    @Inject
    GuildChannelService guildChannelService;

    @Inject
    StorageGateway storageGateway;

    @Inject
    DiscordClient discordClient;

    @Inject
    MeterRegistry meterRegistry;

    @ConfigProperty(
            name = "clipindex.purge.cooldown",
            defaultValue = "24h")
    Duration purgeCooldown;

    /**
     * Counts removed by a purge, for confirmation and audit.
     */
    public record PurgeResult(int messagesDeleted, int clipsDeleted, int thumbnailsDeleted, int filesDeleted,
            int channelsPurged, boolean guildLeft) {
    }

    /**
     * Purges one channel.
     *
     * @throws PurgeCooldownException
     *             if the channel is inside its purge cooldown; nothing is modified
     */
    public PurgeResult purgeChannel(String guildId, String channelId) {
        Instant now = Instant.now();
        Optional<Channel> channel = guildChannelService.findActiveChannel(guildId, channelId);
        if (channel.isPresent() && channel.get().isInPurgeCooldown(now)) {
            throw new PurgeCooldownException(channelId, channel.get().purgeCooldown);
        }

        cancellationRegistry.cancelChannel(channelId);
        if (scanStateService.cancel(channelId, "Cancelled by channel purge")) {
            LOG.infof("Cancelled active scan of channel %s before purge", channelId);
        }

        int filesDeleted = deleteFiles(purgeDataService.channelThumbnailPaths(channelId));
        PurgeDataService.DeletedRows deleted = purgeDataService.deleteChannelData(channelId);
        guildChannelService.setPurgeCooldown(channelId, now.plus(purgeCooldown));

        PurgeResult result = new PurgeResult(deleted.messages(), deleted.clips(), deleted.thumbnails(), filesDeleted,
                1, false);
        Counter.builder("clipindex.purge.total").tag("scope", "channel").register(meterRegistry).increment();
        LOG.infof("Purged channel %s in guild %s: messages=%d, clips=%d, thumbnails=%d, files=%d", channelId,
                guildId, result.messagesDeleted(), result.clipsDeleted(), result.thumbnailsDeleted(),
                result.filesDeleted());
        return result;
    }

    /**
     * Purges a guild and leaves it.
     */
    public PurgeResult purgeGuild(String guildId) {
        cancellationRegistry.cancelGuild(guildId);
        scanStateService.cancelGuild(guildId, "Cancelled by guild purge");

        List<String> channelIds = guildChannelService.listChannelIds(guildId);
        int filesDeleted = deleteFiles(purgeDataService.guildThumbnailPaths(guildId));
        PurgeDataService.DeletedRows deleted = purgeDataService.deleteGuildData(guildId);
        guildChannelService.softDeleteGuild(guildId);

        boolean left = false;
        try {
            discordClient.leaveGuild(guildId);
            left = true;
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to leave guild %s after purge", guildId);
        }

        PurgeResult result = new PurgeResult(deleted.messages(), deleted.clips(), deleted.thumbnails(), filesDeleted,
                channelIds.size(), left);
        Counter.builder("clipindex.purge.total").tag("scope", "guild").register(meterRegistry).increment();
        LOG.infof("Purged guild %s: channels=%d, messages=%d, clips=%d, thumbnails=%d, files=%d, left=%s", guildId,
                result.channelsPurged(), result.messagesDeleted(), result.clipsDeleted(), result.thumbnailsDeleted(),
                result.filesDeleted(), left);
        return result;
    }

    private int deleteFiles(List<String> paths) {
        int deleted = 0;
        for (String path : paths) {
            try {
                storageGateway.delete(path);
                deleted++;
            } catch (RuntimeException e) {
                LOG.warnf("Failed to delete thumbnail file %s: %s", path, e.getMessage());
            }
        }
        return deleted;
    }
}
