package villagecompute.clipindex.services;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.quarkus.narayana.jta.QuarkusTransaction;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.clipindex.data.models.Clip;
import villagecompute.clipindex.exceptions.MessageDeletedException;
import villagecompute.clipindex.integration.discord.DiscordAttachment;
import villagecompute.clipindex.integration.discord.DiscordClient;
import villagecompute.clipindex.integration.discord.DiscordMessage;
import villagecompute.clipindex.util.CdnUrls;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Keeps signed attachment URLs of clips fresh.
 *
 * <p>
 * A refresh refetches the source message and copies the current URL of the attachment with the clip's filename. When
 * the message was deleted, or no longer carries the attachment, the clip is deleted with its thumbnails instead.
 */
@ApplicationScoped
public class CdnRefreshService {

    private static final Logger LOG = Logger.getLogger(CdnRefreshService.class);

    @Inject
    DiscordClient discordClient;

    @Inject
    PurgeDataService purgeDataService;

    @Inject
    StorageGateway storageGateway;

    @Inject
    MeterRegistry meterRegistry;

    /**
     * Outcome of a refresh run.
     */
    public record RefreshResult(int refreshed, int deleted, int missing) {
    }

    /**
     * Refreshes the URLs of the given clips.
     *
     * @throws RuntimeException
     *             on platform or database errors other than a deleted message; clips handled before the error keep
     *             their update
     */
    public RefreshResult refresh(List<String> clipIds) {
        List<Clip> clips = QuarkusTransaction.requiringNew().call(() -> Clip.findByIds(clipIds));
        int refreshed = 0;
        int deleted = 0;
        for (Clip clip : clips) {
            Optional<DiscordAttachment> attachment;
            try {
                DiscordMessage message = discordClient.fetchMessage(clip.channelId, clip.messageId);
                attachment = message.findAttachment(clip.filename);
            } catch (MessageDeletedException e) {
                LOG.infof("Source message of clip %s was deleted, removing clip", clip.id);
                attachment = Optional.empty();
            }

            if (attachment.isEmpty()) {
                deleteClip(clip.id);
                deleted++;
                continue;
            }

            String url = attachment.get().url();
            Instant expiresAt = CdnUrls.expiresAt(url, Instant.now());
            QuarkusTransaction.requiringNew().run(() -> Clip.update("cdnUrl = ?1, expiresAt = ?2, updatedAt = ?3 "
                    + "WHERE id = ?4", url, expiresAt, Instant.now(), clip.id));
            refreshed++;
        }

        RefreshResult result = new RefreshResult(refreshed, deleted, clipIds.size() - clips.size());
        Counter.builder("clipindex.cdn_refresh.total").tag("outcome", "refreshed").register(meterRegistry)
                .increment(refreshed);
        Counter.builder("clipindex.cdn_refresh.total").tag("outcome", "deleted").register(meterRegistry)
                .increment(deleted);
        LOG.infof("CDN refresh: %d refreshed, %d deleted, %d missing", result.refreshed(), result.deleted(),
                result.missing());
        return result;
    }

    /**
     * Clips expiring within {@code window}, grouped by guild.
     */
    public Map<String, List<String>> findExpiring(Duration window, int limit) {
        Instant cutoff = Instant.now().plus(window);
        List<Clip> clips = QuarkusTransaction.requiringNew().call(() -> Clip.findExpiringBefore(cutoff, limit));
        return clips.stream().collect(Collectors.groupingBy(clip -> clip.guildId, LinkedHashMap::new,
                Collectors.mapping(clip -> clip.id, Collectors.toList())));
    }

    private void deleteClip(String clipId) {
        for (String path : purgeDataService.deleteClip(clipId)) {
            try {
                storageGateway.delete(path);
            } catch (RuntimeException e) {
                LOG.warnf("Failed to delete thumbnail file %s: %s", path, e.getMessage());
            }
        }
    }
}
