package villagecompute.clipindex.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import villagecompute.clipindex.data.models.Clip;
import villagecompute.clipindex.data.models.Message;

import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Bulk lookups of already-indexed rows, one query per batch.
 */
@ApplicationScoped
public class IndexedDataService {

    /**
     * The parts of a stored clip that decide whether a rescan must touch it.
     */
    public record ExistingClip(String id, Clip.ThumbnailStatus thumbnailStatus, String settingsHash,
            Instant expiresAt) {

        public boolean isUpToDate(String currentSettingsHash) {
            return thumbnailStatus == Clip.ThumbnailStatus.COMPLETED && currentSettingsHash.equals(settingsHash);
        }

        public boolean isCdnUrlExpired(Instant now) {
            return expiresAt == null || !expiresAt.isAfter(now);
        }
    }

    @Transactional
    public Set<String> existingMessageIds(String channelId, List<String> messageIds) {
        if (messageIds.isEmpty()) {
            return Set.of();
        }
        List<Message> messages = Message.list("channelId = ?1 AND id IN ?2", channelId, messageIds);
        Set<String> ids = new HashSet<>();
        for (Message message : messages) {
            ids.add(message.id);
        }
        return ids;
    }

    @Transactional
    public Map<String, ExistingClip> existingClips(List<String> clipIds) {
        Map<String, ExistingClip> existing = new HashMap<>();
        for (Clip clip : Clip.findByIds(clipIds)) {
            existing.put(clip.id, new ExistingClip(clip.id, clip.thumbnailStatus, clip.settingsHash, clip.expiresAt));
        }
        return existing;
    }
}
