package villagecompute.clipindex.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.List;

/**
 * Transactional cascade deletes of indexed data.
 *
 * <p>
 * Rows are removed child first: thumbnails, failed thumbnails, favorites, clips, then messages. Each public delete
 * runs in one transaction, so a failure leaves the channel or guild untouched.
 */
@ApplicationScoped
public class PurgeDataService {

    private static final Logger LOG = Logger.getLogger(PurgeDataService.class);

    @Inject
    EntityManager entityManager;

    /**
     * Row counts removed by a purge.
     */
    public record DeletedRows(int messages, int clips, int thumbnails) {
    }

    @Transactional
    public List<String> channelThumbnailPaths(String channelId) {
        return thumbnailPaths("channel_id", channelId);
    }

    @Transactional
    public List<String> guildThumbnailPaths(String guildId) {
        return thumbnailPaths("guild_id", guildId);
    }

    /**
     * Deletes every indexed row of a channel and clears its scan cursors.
     */
    @Transactional
    public DeletedRows deleteChannelData(String channelId) {
        DeletedRows deleted = deleteScoped("channel_id", channelId);
        entityManager.createNativeQuery("""
                UPDATE channel_scan_status
                SET forward_cursor_message_id = NULL, backward_cursor_message_id = NULL,
                    message_count = 0, total_messages_scanned = 0, updated_at = :now
                WHERE channel_id = :channelId AND status NOT IN ('PENDING', 'RUNNING')
                """).setParameter("now", Instant.now()).setParameter("channelId", channelId).executeUpdate();
        LOG.infof("Deleted channel %s data: %s", channelId, deleted);
        return deleted;
    }

    /**
     * Deletes every indexed row of a guild and clears the scan cursors of all its channels.
     */
    @Transactional
    public DeletedRows deleteGuildData(String guildId) {
        DeletedRows deleted = deleteScoped("guild_id", guildId);
        entityManager.createNativeQuery("""
                UPDATE channel_scan_status
                SET forward_cursor_message_id = NULL, backward_cursor_message_id = NULL,
                    message_count = 0, total_messages_scanned = 0, updated_at = :now
                WHERE guild_id = :guildId AND status NOT IN ('PENDING', 'RUNNING')
                """).setParameter("now", Instant.now()).setParameter("guildId", guildId).executeUpdate();
        LOG.infof("Deleted guild %s data: %s", guildId, deleted);
        return deleted;
    }

    /**
     * Deletes one clip with its thumbnails and favorites, and its message when no other clip references it.
     *
     * @return storage paths of the deleted thumbnails
     */
    @Transactional
    @SuppressWarnings("unchecked")
    public List<String> deleteClip(String clipId) {
        List<String> paths = entityManager
                .createNativeQuery("SELECT storage_path FROM thumbnails WHERE clip_id = :clipId")
                .setParameter("clipId", clipId).getResultList();
        List<String> messageIds = entityManager.createNativeQuery("SELECT message_id FROM clips WHERE id = :clipId")
                .setParameter("clipId", clipId).getResultList();
        for (String table : List.of("thumbnails", "failed_thumbnails", "clip_favorites")) {
            entityManager.createNativeQuery("DELETE FROM " + table + " WHERE clip_id = :clipId")
                    .setParameter("clipId", clipId).executeUpdate();
        }
        entityManager.createNativeQuery("DELETE FROM clips WHERE id = :clipId").setParameter("clipId", clipId)
                .executeUpdate();
        for (String messageId : messageIds) {
            entityManager.createNativeQuery("""
                    DELETE FROM messages m WHERE m.id = :messageId
                      AND NOT EXISTS (SELECT 1 FROM clips c WHERE c.message_id = m.id)
                    """).setParameter("messageId", messageId).executeUpdate();
        }
        LOG.infof("Deleted clip %s (%d thumbnails)", clipId, paths.size());
        return paths;
    }

    @SuppressWarnings("unchecked")
    private List<String> thumbnailPaths(String scopeColumn, String scopeId) {
        return entityManager.createNativeQuery("SELECT t.storage_path FROM thumbnails t JOIN clips c ON c.id = t.clip_id"
                + " WHERE c." + scopeColumn + " = :scopeId").setParameter("scopeId", scopeId).getResultList();
    }

    private DeletedRows deleteScoped(String scopeColumn, String scopeId) {
        String clipScope = "(SELECT id FROM clips WHERE " + scopeColumn + " = :scopeId)";
        int thumbnails = execute("DELETE FROM thumbnails WHERE clip_id IN " + clipScope, scopeId);
        execute("DELETE FROM failed_thumbnails WHERE clip_id IN " + clipScope, scopeId);
        execute("DELETE FROM clip_favorites WHERE clip_id IN " + clipScope, scopeId);
        int clips = execute("DELETE FROM clips WHERE " + scopeColumn + " = :scopeId", scopeId);
        int messages = execute("DELETE FROM messages WHERE " + scopeColumn + " = :scopeId", scopeId);
        return new DeletedRows(messages, clips, thumbnails);
    }

    private int execute(String sql, String scopeId) {
        return entityManager.createNativeQuery(sql).setParameter("scopeId", scopeId).executeUpdate();
    }
}
