package villagecompute.clipindex.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import villagecompute.clipindex.data.models.Clip;
import villagecompute.clipindex.exceptions.ResourceNotFoundException;
import villagecompute.clipindex.exceptions.ValidationException;

import java.time.Instant;

/**
 * Adds and removes clip favorites.
 *
 * <p>
 * Archived clips cannot be favorited. The rule lives in the insert itself ({@code WHERE archived = false}), so a clip
 * archived concurrently can never gain a favorite. Favorites that existed before archiving are kept.
 */
@ApplicationScoped
public class FavoriteService {

    private static final Logger LOG = Logger.getLogger(FavoriteService.class);

    @Inject
    EntityManager entityManager;

    /**
     * Favorites a clip for a user. Favoriting twice is a no-op.
     *
     * @return true when a new favorite was stored
     * @throws ResourceNotFoundException
     *             if the clip does not exist
     * @throws ValidationException
     *             if the clip is archived
     */
    @Transactional
    public boolean addFavorite(String userId, String clipId) {
        int inserted = entityManager.createNativeQuery("""
                INSERT INTO clip_favorites (user_id, clip_id, created_at)
                SELECT :userId, c.id, :now FROM clips c WHERE c.id = :clipId AND c.archived = false
                ON CONFLICT (user_id, clip_id) DO NOTHING
                """).setParameter("userId", userId).setParameter("now", Instant.now())
                .setParameter("clipId", clipId).executeUpdate();
        if (inserted == 1) {
            LOG.debugf("User %s favorited clip %s", userId, clipId);
            return true;
        }

        Clip clip = Clip.findById(clipId);
        if (clip == null) {
            throw new ResourceNotFoundException("Clip not found: " + clipId);
        }
        if (clip.archived) {
            throw new ValidationException("Archived clips cannot be favorited");
        }
        return false;
    }

    /**
     * @return true when a favorite was removed
     */
    @Transactional
    public boolean removeFavorite(String userId, String clipId) {
        return entityManager.createNativeQuery("DELETE FROM clip_favorites WHERE user_id = :userId AND clip_id = :clipId")
                .setParameter("userId", userId).setParameter("clipId", clipId).executeUpdate() == 1;
    }
}
