package villagecompute.clipindex.services;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.quarkus.narayana.jta.QuarkusTransaction;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import org.jboss.logging.Logger;
import villagecompute.clipindex.data.models.Clip;
import villagecompute.clipindex.data.models.FailedThumbnail;
import villagecompute.clipindex.data.models.Thumbnail;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Generates, stores and tracks clip thumbnails.
 *
 * <p>
 * <b>Lifecycle:</b> a clip is marked PROCESSING, both sizes are rendered and uploaded, then the thumbnail rows are
 * written and the clip becomes COMPLETED. Any failure marks the clip FAILED and schedules a retry in
 * {@code failed_thumbnails} following {@link #RETRY_BACKOFF_MINUTES}; once the schedule is exhausted the row keeps a
 * null {@code next_retry_at} and is never retried automatically.
 *
 * <p>
 * Rendering happens outside any transaction; each status change commits on its own.
 */
@ApplicationScoped
public class ThumbnailService {

    private static final Logger LOG = Logger.getLogger(ThumbnailService.class);

    static final int[] RETRY_BACKOFF_MINUTES = { 5, 15, 60, 240, 720, 1440 };

    @Inject
    ThumbnailGenerator thumbnailGenerator;

    @Inject
    StorageGateway storageGateway;

    @Inject
    EntityManager entityManager;

    @Inject
    MeterRegistry meterRegistry;

    /**
     * Renders thumbnails for the given clips.
     *
     * @return number of clips whose thumbnails were generated
     */
    public int generate(List<String> clipIds) {
        List<Clip> clips = QuarkusTransaction.requiringNew().call(() -> Clip.findByIds(clipIds));
        if (clips.size() < clipIds.size()) {
            LOG.infof("%d of %d clips no longer exist, skipping them", clipIds.size() - clips.size(),
                    clipIds.size());
        }
        int generated = 0;
        for (Clip clip : clips) {
            if (processClip(clip)) {
                generated++;
            }
        }
        return generated;
    }

    /**
     * Regenerates failed thumbnails that are due.
     *
     * @param clipIds
     *            restricts the retry to these clips; empty retries any due failure
     * @param limit
     *            maximum failures picked when {@code clipIds} is empty
     * @return number of clips whose thumbnails were generated
     */
    public int retryDue(List<String> clipIds, int limit) {
        Instant now = Instant.now();
        List<String> due = QuarkusTransaction.requiringNew().call(() -> {
            List<FailedThumbnail> failures = clipIds.isEmpty() ? FailedThumbnail.findDue(now, limit)
                    : FailedThumbnail.list("clipId IN ?1 AND nextRetryAt IS NOT NULL AND nextRetryAt <= ?2", clipIds,
                            now);
            return failures.stream().map(failure -> failure.clipId).toList();
        });
        if (due.isEmpty()) {
            LOG.debug("No failed thumbnails due for retry");
            return 0;
        }
        LOG.infof("Retrying %d failed thumbnails", due.size());
        return generate(due);
    }

    /**
     * Clip ids of failures due for retry, grouped by guild.
     */
    public Map<String, List<String>> dueFailuresByGuild(int limit) {
        Instant now = Instant.now();
        List<FailedThumbnail> due = QuarkusTransaction.requiringNew().call(() -> FailedThumbnail.findDue(now, limit));
        return due.stream().collect(Collectors.groupingBy(failure -> failure.guildId, LinkedHashMap::new,
                Collectors.mapping(failure -> failure.clipId, Collectors.toList())));
    }

    /**
     * Marks clips stuck in PENDING or PROCESSING for longer than {@code threshold} as FAILED and schedules them for
     * retry.
     *
     * @return number of clips marked failed
     */
    public int markStale(Duration threshold) {
        Instant now = Instant.now();
        Instant cutoff = now.minus(threshold);
        return QuarkusTransaction.requiringNew().call(() -> {
            entityManager.createNativeQuery("""
                    INSERT INTO failed_thumbnails (clip_id, guild_id, retry_count, next_retry_at, last_error, updated_at)
                    SELECT id, guild_id, 0, :now, 'Thumbnail generation stalled', :now FROM clips
                    WHERE thumbnail_status IN ('PENDING', 'PROCESSING') AND updated_at < :cutoff
                    ON CONFLICT (clip_id) DO NOTHING
                    """).setParameter("now", now).setParameter("cutoff", cutoff).executeUpdate();
            int stale = entityManager.createNativeQuery("""
                    UPDATE clips SET thumbnail_status = 'FAILED', updated_at = :now
                    WHERE thumbnail_status IN ('PENDING', 'PROCESSING') AND updated_at < :cutoff
                    """).setParameter("now", now).setParameter("cutoff", cutoff).executeUpdate();
            if (stale > 0) {
                LOG.warnf("Marked %d stalled thumbnails as failed", stale);
            }
            return stale;
        });
    }

    /**
     * When the next attempt after failure number {@code retryCount} (1-based) is due, or null when retries are
     * exhausted.
     */
    public static Instant nextRetryAt(int retryCount, Instant now) {
        if (retryCount < 1 || retryCount > RETRY_BACKOFF_MINUTES.length) {
            return null;
        }
        return now.plus(Duration.ofMinutes(RETRY_BACKOFF_MINUTES[retryCount - 1]));
    }

    private boolean processClip(Clip clip) {
        updateStatus(clip.id, Clip.ThumbnailStatus.PROCESSING);
        try {
            Map<Thumbnail.SizeType, byte[]> images = thumbnailGenerator.generate(clip.cdnUrl);
            for (Map.Entry<Thumbnail.SizeType, byte[]> image : images.entrySet()) {
                storageGateway.upload(Thumbnail.storagePath(clip.guildId, clip.id, image.getKey()), image.getValue(),
                        "image/webp");
            }
            QuarkusTransaction.requiringNew().run(() -> saveThumbnails(clip));
            Counter.builder("clipindex.thumbnails.total").tag("status", "success").register(meterRegistry)
                    .increment();
            LOG.debugf("Generated thumbnails for clip %s", clip.id);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            recordFailure(clip, e);
            return false;
        } catch (Exception e) {
            recordFailure(clip, e);
            return false;
        }
    }

    private void saveThumbnails(Clip clip) {
        Instant now = Instant.now();
        for (Thumbnail.SizeType size : Thumbnail.SizeType.values()) {
            Thumbnail thumbnail = Thumbnail.find("clipId = ?1 AND sizeType = ?2", clip.id, size).firstResult();
            if (thumbnail == null) {
                thumbnail = new Thumbnail();
                thumbnail.clipId = clip.id;
                thumbnail.sizeType = size;
                thumbnail.createdAt = now;
            }
            thumbnail.storagePath = Thumbnail.storagePath(clip.guildId, clip.id, size);
            thumbnail.width = size.getWidth();
            thumbnail.height = size.getHeight();
            thumbnail.persist();
        }
        Clip.update("thumbnailStatus = ?1, updatedAt = ?2 WHERE id = ?3", Clip.ThumbnailStatus.COMPLETED, now,
                clip.id);
        FailedThumbnail.deleteById(clip.id);
    }

    private void recordFailure(Clip clip, Exception cause) {
        Counter.builder("clipindex.thumbnails.total").tag("status", "failure").register(meterRegistry).increment();
        QuarkusTransaction.requiringNew().run(() -> {
            Instant now = Instant.now();
            Clip.update("thumbnailStatus = ?1, updatedAt = ?2 WHERE id = ?3", Clip.ThumbnailStatus.FAILED, now,
                    clip.id);
            FailedThumbnail failure = FailedThumbnail.findById(clip.id);
            if (failure == null) {
                failure = new FailedThumbnail();
                failure.clipId = clip.id;
                failure.guildId = clip.guildId;
                failure.retryCount = 0;
            }
            failure.retryCount++;
            failure.nextRetryAt = nextRetryAt(failure.retryCount, now);
            failure.lastError = cause.getMessage();
            failure.updatedAt = now;
            failure.persist();
            if (failure.nextRetryAt == null) {
                LOG.errorf(cause, "Thumbnail generation for clip %s failed %d times, giving up", clip.id,
                        failure.retryCount);
            } else {
                LOG.warnf("Thumbnail generation for clip %s failed (attempt %d), next retry at %s: %s", clip.id,
                        failure.retryCount, failure.nextRetryAt, cause.getMessage());
            }
        });
    }

    private void updateStatus(String clipId, Clip.ThumbnailStatus status) {
        QuarkusTransaction.requiringNew().run(() -> Clip.update("thumbnailStatus = ?1, updatedAt = ?2 WHERE id = ?3",
                status, Instant.now(), clipId));
    }
}
