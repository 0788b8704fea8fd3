package villagecompute.clipindex.jobs;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.clipindex.services.ThumbnailService;

import java.util.List;
import java.util.Map;

/**
 * Regenerates failed thumbnails whose retry time has come.
 *
 * <p>
 * <b>Payload:</b> {@code {"guild_id": "...", "clip_ids": [...]}}; without {@code clip_ids} up to
 * {@value #DEFAULT_RETRY_LIMIT} due failures are picked.
 */
@ApplicationScoped
public class ThumbnailRetryJobHandler implements JobHandler {

    private static final Logger LOG = Logger.getLogger(ThumbnailRetryJobHandler.class);

    static final int DEFAULT_RETRY_LIMIT = 10;

    @Inject
    ThumbnailService thumbnailService;

    @Override
    public JobType handlesType() {
        return JobType.THUMBNAIL_RETRY;
    }

    @Override
    public void execute(Long jobId, Map<String, Object> payload) {
        List<String> clipIds = JobPayload.of(payload).stringList(JobPayload.CLIP_IDS);
        int regenerated = thumbnailService.retryDue(clipIds, DEFAULT_RETRY_LIMIT);
        LOG.infof("Thumbnail retry job %d regenerated %d thumbnails", jobId, regenerated);
    }
}
