package villagecompute.clipindex.jobs;

import com.google.common.collect.Lists;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.clipindex.services.JobEnqueueService;
import villagecompute.clipindex.services.JobQueueService;
import villagecompute.clipindex.services.ThumbnailService;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Scheduler for thumbnail retries.
 *
 * <p>
 * Every 5 minutes it marks thumbnails stuck in PENDING or PROCESSING as failed, then enqueues
 * {@link JobType#THUMBNAIL_RETRY} jobs for failures whose {@code next_retry_at} has passed, grouped per guild in
 * batches of {@link ThumbnailRetryJobHandler#DEFAULT_RETRY_LIMIT}. Clips already referenced by a READY or CLAIMED retry
 * job are left out.
 *
 * @see ThumbnailRetryJobHandler for handler implementation
 */
@ApplicationScoped
public class ThumbnailRetryScheduler {

    private static final Logger LOG = Logger.getLogger(ThumbnailRetryScheduler.class);

    static final int MAX_DUE_PER_RUN = 200;

    @Inject
    ThumbnailService thumbnailService;

    @Inject
    JobEnqueueService jobEnqueueService;

    @Inject
    JobQueueService jobQueueService;

    @ConfigProperty(
            name = "clipindex.thumbnails.stale-after",
            defaultValue = "30m")
    Duration staleAfter;

    @Scheduled(
            every = "5m",
            identity = "thumbnail-retry")
    void scheduleRetries() {
        try {
            thumbnailService.markStale(staleAfter);
            Map<String, List<String>> due = thumbnailService.dueFailuresByGuild(MAX_DUE_PER_RUN);
            int jobs = 0;
            for (Map.Entry<String, List<String>> entry : due.entrySet()) {
                Set<String> pending = jobQueueService.pendingClipIds(JobType.THUMBNAIL_RETRY, entry.getKey());
                List<String> clipIds = entry.getValue().stream().filter(clipId -> !pending.contains(clipId))
                        .toList();
                for (List<String> batch : Lists.partition(clipIds, ThumbnailRetryJobHandler.DEFAULT_RETRY_LIMIT)) {
                    jobEnqueueService.requestThumbnailRetry(entry.getKey(), batch);
                    jobs++;
                }
            }
            if (jobs > 0) {
                LOG.infof("Enqueued %d thumbnail retry jobs for %d guilds", jobs, due.size());
            }
        } catch (Exception e) {
            LOG.errorf(e, "Thumbnail retry scheduler failed: %s", e.getMessage());
            // Swallow exception to prevent scheduler from being disabled
        }
    }
}
