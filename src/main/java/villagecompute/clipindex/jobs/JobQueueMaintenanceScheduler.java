package villagecompute.clipindex.jobs;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.clipindex.services.JobQueueService;
import villagecompute.clipindex.services.JobQueueService.TrimResult;
import villagecompute.clipindex.services.ScanCancellationRegistry;

/**
 * Applies queue retention and drops expired cancellation flags.
 *
 * @see JobQueueService#trim()
 */
@ApplicationScoped
public class JobQueueMaintenanceScheduler {

    private static final Logger LOG = Logger.getLogger(JobQueueMaintenanceScheduler.class);

    @Inject
    JobQueueService jobQueueService;

    @Inject
    ScanCancellationRegistry cancellationRegistry;

    @Scheduled(
            every = "${clipindex.jobs.trim-interval:10m}",
            identity = "job-queue-trim")
    void trimQueue() {
        try {
            TrimResult result = jobQueueService.trim();
            LOG.debugf("Queue trim removed %d entries (%d streams over max length)", result.trimmed(),
                    result.overflowingStreams());
        } catch (Exception e) {
            LOG.errorf(e, "Queue trim failed: %s", e.getMessage());
            // Swallow exception to prevent scheduler from being disabled
        }
    }

    @Scheduled(
            every = "15m",
            identity = "scan-cancellation-evict")
    void evictCancellationFlags() {
        cancellationRegistry.evictExpired();
    }
}
