package villagecompute.clipindex.jobs;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.clipindex.services.CdnRefreshService;
import villagecompute.clipindex.services.JobEnqueueService;
import villagecompute.clipindex.services.JobQueueService;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Enqueues {@link JobType#CDN_REFRESH} jobs for clips whose attachment URL expires within
 * {@code clipindex.cdn.refresh-window} (1 hour by default). Clips still waiting in a READY or CLAIMED refresh job
 * are skipped, so a backlog is not multiplied every tick.
 *
 * @see CdnRefreshJobHandler for handler implementation
 */
@ApplicationScoped
public class CdnRefreshScheduler {

    private static final Logger LOG = Logger.getLogger(CdnRefreshScheduler.class);

    @Inject
    CdnRefreshService cdnRefreshService;

    @Inject
    JobEnqueueService jobEnqueueService;

    @Inject
    JobQueueService jobQueueService;

    @ConfigProperty(
            name = "clipindex.cdn.refresh-window",
            defaultValue = "1h")
    Duration refreshWindow;

    @ConfigProperty(
            name = "clipindex.cdn.max-per-run",
            defaultValue = "500")
    int maxPerRun;

    @Scheduled(
            every = "${clipindex.cdn.refresh-interval:15m}",
            identity = "cdn-refresh")
    void scheduleRefresh() {
        try {
            Map<String, List<String>> expiring = cdnRefreshService.findExpiring(refreshWindow, maxPerRun);
            int jobs = 0;
            int skipped = 0;
            for (Map.Entry<String, List<String>> entry : expiring.entrySet()) {
                List<String> clipIds = withoutPending(entry.getKey(), entry.getValue());
                skipped += entry.getValue().size() - clipIds.size();
                if (!clipIds.isEmpty()) {
                    jobs += jobEnqueueService.requestCdnRefresh(entry.getKey(), clipIds).size();
                }
            }
            if (jobs > 0 || skipped > 0) {
                LOG.infof("Enqueued %d CDN refresh jobs for %d guilds, %d clips already queued", jobs,
                        expiring.size(), skipped);
            }
        } catch (Exception e) {
            LOG.errorf(e, "CDN refresh scheduler failed: %s", e.getMessage());
            // Swallow exception to prevent scheduler from being disabled
        }
    }

    private List<String> withoutPending(String guildId, List<String> clipIds) {
        Set<String> pending = jobQueueService.pendingClipIds(JobType.CDN_REFRESH, guildId);
        return clipIds.stream().filter(clipId -> !pending.contains(clipId)).toList();
    }
}
