package villagecompute.clipindex.observability;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.context.Initialized;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.clipindex.jobs.JobDispatcher;
import villagecompute.clipindex.jobs.JobQueue;
import villagecompute.clipindex.services.JobQueueService;
import villagecompute.clipindex.services.JobQueueService.QueueStats;
import villagecompute.clipindex.services.ScanState;
import villagecompute.clipindex.services.ScanStateService;
import villagecompute.clipindex.services.SettingsResolver;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Registers the gauges of the clip indexer.
 *
 * <p>
 * <b>Metrics Catalog:</b>
 * <ul>
 * <li>{@code clipindex_jobs_depth{status}} - job queue entries per delivery status (ready, claimed, dead_letter)</li>
 * <li>{@code clipindex_worker_permits_available{queue}} - free worker permits, and free BULK permits</li>
 * <li>{@code clipindex_scans{status}} - channel scan rows per state</li>
 * <li>{@code clipindex_settings_cache_size} - entries in the effective settings cache</li>
 * </ul>
 *
 * <p>
 * Database-backed values are sampled by {@link #refreshSnapshots()} and cached, so a metrics scrape never opens a
 * transaction. Counters and timers are registered by the services that own them ({@code clipindex.jobs.*},
 * {@code clipindex.bulk.*}, {@code clipindex.purge.*}, {@code clipindex.thumbnails.*}).
 *
 * @see LoggingConfig for structured logging field definitions
 */
@ApplicationScoped
public class ObservabilityMetrics {

    private static final Logger LOG = Logger.getLogger(ObservabilityMetrics.class);

    @Inject
    MeterRegistry registry;

    @Inject
    JobQueueService jobQueueService;

    @Inject
    ScanStateService scanStateService;

    @Inject
    JobDispatcher jobDispatcher;

    @Inject
    SettingsResolver settingsResolver;

    private final AtomicReference<QueueStats> queueStats = new AtomicReference<>(new QueueStats(0, 0, 0));

    private final AtomicReference<Map<ScanState, Long>> scanStats = new AtomicReference<>(
            new EnumMap<>(ScanState.class));

    public void registerMetrics(@Observes @Initialized(ApplicationScoped.class) Object init) {
        LOG.info("Registering observability metrics");

        Gauge.builder("clipindex_jobs_depth", this, m -> queueStats.get().ready())
                .description("Job queue entries waiting to be claimed").tags(List.of(Tag.of("status", "ready")))
                .register(registry);
        Gauge.builder("clipindex_jobs_depth", this, m -> queueStats.get().claimed())
                .description("Job queue entries held by a worker").tags(List.of(Tag.of("status", "claimed")))
                .register(registry);
        Gauge.builder("clipindex_jobs_depth", this, m -> queueStats.get().deadLetter())
                .description("Dead-lettered job queue entries kept for inspection")
                .tags(List.of(Tag.of("status", "dead_letter"))).register(registry);

        Gauge.builder("clipindex_worker_permits_available", jobDispatcher, JobDispatcher::getAvailableWorkerPermits)
                .description("Free worker permits in this process").tags(List.of(Tag.of("queue", "all")))
                .register(registry);
        Gauge.builder("clipindex_worker_permits_available", jobDispatcher, JobDispatcher::getAvailableBulkPermits)
                .description("Free permits for thumbnail generation")
                .tags(List.of(Tag.of("queue", JobQueue.BULK.name()))).register(registry);

        for (ScanState state : ScanState.values()) {
            Gauge.builder("clipindex_scans", this, m -> scanStats.get().getOrDefault(state, 0L))
                    .description("Channel scan rows in state " + state.name())
                    .tags(List.of(Tag.of("status", state.name()))).register(registry);
        }

        Gauge.builder("clipindex_settings_cache_size", settingsResolver, SettingsResolver::size)
                .description("Entries in the effective settings cache").register(registry);

        LOG.infof("Observability metrics registration complete. Access metrics at /q/metrics");
    }

    @Scheduled(
            every = "${clipindex.metrics.refresh-interval:30s}",
            identity = "metrics-snapshot")
    void refreshSnapshots() {
        try {
            queueStats.set(jobQueueService.stats());
            scanStats.set(scanStateService.healthStats());
        } catch (Exception e) {
            LOG.warnf("Metric snapshot refresh failed: %s", e.getMessage());
            // Keep the previous snapshot
        }
    }
}
