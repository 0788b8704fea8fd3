package villagecompute.clipindex.jobs;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.scheduler.Scheduled;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.clipindex.data.models.QueuedJob;
import villagecompute.clipindex.exceptions.MessageDeletedException;
import villagecompute.clipindex.exceptions.RateLimitException;
import villagecompute.clipindex.exceptions.ValidationException;
import villagecompute.clipindex.observability.LoggingConfig;
import villagecompute.clipindex.services.JobQueueService;
import villagecompute.clipindex.services.ScanCancellationRegistry;
import villagecompute.clipindex.services.ScanStateService;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.function.DoubleSupplier;

/**
 * Worker pool that claims jobs from {@link JobQueueService} and routes them to their {@link JobHandler}.
 *
 * <p>
 * Each poll claims as many jobs as there are free worker permits (default 8 per process). Jobs of the BULK family
 * additionally hold one of the bulk permits (default 2); while those are exhausted the poll skips the BULK family and
 * leaves its jobs READY for the next cycle.
 *
 * <p>
 * <b>Outcome classification:</b>
 * <ul>
 * <li>handler returns: ack</li>
 * <li>{@link MessageDeletedException}: ack, the source data is gone and nothing is left to retry</li>
 * <li>{@link ValidationException}, unknown job type: dead-letter; a scan job also marks its channel FAILED</li>
 * <li>anything else: nack with {@code 2^attempt * base * jitter[0.75, 1.25]} until {@code max-attempts} deliveries,
 * then dead-letter</li>
 * </ul>
 *
 * <p>
 * <b>Shutdown:</b> claiming stops, running scans are told to stop at their next checkpoint, and in-flight jobs get
 * {@code shutdown-timeout} to finish. Jobs still running after that stay CLAIMED and are redelivered once the
 * visibility window passes.
 *
 * @see JobHandler for handler contract
 * @see JobQueue for queue family descriptions
 */
@ApplicationScoped
public class JobDispatcher {

    private static final Logger LOG = Logger.getLogger(JobDispatcher.class);

    /**
     * Result of dispatching one claimed job.
     */
    public enum DispatchOutcome {
        ACKED, RETRIED, DEAD_LETTERED
    }

    @Inject
    JobQueueService jobQueueService;

    @Inject
    ScanStateService scanStateService;

    @Inject
    ScanCancellationRegistry cancellationRegistry;

    @Inject
    Tracer tracer;

    @Inject
    MeterRegistry meterRegistry;

    @ConfigProperty(
            name = "clipindex.jobs.worker-concurrency",
            defaultValue = "8")
    int workerConcurrency;

    @ConfigProperty(
            name = "clipindex.jobs.bulk-concurrency",
            defaultValue = "2")
    int bulkConcurrency;

    @ConfigProperty(
            name = "clipindex.jobs.max-attempts",
            defaultValue = "5")
    int maxAttempts;

    @ConfigProperty(
            name = "clipindex.jobs.retry-base-delay",
            defaultValue = "30s")
    Duration retryBaseDelay;

    @ConfigProperty(
            name = "clipindex.jobs.claim-block",
            defaultValue = "2s")
    Duration claimBlock;

    @ConfigProperty(
            name = "clipindex.jobs.shutdown-timeout",
            defaultValue = "30s")
    Duration shutdownTimeout;

    DoubleSupplier jitterSource = Math::random;

    private final Map<JobType, JobHandler> handlerRegistry;

    private final String consumerId;

    private Semaphore workerPermits;
    private Semaphore bulkPermits;
    private ExecutorService executor;
    private volatile boolean accepting = true;

    @Inject
    public JobDispatcher(Instance<JobHandler> handlers) {
        this.handlerRegistry = buildHandlerRegistry(handlers);
        this.consumerId = "worker_" + hostname();
        LOG.infof("Initialized JobDispatcher %s with %d registered handlers", consumerId, handlerRegistry.size());
    }

    @PostConstruct
    void init() {
        workerPermits = new Semaphore(workerConcurrency);
        bulkPermits = new Semaphore(bulkConcurrency);
        executor = Executors.newFixedThreadPool(workerConcurrency,
                new ThreadFactoryBuilder().setNameFormat("clip-worker-%d").setDaemon(true).build());
    }

    /**
     * Discovers all CDI-managed {@link JobHandler} beans and builds a type to handler map.
     *
     * @throws IllegalStateException
     *             if two handlers register for the same JobType
     */
    private static Map<JobType, JobHandler> buildHandlerRegistry(Iterable<JobHandler> handlers) {
        Map<JobType, JobHandler> registry = new EnumMap<>(JobType.class);
        for (JobHandler handler : handlers) {
            JobType type = handler.handlesType();
            if (registry.containsKey(type)) {
                throw new IllegalStateException("Duplicate handlers registered for JobType." + type + ": "
                        + registry.get(type).getClass().getName() + " and " + handler.getClass().getName());
            }
            registry.put(type, handler);
            LOG.debugf("Registered handler %s for JobType.%s (queue: %s)", handler.getClass().getSimpleName(), type,
                    type.getQueue());
        }
        for (JobType type : JobType.values()) {
            if (!registry.containsKey(type)) {
                LOG.warnf("No handler registered for JobType.%s; its jobs will be dead-lettered", type);
            }
        }
        return registry;
    }

    @Scheduled(
            every = "${clipindex.jobs.poll-interval:1s}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void poll() {
        if (!accepting) {
            return;
        }
        int free = workerPermits.availablePermits();
        if (free == 0) {
            return;
        }
        int maxQueuePriority = bulkPermits.availablePermits() > 0 ? Integer.MAX_VALUE
                : JobQueue.DEFAULT.getPriority();
        List<QueuedJob> jobs;
        try {
            jobs = jobQueueService.claim(consumerId, free, claimBlock, maxQueuePriority);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Job poll interrupted");
            return;
        }
        for (QueuedJob job : jobs) {
            submit(job);
        }
    }

    /**
     * Hands a claimed job to the worker pool, or back to the queue when no permit is free.
     */
    void submit(QueuedJob job) {
        boolean bulk = isBulk(job);
        if (!workerPermits.tryAcquire()) {
            jobQueueService.release(job.id, consumerId);
            return;
        }
        if (bulk && !bulkPermits.tryAcquire()) {
            workerPermits.release();
            LOG.debugf("No bulk permit for job %d, releasing", job.id);
            jobQueueService.release(job.id, consumerId);
            return;
        }
        try {
            executor.execute(() -> {
                try {
                    dispatch(job);
                } finally {
                    releasePermits(bulk);
                }
            });
        } catch (RejectedExecutionException e) {
            releasePermits(bulk);
            LOG.warnf("Worker pool rejected job %d, releasing it: %s", job.id, e.getMessage());
            jobQueueService.release(job.id, consumerId);
        }
    }

    private void releasePermits(boolean bulk) {
        if (bulk) {
            bulkPermits.release();
        }
        workerPermits.release();
    }

    private static boolean isBulk(QueuedJob job) {
        return JobType.fromWireName(job.jobType).map(type -> type.getQueue() == JobQueue.BULK).orElse(false);
    }

    /**
     * Runs one claimed job through its handler and settles it in the queue.
     */
    DispatchOutcome dispatch(QueuedJob job) {
        Optional<JobType> resolved = JobType.fromWireName(job.jobType);
        if (resolved.isEmpty()) {
            return deadLetter(job, null, "Unknown job type: " + job.jobType);
        }
        JobType jobType = resolved.get();
        JobHandler handler = handlerRegistry.get(jobType);
        if (handler == null) {
            return deadLetter(job, jobType, "No handler registered for JobType." + jobType);
        }

        Span span = tracer.spanBuilder("job.execute").setAttribute("job.id", job.id)
                .setAttribute("job.type", jobType.getWireName()).setAttribute("job.queue", jobType.getQueue().name())
                .setAttribute("job.attempt", job.deliveryCount).startSpan();
        Timer.Sample sample = Timer.start(meterRegistry);

        try (Scope scope = span.makeCurrent()) {
            LoggingConfig.enrichWithTraceContext();
            LoggingConfig.setJob(job.id, jobType.getWireName(), job.guildId, job.channelId);

            handler.execute(job.id, job.payload);
            jobQueueService.ack(job.id, consumerId);
            span.addEvent("job.completed");
            LOG.infof("Job %d (type: %s) completed on attempt %d", job.id, jobType, job.deliveryCount);
            return record(jobType, DispatchOutcome.ACKED);

        } catch (MessageDeletedException e) {
            span.addEvent("job.source_deleted");
            LOG.infof("Job %d (type: %s) source message deleted, acknowledging: %s", job.id, jobType,
                    e.getMessage());
            jobQueueService.ack(job.id, consumerId);
            return record(jobType, DispatchOutcome.ACKED);

        } catch (ValidationException e) {
            span.recordException(e);
            span.addEvent("job.invalid");
            LOG.errorf("Job %d (type: %s) rejected: %s", job.id, jobType, e.getMessage());
            return deadLetter(job, jobType, describe(e));

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            span.recordException(e);
            span.addEvent("job.interrupted");
            LOG.warnf(e, "Job %d (type: %s) interrupted during execution", job.id, jobType);
            return retry(job, jobType, e);

        } catch (Exception e) {
            span.recordException(e);
            span.addEvent("job.failed");
            LOG.errorf(e, "Job %d (type: %s) failed on attempt %d", job.id, jobType, job.deliveryCount);
            return retry(job, jobType, e);

        } finally {
            sample.stop(Timer.builder("clipindex.jobs.duration").tag("type", jobType.getWireName())
                    .register(meterRegistry));
            span.end();
            LoggingConfig.clearMDC();
        }
    }

    private DispatchOutcome retry(QueuedJob job, JobType jobType, Exception e) {
        if (job.deliveryCount >= maxAttempts) {
            return deadLetter(job, jobType, "Exhausted " + maxAttempts + " attempts: " + describe(e));
        }
        Duration delay = calculateBackoffDelay(job.deliveryCount);
        if (e instanceof RateLimitException rateLimit && rateLimit.getRetryAfter() != null
                && rateLimit.getRetryAfter().compareTo(delay) > 0) {
            delay = rateLimit.getRetryAfter();
        }
        jobQueueService.nack(job.id, consumerId, delay, describe(e));
        LOG.infof("Job %d (type: %s) scheduled for retry in %ds", job.id, jobType, delay.toSeconds());
        return record(jobType, DispatchOutcome.RETRIED);
    }

    private DispatchOutcome deadLetter(QueuedJob job, JobType jobType, String reason) {
        jobQueueService.deadLetter(job.id, reason);
        if (jobType == JobType.SCAN && job.channelId != null) {
            scanStateService.fail(job.channelId, reason);
        }
        LOG.errorf("Job %d (type: %s) dead-lettered: %s", job.id, job.jobType, reason);
        return record(jobType, DispatchOutcome.DEAD_LETTERED);
    }

    private DispatchOutcome record(JobType jobType, DispatchOutcome outcome) {
        Counter.builder("clipindex.jobs.processed.total")
                .tag("type", jobType == null ? "unknown" : jobType.getWireName())
                .tag("outcome", outcome.name().toLowerCase()).register(meterRegistry).increment();
        return outcome;
    }

    /**
     * Calculates the next retry delay using exponential backoff with jitter.
     *
     * <p>
     * <b>Formula:</b> {@code delay = (2^attempt) * retry-base-delay * [0.75, 1.25]}
     *
     * @param attempt
     *            deliveries so far (1-indexed)
     */
    public Duration calculateBackoffDelay(int attempt) {
        double baseDelay = Math.pow(2, attempt) * retryBaseDelay.toMillis();
        double jitter = 0.75 + (jitterSource.getAsDouble() * 0.5);
        return Duration.ofMillis((long) (baseDelay * jitter));
    }

    void onShutdown(@Observes ShutdownEvent event) {
        accepting = false;
        cancellationRegistry.requestShutdown();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.warnf("Jobs still running after %ds; they will be redelivered", shutdownTimeout.toSeconds());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for running jobs");
        }
        LOG.infof("JobDispatcher %s stopped", consumerId);
    }

    public String getConsumerId() {
        return consumerId;
    }

    public int getAvailableWorkerPermits() {
        return workerPermits.availablePermits();
    }

    public int getAvailableBulkPermits() {
        return bulkPermits.availablePermits();
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private static String hostname() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            LOG.warnf("Could not resolve hostname, using 'localhost': %s", e.getMessage());
            return "localhost";
        }
    }
}
