package villagecompute.clipindex.services;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.quarkus.narayana.jta.QuarkusTransaction;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import jakarta.transaction.Transactional;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.clipindex.data.models.QueuedJob;
import villagecompute.clipindex.data.models.QueuedJob.DeliveryStatus;
import villagecompute.clipindex.jobs.JobType;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Database-backed durable job log with a consumer-group style claim protocol.
 *
 * <p>
 * <b>Streams:</b> every job belongs to the stream {@code jobs:guild:{guildId}:{jobType}}. Rows are ordered by their
 * sequence id. Claims take the oldest entries of every stream first (round-robin by stream position), so a large
 * backlog in one guild never starves another guild.
 *
 * <p>
 * <b>Claim protocol:</b>
 * <ol>
 * <li>Candidates are READY jobs whose {@code available_at} has passed, plus CLAIMED jobs idle longer than the
 * visibility timeout (their consumer is assumed dead). Stale jobs are taken before new ones.</li>
 * <li>Candidates are locked with {@code FOR UPDATE SKIP LOCKED}; jobs locked by a concurrent claimer are skipped.</li>
 * <li>Locked jobs are marked CLAIMED by the consumer and their delivery count incremented.</li>
 * </ol>
 *
 * <p>
 * <b>Outcomes:</b> {@link #ack} marks a job ACKED, {@link #nack} returns it to READY after a delay, and
 * {@link #deadLetter} acknowledges it without success.
 *
 * <p>
 * <b>Retention:</b> {@link #trim()} deletes only acknowledged entries (beyond {@code max-length} per stream, or older
 * than the retention age). Unacknowledged entries are never dropped; a stream whose backlog exceeds the max length is
 * reported as an error instead.
 *
 * @see QueuedJob for the schema
 * @see villagecompute.clipindex.jobs.JobDispatcher for the consumer side
 */
@ApplicationScoped
public class JobQueueService {

    private static final Logger LOG = Logger.getLogger(JobQueueService.class);

    /**
     * Delay between empty polls while a claim call is blocking.
     */
    private static final long POLL_INTERVAL_MS = 250;

    /**
     * Extra candidates read per claim to make up for rows skipped because another consumer holds their lock.
     */
    private static final int CANDIDATE_OVERSAMPLE = 4;

    @Inject
    EntityManager entityManager;

    @Inject
    MeterRegistry meterRegistry;

    @ConfigProperty(
            name = "clipindex.jobs.visibility-timeout",
            defaultValue = "60s")
    Duration visibilityTimeout;

    @ConfigProperty(
            name = "clipindex.jobs.stream-max-length",
            defaultValue = "10000")
    int streamMaxLength;

    @ConfigProperty(
            name = "clipindex.jobs.acked-retention",
            defaultValue = "24h")
    Duration ackedRetention;

    @ConfigProperty(
            name = "clipindex.jobs.dead-letter-retention",
            defaultValue = "168h")
    Duration deadLetterRetention;

    /**
     * Snapshot of job counts by delivery status.
     */
    public record QueueStats(long ready, long claimed, long deadLetter) {
    }

    /**
     * Result of a retention pass.
     */
    public record TrimResult(int trimmed, int overflowingStreams) {
    }

    /**
     * Appends a job to the stream of its guild and type.
     *
     * @param type
     *            job type
     * @param guildId
     *            target guild
     * @param channelId
     *            target channel, null for guild-wide jobs
     * @param payload
     *            job parameters; {@code type}, {@code guild_id}, {@code channel_id} and {@code created_at} are added
     * @return the job id
     */
    @Transactional
    public Long enqueue(JobType type, String guildId, String channelId, Map<String, Object> payload) {
        if (guildId == null || guildId.isBlank()) {
            throw new IllegalArgumentException("guildId is required to enqueue a " + type.getWireName() + " job");
        }
        Instant now = Instant.now();

        Map<String, Object> body = new LinkedHashMap<>(payload == null ? Map.of() : payload);
        body.put("type", type.getWireName());
        body.put("guild_id", guildId);
        if (channelId != null) {
            body.put("channel_id", channelId);
        }
        body.put("created_at", now.toString());

        QueuedJob job = new QueuedJob();
        job.streamKey = QueuedJob.streamKey(guildId, type);
        job.jobType = type.getWireName();
        job.queuePriority = type.getQueue().getPriority();
        job.guildId = guildId;
        job.channelId = channelId;
        job.payload = body;
        job.status = DeliveryStatus.READY;
        job.deliveryCount = 0;
        job.availableAt = now;
        job.createdAt = now;
        job.persist();

        Counter.builder("clipindex.jobs.enqueued.total").tag("type", type.getWireName()).register(meterRegistry)
                .increment();
        LOG.infof("Enqueued job %d on %s", job.id, job.streamKey);
        return job.id;
    }

    /**
     * Claims up to {@code count} jobs for a consumer, waiting up to {@code block} for work to appear.
     *
     * @param consumerId
     *            identifier of the claiming worker
     * @param count
     *            maximum number of jobs to claim
     * @param block
     *            maximum time to wait when nothing is claimable; zero returns immediately
     * @return claimed jobs, possibly empty
     * @throws InterruptedException
     *             if the calling thread is interrupted while waiting
     */
    public List<QueuedJob> claim(String consumerId, int count, Duration block) throws InterruptedException {
        return claim(consumerId, count, block, Integer.MAX_VALUE);
    }

    /**
     * Claims like {@link #claim(String, int, Duration)}, restricted to queue families with a priority value up to
     * {@code maxQueuePriority}. Used to skip the BULK family while its workers are saturated.
     */
    public List<QueuedJob> claim(String consumerId, int count, Duration block, int maxQueuePriority)
            throws InterruptedException {
        if (count <= 0) {
            return List.of();
        }
        long deadline = System.currentTimeMillis() + block.toMillis();
        while (true) {
            List<QueuedJob> claimed = QuarkusTransaction.requiringNew()
                    .call(() -> claimBatch(consumerId, count, maxQueuePriority));
            if (!claimed.isEmpty()) {
                return claimed;
            }
            long remaining = deadline - System.currentTimeMillis();
            if (remaining <= 0) {
                return List.of();
            }
            Thread.sleep(Math.min(POLL_INTERVAL_MS, remaining));
        }
    }

    /**
     * Single claim round-trip. Must run inside a transaction so the row locks are held until the claim commits.
     */
    List<QueuedJob> claimBatch(String consumerId, int count, int maxQueuePriority) {
        Instant now = Instant.now();
        Instant staleBefore = now.minus(visibilityTimeout);

        @SuppressWarnings("unchecked")
        List<Number> candidateIds = entityManager.createNativeQuery("""
                SELECT id FROM (
                  SELECT id, queue_priority,
                         ROW_NUMBER() OVER (PARTITION BY stream_key ORDER BY id) AS stream_position,
                         CASE WHEN status = 'CLAIMED' THEN 0 ELSE 1 END AS reclaim_rank
                  FROM job_queue
                  WHERE queue_priority <= :maxPriority
                    AND ((status = 'READY' AND available_at <= :now)
                         OR (status = 'CLAIMED' AND claimed_at < :staleBefore))
                ) candidates
                ORDER BY reclaim_rank, queue_priority, stream_position, id
                LIMIT :limit
                """).setParameter("maxPriority", maxQueuePriority).setParameter("now", now)
                .setParameter("staleBefore", staleBefore).setParameter("limit", count * CANDIDATE_OVERSAMPLE)
                .getResultList();

        if (candidateIds.isEmpty()) {
            return List.of();
        }

        List<Long> ids = candidateIds.stream().map(Number::longValue).toList();
        Map<Long, Integer> rank = new HashMap<>();
        for (int i = 0; i < ids.size(); i++) {
            rank.put(ids.get(i), i);
        }

        @SuppressWarnings("unchecked")
        List<QueuedJob> locked = entityManager.createNativeQuery("""
                SELECT * FROM job_queue
                WHERE id IN (:ids)
                  AND ((status = 'READY' AND available_at <= :now)
                       OR (status = 'CLAIMED' AND claimed_at < :staleBefore))
                FOR UPDATE SKIP LOCKED
                """, QueuedJob.class).setParameter("ids", ids).setParameter("now", now)
                .setParameter("staleBefore", staleBefore).getResultList();

        List<QueuedJob> claimed = new ArrayList<>(locked);
        claimed.sort(Comparator.comparingInt(job -> rank.getOrDefault(job.id, Integer.MAX_VALUE)));
        if (claimed.size() > count) {
            claimed = new ArrayList<>(claimed.subList(0, count));
        }

        for (QueuedJob job : claimed) {
            if (job.status == DeliveryStatus.CLAIMED) {
                LOG.warnf("Reclaiming job %d from consumer %s (claimed at %s, visibility timeout %s)", job.id,
                        job.claimedBy, job.claimedAt, visibilityTimeout);
                Counter.builder("clipindex.jobs.reclaimed.total").tag("type", job.jobType).register(meterRegistry)
                        .increment();
            }
            job.status = DeliveryStatus.CLAIMED;
            job.claimedBy = consumerId;
            job.claimedAt = now;
            job.deliveryCount++;
        }

        if (!claimed.isEmpty()) {
            LOG.debugf("Consumer %s claimed %d jobs", consumerId, claimed.size());
        }
        return claimed;
    }

    /**
     * Hands a claimed job back untouched: READY immediately, with the delivery it was claimed with not counted.
     */
    @Transactional
    public boolean release(Long jobId, String consumerId) {
        int updated = entityManager.createNativeQuery("""
                UPDATE job_queue
                SET status = 'READY', claimed_by = NULL, claimed_at = NULL,
                    delivery_count = GREATEST(delivery_count - 1, 0)
                WHERE id = :id AND status = 'CLAIMED' AND claimed_by = :consumer
                """).setParameter("id", jobId).setParameter("consumer", consumerId).executeUpdate();
        return updated == 1;
    }

    /**
     * Acknowledges a job held by the consumer.
     *
     * @return false when the job is no longer held by this consumer (it was reclaimed after a timeout)
     */
    @Transactional
    public boolean ack(Long jobId, String consumerId) {
        int updated = entityManager.createNativeQuery("""
                UPDATE job_queue SET status = 'ACKED', acked_at = :now, last_error = NULL
                WHERE id = :id AND status = 'CLAIMED' AND claimed_by = :consumer
                """).setParameter("now", Instant.now()).setParameter("id", jobId).setParameter("consumer", consumerId)
                .executeUpdate();
        if (updated == 0) {
            LOG.warnf("Ack for job %d ignored: no longer held by %s", jobId, consumerId);
            return false;
        }
        return true;
    }

    /**
     * Releases a job back to its stream for redelivery after {@code delay}.
     */
    @Transactional
    public boolean nack(Long jobId, String consumerId, Duration delay, String error) {
        int updated = entityManager.createNativeQuery("""
                UPDATE job_queue
                SET status = 'READY', claimed_by = NULL, claimed_at = NULL,
                    available_at = :availableAt, last_error = :error
                WHERE id = :id AND status = 'CLAIMED' AND claimed_by = :consumer
                """).setParameter("availableAt", Instant.now().plus(delay)).setParameter("error", truncate(error))
                .setParameter("id", jobId).setParameter("consumer", consumerId).executeUpdate();
        if (updated == 0) {
            LOG.warnf("Nack for job %d ignored: no longer held by %s", jobId, consumerId);
            return false;
        }
        LOG.infof("Job %d released for redelivery in %ds", jobId, delay.toSeconds());
        return true;
    }

    /**
     * Acknowledges a job without success so it is never redelivered.
     */
    @Transactional
    public void deadLetter(Long jobId, String reason) {
        entityManager.createNativeQuery("""
                UPDATE job_queue SET status = 'DEAD_LETTER', acked_at = :now, last_error = :reason
                WHERE id = :id AND status IN ('READY', 'CLAIMED')
                """).setParameter("now", Instant.now()).setParameter("reason", truncate(reason))
                .setParameter("id", jobId).executeUpdate();
        Counter.builder("clipindex.jobs.dead_lettered.total").register(meterRegistry).increment();
        LOG.errorf("Job %d dead-lettered: %s", jobId, reason);
    }

    /**
     * Applies the retention policy and reports streams whose unacknowledged backlog exceeds the max length.
     */
    @Transactional
    public TrimResult trim() {
        Instant now = Instant.now();
        int trimmed = entityManager.createNativeQuery("""
                DELETE FROM job_queue WHERE id IN (
                  SELECT id FROM (
                    SELECT id, ROW_NUMBER() OVER (PARTITION BY stream_key ORDER BY id DESC) AS position
                    FROM job_queue WHERE status IN ('ACKED', 'DEAD_LETTER')
                  ) ranked WHERE position > :maxLength
                )
                """).setParameter("maxLength", streamMaxLength).executeUpdate();

        trimmed += entityManager.createNativeQuery("""
                DELETE FROM job_queue
                WHERE (status = 'ACKED' AND acked_at < :ackedCutoff)
                   OR (status = 'DEAD_LETTER' AND acked_at < :deadLetterCutoff)
                """).setParameter("ackedCutoff", now.minus(ackedRetention))
                .setParameter("deadLetterCutoff", now.minus(deadLetterRetention)).executeUpdate();

        @SuppressWarnings("unchecked")
        List<Object[]> overflowing = entityManager.createNativeQuery("""
                SELECT stream_key, COUNT(*) FROM job_queue
                WHERE status IN ('READY', 'CLAIMED')
                GROUP BY stream_key HAVING COUNT(*) > :maxLength
                """).setParameter("maxLength", streamMaxLength).getResultList();

        for (Object[] row : overflowing) {
            LOG.errorf("Stream %s holds %s unacknowledged jobs, above the retention length %d; nothing was dropped",
                    row[0], row[1], streamMaxLength);
            Counter.builder("clipindex.jobs.backlog_overflow.total").register(meterRegistry).increment();
        }

        if (trimmed > 0) {
            LOG.infof("Trimmed %d acknowledged jobs", trimmed);
        }
        return new TrimResult(trimmed, overflowing.size());
    }

    /**
     * Clip ids referenced by READY or CLAIMED jobs of {@code type} in a guild's stream. Periodic schedulers use it to
     * skip clips whose previous job has not run yet.
     */
    @Transactional
    public Set<String> pendingClipIds(JobType type, String guildId) {
        @SuppressWarnings("unchecked")
        List<String> clipIds = entityManager.createNativeQuery("""
                SELECT DISTINCT clip_id
                FROM job_queue,
                     jsonb_array_elements_text(CASE WHEN jsonb_typeof(payload -> 'clip_ids') = 'array'
                                                    THEN payload -> 'clip_ids' ELSE CAST('[]' AS JSONB) END) AS clip_id
                WHERE stream_key = :streamKey AND status IN ('READY', 'CLAIMED')
                """).setParameter("streamKey", QueuedJob.streamKey(guildId, type)).getResultList();
        return new HashSet<>(clipIds);
    }

    /**
     * Counts jobs per delivery status.
     */
    @Transactional
    public QueueStats stats() {
        @SuppressWarnings("unchecked")
        List<Object[]> rows = entityManager
                .createNativeQuery("SELECT status, COUNT(*) FROM job_queue WHERE status <> 'ACKED' GROUP BY status")
                .getResultList();
        long ready = 0;
        long claimed = 0;
        long deadLetter = 0;
        for (Object[] row : rows) {
            long count = ((Number) row[1]).longValue();
            switch (DeliveryStatus.valueOf(row[0].toString())) {
                case READY -> ready = count;
                case CLAIMED -> claimed = count;
                case DEAD_LETTER -> deadLetter = count;
                default -> {
                }
            }
        }
        return new QueueStats(ready, claimed, deadLetter);
    }

    private static String truncate(String value) {
        if (value == null || value.length() <= 2000) {
            return value;
        }
        return value.substring(0, 2000);
    }
}
