package villagecompute.clipindex.services;

import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.test.junit.QuarkusTest;
import io.quarkus.test.junit.TestProfile;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;
import villagecompute.clipindex.BaseIntegrationTest;
import villagecompute.clipindex.data.models.QueuedJob;
import villagecompute.clipindex.data.models.QueuedJob.DeliveryStatus;
import villagecompute.clipindex.jobs.JobType;
import villagecompute.clipindex.testing.PostgreSQLTestProfile;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests the claim protocol and retention of {@link JobQueueService} against PostgreSQL.
 */
@QuarkusTest
@TestProfile(PostgreSQLTestProfile.class)
class JobQueueServiceDatabaseTest extends BaseIntegrationTest {

    @Inject
    JobQueueService jobQueueService;

    @Inject
    JobEnqueueService jobEnqueueService;

    @Test
    void testClaim_marksJobsClaimedOldestFirst() throws Exception {
        Long first = jobQueueService.enqueue(JobType.SCAN, "g1", "c1", Map.of());
        Long second = jobQueueService.enqueue(JobType.SCAN, "g1", "c2", Map.of());

        List<QueuedJob> claimed = jobQueueService.claim("worker-1", 5, Duration.ZERO);

        assertEquals(List.of(first, second), claimed.stream().map(job -> job.id).toList());
        assertRowCount(2, "job_queue", "status = 'CLAIMED' AND claimed_by = 'worker-1' AND delivery_count = 1",
                Map.of());
        assertTrue(jobQueueService.claim("worker-2", 5, Duration.ZERO).isEmpty(),
                "A fresh claim must not be taken by another consumer");
    }

    @Test
    void testClaim_skipsRowsLockedByAnotherTransaction() throws Exception {
        Long locked = jobQueueService.enqueue(JobType.SCAN, "g1", "c1", Map.of());
        Long free = jobQueueService.enqueue(JobType.SCAN, "g1", "c2", Map.of());

        CountDownLatch lockHeld = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<?> holder = executor.submit(() -> QuarkusTransaction.requiringNew().run(() -> {
                entityManager.createNativeQuery("SELECT id FROM job_queue WHERE id = :id FOR UPDATE")
                        .setParameter("id", locked).getResultList();
                lockHeld.countDown();
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException(e);
                }
            }));
            assertTrue(lockHeld.await(10, TimeUnit.SECONDS));

            List<QueuedJob> claimed = jobQueueService.claim("worker-1", 5, Duration.ZERO);

            assertEquals(List.of(free), claimed.stream().map(job -> job.id).toList());
            release.countDown();
            holder.get(10, TimeUnit.SECONDS);
        } finally {
            release.countDown();
            executor.shutdownNow();
        }

        List<QueuedJob> later = jobQueueService.claim("worker-2", 5, Duration.ZERO);
        assertEquals(List.of(locked), later.stream().map(job -> job.id).toList());
    }

    @Test
    void testClaim_reclaimsJobIdlePastVisibilityTimeout() throws Exception {
        Long jobId = jobQueueService.enqueue(JobType.SCAN, "g1", "c1", Map.of());
        jobQueueService.claim("worker-1", 1, Duration.ZERO);
        executeCommitted("UPDATE job_queue SET claimed_at = :claimedAt WHERE id = :id",
                Map.of("claimedAt", Instant.now().minus(Duration.ofMinutes(5)), "id", jobId));

        List<QueuedJob> reclaimed = jobQueueService.claim("worker-2", 1, Duration.ZERO);

        assertEquals(1, reclaimed.size());
        assertEquals("worker-2", reclaimed.get(0).claimedBy);
        assertEquals(2, reclaimed.get(0).deliveryCount);
        assertFalse(jobQueueService.ack(jobId, "worker-1"), "The consumer that lost the claim cannot ack");
        assertTrue(jobQueueService.ack(jobId, "worker-2"));
        assertRowCount(1, "job_queue", "id = :id AND status = 'ACKED' AND acked_at IS NOT NULL", Map.of("id", jobId));
    }

    @Test
    void testNack_returnsJobAfterDelay() throws Exception {
        Long jobId = jobQueueService.enqueue(JobType.SCAN, "g1", "c1", Map.of());
        jobQueueService.claim("worker-1", 1, Duration.ZERO);

        assertTrue(jobQueueService.nack(jobId, "worker-1", Duration.ofHours(1), "Bad gateway"));

        assertTrue(jobQueueService.claim("worker-1", 1, Duration.ZERO).isEmpty());
        assertRowCount(1, "job_queue",
                "id = :id AND status = 'READY' AND claimed_by IS NULL AND last_error = 'Bad gateway'",
                Map.of("id", jobId));

        executeCommitted("UPDATE job_queue SET available_at = :now WHERE id = :id",
                Map.of("now", Instant.now().minusSeconds(1), "id", jobId));
        List<QueuedJob> redelivered = jobQueueService.claim("worker-1", 1, Duration.ZERO);
        assertEquals(2, redelivered.get(0).deliveryCount);
    }

    @Test
    void testDeadLetter_isNeverRedelivered() throws Exception {
        Long jobId = jobQueueService.enqueue(JobType.SCAN, "g1", "c1", Map.of());
        jobQueueService.claim("worker-1", 1, Duration.ZERO);

        jobQueueService.deadLetter(jobId, "Retries exhausted");

        assertTrue(jobQueueService.claim("worker-1", 1, Duration.ZERO).isEmpty());
        assertEquals(new JobQueueService.QueueStats(0, 0, 1), jobQueueService.stats());
    }

    @Test
    void testTrim_deletesOnlyAcknowledgedJobsPastRetention() throws Exception {
        Long oldAcked = jobQueueService.enqueue(JobType.SCAN, "g1", "c1", Map.of());
        Long recentAcked = jobQueueService.enqueue(JobType.SCAN, "g1", "c2", Map.of());
        jobQueueService.claim("worker-1", 2, Duration.ZERO);
        jobQueueService.ack(oldAcked, "worker-1");
        jobQueueService.ack(recentAcked, "worker-1");
        executeCommitted("UPDATE job_queue SET acked_at = :ackedAt WHERE id = :id",
                Map.of("ackedAt", Instant.now().minus(Duration.ofHours(25)), "id", oldAcked));
        Long ready = jobQueueService.enqueue(JobType.SCAN, "g1", "c3", Map.of());
        executeCommitted("UPDATE job_queue SET created_at = :old WHERE id = :id",
                Map.of("old", Instant.now().minus(Duration.ofDays(30)), "id", ready));

        JobQueueService.TrimResult result = jobQueueService.trim();

        assertEquals(1, result.trimmed());
        assertEquals(0, result.overflowingStreams());
        assertRowCount(0, "job_queue", "id = :id", Map.of("id", oldAcked));
        assertRowCount(1, "job_queue", "id = :id", Map.of("id", recentAcked));
        assertRowCount(1, "job_queue", "id = :id AND status = 'READY'", Map.of("id", ready));
    }

    @Test
    void testPendingClipIds_tracksReadyAndClaimedJobsOnly() throws Exception {
        jobEnqueueService.requestCdnRefresh("g1", List.of("clip-a", "clip-b"));
        jobEnqueueService.requestThumbnailRetry("g1", List.of("clip-z"));

        assertEquals(Set.of("clip-a", "clip-b"), jobQueueService.pendingClipIds(JobType.CDN_REFRESH, "g1"));
        assertEquals(Set.of("clip-z"), jobQueueService.pendingClipIds(JobType.THUMBNAIL_RETRY, "g1"));
        assertTrue(jobQueueService.pendingClipIds(JobType.CDN_REFRESH, "g2").isEmpty());

        for (QueuedJob job : jobQueueService.claim("worker-1", 10, Duration.ZERO)) {
            jobQueueService.ack(job.id, "worker-1");
        }

        assertTrue(jobQueueService.pendingClipIds(JobType.CDN_REFRESH, "g1").isEmpty());
    }

    @Test
    void testEnqueue_payloadStoredAsJsonb() {
        Long jobId = jobQueueService.enqueue(JobType.SCAN, "g1", "c1", Map.of("limit", 250));

        assertEquals("250", selectValue("SELECT payload ->> 'limit' FROM job_queue WHERE id = :id",
                Map.of("id", jobId)));
        assertEquals(QueuedJob.streamKey("g1", JobType.SCAN),
                selectValue("SELECT stream_key FROM job_queue WHERE id = :id", Map.of("id", jobId)));
        assertEquals(DeliveryStatus.READY.name(),
                selectValue("SELECT status FROM job_queue WHERE id = :id", Map.of("id", jobId)));
    }
}
