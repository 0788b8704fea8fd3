package villagecompute.clipindex.jobs;

import java.util.Map;

/**
 * Contract for async job handler implementations.
 *
 * <p>
 * Handlers must be CDI-managed beans annotated with {@code @ApplicationScoped}. The {@link JobDispatcher} discovers
 * them at startup and routes claimed jobs based on their {@link JobType}.
 *
 * <p>
 * <b>Delivery Model:</b>
 * <ul>
 * <li>Jobs are delivered at least once; a job may be redelivered after a worker crash or a visibility timeout, so
 * handlers must be idempotent</li>
 * <li>Returning normally acknowledges the job</li>
 * <li>{@link villagecompute.clipindex.exceptions.ValidationException} dead-letters the job</li>
 * <li>Any other exception returns the job to the queue with exponential backoff</li>
 * </ul>
 *
 * <p>
 * <b>Example Implementation:</b>
 *
 * <pre>{@code
 * @ApplicationScoped
 * public class PurgeChannelJobHandler implements JobHandler {
 *     @Override
 *     public JobType handlesType() {
 *         return JobType.PURGE_CHANNEL;
 *     }
 *
 *     @Override
 *     public void execute(Long jobId, Map<String, Object> payload) throws Exception {
 *         JobPayload job = JobPayload.of(payload);
 *         purgeCoordinator.purgeChannel(job.requireString("guild_id"), job.requireString("channel_id"));
 *     }
 * }
 * }</pre>
 *
 * @see JobDispatcher for dispatcher implementation
 * @see JobType for supported job types
 */
public interface JobHandler {

    /**
     * Returns the job type this handler processes.
     *
     * @return the job type enum value
     */
    JobType handlesType();

    /**
     * Executes the job with the given payload.
     *
     * <p>
     * <b>Thread Safety:</b> This method may be called concurrently by multiple worker threads for different jobs.
     *
     * @param jobId
     *            the primary key from {@code job_queue.id}
     * @param payload
     *            job parameters (stored as JSONB)
     * @throws Exception
     *             any error during execution; classified by the dispatcher
     */
    void execute(Long jobId, Map<String, Object> payload) throws Exception;
}
