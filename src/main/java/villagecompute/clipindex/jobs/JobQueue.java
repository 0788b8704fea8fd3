package villagecompute.clipindex.jobs;

/**
 * Queue families used to order claims and bound concurrency in the worker pool.
 *
 * <p>
 * Every {@link JobType} belongs to one family. The family priority is the first sort key when a worker claims a batch,
 * so purges and CDN refreshes overtake a long scan backlog.
 *
 * <p>
 * <b>Concurrency:</b>
 * <ul>
 * <li>HIGH and DEFAULT share the general worker permits</li>
 * <li>BULK additionally holds a dedicated permit, since ffmpeg thumbnail extraction is CPU and memory heavy</li>
 * </ul>
 *
 * @see JobType for job-to-queue assignments
 * @see JobDispatcher for permit handling
 */
public enum JobQueue {

    /**
     * HIGH queue - destructive or user-visible operations that should not wait behind scans.
     * <p>
     * Handles: channel purge, guild purge, CDN refresh.
     */
    HIGH(0, "Purges and CDN refreshes"),

    /**
     * DEFAULT queue - channel history scans.
     */
    DEFAULT(5, "Channel scans"),

    /**
     * BULK queue - thumbnail generation and retries, limited by a dedicated semaphore.
     */
    BULK(8, "Thumbnail generation with limited concurrency");

    private final int priority;
    private final String description;

    JobQueue(int priority, String description) {
        this.priority = priority;
        this.description = description;
    }

    /**
     * Returns the claim priority (lower values are claimed first).
     */
    public int getPriority() {
        return priority;
    }

    /**
     * Returns a human-readable description of the queue's purpose.
     */
    public String getDescription() {
        return description;
    }
}
