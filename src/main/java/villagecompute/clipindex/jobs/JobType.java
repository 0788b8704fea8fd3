package villagecompute.clipindex.jobs;

import java.util.Optional;

/**
 * Enumeration of the job kinds processed by the worker pool.
 *
 * <p>
 * Each job type maps to exactly one {@link JobQueue} family and carries the wire name used in job payloads and stream
 * keys ({@code jobs:guild:{guildId}:{wireName}}). Handler implementations register themselves with the corresponding
 * job type for CDI discovery.
 *
 * @see JobQueue for queue family descriptions
 * @see JobHandler for handler contract
 */
public enum JobType {

    /**
     * Walks a channel's message history and indexes video attachments.
     * <p>
     * <b>Handler:</b> ScanJobHandler
     */
    SCAN("scan", JobQueue.DEFAULT),

    /**
     * Deletes all indexed data of one channel and starts its purge cooldown.
     * <p>
     * <b>Handler:</b> PurgeChannelJobHandler
     */
    PURGE_CHANNEL("purge_channel", JobQueue.HIGH),

    /**
     * Deletes all indexed data of a guild, soft-deletes it and leaves the guild.
     * <p>
     * <b>Handler:</b> PurgeGuildJobHandler
     */
    PURGE_GUILD("purge_guild", JobQueue.HIGH),

    /**
     * Generates small and large thumbnails for newly indexed clips.
     * <p>
     * <b>Handler:</b> ThumbnailGenerateJobHandler
     */
    THUMBNAIL_GENERATE("thumbnail_generate", JobQueue.BULK),

    /**
     * Retries thumbnails whose previous generation failed and whose retry time has come.
     * <p>
     * <b>Handler:</b> ThumbnailRetryJobHandler
     */
    THUMBNAIL_RETRY("thumbnail_retry", JobQueue.BULK),

    /**
     * Refreshes expired attachment CDN URLs; cleans up clips whose source message was deleted.
     * <p>
     * <b>Handler:</b> CdnRefreshJobHandler
     */
    CDN_REFRESH("cdn_refresh", JobQueue.HIGH);

    private final String wireName;
    private final JobQueue queue;

    JobType(String wireName, JobQueue queue) {
        this.wireName = wireName;
        this.queue = queue;
    }

    /**
     * Returns the lowercase name used in payloads and stream keys.
     */
    public String getWireName() {
        return wireName;
    }

    /**
     * Returns the queue family this job type is assigned to.
     */
    public JobQueue getQueue() {
        return queue;
    }

    /**
     * Resolves a job type from its wire name.
     *
     * @param wireName
     *            value stored in {@code job_queue.job_type}
     * @return the job type, or empty when the name is unknown
     */
    public static Optional<JobType> fromWireName(String wireName) {
        if (wireName == null) {
            return Optional.empty();
        }
        for (JobType type : values()) {
            if (type.wireName.equals(wireName)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
