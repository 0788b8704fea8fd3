package villagecompute.clipindex.services;

import com.google.common.collect.Lists;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import villagecompute.clipindex.data.models.Channel;
import villagecompute.clipindex.data.models.Guild;
import villagecompute.clipindex.exceptions.DuplicateResourceException;
import villagecompute.clipindex.exceptions.PurgeCooldownException;
import villagecompute.clipindex.exceptions.ResourceNotFoundException;
import villagecompute.clipindex.exceptions.ValidationException;
import villagecompute.clipindex.integration.discord.ScanDirection;
import villagecompute.clipindex.jobs.JobPayload;
import villagecompute.clipindex.jobs.JobType;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Producer-side entry point: validates requests and enqueues jobs.
 *
 * <p>
 * Business rejections happen here, synchronously, so they never reach the queue: a duplicate scan raises
 * {@link DuplicateResourceException}, a purge inside the cooldown raises {@link PurgeCooldownException}, scanning a
 * disabled channel raises {@link ValidationException}. A scan request marks the channel PENDING and enqueues the job in
 * the same transaction.
 */
@ApplicationScoped
public class JobEnqueueService {

    private static final Logger LOG = Logger.getLogger(JobEnqueueService.class);

    public static final int DEFAULT_SCAN_LIMIT = 100;
    public static final int MAX_SCAN_LIMIT = 10_000;

    static final int CLIP_IDS_PER_JOB = 25;

    @Inject
    JobQueueService jobQueueService;

    @Inject
    ScanStateService scanStateService;

    @Inject
    GuildChannelService guildChannelService;

    /**
     * Parameters of a scan request. Null fields take their defaults.
     *
     * @param direction
     *            walking direction, null for the channel's configured scan mode
     * @param limit
     *            messages to walk per chunk, clamped to 1..10000 (default 100)
     * @param autoContinue
     *            enqueue follow-up chunks until history is exhausted (default true)
     * @param rescan
     *            treatment of indexed messages (default {@link RescanMode#STOP})
     * @param cursorMessageId
     *            explicit start cursor, null for the stored cursor
     * @param historical
     *            walk backward from the newest message regardless of stored cursors
     */
    public record ScanRequest(String guildId, String channelId, ScanDirection direction, Integer limit,
            Boolean autoContinue, RescanMode rescan, String cursorMessageId, boolean historical) {

        public static ScanRequest of(String guildId, String channelId) {
            return new ScanRequest(guildId, channelId, null, null, null, null, null, false);
        }
    }

    /**
     * Requests a scan of one channel.
     *
     * @return the scan job id
     * @throws ResourceNotFoundException
     *             if the guild or channel is unknown or deleted
     * @throws ValidationException
     *             if scanning is disabled for the guild or channel
     * @throws DuplicateResourceException
     *             if a scan is already PENDING or RUNNING for the channel
     */
    @Transactional
    public Long requestScan(ScanRequest request) {
        Guild guild = guildChannelService.findActiveGuild(request.guildId())
                .orElseThrow(() -> new ResourceNotFoundException("Guild not found: " + request.guildId()));
        Channel channel = guildChannelService.findActiveChannel(request.guildId(), request.channelId())
                .orElseThrow(() -> new ResourceNotFoundException("Channel not found: " + request.channelId()));
        if (!guild.messageScanEnabled || !channel.messageScanEnabled) {
            throw new ValidationException("Message scanning is disabled for channel " + request.channelId());
        }

        if (!scanStateService.markPending(request.guildId(), request.channelId())) {
            throw new DuplicateResourceException("Scan is already running for this channel");
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        if (request.historical()) {
            payload.put(JobPayload.DIRECTION, ScanDirection.BACKWARD.getWireName());
            payload.put(JobPayload.HISTORICAL, true);
        } else if (request.direction() != null) {
            payload.put(JobPayload.DIRECTION, request.direction().getWireName());
        }
        payload.put(JobPayload.LIMIT, clampLimit(request.limit()));
        payload.put(JobPayload.AUTO_CONTINUE, request.autoContinue() == null || request.autoContinue());
        payload.put(JobPayload.RESCAN,
                (request.rescan() == null ? RescanMode.STOP : request.rescan()).getWireName());
        if (request.cursorMessageId() != null && !request.historical()) {
            payload.put(JobPayload.CURSOR_MESSAGE_ID, request.cursorMessageId());
        }

        Long jobId = jobQueueService.enqueue(JobType.SCAN, request.guildId(), request.channelId(), payload);
        LOG.infof("Scan requested for channel %s in guild %s (job %d)", request.channelId(), request.guildId(),
                jobId);
        return jobId;
    }

    /**
     * Moves a running scan back to PENDING and enqueues its next chunk from {@code cursorMessageId}.
     *
     * @return the follow-up job id, or null when the scan is no longer RUNNING
     */
    @Transactional
    public Long continueScan(String guildId, String channelId, Map<String, Object> previousPayload,
            String cursorMessageId) {
        if (!scanStateService.requeue(channelId)) {
            LOG.infof("Scan of channel %s is no longer running, not continuing", channelId);
            return null;
        }
        Map<String, Object> payload = new LinkedHashMap<>(previousPayload);
        payload.remove("type");
        payload.remove("created_at");
        payload.put(JobPayload.CURSOR_MESSAGE_ID, cursorMessageId);
        return jobQueueService.enqueue(JobType.SCAN, guildId, channelId, payload);
    }

    /**
     * Requests a purge of one channel's indexed data.
     *
     * @throws PurgeCooldownException
     *             if the channel was purged within the cooldown window
     */
    @Transactional
    public Long requestChannelPurge(String guildId, String channelId) {
        Channel channel = guildChannelService.findActiveChannel(guildId, channelId)
                .orElseThrow(() -> new ResourceNotFoundException("Channel not found: " + channelId));
        if (channel.isInPurgeCooldown(Instant.now())) {
            throw new PurgeCooldownException(channelId, channel.purgeCooldown);
        }
        return jobQueueService.enqueue(JobType.PURGE_CHANNEL, guildId, channelId, Map.of());
    }

    @Transactional
    public Long requestGuildPurge(String guildId) {
        guildChannelService.findActiveGuild(guildId)
                .orElseThrow(() -> new ResourceNotFoundException("Guild not found: " + guildId));
        return jobQueueService.enqueue(JobType.PURGE_GUILD, guildId, null, Map.of());
    }

    @Transactional
    public List<Long> requestThumbnails(String guildId, List<String> clipIds) {
        return enqueueClipJobs(JobType.THUMBNAIL_GENERATE, guildId, clipIds);
    }

    /**
     * Requests regeneration of failed thumbnails; with no ids the retry job picks due failures itself.
     */
    @Transactional
    public Long requestThumbnailRetry(String guildId, List<String> clipIds) {
        Map<String, Object> payload = new LinkedHashMap<>();
        if (clipIds != null && !clipIds.isEmpty()) {
            payload.put(JobPayload.CLIP_IDS, List.copyOf(clipIds));
        }
        return jobQueueService.enqueue(JobType.THUMBNAIL_RETRY, guildId, null, payload);
    }

    @Transactional
    public List<Long> requestCdnRefresh(String guildId, List<String> clipIds) {
        return enqueueClipJobs(JobType.CDN_REFRESH, guildId, clipIds);
    }

    public static int clampLimit(Integer limit) {
        if (limit == null) {
            return DEFAULT_SCAN_LIMIT;
        }
        return Math.max(1, Math.min(MAX_SCAN_LIMIT, limit));
    }

    private List<Long> enqueueClipJobs(JobType type, String guildId, List<String> clipIds) {
        if (clipIds == null || clipIds.isEmpty()) {
            throw new ValidationException("At least one clip id is required for " + type.getWireName());
        }
        List<Long> jobIds = new ArrayList<>();
        for (List<String> chunk : Lists.partition(List.copyOf(clipIds), CLIP_IDS_PER_JOB)) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put(JobPayload.CLIP_IDS, new ArrayList<>(chunk));
            jobIds.add(jobQueueService.enqueue(type, guildId, null, payload));
        }
        LOG.debugf("Enqueued %d %s jobs for %d clips in guild %s", jobIds.size(), type.getWireName(), clipIds.size(),
                guildId);
        return jobIds;
    }
}
