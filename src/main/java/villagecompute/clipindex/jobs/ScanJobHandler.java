package villagecompute.clipindex.jobs;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.clipindex.data.models.ChannelScanStatus;
import villagecompute.clipindex.exceptions.ChatPlatformException;
import villagecompute.clipindex.exceptions.ScanNotRunningException;
import villagecompute.clipindex.exceptions.ValidationException;
import villagecompute.clipindex.integration.discord.DiscordClient;
import villagecompute.clipindex.integration.discord.DiscordMessage;
import villagecompute.clipindex.integration.discord.ScanDirection;
import villagecompute.clipindex.services.ClipBatchProcessor;
import villagecompute.clipindex.services.ClipBatchProcessor.BatchOutcome;
import villagecompute.clipindex.services.JobEnqueueService;
import villagecompute.clipindex.services.RescanMode;
import villagecompute.clipindex.services.ScanCancellationRegistry;
import villagecompute.clipindex.services.ScanStateService;
import villagecompute.clipindex.services.ScannedRange;
import villagecompute.clipindex.services.SettingsResolver;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Job handler that walks one chunk of a channel's message history and indexes its video attachments.
 *
 * <p>
 * <b>Execution Flow:</b>
 * <ol>
 * <li>Parse direction, limit, rescan mode and cursor from the payload</li>
 * <li>Move the channel's scan PENDING to RUNNING; a scan that is no longer PENDING was cancelled or is a duplicate
 * delivery, and the job is acknowledged without work</li>
 * <li>Fetch pages of up to 100 messages from the cursor, hand each to {@link ClipBatchProcessor}, then advance the
 * cursor and counters through {@link ScanStateService#recordProgress}</li>
 * <li>Check for cancellation between pages</li>
 * <li>When the chunk limit is reached and history remains, requeue a follow-up job (auto-continue); otherwise mark the
 * scan SUCCEEDED</li>
 * </ol>
 *
 * <p>
 * <b>Cursor start:</b> the payload's {@code cursor_message_id} wins; otherwise the persisted forward or backward
 * cursor of the channel. Without an explicit direction a channel that already has a forward cursor is scanned
 * forward from it, so a routine re-scan catches up on new messages; first scans follow the channel's
 * {@code scan_mode}. A historical scan starts from the newest message and walks backward; its walk is not contiguous
 * with the scanned range, so it halts only at stored messages. Follow-up jobs carry the direction of the chunk that
 * enqueued them, and a historical follow-up resumes from its payload cursor.
 *
 * <p>
 * <b>Errors:</b> a permanent platform rejection (4xx other than 429, e.g. missing access) fails the scan and
 * acknowledges the job. Transient errors put the scan back to PENDING and propagate so the dispatcher retries the
 * job; the retry resumes from the last committed cursor. A scan cancelled while a page is being written (purge or
 * stop) ends the job quietly; the writes after the cancellation were refused.
 *
 * <p>
 * <b>Payload Structure:</b>
 *
 * <pre>
 * {
 *   "guild_id": "123",
 *   "channel_id": "456",
 *   "direction": "backward",        // Optional - forward from the forward cursor once one exists,
 *                                   //   otherwise the channel's scan_mode setting
 *   "limit": 100,                   // Optional - messages per chunk, clamped to 1..10000
 *   "auto_continue": true,          // Optional
 *   "rescan": "stop",               // Optional - stop | continue | update
 *   "cursor_message_id": "789",     // Optional
 *   "historical": false             // Optional
 * }
 * </pre>
 */
@ApplicationScoped
public class ScanJobHandler implements JobHandler {

    private static final Logger LOG = Logger.getLogger(ScanJobHandler.class);

    @Inject
    ScanStateService scanStateService;

    @Inject
    ScanCancellationRegistry cancellationRegistry;

    @Inject
    DiscordClient discordClient;

    @Inject
    ClipBatchProcessor batchProcessor;

    @Inject
    SettingsResolver settingsResolver;

    @Inject
    JobEnqueueService jobEnqueueService;

    @Inject
    Tracer tracer;

    @Inject
    MeterRegistry meterRegistry;

    @Override
    public JobType handlesType() {
        return JobType.SCAN;
    }

    @Override
    public void execute(Long jobId, Map<String, Object> payload) throws Exception {
        JobPayload job = JobPayload.of(payload);
        String guildId = job.requireString(JobPayload.GUILD_ID);
        String channelId = job.requireString(JobPayload.CHANNEL_ID);
        int limit = JobEnqueueService.clampLimit(job.intValue(JobPayload.LIMIT, JobEnqueueService.DEFAULT_SCAN_LIMIT));
        boolean autoContinue = job.booleanValue(JobPayload.AUTO_CONTINUE, true);
        boolean historical = job.booleanValue(JobPayload.HISTORICAL, false);
        RescanMode rescan = parseRescan(job.optionalString(JobPayload.RESCAN));
        Optional<String> requestedDirection = job.optionalString(JobPayload.DIRECTION);

        Span span = tracer.spanBuilder("job.scan").setAttribute("job.id", jobId)
                .setAttribute("job.type", JobType.SCAN.getWireName()).setAttribute("guild.id", guildId)
                .setAttribute("channel.id", channelId).setAttribute("scan.limit", limit).startSpan();

        try (Scope scope = span.makeCurrent()) {
            if (!scanStateService.markRunning(channelId)) {
                LOG.infof("Scan of channel %s is not pending (cancelled or duplicate delivery), skipping job %d",
                        channelId, jobId);
                span.addEvent("scan.skipped");
                return;
            }

            Optional<ChannelScanStatus> status = historical ? Optional.empty() : scanStateService.find(channelId);
            ScanDirection direction = historical ? ScanDirection.BACKWARD
                    : requestedDirection.map(ScanJobHandler::parseDirection)
                            .orElseGet(() -> defaultDirection(guildId, channelId, status));
            Optional<String> payloadCursor = job.optionalString(JobPayload.CURSOR_MESSAGE_ID);
            String cursor = historical ? payloadCursor.orElse(null)
                    : payloadCursor.orElseGet(() -> persistedCursor(status, direction));
            ScannedRange scannedRange = ScannedRange.of(status);
            span.setAttribute("scan.direction", direction.getWireName());

            // continuations keep walking the way this chunk did
            Map<String, Object> continuation = new LinkedHashMap<>(payload);
            continuation.put(JobPayload.DIRECTION, direction.getWireName());

            try {
                runChunk(jobId, guildId, channelId, direction, cursor, scannedRange, limit, autoContinue, rescan,
                        continuation, span);
            } catch (ChatPlatformException e) {
                if (isPermanent(e)) {
                    span.recordException(e);
                    scanStateService.fail(channelId, e.getMessage());
                    return;
                }
                scanStateService.requeue(channelId);
                throw e;
            } catch (ValidationException e) {
                scanStateService.fail(channelId, e.getMessage());
                throw e;
            } catch (RuntimeException e) {
                scanStateService.requeue(channelId);
                throw e;
            }
        } finally {
            span.end();
        }
    }

    private void runChunk(Long jobId, String guildId, String channelId, ScanDirection direction, String cursor,
            ScannedRange scannedRange, int limit, boolean autoContinue, RescanMode rescan,
            Map<String, Object> payload, Span span) {
        Instant startedAt = Instant.now();
        int remaining = limit;
        int walkedTotal = 0;
        int clipsTotal = 0;
        boolean exhausted = false;

        while (remaining > 0) {
            if (cancellationRegistry.isCancelled(guildId, channelId, startedAt)) {
                if (cancellationRegistry.isShuttingDown()) {
                    LOG.infof("Shutdown requested, handing scan of channel %s back at cursor %s", channelId,
                            cursor);
                    jobEnqueueService.continueScan(guildId, channelId, payload, cursor);
                } else {
                    scanStateService.cancel(channelId, "Scan cancelled");
                    LOG.infof("Scan of channel %s cancelled after %d messages", channelId, walkedTotal);
                }
                span.addEvent("scan.cancelled");
                return;
            }

            int pageSize = Math.min(DiscordClient.MAX_PAGE_SIZE, remaining);
            List<DiscordMessage> page = discordClient.fetchMessages(channelId, direction, cursor, pageSize);
            if (page.isEmpty()) {
                exhausted = true;
                break;
            }

            BatchOutcome outcome;
            try {
                outcome = batchProcessor.process(guildId, channelId, page, rescan, scannedRange);
            } catch (ScanNotRunningException e) {
                LOG.infof("Scan of channel %s was cancelled while writing a page, stopping", channelId);
                span.addEvent("scan.cancelled");
                return;
            }
            if (outcome.walkedCount() > 0) {
                if (!scanStateService.recordProgress(channelId, outcome.newestWalkedId(), outcome.oldestWalkedId(),
                        outcome.messagesWithClips(), outcome.walkedCount())) {
                    LOG.infof("Scan of channel %s is no longer running, stopping", channelId);
                    span.addEvent("scan.cancelled");
                    return;
                }
                cursor = outcome.lastWalkedId();
            }
            if (!outcome.thumbnailClipIds().isEmpty()) {
                jobEnqueueService.requestThumbnails(guildId, outcome.thumbnailClipIds());
            }

            walkedTotal += outcome.walkedCount();
            clipsTotal += outcome.clipsWritten();
            remaining -= page.size();
            if (outcome.reachedIndexed() || page.size() < pageSize) {
                exhausted = true;
                break;
            }
        }

        Counter.builder("clipindex.scan.messages.total").tag("direction", direction.getWireName())
                .register(meterRegistry).increment(walkedTotal);
        Counter.builder("clipindex.scan.clips.total").register(meterRegistry).increment(clipsTotal);
        span.setAttribute("scan.messages", walkedTotal);
        span.setAttribute("scan.clips", clipsTotal);

        if (!exhausted && autoContinue) {
            Long nextJobId = jobEnqueueService.continueScan(guildId, channelId, payload, cursor);
            LOG.infof("Scan job %d walked %d messages in channel %s, continuing as job %s", jobId, walkedTotal,
                    channelId, nextJobId);
            return;
        }
        scanStateService.complete(channelId);
        LOG.infof("Scan job %d of channel %s completed: %d messages, %d clips", jobId, channelId, walkedTotal,
                clipsTotal);
    }

    /**
     * A channel that was scanned before catches up from its forward cursor; a first scan walks the way the channel's
     * {@code scan_mode} setting says.
     */
    private ScanDirection defaultDirection(String guildId, String channelId, Optional<ChannelScanStatus> status) {
        if (status.isPresent() && status.get().forwardCursorMessageId != null) {
            return ScanDirection.FORWARD;
        }
        return parseDirection(settingsResolver.getEffectiveSettings(guildId, channelId).scanMode());
    }

    private static String persistedCursor(Optional<ChannelScanStatus> status, ScanDirection direction) {
        if (status.isEmpty()) {
            return null;
        }
        return direction == ScanDirection.FORWARD ? status.get().forwardCursorMessageId
                : status.get().backwardCursorMessageId;
    }

    private static boolean isPermanent(ChatPlatformException e) {
        int status = e.getStatusCode();
        return status >= 400 && status < 500 && status != 429;
    }

    private static ScanDirection parseDirection(String value) {
        return ScanDirection.fromWireName(value)
                .orElseThrow(() -> new ValidationException("Unknown scan direction: " + value));
    }

    private static RescanMode parseRescan(Optional<String> value) {
        if (value.isEmpty()) {
            return RescanMode.STOP;
        }
        return RescanMode.fromWireName(value.get())
                .orElseThrow(() -> new ValidationException("Unknown rescan mode: " + value.get()));
    }
}
