package villagecompute.clipindex.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.clipindex.data.bulk.BulkWriteRepository;
import villagecompute.clipindex.data.bulk.BulkWriteResult;
import villagecompute.clipindex.data.bulk.UpsertTable;
import villagecompute.clipindex.integration.discord.AttachmentExtractor;
import villagecompute.clipindex.integration.discord.ClipCandidate;
import villagecompute.clipindex.integration.discord.DiscordAuthor;
import villagecompute.clipindex.integration.discord.DiscordMessage;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns one page of channel history into indexed rows.
 *
 * <p>
 * Per page: settings are resolved once, existing messages and clips are loaded in bulk, and users, messages and clips
 * are written with one upsert each (parents first). Only messages carrying at least one clip are stored.
 *
 * <p>
 * A clip that is already indexed under the current settings hash with a completed thumbnail is left alone, except that
 * its CDN URL is rewritten when expired; in {@link RescanMode#UPDATE} its record is rewritten regardless. Every other
 * clip is written and returned for thumbnail generation.
 *
 * <p>
 * {@link RescanMode#STOP} halts at the first message that is either stored or inside the channel's
 * {@link ScannedRange}.
 */
@ApplicationScoped
public class ClipBatchProcessor {

    private static final Logger LOG = Logger.getLogger(ClipBatchProcessor.class);

    @Inject
    SettingsResolver settingsResolver;

    @Inject
    AttachmentExtractor attachmentExtractor;

    @Inject
    IndexedDataService indexedDataService;

    @Inject
    BulkWriteRepository bulkWriteRepository;

    /**
     * Result of one page.
     *
     * @param messagesWalked
     *            messages consumed from the page, in walking order; the cursor moves to the last of them
     * @param messagesWithClips
     *            walked messages that carried clips
     * @param clipsFound
     *            clip candidates in walked messages
     * @param clipsWritten
     *            clip rows written
     * @param writeFailures
     *            rows rejected by the bulk writer across all tables
     * @param thumbnailClipIds
     *            clips that need a thumbnail
     * @param reachedIndexed
     *            true when {@link RescanMode#STOP} halted at an indexed message
     */
    public record BatchOutcome(List<DiscordMessage> messagesWalked, int messagesWithClips, int clipsFound,
            int clipsWritten, int writeFailures, List<String> thumbnailClipIds, boolean reachedIndexed) {

        public int walkedCount() {
            return messagesWalked.size();
        }

        /**
         * Last message consumed in walking order, or null when nothing was walked.
         */
        public String lastWalkedId() {
            return messagesWalked.isEmpty() ? null : messagesWalked.get(messagesWalked.size() - 1).id();
        }

        public String newestWalkedId() {
            return messagesWalked.stream().max(DiscordMessage.OLDEST_FIRST).map(DiscordMessage::id).orElse(null);
        }

        public String oldestWalkedId() {
            return messagesWalked.stream().min(DiscordMessage.OLDEST_FIRST).map(DiscordMessage::id).orElse(null);
        }
    }

    /**
     * Processes a page given in walking order.
     *
     * @throws villagecompute.clipindex.exceptions.ScanNotRunningException
     *             when the channel's scan was cancelled while the page was being written
     *
     * @param scannedRange
     *            history already walked by earlier scans; in {@link RescanMode#STOP} a message inside it counts as
     *            indexed even when it stored no row
     */
    public BatchOutcome process(String guildId, String channelId, List<DiscordMessage> page, RescanMode mode,
            ScannedRange scannedRange) {
        if (page.isEmpty()) {
            return new BatchOutcome(List.of(), 0, 0, 0, 0, List.of(), false);
        }

        ResolvedSettings settings = settingsResolver.getEffectiveSettings(guildId, channelId);
        Set<String> indexedMessageIds = indexedDataService.existingMessageIds(channelId,
                page.stream().map(DiscordMessage::id).toList());

        List<DiscordMessage> walked = new ArrayList<>();
        Map<DiscordMessage, List<ClipCandidate>> toProcess = new LinkedHashMap<>();
        boolean reachedIndexed = false;
        for (DiscordMessage message : page) {
            boolean indexed = indexedMessageIds.contains(message.id());
            if (mode == RescanMode.STOP && (indexed || scannedRange.contains(message.id()))) {
                LOG.debugf("Reached indexed message %s in channel %s, stopping", message.id(), channelId);
                reachedIndexed = true;
                break;
            }
            walked.add(message);
            if (indexed && mode == RescanMode.CONTINUE) {
                continue;
            }
            List<ClipCandidate> candidates = attachmentExtractor.extract(message, settings);
            if (!candidates.isEmpty()) {
                toProcess.put(message, candidates);
            }
        }

        List<String> candidateIds = toProcess.values().stream().flatMap(List::stream).map(ClipCandidate::clipId)
                .toList();
        Map<String, IndexedDataService.ExistingClip> existingClips = candidateIds.isEmpty() ? Map.of()
                : indexedDataService.existingClips(candidateIds);

        Instant now = Instant.now();
        Map<String, Map<String, Object>> users = new LinkedHashMap<>();
        List<Map<String, Object>> messages = new ArrayList<>();
        List<Map<String, Object>> clips = new ArrayList<>();
        List<String> thumbnailClipIds = new ArrayList<>();
        int clipsFound = 0;

        for (Map.Entry<DiscordMessage, List<ClipCandidate>> entry : toProcess.entrySet()) {
            DiscordMessage message = entry.getKey();
            users.putIfAbsent(message.author().id(), userRow(message.author()));
            messages.add(messageRow(guildId, channelId, message, settings));
            for (ClipCandidate candidate : entry.getValue()) {
                clipsFound++;
                IndexedDataService.ExistingClip existing = existingClips.get(candidate.clipId());
                if (existing != null && existing.isUpToDate(settings.settingsHash())) {
                    if (mode == RescanMode.UPDATE || existing.isCdnUrlExpired(now)) {
                        clips.add(clipRow(guildId, channelId, candidate, settings));
                    }
                    continue;
                }
                clips.add(clipRow(guildId, channelId, candidate, settings));
                thumbnailClipIds.add(candidate.clipId());
            }
        }

        BulkWriteResult userResult = bulkWriteRepository.bulkUpsert(channelId, UpsertTable.CHAT_USERS,
                new ArrayList<>(users.values()));
        BulkWriteResult messageResult = bulkWriteRepository.bulkUpsert(channelId, UpsertTable.MESSAGES, messages);
        BulkWriteResult clipResult = bulkWriteRepository.bulkUpsert(channelId, UpsertTable.CLIPS, clips);
        int failures = userResult.failure() + messageResult.failure() + clipResult.failure();
        if (failures > 0) {
            LOG.warnf("Batch in channel %s had %d failed row writes", channelId, failures);
        }

        LOG.infof("Processed %d messages in channel %s: %d with clips, %d clips found, %d written, %d need thumbnails",
                walked.size(), channelId, toProcess.size(), clipsFound, clipResult.success(), thumbnailClipIds.size());
        return new BatchOutcome(walked, toProcess.size(), clipsFound, clipResult.success(), failures,
                thumbnailClipIds, reachedIndexed);
    }

    private static Map<String, Object> userRow(DiscordAuthor author) {
        Map<String, Object> row = new HashMap<>();
        row.put("id", author.id());
        row.put("username", author.username());
        row.put("discriminator", author.discriminator() == null ? "0" : author.discriminator());
        row.put("avatar_url", author.avatarUrl());
        return row;
    }

    private static Map<String, Object> messageRow(String guildId, String channelId, DiscordMessage message,
            ResolvedSettings settings) {
        Map<String, Object> row = new HashMap<>();
        row.put("id", message.id());
        row.put("guild_id", guildId);
        row.put("channel_id", channelId);
        row.put("author_id", message.author().id());
        row.put("content", settings.enableMessageContentStorage() ? message.content() : null);
        row.put("timestamp", message.timestamp());
        return row;
    }

    private static Map<String, Object> clipRow(String guildId, String channelId, ClipCandidate candidate,
            ResolvedSettings settings) {
        Map<String, Object> row = new HashMap<>();
        row.put("id", candidate.clipId());
        row.put("message_id", candidate.message().id());
        row.put("guild_id", guildId);
        row.put("channel_id", channelId);
        row.put("author_id", candidate.message().author().id());
        row.put("filename", candidate.attachment().filename());
        row.put("file_size", candidate.attachment().size());
        row.put("mime_type", candidate.attachment().contentType() == null ? "application/octet-stream"
                : candidate.attachment().contentType());
        row.put("cdn_url", candidate.attachment().url());
        row.put("expires_at", candidate.expiresAt());
        row.put("settings_hash", settings.settingsHash());
        return row;
    }
}
