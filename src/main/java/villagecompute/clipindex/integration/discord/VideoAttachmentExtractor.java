package villagecompute.clipindex.integration.discord;

import io.quarkus.arc.DefaultBean;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;
import villagecompute.clipindex.services.ResolvedSettings;
import villagecompute.clipindex.util.CdnUrls;
import villagecompute.clipindex.util.ClipIds;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Indexes video attachments.
 *
 * <p>
 * An attachment is a video when its content type is one of the allowed MIME types, or, for old messages without a
 * content type or with a generic one, when its filename has a known video extension. A configured
 * {@code match_regex} must be found somewhere in the message content (a missing content counts as empty).
 */
@DefaultBean
@ApplicationScoped
public class VideoAttachmentExtractor implements AttachmentExtractor {

    private static final Logger LOG = Logger.getLogger(VideoAttachmentExtractor.class);

    static final Set<String> VIDEO_EXTENSIONS = Set.of(".mp4", ".mov", ".webm", ".avi", ".mkv", ".flv", ".wmv");

    private final Map<String, Pattern> patterns = new ConcurrentHashMap<>();

    @Override
    public List<ClipCandidate> extract(DiscordMessage message, ResolvedSettings settings) {
        if (message.attachments().isEmpty() || !matchesFilter(message, settings.matchRegex())) {
            return List.of();
        }
        Instant now = Instant.now();
        List<ClipCandidate> candidates = new ArrayList<>();
        for (DiscordAttachment attachment : message.attachments()) {
            if (isVideo(attachment, settings.allowedMimeTypes())) {
                String clipId = ClipIds.clipId(message.id(), message.channelId(), attachment.filename(),
                        message.timestamp());
                candidates.add(
                        new ClipCandidate(clipId, message, attachment, CdnUrls.expiresAt(attachment.url(), now)));
            }
        }
        return candidates;
    }

    static boolean isVideo(DiscordAttachment attachment, List<String> allowedMimeTypes) {
        String contentType = attachment.contentType();
        if (contentType != null && allowedMimeTypes.contains(contentType.toLowerCase(Locale.ROOT))) {
            return true;
        }
        String filename = attachment.filename() == null ? "" : attachment.filename().toLowerCase(Locale.ROOT);
        return VIDEO_EXTENSIONS.stream().anyMatch(filename::endsWith);
    }

    private boolean matchesFilter(DiscordMessage message, String regex) {
        if (regex == null || regex.isEmpty()) {
            return true;
        }
        Pattern pattern;
        try {
            pattern = patterns.computeIfAbsent(regex, Pattern::compile);
        } catch (PatternSyntaxException e) {
            LOG.warnf("Ignoring invalid match_regex '%s': %s", regex, e.getDescription());
            return true;
        }
        String content = message.content() == null ? "" : message.content();
        return pattern.matcher(content).find();
    }
}
