package villagecompute.clipindex.integration.discord;

import java.time.Instant;

/**
 * A video attachment selected for indexing, with its derived clip id and CDN expiry.
 */
public record ClipCandidate(String clipId, DiscordMessage message, DiscordAttachment attachment, Instant expiresAt) {
}
