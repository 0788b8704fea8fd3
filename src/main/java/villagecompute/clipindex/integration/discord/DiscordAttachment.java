package villagecompute.clipindex.integration.discord;

/**
 * File attached to a chat message. {@code contentType} is missing on very old messages.
 */
public record DiscordAttachment(String id, String filename, long size, String url, String contentType) {
}
