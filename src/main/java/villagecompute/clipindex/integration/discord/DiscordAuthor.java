package villagecompute.clipindex.integration.discord;

/**
 * Author of a chat message as returned by the platform.
 */
public record DiscordAuthor(String id, String username, String discriminator, String avatarHash) {

    private static final String CDN_BASE = "https://cdn.discordapp.com";

    /**
     * Avatar image URL, or null when the user has no custom avatar.
     */
    public String avatarUrl() {
        if (avatarHash == null || avatarHash.isBlank()) {
            return null;
        }
        String extension = avatarHash.startsWith("a_") ? "gif" : "png";
        return CDN_BASE + "/avatars/" + id + "/" + avatarHash + "." + extension;
    }
}
