package villagecompute.clipindex.services;

import java.util.List;
import java.util.Map;

/**
 * Effective scan settings of a channel: {@code defaults ⊕ guild ⊕ channel}, later layers winning per key.
 *
 * @param guildId
 *            guild the settings were resolved for
 * @param channelId
 *            channel the settings were resolved for
 * @param allowedMimeTypes
 *            attachment MIME types indexed as clips
 * @param matchRegex
 *            optional regex a message's content must match, null for no filter
 * @param enableMessageContentStorage
 *            whether message text is persisted
 * @param scanMode
 *            default scan direction of the channel ({@code forward} or {@code backward})
 * @param values
 *            the full merged map, including keys not modeled above
 * @param settingsHash
 *            MD5 over the key-sorted JSON of {@code values}; clips indexed under a different hash are re-processed
 */
public record ResolvedSettings(String guildId, String channelId, List<String> allowedMimeTypes, String matchRegex,
        boolean enableMessageContentStorage, String scanMode, Map<String, Object> values, String settingsHash) {

    public static final String KEY_ALLOWED_MIME_TYPES = "allowed_mime_types";
    public static final String KEY_MATCH_REGEX = "match_regex";
    public static final String KEY_ENABLE_MESSAGE_CONTENT_STORAGE = "enable_message_content_storage";
    public static final String KEY_SCAN_MODE = "scan_mode";

    public ResolvedSettings {
        allowedMimeTypes = List.copyOf(allowedMimeTypes);
        values = Map.copyOf(values);
    }
}
