package villagecompute.clipindex.util;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Deterministic clip identifiers.
 *
 * <p>
 * A clip id is the MD5 of {@code message_id:channel_id:filename:timestamp}, where the timestamp is the message time
 * rendered as {@code yyyy-MM-ddTHH:mm:ss[.SSSSSS]+00:00}: seconds always, microseconds only when non-zero. Ids
 * therefore survive rescans and match ids produced by earlier indexer versions.
 */
public final class ClipIds {

    private static final DateTimeFormatter SECONDS = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    private ClipIds() {
    }

    public static String clipId(String messageId, String channelId, String filename, Instant messageTimestamp) {
        return Digests.md5Hex(messageId + ":" + channelId + ":" + filename + ":" + isoTimestamp(messageTimestamp));
    }

    /**
     * Renders {@code timestamp} in UTC with a {@code +00:00} offset and optional 6-digit fraction.
     */
    public static String isoTimestamp(Instant timestamp) {
        OffsetDateTime utc = timestamp.atOffset(ZoneOffset.UTC);
        StringBuilder out = new StringBuilder(SECONDS.format(utc));
        int micros = utc.getNano() / 1_000;
        if (micros != 0) {
            out.append('.').append(String.format("%06d", micros));
        }
        return out.append("+00:00").toString();
    }
}
