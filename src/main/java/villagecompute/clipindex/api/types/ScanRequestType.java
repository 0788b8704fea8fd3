package villagecompute.clipindex.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import villagecompute.clipindex.exceptions.ValidationException;
import villagecompute.clipindex.integration.discord.ScanDirection;
import villagecompute.clipindex.services.JobEnqueueService.ScanRequest;
import villagecompute.clipindex.services.RescanMode;

/**
 * Body of a scan request. Every field is optional.
 *
 * @param direction
 *            {@code forward} or {@code backward}; defaults to the channel's {@code scan_mode} setting
 * @param limit
 *            messages per chunk, clamped to 1..10000
 * @param autoContinue
 *            requeue follow-up chunks until history is exhausted
 * @param rescan
 *            {@code stop}, {@code continue} or {@code update}
 * @param cursorMessageId
 *            start after (forward) or before (backward) this message
 * @param historical
 *            scan backward from the newest message regardless of stored cursors
 */
public record ScanRequestType(String direction, Integer limit, @JsonProperty("auto_continue") Boolean autoContinue,
        String rescan, @JsonProperty("cursor_message_id") String cursorMessageId, Boolean historical) {

    /**
     * Converts to a service request.
     *
     * @throws ValidationException
     *             if direction or rescan is not a known value
     */
    public ScanRequest toRequest(String guildId, String channelId) {
        ScanDirection parsedDirection = direction == null ? null
                : ScanDirection.fromWireName(direction)
                        .orElseThrow(() -> new ValidationException("Unknown scan direction: " + direction));
        RescanMode parsedRescan = rescan == null ? null
                : RescanMode.fromWireName(rescan)
                        .orElseThrow(() -> new ValidationException("Unknown rescan mode: " + rescan));
        return new ScanRequest(guildId, channelId, parsedDirection, limit, autoContinue, parsedRescan, cursorMessageId,
                Boolean.TRUE.equals(historical));
    }
}
