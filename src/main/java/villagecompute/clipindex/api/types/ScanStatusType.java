package villagecompute.clipindex.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import villagecompute.clipindex.services.ScanStateService.ScanStatusView;

import java.time.Instant;

/**
 * Scan progress of one channel as returned to pollers.
 *
 * @param channelId
 *            channel snowflake
 * @param status
 *            PENDING, RUNNING, SUCCEEDED, FAILED or CANCELLED
 * @param messageCount
 *            messages that produced at least one clip
 * @param totalMessagesScanned
 *            messages walked across all scans of the channel
 * @param updatedAt
 *            last transition or progress update
 * @param errorMessage
 *            reason of the last failure or cancellation, null otherwise
 */
public record ScanStatusType(@JsonProperty("channel_id") String channelId, String status,
        @JsonProperty("message_count") long messageCount,
        @JsonProperty("total_messages_scanned") long totalMessagesScanned, @JsonProperty("updated_at") Instant updatedAt,
        @JsonProperty("error_message") String errorMessage) {

    public static ScanStatusType from(ScanStatusView view) {
        return new ScanStatusType(view.channelId(), view.status().name(), view.messageCount(),
                view.totalMessagesScanned(), view.updatedAt(), view.errorMessage());
    }
}
