package villagecompute.clipindex.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Scan statuses of every channel of a guild with a polling hint.
 *
 * @param statuses
 *            one entry per channel that has ever been scanned
 * @param active
 *            true while any scan is PENDING or RUNNING
 * @param pollAfterSeconds
 *            suggested delay before the next poll: short while scans are active, long otherwise
 */
public record GuildScanStatusesType(List<ScanStatusType> statuses, boolean active,
        @JsonProperty("poll_after_seconds") int pollAfterSeconds) {
}
