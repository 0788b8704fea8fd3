package villagecompute.clipindex.services;

import villagecompute.clipindex.data.models.ChannelScanStatus;

import java.math.BigInteger;
import java.util.Optional;

/**
 * The stretch of a channel's history that earlier scans already walked, bounded by the persisted backward and forward
 * cursors (both inclusive).
 *
 * <p>
 * Only messages that carried clips are stored, so a stored-row lookup alone cannot tell a walked message without clips
 * from one never seen. Snowflake ids are compared numerically.
 */
public record ScannedRange(String oldestMessageId, String newestMessageId) {

    public static final ScannedRange NONE = new ScannedRange(null, null);

    /**
     * Range of a channel's scan row; {@link #NONE} until both cursors are set.
     */
    public static ScannedRange of(Optional<ChannelScanStatus> status) {
        if (status.isEmpty() || status.get().backwardCursorMessageId == null
                || status.get().forwardCursorMessageId == null) {
            return NONE;
        }
        return new ScannedRange(status.get().backwardCursorMessageId, status.get().forwardCursorMessageId);
    }

    public boolean isEmpty() {
        return oldestMessageId == null || newestMessageId == null;
    }

    public boolean contains(String messageId) {
        if (isEmpty() || messageId == null) {
            return false;
        }
        BigInteger id = new BigInteger(messageId);
        return id.compareTo(new BigInteger(oldestMessageId)) >= 0 && id.compareTo(new BigInteger(newestMessageId)) <= 0;
    }
}
