package villagecompute.clipindex.integration.discord;

import java.util.Locale;
import java.util.Optional;

/**
 * Direction a scan walks a channel's history.
 */
public enum ScanDirection {

    /**
     * Oldest to newest, after the cursor.
     */
    FORWARD("forward", "after"),

    /**
     * Newest to oldest, before the cursor (from the newest message when there is none).
     */
    BACKWARD("backward", "before");

    private final String wireName;
    private final String cursorParameter;

    ScanDirection(String wireName, String cursorParameter) {
        this.wireName = wireName;
        this.cursorParameter = cursorParameter;
    }

    public String getWireName() {
        return wireName;
    }

    /**
     * Query parameter carrying the cursor on the message history endpoint.
     */
    public String getCursorParameter() {
        return cursorParameter;
    }

    public static Optional<ScanDirection> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ScanDirection direction : values()) {
            if (direction.wireName.equals(normalized)) {
                return Optional.of(direction);
            }
        }
        return Optional.empty();
    }
}
