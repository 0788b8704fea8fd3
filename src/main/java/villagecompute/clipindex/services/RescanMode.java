package villagecompute.clipindex.services;

import java.util.Locale;
import java.util.Optional;

/**
 * How a scan treats messages that are already indexed.
 */
public enum RescanMode {

    /**
     * Halt at the first already-indexed message. Used for routine catch-up.
     */
    STOP("stop"),

    /**
     * Walk the whole requested range but skip writes for indexed messages. Used to fill gaps.
     */
    CONTINUE("continue"),

    /**
     * Re-process every message, rewriting existing clip records. Used after extraction rules change.
     */
    UPDATE("update");

    private final String wireName;

    RescanMode(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public static Optional<RescanMode> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (RescanMode mode : values()) {
            if (mode.wireName.equals(normalized)) {
                return Optional.of(mode);
            }
        }
        return Optional.empty();
    }
}
