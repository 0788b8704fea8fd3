package villagecompute.clipindex.exceptions;

import java.time.Instant;

/**
 * Exception thrown when a channel purge is requested before the channel's purge cooldown has elapsed.
 */
public class PurgeCooldownException extends RuntimeException {

    private final Instant cooldownUntil;

    public PurgeCooldownException(String channelId, Instant cooldownUntil) {
        super("Purge cooldown active for channel " + channelId + " until " + cooldownUntil);
        this.cooldownUntil = cooldownUntil;
    }

    public PurgeCooldownException(String message) {
        super(message);
        this.cooldownUntil = null;
    }

    public PurgeCooldownException(String message, Throwable cause) {
        super(message, cause);
        this.cooldownUntil = null;
    }

    public Instant getCooldownUntil() {
        return cooldownUntil;
    }
}
