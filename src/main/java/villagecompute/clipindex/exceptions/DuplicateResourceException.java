package villagecompute.clipindex.exceptions;

/**
 * Exception thrown when a request would create a second instance of something that must be unique, such as a second
 * active scan for a channel.
 *
 * <p>
 * Extends RuntimeException per project standards. Typically mapped to HTTP 409 Conflict by the caller.
 */
public class DuplicateResourceException extends RuntimeException {

    public DuplicateResourceException(String message) {
        super(message);
    }

    public DuplicateResourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
