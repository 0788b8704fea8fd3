package villagecompute.clipindex.exceptions;

/**
 * Exception thrown when a guild, channel or clip cannot be found (or has been soft-deleted).
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public ResourceNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
