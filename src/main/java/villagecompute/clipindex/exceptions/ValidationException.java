package villagecompute.clipindex.exceptions;

/**
 * Exception thrown when input validation fails (malformed job payload, unknown job type, scanning disabled for a
 * channel).
 *
 * <p>
 * When raised from a job handler the dispatcher dead-letters the job instead of retrying it.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
