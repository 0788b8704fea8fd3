package villagecompute.clipindex.exceptions;

import java.time.Duration;

/**
 * Exception thrown when the chat platform keeps answering HTTP 429 after the client exhausted its retries.
 *
 * <p>
 * Treated as a transient failure: the job is returned to the queue and redelivered after a backoff delay.
 */
public class RateLimitException extends RuntimeException {

    private final Duration retryAfter;

    public RateLimitException(String message) {
        this(message, Duration.ZERO);
    }

    public RateLimitException(String message, Duration retryAfter) {
        super(message);
        this.retryAfter = retryAfter;
    }

    public RateLimitException(String message, Throwable cause) {
        super(message, cause);
        this.retryAfter = Duration.ZERO;
    }

    /**
     * Delay suggested by the last 429 response, or zero when unknown.
     */
    public Duration getRetryAfter() {
        return retryAfter;
    }
}
