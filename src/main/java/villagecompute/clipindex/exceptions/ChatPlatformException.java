package villagecompute.clipindex.exceptions;

/**
 * Exception thrown when a chat platform API call fails for a reason other than rate limiting or a deleted message
 * (5xx after retries, unexpected status, unreadable body).
 */
public class ChatPlatformException extends RuntimeException {

    private final int statusCode;

    public ChatPlatformException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public ChatPlatformException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /**
     * HTTP status of the failed call, or -1 when the request never produced a response.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
