package villagecompute.clipindex.exceptions;

/**
 * Exception signalling that the source message of a clip no longer exists on the chat platform.
 *
 * <p>
 * This is terminal for the affected clip: callers clean up the stored clip instead of retrying.
 */
public class MessageDeletedException extends RuntimeException {

    private final String channelId;
    private final String messageId;

    public MessageDeletedException(String channelId, String messageId) {
        super("Message " + messageId + " in channel " + channelId + " was deleted");
        this.channelId = channelId;
        this.messageId = messageId;
    }

    public MessageDeletedException(String message) {
        super(message);
        this.channelId = null;
        this.messageId = null;
    }

    public MessageDeletedException(String message, Throwable cause) {
        super(message, cause);
        this.channelId = null;
        this.messageId = null;
    }

    public String getChannelId() {
        return channelId;
    }

    public String getMessageId() {
        return messageId;
    }
}
