package villagecompute.clipindex.exceptions;

/**
 * Exception thrown when scan output is about to be written for a channel whose scan is no longer RUNNING, typically
 * because a purge or stop request cancelled it.
 */
public class ScanNotRunningException extends RuntimeException {

    private final String channelId;

    public ScanNotRunningException(String channelId) {
        super("Scan of channel " + channelId + " is no longer running");
        this.channelId = channelId;
    }

    public String getChannelId() {
        return channelId;
    }
}
