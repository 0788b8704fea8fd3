package villagecompute.clipindex.services;

import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process cancellation flags polled by running scans between batches.
 *
 * <p>
 * Cancellation is cooperative: a purge raises a flag for the channel or guild, and the scan handler checks
 * {@link #isCancelled} before each page so it never stops in the middle of a batch write. Scans running on another
 * worker process notice the cancellation through the persisted status instead (see
 * {@link ScanStateService#recordProgress}).
 *
 * <p>
 * A shutdown request cancels everything so in-flight scans stop at their next checkpoint.
 */
@ApplicationScoped
public class ScanCancellationRegistry {

    private static final Logger LOG = Logger.getLogger(ScanCancellationRegistry.class);

    /**
     * Flags older than this are dropped; no scan lives long enough to still need them.
     */
    private static final Duration FLAG_TTL = Duration.ofHours(1);

    private final Map<String, Instant> cancelledChannels = new ConcurrentHashMap<>();
    private final Map<String, Instant> cancelledGuilds = new ConcurrentHashMap<>();

    private volatile boolean shuttingDown;

    public void cancelChannel(String channelId) {
        cancelledChannels.put(channelId, Instant.now());
        LOG.infof("Cancellation requested for channel %s", channelId);
    }

    public void cancelGuild(String guildId) {
        cancelledGuilds.put(guildId, Instant.now());
        LOG.infof("Cancellation requested for guild %s", guildId);
    }

    /**
     * Returns true when the scan of {@code channelId} should stop at the next checkpoint.
     *
     * @param scanStartedAt
     *            when the asking scan started; flags raised before that belong to an earlier scan
     */
    public boolean isCancelled(String guildId, String channelId, Instant scanStartedAt) {
        if (shuttingDown) {
            return true;
        }
        return raisedSince(cancelledChannels.get(channelId), scanStartedAt)
                || raisedSince(cancelledGuilds.get(guildId), scanStartedAt);
    }

    public void requestShutdown() {
        shuttingDown = true;
    }

    public boolean isShuttingDown() {
        return shuttingDown;
    }

    /**
     * Drops expired flags.
     */
    public void evictExpired() {
        Instant cutoff = Instant.now().minus(FLAG_TTL);
        cancelledChannels.values().removeIf(raisedAt -> raisedAt.isBefore(cutoff));
        cancelledGuilds.values().removeIf(raisedAt -> raisedAt.isBefore(cutoff));
    }

    private static boolean raisedSince(Instant raisedAt, Instant scanStartedAt) {
        return raisedAt != null && !raisedAt.isBefore(scanStartedAt);
    }
}
