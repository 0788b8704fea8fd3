package villagecompute.clipindex.integration.discord;

import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Retry rules for platform API calls.
 *
 * <p>
 * Only 429 and 5xx responses are retried. A rate limit response with a {@code retry_after} hint waits that long plus
 * half a second; everything else waits {@code min(base * 2^(attempt-1), max)} plus up to 50% random jitter.
 */
@ApplicationScoped
public class DiscordRetryPolicy {

    static final Duration RETRY_AFTER_BUFFER = Duration.ofMillis(500);

    @ConfigProperty(
            name = "clipindex.discord.max-retries",
            defaultValue = "3")
    int maxRetries;

    @ConfigProperty(
            name = "clipindex.discord.retry-base-delay",
            defaultValue = "1s")
    Duration baseDelay;

    @ConfigProperty(
            name = "clipindex.discord.retry-max-delay",
            defaultValue = "10s")
    Duration maxDelay;

    DoubleSupplier jitterSource = () -> ThreadLocalRandom.current().nextDouble();

    public boolean isRetryable(int statusCode) {
        return statusCode == 429 || (statusCode >= 500 && statusCode < 600);
    }

    public boolean canRetry(int retriesSoFar) {
        return retriesSoFar < maxRetries;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    /**
     * Delay before retry number {@code attempt} (1-based).
     *
     * @param retryAfter
     *            server-provided wait, or null
     */
    public Duration delayFor(int attempt, Duration retryAfter) {
        if (retryAfter != null) {
            return retryAfter.plus(RETRY_AFTER_BUFFER);
        }
        long base = baseDelay.toMillis() * (1L << Math.min(attempt - 1, 20));
        long capped = Math.min(base, maxDelay.toMillis());
        long jitter = (long) (capped * 0.5 * jitterSource.getAsDouble());
        return Duration.ofMillis(capped + jitter);
    }
}
