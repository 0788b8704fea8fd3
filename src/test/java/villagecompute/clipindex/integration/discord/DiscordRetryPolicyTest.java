package villagecompute.clipindex.integration.discord;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DiscordRetryPolicyTest {

    private DiscordRetryPolicy policy;

    @BeforeEach
    void setUp() {
        policy = new DiscordRetryPolicy();
        policy.maxRetries = 3;
        policy.baseDelay = Duration.ofSeconds(1);
        policy.maxDelay = Duration.ofSeconds(10);
        policy.jitterSource = () -> 0.0;
    }

    @Test
    void testIsRetryable_onlyRateLimitAndServerErrors() {
        assertTrue(policy.isRetryable(429));
        assertTrue(policy.isRetryable(500));
        assertTrue(policy.isRetryable(503));
        assertFalse(policy.isRetryable(400));
        assertFalse(policy.isRetryable(403));
        assertFalse(policy.isRetryable(404));
        assertFalse(policy.isRetryable(200));
    }

    @Test
    void testCanRetry_boundedByMaxRetries() {
        assertTrue(policy.canRetry(2));
        assertFalse(policy.canRetry(3));
    }

    @Test
    void testDelayFor_exponentialAndCapped() {
        assertEquals(Duration.ofSeconds(1), policy.delayFor(1, null));
        assertEquals(Duration.ofSeconds(4), policy.delayFor(3, null));
        assertEquals(Duration.ofSeconds(10), policy.delayFor(6, null));
    }

    @Test
    void testDelayFor_jitterAddsUpToHalf() {
        policy.jitterSource = () -> 1.0;

        assertEquals(Duration.ofMillis(3000), policy.delayFor(2, null));
    }

    @Test
    void testDelayFor_retryAfterHintPlusBuffer() {
        assertEquals(Duration.ofMillis(2500), policy.delayFor(1, Duration.ofSeconds(2)));
    }
}
