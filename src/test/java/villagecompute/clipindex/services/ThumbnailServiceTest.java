package villagecompute.clipindex.services;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class ThumbnailServiceTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    void testNextRetryAt_followsBackoffSchedule() {
        assertEquals(NOW.plus(Duration.ofMinutes(5)), ThumbnailService.nextRetryAt(1, NOW));
        assertEquals(NOW.plus(Duration.ofMinutes(15)), ThumbnailService.nextRetryAt(2, NOW));
        assertEquals(NOW.plus(Duration.ofHours(1)), ThumbnailService.nextRetryAt(3, NOW));
        assertEquals(NOW.plus(Duration.ofHours(24)), ThumbnailService.nextRetryAt(6, NOW));
    }

    @Test
    void testNextRetryAt_nullWhenScheduleExhausted() {
        assertNull(ThumbnailService.nextRetryAt(7, NOW));
        assertNull(ThumbnailService.nextRetryAt(0, NOW));
    }
}
