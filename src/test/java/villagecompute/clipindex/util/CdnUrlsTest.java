package villagecompute.clipindex.util;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class CdnUrlsTest {

    private static final Instant NOW = Instant.parse("2024-01-12T00:00:00Z");

    @Test
    void testExpiresAt_readsHexExParameter() {
        String url = "https://cdn.discordapp.com/attachments/1/2/clip.mp4?ex=65a0b2c0&is=659f6140&hm=abc";

        assertEquals(Instant.ofEpochSecond(1705030336L), CdnUrls.expiresAt(url, NOW));
    }

    @Test
    void testExpiresAt_defaultsWithoutParameter() {
        assertEquals(NOW.plus(CdnUrls.DEFAULT_LIFETIME),
                CdnUrls.expiresAt("https://cdn.discordapp.com/attachments/1/2/clip.mp4", NOW));
    }

    @Test
    void testExpiresAt_defaultsOnGarbage() {
        assertEquals(NOW.plus(CdnUrls.DEFAULT_LIFETIME), CdnUrls.expiresAt("https://cdn/x.mp4?ex=zz", NOW));
        assertEquals(NOW.plus(CdnUrls.DEFAULT_LIFETIME), CdnUrls.expiresAt(null, NOW));
    }

    @Test
    void testQueryParam_missingName() {
        assertNull(CdnUrls.queryParam("https://cdn/x.mp4?is=1", "ex"));
    }
}
