package villagecompute.clipindex.util;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;

/**
 * Helpers for signed attachment CDN URLs.
 *
 * <p>
 * Signed URLs carry their expiry as a hex unix timestamp in the {@code ex} query parameter.
 */
public final class CdnUrls {

    /**
     * Assumed lifetime of a URL without a readable {@code ex} parameter.
     */
    public static final Duration DEFAULT_LIFETIME = Duration.ofHours(24);

    private CdnUrls() {
    }

    /**
     * Expiry encoded in {@code url}, or {@code now + 24h} when the URL has no parseable {@code ex} parameter.
     */
    public static Instant expiresAt(String url, Instant now) {
        String ex = queryParam(url, "ex");
        if (ex != null) {
            try {
                return Instant.ofEpochSecond(Long.parseLong(ex, 16));
            } catch (NumberFormatException e) {
                // not hex, fall through to default
            }
        }
        return now.plus(DEFAULT_LIFETIME);
    }

    static String queryParam(String url, String name) {
        if (url == null) {
            return null;
        }
        String query;
        try {
            query = URI.create(url).getRawQuery();
        } catch (IllegalArgumentException e) {
            return null;
        }
        if (query == null) {
            return null;
        }
        for (String pair : query.split("&")) {
            int eq = pair.indexOf('=');
            if (eq > 0 && pair.substring(0, eq).equals(name)) {
                return pair.substring(eq + 1);
            }
        }
        return null;
    }
}
