package villagecompute.clipindex.services;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.clipindex.util.Digests;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves the effective settings of a channel with a TTL cache in front of the settings store.
 *
 * <p>
 * <b>Merge order:</b> built-in defaults, then the guild's {@code default_channel_settings}, then guild
 * {@code settings}, then the channel's own settings. Later layers win per key.
 *
 * <p>
 * <b>Caching:</b> entries are keyed by {@code guildId:channelId} and expire after {@code clipindex.settings.cache-ttl}.
 * Loads go through {@link Cache#get}, so concurrent misses for the same key share a single store read. Writers call
 * {@link #invalidate} or {@link #invalidateGuild} after a successful update; other processes converge within one TTL.
 */
@ApplicationScoped
public class SettingsResolver {

    private static final Logger LOG = Logger.getLogger(SettingsResolver.class);

    static final List<String> DEFAULT_ALLOWED_MIME_TYPES = List.of("video/mp4", "video/quicktime", "video/webm",
            "video/x-msvideo");
    static final String DEFAULT_SCAN_MODE = "backward";

    @Inject
    SettingsStore settingsStore;

    @Inject
    ObjectMapper objectMapper;

    @ConfigProperty(
            name = "clipindex.settings.cache-ttl",
            defaultValue = "300s")
    Duration cacheTtl;

    @ConfigProperty(
            name = "clipindex.settings.cache-max-size",
            defaultValue = "10000")
    long cacheMaxSize;

    private Cache<String, ResolvedSettings> cache;

    @PostConstruct
    void init() {
        cache = Caffeine.newBuilder().expireAfterWrite(cacheTtl).maximumSize(cacheMaxSize).recordStats().build();
    }

    /**
     * Returns the effective settings, loading them at most once per key and TTL window.
     */
    public ResolvedSettings getEffectiveSettings(String guildId, String channelId) {
        return getEffectiveSettings(guildId, channelId, false);
    }

    /**
     * Returns the effective settings.
     *
     * @param bypassCache
     *            reads the store directly and refreshes the cached entry
     */
    public ResolvedSettings getEffectiveSettings(String guildId, String channelId, boolean bypassCache) {
        String key = cacheKey(guildId, channelId);
        if (bypassCache) {
            ResolvedSettings fresh = load(guildId, channelId);
            cache.put(key, fresh);
            return fresh;
        }
        return cache.get(key, k -> load(guildId, channelId));
    }

    public void invalidate(String guildId, String channelId) {
        cache.invalidate(cacheKey(guildId, channelId));
    }

    /**
     * Drops every cached channel of the guild, used after guild-level settings change.
     */
    public void invalidateGuild(String guildId) {
        String prefix = guildId + ":";
        List<String> keys = cache.asMap().keySet().stream().filter(k -> k.startsWith(prefix)).toList();
        cache.invalidateAll(keys);
        LOG.debugf("Invalidated %d cached settings entries for guild %s", keys.size(), guildId);
    }

    public void clear() {
        cache.invalidateAll();
    }

    public CacheStats stats() {
        return cache.stats();
    }

    public long size() {
        return cache.estimatedSize();
    }

    private ResolvedSettings load(String guildId, String channelId) {
        SettingsStore.SettingsLayers layers = settingsStore.load(guildId, channelId);
        Map<String, Object> merged = defaults();
        merged.putAll(layers.guildDefaults());
        merged.putAll(layers.guildSettings());
        merged.putAll(layers.channelSettings());
        return new ResolvedSettings(guildId, channelId, mimeTypes(merged.get(ResolvedSettings.KEY_ALLOWED_MIME_TYPES)),
                stringOrNull(merged.get(ResolvedSettings.KEY_MATCH_REGEX)),
                booleanOr(merged.get(ResolvedSettings.KEY_ENABLE_MESSAGE_CONTENT_STORAGE), true),
                stringOr(merged.get(ResolvedSettings.KEY_SCAN_MODE), DEFAULT_SCAN_MODE),
                withoutNulls(merged), hash(merged));
    }

    static Map<String, Object> defaults() {
        Map<String, Object> defaults = new LinkedHashMap<>();
        defaults.put(ResolvedSettings.KEY_ALLOWED_MIME_TYPES, DEFAULT_ALLOWED_MIME_TYPES);
        defaults.put(ResolvedSettings.KEY_MATCH_REGEX, null);
        defaults.put(ResolvedSettings.KEY_ENABLE_MESSAGE_CONTENT_STORAGE, true);
        defaults.put(ResolvedSettings.KEY_SCAN_MODE, DEFAULT_SCAN_MODE);
        return defaults;
    }

    String hash(Map<String, Object> merged) {
        try {
            String json = objectMapper.writer().with(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                    .writeValueAsString(merged);
            return Digests.md5Hex(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize settings for hashing", e);
        }
    }

    private static List<String> mimeTypes(Object value) {
        if (value instanceof Collection<?> items) {
            List<String> types = new ArrayList<>();
            for (Object item : items) {
                if (item != null) {
                    types.add(item.toString().toLowerCase());
                }
            }
            return types;
        }
        return DEFAULT_ALLOWED_MIME_TYPES;
    }

    private static String stringOrNull(Object value) {
        return value == null || value.toString().isBlank() ? null : value.toString();
    }

    private static String stringOr(Object value, String fallback) {
        String s = stringOrNull(value);
        return s == null ? fallback : s;
    }

    private static boolean booleanOr(Object value, boolean fallback) {
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof String s) {
            return Boolean.parseBoolean(s);
        }
        return fallback;
    }

    private static Map<String, Object> withoutNulls(Map<String, Object> merged) {
        Map<String, Object> copy = new LinkedHashMap<>();
        merged.forEach((k, v) -> {
            if (v != null) {
                copy.put(k, v);
            }
        });
        return copy;
    }

    private static String cacheKey(String guildId, String channelId) {
        return guildId + ":" + channelId;
    }
}
