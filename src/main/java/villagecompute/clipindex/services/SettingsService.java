package villagecompute.clipindex.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.clipindex.exceptions.ValidationException;

import java.util.Collection;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Validated writes of guild and channel settings. Each successful write invalidates the affected cache entries.
 */
@ApplicationScoped
public class SettingsService {

    private static final Logger LOG = Logger.getLogger(SettingsService.class);

    private static final Set<String> SCAN_MODES = Set.of("forward", "backward");

    @Inject
    SettingsStore settingsStore;

    @Inject
    SettingsResolver settingsResolver;

    public void updateGuildSettings(String guildId, Map<String, Object> defaultChannelSettings,
            Map<String, Object> settings) {
        validate(defaultChannelSettings);
        validate(settings);
        settingsStore.saveGuildSettings(guildId, defaultChannelSettings, settings);
        settingsResolver.invalidateGuild(guildId);
        LOG.infof("Updated guild settings for guild %s", guildId);
    }

    public void updateChannelSettings(String guildId, String channelId, Map<String, Object> settings) {
        validate(settings);
        settingsStore.saveChannelSettings(guildId, channelId, settings);
        settingsResolver.invalidate(guildId, channelId);
        LOG.infof("Updated channel settings for channel %s in guild %s", channelId, guildId);
    }

    static void validate(Map<String, Object> settings) {
        if (settings == null) {
            return;
        }
        Object mimeTypes = settings.get(ResolvedSettings.KEY_ALLOWED_MIME_TYPES);
        if (mimeTypes != null && !(mimeTypes instanceof Collection<?>)) {
            throw new ValidationException("allowed_mime_types must be a list");
        }
        Object regex = settings.get(ResolvedSettings.KEY_MATCH_REGEX);
        if (regex != null) {
            try {
                Pattern.compile(regex.toString());
            } catch (PatternSyntaxException e) {
                throw new ValidationException("match_regex is not a valid pattern: " + e.getDescription(), e);
            }
        }
        Object scanMode = settings.get(ResolvedSettings.KEY_SCAN_MODE);
        if (scanMode != null && !SCAN_MODES.contains(scanMode.toString())) {
            throw new ValidationException("scan_mode must be forward or backward");
        }
    }
}
