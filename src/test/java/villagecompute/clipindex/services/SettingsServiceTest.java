package villagecompute.clipindex.services;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import villagecompute.clipindex.exceptions.ValidationException;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for {@link SettingsService}.
 */
class SettingsServiceTest {

    @Mock
    SettingsStore settingsStore;

    @Mock
    SettingsResolver settingsResolver;

    @InjectMocks
    SettingsService settingsService;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
    }

    @Test
    void testUpdateChannelSettings_invalidatesAfterSave() {
        Map<String, Object> settings = Map.of("scan_mode", "forward");

        settingsService.updateChannelSettings("g1", "c1", settings);

        verify(settingsStore).saveChannelSettings("g1", "c1", settings);
        verify(settingsResolver).invalidate("g1", "c1");
    }

    @Test
    void testUpdateGuildSettings_invalidatesWholeGuild() {
        settingsService.updateGuildSettings("g1", Map.of("match_regex", "clip"), Map.of());

        verify(settingsResolver).invalidateGuild("g1");
    }

    @Test
    void testUpdateChannelSettings_invalidRegexRejected() {
        assertThrows(ValidationException.class,
                () -> settingsService.updateChannelSettings("g1", "c1", Map.of("match_regex", "(unclosed")));

        verify(settingsStore, never()).saveChannelSettings(anyString(), anyString(), any());
        verify(settingsResolver, never()).invalidate(anyString(), anyString());
    }

    @Test
    void testUpdateChannelSettings_unknownScanModeRejected() {
        assertThrows(ValidationException.class,
                () -> settingsService.updateChannelSettings("g1", "c1", Map.of("scan_mode", "sideways")));
    }

    @Test
    void testUpdateGuildSettings_mimeTypesMustBeList() {
        assertThrows(ValidationException.class,
                () -> settingsService.updateGuildSettings("g1", Map.of("allowed_mime_types", "video/mp4"), null));
    }
}
