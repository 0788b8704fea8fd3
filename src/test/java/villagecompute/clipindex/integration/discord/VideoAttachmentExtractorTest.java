package villagecompute.clipindex.integration.discord;

import org.junit.jupiter.api.Test;
import villagecompute.clipindex.services.ResolvedSettings;
import villagecompute.clipindex.util.ClipIds;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class VideoAttachmentExtractorTest {

    private final VideoAttachmentExtractor extractor = new VideoAttachmentExtractor();

    private static ResolvedSettings settings(String regex) {
        return new ResolvedSettings("g1", "c1", List.of("video/mp4", "video/webm"), regex, true, "backward",
                Map.of(), "hash");
    }

    private static DiscordMessage message(String content, DiscordAttachment... attachments) {
        return new DiscordMessage("111", "c1", new DiscordAuthor("u1", "alice", "0", null), content,
                Instant.parse("2024-01-01T10:00:00Z"), List.of(attachments));
    }

    private static DiscordAttachment attachment(String filename, String contentType) {
        return new DiscordAttachment("a-" + filename, filename, 1000, "https://cdn/" + filename, contentType);
    }

    @Test
    void testExtract_onlyVideoAttachmentsBecomeClips() {
        List<ClipCandidate> clips = extractor.extract(
                message("gg", attachment("clip.mp4", "video/mp4"), attachment("pic.png", "image/png")),
                settings(null));

        assertEquals(1, clips.size());
        assertEquals("clip.mp4", clips.get(0).attachment().filename());
        assertEquals(ClipIds.clipId("111", "c1", "clip.mp4", Instant.parse("2024-01-01T10:00:00Z")),
                clips.get(0).clipId());
    }

    @Test
    void testIsVideo_extensionFallbackWhenContentTypeMissing() {
        assertTrue(VideoAttachmentExtractor.isVideo(attachment("OLD.MOV", null), List.of("video/mp4")));
        assertTrue(VideoAttachmentExtractor.isVideo(attachment("x.mkv", "application/octet-stream"),
                List.of("video/mp4")));
        assertFalse(VideoAttachmentExtractor.isVideo(attachment("notes.txt", null), List.of("video/mp4")));
    }

    @Test
    void testIsVideo_contentTypeMatchIgnoresCase() {
        assertTrue(VideoAttachmentExtractor.isVideo(attachment("clip", "Video/WebM"), List.of("video/webm")));
    }

    @Test
    void testExtract_regexFiltersByContent() {
        DiscordMessage tagged = message("new #highlight", attachment("clip.mp4", "video/mp4"));
        DiscordMessage untagged = message("just chatting", attachment("clip.mp4", "video/mp4"));
        DiscordMessage empty = message(null, attachment("clip.mp4", "video/mp4"));

        assertEquals(1, extractor.extract(tagged, settings("#highlight")).size());
        assertTrue(extractor.extract(untagged, settings("#highlight")).isEmpty());
        assertTrue(extractor.extract(empty, settings("#highlight")).isEmpty());
    }

    @Test
    void testExtract_noAttachments() {
        assertTrue(extractor.extract(message("hello"), settings(null)).isEmpty());
    }
}
