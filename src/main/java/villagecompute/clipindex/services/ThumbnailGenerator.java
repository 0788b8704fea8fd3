package villagecompute.clipindex.services;

import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.clipindex.data.models.Thumbnail;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Renders WebP thumbnails of a video with the {@code ffmpeg} binary.
 *
 * <p>
 * The video is downloaded to a temporary file, a frame is taken one second in (the first frame for shorter videos),
 * scaled to fit each {@link Thumbnail.SizeType} and padded to its exact dimensions.
 */
@ApplicationScoped
public class ThumbnailGenerator {

    private static final Logger LOG = Logger.getLogger(ThumbnailGenerator.class);

    private static final Duration DOWNLOAD_TIMEOUT = Duration.ofMinutes(5);

    @ConfigProperty(
            name = "clipindex.thumbnails.ffmpeg-path",
            defaultValue = "ffmpeg")
    String ffmpegPath;

    @ConfigProperty(
            name = "clipindex.thumbnails.frame-offset",
            defaultValue = "1s")
    Duration frameOffset;

    @ConfigProperty(
            name = "clipindex.thumbnails.webp-quality",
            defaultValue = "80")
    int webpQuality;

    @ConfigProperty(
            name = "clipindex.thumbnails.ffmpeg-timeout",
            defaultValue = "60s")
    Duration ffmpegTimeout;

    private final HttpClient httpClient = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10))
            .followRedirects(HttpClient.Redirect.NORMAL).build();

    /**
     * Downloads {@code videoUrl} and renders one WebP image per size.
     *
     * @throws IOException
     *             if the download or ffmpeg fails
     */
    public Map<Thumbnail.SizeType, byte[]> generate(String videoUrl) throws IOException, InterruptedException {
        Path workDir = Files.createTempDirectory("clip-thumb");
        Path video = workDir.resolve("source");
        try {
            download(videoUrl, video);
            Map<Thumbnail.SizeType, byte[]> images = new EnumMap<>(Thumbnail.SizeType.class);
            for (Thumbnail.SizeType size : Thumbnail.SizeType.values()) {
                Path output = workDir.resolve(size.suffix() + ".webp");
                if (!render(video, output, size, frameOffset)) {
                    LOG.debugf("No frame at %ss, falling back to the first frame", frameOffset.toSeconds());
                    if (!render(video, output, size, Duration.ZERO)) {
                        throw new IOException("ffmpeg produced no " + size.suffix() + " thumbnail");
                    }
                }
                images.put(size, Files.readAllBytes(output));
            }
            return images;
        } finally {
            deleteQuietly(workDir);
        }
    }

    private void download(String url, Path target) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder().uri(URI.create(url)).timeout(DOWNLOAD_TIMEOUT).GET().build();
        HttpResponse<Path> response = httpClient.send(request, HttpResponse.BodyHandlers.ofFile(target));
        if (response.statusCode() != 200) {
            throw new IOException("Video download returned status " + response.statusCode());
        }
    }

    private boolean render(Path video, Path output, Thumbnail.SizeType size, Duration offset)
            throws IOException, InterruptedException {
        int w = size.getWidth();
        int h = size.getHeight();
        List<String> command = new ArrayList<>(List.of(ffmpegPath, "-y", "-loglevel", "error", "-ss",
                String.valueOf(offset.toMillis() / 1000.0), "-i", video.toString(), "-frames:v", "1", "-vf",
                "scale=" + w + ":" + h + ":force_original_aspect_ratio=decrease,pad=" + w + ":" + h
                        + ":(ow-iw)/2:(oh-ih)/2",
                "-c:v", "libwebp", "-quality", String.valueOf(webpQuality), output.toString()));

        Process process = new ProcessBuilder(command).redirectErrorStream(true).start();
        if (!process.waitFor(ffmpegTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
            process.destroyForcibly();
            throw new IOException("ffmpeg timed out after " + ffmpegTimeout.toSeconds() + "s");
        }
        String log = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
        if (process.exitValue() != 0) {
            throw new IOException("ffmpeg exited with " + process.exitValue() + ": " + log.strip());
        }
        return Files.exists(output) && Files.size(output) > 0;
    }

    private static void deleteQuietly(Path dir) {
        try (var paths = Files.walk(dir)) {
            paths.sorted((a, b) -> b.getNameCount() - a.getNameCount()).forEach(path -> path.toFile().delete());
        } catch (IOException e) {
            LOG.warnf("Failed to clean up %s: %s", dir, e.getMessage());
        }
    }
}
