package villagecompute.clipindex.jobs;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.clipindex.exceptions.ValidationException;
import villagecompute.clipindex.services.ThumbnailService;

import java.util.List;
import java.util.Map;

/**
 * Generates small and large thumbnails for newly indexed clips.
 *
 * <p>
 * Per-clip failures are recorded for the retry schedule by {@link ThumbnailService} and do not fail the job.
 *
 * <p>
 * <b>Payload:</b> {@code {"guild_id": "...", "clip_ids": ["...", ...]}}
 */
@ApplicationScoped
public class ThumbnailGenerateJobHandler implements JobHandler {

    private static final Logger LOG = Logger.getLogger(ThumbnailGenerateJobHandler.class);

    @Inject
    ThumbnailService thumbnailService;

    @Inject
    Tracer tracer;

    @Override
    public JobType handlesType() {
        return JobType.THUMBNAIL_GENERATE;
    }

    @Override
    public void execute(Long jobId, Map<String, Object> payload) {
        JobPayload job = JobPayload.of(payload);
        String guildId = job.requireString(JobPayload.GUILD_ID);
        List<String> clipIds = job.stringList(JobPayload.CLIP_IDS);
        if (clipIds.isEmpty()) {
            throw new ValidationException("Thumbnail job has no clip_ids");
        }

        Span span = tracer.spanBuilder("job.thumbnail_generate").setAttribute("job.id", jobId)
                .setAttribute("guild.id", guildId).setAttribute("clips.requested", clipIds.size()).startSpan();
        try (Scope scope = span.makeCurrent()) {
            int generated = thumbnailService.generate(clipIds);
            span.setAttribute("clips.generated", generated);
            LOG.infof("Thumbnail job %d generated %d of %d clips", jobId, generated, clipIds.size());
        } finally {
            span.end();
        }
    }
}
