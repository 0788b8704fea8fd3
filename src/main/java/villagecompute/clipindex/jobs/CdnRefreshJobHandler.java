package villagecompute.clipindex.jobs;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.clipindex.exceptions.ValidationException;
import villagecompute.clipindex.services.CdnRefreshService;
import villagecompute.clipindex.services.CdnRefreshService.RefreshResult;

import java.util.List;
import java.util.Map;

/**
 * Refreshes expired attachment URLs of clips. Clips whose source message was deleted are removed.
 *
 * <p>
 * <b>Payload:</b> {@code {"guild_id": "...", "clip_ids": ["...", ...]}}
 */
@ApplicationScoped
public class CdnRefreshJobHandler implements JobHandler {

    @Inject
    CdnRefreshService cdnRefreshService;

    @Inject
    Tracer tracer;

    @Override
    public JobType handlesType() {
        return JobType.CDN_REFRESH;
    }

    @Override
    public void execute(Long jobId, Map<String, Object> payload) {
        JobPayload job = JobPayload.of(payload);
        String guildId = job.requireString(JobPayload.GUILD_ID);
        List<String> clipIds = job.stringList(JobPayload.CLIP_IDS);
        if (clipIds.isEmpty()) {
            throw new ValidationException("CDN refresh job has no clip_ids");
        }

        Span span = tracer.spanBuilder("job.cdn_refresh").setAttribute("job.id", jobId)
                .setAttribute("guild.id", guildId).setAttribute("clips.requested", clipIds.size()).startSpan();
        try (Scope scope = span.makeCurrent()) {
            RefreshResult result = cdnRefreshService.refresh(clipIds);
            span.setAttribute("clips.refreshed", result.refreshed());
            span.setAttribute("clips.deleted", result.deleted());
        } finally {
            span.end();
        }
    }
}
