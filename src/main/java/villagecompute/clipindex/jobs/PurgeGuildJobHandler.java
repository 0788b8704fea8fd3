package villagecompute.clipindex.jobs;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.clipindex.services.PurgeCoordinator;
import villagecompute.clipindex.services.PurgeCoordinator.PurgeResult;

import java.util.Map;

/**
 * Deletes all indexed data of a guild, soft-deletes it and leaves it.
 *
 * <p>
 * <b>Payload:</b> {@code {"guild_id": "..."}}
 */
@ApplicationScoped
public class PurgeGuildJobHandler implements JobHandler {

    @Inject
    PurgeCoordinator purgeCoordinator;

    @Inject
    Tracer tracer;

    @Override
    public JobType handlesType() {
        return JobType.PURGE_GUILD;
    }

    @Override
    public void execute(Long jobId, Map<String, Object> payload) {
        String guildId = JobPayload.of(payload).requireString(JobPayload.GUILD_ID);

        Span span = tracer.spanBuilder("job.purge_guild").setAttribute("job.id", jobId)
                .setAttribute("guild.id", guildId).startSpan();
        try (Scope scope = span.makeCurrent()) {
            PurgeResult result = purgeCoordinator.purgeGuild(guildId);
            span.setAttribute("purge.channels", result.channelsPurged());
            span.setAttribute("purge.guild_left", result.guildLeft());
        } finally {
            span.end();
        }
    }
}
