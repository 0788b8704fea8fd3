package villagecompute.clipindex.jobs;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.clipindex.exceptions.PurgeCooldownException;
import villagecompute.clipindex.services.PurgeCoordinator;
import villagecompute.clipindex.services.PurgeCoordinator.PurgeResult;

import java.util.Map;

/**
 * Deletes all indexed data of one channel.
 *
 * <p>
 * A channel that entered its cooldown after the job was enqueued (a second purge won the race) is acknowledged
 * without work.
 *
 * <p>
 * <b>Payload:</b> {@code {"guild_id": "...", "channel_id": "..."}}
 */
@ApplicationScoped
public class PurgeChannelJobHandler implements JobHandler {

    private static final Logger LOG = Logger.getLogger(PurgeChannelJobHandler.class);

    @Inject
    PurgeCoordinator purgeCoordinator;

    @Inject
    Tracer tracer;

    @Override
    public JobType handlesType() {
        return JobType.PURGE_CHANNEL;
    }

    @Override
    public void execute(Long jobId, Map<String, Object> payload) {
        JobPayload job = JobPayload.of(payload);
        String guildId = job.requireString(JobPayload.GUILD_ID);
        String channelId = job.requireString(JobPayload.CHANNEL_ID);

        Span span = tracer.spanBuilder("job.purge_channel").setAttribute("job.id", jobId)
                .setAttribute("guild.id", guildId).setAttribute("channel.id", channelId).startSpan();
        try (Scope scope = span.makeCurrent()) {
            PurgeResult result = purgeCoordinator.purgeChannel(guildId, channelId);
            span.setAttribute("purge.messages", result.messagesDeleted());
            span.setAttribute("purge.clips", result.clipsDeleted());
        } catch (PurgeCooldownException e) {
            LOG.infof("Channel %s is in purge cooldown, skipping job %d: %s", channelId, jobId, e.getMessage());
            span.addEvent("purge.cooldown");
        } finally {
            span.end();
        }
    }
}
