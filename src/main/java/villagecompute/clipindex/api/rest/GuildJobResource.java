package villagecompute.clipindex.api.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;
import villagecompute.clipindex.api.types.JobAcceptedType;
import villagecompute.clipindex.api.types.ScanRequestType;
import villagecompute.clipindex.exceptions.DuplicateResourceException;
import villagecompute.clipindex.exceptions.PurgeCooldownException;
import villagecompute.clipindex.exceptions.ResourceNotFoundException;
import villagecompute.clipindex.exceptions.ValidationException;
import villagecompute.clipindex.jobs.JobType;
import villagecompute.clipindex.services.JobEnqueueService;

/**
 * Entry points that enqueue scan and purge jobs. All of them answer 202 with the job id; the work happens on the
 * worker pool.
 *
 * <p>
 * Example request:
 *
 * <pre>{@code
 * POST /api/guilds/123/channels/456/scan
 * {
 *   "direction": "backward",
 *   "limit": 500,
 *   "rescan": "stop"
 * }
 * }</pre>
 */
@Path("/api/guilds/{guildId}")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@Tag(
        name = "Jobs",
        description = "Scan and purge requests")
public class GuildJobResource {

    private static final Logger LOG = Logger.getLogger(GuildJobResource.class);

    @Inject
    JobEnqueueService jobEnqueueService;

    @POST
    @Path("/channels/{channelId}/scan")
    @Operation(
            summary = "Request a channel scan",
            description = "Marks the channel PENDING and enqueues a scan job")
    public Response requestScan(@PathParam("guildId") String guildId, @PathParam("channelId") String channelId,
            ScanRequestType request) {
        try {
            ScanRequestType body = request != null ? request : new ScanRequestType(null, null, null, null, null, null);
            Long jobId = jobEnqueueService.requestScan(body.toRequest(guildId, channelId));
            return accepted(jobId, JobType.SCAN);

        } catch (DuplicateResourceException e) {
            return Response.status(Response.Status.CONFLICT).entity(new ErrorResponse(e.getMessage())).build();

        } catch (ResourceNotFoundException e) {
            return Response.status(Response.Status.NOT_FOUND).entity(new ErrorResponse(e.getMessage())).build();

        } catch (ValidationException e) {
            LOG.warnf("Scan request rejected: %s", e.getMessage());
            return Response.status(Response.Status.BAD_REQUEST).entity(new ErrorResponse(e.getMessage())).build();
        }
    }

    @POST
    @Path("/channels/{channelId}/purge")
    @Operation(
            summary = "Purge a channel",
            description = "Deletes all indexed data of the channel; rejected during the purge cooldown")
    public Response purgeChannel(@PathParam("guildId") String guildId, @PathParam("channelId") String channelId) {
        try {
            return accepted(jobEnqueueService.requestChannelPurge(guildId, channelId), JobType.PURGE_CHANNEL);

        } catch (PurgeCooldownException e) {
            return Response.status(Response.Status.TOO_MANY_REQUESTS).entity(new ErrorResponse(e.getMessage()))
                    .build();

        } catch (ResourceNotFoundException e) {
            return Response.status(Response.Status.NOT_FOUND).entity(new ErrorResponse(e.getMessage())).build();
        }
    }

    @POST
    @Path("/purge")
    @Operation(
            summary = "Purge a guild",
            description = "Deletes all indexed data of the guild and leaves it")
    public Response purgeGuild(@PathParam("guildId") String guildId) {
        try {
            return accepted(jobEnqueueService.requestGuildPurge(guildId), JobType.PURGE_GUILD);

        } catch (ResourceNotFoundException e) {
            return Response.status(Response.Status.NOT_FOUND).entity(new ErrorResponse(e.getMessage())).build();
        }
    }

    private static Response accepted(Long jobId, JobType type) {
        return Response.status(Response.Status.ACCEPTED).entity(new JobAcceptedType(jobId, type.getWireName()))
                .build();
    }

    private record ErrorResponse(String message) {
    }
}
