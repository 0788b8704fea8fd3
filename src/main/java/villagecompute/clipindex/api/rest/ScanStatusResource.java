package villagecompute.clipindex.api.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import villagecompute.clipindex.api.types.GuildScanStatusesType;
import villagecompute.clipindex.api.types.ScanStatusType;
import villagecompute.clipindex.services.ScanStateService;
import villagecompute.clipindex.services.ScanStateService.ScanStatusView;

import java.util.List;
import java.util.Optional;

/**
 * Read-only scan progress for dashboards that poll.
 *
 * <p>
 * The guild listing carries {@code poll_after_seconds}: {@value #ACTIVE_POLL_SECONDS} while any scan is PENDING or
 * RUNNING, {@value #IDLE_POLL_SECONDS} otherwise.
 */
@Path("/api/guilds/{guildId}")
@Produces(MediaType.APPLICATION_JSON)
@Tag(
        name = "Scans",
        description = "Channel scan progress")
public class ScanStatusResource {

    static final int ACTIVE_POLL_SECONDS = 2;
    static final int IDLE_POLL_SECONDS = 30;

    @Inject
    ScanStateService scanStateService;

    @GET
    @Path("/scan-statuses")
    @Operation(
            summary = "List scan statuses",
            description = "Scan status of every scanned channel of a guild with a polling hint")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Statuses returned",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = GuildScanStatusesType.class)))})
    public GuildScanStatusesType listStatuses(@PathParam("guildId") String guildId) {
        List<ScanStatusView> views = scanStateService.getGuildStatuses(guildId);
        boolean active = views.stream().anyMatch(view -> view.status().isActive());
        return new GuildScanStatusesType(views.stream().map(ScanStatusType::from).toList(), active,
                active ? ACTIVE_POLL_SECONDS : IDLE_POLL_SECONDS);
    }

    @GET
    @Path("/channels/{channelId}/scan-status")
    @Operation(
            summary = "Get scan status",
            description = "Scan status of one channel")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Status returned",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = ScanStatusType.class))),
                    @APIResponse(
                            responseCode = "404",
                            description = "Channel was never scanned")})
    public Response getStatus(@PathParam("guildId") String guildId, @PathParam("channelId") String channelId) {
        Optional<ScanStatusView> view = scanStateService.getStatus(channelId);
        if (view.isEmpty()) {
            return Response.status(Response.Status.NOT_FOUND)
                    .entity(new ErrorResponse("No scan status for channel " + channelId)).build();
        }
        return Response.ok(ScanStatusType.from(view.get())).build();
    }

    private record ErrorResponse(String message) {
    }
}
