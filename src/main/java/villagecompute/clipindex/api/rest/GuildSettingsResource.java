package villagecompute.clipindex.api.rest;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import villagecompute.clipindex.exceptions.ValidationException;
import villagecompute.clipindex.services.ResolvedSettings;
import villagecompute.clipindex.services.SettingsResolver;
import villagecompute.clipindex.services.SettingsService;

import java.util.Map;

@Path("/api/guilds/{guildId}")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@Tag(
        name = "Settings",
        description = "Guild and channel indexing settings")
public class GuildSettingsResource {

    @Inject
    SettingsService settingsService;

    @Inject
    SettingsResolver settingsResolver;

    @GET
    @Path("/channels/{channelId}/settings")
    @Operation(
            summary = "Effective channel settings",
            description = "Defaults, guild settings and channel overrides merged")
    public Map<String, Object> effectiveSettings(@PathParam("guildId") String guildId,
            @PathParam("channelId") String channelId) {
        ResolvedSettings settings = settingsResolver.getEffectiveSettings(guildId, channelId);
        return Map.of("values", settings.values(), "settings_hash", settings.settingsHash());
    }

    @PUT
    @Path("/settings")
    @Operation(
            summary = "Update guild settings")
    public Response updateGuildSettings(@PathParam("guildId") String guildId, GuildSettingsUpdate update) {
        if (update == null) {
            return Response.status(Response.Status.BAD_REQUEST).entity(new ErrorResponse("Request body required"))
                    .build();
        }
        try {
            settingsService.updateGuildSettings(guildId, update.defaultChannelSettings(), update.settings());
            return Response.noContent().build();
        } catch (ValidationException e) {
            return Response.status(Response.Status.BAD_REQUEST).entity(new ErrorResponse(e.getMessage())).build();
        }
    }

    @PUT
    @Path("/channels/{channelId}/settings")
    @Operation(
            summary = "Update channel overrides")
    public Response updateChannelSettings(@PathParam("guildId") String guildId,
            @PathParam("channelId") String channelId, Map<String, Object> settings) {
        try {
            settingsService.updateChannelSettings(guildId, channelId, settings);
            return Response.noContent().build();
        } catch (ValidationException e) {
            return Response.status(Response.Status.BAD_REQUEST).entity(new ErrorResponse(e.getMessage())).build();
        }
    }

    public record GuildSettingsUpdate(@JsonProperty("default_channel_settings") Map<String, Object> defaultChannelSettings,
            Map<String, Object> settings) {
    }

    private record ErrorResponse(String message) {
    }
}
