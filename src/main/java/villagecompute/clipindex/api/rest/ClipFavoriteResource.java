package villagecompute.clipindex.api.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import villagecompute.clipindex.exceptions.ResourceNotFoundException;
import villagecompute.clipindex.exceptions.ValidationException;
import villagecompute.clipindex.services.FavoriteService;

/**
 * Favorite toggling for a clip. Archived clips answer 409.
 */
@Path("/api/clips/{clipId}/favorites/{userId}")
@Produces(MediaType.APPLICATION_JSON)
@Tag(
        name = "Clips",
        description = "Clip favorites")
public class ClipFavoriteResource {

    @Inject
    FavoriteService favoriteService;

    @PUT
    @Operation(
            summary = "Favorite a clip")
    public Response addFavorite(@PathParam("clipId") String clipId, @PathParam("userId") String userId) {
        try {
            boolean created = favoriteService.addFavorite(userId, clipId);
            return created ? Response.status(Response.Status.CREATED).build() : Response.noContent().build();

        } catch (ResourceNotFoundException e) {
            return Response.status(Response.Status.NOT_FOUND).entity(new ErrorResponse(e.getMessage())).build();

        } catch (ValidationException e) {
            return Response.status(Response.Status.CONFLICT).entity(new ErrorResponse(e.getMessage())).build();
        }
    }

    @DELETE
    @Operation(
            summary = "Remove a favorite")
    public Response removeFavorite(@PathParam("clipId") String clipId, @PathParam("userId") String userId) {
        favoriteService.removeFavorite(userId, clipId);
        return Response.noContent().build();
    }

    private record ErrorResponse(String message) {
    }
}
