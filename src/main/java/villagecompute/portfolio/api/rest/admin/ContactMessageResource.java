package villagecompute.portfolio.api.rest.admin;

import jakarta.annotation.security.RolesAllowed;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.PATCH;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import villagecompute.portfolio.api.types.ContactMessageType;
import villagecompute.portfolio.exceptions.ResourceNotFoundException;
import villagecompute.portfolio.services.ContactMessageService;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Admin inbox for contact messages.
 *
 * <p>
 * Responsibilities:
 * <ul>
 * <li>{@code GET /admin/api/contact-messages} – list messages, newest first, optionally filtered by spam flag</li>
 * <li>{@code GET /admin/api/contact-messages/unread-count} – count unread messages</li>
 * <li>{@code GET /admin/api/contact-messages/{id}} – message detail with spam signals</li>
 * <li>{@code PATCH /admin/api/contact-messages/{id}/read} – mark as read</li>
 * <li>{@code DELETE /admin/api/contact-messages/{id}} – delete</li>
 * </ul>
 *
 * <p>
 * <b>Security:</b> All endpoints require the {@code admin} role.
 */
@Path("/admin/api/contact-messages")
@RolesAllowed("admin")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ContactMessageResource {

    @Inject
    ContactMessageService messageService;

    @GET
    public Response list(@QueryParam("page") @DefaultValue("0") int page,
            @QueryParam("size") @DefaultValue("20") int size, @QueryParam("spam") Boolean spam) {
        List<ContactMessageType> messages = messageService.list(spam, page, size);
        return Response.ok(messages).build();
    }

    @GET
    @Path("/unread-count")
    public Response unreadCount() {
        return Response.ok(Map.of("unread_count", messageService.countUnread())).build();
    }

    @GET
    @Path("/{id}")
    public Response get(@PathParam("id") UUID id) {
        try {
            return Response.ok(messageService.get(id)).build();
        } catch (ResourceNotFoundException e) {
            return notFound(e);
        }
    }

    @PATCH
    @Path("/{id}/read")
    public Response markAsRead(@PathParam("id") UUID id) {
        try {
            return Response.ok(messageService.markAsRead(id)).build();
        } catch (ResourceNotFoundException e) {
            return notFound(e);
        }
    }

    @DELETE
    @Path("/{id}")
    public Response delete(@PathParam("id") UUID id) {
        try {
            messageService.delete(id);
            return Response.noContent().build();
        } catch (ResourceNotFoundException e) {
            return notFound(e);
        }
    }

    private static Response notFound(ResourceNotFoundException e) {
        return Response.status(Response.Status.NOT_FOUND).entity(new ErrorResponse(e.getMessage())).build();
    }

    /**
     * Simple error response wrapper.
     */
    public record ErrorResponse(String error) {
    }
}
