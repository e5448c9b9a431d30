package villagecompute.portfolio.api.rest.admin;

import jakarta.annotation.security.RolesAllowed;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.jboss.logging.Logger;
import villagecompute.portfolio.api.types.PurgeResultType;
import villagecompute.portfolio.api.types.SubmissionAttemptType;
import villagecompute.portfolio.data.models.SubmissionAttempt;
import villagecompute.portfolio.services.SubmissionLogService;

import java.util.List;

/**
 * Admin audit view of contact submission attempts.
 *
 * <p>
 * Responsibilities:
 * <ul>
 * <li>{@code GET /admin/api/contact-submissions} – recent attempts, optionally filtered by IP or email</li>
 * <li>{@code POST /admin/api/contact-submissions/purge} – run the retention purge now</li>
 * </ul>
 *
 * <p>
 * <b>Security:</b> All endpoints require the {@code admin} role.
 */
@Path("/admin/api/contact-submissions")
@RolesAllowed("admin")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ContactSubmissionResource {

    private static final Logger LOG = Logger.getLogger(ContactSubmissionResource.class);

    @Inject
    SubmissionLogService submissionLogService;

    /**
     * Lists recent submission attempts.
     *
     * @param ipAddress
     *            optional IP filter (takes precedence over email)
     * @param email
     *            optional email filter
     * @param limit
     *            max results (default 100, max 1000)
     * @return attempts, newest first
     */
    @GET
    public Response listAttempts(@QueryParam("ip_address") String ipAddress, @QueryParam("email") String email,
            @QueryParam("limit") @DefaultValue("100") int limit) {
        int safeLimit = Math.min(Math.max(1, limit), 1000);

        List<SubmissionAttempt> attempts;
        if (ipAddress != null && !ipAddress.isBlank()) {
            attempts = SubmissionAttempt.findByIp(ipAddress, safeLimit);
        } else if (email != null && !email.isBlank()) {
            attempts = SubmissionAttempt.findByEmail(email, safeLimit);
        } else {
            attempts = SubmissionAttempt.findRecent(safeLimit);
        }

        return Response.ok(attempts.stream().map(SubmissionAttemptType::fromEntity).toList()).build();
    }

    /**
     * Deletes attempts older than the given number of days.
     *
     * @param days
     *            retention period, at least 1
     * @return purge result, or 400 for an invalid period
     */
    @POST
    @Path("/purge")
    public Response purge(@QueryParam("days") @DefaultValue("30") int days) {
        try {
            long deleted = submissionLogService.purgeOlderThan(days);
            LOG.infof("Manual submission log purge: days=%d deleted=%d", days, deleted);
            return Response.ok(new PurgeResultType(days, deleted)).build();
        } catch (IllegalArgumentException e) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(new ContactMessageResource.ErrorResponse(e.getMessage())).build();
        }
    }
}
