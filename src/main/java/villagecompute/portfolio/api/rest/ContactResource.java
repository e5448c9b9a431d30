package villagecompute.portfolio.api.rest;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import io.vertx.core.http.HttpServerRequest;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.CookieParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.NewCookie;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;
import villagecompute.portfolio.api.types.ChallengeValidationRequestType;
import villagecompute.portfolio.api.types.ChallengeValidationResponseType;
import villagecompute.portfolio.api.types.ContactSubmissionRequestType;
import villagecompute.portfolio.api.types.ContactSubmissionResponseType;
import villagecompute.portfolio.data.models.ContactMessage;
import villagecompute.portfolio.exceptions.ContactStoreException;
import villagecompute.portfolio.observability.LoggingConfig;
import villagecompute.portfolio.services.ChallengeSessionStore;
import villagecompute.portfolio.services.ChallengeVerificationService;
import villagecompute.portfolio.services.ClientIdentityResolver;
import villagecompute.portfolio.services.ContactDecision;
import villagecompute.portfolio.services.ContactNotificationService;
import villagecompute.portfolio.services.ContactSubmission;
import villagecompute.portfolio.services.ContactSubmissionPipeline;

import java.time.Instant;
import java.util.Optional;

/**
 * Public contact form endpoints.
 *
 * <p>
 * <b>Endpoints:</b>
 * <ul>
 * <li>{@code POST /api/contact} - submit a message</li>
 * <li>{@code POST /api/contact/challenge} - record a solved human-verification challenge in the caller's
 * {@code contact_session}</li>
 * </ul>
 *
 * <p>
 * <b>Responses for {@code POST /api/contact}:</b>
 * <ul>
 * <li>200 OK: message accepted. Spam-flagged and honeypot submissions get the same body.</li>
 * <li>400 Bad Request: validation failed, suspicious user agent, or challenge missing/stale/too fast</li>
 * <li>429 Too Many Requests: rate limit exceeded, with {@code Retry-After}</li>
 * <li>503 Service Unavailable: the message could not be stored</li>
 * </ul>
 */
@Path("/api/contact")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@Tag(
        name = "Contact",
        description = "Public contact form")
public class ContactResource {

    private static final Logger LOG = Logger.getLogger(ContactResource.class);

    @Inject
    ContactSubmissionPipeline pipeline;

    @Inject
    ClientIdentityResolver identityResolver;

    @Inject
    ChallengeSessionStore sessionStore;

    @Inject
    ChallengeVerificationService challengeVerificationService;

    @Inject
    ContactNotificationService notificationService;

    @Inject
    Tracer tracer;

    @ConfigProperty(
            name = "contact.session.cookie-secure",
            defaultValue = "true")
    boolean cookieSecure;

    @POST
    @Operation(
            summary = "Submit contact message",
            description = "Runs the submission through rate limiting, bot detection and spam scoring.")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Message received",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON)),
                    @APIResponse(
                            responseCode = "400",
                            description = "Invalid request or submission rejected",
                            content = @Content(
                                    mediaType = MediaType.APPLICATION_JSON)),
                    @APIResponse(
                            responseCode = "429",
                            description = "Too many submissions",
                            content = @Content(
                                    mediaType = MediaType.APPLICATION_JSON)),
                    @APIResponse(
                            responseCode = "503",
                            description = "Message could not be stored",
                            content = @Content(
                                    mediaType = MediaType.APPLICATION_JSON))})
    public Response submit(@Valid @NotNull ContactSubmissionRequestType request,
            @CookieParam(ChallengeSessionStore.SESSION_COOKIE) String sessionId, @Context HttpHeaders headers,
            @Context HttpServerRequest httpRequest) {

        Span span = tracer.spanBuilder("contact.submit").startSpan();
        try (Scope ignored = span.makeCurrent()) {
            LoggingConfig.enrichWithTraceContext();
            LoggingConfig.setRequestOrigin("/api/contact");

            String identity = identityResolver.resolve(headers, peerAddress(httpRequest));
            LoggingConfig.setClientIp(identity);

            String userAgent = headers.getHeaderString(HttpHeaders.USER_AGENT);
            String fingerprint = identityResolver.fingerprint(identity, userAgent);
            LoggingConfig.setClientFingerprint(fingerprint);
            span.setAttribute("contact.client_fingerprint", fingerprint);
            Instant lastValidation = sessionStore.lastValidation(sessionId).orElse(null);

            ContactSubmission submission = new ContactSubmission(identity, userAgent, request.formFields(), sessionId,
                    lastValidation, request.name(), request.email(), request.subject(), request.message());

            ContactDecision decision;
            try {
                decision = pipeline.process(submission);
            } catch (ContactStoreException e) {
                span.recordException(e);
                return Response.status(Response.Status.SERVICE_UNAVAILABLE).entity(ContactSubmissionResponseType
                        .rejected("Your message could not be saved. Please try again later.")).build();
            }

            span.setAttribute("contact.verdict", decision.verdict().getCode());
            if (decision.reason() != null) {
                span.setAttribute("contact.reason", decision.reason().getCode());
            }

            if (decision.shouldNotify()) {
                ContactMessage message = ContactMessage.findById(decision.messageId());
                if (message != null) {
                    notificationService.notifyNewMessage(message);
                }
            }

            return toResponse(decision);
        } finally {
            LoggingConfig.clearMDC();
            span.end();
        }
    }

    @POST
    @Path("/challenge")
    @Operation(
            summary = "Validate challenge",
            description = "Verifies a human-verification token and records the validation time in the contact session.")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Challenge accepted",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON)),
                    @APIResponse(
                            responseCode = "400",
                            description = "Challenge rejected",
                            content = @Content(
                                    mediaType = MediaType.APPLICATION_JSON))})
    public Response validateChallenge(@Valid @NotNull ChallengeValidationRequestType request,
            @CookieParam(ChallengeSessionStore.SESSION_COOKIE) String sessionId, @Context HttpHeaders headers,
            @Context HttpServerRequest httpRequest) {

        try {
            LoggingConfig.enrichWithTraceContext();
            LoggingConfig.setRequestOrigin("/api/contact/challenge");

            String identity = identityResolver.resolve(headers, peerAddress(httpRequest));
            LoggingConfig.setClientIp(identity);

            String session = sessionStore.ensureSession(sessionId);
            Optional<Instant> validatedAt = challengeVerificationService.verifyAndRecord(session, request.token(),
                    identity);

            NewCookie cookie = new NewCookie.Builder(ChallengeSessionStore.SESSION_COOKIE).value(session).path("/")
                    .maxAge(30 * 60).secure(cookieSecure).httpOnly(true).sameSite(NewCookie.SameSite.LAX).build();

            if (validatedAt.isEmpty()) {
                LOG.warnf("Challenge token rejected: ip=%s", identity);
                return Response.status(Response.Status.BAD_REQUEST)
                        .entity(new ChallengeValidationResponseType(false, null)).cookie(cookie).build();
            }

            return Response.ok(new ChallengeValidationResponseType(true, validatedAt.get())).cookie(cookie).build();
        } finally {
            LoggingConfig.clearMDC();
        }
    }

    private Response toResponse(ContactDecision decision) {
        if (decision.presentsSuccess()) {
            return Response.ok(ContactSubmissionResponseType.success()).build();
        }

        return switch (decision.reason()) {
            case RATE_LIMIT_EXCEEDED -> Response.status(Response.Status.TOO_MANY_REQUESTS)
                    .header("Retry-After", decision.rateLimit().retryAfterSeconds(Instant.now()))
                    .entity(ContactSubmissionResponseType
                            .rejected("Too many messages. Please wait a while before trying again."))
                    .build();
            case SUSPICIOUS_USER_AGENT -> Response.status(Response.Status.BAD_REQUEST)
                    .entity(ContactSubmissionResponseType
                            .rejected("Your message could not be sent. Please try again from a web browser."))
                    .build();
            case CHALLENGE_STALE -> Response.status(Response.Status.BAD_REQUEST)
                    .entity(ContactSubmissionResponseType
                            .rejected("Verification expired. Please complete the challenge again."))
                    .build();
            case CHALLENGE_TOO_FAST -> Response.status(Response.Status.BAD_REQUEST)
                    .entity(ContactSubmissionResponseType
                            .rejected("Please take a moment before submitting, then complete the challenge again."))
                    .build();
            case HONEYPOT_TRIGGERED -> Response.ok(ContactSubmissionResponseType.success()).build();
        };
    }

    private static String peerAddress(HttpServerRequest request) {
        if (request != null && request.remoteAddress() != null) {
            return request.remoteAddress().host();
        }
        return null;
    }
}
