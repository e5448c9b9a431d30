package villagecompute.portfolio.services;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Ephemeral per-session challenge state.
 *
 * <p>
 * Holds the instant of the last accepted human-verification validation for each {@code contact_session} cookie.
 * Entries expire after 30 minutes without access and are never persisted, so a restart forgets every validation.
 *
 * <p>
 * <b>Thread Safety:</b> Backed by a Caffeine cache; all operations are atomic per session.
 */
@ApplicationScoped
public class ChallengeSessionStore {

    private static final Logger LOG = Logger.getLogger(ChallengeSessionStore.class);

    public static final String SESSION_COOKIE = "contact_session";

    /**
     * Challenge state for one client session.
     *
     * @param sessionId
     *            opaque session identifier
     * @param lastValidation
     *            instant the last challenge was solved (nullable)
     */
    public record ChallengeState(String sessionId, Instant lastValidation) {
    }

    private final Cache<String, ChallengeState> sessions = Caffeine.newBuilder()
            .expireAfterAccess(30, TimeUnit.MINUTES).maximumSize(100_000).build();

    /**
     * Returns the given session id when usable, otherwise a freshly generated one.
     */
    public String ensureSession(String sessionId) {
        if (sessionId != null && !sessionId.isBlank()) {
            return sessionId;
        }
        return UUID.randomUUID().toString();
    }

    public void recordValidation(String sessionId, Instant validatedAt) {
        sessions.put(sessionId, new ChallengeState(sessionId, validatedAt));
        LOG.debugf("Recorded challenge validation: session=%s at=%s", sessionId, validatedAt);
    }

    public Optional<Instant> lastValidation(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            return Optional.empty();
        }
        ChallengeState state = sessions.getIfPresent(sessionId);
        return state == null ? Optional.empty() : Optional.ofNullable(state.lastValidation());
    }

    /**
     * Atomically claims the session's validation for one submission.
     *
     * <p>
     * Succeeds only if the session still holds exactly {@code expected}; the entry is removed in the same step, so of
     * several submissions that read the same validation at most one claims it.
     *
     * @param sessionId
     *            session identifier (nullable)
     * @param expected
     *            validation instant the submission was evaluated against (nullable)
     * @return true if this caller claimed the validation
     */
    public boolean consume(String sessionId, Instant expected) {
        if (sessionId == null || expected == null) {
            return false;
        }
        ChallengeState state = sessions.getIfPresent(sessionId);
        if (state == null || !expected.equals(state.lastValidation())) {
            return false;
        }
        return sessions.asMap().remove(sessionId, state);
    }

    /**
     * Drops the stored validation so it cannot be reused for a retry.
     */
    public void clearValidation(String sessionId) {
        if (sessionId != null) {
            sessions.invalidate(sessionId);
        }
    }
}
