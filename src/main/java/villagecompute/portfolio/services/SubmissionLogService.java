package villagecompute.portfolio.services;

import io.quarkus.narayana.jta.QuarkusTransaction;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import villagecompute.portfolio.config.ContactSecurityConfig;
import villagecompute.portfolio.data.models.SubmissionAttempt;
import villagecompute.portfolio.data.models.SubmissionOutcome;
import villagecompute.portfolio.observability.ObservabilityMetrics;

import java.time.Duration;
import java.time.Instant;

/**
 * Append-only audit log of contact-form attempts plus its age-based retention.
 *
 * <p>
 * {@link #log} never throws. Insert failures are reported to {@link ObservabilityMetrics} and swallowed. Each insert
 * runs in its own transaction, independent of the caller's.
 *
 * @see SubmissionAttempt
 * @see villagecompute.portfolio.jobs.SubmissionLogCleanupScheduler for the periodic purge trigger
 */
@ApplicationScoped
public class SubmissionLogService {

    private static final Logger LOG = Logger.getLogger(SubmissionLogService.class);

    @Inject
    ContactSecurityConfig config;

    @Inject
    ObservabilityMetrics observabilityMetrics;

    /**
     * Appends one attempt at the current instant.
     *
     * @param identity
     *            resolved client identity
     * @param email
     *            declared email (nullable)
     * @param outcome
     *            accepted or blocked
     * @param userAgent
     *            raw user agent, truncated before storage
     */
    public void log(String identity, String email, SubmissionOutcome outcome, String userAgent) {
        log(identity, email, outcome, userAgent, Instant.now());
    }

    /**
     * Appends one attempt at {@code submittedAt}.
     */
    public void log(String identity, String email, SubmissionOutcome outcome, String userAgent, Instant submittedAt) {
        String storedUserAgent = config.truncateUserAgent(userAgent);
        try {
            QuarkusTransaction.requiringNew()
                    .run(() -> SubmissionAttempt.create(identity, email, outcome, storedUserAgent, submittedAt));
            LOG.infof("Logged contact submission: ip=%s email=%s outcome=%s", identity, email, outcome.getValue());
        } catch (Exception e) {
            LOG.errorf(e, "Failed to log submission attempt: ip=%s email=%s outcome=%s", identity, email,
                    outcome != null ? outcome.getValue() : null);
            observabilityMetrics.incrementStoreFailure("submission_log");
        }
    }

    /**
     * Deletes every attempt strictly older than {@code days} days.
     *
     * @param days
     *            retention in days, at least 1
     * @return number of deleted attempts
     */
    public long purgeOlderThan(int days) {
        return purgeOlderThan(days, Instant.now());
    }

    /**
     * Deletes every attempt with {@code submitted_at < now - days}.
     *
     * @param days
     *            retention in days, at least 1
     * @param now
     *            reference instant
     * @return number of deleted attempts
     */
    @Transactional
    public long purgeOlderThan(int days, Instant now) {
        if (days < 1) {
            throw new IllegalArgumentException("Retention days must be at least 1: " + days);
        }

        Instant cutoff = now.minus(Duration.ofDays(days));
        long deleted = SubmissionAttempt.deleteOlderThan(cutoff);
        LOG.infof("Purged %d contact submission logs older than %s (%d days)", deleted, cutoff, days);
        return deleted;
    }
}
