package villagecompute.portfolio.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import io.quarkus.panache.common.Parameters;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Audit record of a single contact-form POST, implementing the Panache ActiveRecord pattern.
 *
 * <p>
 * One row is appended per pipeline run, whether the submission was accepted or blocked. Rows are never updated; they
 * are removed only by the retention purge ({@link #deleteOlderThan(Instant)}). The same rows back the sliding-window
 * counts used by {@link villagecompute.portfolio.services.ContactRateLimitService}.
 *
 * <p>
 * <b>Schema Mapping:</b>
 * <ul>
 * <li>{@code id} (UUID, PK) - Primary key identifier</li>
 * <li>{@code ip_address} (TEXT) - Resolved client identity</li>
 * <li>{@code email} (TEXT) - Email declared by the submitter (nullable)</li>
 * <li>{@code submitted_at} (TIMESTAMPTZ) - Attempt timestamp (UTC)</li>
 * <li>{@code outcome} (TEXT) - "accepted" or "blocked"</li>
 * <li>{@code user_agent} (TEXT) - Declared user agent, truncated to the configured maximum length</li>
 * </ul>
 *
 * @see ContactMessage for stored message content
 */
@Entity
@Table(
        name = "contact_submission_logs",
        indexes = {@Index(
                name = "idx_contact_submission_logs_ip_submitted",
                columnList = "ip_address, submitted_at"),
                @Index(
                        name = "idx_contact_submission_logs_email_submitted",
                        columnList = "email, submitted_at")})
public class SubmissionAttempt extends PanacheEntityBase {

    @Id
    @Column(
            nullable = false)
    public UUID id;

    @Column(
            name = "ip_address",
            nullable = false)
    public String ipAddress;

    @Column
    public String email;

    @Column(
            name = "submitted_at",
            nullable = false)
    public Instant submittedAt;

    @Column(
            nullable = false)
    public String outcome;

    @Column(
            name = "user_agent",
            length = 1000)
    public String userAgent;

    /**
     * Counts distinct attempts since {@code windowStart} that match the identity OR the email.
     *
     * <p>
     * A row matching both keys is counted once. A null or blank email restricts the count to the identity alone.
     *
     * @param ipAddress
     *            resolved client identity
     * @param email
     *            declared email (nullable)
     * @param windowStart
     *            inclusive lower bound on {@code submitted_at}
     * @return number of matching attempts
     */
    public static long countSince(String ipAddress, String email, Instant windowStart) {
        if (email == null || email.isBlank()) {
            return count("ipAddress = :ip AND submittedAt >= :start",
                    Parameters.with("ip", ipAddress).and("start", windowStart));
        }
        return count("(ipAddress = :ip OR email = :email) AND submittedAt >= :start",
                Parameters.with("ip", ipAddress).and("email", email).and("start", windowStart));
    }

    /**
     * Deletes every attempt strictly older than the cutoff.
     *
     * @param cutoff
     *            attempts with {@code submitted_at < cutoff} are removed
     * @return number of deleted rows
     */
    public static long deleteOlderThan(Instant cutoff) {
        return delete("submittedAt < ?1", cutoff);
    }

    /**
     * Recent attempts for an identity (admin audit view).
     */
    public static List<SubmissionAttempt> findByIp(String ipAddress, int limit) {
        if (ipAddress == null || ipAddress.isBlank()) {
            return List.of();
        }
        return find("ipAddress = ?1 ORDER BY submittedAt DESC", ipAddress).page(0, limit).list();
    }

    /**
     * Recent attempts for an email (admin audit view).
     */
    public static List<SubmissionAttempt> findByEmail(String email, int limit) {
        if (email == null || email.isBlank()) {
            return List.of();
        }
        return find("email = ?1 ORDER BY submittedAt DESC", email).page(0, limit).list();
    }

    public static List<SubmissionAttempt> findRecent(int limit) {
        return find("ORDER BY submittedAt DESC").page(0, limit).list();
    }

    /**
     * Creates and persists a new attempt.
     *
     * @param ipAddress
     *            resolved client identity
     * @param email
     *            declared email (nullable)
     * @param outcome
     *            pipeline outcome
     * @param userAgent
     *            already-truncated user agent
     * @param submittedAt
     *            attempt timestamp
     * @return the persisted entity
     */
    public static SubmissionAttempt create(String ipAddress, String email, SubmissionOutcome outcome, String userAgent,
            Instant submittedAt) {
        SubmissionAttempt attempt = new SubmissionAttempt();
        attempt.id = UUID.randomUUID();
        attempt.ipAddress = ipAddress;
        attempt.email = email;
        attempt.outcome = outcome.getValue();
        attempt.userAgent = userAgent;
        attempt.submittedAt = submittedAt;
        attempt.persist();
        return attempt;
    }

    public SubmissionOutcome outcome() {
        return SubmissionOutcome.fromValue(outcome);
    }
}
