package villagecompute.portfolio.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Contact-form message that cleared the gating checks, implementing the Panache ActiveRecord pattern.
 *
 * <p>
 * Messages flagged as spam are stored like any other message so that automated senders get no signal that they were
 * detected. The spam score is fixed at creation time and {@code is_spam} is derived from it once, against the threshold
 * in force at that moment.
 *
 * <p>
 * <b>Schema Mapping:</b>
 * <ul>
 * <li>{@code id} (UUID, PK) - Primary key identifier</li>
 * <li>{@code name}, {@code email}, {@code subject}, {@code message} - Submitted content</li>
 * <li>{@code ip_address} (TEXT) - Resolved client identity</li>
 * <li>{@code user_agent} (TEXT) - Declared user agent (truncated)</li>
 * <li>{@code spam_score} (DOUBLE) - Heuristic score in [0,1]</li>
 * <li>{@code is_spam} (BOOLEAN) - True when the score exceeded the spam threshold</li>
 * <li>{@code is_read} (BOOLEAN) - Admin read flag</li>
 * <li>{@code created_at} (TIMESTAMPTZ) - Creation timestamp</li>
 * </ul>
 *
 * @see SubmissionAttempt for the audit trail of every attempt
 */
@Entity
@Table(
        name = "contact_messages",
        indexes = @Index(
                name = "idx_contact_messages_created_at",
                columnList = "created_at"))
public class ContactMessage extends PanacheEntityBase {

    private static final Logger LOG = Logger.getLogger(ContactMessage.class);

    @Id
    @Column(
            nullable = false)
    public UUID id;

    @Column(
            nullable = false,
            length = 100)
    public String name;

    @Column(
            nullable = false,
            length = 120)
    public String email;

    @Column(
            length = 200)
    public String subject;

    @Column(
            name = "message",
            nullable = false,
            columnDefinition = "TEXT")
    public String body;

    @Column(
            name = "ip_address")
    public String ipAddress;

    @Column(
            name = "user_agent",
            length = 1000)
    public String userAgent;

    @Column(
            name = "spam_score",
            nullable = false)
    public double spamScore;

    @Column(
            name = "is_spam",
            nullable = false)
    public boolean isSpam;

    @Column(
            name = "is_read",
            nullable = false)
    public boolean isRead;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    /**
     * Lists messages newest first (admin inbox).
     *
     * @param spam
     *            filter on the spam flag, or null for all messages
     * @param page
     *            zero-based page index
     * @param size
     *            page size
     * @return one page of messages
     */
    public static List<ContactMessage> findPage(Boolean spam, int page, int size) {
        if (spam == null) {
            return find("ORDER BY createdAt DESC").page(page, size).list();
        }
        return find("isSpam = ?1 ORDER BY createdAt DESC", spam).page(page, size).list();
    }

    public static long countUnread() {
        return count("isRead = false");
    }

    /**
     * Creates and persists a message with its spam verdict.
     *
     * @param name
     *            submitter name
     * @param email
     *            submitter email
     * @param subject
     *            optional subject
     * @param body
     *            message body
     * @param ipAddress
     *            resolved client identity
     * @param userAgent
     *            truncated user agent
     * @param spamScore
     *            score in [0,1]
     * @param spamThreshold
     *            scores strictly above this value mark the message as spam
     * @return the persisted message
     */
    public static ContactMessage create(String name, String email, String subject, String body, String ipAddress,
            String userAgent, double spamScore, double spamThreshold) {
        ContactMessage message = new ContactMessage();
        message.id = UUID.randomUUID();
        message.name = name;
        message.email = email;
        message.subject = subject;
        message.body = body;
        message.ipAddress = ipAddress;
        message.userAgent = userAgent;
        message.spamScore = spamScore;
        message.isSpam = spamScore > spamThreshold;
        message.isRead = false;
        message.createdAt = Instant.now();
        message.persist();
        LOG.debugf("Stored contact message: id=%s spam=%s score=%.3f", message.id, message.isSpam, spamScore);
        return message;
    }

    public void markAsRead() {
        this.isRead = true;
    }
}
