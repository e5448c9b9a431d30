package villagecompute.portfolio.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import villagecompute.portfolio.data.models.ContactMessage;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Contact message DTO for the admin inbox.
 *
 * <p>
 * {@code spam_score} and {@code is_spam} are the values stored when the message arrived. {@code spam_signals} and
 * {@code recomputed_spam_score} are diagnostics produced by the current heuristics when a single message is fetched,
 * so after a weight or threshold change they may disagree with the stored score. Both are empty/null in list
 * responses.
 */
public record ContactMessageType(UUID id, String name, String email, String subject, String message,
        @JsonProperty("ip_address") String ipAddress, @JsonProperty("user_agent") String userAgent,
        @JsonProperty("spam_score") double spamScore, @JsonProperty("is_spam") boolean spam,
        @JsonProperty("is_read") boolean read, @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("spam_signals") List<SpamSignalType> spamSignals,
        @JsonProperty("recomputed_spam_score") Double recomputedSpamScore) {

    public static ContactMessageType fromEntity(ContactMessage message) {
        return new ContactMessageType(message.id, message.name, message.email, message.subject, message.body,
                message.ipAddress, message.userAgent, message.spamScore, message.isSpam, message.isRead,
                message.createdAt, List.of(), null);
    }

    public static ContactMessageType withDiagnostics(ContactMessage message, List<SpamSignalType> signals,
            double recomputedScore) {
        return new ContactMessageType(message.id, message.name, message.email, message.subject, message.body,
                message.ipAddress, message.userAgent, message.spamScore, message.isSpam, message.isRead,
                message.createdAt, signals, recomputedScore);
    }
}
