package villagecompute.portfolio.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import villagecompute.portfolio.data.models.SubmissionAttempt;

import java.time.Instant;
import java.util.UUID;

/**
 * Submission attempt DTO for the audit view.
 *
 * @param id
 *            attempt id
 * @param ipAddress
 *            client identity
 * @param email
 *            declared email (nullable)
 * @param outcome
 *            {@code accepted} or {@code blocked}
 * @param userAgent
 *            truncated user agent
 * @param submittedAt
 *            attempt timestamp
 */
public record SubmissionAttemptType(UUID id, @JsonProperty("ip_address") String ipAddress, String email,
        String outcome, @JsonProperty("user_agent") String userAgent,
        @JsonProperty("submitted_at") Instant submittedAt) {

    public static SubmissionAttemptType fromEntity(SubmissionAttempt attempt) {
        return new SubmissionAttemptType(attempt.id, attempt.ipAddress, attempt.email, attempt.outcome,
                attempt.userAgent, attempt.submittedAt);
    }
}
