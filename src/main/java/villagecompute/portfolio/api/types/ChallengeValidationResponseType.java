package villagecompute.portfolio.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Response DTO for {@code POST /api/contact/challenge}.
 *
 * @param valid
 *            whether the token was accepted
 * @param validatedAt
 *            instant recorded in the challenge session (null when invalid)
 */
public record ChallengeValidationResponseType(boolean valid, @JsonProperty("validated_at") Instant validatedAt) {
}
