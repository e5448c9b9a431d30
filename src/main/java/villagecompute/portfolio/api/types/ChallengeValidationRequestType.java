package villagecompute.portfolio.api.types;

import jakarta.validation.constraints.NotBlank;

/**
 * Request DTO for {@code POST /api/contact/challenge}.
 *
 * @param token
 *            token produced by the client-side verification widget
 */
public record ChallengeValidationRequestType(@NotBlank String token) {
}
