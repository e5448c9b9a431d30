package villagecompute.portfolio.services;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Everything the pipeline needs to judge one contact-form POST.
 *
 * @param identity
 *            resolved client identity
 * @param userAgent
 *            raw user-agent header (nullable)
 * @param formFields
 *            raw submitted fields, including honeypot decoys
 * @param challengeSessionId
 *            challenge session identifier (nullable)
 * @param lastChallengeValidation
 *            instant the session last solved a challenge (nullable)
 * @param name
 *            submitter name
 * @param email
 *            submitter email
 * @param subject
 *            optional subject
 * @param body
 *            message body
 */
public record ContactSubmission(String identity, String userAgent, Map<String, String> formFields,
        String challengeSessionId, Instant lastChallengeValidation, String name, String email, String subject,
        String body) {

    public ContactSubmission {
        Objects.requireNonNull(identity, "identity is required");
        formFields = formFields == null ? Map.of() : Map.copyOf(formFields);
    }
}
