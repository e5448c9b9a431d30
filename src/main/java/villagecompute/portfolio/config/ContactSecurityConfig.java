package villagecompute.portfolio.config;

import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.time.Duration;
import java.util.Optional;

/**
 * Tunable policy for the contact-form abuse-mitigation pipeline.
 *
 * <p>
 * <b>Configuration Properties:</b>
 * <ul>
 * <li>{@code contact.spam.threshold} - Scores strictly above this value flag a message as spam (default 0.7)</li>
 * <li>{@code contact.challenge.enabled} - Require a human-verification validation before submitting (default
 * false)</li>
 * <li>{@code contact.challenge.max-age} - Validations older than this are stale (default PT5M)</li>
 * <li>{@code contact.challenge.min-delay} - Validations younger than this are too fast (default PT2S)</li>
 * <li>{@code contact.retention.days} - Age after which submission logs are purged (default 30)</li>
 * <li>{@code contact.user-agent.max-length} - Stored user-agent truncation length (default 500)</li>
 * <li>{@code contact.notify.owner-email} - Recipient of new-message notifications (optional)</li>
 * <li>{@code contact.notify.send-confirmation} - Send a confirmation to the submitter (default true)</li>
 * <li>{@code contact.recaptcha.secret-key} - reCAPTCHA secret; tokens are verified remotely only when set</li>
 * </ul>
 */
@ApplicationScoped
public class ContactSecurityConfig {

    @ConfigProperty(
            name = "contact.spam.threshold",
            defaultValue = "0.7")
    double spamThreshold;

    @ConfigProperty(
            name = "contact.challenge.enabled",
            defaultValue = "false")
    boolean challengeEnabled;

    @ConfigProperty(
            name = "contact.challenge.max-age",
            defaultValue = "PT5M")
    Duration challengeMaxAge;

    @ConfigProperty(
            name = "contact.challenge.min-delay",
            defaultValue = "PT2S")
    Duration challengeMinDelay;

    @ConfigProperty(
            name = "contact.retention.days",
            defaultValue = "30")
    int retentionDays;

    @ConfigProperty(
            name = "contact.user-agent.max-length",
            defaultValue = "500")
    int userAgentMaxLength;

    @ConfigProperty(
            name = "contact.notify.owner-email")
    Optional<String> ownerEmail;

    @ConfigProperty(
            name = "contact.notify.send-confirmation",
            defaultValue = "true")
    boolean sendConfirmation;

    @ConfigProperty(
            name = "contact.recaptcha.secret-key")
    Optional<String> recaptchaSecretKey;

    public double getSpamThreshold() {
        return spamThreshold;
    }

    public boolean isChallengeEnabled() {
        return challengeEnabled;
    }

    public Duration getChallengeMaxAge() {
        return challengeMaxAge;
    }

    public Duration getChallengeMinDelay() {
        return challengeMinDelay;
    }

    public int getRetentionDays() {
        return retentionDays;
    }

    public int getUserAgentMaxLength() {
        return userAgentMaxLength;
    }

    public Optional<String> getOwnerEmail() {
        return ownerEmail.filter(email -> !email.isBlank());
    }

    public boolean isSendConfirmation() {
        return sendConfirmation;
    }

    public Optional<String> getRecaptchaSecretKey() {
        return recaptchaSecretKey.filter(key -> !key.isBlank());
    }

    /**
     * Truncates a user agent to the configured maximum length.
     *
     * @param userAgent
     *            raw header value (nullable)
     * @return empty string for null, otherwise at most {@code contact.user-agent.max-length} characters
     */
    public String truncateUserAgent(String userAgent) {
        if (userAgent == null) {
            return "";
        }
        return userAgent.length() > userAgentMaxLength ? userAgent.substring(0, userAgentMaxLength) : userAgent;
    }
}
