package villagecompute.portfolio.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.rest.client.inject.RestClient;
import org.jboss.logging.Logger;
import villagecompute.portfolio.api.types.RecaptchaVerifyResponseType;
import villagecompute.portfolio.config.ContactSecurityConfig;
import villagecompute.portfolio.integration.captcha.RecaptchaRestClient;

import java.time.Instant;
import java.util.Optional;

/**
 * Verifies human-verification tokens and records the validation instant in the caller's challenge session.
 *
 * <p>
 * Tokens are verified with reCAPTCHA when {@code contact.recaptcha.secret-key} is configured. Without a secret any
 * non-blank token is accepted, which is meant for local development only.
 */
@ApplicationScoped
public class ChallengeVerificationService {

    private static final Logger LOG = Logger.getLogger(ChallengeVerificationService.class);

    @Inject
    ContactSecurityConfig config;

    @Inject
    ChallengeSessionStore sessionStore;

    @Inject
    @RestClient
    RecaptchaRestClient recaptchaClient;

    /**
     * Verifies a token and, on success, stamps the session.
     *
     * @param sessionId
     *            challenge session identifier
     * @param token
     *            token produced by the client-side widget
     * @param identity
     *            resolved client identity, forwarded to the verifier
     * @return validation instant when the token was accepted, empty otherwise
     */
    public Optional<Instant> verifyAndRecord(String sessionId, String token, String identity) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }

        if (!verify(token, identity)) {
            sessionStore.clearValidation(sessionId);
            return Optional.empty();
        }

        Instant now = Instant.now();
        sessionStore.recordValidation(sessionId, now);
        return Optional.of(now);
    }

    private boolean verify(String token, String identity) {
        Optional<String> secret = config.getRecaptchaSecretKey();
        if (secret.isEmpty()) {
            LOG.debug("No reCAPTCHA secret configured, accepting challenge token without remote verification");
            return true;
        }

        try {
            RecaptchaVerifyResponseType response = recaptchaClient.verify(secret.get(), token, identity);
            if (response == null || !response.success()) {
                LOG.warnf("Challenge verification rejected: ip=%s errors=%s", identity,
                        response != null ? response.errorCodes() : null);
                return false;
            }
            return true;
        } catch (Exception e) {
            LOG.errorf(e, "Challenge verification failed: ip=%s", identity);
            return false;
        }
    }
}
