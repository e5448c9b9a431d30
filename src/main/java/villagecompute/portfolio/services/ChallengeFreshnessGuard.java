package villagecompute.portfolio.services;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.portfolio.config.ContactSecurityConfig;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Temporal policy for human-verification validations.
 *
 * <p>
 * A validation older than {@code contact.challenge.max-age} (5 minutes) is stale. A validation recorded less than
 * {@code contact.challenge.min-delay} (2 seconds) before the submission is too fast for a person. Missing validations
 * are treated as stale.
 */
@ApplicationScoped
public class ChallengeFreshnessGuard {

    @Inject
    ContactSecurityConfig config;

    private Duration maxAge;

    private Duration minDelay;

    public ChallengeFreshnessGuard() {
    }

    ChallengeFreshnessGuard(Duration maxAge, Duration minDelay) {
        this.maxAge = maxAge;
        this.minDelay = minDelay;
    }

    @PostConstruct
    void init() {
        this.maxAge = config.getChallengeMaxAge();
        this.minDelay = config.getChallengeMinDelay();
    }

    /**
     * @return true if the validation exists and is no older than the maximum age
     */
    public boolean isFresh(Instant lastValidation, Instant now) {
        if (lastValidation == null) {
            return false;
        }
        return Duration.between(lastValidation, now).compareTo(maxAge) <= 0;
    }

    /**
     * @return true if the validation happened less than the minimum delay before {@code now}
     */
    public boolean isTooFast(Instant lastValidation, Instant now) {
        if (lastValidation == null) {
            return false;
        }
        return Duration.between(lastValidation, now).compareTo(minDelay) < 0;
    }

    /**
     * Applies both policies.
     *
     * @return the violated policy, or empty when the validation is acceptable
     */
    public Optional<ContactDecision.BlockReason> evaluate(Instant lastValidation, Instant now) {
        if (!isFresh(lastValidation, now)) {
            return Optional.of(ContactDecision.BlockReason.CHALLENGE_STALE);
        }
        if (isTooFast(lastValidation, now)) {
            return Optional.of(ContactDecision.BlockReason.CHALLENGE_TOO_FAST);
        }
        return Optional.empty();
    }
}
