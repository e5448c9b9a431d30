/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.portfolio.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.portfolio.data.models.SubmissionAttempt;
import villagecompute.portfolio.observability.LoggingConfig;
import villagecompute.portfolio.observability.ObservabilityMetrics;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Multi-window sliding rate limiter for contact-form submissions, backed by the submission audit log.
 *
 * <p>
 * Three trailing windows gate every submission: 2 per minute, 10 per hour, 50 per day. For each window the limiter
 * counts prior {@link SubmissionAttempt} rows (any outcome) whose identity OR email matches the current submission, so
 * rotating one key while reusing the other does not reset the count. Windows are evaluated shortest first and the first
 * exhausted window short-circuits the check.
 *
 * <p>
 * <b>Fail Closed:</b> If the record store cannot be queried the submission is denied. The limiter is the primary
 * defense against volumetric abuse, so an outage must not turn into unlimited admission.
 *
 * <p>
 * <b>Thread Safety:</b> Stateless between calls. Counting and the later log insert are separate statements, so
 * concurrent requests from one identity can both observe a count below the maximum and both be admitted. The limits
 * are therefore approximate by a small margin under concurrency.
 *
 * @see SubmissionLogService for the inserts that feed the counts
 */
@ApplicationScoped
public class ContactRateLimitService {

    private static final Logger LOG = Logger.getLogger(ContactRateLimitService.class);

    @Inject
    ObservabilityMetrics observabilityMetrics;

    /**
     * Fixed rate-limit windows, ordered shortest first.
     */
    public enum Window {
        PER_MINUTE("per_minute", Duration.ofMinutes(1), 2), PER_HOUR("per_hour", Duration.ofHours(1), 10), PER_DAY(
                "per_day", Duration.ofDays(1), 50);

        private final String value;
        private final Duration length;
        private final int maxSubmissions;

        Window(String value, Duration length, int maxSubmissions) {
            this.value = value;
            this.length = length;
            this.maxSubmissions = maxSubmissions;
        }

        public String getValue() {
            return value;
        }

        public Duration getLength() {
            return length;
        }

        public int getMaxSubmissions() {
            return maxSubmissions;
        }
    }

    /**
     * Rate limit check result.
     *
     * @param allowed
     *            whether the submission may proceed
     * @param violatedWindow
     *            first exhausted window (null when allowed or when the store was unavailable)
     * @param blockedUntil
     *            now + length of the violated window (null when allowed)
     * @param remaining
     *            remaining submissions per evaluated window
     * @param storeUnavailable
     *            true when the denial came from a record-store fault
     */
    public record RateLimitResult(boolean allowed, Window violatedWindow, Instant blockedUntil,
            Map<Window, Integer> remaining, boolean storeUnavailable) {

        public RateLimitResult {
            remaining = remaining == null ? Map.of() : Collections.unmodifiableMap(new EnumMap<>(remaining));
        }

        public static RateLimitResult allowed(Map<Window, Integer> remaining) {
            return new RateLimitResult(true, null, null, remaining, false);
        }

        public static RateLimitResult denied(Window window, Instant blockedUntil, Map<Window, Integer> remaining) {
            return new RateLimitResult(false, window, blockedUntil, remaining, false);
        }

        public static RateLimitResult unavailable(Instant retryAt) {
            return new RateLimitResult(false, null, retryAt, Map.of(), true);
        }

        /**
         * Seconds until the client may retry, rounded up, or 0 when allowed.
         */
        public long retryAfterSeconds(Instant now) {
            if (allowed || blockedUntil == null) {
                return 0;
            }
            long millis = Duration.between(now, blockedUntil).toMillis();
            return Math.max(1, (millis + 999) / 1000);
        }
    }

    /**
     * Checks whether a submission is admitted under all windows at the current instant.
     *
     * @param identity
     *            resolved client identity
     * @param email
     *            declared email (nullable)
     * @return admission result with per-window remaining counts
     */
    public RateLimitResult check(String identity, String email) {
        return check(identity, email, Instant.now());
    }

    /**
     * Checks whether a submission is admitted under all windows at {@code now}.
     *
     * @param identity
     *            resolved client identity
     * @param email
     *            declared email (nullable)
     * @param now
     *            evaluation instant
     * @return admission result with per-window remaining counts
     */
    public RateLimitResult check(String identity, String email, Instant now) {
        Objects.requireNonNull(identity, "identity is required");
        Objects.requireNonNull(now, "now is required");

        Map<Window, Integer> remaining = new EnumMap<>(Window.class);

        for (Window window : Window.values()) {
            long count;
            try {
                count = countAttempts(identity, email, now.minus(window.getLength()));
            } catch (RuntimeException e) {
                LOG.errorf(e, "Submission store unavailable during rate limit check, denying: ip=%s window=%s",
                        identity, window.getValue());
                observabilityMetrics.incrementStoreFailure("rate_limit_count");
                observabilityMetrics.incrementRateLimitCheck("store_unavailable", false);
                return RateLimitResult.unavailable(now.plus(Window.PER_MINUTE.getLength()));
            }

            remaining.put(window, (int) Math.max(0, window.getMaxSubmissions() - count));
            LoggingConfig.setRateLimitBucket(window.getValue());

            if (count >= window.getMaxSubmissions()) {
                Instant blockedUntil = now.plus(window.getLength());
                LOG.warnf("Rate limit exceeded: ip=%s window=%s count=%d max=%d blockedUntil=%s", identity,
                        window.getValue(), count, window.getMaxSubmissions(), blockedUntil);
                observabilityMetrics.incrementRateLimitCheck(window.getValue(), false);
                return RateLimitResult.denied(window, blockedUntil, remaining);
            }

            observabilityMetrics.incrementRateLimitCheck(window.getValue(), true);
        }

        return RateLimitResult.allowed(remaining);
    }

    long countAttempts(String identity, String email, Instant windowStart) {
        return SubmissionAttempt.countSince(identity, email, windowStart);
    }
}
