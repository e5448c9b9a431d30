package villagecompute.portfolio.services;

import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import villagecompute.portfolio.data.models.SubmissionAttempt;
import villagecompute.portfolio.data.models.SubmissionOutcome;
import villagecompute.portfolio.services.ContactRateLimitService.RateLimitResult;
import villagecompute.portfolio.services.ContactRateLimitService.Window;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ContactRateLimitService sliding windows over logged submission attempts.
 */
@QuarkusTest
class ContactRateLimitServiceTest {

    @Inject
    ContactRateLimitService rateLimitService;

    private Instant now;

    @BeforeEach
    @Transactional
    void setUp() {
        SubmissionAttempt.deleteAll();
        now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
    }

    private void insertAttempt(String ip, String email, Instant submittedAt) {
        QuarkusTransaction.requiringNew()
                .run(() -> SubmissionAttempt.create(ip, email, SubmissionOutcome.ACCEPTED, "Mozilla/5.0", submittedAt));
    }

    @Test
    void testCheck_NoHistory_AllowedWithFullRemaining() {
        RateLimitResult result = rateLimitService.check("203.0.113.10", "first@example.com", now);

        assertTrue(result.allowed());
        assertNull(result.violatedWindow());
        assertEquals(2, result.remaining().get(Window.PER_MINUTE));
        assertEquals(10, result.remaining().get(Window.PER_HOUR));
        assertEquals(50, result.remaining().get(Window.PER_DAY));
    }

    @Test
    void testCheck_OnePriorAttempt_RemainingDecremented() {
        insertAttempt("203.0.113.11", "one@example.com", now.minusSeconds(10));

        RateLimitResult result = rateLimitService.check("203.0.113.11", "one@example.com", now);

        assertTrue(result.allowed());
        assertEquals(1, result.remaining().get(Window.PER_MINUTE));
        assertEquals(9, result.remaining().get(Window.PER_HOUR));
        assertEquals(49, result.remaining().get(Window.PER_DAY));
    }

    @Test
    void testCheck_ThirdAttemptWithinMinute_Denied() {
        insertAttempt("203.0.113.12", "burst@example.com", now.minusSeconds(30));
        insertAttempt("203.0.113.12", "burst@example.com", now.minusSeconds(5));

        RateLimitResult result = rateLimitService.check("203.0.113.12", "burst@example.com", now);

        assertFalse(result.allowed());
        assertFalse(result.storeUnavailable());
        assertEquals(Window.PER_MINUTE, result.violatedWindow());
        assertEquals(now.plus(Duration.ofMinutes(1)), result.blockedUntil());
        assertEquals(60, result.retryAfterSeconds(now));
    }

    @Test
    void testCheck_AttemptsOlderThanMinute_NotCountedInMinuteWindow() {
        insertAttempt("203.0.113.13", null, now.minusSeconds(90));
        insertAttempt("203.0.113.13", null, now.minusSeconds(120));

        RateLimitResult result = rateLimitService.check("203.0.113.13", null, now);

        assertTrue(result.allowed());
        assertEquals(2, result.remaining().get(Window.PER_MINUTE));
        assertEquals(8, result.remaining().get(Window.PER_HOUR));
    }

    @Test
    void testCheck_HourWindowExceeded_DeniedWithHourWindow() {
        for (int i = 0; i < 10; i++) {
            insertAttempt("203.0.113.14", null, now.minus(Duration.ofMinutes(2L + i * 5L)));
        }

        RateLimitResult result = rateLimitService.check("203.0.113.14", null, now);

        assertFalse(result.allowed());
        assertEquals(Window.PER_HOUR, result.violatedWindow());
        assertEquals(now.plus(Duration.ofHours(1)), result.blockedUntil());
    }

    @Test
    void testCheck_SameEmailDifferentIps_CountedTogether() {
        insertAttempt("198.51.100.1", "rotating@example.com", now.minusSeconds(20));
        insertAttempt("198.51.100.2", "rotating@example.com", now.minusSeconds(10));

        RateLimitResult result = rateLimitService.check("198.51.100.3", "rotating@example.com", now);

        assertFalse(result.allowed());
        assertEquals(Window.PER_MINUTE, result.violatedWindow());
    }

    @Test
    void testCheck_SameIpDifferentEmails_CountedTogether() {
        insertAttempt("198.51.100.9", "a@example.com", now.minusSeconds(20));
        insertAttempt("198.51.100.9", "b@example.com", now.minusSeconds(10));

        RateLimitResult result = rateLimitService.check("198.51.100.9", "c@example.com", now);

        assertFalse(result.allowed());
    }

    @Test
    void testCheck_RowMatchingIpAndEmail_CountedOnce() {
        insertAttempt("198.51.100.20", "both@example.com", now.minusSeconds(10));

        RateLimitResult result = rateLimitService.check("198.51.100.20", "both@example.com", now);

        assertTrue(result.allowed());
        assertEquals(1, result.remaining().get(Window.PER_MINUTE));
    }

    @Test
    void testCheck_UnrelatedIdentity_NotAffected() {
        insertAttempt("198.51.100.30", "x@example.com", now.minusSeconds(20));
        insertAttempt("198.51.100.30", "x@example.com", now.minusSeconds(10));

        RateLimitResult result = rateLimitService.check("198.51.100.31", "y@example.com", now);

        assertTrue(result.allowed());
    }
}
