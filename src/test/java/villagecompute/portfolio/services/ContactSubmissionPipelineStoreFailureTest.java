package villagecompute.portfolio.services;

import io.quarkus.test.InjectMock;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import villagecompute.portfolio.data.models.ContactMessage;
import villagecompute.portfolio.data.models.SubmissionAttempt;
import villagecompute.portfolio.data.models.SubmissionOutcome;
import villagecompute.portfolio.exceptions.ContactStoreException;
import villagecompute.portfolio.services.ContactDecision.BlockReason;
import villagecompute.portfolio.services.ContactDecision.PipelineState;
import villagecompute.portfolio.services.ContactDecision.Verdict;
import villagecompute.portfolio.services.ContactRateLimitService.RateLimitResult;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Pipeline behavior when the record store fails.
 */
@QuarkusTest
class ContactSubmissionPipelineStoreFailureTest {

    @Inject
    ContactSubmissionPipeline pipeline;

    @InjectMock
    ContactRateLimitService rateLimitService;

    @BeforeEach
    @Transactional
    void setUp() {
        SubmissionAttempt.deleteAll();
        ContactMessage.deleteAll();
    }

    @Test
    void testProcess_RateLimitStoreUnavailable_BlockedAndLoggedOnce() {
        Instant now = Instant.now();
        when(rateLimitService.check(anyString(), any(), any()))
                .thenReturn(RateLimitResult.unavailable(now.plusSeconds(60)));

        ContactDecision decision = pipeline.process(ContactSubmissionPipelineTest.submission("203.0.113.42",
                ContactSubmissionPipelineTest.BROWSER, Map.of(), "jane@example.com", "Hi",
                ContactSubmissionPipelineTest.CLEAN_BODY), now);

        assertEquals(Verdict.BLOCKED, decision.verdict());
        assertEquals(BlockReason.RATE_LIMIT_EXCEEDED, decision.reason());
        assertEquals(PipelineState.RATE_LIMIT_CHECK, decision.decidedAt());
        assertTrue(decision.rateLimit().storeUnavailable());
        assertFalse(decision.presentsSuccess());

        List<SubmissionAttempt> attempts = SubmissionAttempt.findByIp("203.0.113.42", 10);
        assertEquals(1, attempts.size());
        assertEquals(SubmissionOutcome.BLOCKED, attempts.get(0).outcome());
        assertEquals(0, ContactMessage.count());
    }

    @Test
    void testProcess_MessageInsertFails_LogsAcceptedOnceAndThrows() {
        when(rateLimitService.check(anyString(), any(), any())).thenReturn(RateLimitResult.allowed(Map.of()));
        // name column holds 100 characters
        String oversizedName = "J".repeat(150);
        ContactSubmission submission = new ContactSubmission("203.0.113.43", ContactSubmissionPipelineTest.BROWSER,
                Map.of(), null, null, oversizedName, "jane@example.com", "Hi",
                ContactSubmissionPipelineTest.CLEAN_BODY);

        assertThrows(ContactStoreException.class, () -> pipeline.process(submission));

        List<SubmissionAttempt> attempts = SubmissionAttempt.findByIp("203.0.113.43", 10);
        assertEquals(1, attempts.size());
        assertEquals(SubmissionOutcome.ACCEPTED, attempts.get(0).outcome());
        assertEquals(0, ContactMessage.count());
    }
}
