package villagecompute.portfolio.services;

import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import villagecompute.portfolio.data.models.ContactMessage;
import villagecompute.portfolio.data.models.SubmissionAttempt;
import villagecompute.portfolio.data.models.SubmissionOutcome;
import villagecompute.portfolio.services.ContactDecision.BlockReason;
import villagecompute.portfolio.services.ContactDecision.PipelineState;
import villagecompute.portfolio.services.ContactDecision.Verdict;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests for ContactSubmissionPipeline against the H2 record store.
 */
@QuarkusTest
class ContactSubmissionPipelineTest {

    static final String BROWSER = "Mozilla/5.0 (legit browser)";

    static final String CLEAN_BODY = "Hello there, I came across your portfolio while looking for a developer to help "
            + "with a small web project for our local library. We would like to build a simple site that lists "
            + "upcoming events and lets visitors sign up for reading groups. Could we schedule a short call next week "
            + "to talk about scope and timeline? Thanks so much for your help with this.";

    @Inject
    ContactSubmissionPipeline pipeline;

    @BeforeEach
    @Transactional
    void setUp() {
        SubmissionAttempt.deleteAll();
        ContactMessage.deleteAll();
    }

    static ContactSubmission submission(String ip, String userAgent, Map<String, String> formFields, String email,
            String subject, String body) {
        return new ContactSubmission(ip, userAgent, formFields, null, null, "Jane Doe", email, subject, body);
    }

    @Test
    void testProcess_LegitBrowserCleanMessage_Accepted() {
        ContactDecision decision = pipeline.process(
                submission("203.0.113.60", BROWSER, Map.of(), "jane@example.com", "Library project", CLEAN_BODY));

        assertEquals(Verdict.ACCEPTED, decision.verdict());
        assertEquals(PipelineState.ACCEPTED, decision.state());
        assertEquals(PipelineState.SCORE, decision.decidedAt());
        assertNull(decision.reason());
        assertTrue(decision.spamScore() < 0.1, "Score should be below 0.1 but was " + decision.spamScore());
        assertFalse(decision.isSpam());
        assertTrue(decision.presentsSuccess());
        assertTrue(decision.shouldNotify());

        ContactMessage message = ContactMessage.findById(decision.messageId());
        assertNotNull(message);
        assertFalse(message.isSpam);
        assertFalse(message.isRead);
        assertEquals("203.0.113.60", message.ipAddress);
        assertEquals(BROWSER, message.userAgent);

        assertSingleAttempt("203.0.113.60", SubmissionOutcome.ACCEPTED);
    }

    @Test
    void testProcess_PythonRequestsAgent_BlockedRegardlessOfContent() {
        ContactDecision decision = pipeline.process(submission("203.0.113.61", "python-requests/2.28", Map.of(),
                "jane@example.com", "Library project", CLEAN_BODY));

        assertEquals(Verdict.BLOCKED, decision.verdict());
        assertEquals(BlockReason.SUSPICIOUS_USER_AGENT, decision.reason());
        assertEquals(PipelineState.BLOCKED, decision.state());
        assertEquals(PipelineState.UA_CHECK, decision.decidedAt());
        assertFalse(decision.presentsSuccess());
        assertNull(decision.spamAnalysis());
        assertEquals(0, ContactMessage.count());

        assertSingleAttempt("203.0.113.61", SubmissionOutcome.BLOCKED);
    }

    @Test
    void testProcess_HoneypotFilled_BlockedButPresentsSuccess() {
        ContactDecision decision = pipeline.process(submission("203.0.113.62", BROWSER,
                Map.of("website", "http://spam.example"), "jane@example.com", "Library project", CLEAN_BODY));

        assertEquals(Verdict.BLOCKED, decision.verdict());
        assertEquals(BlockReason.HONEYPOT_TRIGGERED, decision.reason());
        assertEquals(PipelineState.HONEYPOT_CHECK, decision.decidedAt());
        assertTrue(decision.presentsSuccess());
        assertFalse(decision.shouldNotify());
        assertEquals(0, ContactMessage.count());

        assertSingleAttempt("203.0.113.62", SubmissionOutcome.BLOCKED);
    }

    @Test
    void testProcess_HoneypotAndBotAgent_HoneypotCheckedFirst() {
        ContactDecision decision = pipeline.process(submission("203.0.113.63", "curl/8.4.0",
                Map.of("fax", "555-0100"), "jane@example.com", "Library project", CLEAN_BODY));

        assertEquals(BlockReason.HONEYPOT_TRIGGERED, decision.reason());
    }

    @Test
    void testProcess_ThirdSubmissionWithinMinute_RateLimited() {
        ContactSubmission candidate = submission("203.0.113.64", BROWSER, Map.of(), "burst@example.com",
                "Library project", CLEAN_BODY);

        assertEquals(Verdict.ACCEPTED, pipeline.process(candidate).verdict());
        assertEquals(Verdict.ACCEPTED, pipeline.process(candidate).verdict());
        ContactDecision third = pipeline.process(candidate);

        assertEquals(Verdict.BLOCKED, third.verdict());
        assertEquals(BlockReason.RATE_LIMIT_EXCEEDED, third.reason());
        assertEquals(PipelineState.RATE_LIMIT_CHECK, third.decidedAt());
        assertEquals(ContactRateLimitService.Window.PER_MINUTE, third.rateLimit().violatedWindow());
        assertFalse(third.presentsSuccess());

        assertEquals(2, ContactMessage.count());
        assertEquals(3, SubmissionAttempt.findByIp("203.0.113.64", 10).size());
    }

    @Test
    void testProcess_BlockedAttemptsCountTowardRateLimit() {
        ContactSubmission bot = submission("203.0.113.65", "Wget/1.21", Map.of(), "loop@example.com", "Hi",
                CLEAN_BODY);
        pipeline.process(bot);
        pipeline.process(bot);

        ContactDecision decision = pipeline.process(
                submission("203.0.113.65", BROWSER, Map.of(), "loop@example.com", "Library project", CLEAN_BODY));

        assertEquals(BlockReason.RATE_LIMIT_EXCEEDED, decision.reason());
    }

    @Test
    void testProcess_SpamContent_StoredAsSpamWithoutNotification() {
        ContactDecision decision = pipeline.process(submission("203.0.113.66", BROWSER, Map.of(), "x12345@spam.io",
                "FREE MONEY NOW!!! http://a.io http://b.io $100 $200", "Buy bitcoin casino viagra loan!!!!!!!!"));

        assertEquals(Verdict.ACCEPTED_AS_SPAM, decision.verdict());
        assertEquals(PipelineState.ACCEPTED_AS_SPAM, decision.state());
        assertTrue(decision.isSpam());
        assertTrue(decision.presentsSuccess());
        assertFalse(decision.shouldNotify());
        assertTrue(decision.spamScore() > 0.7);
        assertFalse(decision.spamAnalysis().triggeredSignals().isEmpty());

        ContactMessage message = ContactMessage.findById(decision.messageId());
        assertNotNull(message);
        assertTrue(message.isSpam);
        assertEquals(decision.spamScore(), message.spamScore, 1e-9);

        assertSingleAttempt("203.0.113.66", SubmissionOutcome.ACCEPTED);
    }

    @Test
    void testProcess_ChallengeDisabled_NoValidationNeeded() {
        ContactDecision decision = pipeline.process(
                submission("203.0.113.67", BROWSER, Map.of(), "nochallenge@example.com", null, CLEAN_BODY));

        assertEquals(Verdict.ACCEPTED, decision.verdict());
    }

    private static void assertSingleAttempt(String ip, SubmissionOutcome outcome) {
        List<SubmissionAttempt> attempts = SubmissionAttempt.findByIp(ip, 10);
        assertEquals(1, attempts.size(), "Exactly one attempt should be logged");
        assertEquals(outcome, attempts.get(0).outcome());
    }
}
