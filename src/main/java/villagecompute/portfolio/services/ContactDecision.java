package villagecompute.portfolio.services;

import villagecompute.portfolio.services.ContactRateLimitService.RateLimitResult;
import villagecompute.portfolio.services.SpamScoringService.SpamAnalysis;

import java.util.UUID;

/**
 * Outcome of one pipeline run.
 *
 * @param verdict
 *            final verdict
 * @param reason
 *            block reason (null unless blocked)
 * @param state
 *            terminal pipeline state
 * @param decidedAt
 *            last state the run passed through before logging, i.e. the check that blocked or {@code SCORE}
 * @param rateLimit
 *            rate-limit result (null if the check did not run)
 * @param spamAnalysis
 *            spam analysis (null unless scored)
 * @param messageId
 *            stored message id (null unless accepted)
 */
public record ContactDecision(Verdict verdict, BlockReason reason, PipelineState state, PipelineState decidedAt,
        RateLimitResult rateLimit, SpamAnalysis spamAnalysis, UUID messageId) {

    public ContactDecision {
        if (state == null || !state.isTerminal()) {
            throw new IllegalArgumentException("Decision state must be terminal: " + state);
        }
        if (decidedAt == null || decidedAt.isTerminal()) {
            throw new IllegalArgumentException("Decision must record the check that decided it: " + decidedAt);
        }
    }

    public enum Verdict {
        ACCEPTED("accepted"), ACCEPTED_AS_SPAM("accepted_as_spam"), BLOCKED("blocked");

        private final String code;

        Verdict(String code) {
            this.code = code;
        }

        public String getCode() {
            return code;
        }
    }

    public enum BlockReason {
        RATE_LIMIT_EXCEEDED("rate_limit_exceeded"), HONEYPOT_TRIGGERED("honeypot_triggered"), SUSPICIOUS_USER_AGENT(
                "suspicious_user_agent"), CHALLENGE_STALE("challenge_stale"), CHALLENGE_TOO_FAST("challenge_too_fast");

        private final String code;

        BlockReason(String code) {
            this.code = code;
        }

        public String getCode() {
            return code;
        }
    }

    /**
     * Pipeline states in evaluation order. Terminal states are {@link #ACCEPTED}, {@link #ACCEPTED_AS_SPAM} and
     * {@link #BLOCKED}.
     */
    public enum PipelineState {
        START, RATE_LIMIT_CHECK, HONEYPOT_CHECK, UA_CHECK, FRESHNESS_CHECK, SCORE, LOGGED, ACCEPTED, ACCEPTED_AS_SPAM, BLOCKED;

        public boolean isTerminal() {
            return this == ACCEPTED || this == ACCEPTED_AS_SPAM || this == BLOCKED;
        }
    }

    public static ContactDecision blocked(BlockReason reason, PipelineState decidedAt, RateLimitResult rateLimit) {
        return new ContactDecision(Verdict.BLOCKED, reason, PipelineState.BLOCKED, decidedAt, rateLimit, null, null);
    }

    public static ContactDecision accepted(boolean spam, RateLimitResult rateLimit, SpamAnalysis analysis,
            UUID messageId) {
        return spam
                ? new ContactDecision(Verdict.ACCEPTED_AS_SPAM, null, PipelineState.ACCEPTED_AS_SPAM,
                        PipelineState.SCORE, rateLimit, analysis, messageId)
                : new ContactDecision(Verdict.ACCEPTED, null, PipelineState.ACCEPTED, PipelineState.SCORE, rateLimit,
                        analysis, messageId);
    }

    /**
     * Whether the submitter should see a success response. Honeypot blocks and spam are masked as success so automated
     * senders learn nothing about detection.
     */
    public boolean presentsSuccess() {
        return verdict != Verdict.BLOCKED || reason == BlockReason.HONEYPOT_TRIGGERED;
    }

    /**
     * Whether the notification collaborator should be told about the message.
     */
    public boolean shouldNotify() {
        return verdict == Verdict.ACCEPTED;
    }

    public Double spamScore() {
        return spamAnalysis == null ? null : spamAnalysis.score();
    }

    public boolean isSpam() {
        return verdict == Verdict.ACCEPTED_AS_SPAM;
    }
}
