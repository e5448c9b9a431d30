/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.portfolio.services;

import io.quarkus.narayana.jta.QuarkusTransaction;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.portfolio.config.ContactSecurityConfig;
import villagecompute.portfolio.data.models.ContactMessage;
import villagecompute.portfolio.data.models.SubmissionOutcome;
import villagecompute.portfolio.exceptions.ContactStoreException;
import villagecompute.portfolio.observability.LoggingConfig;
import villagecompute.portfolio.observability.ObservabilityMetrics;
import villagecompute.portfolio.services.ContactDecision.BlockReason;
import villagecompute.portfolio.services.ContactDecision.PipelineState;
import villagecompute.portfolio.services.ContactRateLimitService.RateLimitResult;
import villagecompute.portfolio.services.SpamScoringService.SpamAnalysis;

import java.time.Instant;
import java.util.Optional;

/**
 * Runs one contact-form submission through the abuse-mitigation checks and returns the final decision.
 *
 * <p>
 * <b>Order:</b>
 * <ol>
 * <li>Rate limit (IP and email windows)</li>
 * <li>Honeypot fields</li>
 * <li>User-agent heuristic</li>
 * <li>Challenge freshness (only when {@code contact.challenge.enabled})</li>
 * <li>Spam scoring, which never blocks</li>
 * </ol>
 * The first failing check ends the run as {@code BLOCKED}. Every run writes exactly one submission log entry before
 * returning.
 *
 * <p>
 * With the challenge check enabled, a fresh validation is claimed from the {@link ChallengeSessionStore} before scoring.
 * Only one submission can claim a given validation; concurrent submissions carrying the same session lose the claim
 * and are blocked as {@code challenge_stale}.
 *
 * <p>
 * The pipeline holds no state between calls; the record store and the challenge session store carry everything.
 */
@ApplicationScoped
public class ContactSubmissionPipeline {

    private static final Logger LOG = Logger.getLogger(ContactSubmissionPipeline.class);

    @Inject
    ContactSecurityConfig config;

    @Inject
    ContactRateLimitService rateLimitService;

    @Inject
    HoneypotDetector honeypotDetector;

    @Inject
    BotUserAgentDetector userAgentDetector;

    @Inject
    ChallengeFreshnessGuard freshnessGuard;

    @Inject
    ChallengeSessionStore sessionStore;

    @Inject
    SpamScoringService spamScoringService;

    @Inject
    SubmissionLogService submissionLogService;

    @Inject
    ObservabilityMetrics metrics;

    public ContactDecision process(ContactSubmission submission) {
        return process(submission, Instant.now());
    }

    /**
     * Evaluates a submission.
     *
     * @param submission
     *            candidate submission
     * @param now
     *            evaluation instant
     * @return decision with verdict, block reason and diagnostics
     * @throws ContactStoreException
     *             if an accepted message cannot be stored
     */
    public ContactDecision process(ContactSubmission submission, Instant now) {
        String identity = submission.identity();
        PipelineState stage = advance(PipelineState.START, PipelineState.RATE_LIMIT_CHECK, identity);

        RateLimitResult rateLimit = rateLimitService.check(identity, submission.email(), now);
        if (!rateLimit.allowed()) {
            LOG.warnf("Contact submission rate limited: ip=%s window=%s storeUnavailable=%s", identity,
                    rateLimit.violatedWindow() != null ? rateLimit.violatedWindow().getValue() : "unknown",
                    rateLimit.storeUnavailable());
            return block(submission, BlockReason.RATE_LIMIT_EXCEEDED, stage, rateLimit, now);
        }

        stage = advance(stage, PipelineState.HONEYPOT_CHECK, identity);
        if (honeypotDetector.isTriggered(submission.formFields())) {
            return block(submission, BlockReason.HONEYPOT_TRIGGERED, stage, rateLimit, now);
        }

        stage = advance(stage, PipelineState.UA_CHECK, identity);
        if (userAgentDetector.isSuspicious(submission.userAgent())) {
            LOG.warnf("Suspicious user agent on contact submission: ip=%s userAgent=%s", identity,
                    submission.userAgent());
            return block(submission, BlockReason.SUSPICIOUS_USER_AGENT, stage, rateLimit, now);
        }

        stage = advance(stage, PipelineState.FRESHNESS_CHECK, identity);
        if (config.isChallengeEnabled()) {
            Optional<BlockReason> violation = freshnessGuard.evaluate(submission.lastChallengeValidation(), now);
            if (violation.isPresent()) {
                LOG.warnf("Challenge check failed on contact submission: ip=%s reason=%s", identity,
                        violation.get().getCode());
                clearChallenge(submission);
                return block(submission, violation.get(), stage, rateLimit, now);
            }
            // a validation covers one submission
            if (!sessionStore.consume(submission.challengeSessionId(), submission.lastChallengeValidation())) {
                LOG.warnf("Challenge validation already claimed by another submission: ip=%s", identity);
                return block(submission, BlockReason.CHALLENGE_STALE, stage, rateLimit, now);
            }
        }

        stage = advance(stage, PipelineState.SCORE, identity);
        SpamAnalysis analysis = spamScoringService.analyze(submission.name(), submission.email(), submission.subject(),
                submission.body());
        metrics.recordSpamScore(analysis.score());

        ContactMessage message;
        try {
            message = QuarkusTransaction.requiringNew()
                    .call(() -> ContactMessage.create(submission.name(), submission.email(), submission.subject(),
                            submission.body(), identity, config.truncateUserAgent(submission.userAgent()),
                            analysis.score(), config.getSpamThreshold()));
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to store contact message: ip=%s", identity);
            metrics.incrementStoreFailure("contact_message");
            submissionLogService.log(identity, submission.email(), SubmissionOutcome.ACCEPTED, submission.userAgent(),
                    now);
            throw new ContactStoreException("Failed to store contact message", e);
        }

        submissionLogService.log(identity, submission.email(), SubmissionOutcome.ACCEPTED, submission.userAgent(),
                now);
        advance(stage, PipelineState.LOGGED, identity);

        ContactDecision decision = ContactDecision.accepted(message.isSpam, rateLimit, analysis, message.id);
        LoggingConfig.setContactVerdict(decision.verdict().getCode());
        metrics.incrementSubmission(decision.verdict().getCode(), "none");
        LOG.infof("Contact submission accepted: id=%s ip=%s spam=%s score=%.3f", message.id, identity,
                message.isSpam, analysis.score());
        return decision;
    }

    private ContactDecision block(ContactSubmission submission, BlockReason reason, PipelineState decidedAt,
            RateLimitResult rateLimit, Instant now) {
        submissionLogService.log(submission.identity(), submission.email(), SubmissionOutcome.BLOCKED,
                submission.userAgent(), now);
        advance(decidedAt, PipelineState.LOGGED, submission.identity());

        ContactDecision decision = ContactDecision.blocked(reason, decidedAt, rateLimit);
        LoggingConfig.setContactVerdict(decision.verdict().getCode());
        metrics.incrementSubmission(decision.verdict().getCode(), reason.getCode());
        return decision;
    }

    private static PipelineState advance(PipelineState from, PipelineState to, String identity) {
        LOG.tracef("Contact pipeline: ip=%s %s -> %s", identity, from, to);
        return to;
    }

    private void clearChallenge(ContactSubmission submission) {
        if (submission.challengeSessionId() != null) {
            sessionStore.clearValidation(submission.challengeSessionId());
        }
    }
}
