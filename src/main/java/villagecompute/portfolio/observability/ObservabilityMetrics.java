package villagecompute.portfolio.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Custom Micrometer metrics for the contact-form pipeline.
 *
 * <p>
 * <b>Metrics Catalog:</b>
 * <ul>
 * <li><b>Counters:</b> {@code portfolio_contact_submissions_total{verdict,reason}} - Pipeline outcomes</li>
 * <li><b>Counters:</b> {@code portfolio_contact_rate_limit_checks_total{window,result}} - Rate limit check
 * outcomes</li>
 * <li><b>Counters:</b> {@code portfolio_contact_store_failures_total{operation}} - Record store faults that were
 * absorbed (log insert) or failed closed (rate-limit count)</li>
 * <li><b>Summaries:</b> {@code portfolio_contact_spam_score} - Distribution of computed spam scores</li>
 * </ul>
 *
 * <p>
 * Metrics are exported in Prometheus format at {@code /q/metrics}.
 */
@ApplicationScoped
public class ObservabilityMetrics {

    @Inject
    MeterRegistry registry;

    private final Map<String, Counter> submissionCounters = new ConcurrentHashMap<>();

    private final Map<String, Counter> rateLimitCounters = new ConcurrentHashMap<>();

    private final Map<String, Counter> storeFailureCounters = new ConcurrentHashMap<>();

    /**
     * Counts a completed pipeline run.
     *
     * @param verdict
     *            verdict code (accepted, accepted_as_spam, blocked)
     * @param reason
     *            block reason code, or "none"
     */
    public void incrementSubmission(String verdict, String reason) {
        String key = verdict + ":" + reason;
        submissionCounters.computeIfAbsent(key,
                k -> Counter.builder("portfolio_contact_submissions_total")
                        .description("Contact-form submissions by verdict and reason").tag("verdict", verdict)
                        .tag("reason", reason).register(registry))
                .increment();
    }

    /**
     * Counts a rate-limit window evaluation.
     *
     * @param window
     *            window code (per_minute, per_hour, per_day, or store_unavailable)
     * @param allowed
     *            whether the window admitted the request
     */
    public void incrementRateLimitCheck(String window, boolean allowed) {
        String result = allowed ? "allowed" : "denied";
        String key = window + ":" + result;
        rateLimitCounters.computeIfAbsent(key,
                k -> Counter.builder("portfolio_contact_rate_limit_checks_total")
                        .description("Contact rate limit checks by window and result").tag("window", window)
                        .tag("result", result).register(registry))
                .increment();
    }

    /**
     * Counts a record-store fault.
     *
     * @param operation
     *            failing operation (rate_limit_count, submission_log, retention_purge)
     */
    public void incrementStoreFailure(String operation) {
        storeFailureCounters.computeIfAbsent(operation,
                k -> Counter.builder("portfolio_contact_store_failures_total")
                        .description("Contact record store faults by operation").tag("operation", operation)
                        .register(registry))
                .increment();
    }

    public void recordSpamScore(double score) {
        DistributionSummary.builder("portfolio_contact_spam_score").description("Spam scores of scored submissions")
                .register(registry).record(score);
    }
}
