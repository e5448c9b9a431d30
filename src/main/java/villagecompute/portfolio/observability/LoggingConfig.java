package villagecompute.portfolio.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import org.jboss.logging.MDC;

/**
 * Standard MDC field names and helpers for structured logging of contact-form requests.
 *
 * <p>
 * <b>Standard Log Fields:</b>
 * <ul>
 * <li>{@code trace_id} - OpenTelemetry trace identifier</li>
 * <li>{@code span_id} - Current span identifier within the trace</li>
 * <li>{@code client_ip} - Resolved client identity of the submitter</li>
 * <li>{@code client_fingerprint} - Short hash of client identity and user agent</li>
 * <li>{@code request_origin} - HTTP request path or scheduler identifier</li>
 * <li>{@code rate_limit_bucket} - Rate-limit window that was evaluated last</li>
 * <li>{@code contact_verdict} - Final pipeline verdict for the request</li>
 * </ul>
 *
 * <p>
 * <b>Thread Safety:</b> All methods operate on {@link MDC}, which uses ThreadLocal storage. Callers must invoke
 * {@link #clearMDC()} when the request or job completes.
 */
public final class LoggingConfig {

    public static final String MDC_TRACE_ID = "trace_id";

    public static final String MDC_SPAN_ID = "span_id";

    public static final String MDC_CLIENT_IP = "client_ip";

    public static final String MDC_CLIENT_FINGERPRINT = "client_fingerprint";

    public static final String MDC_REQUEST_ORIGIN = "request_origin";

    public static final String MDC_RATE_LIMIT_BUCKET = "rate_limit_bucket";

    public static final String MDC_CONTACT_VERDICT = "contact_verdict";

    private LoggingConfig() {
        // Utility class, no instantiation
    }

    /**
     * Enriches MDC with trace_id and span_id from the current OpenTelemetry span. Empty strings are written when no
     * span is active so the JSON log schema stays stable.
     */
    public static void enrichWithTraceContext() {
        SpanContext spanContext = Span.current().getSpanContext();

        if (spanContext.isValid()) {
            MDC.put(MDC_TRACE_ID, spanContext.getTraceId());
            MDC.put(MDC_SPAN_ID, spanContext.getSpanId());
        } else {
            MDC.put(MDC_TRACE_ID, "");
            MDC.put(MDC_SPAN_ID, "");
        }
    }

    public static void setClientIp(String clientIp) {
        if (clientIp != null) {
            MDC.put(MDC_CLIENT_IP, clientIp);
        }
    }

    public static void setClientFingerprint(String fingerprint) {
        if (fingerprint != null) {
            MDC.put(MDC_CLIENT_FINGERPRINT, fingerprint);
        }
    }

    public static void setRequestOrigin(String requestOrigin) {
        if (requestOrigin != null) {
            MDC.put(MDC_REQUEST_ORIGIN, requestOrigin);
        }
    }

    public static void setRateLimitBucket(String rateLimitBucket) {
        if (rateLimitBucket != null) {
            MDC.put(MDC_RATE_LIMIT_BUCKET, rateLimitBucket);
        }
    }

    public static void setContactVerdict(String verdict) {
        if (verdict != null) {
            MDC.put(MDC_CONTACT_VERDICT, verdict);
        }
    }

    /**
     * Clears all observability-related MDC fields to prevent context leakage across thread reuse.
     */
    public static void clearMDC() {
        MDC.remove(MDC_TRACE_ID);
        MDC.remove(MDC_SPAN_ID);
        MDC.remove(MDC_CLIENT_IP);
        MDC.remove(MDC_CLIENT_FINGERPRINT);
        MDC.remove(MDC_REQUEST_ORIGIN);
        MDC.remove(MDC_RATE_LIMIT_BUCKET);
        MDC.remove(MDC_CONTACT_VERDICT);
    }
}
