package villagecompute.portfolio.api.types;

/**
 * Response body for {@code POST /api/contact}. Accepted, spam-flagged and honeypot submissions all receive the same
 * success body.
 *
 * @param status
 *            {@code sent} on success, {@code rejected} otherwise
 * @param message
 *            human-readable message
 */
public record ContactSubmissionResponseType(String status, String message) {

    public static final String SUCCESS_MESSAGE = "Thanks for your message! I'll get back to you soon.";

    public static ContactSubmissionResponseType success() {
        return new ContactSubmissionResponseType("sent", SUCCESS_MESSAGE);
    }

    public static ContactSubmissionResponseType rejected(String message) {
        return new ContactSubmissionResponseType("rejected", message);
    }
}
