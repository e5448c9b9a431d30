package villagecompute.portfolio.data.models;

/**
 * Outcome recorded for a contact-form submission attempt.
 *
 * <p>
 * Stored as the lower-case {@link #getValue() value} in {@code contact_submission_logs.outcome}.
 */
public enum SubmissionOutcome {
    ACCEPTED("accepted"), BLOCKED("blocked");

    private final String value;

    SubmissionOutcome(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static SubmissionOutcome fromValue(String value) {
        for (SubmissionOutcome outcome : values()) {
            if (outcome.value.equals(value)) {
                return outcome;
            }
        }
        throw new IllegalArgumentException("Unknown submission outcome: " + value);
    }
}
