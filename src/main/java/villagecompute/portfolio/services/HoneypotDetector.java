package villagecompute.portfolio.services;

import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Map;

/**
 * Detects automated submitters through decoy form fields.
 *
 * <p>
 * The decoy fields are rendered in the contact form but hidden from people by the presentation layer. Any non-blank
 * value in one of them marks the submission as automated. The pipeline still answers such submissions with a success
 * response and records them as blocked.
 */
@ApplicationScoped
public class HoneypotDetector {

    private static final Logger LOG = Logger.getLogger(HoneypotDetector.class);

    public static final List<String> HONEYPOT_FIELDS = List.of("website", "url", "phone_number", "fax", "company");

    /**
     * Checks submitted form fields for filled decoys.
     *
     * @param formFields
     *            raw submitted field values (nullable)
     * @return true if any decoy field carries a non-whitespace value
     */
    public boolean isTriggered(Map<String, String> formFields) {
        if (formFields == null || formFields.isEmpty()) {
            return false;
        }

        for (String field : HONEYPOT_FIELDS) {
            String value = formFields.get(field);
            if (value != null && !value.isBlank()) {
                LOG.warnf("Honeypot triggered: field '%s' was filled", field);
                return true;
            }
        }

        return false;
    }
}
