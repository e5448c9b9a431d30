package villagecompute.portfolio.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.util.HashMap;
import java.util.Map;

/**
 * Request DTO for {@code POST /api/contact}.
 *
 * <p>
 * The {@code website}, {@code url}, {@code phone_number}, {@code fax} and {@code company} properties are honeypot
 * decoys. The public form renders them hidden, so a human never fills them in.
 *
 * <pre>
 * {
 *   "name": "Jane Doe",
 *   "email": "jane@example.com",
 *   "subject": "Project inquiry",
 *   "message": "Hi, I saw your portfolio and would like to talk about a project."
 * }
 * </pre>
 *
 * @param name
 *            submitter name (1-100 chars)
 * @param email
 *            submitter email
 * @param subject
 *            optional subject (max 200 chars)
 * @param message
 *            message body (max 5,000 chars)
 * @param website
 *            honeypot
 * @param url
 *            honeypot
 * @param phoneNumber
 *            honeypot
 * @param fax
 *            honeypot
 * @param company
 *            honeypot
 */
public record ContactSubmissionRequestType(@NotBlank @Size(
        max = 100) String name,
        @NotBlank @Email @Size(
                max = 120) String email,
        @Size(
                max = 200) String subject,
        @NotBlank @Size(
                max = 5_000,
                message = "Message must be at most 5,000 characters") String message,
        String website, String url, @JsonProperty("phone_number") String phoneNumber, String fax, String company) {

    /**
     * Raw field mapping for honeypot inspection. Absent fields are omitted.
     */
    public Map<String, String> formFields() {
        Map<String, String> fields = new HashMap<>();
        put(fields, "name", name);
        put(fields, "email", email);
        put(fields, "subject", subject);
        put(fields, "message", message);
        put(fields, "website", website);
        put(fields, "url", url);
        put(fields, "phone_number", phoneNumber);
        put(fields, "fax", fax);
        put(fields, "company", company);
        return fields;
    }

    private static void put(Map<String, String> fields, String key, String value) {
        if (value != null) {
            fields.put(key, value);
        }
    }
}
