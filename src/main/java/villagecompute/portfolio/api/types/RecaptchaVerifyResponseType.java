package villagecompute.portfolio.api.types;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * reCAPTCHA {@code siteverify} response.
 *
 * @param success
 *            whether the token was valid
 * @param challengeTs
 *            timestamp of the challenge load (ISO format)
 * @param hostname
 *            hostname of the site where the challenge was solved
 * @param errorCodes
 *            optional error codes
 */
@JsonIgnoreProperties(
        ignoreUnknown = true)
public record RecaptchaVerifyResponseType(boolean success, @JsonProperty("challenge_ts") String challengeTs,
        String hostname, @JsonProperty("error-codes") List<String> errorCodes) {
}
