package villagecompute.portfolio.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of a retention purge.
 *
 * @param days
 *            retention period used
 * @param deleted
 *            number of attempts deleted
 */
public record PurgeResultType(int days, @JsonProperty("deleted_count") long deleted) {
}
