package villagecompute.portfolio.api.types;

import villagecompute.portfolio.services.SpamScoringService.SpamSignal;

/**
 * One triggered spam heuristic, for the admin inbox.
 *
 * @param name
 *            signal name
 * @param contribution
 *            score contribution
 * @param detail
 *            short diagnostic
 */
public record SpamSignalType(String name, double contribution, String detail) {

    public static SpamSignalType fromSignal(SpamSignal signal) {
        return new SpamSignalType(signal.name(), signal.contribution(), signal.detail());
    }
}
