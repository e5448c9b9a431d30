package villagecompute.portfolio.services;

import jakarta.enterprise.context.ApplicationScoped;

import java.util.List;
import java.util.Locale;

/**
 * Coarse user-agent filter for non-browser clients.
 *
 * <p>
 * An empty user agent is suspicious. Otherwise the lower-cased agent is matched against known library and crawler
 * tokens. False positives and negatives are expected.
 */
@ApplicationScoped
public class BotUserAgentDetector {

    static final List<String> BOT_TOKENS = List.of("bot", "crawler", "spider", "scraper", "curl", "wget", "python",
            "requests", "urllib", "http", "java", "go-http", "okhttp");

    public boolean isSuspicious(String userAgent) {
        if (userAgent == null || userAgent.isBlank()) {
            return true;
        }

        String lower = userAgent.toLowerCase(Locale.ROOT);
        return BOT_TOKENS.stream().anyMatch(lower::contains);
    }
}
