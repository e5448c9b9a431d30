package villagecompute.portfolio.services;

import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rule-based spam scoring for contact-form content.
 *
 * <p>
 * The score is a sum of independent signal contributions, each capped on its own, with the total clamped to [0,1].
 * Every contribution is non-negative, so adding a triggering signal to otherwise unchanged input never lowers the
 * score.
 *
 * <p>
 * <b>Signals:</b>
 * <ul>
 * <li><b>spam_keywords:</b> 0.1 per distinct keyword found, cap 0.4</li>
 * <li><b>spam_patterns:</b> 0.05 per structural pattern match (URLs, caps runs, "!!", dollar amounts, long digit runs,
 * symbol runs), cap 0.3</li>
 * <li><b>very_short_message:</b> body under 10 characters, +0.2</li>
 * <li><b>very_long_message:</b> body over 2000 characters, +0.15</li>
 * <li><b>numeric_email:</b> 5+ consecutive digits in the email, +0.1</li>
 * <li><b>repeated_chars:</b> 5+ identical consecutive characters anywhere, +0.1</li>
 * <li><b>no_spaces:</b> body without a single space, +0.2</li>
 * <li><b>excessive_punct:</b> punctuation ratio above 10%, +min(ratio * 0.5, 0.2)</li>
 * </ul>
 *
 * <p>
 * Scoring never blocks a submission; the caller compares the score with the spam threshold.
 */
@ApplicationScoped
public class SpamScoringService {

    private static final Logger LOG = Logger.getLogger(SpamScoringService.class);

    static final List<String> SPAM_KEYWORDS = List.of("bitcoin", "cryptocurrency", "investment", "trading", "forex",
            "casino", "viagra", "cialis", "pharmacy", "pills", "weight loss", "diet pills", "make money", "earn money",
            "work from home", "business opportunity", "guaranteed", "no risk", "limited time", "act now", "urgent",
            "click here", "visit our website", "check out our", "amazing deal", "seo services", "backlinks",
            "increase traffic", "ranking", "loan", "credit", "debt", "mortgage", "insurance", "replica", "fake",
            "counterfeit", "cheap", "discount");

    private static final Pattern CAPS_RUN = Pattern.compile("\\b[A-Z]{3,}\\b");

    /**
     * Structural patterns evaluated on the lower-cased combined text. The caps-run pattern is evaluated separately on
     * the original text since lower-casing would erase it.
     */
    private static final List<Pattern> LOWERCASE_PATTERNS = List.of(Pattern.compile("https?://\\S+"),
            Pattern.compile("!{2,}"), Pattern.compile("\\$\\d+"), Pattern.compile("\\b\\d{10,}\\b"),
            Pattern.compile("[^\\w\\s]{3,}"));

    private static final Pattern NUMERIC_EMAIL = Pattern.compile("\\d{5,}");

    private static final Pattern REPEATED_CHARS = Pattern.compile("(.)\\1{4,}", Pattern.DOTALL);

    private static final Pattern PUNCTUATION = Pattern.compile("[!@#$%^&*(),.?\":{}|<>]");

    static final double KEYWORD_WEIGHT = 0.1;
    static final double KEYWORD_CAP = 0.4;
    static final double PATTERN_WEIGHT = 0.05;
    static final double PATTERN_CAP = 0.3;
    static final int SHORT_MESSAGE_LENGTH = 10;
    static final double SHORT_MESSAGE_PENALTY = 0.2;
    static final int LONG_MESSAGE_LENGTH = 2000;
    static final double LONG_MESSAGE_PENALTY = 0.15;
    static final double NUMERIC_EMAIL_PENALTY = 0.1;
    static final double REPEATED_CHARS_PENALTY = 0.1;
    static final double NO_SPACES_PENALTY = 0.2;
    static final double PUNCTUATION_RATIO_THRESHOLD = 0.1;
    static final double PUNCTUATION_WEIGHT = 0.5;
    static final double PUNCTUATION_CAP = 0.2;

    /**
     * Single heuristic outcome, kept for diagnostics.
     *
     * @param name
     *            signal identifier
     * @param triggered
     *            whether the heuristic fired
     * @param contribution
     *            amount added to the raw score (0 when not triggered)
     * @param detail
     *            human-readable detail (match counts, ratios)
     */
    public record SpamSignal(String name, boolean triggered, double contribution, String detail) {

        static SpamSignal of(String name, double contribution, String detail) {
            return new SpamSignal(name, contribution > 0, contribution, detail);
        }
    }

    /**
     * Full scoring result.
     *
     * @param score
     *            clamped score in [0,1]
     * @param signals
     *            one entry per heuristic, in evaluation order
     */
    public record SpamAnalysis(double score, List<SpamSignal> signals) {

        public SpamAnalysis {
            signals = List.copyOf(signals);
        }

        public List<SpamSignal> triggeredSignals() {
            return signals.stream().filter(SpamSignal::triggered).toList();
        }
    }

    /**
     * Computes the spam score for a submission.
     *
     * @return score in [0,1]
     */
    public double score(String name, String email, String subject, String body) {
        return analyze(name, email, subject, body).score();
    }

    /**
     * Computes the spam score with per-signal diagnostics.
     *
     * @param name
     *            submitter name (nullable)
     * @param email
     *            submitter email (nullable)
     * @param subject
     *            subject line (nullable)
     * @param body
     *            message body (nullable)
     * @return analysis with clamped score and every signal's state
     */
    public SpamAnalysis analyze(String name, String email, String subject, String body) {
        String safeEmail = nullToEmpty(email);
        String safeBody = nullToEmpty(body);
        String combined = nullToEmpty(name) + " " + safeEmail + " " + nullToEmpty(subject) + " " + safeBody;
        String lowerCombined = combined.toLowerCase();

        List<SpamSignal> signals = new ArrayList<>();

        int keywordMatches = 0;
        for (String keyword : SPAM_KEYWORDS) {
            if (lowerCombined.contains(keyword)) {
                keywordMatches++;
            }
        }
        signals.add(SpamSignal.of("spam_keywords", Math.min(keywordMatches * KEYWORD_WEIGHT, KEYWORD_CAP),
                keywordMatches + " matches"));

        int patternMatches = countMatches(CAPS_RUN, combined);
        for (Pattern pattern : LOWERCASE_PATTERNS) {
            patternMatches += countMatches(pattern, lowerCombined);
        }
        signals.add(SpamSignal.of("spam_patterns", Math.min(patternMatches * PATTERN_WEIGHT, PATTERN_CAP),
                patternMatches + " matches"));

        int trimmedLength = safeBody.strip().length();
        signals.add(SpamSignal.of("very_short_message", trimmedLength < SHORT_MESSAGE_LENGTH ? SHORT_MESSAGE_PENALTY : 0,
                "length " + trimmedLength));
        signals.add(SpamSignal.of("very_long_message", trimmedLength > LONG_MESSAGE_LENGTH ? LONG_MESSAGE_PENALTY : 0,
                "length " + trimmedLength));

        signals.add(SpamSignal.of("numeric_email", NUMERIC_EMAIL.matcher(safeEmail).find() ? NUMERIC_EMAIL_PENALTY : 0,
                safeEmail));

        signals.add(SpamSignal.of("repeated_chars",
                REPEATED_CHARS.matcher(lowerCombined).find() ? REPEATED_CHARS_PENALTY : 0, ""));

        signals.add(SpamSignal.of("no_spaces", safeBody.strip().indexOf(' ') < 0 ? NO_SPACES_PENALTY : 0, ""));

        double ratio = (double) countMatches(PUNCTUATION, safeBody) / Math.max(safeBody.length(), 1);
        double punctuationScore = ratio > PUNCTUATION_RATIO_THRESHOLD
                ? Math.min(ratio * PUNCTUATION_WEIGHT, PUNCTUATION_CAP)
                : 0;
        signals.add(SpamSignal.of("excessive_punct", punctuationScore, String.format("ratio %.2f", ratio)));

        double raw = signals.stream().mapToDouble(SpamSignal::contribution).sum();
        double score = Math.max(0.0, Math.min(raw, 1.0));

        if (score > 0.1) {
            LOG.infof("Spam analysis: email=%s score=%.3f signals=%s", safeEmail, score,
                    signals.stream().filter(SpamSignal::triggered)
                            .map(s -> String.format("%s(+%.2f)", s.name(), s.contribution())).toList());
        }

        return new SpamAnalysis(score, signals);
    }

    private static int countMatches(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
