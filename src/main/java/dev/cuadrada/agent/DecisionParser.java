package dev.cuadrada.agent;

import dev.cuadrada.domain.enums.Decision;
import dev.cuadrada.domain.valueobject.ParsedReview;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies a free-text review into ACCEPTED, REVISION or REJECTED.
 *
 * <p>Order of evidence:
 * <ol>
 *   <li>The last {@code FINAL DECISION: **...**} line of the review. The whole verdict
 *       must be a known one; "ACCEPTED WITH ..." is a revision, a negated or unknown
 *       verdict is refused.</li>
 *   <li>Without that line, keyword evidence, but only when exactly one verdict family
 *       is mentioned and no verdict word is negated. "accepted ... revision" is
 *       ambiguous and is refused.</li>
 * </ol>
 * Anything else raises {@link ReviewParseException}; the parser never picks a default.
 */
@Component
public class DecisionParser {

    private static final int SUMMARY_LIMIT = 300;

    private static final Pattern FINAL_DECISION = Pattern.compile(
            "FINAL\\s+DECISION\\s*(?::\\s*\\**|\\*\\*)\\s*([^*\\r\\n]+?)\\s*(?:\\*+|$)",
            Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);

    private static final Pattern VERDICT_NEGATION = Pattern.compile(
            "\\b(?:NOT|NO|CANNOT|CAN'T|NEVER)\\b|\\bUN(?:ACCEPT|RECOMMEND|PUBLISH)");
    private static final Pattern ACCEPTED_VERDICT = Pattern.compile("ACCEPT(?:ED)?");
    private static final Pattern REVISION_VERDICT = Pattern.compile(
            "ACCEPT(?:ED)?\\s+WITH\\b.*|(?:(?:MINOR|MAJOR)\\s+)?REVISIONS?(?:\\s+REQUIRED)?");
    private static final Pattern REJECTED_VERDICT = Pattern.compile("REJECT(?:ED)?");

    private static final Pattern NULL_HYPOTHESIS = Pattern.compile(
            "\\breject(?:s|ed|ing)?\\s+(?:the\\s+|a\\s+)?null\\b[^.;\\n]*"
                    + "|\\brejection\\s+of\\s+(?:the\\s+|a\\s+)?null\\b[^.;\\n]*");
    private static final Pattern NEGATED_VERDICT_WORD = Pattern.compile(
            "\\b(?:not|cannot|can't|never|no)\\s+(?:\\w+\\s+){0,2}(?:accept|recommend|publish|reject|revis)"
                    + "|\\bun(?:accept|publishable)");
    private static final Pattern ACCEPT_WORDS = Pattern.compile(
            "\\baccept(?:ed|ance)?\\b|recommend(?:ed|s)?\\s+(?:for\\s+)?publication");
    private static final Pattern REVISION_WORDS = Pattern.compile(
            "\\brevision(?:s)?\\b|\\brevise[ds]?\\b|improvements\\s+needed");
    private static final Pattern REJECT_WORDS = Pattern.compile("\\breject(?:ed|ion|s)?\\b");

    public ParsedReview parse(String reviewText) {
        if (reviewText == null || reviewText.isBlank())
            throw new ReviewParseException("Empty review text");
        Decision decision = classify(reviewText);
        return new ParsedReview(decision, summarize(reviewText), reviewText.trim());
    }

    Decision classify(String reviewText) {
        Matcher marker = FINAL_DECISION.matcher(reviewText);
        String lastVerdict = null;
        while (marker.find()) {
            lastVerdict = marker.group(1);
        }
        if (lastVerdict != null) return classifyVerdict(lastVerdict);

        String lower = NULL_HYPOTHESIS.matcher(reviewText.toLowerCase(Locale.ROOT)).replaceAll(" ");
        if (NEGATED_VERDICT_WORD.matcher(lower).find())
            throw new ReviewParseException("Review negates a verdict and has no final decision line");
        Set<Decision> evidence = EnumSet.noneOf(Decision.class);
        if (ACCEPT_WORDS.matcher(lower).find()) evidence.add(Decision.ACCEPTED);
        if (REVISION_WORDS.matcher(lower).find()) evidence.add(Decision.REVISION);
        if (REJECT_WORDS.matcher(lower).find()) evidence.add(Decision.REJECTED);

        if (evidence.size() == 1) return evidence.iterator().next();
        if (evidence.isEmpty())
            throw new ReviewParseException("Review contains no recognizable decision");
        throw new ReviewParseException("Review is ambiguous between " + evidence);
    }

    private static Decision classifyVerdict(String rawVerdict) {
        String verdict = rawVerdict.toUpperCase(Locale.ROOT)
                .replaceAll("[^A-Z']+", " ")
                .trim();
        if (VERDICT_NEGATION.matcher(verdict).find())
            throw new ReviewParseException("Negated final decision: " + rawVerdict.trim());
        if (ACCEPTED_VERDICT.matcher(verdict).matches()) return Decision.ACCEPTED;
        if (REVISION_VERDICT.matcher(verdict).matches()) return Decision.REVISION;
        if (REJECTED_VERDICT.matcher(verdict).matches()) return Decision.REJECTED;
        throw new ReviewParseException("Unrecognized final decision: " + rawVerdict.trim());
    }

    /**
     * First paragraph of the review, capped at {@value #SUMMARY_LIMIT} characters.
     */
    static String summarize(String reviewText) {
        String trimmed = reviewText.trim();
        String first = trimmed.split("\\R\\s*\\R", 2)[0].trim();
        if (first.length() > SUMMARY_LIMIT) return first.substring(0, SUMMARY_LIMIT) + "...";
        return first;
    }
}
