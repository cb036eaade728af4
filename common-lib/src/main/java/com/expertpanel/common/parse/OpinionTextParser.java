package com.expertpanel.common.parse;

import com.expertpanel.common.model.Opinion;
import com.expertpanel.common.outcome.Outcome;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Extracts an {@link Opinion} from an expert's free-text response.
 *
 * <p>Headings (lines starting with {@code **} or {@code #}, italic lines, or lines ending in
 * {@code :}) switch the current section by whole-word keyword:
 * <pre>
 *   "hypothesis" / "hypotheses"         → hypotheses
 *   "test" / "tests" / "testing"        → recommended tests
 *   "colleague" / "peer" / "evaluation" → critique (follow-up rounds only)
 *   anything else                       → ignored section
 * </pre>
 * List items inside the hypotheses and tests sections are collected in order and capped at
 * {@value ContractValidator#MAX_ITEMS}. The full response is kept as the justification.
 *
 * <p>Returns a failure {@link Outcome} when the text is blank or either list comes out empty.
 */
public final class OpinionTextParser {

    private static final Pattern HYPOTHESES_HEADING = Pattern.compile("\\bhypothes[ie]s\\b");
    private static final Pattern TESTS_HEADING      = Pattern.compile("\\btest(s|ing)?\\b");
    private static final Pattern CRITIQUE_HEADING   = Pattern.compile("\\b(colleagues?|peers?|evaluation)\\b");

    private enum Section { NONE, HYPOTHESES, TESTS, CRITIQUE }

    private OpinionTextParser() {}

    public static Outcome<Opinion> parse(String text, boolean followUpRound) {
        if (text == null || text.isBlank()) {
            return Outcome.failure("empty response");
        }

        List<String> hypotheses   = new ArrayList<>();
        List<String> tests        = new ArrayList<>();
        List<String> critique     = new ArrayList<>();
        List<String> peerMentions = new ArrayList<>();
        Section current = Section.NONE;

        for (String raw : text.split("\\R")) {
            String line = raw.strip();
            if (line.isEmpty()) continue;

            if (BulletItems.isHeading(line)) {
                current = classify(line);
                continue;
            }

            boolean item = BulletItems.isItem(line);
            String content = item ? BulletItems.strip(line) : line;
            if (content.isEmpty()) continue;

            switch (current) {
                case HYPOTHESES -> { if (item) hypotheses.add(content); }
                case TESTS      -> { if (item) tests.add(content); }
                case CRITIQUE   -> critique.add(content);
                default         -> {
                    if (mentionsPeers(content)) peerMentions.add(content);
                }
            }
        }

        if (hypotheses.isEmpty()) return Outcome.failure("no diagnostic hypotheses found in response");
        if (tests.isEmpty())      return Outcome.failure("no recommended tests found in response");

        String critiqueText = "";
        if (followUpRound) {
            critiqueText = String.join(" ", critique.isEmpty() ? peerMentions : critique);
        }

        return Outcome.success(new Opinion(
            ContractValidator.cap(hypotheses),
            ContractValidator.cap(tests),
            text.strip(),
            critiqueText,
            false));
    }

    private static Section classify(String heading) {
        String lower = heading.toLowerCase(Locale.ROOT);
        if (HYPOTHESES_HEADING.matcher(lower).find()) return Section.HYPOTHESES;
        if (TESTS_HEADING.matcher(lower).find())      return Section.TESTS;
        if (CRITIQUE_HEADING.matcher(lower).find())   return Section.CRITIQUE;
        return Section.NONE;
    }

    private static boolean mentionsPeers(String line) {
        String lower = line.toLowerCase(Locale.ROOT);
        return lower.contains("colleague") || lower.contains("peer");
    }
}
