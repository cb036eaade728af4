package com.expertpanel.common.parse;

import com.expertpanel.common.model.Decision;
import com.expertpanel.common.outcome.Outcome;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts a {@link Decision} from the coordinator's free-text consensus analysis.
 *
 * <h3>Sections</h3>
 * <pre>
 *   **Integrated Hypothesis**  → items under "Main Candidates:"
 *   **Priority Tests**         → items under "Immediately Needed:"
 *   **Consensus Status**       → "Consensus Rationale:" text (may continue on plain lines)
 *   **Consensus Analysis**, **Safety Considerations** → skipped
 * </pre>
 *
 * <p>Sub-section labels are recognised with or without a bullet and with or without bold
 * markup ({@code - Main Candidates:}, {@code **Main Candidates:**}, {@code Main Candidates:}),
 * and are matched before a bold line can be taken for a section heading.
 *
 * <p>Items of three characters or fewer are dropped. Inside the status section the markers
 * "Clear consensus", "Complete consensus" and "Consensus Reached: Yes" set the termination
 * reason to {@value #DECLARED_CONSENSUS}; lines phrased conditionally ("only if", "only when")
 * echo the prompt template and never count. A rationale shorter than
 * {@value #MIN_RATIONALE_LENGTH} characters is replaced by the head of the response.
 */
public final class DecisionTextParser {

    public static final String DECLARED_CONSENSUS = "consensus declared by coordinator";

    static final int MIN_RATIONALE_LENGTH   = 10;
    static final int RATIONALE_PREVIEW_CHARS = 500;

    private static final Pattern LEADING_MARKER = Pattern.compile("^[-*•]\\s*");
    private static final Pattern LABEL = Pattern.compile("^([A-Za-z][A-Za-z -]{2,40}):(.*)$");

    private static final Set<String> SUBSECTION_LABELS = Set.of(
        "agreed opinions", "conflicting opinions", "evidence level",
        "main candidates", "excluded hypotheses", "additional review needed",
        "immediately needed", "phased progression", "optional considerations",
        "consensus reached", "consensus rationale", "next steps", "consensus expression",
        "warning signs", "emergency situations", "follow-up monitoring");

    private static final Pattern REACHED_YES =
        Pattern.compile("consensus reached:\\s*\\**\\s*yes", Pattern.CASE_INSENSITIVE);

    private enum Section { NONE, HYPOTHESIS, TESTS, STATUS, ANALYSIS, SAFETY }

    private DecisionTextParser() {}

    public static Outcome<Decision> parse(String text) {
        if (text == null || text.isBlank()) {
            return Outcome.failure("empty response");
        }

        List<String> hypotheses = new ArrayList<>();
        List<String> tests      = new ArrayList<>();
        StringBuilder rationale = new StringBuilder();
        String terminationReason = null;

        Section section = Section.NONE;
        String subsection = null;

        for (String raw : text.split("\\R")) {
            String line = raw.strip();
            if (line.isEmpty()) continue;

            Matcher labelled = LABEL.matcher(bare(line));
            String label = labelled.matches() ? labelled.group(1).trim().toLowerCase(Locale.ROOT) : null;
            boolean isLabel = label != null && SUBSECTION_LABELS.contains(label);

            if (!isLabel) {
                Section heading = sectionOf(line);
                if (heading != null) {
                    section = heading;
                    subsection = null;
                    continue;
                }
            }

            if (isLabel) {
                subsection = label;
                String inline = labelled.group(2).strip();
                switch (section) {
                    case HYPOTHESIS -> { if (label.equals("main candidates")) addInline(hypotheses, inline); }
                    case TESTS      -> { if (label.equals("immediately needed")) addInline(tests, inline); }
                    case STATUS     -> { if (label.equals("consensus rationale")) rationale.append(inline); }
                    default         -> { }
                }
            } else if (section == Section.HYPOTHESIS && "main candidates".equals(subsection)) {
                addItem(hypotheses, line);
            } else if (section == Section.TESTS && "immediately needed".equals(subsection)) {
                addItem(tests, line);
            } else if (section == Section.STATUS && "consensus rationale".equals(subsection)
                       && !line.startsWith("-") && !line.startsWith("**")) {
                if (rationale.length() > 0) rationale.append(' ');
                rationale.append(line);
            }

            if (section == Section.STATUS && terminationReason == null && declaresConsensus(line)) {
                terminationReason = DECLARED_CONSENSUS;
            }
        }

        if (hypotheses.isEmpty()) return Outcome.failure("no consensus hypotheses found in response");
        if (tests.isEmpty())      return Outcome.failure("no prioritized tests found in response");

        String rationaleText = rationale.toString().strip();
        if (rationaleText.length() < MIN_RATIONALE_LENGTH) {
            String trimmed = text.strip();
            rationaleText = trimmed.substring(0, Math.min(RATIONALE_PREVIEW_CHARS, trimmed.length()));
        }

        return Outcome.success(new Decision(
            ContractValidator.cap(hypotheses),
            ContractValidator.cap(tests),
            rationaleText,
            terminationReason,
            false));
    }

    /** Line without its bullet marker and bold markup. */
    private static String bare(String line) {
        return LEADING_MARKER.matcher(line.replace("**", "").strip()).replaceFirst("").strip();
    }

    private static Section sectionOf(String line) {
        if (!line.startsWith("**") && !line.startsWith("#")) return null;
        String lower = line.toLowerCase(Locale.ROOT);
        if (lower.contains("integrated hypothes"))   return Section.HYPOTHESIS;
        if (lower.contains("priority tests"))        return Section.TESTS;
        if (lower.contains("consensus status"))      return Section.STATUS;
        if (lower.contains("consensus analysis"))    return Section.ANALYSIS;
        if (lower.contains("safety considerations")) return Section.SAFETY;
        return line.endsWith("**") || line.startsWith("#") ? Section.NONE : null;
    }

    private static boolean declaresConsensus(String line) {
        String lower = line.toLowerCase(Locale.ROOT);
        if (lower.contains("only if") || lower.contains("only when")) return false;
        return line.contains("Clear consensus")
            || line.contains("Complete consensus")
            || REACHED_YES.matcher(line).find();
    }

    private static void addItem(List<String> target, String line) {
        if (!BulletItems.isItem(line)) return;
        String item = BulletItems.strip(line);
        if (item.length() > 3) target.add(item);
    }

    private static void addInline(List<String> target, String inline) {
        if (inline.isEmpty()) return;
        for (String part : inline.split("[,;]")) {
            String item = part.replace("**", "").strip();
            if (item.length() > 3) target.add(item);
        }
    }
}
