package com.expertpanel.common.consensus;

import com.expertpanel.common.model.Decision;
import com.expertpanel.common.model.Opinion;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Default {@link ConsensusEvaluator}: coordinator declaration OR opinion overlap.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Declared: the decision has a non-blank termination reason.</li>
 *   <li>Overlap: skip unless the round holds at least {@value #MIN_PANEL_SIZE} opinions.</li>
 *   <li>Normalise every hypothesis and test string (trim, lower-case) and de-duplicate per
 *       expert, so one expert repeating a string counts once.</li>
 *   <li>Count, per normalised string, the distinct experts producing it. Fallback opinions
 *       are substituted placeholders and are not counted.</li>
 *   <li>Overlap holds when some hypothesis AND some test each reach
 *       {@value #MIN_AGREEING_EXPERTS} experts.</li>
 * </ol>
 *
 * <p>Panels of one or two experts can never satisfy the overlap path.
 *
 * <p>This class is stateless and thread-safe.
 */
public class OverlapConsensusStrategy implements ConsensusEvaluator {

    static final int MIN_PANEL_SIZE       = 3;
    static final int MIN_AGREEING_EXPERTS = 2;

    @Override
    public ConsensusResult evaluate(Map<String, Opinion> opinions, Decision decision) {
        boolean declared = decision != null && decision.declaresTermination();

        List<String> sharedHypotheses = List.of();
        List<String> sharedTests      = List.of();
        if (opinions != null && opinions.size() >= MIN_PANEL_SIZE) {
            sharedHypotheses = shared(opinions, Opinion::hypotheses);
            sharedTests      = shared(opinions, Opinion::recommendedTests);
        }
        boolean overlap = !sharedHypotheses.isEmpty() && !sharedTests.isEmpty();

        return new ConsensusResult(declared || overlap, declared, overlap, sharedHypotheses, sharedTests);
    }

    /** Lower-cased, trimmed form used for agreement comparisons. */
    public static String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }

    private List<String> shared(Map<String, Opinion> opinions, Function<Opinion, List<String>> field) {
        Map<String, Integer> expertCounts = new HashMap<>();
        List<String> firstSeenOrder = new ArrayList<>();

        for (Opinion opinion : opinions.values()) {
            if (opinion == null || opinion.fallback()) continue;
            Set<String> perExpert = new LinkedHashSet<>();
            for (String item : field.apply(opinion)) {
                String key = normalize(item);
                if (!key.isEmpty()) perExpert.add(key);
            }
            for (String key : perExpert) {
                if (expertCounts.merge(key, 1, Integer::sum) == 1) {
                    firstSeenOrder.add(key);
                }
            }
        }

        List<String> shared = new ArrayList<>();
        for (String key : firstSeenOrder) {
            if (expertCounts.get(key) >= MIN_AGREEING_EXPERTS) shared.add(key);
        }
        return shared;
    }
}
