package com.expertpanel.common.consensus;

import com.expertpanel.common.model.Decision;
import com.expertpanel.common.model.Opinion;
import com.expertpanel.common.parse.FallbackFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class OverlapConsensusStrategyTest {

    private final OverlapConsensusStrategy strategy = new OverlapConsensusStrategy();

    private static final Decision UNDECLARED = Decision.of(List.of("pneumonia"), List.of("chest x-ray"), "synthesis");

    private static Map<String, Opinion> panel(Opinion... opinions) {
        Map<String, Opinion> map = new LinkedHashMap<>();
        for (int i = 0; i < opinions.length; i++) {
            map.put("expert_" + (i + 1), opinions[i]);
        }
        return map;
    }

    // ── overlap path ──────────────────────────────────────────────────────

    @Nested
    @DisplayName("overlap")
    class OverlapTests {

        @Test
        @DisplayName("pairwise disjoint opinions → no consensus")
        void disjointOpinions_noConsensus() {
            ConsensusResult result = strategy.evaluate(panel(
                Opinion.of(List.of("A"), List.of("X"), "j"),
                Opinion.of(List.of("B"), List.of("Y"), "j"),
                Opinion.of(List.of("C"), List.of("Z"), "j")), UNDECLARED);

            assertFalse(result.reached());
            assertFalse(result.overlapReached());
            assertTrue(result.sharedHypotheses().isEmpty());
        }

        @Test
        @DisplayName("two of three share a hypothesis and a test → consensus")
        void twoOfThreeShare_consensus() {
            ConsensusResult result = strategy.evaluate(panel(
                Opinion.of(List.of("Pneumonia", "Bronchitis"), List.of("Chest X-ray"), "j"),
                Opinion.of(List.of(" pneumonia "), List.of("chest x-ray", "CBC"), "j"),
                Opinion.of(List.of("Asthma"), List.of("Spirometry"), "j")), UNDECLARED);

            assertTrue(result.reached());
            assertTrue(result.overlapReached());
            assertFalse(result.declaredByDecision());
            assertEquals(List.of("pneumonia"), result.sharedHypotheses());
            assertEquals(List.of("chest x-ray"), result.sharedTests());
        }

        @Test
        @DisplayName("shared hypothesis without a shared test → no consensus")
        void hypothesisOnly_noConsensus() {
            ConsensusResult result = strategy.evaluate(panel(
                Opinion.of(List.of("Pneumonia"), List.of("Chest X-ray"), "j"),
                Opinion.of(List.of("Pneumonia"), List.of("CBC"), "j"),
                Opinion.of(List.of("Asthma"), List.of("Spirometry"), "j")), UNDECLARED);

            assertFalse(result.reached());
            assertEquals(List.of("pneumonia"), result.sharedHypotheses());
        }

        @Test
        @DisplayName("one expert repeating a string counts once")
        void repetitionWithinExpert_countsOnce() {
            ConsensusResult result = strategy.evaluate(panel(
                Opinion.of(List.of("Pneumonia", "PNEUMONIA"), List.of("CBC", "cbc"), "j"),
                Opinion.of(List.of("Asthma"), List.of("Spirometry"), "j"),
                Opinion.of(List.of("Bronchitis"), List.of("Sputum culture"), "j")), UNDECLARED);

            assertFalse(result.reached());
        }

        @Test
        @DisplayName("two-expert panel in full agreement → overlap never applies")
        void twoExpertPanel_noOverlap() {
            ConsensusResult result = strategy.evaluate(panel(
                Opinion.of(List.of("Pneumonia"), List.of("Chest X-ray"), "j"),
                Opinion.of(List.of("Pneumonia"), List.of("Chest X-ray"), "j")), UNDECLARED);

            assertFalse(result.reached());
            assertFalse(result.overlapReached());
        }

        @Test
        @DisplayName("identical fallback opinions do not agree with each other")
        void fallbackOpinions_notCounted() {
            ConsensusResult result = strategy.evaluate(panel(
                FallbackFactory.expertFailureOpinion("expert_1", "timeout"),
                FallbackFactory.expertFailureOpinion("expert_2", "timeout"),
                Opinion.of(List.of("Asthma"), List.of("Spirometry"), "j")), UNDECLARED);

            assertFalse(result.reached());
        }
    }

    // ── fallback opinions ─────────────────────────────────────────────────

    @Nested
    @DisplayName("fallback opinions are excluded from overlap counting")
    class FallbackExclusionTests {

        private final Opinion pneumonia = Opinion.of(List.of("Pneumonia"), List.of("Chest X-ray"), "j");

        private Opinion substituted(Opinion content) {
            return new Opinion(content.hypotheses(), content.recommendedTests(), "substituted", "", true);
        }

        @Test
        @DisplayName("a fallback matching one real expert does not make a second agreeing expert")
        void fallbackOpinions_excludedFromOverlapCount() {
            ConsensusResult result = strategy.evaluate(panel(
                pneumonia,
                substituted(pneumonia),
                Opinion.of(List.of("Asthma"), List.of("Spirometry"), "j")), UNDECLARED);

            assertFalse(result.reached());
            assertFalse(result.overlapReached());
            assertTrue(result.sharedHypotheses().isEmpty());
            assertTrue(result.sharedTests().isEmpty());
        }

        @Test
        @DisplayName("two agreeing real experts still reach consensus beside a fallback")
        void realAgreement_withFallbackInPanel() {
            ConsensusResult result = strategy.evaluate(panel(
                pneumonia,
                Opinion.of(List.of("pneumonia"), List.of("chest x-ray"), "j"),
                FallbackFactory.expertFailureOpinion("expert_3", "timeout")), UNDECLARED);

            assertTrue(result.overlapReached());
            assertEquals(List.of("pneumonia"), result.sharedHypotheses());
        }
    }

    // ── declared path ─────────────────────────────────────────────────────

    @Nested
    @DisplayName("declared")
    class DeclaredTests {

        @Test
        @DisplayName("decision with termination reason → consensus regardless of opinions")
        void declaredDecision_consensus() {
            Decision declared = new Decision(List.of("pneumonia"), List.of("chest x-ray"),
                                             "experts agree", "consensus declared by coordinator", false);
            ConsensusResult result = strategy.evaluate(panel(
                Opinion.of(List.of("A"), List.of("X"), "j"),
                Opinion.of(List.of("B"), List.of("Y"), "j")), declared);

            assertTrue(result.reached());
            assertTrue(result.declaredByDecision());
            assertFalse(result.overlapReached());
        }

        @Test
        @DisplayName("blank termination reason is not a declaration")
        void blankReason_notDeclared() {
            Decision blank = new Decision(List.of("a"), List.of("b"), "r", "  ", false);
            assertFalse(strategy.evaluate(Map.of(), blank).declaredByDecision());
        }

        @Test
        @DisplayName("null inputs → no consensus")
        void nullInputs_noConsensus() {
            assertFalse(strategy.evaluate(null, null).reached());
        }
    }

    @Test
    @DisplayName("normalize trims and lower-cases")
    void normalize() {
        assertEquals("chest x-ray", OverlapConsensusStrategy.normalize("  Chest X-Ray "));
        assertEquals("", OverlapConsensusStrategy.normalize(null));
    }
}
