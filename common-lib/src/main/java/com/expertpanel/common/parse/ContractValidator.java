package com.expertpanel.common.parse;

import com.expertpanel.common.model.CaseContext;
import com.expertpanel.common.model.Decision;
import com.expertpanel.common.model.Opinion;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Shape checks for the data contracts. Each method returns the list of violations found;
 * an empty list means the value may be stored.
 */
public final class ContractValidator {

    public static final int MAX_ITEMS = 5;

    private ContractValidator() {}

    public static List<String> opinionViolations(Opinion opinion) {
        if (opinion == null) return List.of("opinion is null");
        List<String> violations = new ArrayList<>();
        checkList("hypotheses", opinion.hypotheses(), violations);
        checkList("recommendedTests", opinion.recommendedTests(), violations);
        return violations;
    }

    public static List<String> decisionViolations(Decision decision) {
        if (decision == null) return List.of("decision is null");
        List<String> violations = new ArrayList<>();
        checkList("consensusHypotheses", decision.consensusHypotheses(), violations);
        checkList("prioritizedTests", decision.prioritizedTests(), violations);
        if (decision.rationale().isBlank()) {
            violations.add("rationale is blank");
        }
        return violations;
    }

    public static List<String> caseContextViolations(CaseContext context) {
        if (context == null) return List.of("case context is null");
        List<String> violations = new ArrayList<>();
        checkFields("demographics", context.demographics(), violations);
        checkFields("symptoms", context.symptoms(), violations);
        checkFields("history", context.history(), violations);
        checkFields("medications", context.medications(), violations);
        checkFields("vitals", context.vitals(), violations);
        return violations;
    }

    /** First {@value #MAX_ITEMS} entries, in order. */
    public static List<String> cap(List<String> items) {
        return items.size() <= MAX_ITEMS ? List.copyOf(items) : List.copyOf(items.subList(0, MAX_ITEMS));
    }

    private static void checkList(String name, List<String> items, List<String> violations) {
        if (items.isEmpty()) {
            violations.add(name + " is empty");
            return;
        }
        if (items.size() > MAX_ITEMS) {
            violations.add(name + " has " + items.size() + " items (max " + MAX_ITEMS + ")");
        }
        if (items.stream().anyMatch(String::isBlank)) {
            violations.add(name + " contains a blank entry");
        }
    }

    private static void checkFields(String field, Map<String, Object> values, List<String> violations) {
        values.forEach((key, value) -> {
            if (!isSupportedValue(value)) {
                violations.add(field + "." + key + " has unsupported type "
                               + (value == null ? "null" : value.getClass().getSimpleName()));
            }
        });
    }

    private static boolean isSupportedValue(Object value) {
        if (value instanceof String || value instanceof Number || value instanceof Boolean) return true;
        if (value instanceof List<?> list) {
            return list.stream().allMatch(ContractValidator::isSupportedValue);
        }
        if (value instanceof Map<?, ?> map) {
            return map.keySet().stream().allMatch(k -> k instanceof String)
                && map.values().stream().allMatch(ContractValidator::isSupportedValue);
        }
        return false;
    }
}
