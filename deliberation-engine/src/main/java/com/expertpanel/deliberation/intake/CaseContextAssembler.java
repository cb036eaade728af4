package com.expertpanel.deliberation.intake;

import com.expertpanel.common.model.CaseContext;
import com.expertpanel.common.model.ImagingFinding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Builds a {@link CaseContext} from intake answers using keyword heuristics.
 *
 * <p>Each structured field keeps the raw answer under {@code raw} plus boolean flags:
 * <pre>
 *   demographics → age_mentioned, gender_mentioned, occupation_mentioned, age (when parseable)
 *   history      → has_history
 *   symptoms     → has_symptoms, keywords, emergency_keywords
 *   medications  → has_medications
 * </pre>
 * {@code freeText} is every non-blank answer and note joined by newlines.
 */
@Component
public class CaseContextAssembler {

    private static final Logger log = LoggerFactory.getLogger(CaseContextAssembler.class);

    private static final Pattern AGE = Pattern.compile(
        "(\\d{1,3})\\s*(?:-\\s*)?(?:years?(?:\\s*-?\\s*old)?|yrs?|yo|y/o)\\b", Pattern.CASE_INSENSITIVE);

    private static final List<String> AGE_WORDS        = List.of("age", "aged", "year old", "years old", "born in");
    private static final List<String> GENDER_WORDS     = List.of("male", "female", "man", "woman", "boy", "girl");
    private static final List<String> OCCUPATION_WORDS = List.of("work", "job", "occupation", "employed", "retired", "student");
    private static final List<String> NEGATIVE_WORDS   = List.of("none", "no ", "nothing", "not taking", "denies", "n/a");

    private static final List<String> SYMPTOM_WORDS = List.of(
        "fever", "cough", "headache", "pain", "fatigue", "nausea", "vomiting", "dizziness",
        "shortness of breath", "rash", "diarrhea", "chills", "sore throat", "weight loss", "swelling");

    public CaseContext assemble(IntakeAnswers answers, ImagingFinding finding) {
        Map<String, Object> demographics = withRaw(answers.demographics());
        if (!answers.demographics().isBlank()) {
            String lower = lower(answers.demographics());
            Matcher age = AGE.matcher(answers.demographics());
            boolean agePresent = age.find();
            if (agePresent) demographics.put("age", Integer.parseInt(age.group(1)));
            demographics.put("age_mentioned", agePresent || containsAny(lower, AGE_WORDS));
            demographics.put("gender_mentioned", containsWord(lower, GENDER_WORDS));
            demographics.put("occupation_mentioned", containsAny(lower, OCCUPATION_WORDS));
        }

        Map<String, Object> history = withRaw(answers.history());
        if (!answers.history().isBlank()) {
            history.put("has_history", !isNegative(answers.history()));
        }

        Map<String, Object> symptoms = withRaw(answers.symptoms());
        if (!answers.symptoms().isBlank()) {
            String lower = lower(answers.symptoms());
            symptoms.put("has_symptoms", !isNegative(answers.symptoms()) && !lower.contains("check-up"));
            symptoms.put("keywords", SYMPTOM_WORDS.stream().filter(lower::contains).toList());
            symptoms.put("emergency_keywords", EmergencyKeywordDetector.detect(answers.symptoms()));
        }

        Map<String, Object> medications = withRaw(answers.medications());
        if (!answers.medications().isBlank()) {
            medications.put("has_medications", !isNegative(answers.medications()));
        }

        String freeText = Stream.concat(
                Stream.of(answers.demographics(), answers.history(), answers.symptoms(), answers.medications()),
                answers.notes().stream())
            .filter(s -> s != null && !s.isBlank())
            .map(String::strip)
            .collect(Collectors.joining("\n"));

        log.info("[Intake] Case context assembled. demographicsFlags={} symptomKeywords={} imaging={}",
                 demographics.size(), symptoms.getOrDefault("keywords", List.of()),
                 finding != null && !finding.isEmpty());

        return new CaseContext(demographics, symptoms, history, medications, Map.of(),
                               finding == null ? ImagingFinding.none() : finding, freeText);
    }

    private static Map<String, Object> withRaw(String answer) {
        Map<String, Object> field = new LinkedHashMap<>();
        if (!answer.isBlank()) field.put("raw", answer.strip());
        return field;
    }

    private static boolean isNegative(String answer) {
        String lower = lower(answer).strip() + " ";
        return NEGATIVE_WORDS.stream().anyMatch(lower::startsWith);
    }

    private static boolean containsAny(String lower, List<String> words) {
        return words.stream().anyMatch(lower::contains);
    }

    private static boolean containsWord(String lower, List<String> words) {
        return words.stream().anyMatch(w -> Pattern.compile("\\b" + Pattern.quote(w) + "\\b").matcher(lower).find());
    }

    private static String lower(String s) {
        return s.toLowerCase(Locale.ROOT);
    }
}
