package com.expertpanel.deliberation.intake;

import java.util.List;
import java.util.Locale;

/**
 * Flags free text that mentions an emergency. Substring matching only.
 */
public final class EmergencyKeywordDetector {

    public static final List<String> EMERGENCY_KEYWORDS = List.of(
        "severe pain", "difficulty breathing", "loss of consciousness", "heart attack",
        "stroke", "bleeding", "fracture", "burn", "poisoning", "seizure", "shock", "fainting");

    private EmergencyKeywordDetector() {}

    /** Emergency keywords found in {@code text}, in {@link #EMERGENCY_KEYWORDS} order. */
    public static List<String> detect(String text) {
        if (text == null || text.isBlank()) return List.of();
        String lower = text.toLowerCase(Locale.ROOT);
        return EMERGENCY_KEYWORDS.stream().filter(lower::contains).toList();
    }

    public static boolean isEmergency(String text) {
        return !detect(text).isEmpty();
    }
}
