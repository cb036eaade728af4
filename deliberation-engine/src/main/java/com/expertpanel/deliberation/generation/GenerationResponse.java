package com.expertpanel.deliberation.generation;

/**
 * Raw backend output. {@code truncated} is true when generation stopped on the token limit.
 */
public record GenerationResponse(String text, boolean truncated) {

    public GenerationResponse {
        text = text == null ? "" : text;
    }

    public static GenerationResponse complete(String text) {
        return new GenerationResponse(text, false);
    }

    public static GenerationResponse truncated(String text) {
        return new GenerationResponse(text, true);
    }

    public boolean isEmpty() {
        return text.isBlank();
    }
}
