package com.expertpanel.deliberation.generation;

import com.expertpanel.common.exception.GenerationException;
import com.expertpanel.common.exception.GenerationFailure;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * {@link GenerationBackend} backed by the Anthropic Messages API.
 *
 * <p>Concatenates the {@code text} blocks of {@code content} and reports truncation when
 * {@code stop_reason} is {@code max_tokens}. A missing API key fails fast with
 * {@link GenerationFailure#BACKEND_ERROR} so the caller's fallback path takes over.
 *
 * <p>Timeouts are applied by the caller, not here.
 */
public class AnthropicGenerationBackend implements GenerationBackend {

    private static final Logger log = LoggerFactory.getLogger(AnthropicGenerationBackend.class);

    static final String STOP_REASON_MAX_TOKENS = "max_tokens";

    private final WebClient anthropicClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final GenerationSettings settings;

    public AnthropicGenerationBackend(WebClient anthropicClient, ObjectMapper objectMapper,
                                      String apiKey, GenerationSettings settings) {
        this.anthropicClient = anthropicClient;
        this.objectMapper = objectMapper;
        this.apiKey = apiKey;
        this.settings = settings;
    }

    @Override
    public Mono<GenerationResponse> invoke(String systemPrompt, String userPrompt) {
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("[Anthropic] No API key configured. model={}", settings.model());
            return Mono.error(new GenerationException(GenerationFailure.BACKEND_ERROR, "no Anthropic API key configured"));
        }

        Map<String, Object> requestBody = Map.of(
            "model", settings.model(),
            "max_tokens", settings.maxTokens(),
            "temperature", settings.temperature(),
            "system", systemPrompt,
            "messages", List.of(Map.of("role", "user", "content", userPrompt))
        );

        return Mono.fromCallable(() -> objectMapper.writeValueAsString(requestBody))
            .flatMap(bodyJson ->
                anthropicClient.post()
                    .uri("/v1/messages")
                    .header("x-api-key", apiKey)
                    .bodyValue(bodyJson)
                    .retrieve()
                    .bodyToMono(String.class)
            )
            .map(this::toResponse)
            .doOnSuccess(r -> log.debug("[Anthropic] Response received. model={} chars={} truncated={}",
                                        settings.model(), r.text().length(), r.truncated()))
            .onErrorMap(e -> !(e instanceof GenerationException),
                        e -> new GenerationException(GenerationFailure.BACKEND_ERROR, e.getMessage(), e));
    }

    GenerationResponse toResponse(String body) {
        try {
            JsonNode root = objectMapper.readTree(body);
            StringBuilder text = new StringBuilder();
            for (JsonNode block : root.path("content")) {
                if ("text".equals(block.path("type").asText("text"))) {
                    text.append(block.path("text").asText(""));
                }
            }
            boolean truncated = STOP_REASON_MAX_TOKENS.equals(root.path("stop_reason").asText());
            return new GenerationResponse(text.toString(), truncated);
        } catch (Exception e) {
            throw new GenerationException(GenerationFailure.PARSE_FAILURE,
                                          "Failed to extract text from Anthropic response", e);
        }
    }
}
