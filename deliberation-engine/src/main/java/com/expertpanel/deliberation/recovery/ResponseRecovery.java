package com.expertpanel.deliberation.recovery;

import com.expertpanel.common.exception.GenerationException;
import com.expertpanel.common.exception.GenerationFailure;
import com.expertpanel.common.outcome.Outcome;
import com.expertpanel.deliberation.generation.GenerationBackend;
import com.expertpanel.deliberation.generation.GenerationResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Turns a generation call into a contract value: invoke → retry once on truncation → parse →
 * fallback.
 *
 * <h3>Policy</h3>
 * <ol>
 *   <li>Every backend call carries the configured timeout; expiry counts as a failure.</li>
 *   <li>Empty text with {@code truncated=true} triggers exactly one continuation request
 *       (original prompt plus {@link #CONTINUATION_INSTRUCTION}). Never more than one.</li>
 *   <li>Empty text without truncation, an empty continuation, a timeout or a backend error
 *       goes straight to the fallback.</li>
 *   <li>Text that parses to a failure {@link Outcome} goes to the fallback.</li>
 * </ol>
 *
 * <p>The returned {@code Mono} always emits a value and never errors.
 */
@Component
public class ResponseRecovery {

    private static final Logger log = LoggerFactory.getLogger(ResponseRecovery.class);

    public static final String CONTINUATION_INSTRUCTION =
        "Continue from the prior response and deliver the full structured output. "
        + "Stay within the specified length constraints.";

    private final Duration timeout;

    public ResponseRecovery(@Value("${deliberation.generation.timeout-ms:30000}") long timeoutMs) {
        this.timeout = Duration.ofMillis(timeoutMs);
    }

    /**
     * @param label        log label identifying the caller, e.g. {@code expert_1/round-2}
     * @param backend      generation backend to call
     * @param systemPrompt role instructions
     * @param userPrompt   case-specific prompt
     * @param parser       extracts the contract value, or a failure naming what was missing
     * @param fallback     builds the substitute from a failure description
     * @return the parsed value or the fallback; never empty, never an error
     */
    public <T> Mono<T> recover(String label,
                               GenerationBackend backend,
                               String systemPrompt,
                               String userPrompt,
                               Function<String, Outcome<T>> parser,
                               Function<String, T> fallback) {
        return invoke(backend, systemPrompt, userPrompt)
            .flatMap(response -> {
                if (!response.isEmpty()) return Mono.just(response);
                if (!response.truncated()) {
                    return Mono.error(new GenerationException(GenerationFailure.EMPTY,
                                                              "backend returned empty text"));
                }
                log.warn("[ResponseRecovery] Empty truncated response, requesting continuation. label={}", label);
                return invoke(backend, systemPrompt, continuationPrompt(userPrompt))
                    .flatMap(retry -> retry.isEmpty()
                        ? Mono.error(new GenerationException(GenerationFailure.TRUNCATED,
                                                             "empty text after continuation"))
                        : Mono.just(retry));
            })
            .map(response -> {
                Outcome<T> parsed = parser.apply(response.text());
                if (!parsed.isSuccess()) {
                    log.warn("[ResponseRecovery] Parse failed, using fallback. label={} reason={}",
                             label, parsed.error());
                }
                return parsed.orElseGet(error -> fallback.apply(GenerationFailure.PARSE_FAILURE + ": " + error));
            })
            .onErrorResume(e -> {
                log.error("[ResponseRecovery] Generation failed, using fallback. label={} reason={}",
                          label, e.getMessage());
                return Mono.just(fallback.apply(describe(e)));
            });
    }

    static String continuationPrompt(String userPrompt) {
        return userPrompt + "\n\n" + CONTINUATION_INSTRUCTION;
    }

    private Mono<GenerationResponse> invoke(GenerationBackend backend, String systemPrompt, String userPrompt) {
        return Mono.defer(() -> backend.invoke(systemPrompt, userPrompt))
            .switchIfEmpty(Mono.error(new GenerationException(GenerationFailure.EMPTY, "backend returned no response")))
            .timeout(timeout)
            .onErrorMap(TimeoutException.class,
                        e -> new GenerationException(GenerationFailure.TIMEOUT,
                                                     "no response within " + timeout.toMillis() + "ms", e));
    }

    private static String describe(Throwable e) {
        if (e instanceof GenerationException) return e.getMessage();
        return GenerationFailure.BACKEND_ERROR + ": " + e.getClass().getSimpleName() + " " + e.getMessage();
    }
}
