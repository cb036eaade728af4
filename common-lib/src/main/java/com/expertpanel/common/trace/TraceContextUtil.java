package com.expertpanel.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

/**
 * Carries the deliberation session id through a run pipeline.
 *
 * <p>The run pipeline writes the id once into its Reactor Context; logging hooks attached with
 * {@code doOnEach} read it back from the signal and copy it into MDC only while the log call
 * runs. Expert calls hop between bounded-elastic threads, so MDC never holds it across
 * operators.
 *
 * <pre>
 *     Mono&lt;DeliberationResult&gt; run = claim.then(body).doOnEach(flowLogger.outcome());
 *     return TraceContextUtil.withSessionId(run, sessionId);
 * </pre>
 */
public final class TraceContextUtil {

    public static final String SESSION_ID_KEY = "sessionId";
    public static final String UNKNOWN_SESSION = "unknown";

    private TraceContextUtil() {}

    /** Puts {@code sessionId} in the context seen by every operator upstream of this call. */
    public static <T> Mono<T> withSessionId(Mono<T> mono, String sessionId) {
        return mono.contextWrite(ctx -> ctx.put(SESSION_ID_KEY, sessionId));
    }

    /** @return the session id, or {@value #UNKNOWN_SESSION} outside a run pipeline */
    public static String getSessionId(ContextView ctx) {
        return ctx.getOrDefault(SESSION_ID_KEY, UNKNOWN_SESSION);
    }

    /** Runs {@code logAction} with {@code sessionId} in MDC for the log pattern. */
    public static void withMdc(String sessionId, Runnable logAction) {
        MDC.put(SESSION_ID_KEY, sessionId);
        try {
            logAction.run();
        } finally {
            MDC.remove(SESSION_ID_KEY);
        }
    }
}
