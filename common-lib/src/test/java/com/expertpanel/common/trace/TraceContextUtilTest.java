package com.expertpanel.common.trace;

import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class TraceContextUtilTest {

    @Test
    void sessionId_visibleUpstream() {
        Mono<String> pipeline = Mono.deferContextual(ctx -> Mono.just(TraceContextUtil.getSessionId(ctx)));
        assertEquals("s-42", TraceContextUtil.withSessionId(pipeline, "s-42").block());
    }

    @Test
    void missingSessionId_unknown() {
        assertEquals(TraceContextUtil.UNKNOWN_SESSION,
                     Mono.deferContextual(ctx -> Mono.just(TraceContextUtil.getSessionId(ctx))).block());
    }

    @Test
    void sessionId_readableFromDoOnEachSignals() {
        List<String> seen = new ArrayList<>();
        Mono<String> pipeline = Mono.just("result")
            .doOnEach(signal -> {
                if (signal.isOnNext()) seen.add(TraceContextUtil.getSessionId(signal.getContextView()));
            });

        TraceContextUtil.withSessionId(pipeline, "s-7").block();

        assertEquals(List.of("s-7"), seen);
    }

    @Test
    void withMdc_setsThenClearsSessionId() {
        AtomicReference<String> during = new AtomicReference<>();
        TraceContextUtil.withMdc("s-42", () -> during.set(MDC.get(TraceContextUtil.SESSION_ID_KEY)));

        assertEquals("s-42", during.get());
        assertNull(MDC.get(TraceContextUtil.SESSION_ID_KEY));
    }
}
