package com.expertpanel.deliberation.logger;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.AppenderBase;
import com.expertpanel.common.exception.DeliberationInProgressException;
import com.expertpanel.common.model.Decision;
import com.expertpanel.common.model.DeliberationResult;
import com.expertpanel.common.trace.TraceContextUtil;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class DeliberationFlowLoggerTest {

    /** Records the message and the MDC session id at the moment each event is appended. */
    static class CapturingAppender extends AppenderBase<ILoggingEvent> {
        final List<String> messages   = new CopyOnWriteArrayList<>();
        final List<String> sessionIds = new CopyOnWriteArrayList<>();

        @Override
        protected void append(ILoggingEvent event) {
            messages.add(event.getFormattedMessage());
            sessionIds.add(MDC.get(TraceContextUtil.SESSION_ID_KEY));
        }
    }

    private final DeliberationFlowLogger flowLogger = new DeliberationFlowLogger();
    private final Logger logger = (Logger) LoggerFactory.getLogger(DeliberationFlowLogger.class);
    private final CapturingAppender appender = new CapturingAppender();

    @BeforeEach
    void attach() {
        logger.setLevel(Level.INFO);
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void detach() {
        logger.detachAppender(appender);
    }

    private static DeliberationResult result(String sessionId) {
        Decision decision = Decision.of(List.of("pneumonia"), List.of("chest x-ray"), "synthesis");
        return new DeliberationResult(sessionId, 2, "round limit reached", decision, false, List.of(), Instant.now());
    }

    @Test
    @DisplayName("terminated run is logged under the session id from the Reactor Context")
    void result_sessionIdFromContext() {
        Mono<DeliberationResult> run = Mono.just(result("s-ctx")).doOnEach(flowLogger.outcome());
        TraceContextUtil.withSessionId(run, "s-ctx").block();

        assertEquals(1, appender.messages.size());
        assertTrue(appender.messages.get(0).contains("stage=" + DeliberationFlowLogger.SESSION_TERMINATED));
        assertTrue(appender.messages.get(0).contains("sessionId=s-ctx"));
        assertEquals("s-ctx", appender.sessionIds.get(0));
        assertNull(MDC.get(TraceContextUtil.SESSION_ID_KEY));
    }

    @Test
    @DisplayName("rejected duplicate run is logged as RUN_REJECTED")
    void duplicateRun_rejectedStage() {
        Mono<DeliberationResult> run = Mono.<DeliberationResult>error(new DeliberationInProgressException("s-dup"))
            .doOnEach(flowLogger.outcome());

        assertThrows(DeliberationInProgressException.class,
                     () -> TraceContextUtil.withSessionId(run, "s-dup").block());
        assertTrue(appender.messages.get(0).contains("stage=" + DeliberationFlowLogger.RUN_REJECTED));
        assertEquals("s-dup", appender.sessionIds.get(0));
    }

    @Test
    @DisplayName("other failures are logged as RUN_FAILED")
    void failure_failedStage() {
        Mono<DeliberationResult> run = Mono.<DeliberationResult>error(new IllegalStateException("boom"))
            .doOnEach(flowLogger.outcome());

        assertThrows(IllegalStateException.class, () -> TraceContextUtil.withSessionId(run, "s-err").block());
        assertTrue(appender.messages.get(0).contains("stage=" + DeliberationFlowLogger.RUN_FAILED));
        assertTrue(appender.messages.get(0).contains("reason=boom"));
    }

    @Test
    @DisplayName("completion signal after the result is not logged twice")
    void onComplete_ignored() {
        Mono<DeliberationResult> run = Mono.just(result("s1")).doOnEach(flowLogger.outcome());
        TraceContextUtil.withSessionId(run, "s1").block();

        assertEquals(1, appender.messages.size());
    }
}
