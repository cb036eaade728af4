package com.expertpanel.deliberation.logger;

import com.expertpanel.common.consensus.ConsensusResult;
import com.expertpanel.common.exception.DeliberationInProgressException;
import com.expertpanel.common.model.CaseContext;
import com.expertpanel.common.model.Decision;
import com.expertpanel.common.model.DeliberationResult;
import com.expertpanel.common.model.Opinion;
import com.expertpanel.common.redact.PayloadRedactor;
import com.expertpanel.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Logs each stage of a deliberation without touching its state.
 *
 * <p>Stages, in order:
 * <ol>
 *   <li>{@link #SESSION_STARTED}</li>
 *   <li>{@link #ROUND_OPENED}</li>
 *   <li>{@link #OPINION_RECEIVED} (once per expert)</li>
 *   <li>{@link #OPINIONS_COLLECTED}</li>
 *   <li>{@link #DECISION_RECORDED}</li>
 *   <li>{@link #CONSENSUS_EVALUATED}</li>
 *   <li>{@link #SESSION_TERMINATED}, or {@link #RUN_FAILED} / {@link #RUN_REJECTED}</li>
 * </ol>
 *
 * <p>Payloads pass through {@link PayloadRedactor} first; free text never reaches the log.
 */
@Component
public class DeliberationFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(DeliberationFlowLogger.class);

    public static final String SESSION_STARTED     = "SESSION_STARTED";
    public static final String ROUND_OPENED        = "ROUND_OPENED";
    public static final String OPINION_RECEIVED    = "OPINION_RECEIVED";
    public static final String OPINIONS_COLLECTED  = "OPINIONS_COLLECTED";
    public static final String DECISION_RECORDED   = "DECISION_RECORDED";
    public static final String CONSENSUS_EVALUATED = "CONSENSUS_EVALUATED";
    public static final String SESSION_TERMINATED  = "SESSION_TERMINATED";
    public static final String RUN_REJECTED        = "RUN_REJECTED";
    public static final String RUN_FAILED          = "RUN_FAILED";

    public void sessionStarted(String sessionId, CaseContext context, int maxRounds) {
        TraceContextUtil.withMdc(sessionId, () ->
            log.info("[DeliberationFlow] stage={} sessionId={} maxRounds={} case={}",
                     SESSION_STARTED, sessionId, maxRounds, PayloadRedactor.redactForLog(context))
        );
    }

    public void stage(String stageName, String sessionId, int roundIndex) {
        TraceContextUtil.withMdc(sessionId, () ->
            log.info("[DeliberationFlow] stage={} sessionId={} round={}", stageName, sessionId, roundIndex)
        );
    }

    public void opinion(String sessionId, int roundIndex, String expertId, Opinion opinion) {
        TraceContextUtil.withMdc(sessionId, () ->
            log.info("[DeliberationFlow] stage={} sessionId={} round={} expert={} opinion={}",
                     OPINION_RECEIVED, sessionId, roundIndex, expertId, PayloadRedactor.redactForLog(opinion))
        );
    }

    public void decision(String sessionId, int roundIndex, Decision decision) {
        TraceContextUtil.withMdc(sessionId, () ->
            log.info("[DeliberationFlow] stage={} sessionId={} round={} decision={}",
                     DECISION_RECORDED, sessionId, roundIndex, PayloadRedactor.redactForLog(decision))
        );
    }

    public void consensus(String sessionId, int roundIndex, ConsensusResult consensus) {
        TraceContextUtil.withMdc(sessionId, () ->
            log.info("[DeliberationFlow] stage={} sessionId={} round={} reached={} declared={} overlap={} "
                     + "sharedHypotheses={} sharedTests={}",
                     CONSENSUS_EVALUATED, sessionId, roundIndex, consensus.reached(),
                     consensus.declaredByDecision(), consensus.overlapReached(),
                     consensus.sharedHypotheses(), consensus.sharedTests())
        );
    }

    /**
     * Hook for {@code doOnEach} on a run pipeline. Logs {@link #SESSION_TERMINATED} for a
     * result, {@link #RUN_REJECTED} for a duplicate run and {@link #RUN_FAILED} for any other
     * error. The session id is read from the signal's Reactor Context, so the pipeline must be
     * wrapped with {@link TraceContextUtil#withSessionId}.
     */
    public Consumer<Signal<DeliberationResult>> outcome() {
        return signal -> {
            if (!signal.isOnNext() && !signal.isOnError()) return;
            String sessionId = TraceContextUtil.getSessionId(signal.getContextView());
            TraceContextUtil.withMdc(sessionId, () -> {
                if (signal.isOnNext()) {
                    DeliberationResult result = signal.get();
                    log.info("[DeliberationFlow] stage={} sessionId={} totalRounds={} reason={} consensusReached={}",
                             SESSION_TERMINATED, sessionId, result.totalRounds(),
                             result.terminationReason(), result.consensusReached());
                } else if (signal.getThrowable() instanceof DeliberationInProgressException) {
                    log.warn("[DeliberationFlow] stage={} sessionId={} reason={}",
                             RUN_REJECTED, sessionId, signal.getThrowable().getMessage());
                } else {
                    log.error("[DeliberationFlow] stage={} sessionId={} reason={}",
                              RUN_FAILED, sessionId, signal.getThrowable().getMessage());
                }
            });
        };
    }
}
