package com.expertpanel.deliberation.orchestrator;

import com.expertpanel.common.consensus.ConsensusEvaluator;
import com.expertpanel.common.consensus.ConsensusResult;
import com.expertpanel.common.exception.DeliberationInProgressException;
import com.expertpanel.common.exception.GenerationException;
import com.expertpanel.common.exception.GenerationFailure;
import com.expertpanel.common.exception.NoOpenRoundException;
import com.expertpanel.common.exception.PanelSizeMismatchException;
import com.expertpanel.common.exception.RoundLimitReachedException;
import com.expertpanel.common.exception.SessionTerminatedException;
import com.expertpanel.common.model.CaseContext;
import com.expertpanel.common.model.Decision;
import com.expertpanel.common.model.DecisionRequest;
import com.expertpanel.common.model.DeliberationResult;
import com.expertpanel.common.model.Opinion;
import com.expertpanel.common.model.RoundRecord;
import com.expertpanel.common.parse.ContractValidator;
import com.expertpanel.common.parse.FallbackFactory;
import com.expertpanel.common.trace.TraceContextUtil;
import com.expertpanel.deliberation.coordinator.CoordinatorAgent;
import com.expertpanel.deliberation.expert.ExpertAgent;
import com.expertpanel.deliberation.logger.DeliberationFlowLogger;
import com.expertpanel.deliberation.round.RoundCoordinator;
import com.expertpanel.deliberation.session.DeliberationSession;
import com.expertpanel.deliberation.session.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Top-level deliberation loop.
 *
 * <pre>
 *   IDLE → ROUND_OPEN → OPINIONS_COLLECTED → DECISION_RECORDED → (ROUND_OPEN | TERMINATED)
 * </pre>
 *
 * <p>Each round: {@link SessionStore#beginRound} → {@link RoundCoordinator#runRound} (join
 * point) → coordinator decision, recovered and validated → {@link ConsensusEvaluator}. The
 * loop ends when {@code beginRound} reports the round limit, when the session is aborted, or,
 * with {@code deliberation.stop-on-consensus=true}, after the first round reaching consensus.
 * With the flag off (the default) every configured round runs and consensus is only recorded.
 *
 * <p>Round-limit exhaustion and abort are normal terminations and yield a result; panel size
 * mismatch and unknown sessions are surfaced as errors. A run requested while another run owns
 * the session is rejected without ending it.
 */
@Service
public class DeliberationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(DeliberationOrchestrator.class);

    public static final String CONSENSUS_REACHED   = "consensus reached";
    public static final String PANEL_SIZE_MISMATCH = "panel size mismatch";
    public static final String ABORTED_PREFIX      = "aborted: ";
    public static final String ERROR_PREFIX        = "error: ";

    private final SessionStore sessionStore;
    private final RoundCoordinator roundCoordinator;
    private final CoordinatorAgent coordinator;
    private final ConsensusEvaluator consensusEvaluator;
    private final DeliberationFlowLogger flowLogger;
    private final boolean stopOnConsensus;
    private final Duration decisionTimeout;

    public DeliberationOrchestrator(SessionStore sessionStore,
                                    RoundCoordinator roundCoordinator,
                                    CoordinatorAgent coordinator,
                                    ConsensusEvaluator consensusEvaluator,
                                    DeliberationFlowLogger flowLogger,
                                    @Value("${deliberation.stop-on-consensus:false}") boolean stopOnConsensus,
                                    @Value("${deliberation.coordinator.timeout-ms:90000}") long decisionTimeoutMs) {
        this.sessionStore = sessionStore;
        this.roundCoordinator = roundCoordinator;
        this.coordinator = coordinator;
        this.consensusEvaluator = consensusEvaluator;
        this.flowLogger = flowLogger;
        this.stopOnConsensus = stopOnConsensus;
        this.decisionTimeout = Duration.ofMillis(decisionTimeoutMs);
    }

    public DeliberationSession startSession(String sessionId, CaseContext caseContext, int maxRounds) {
        return startSession(sessionId, caseContext, maxRounds, SessionStore.DEFAULT_PANEL_SIZE);
    }

    /** Registers the session; returns the existing one unchanged if the id is already known. */
    public DeliberationSession startSession(String sessionId, CaseContext caseContext, int maxRounds, int panelSize) {
        boolean known = sessionStore.get(sessionId).isPresent();
        DeliberationSession session = sessionStore.start(sessionId, caseContext, maxRounds, panelSize);
        if (!known) {
            flowLogger.sessionStarted(sessionId, caseContext, maxRounds);
        }
        return session;
    }

    /**
     * Runs rounds until the session terminates and returns the outcome. Only one run may own a
     * session at a time; the claim is released however the run ends, cancellation included.
     *
     * @throws com.expertpanel.common.exception.SessionNotFoundException via the returned Mono
     * @throws DeliberationInProgressException via the returned Mono; the running loop and the
     *         session are left untouched
     * @throws PanelSizeMismatchException via the returned Mono; the session is terminated
     */
    public Mono<DeliberationResult> runDeliberation(String sessionId, List<ExpertAgent> experts) {
        Mono<DeliberationResult> pipeline = Mono.fromRunnable(() -> sessionStore.claimRun(sessionId))
            .then(Mono.defer(() -> deliberate(sessionId, experts)
                .doFinally(signal -> sessionStore.releaseRun(sessionId))))
            .doOnEach(flowLogger.outcome());
        return TraceContextUtil.withSessionId(pipeline, sessionId);
    }

    /** The last recorded decision, or empty if the session is unknown or has none yet. */
    public Optional<Decision> getFinalDecision(String sessionId) {
        return sessionStore.get(sessionId).flatMap(s -> sessionStore.lastDecision(sessionId));
    }

    /** Snapshot of the session as a result, finished or not. */
    public Optional<DeliberationResult> result(String sessionId) {
        return sessionStore.get(sessionId).map(s -> buildResult(sessionId));
    }

    /**
     * Terminates the session. Expert calls already in flight are left to finish or time out;
     * their opinions are discarded and no further round opens.
     */
    public void abort(String sessionId, String reason) {
        sessionStore.require(sessionId);
        log.warn("[Orchestrator] Abort requested. sessionId={} reason={}", sessionId, reason);
        sessionStore.end(sessionId, ABORTED_PREFIX + reason);
    }

    // ── round loop ────────────────────────────────────────────────────────────

    /** Body of a claimed run. A failure here is fatal to the session and ends it. */
    private Mono<DeliberationResult> deliberate(String sessionId, List<ExpertAgent> experts) {
        return Mono.fromCallable(() -> checkPanel(sessionId, experts))
            .flatMap(session -> nextRound(sessionId, experts))
            .then(Mono.fromCallable(() -> buildResult(sessionId)))
            .onErrorResume(e -> isNormalStop(sessionId, e), e -> {
                log.info("[Orchestrator] Deliberation stopped. sessionId={} reason={}", sessionId, e.getMessage());
                return Mono.fromCallable(() -> buildResult(sessionId));
            })
            .doOnError(e -> sessionStore.end(sessionId, ERROR_PREFIX + e.getMessage()));
    }

    private Mono<Void> nextRound(String sessionId, List<ExpertAgent> experts) {
        return Mono.defer(() -> {
            DeliberationSession session = sessionStore.require(sessionId);
            if (session.isTerminated()) {
                return Mono.<Void>empty();
            }
            int roundIndex = sessionStore.beginRound(sessionId);
            flowLogger.stage(DeliberationFlowLogger.ROUND_OPENED, sessionId, roundIndex);

            return roundCoordinator.runRound(sessionId, roundIndex, experts)
                .flatMap(opinions -> decide(session, roundIndex, opinions))
                .flatMap(consensus -> {
                    if (stopOnConsensus && consensus.reached()) {
                        sessionStore.end(sessionId, CONSENSUS_REACHED);
                        return Mono.<Void>empty();
                    }
                    return nextRound(sessionId, experts);
                });
        });
    }

    private Mono<ConsensusResult> decide(DeliberationSession session, int roundIndex, Map<String, Opinion> opinions) {
        String sessionId = session.getSessionId();
        List<RoundRecord> previousRounds = session.getRounds().stream()
            .filter(r -> r.roundIndex() < roundIndex)
            .toList();
        DecisionRequest request = new DecisionRequest(sessionId, session.getCaseContext(), roundIndex,
                                                      opinions, previousRounds);

        return Mono.defer(() -> coordinator.decide(request))
            .timeout(decisionTimeout)
            .switchIfEmpty(Mono.error(() -> new GenerationException(GenerationFailure.EMPTY,
                                                                    "coordinator returned no decision")))
            .onErrorResume(e -> {
                log.error("[Orchestrator] Coordinator failed, using fallback decision. sessionId={} round={} reason={}",
                          sessionId, roundIndex, e.getMessage());
                return Mono.just(FallbackFactory.recoveryDecision(e.getMessage()));
            })
            .map(decision -> {
                List<String> violations = ContractValidator.decisionViolations(decision);
                Decision accepted = violations.isEmpty()
                    ? decision
                    : FallbackFactory.recoveryDecision("malformed decision: " + String.join("; ", violations));

                sessionStore.recordDecision(sessionId, accepted);
                flowLogger.decision(sessionId, roundIndex, accepted);

                ConsensusResult consensus = consensusEvaluator.evaluate(opinions, accepted);
                sessionStore.recordConsensus(sessionId, roundIndex, consensus);
                flowLogger.consensus(sessionId, roundIndex, consensus);
                return consensus;
            });
    }

    // ── helpers ───────────────────────────────────────────────────────────────

    private DeliberationSession checkPanel(String sessionId, List<ExpertAgent> experts) {
        DeliberationSession session = sessionStore.require(sessionId);
        int supplied = experts == null ? 0 : experts.size();
        if (supplied != session.getPanelSize()) {
            sessionStore.end(sessionId, PANEL_SIZE_MISMATCH);
            throw new PanelSizeMismatchException(sessionId, session.getPanelSize(), supplied);
        }
        return session;
    }

    /** Round-limit exhaustion, or an abort noticed while recording, ends the loop without an error. */
    private boolean isNormalStop(String sessionId, Throwable e) {
        if (e instanceof RoundLimitReachedException) return true;
        if (e instanceof SessionTerminatedException || e instanceof NoOpenRoundException) {
            return sessionStore.get(sessionId).map(DeliberationSession::isTerminated).orElse(false);
        }
        return false;
    }

    private DeliberationResult buildResult(String sessionId) {
        DeliberationSession session = sessionStore.require(sessionId);
        List<RoundRecord> decided = session.getRounds().stream()
            .filter(r -> r.decision() != null)
            .toList();
        Decision finalDecision = decided.isEmpty()
            ? FallbackFactory.recoveryDecision("no round produced a decision")
            : decided.get(decided.size() - 1).decision();

        return new DeliberationResult(
            sessionId,
            decided.size(),
            session.getTerminationReason(),
            finalDecision,
            session.isConsensusReached(),
            decided,
            Instant.now());
    }
}
