package com.expertpanel.deliberation.session;

import com.expertpanel.common.consensus.ConsensusResult;
import com.expertpanel.common.exception.DeliberationInProgressException;
import com.expertpanel.common.exception.InvalidCaseContextException;
import com.expertpanel.common.exception.InvalidDecisionException;
import com.expertpanel.common.exception.InvalidOpinionException;
import com.expertpanel.common.exception.NoOpenRoundException;
import com.expertpanel.common.exception.RoundInProgressException;
import com.expertpanel.common.exception.RoundLimitReachedException;
import com.expertpanel.common.exception.SessionNotFoundException;
import com.expertpanel.common.exception.SessionTerminatedException;
import com.expertpanel.common.model.CaseContext;
import com.expertpanel.common.model.Decision;
import com.expertpanel.common.model.DeliberationState;
import com.expertpanel.common.model.Opinion;
import com.expertpanel.common.model.RoundRecord;
import com.expertpanel.common.parse.ContractValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * In-memory registry of deliberation sessions keyed by session id.
 *
 * <p>Every mutation of a session runs under that session's own lock, so two rounds can never
 * be opened at once and an opinion can never land in the wrong round. Operations on
 * different sessions share no lock.
 *
 * <p>Nothing is persisted: sessions live until {@link #remove(String)} or process exit.
 */
@Component
public class SessionStore {

    private static final Logger log = LoggerFactory.getLogger(SessionStore.class);

    public static final int    DEFAULT_PANEL_SIZE  = 3;
    public static final String ROUND_LIMIT_REACHED = "round limit reached";

    private final Map<String, DeliberationSession> sessions = new ConcurrentHashMap<>();

    /** Registers a session with the default panel size. See {@link #start(String, CaseContext, int, int)}. */
    public DeliberationSession start(String sessionId, CaseContext context, int maxRounds) {
        return start(sessionId, context, maxRounds, DEFAULT_PANEL_SIZE);
    }

    /**
     * Registers a session, or returns the one already registered under {@code sessionId}
     * without touching its state.
     *
     * @throws IllegalArgumentException     if the id is blank or a bound is below 1
     * @throws InvalidCaseContextException  if the context holds unsupported value shapes
     */
    public DeliberationSession start(String sessionId, CaseContext context, int maxRounds, int panelSize) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId must not be blank");
        }
        if (maxRounds < 1) {
            throw new IllegalArgumentException("maxRounds must be at least 1, got " + maxRounds);
        }
        if (panelSize < 1) {
            throw new IllegalArgumentException("panelSize must be at least 1, got " + panelSize);
        }
        List<String> violations = ContractValidator.caseContextViolations(context);
        if (!violations.isEmpty()) {
            throw new InvalidCaseContextException(sessionId, violations);
        }

        return sessions.computeIfAbsent(sessionId, id -> {
            log.info("[SessionStore] Session started. sessionId={} maxRounds={} panelSize={}",
                     id, maxRounds, panelSize);
            return new DeliberationSession(id, context, maxRounds, panelSize);
        });
    }

    public Optional<DeliberationSession> get(String sessionId) {
        return sessionId == null ? Optional.empty() : Optional.ofNullable(sessions.get(sessionId));
    }

    /** @throws SessionNotFoundException if no session is registered under {@code sessionId} */
    public DeliberationSession require(String sessionId) {
        return get(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    /** Terminates the session with {@code reason}. No-op when the session is absent or already ended. */
    public void end(String sessionId, String reason) {
        DeliberationSession session = sessions.get(sessionId);
        if (session == null) return;
        withLock(session, s -> {
            if (s.terminate(reason)) {
                log.info("[SessionStore] Session ended. sessionId={} rounds={} reason={}",
                         sessionId, s.roundStates().size(), reason);
            }
            return null;
        });
    }

    /**
     * Marks the session as owned by one deliberation loop. Until {@link #releaseRun(String)}
     * any further claim is rejected; the session itself is not modified.
     *
     * @throws SessionNotFoundException         if the session is absent
     * @throws DeliberationInProgressException  if a loop already owns the session
     */
    public void claimRun(String sessionId) {
        DeliberationSession session = require(sessionId);
        if (!session.claimRun()) {
            throw new DeliberationInProgressException(sessionId);
        }
        log.debug("[SessionStore] Run claimed. sessionId={}", sessionId);
    }

    /** Releases the claim taken by {@link #claimRun(String)}. No-op when the session is gone. */
    public void releaseRun(String sessionId) {
        get(sessionId).ifPresent(DeliberationSession::releaseRun);
    }

    /**
     * Opens the next round and returns its 1-based index.
     *
     * @throws SessionNotFoundException    if the session is absent
     * @throws SessionTerminatedException  if the session has ended
     * @throws RoundLimitReachedException  if {@code maxRounds} rounds already exist; the session
     *                                     is terminated before this is thrown
     * @throws RoundInProgressException   if the current round has no decision yet
     */
    public int beginRound(String sessionId) {
        return withLock(require(sessionId), session -> {
            if (session.isTerminated()) {
                throw new SessionTerminatedException(sessionId, session.getTerminationReason());
            }
            List<RoundState> rounds = session.roundStates();
            if (rounds.size() >= session.getMaxRounds()) {
                session.terminate(ROUND_LIMIT_REACHED);
                log.info("[SessionStore] Round limit reached. sessionId={} maxRounds={}",
                         sessionId, session.getMaxRounds());
                throw new RoundLimitReachedException(sessionId, session.getMaxRounds());
            }
            RoundState current = session.currentRoundState();
            if (current != null && current.isOpen()) {
                throw new RoundInProgressException(sessionId, current.getRoundIndex());
            }
            int roundIndex = rounds.size() + 1;
            rounds.add(new RoundState(roundIndex));
            session.transitionTo(DeliberationState.ROUND_OPEN);
            log.debug("[SessionStore] Round opened. sessionId={} round={}", sessionId, roundIndex);
            return roundIndex;
        });
    }

    /**
     * Stores {@code opinion} for {@code expertId} in the open round, replacing any earlier
     * opinion from the same expert.
     *
     * @throws NoOpenRoundException     if there is no open round
     * @throws InvalidOpinionException  if the opinion violates the contract; nothing is stored
     */
    public void recordOpinion(String sessionId, String expertId, Opinion opinion) {
        withLock(require(sessionId), session -> {
            RoundState round = openRound(session);
            List<String> violations = ContractValidator.opinionViolations(opinion);
            if (!violations.isEmpty()) {
                throw new InvalidOpinionException(sessionId, expertId, violations);
            }
            round.getOpinions().put(expertId, opinion);
            return null;
        });
    }

    /**
     * Stores a whole round of opinions and moves the session to {@code OPINIONS_COLLECTED} in
     * one step. Either every opinion lands in the open round or none does.
     *
     * @throws NoOpenRoundException     if there is no open round, e.g. after an abort
     * @throws InvalidOpinionException  if any opinion violates the contract
     */
    public void recordOpinions(String sessionId, Map<String, Opinion> opinions) {
        withLock(require(sessionId), session -> {
            RoundState round = openRound(session);
            opinions.forEach((expertId, opinion) -> {
                List<String> violations = ContractValidator.opinionViolations(opinion);
                if (!violations.isEmpty()) {
                    throw new InvalidOpinionException(sessionId, expertId, violations);
                }
            });
            round.getOpinions().putAll(opinions);
            session.transitionTo(DeliberationState.OPINIONS_COLLECTED);
            return null;
        });
    }

    /**
     * Stores the coordinator's decision and closes the round.
     *
     * @throws NoOpenRoundException      if there is no open round
     * @throws InvalidDecisionException  if the decision violates the contract; nothing is stored
     */
    public void recordDecision(String sessionId, Decision decision) {
        withLock(require(sessionId), session -> {
            RoundState round = openRound(session);
            List<String> violations = ContractValidator.decisionViolations(decision);
            if (!violations.isEmpty()) {
                throw new InvalidDecisionException(sessionId, violations);
            }
            round.setDecision(decision);
            session.transitionTo(DeliberationState.DECISION_RECORDED);
            return null;
        });
    }

    /** Records the consensus outcome of a decided round. Reaching consensus is latched on the session. */
    public void recordConsensus(String sessionId, int roundIndex, ConsensusResult consensus) {
        withLock(require(sessionId), session -> {
            session.roundStates().stream()
                .filter(r -> r.getRoundIndex() == roundIndex)
                .findFirst()
                .ifPresent(r -> r.setConsensusReached(consensus.reached()));
            if (consensus.reached()) session.markConsensusReached();
            return null;
        });
    }

    public List<RoundRecord> rounds(String sessionId) {
        return require(sessionId).getRounds();
    }

    /** Latest recorded decision, scanning back past a round that never got one. */
    public Optional<Decision> lastDecision(String sessionId) {
        List<RoundRecord> rounds = rounds(sessionId);
        for (int i = rounds.size() - 1; i >= 0; i--) {
            if (rounds.get(i).decision() != null) return Optional.of(rounds.get(i).decision());
        }
        return Optional.empty();
    }

    /** Discards the session and its case data. */
    public void remove(String sessionId) {
        if (sessions.remove(sessionId) != null) {
            log.info("[SessionStore] Session discarded. sessionId={}", sessionId);
        }
    }

    public int size() {
        return sessions.size();
    }

    // ── helpers ───────────────────────────────────────────────────────────────

    private RoundState openRound(DeliberationSession session) {
        RoundState round = session.currentRoundState();
        if (session.isTerminated() || round == null || !round.isOpen()) {
            throw new NoOpenRoundException(session.getSessionId());
        }
        return round;
    }

    private <T> T withLock(DeliberationSession session, Function<DeliberationSession, T> action) {
        session.lock().lock();
        try {
            return action.apply(session);
        } finally {
            session.lock().unlock();
        }
    }
}
