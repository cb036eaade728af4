package com.expertpanel.deliberation.session;

import com.expertpanel.common.model.CaseContext;
import com.expertpanel.common.model.DeliberationState;
import com.expertpanel.common.model.RoundRecord;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One deliberation over a single case, bounded by {@code maxRounds}.
 *
 * <p>Owned by {@link SessionStore}: all mutators are package-private and run under
 * {@link #lock()}. Public getters return snapshots, so callers can never alter a recorded
 * round.
 */
public class DeliberationSession {

    private final String sessionId;
    private final CaseContext caseContext;
    private final int maxRounds;
    private final int panelSize;
    private final Instant createdAt;

    private final List<RoundState> rounds = new ArrayList<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicBoolean running = new AtomicBoolean();

    private volatile boolean terminated;
    private volatile String terminationReason;
    private volatile DeliberationState state = DeliberationState.IDLE;
    private volatile boolean consensusReached;

    DeliberationSession(String sessionId, CaseContext caseContext, int maxRounds, int panelSize) {
        this.sessionId = sessionId;
        this.caseContext = caseContext;
        this.maxRounds = maxRounds;
        this.panelSize = panelSize;
        this.createdAt = Instant.now();
    }

    public String getSessionId()       { return sessionId; }
    public CaseContext getCaseContext() { return caseContext; }
    public int getMaxRounds()          { return maxRounds; }
    public int getPanelSize()          { return panelSize; }
    public Instant getCreatedAt()      { return createdAt; }
    public boolean isTerminated()      { return terminated; }
    public String getTerminationReason() { return terminationReason; }
    public DeliberationState getState() { return state; }

    /** True while a deliberation loop owns this session. */
    public boolean isRunning()          { return running.get(); }

    /** True once any round has reached consensus; never reset. */
    public boolean isConsensusReached() { return consensusReached; }

    public int getCurrentRound() {
        lock.lock();
        try {
            return rounds.size();
        } finally {
            lock.unlock();
        }
    }

    public List<RoundRecord> getRounds() {
        lock.lock();
        try {
            return rounds.stream().map(RoundState::toRecord).toList();
        } finally {
            lock.unlock();
        }
    }

    // ── package-private mutation, caller holds the lock ──────────────────────

    ReentrantLock lock() {
        return lock;
    }

    List<RoundState> roundStates() {
        return rounds;
    }

    RoundState currentRoundState() {
        return rounds.isEmpty() ? null : rounds.get(rounds.size() - 1);
    }

    void transitionTo(DeliberationState next) {
        this.state = next;
    }

    void markConsensusReached() {
        this.consensusReached = true;
    }

    /** @return false if another loop already owns the session */
    boolean claimRun() {
        return running.compareAndSet(false, true);
    }

    void releaseRun() {
        running.set(false);
    }

    /** First reason wins; later calls are ignored. */
    boolean terminate(String reason) {
        if (terminated) return false;
        this.terminationReason = reason;
        this.terminated = true;
        this.state = DeliberationState.TERMINATED;
        return true;
    }

    @Override
    public String toString() {
        return "DeliberationSession[sessionId=" + sessionId + ", round=" + rounds.size() + "/" + maxRounds
               + ", state=" + state + ", terminationReason=" + terminationReason + "]";
    }
}
