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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SessionStoreTest {

    private static final CaseContext CASE = CaseContext.of(Map.of("raw", "fever and cough"), "fever and cough");
    private static final Opinion OPINION = Opinion.of(List.of("Pneumonia"), List.of("Chest X-ray"), "reasoning");
    private static final Decision DECISION = Decision.of(List.of("Pneumonia"), List.of("Chest X-ray"), "agreed");

    private SessionStore store;

    @BeforeEach
    void setUp() {
        store = new SessionStore();
    }

    // ── start() ───────────────────────────────────────────────────────────

    @Nested
    @DisplayName("start()")
    class StartTests {

        @Test
        @DisplayName("same id twice → same session, state untouched")
        void idempotent() {
            DeliberationSession first = store.start("s1", CASE, 3);
            store.beginRound("s1");
            DeliberationSession second = store.start("s1", CaseContext.of(Map.of(), "other"), 5);

            assertSame(first, second);
            assertEquals(3, second.getMaxRounds());
            assertEquals(1, second.getCurrentRound());
            assertEquals(1, store.size());
        }

        @Test
        @DisplayName("new session starts IDLE with no rounds")
        void initialState() {
            DeliberationSession session = store.start("s1", CASE, 3);
            assertEquals(DeliberationState.IDLE, session.getState());
            assertEquals(0, session.getCurrentRound());
            assertFalse(session.isTerminated());
        }

        @Test
        @DisplayName("zero rounds or blank id → IllegalArgumentException")
        void invalidBounds() {
            assertThrows(IllegalArgumentException.class, () -> store.start("s1", CASE, 0));
            assertThrows(IllegalArgumentException.class, () -> store.start(" ", CASE, 3));
            assertThrows(IllegalArgumentException.class, () -> store.start("s1", CASE, 3, 0));
        }

        @Test
        @DisplayName("unsupported case value → InvalidCaseContextException")
        void invalidCaseContext() {
            CaseContext bad = CaseContext.of(Map.of("onset", Instant.EPOCH), "");
            assertThrows(InvalidCaseContextException.class, () -> store.start("s1", bad, 3));
            assertTrue(store.get("s1").isEmpty());
        }
    }

    // ── rounds ────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("round lifecycle")
    class RoundTests {

        @Test
        @DisplayName("rounds are numbered 1..n")
        void roundNumbering() {
            store.start("s1", CASE, 3);
            assertEquals(1, store.beginRound("s1"));
            store.recordDecision("s1", DECISION);
            assertEquals(2, store.beginRound("s1"));
        }

        @Test
        @DisplayName("maxRounds + 1 beginRound → RoundLimitReached and session terminated")
        void roundLimit() {
            store.start("s1", CASE, 2);
            store.beginRound("s1");
            store.recordDecision("s1", DECISION);
            store.beginRound("s1");
            store.recordDecision("s1", DECISION);

            assertThrows(RoundLimitReachedException.class, () -> store.beginRound("s1"));
            DeliberationSession session = store.require("s1");
            assertTrue(session.isTerminated());
            assertEquals(SessionStore.ROUND_LIMIT_REACHED, session.getTerminationReason());
            assertEquals(DeliberationState.TERMINATED, session.getState());
        }

        @Test
        @DisplayName("beginRound while the current round is undecided → RoundInProgress")
        void roundInProgress() {
            store.start("s1", CASE, 3);
            store.beginRound("s1");
            assertThrows(RoundInProgressException.class, () -> store.beginRound("s1"));
        }

        @Test
        @DisplayName("beginRound after termination → SessionTerminated")
        void terminatedSession() {
            store.start("s1", CASE, 3);
            store.end("s1", "aborted: test");
            assertThrows(SessionTerminatedException.class, () -> store.beginRound("s1"));
        }

        @Test
        @DisplayName("unknown session → SessionNotFound")
        void unknownSession() {
            assertThrows(SessionNotFoundException.class, () -> store.beginRound("missing"));
        }
    }

    // ── opinions and decisions ────────────────────────────────────────────

    @Nested
    @DisplayName("recording")
    class RecordingTests {

        @Test
        @DisplayName("opinion before any round → NoOpenRound")
        void opinionWithoutRound() {
            store.start("s1", CASE, 3);
            assertThrows(NoOpenRoundException.class, () -> store.recordOpinion("s1", "expert_1", OPINION));
        }

        @Test
        @DisplayName("opinion after the round is decided → NoOpenRound")
        void opinionAfterDecision() {
            store.start("s1", CASE, 3);
            store.beginRound("s1");
            store.recordDecision("s1", DECISION);
            assertThrows(NoOpenRoundException.class, () -> store.recordOpinion("s1", "expert_1", OPINION));
        }

        @Test
        @DisplayName("malformed opinion → InvalidOpinion, nothing stored")
        void malformedOpinion() {
            store.start("s1", CASE, 3);
            store.beginRound("s1");
            Opinion empty = Opinion.of(List.of(), List.of("Chest X-ray"), "j");

            assertThrows(InvalidOpinionException.class, () -> store.recordOpinion("s1", "expert_1", empty));
            assertTrue(store.rounds("s1").get(0).opinions().isEmpty());
        }

        @Test
        @DisplayName("second opinion from the same expert replaces the first")
        void lastWriteWins() {
            store.start("s1", CASE, 3);
            store.beginRound("s1");
            store.recordOpinion("s1", "expert_1", OPINION);
            Opinion revised = Opinion.of(List.of("Bronchitis"), List.of("Sputum culture"), "revised");
            store.recordOpinion("s1", "expert_1", revised);

            assertEquals(Map.of("expert_1", revised), store.rounds("s1").get(0).opinions());
        }

        @Test
        @DisplayName("malformed decision → InvalidDecision, round stays open")
        void malformedDecision() {
            store.start("s1", CASE, 3);
            store.beginRound("s1");
            Decision blank = Decision.of(List.of("Pneumonia"), List.of("Chest X-ray"), " ");

            assertThrows(InvalidDecisionException.class, () -> store.recordDecision("s1", blank));
            assertNull(store.rounds("s1").get(0).decision());
        }

        @Test
        @DisplayName("state moves through the round phases")
        void stateTransitions() {
            DeliberationSession session = store.start("s1", CASE, 3);
            store.beginRound("s1");
            assertEquals(DeliberationState.ROUND_OPEN, session.getState());
            store.recordOpinions("s1", Map.of("expert_1", OPINION));
            assertEquals(DeliberationState.OPINIONS_COLLECTED, session.getState());
            store.recordDecision("s1", DECISION);
            assertEquals(DeliberationState.DECISION_RECORDED, session.getState());
        }

        @Test
        @DisplayName("consensus is latched on the session and the round")
        void consensusLatched() {
            DeliberationSession session = store.start("s1", CASE, 3);
            store.beginRound("s1");
            store.recordDecision("s1", DECISION);
            store.recordConsensus("s1", 1, new ConsensusResult(true, false, true, List.of("pneumonia"), List.of("chest x-ray")));
            store.beginRound("s1");
            store.recordDecision("s1", DECISION);
            store.recordConsensus("s1", 2, ConsensusResult.none());

            List<RoundRecord> rounds = store.rounds("s1");
            assertTrue(rounds.get(0).consensusReached());
            assertFalse(rounds.get(1).consensusReached());
            assertTrue(session.isConsensusReached());
        }

        @Test
        @DisplayName("lastDecision skips an undecided trailing round")
        void lastDecision() {
            store.start("s1", CASE, 3);
            store.beginRound("s1");
            store.recordDecision("s1", DECISION);
            store.beginRound("s1");

            assertEquals(DECISION, store.lastDecision("s1").orElseThrow());
        }
    }

    // ── recordOpinions() ──────────────────────────────────────────────────

    @Nested
    @DisplayName("recordOpinions()")
    class BatchRecordingTests {

        @Test
        @DisplayName("whole round stored and state moves to OPINIONS_COLLECTED")
        void storesWholeRound() {
            DeliberationSession session = store.start("s1", CASE, 3);
            store.beginRound("s1");
            Map<String, Opinion> round = new LinkedHashMap<>();
            round.put("expert_1", OPINION);
            round.put("expert_2", Opinion.of(List.of("Bronchitis"), List.of("Sputum culture"), "j"));

            store.recordOpinions("s1", round);

            assertEquals(round, store.rounds("s1").get(0).opinions());
            assertEquals(DeliberationState.OPINIONS_COLLECTED, session.getState());
        }

        @Test
        @DisplayName("one malformed opinion → InvalidOpinion, none of the round stored")
        void malformedOpinion_nothingStored() {
            DeliberationSession session = store.start("s1", CASE, 3);
            store.beginRound("s1");
            Map<String, Opinion> round = new LinkedHashMap<>();
            round.put("expert_1", OPINION);
            round.put("expert_2", Opinion.of(List.of(), List.of("Chest X-ray"), "j"));

            InvalidOpinionException e = assertThrows(InvalidOpinionException.class,
                                                     () -> store.recordOpinions("s1", round));
            assertTrue(e.getMessage().contains("expert_2"));
            assertTrue(store.rounds("s1").get(0).opinions().isEmpty());
            assertEquals(DeliberationState.ROUND_OPEN, session.getState());
        }

        @Test
        @DisplayName("session ended before the round is recorded → NoOpenRound, round stays empty")
        void abortedBeforeRecording_nothingStored() {
            store.start("s1", CASE, 3);
            store.beginRound("s1");
            store.end("s1", "aborted: clinician stopped");

            assertThrows(NoOpenRoundException.class,
                         () -> store.recordOpinions("s1", Map.of("expert_1", OPINION, "expert_2", OPINION)));
            assertTrue(store.rounds("s1").get(0).opinions().isEmpty());
        }
    }

    // ── run claim ─────────────────────────────────────────────────────────

    @Nested
    @DisplayName("claimRun() / releaseRun()")
    class RunClaimTests {

        @Test
        @DisplayName("second claim → DeliberationInProgress, session untouched")
        void secondClaimRejected() {
            DeliberationSession session = store.start("s1", CASE, 3);
            store.claimRun("s1");

            assertThrows(DeliberationInProgressException.class, () -> store.claimRun("s1"));
            assertTrue(session.isRunning());
            assertFalse(session.isTerminated());
        }

        @Test
        @DisplayName("claim is available again after release")
        void releaseAllowsNextClaim() {
            DeliberationSession session = store.start("s1", CASE, 3);
            store.claimRun("s1");
            store.releaseRun("s1");

            assertDoesNotThrow(() -> store.claimRun("s1"));
            assertTrue(session.isRunning());
        }

        @Test
        @DisplayName("unknown session → SessionNotFound; release of a missing session is a no-op")
        void unknownSession() {
            assertThrows(SessionNotFoundException.class, () -> store.claimRun("missing"));
            assertDoesNotThrow(() -> store.releaseRun("missing"));
        }
    }

    // ── concurrent callers ────────────────────────────────────────────────

    @Nested
    @DisplayName("concurrent callers on one session")
    class ConcurrencyTests {

        private static final int CALLERS = 8;

        private <T> List<Future<T>> race(Callable<T> call) throws InterruptedException {
            ExecutorService pool = Executors.newFixedThreadPool(CALLERS);
            CountDownLatch startGate = new CountDownLatch(1);
            List<Future<T>> futures = new ArrayList<>();
            try {
                for (int i = 0; i < CALLERS; i++) {
                    futures.add(pool.submit(() -> {
                        startGate.await();
                        return call.call();
                    }));
                }
                startGate.countDown();
            } finally {
                pool.shutdown();
                assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
            }
            return futures;
        }

        @Test
        @DisplayName("racing beginRound calls open exactly one round")
        void beginRound_exactlyOneWins() throws Exception {
            DeliberationSession session = store.start("s1", CASE, 5);

            int opened = 0;
            int rejected = 0;
            for (Future<Integer> future : race(() -> store.beginRound("s1"))) {
                try {
                    assertEquals(1, future.get());
                    opened++;
                } catch (ExecutionException e) {
                    assertInstanceOf(RoundInProgressException.class, e.getCause());
                    rejected++;
                }
            }

            assertEquals(1, opened);
            assertEquals(CALLERS - 1, rejected);
            assertEquals(1, session.getCurrentRound());
        }

        @Test
        @DisplayName("racing claimRun calls leave exactly one owner")
        void claimRun_exactlyOneWins() throws Exception {
            store.start("s1", CASE, 5);

            int claimed = 0;
            for (Future<Boolean> future : race(() -> {
                try {
                    store.claimRun("s1");
                    return true;
                } catch (DeliberationInProgressException e) {
                    return false;
                }
            })) {
                if (future.get()) claimed++;
            }

            assertEquals(1, claimed);
        }
    }

    // ── end() ─────────────────────────────────────────────────────────────

    @Test
    @DisplayName("end() on an absent session is a no-op")
    void endAbsent() {
        assertDoesNotThrow(() -> store.end("missing", "aborted: nobody"));
    }

    @Test
    @DisplayName("first termination reason wins")
    void endKeepsFirstReason() {
        store.start("s1", CASE, 3);
        store.end("s1", "aborted: first");
        store.end("s1", "error: second");
        assertEquals("aborted: first", store.require("s1").getTerminationReason());
    }

    @Test
    @DisplayName("remove() discards the session")
    void remove() {
        store.start("s1", CASE, 3);
        store.remove("s1");
        assertTrue(store.get("s1").isEmpty());
    }
}
