package com.expertpanel.deliberation.round;

import com.expertpanel.common.exception.ExpertException;
import com.expertpanel.common.model.ExpertRequest;
import com.expertpanel.common.model.Opinion;
import com.expertpanel.common.model.RoundRecord;
import com.expertpanel.common.parse.ContractValidator;
import com.expertpanel.common.parse.FallbackFactory;
import com.expertpanel.deliberation.expert.ExpertAgent;
import com.expertpanel.deliberation.logger.DeliberationFlowLogger;
import com.expertpanel.deliberation.session.DeliberationSession;
import com.expertpanel.deliberation.session.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Drives the opinion half of one round.
 *
 * <p>Each expert is asked exactly once with the case, the round index, the full previous
 * round's opinions (the expert's own included) and the previous decision's rationale.
 * Calls run concurrently on the bounded-elastic scheduler unless {@code parallel} is off,
 * and are joined before anything is recorded: a round is committed whole or not at all.
 *
 * <p>An expert that errors, times out or returns a malformed opinion is replaced by
 * {@link FallbackFactory#expertFailureOpinion(String, String)}; it never fails the round.
 */
@Service
public class RoundCoordinator {

    private static final Logger log = LoggerFactory.getLogger(RoundCoordinator.class);

    private final SessionStore sessionStore;
    private final DeliberationFlowLogger flowLogger;
    private final Duration expertTimeout;
    private final boolean parallel;

    public RoundCoordinator(SessionStore sessionStore,
                            DeliberationFlowLogger flowLogger,
                            @Value("${deliberation.experts.timeout-ms:90000}") long expertTimeoutMs,
                            @Value("${deliberation.experts.parallel:true}") boolean parallel) {
        this.sessionStore = sessionStore;
        this.flowLogger = flowLogger;
        this.expertTimeout = Duration.ofMillis(expertTimeoutMs);
        this.parallel = parallel;
    }

    /**
     * Collects and records one opinion per expert for {@code roundIndex}.
     *
     * @return the recorded opinions keyed by expert id, in panel order
     */
    public Mono<Map<String, Opinion>> runRound(String sessionId, int roundIndex, List<ExpertAgent> experts) {
        return Mono.fromCallable(() -> buildRequest(sessionStore.require(sessionId), roundIndex))
            .flatMap(request -> {
                log.info("[RoundCoordinator] Dispatching {} experts. sessionId={} round={} parallel={}",
                         experts.size(), sessionId, roundIndex, parallel);

                Function<ExpertAgent, Mono<Map.Entry<String, Opinion>>> ask = expert -> askExpert(expert, request);
                Flux<Map.Entry<String, Opinion>> calls = parallel
                    ? Flux.fromIterable(experts).flatMapSequential(ask)
                    : Flux.fromIterable(experts).concatMap(ask);

                return calls.collectList();
            })
            .map(entries -> {
                Map<String, Opinion> collected = new LinkedHashMap<>();
                entries.forEach(entry -> collected.put(entry.getKey(), entry.getValue()));
                sessionStore.recordOpinions(sessionId, collected);

                collected.forEach((expertId, opinion) -> flowLogger.opinion(sessionId, roundIndex, expertId, opinion));
                flowLogger.stage(DeliberationFlowLogger.OPINIONS_COLLECTED, sessionId, roundIndex);
                return collected;
            });
    }

    ExpertRequest buildRequest(DeliberationSession session, int roundIndex) {
        Map<String, Opinion> priorOpinions = Map.of();
        String priorRationale = "";
        for (RoundRecord round : session.getRounds()) {
            if (round.roundIndex() == roundIndex - 1) {
                priorOpinions = round.opinions();
                priorRationale = round.decision() != null ? round.decision().rationale() : "";
            }
        }
        return new ExpertRequest(session.getSessionId(), session.getCaseContext(), roundIndex,
                                 priorOpinions, priorRationale);
    }

    private Mono<Map.Entry<String, Opinion>> askExpert(ExpertAgent expert, ExpertRequest request) {
        String expertId = expert.expertId();
        return Mono.defer(() -> expert.opine(request))
            .subscribeOn(Schedulers.boundedElastic())
            .timeout(expertTimeout, Mono.error(() -> new ExpertException(expertId,
                "no opinion within " + expertTimeout.toMillis() + "ms")))
            .switchIfEmpty(Mono.error(() -> new ExpertException(expertId, "returned no opinion")))
            .flatMap(opinion -> {
                List<String> violations = ContractValidator.opinionViolations(opinion);
                return violations.isEmpty()
                    ? Mono.just(opinion)
                    : Mono.<Opinion>error(new ExpertException(expertId, "malformed opinion: " + String.join("; ", violations)));
            })
            .doOnSuccess(opinion -> log.info("[RoundCoordinator] Expert={} complete. round={} hypotheses={} fallback={}",
                                             expertId, request.roundIndex(), opinion.hypotheses().size(), opinion.fallback()))
            .onErrorResume(e -> {
                log.error("[RoundCoordinator] Expert={} failed. sessionId={} round={} reason={}",
                          expertId, request.sessionId(), request.roundIndex(), e.getMessage());
                return Mono.just(FallbackFactory.expertFailureOpinion(expertId, e.getMessage()));
            })
            .map(opinion -> Map.entry(expertId, opinion));
    }
}
