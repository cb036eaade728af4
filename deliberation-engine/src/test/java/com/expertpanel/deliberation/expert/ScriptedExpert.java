package com.expertpanel.deliberation.expert;

import com.expertpanel.common.model.ExpertRequest;
import com.expertpanel.common.model.Opinion;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/** Test expert answering from a script and keeping every request it received. */
public class ScriptedExpert implements ExpertAgent {

    private final String expertId;
    private final Function<ExpertRequest, Mono<Opinion>> script;
    private final List<ExpertRequest> requests = new CopyOnWriteArrayList<>();

    public ScriptedExpert(String expertId, Function<ExpertRequest, Mono<Opinion>> script) {
        this.expertId = expertId;
        this.script = script;
    }

    public static ScriptedExpert fixed(String expertId, String hypothesis, String test) {
        return new ScriptedExpert(expertId, r -> Mono.just(Opinion.of(List.of(hypothesis), List.of(test), "reasoning")));
    }

    @Override
    public String expertId() {
        return expertId;
    }

    @Override
    public Mono<Opinion> opine(ExpertRequest request) {
        requests.add(request);
        return script.apply(request);
    }

    public List<ExpertRequest> requests() {
        return requests;
    }
}
