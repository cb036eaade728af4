package com.expertpanel.deliberation.controller;

import com.expertpanel.common.exception.DeliberationException;
import com.expertpanel.common.exception.DeliberationInProgressException;
import com.expertpanel.common.exception.SessionNotFoundException;
import com.expertpanel.common.model.Decision;
import com.expertpanel.common.model.DeliberationResult;
import com.expertpanel.common.model.PatientSummary;
import com.expertpanel.deliberation.controller.dto.EmergencyCheckRequest;
import com.expertpanel.deliberation.controller.dto.EmergencyCheckResponse;
import com.expertpanel.deliberation.controller.dto.StartDeliberationRequest;
import com.expertpanel.deliberation.expert.ExpertPanelFactory;
import com.expertpanel.deliberation.intake.CaseIntakeService;
import com.expertpanel.deliberation.intake.EmergencyKeywordDetector;
import com.expertpanel.deliberation.orchestrator.DeliberationOrchestrator;
import com.expertpanel.deliberation.session.SessionStore;
import com.expertpanel.deliberation.summary.PatientSummaryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Base64;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/deliberations")
public class DeliberationController {

    private static final Logger log = LoggerFactory.getLogger(DeliberationController.class);

    private final DeliberationOrchestrator orchestrator;
    private final ExpertPanelFactory panelFactory;
    private final CaseIntakeService intakeService;
    private final SessionStore sessionStore;
    private final PatientSummaryService summaryService;

    @Value("${deliberation.max-rounds:7}")
    private int defaultMaxRounds;

    @Value("${deliberation.panel-size:3}")
    private int panelSize;

    public DeliberationController(DeliberationOrchestrator orchestrator,
                                  ExpertPanelFactory panelFactory,
                                  CaseIntakeService intakeService,
                                  SessionStore sessionStore,
                                  PatientSummaryService summaryService) {
        this.orchestrator = orchestrator;
        this.panelFactory = panelFactory;
        this.intakeService = intakeService;
        this.sessionStore = sessionStore;
        this.summaryService = summaryService;
    }

    @PostMapping
    public Mono<ResponseEntity<DeliberationResult>> deliberate(@RequestBody StartDeliberationRequest request) {
        String sessionId = request.sessionId() == null || request.sessionId().isBlank()
            ? UUID.randomUUID().toString()
            : request.sessionId();
        int maxRounds = request.maxRounds() != null ? request.maxRounds() : defaultMaxRounds;
        log.info("Deliberation requested. sessionId={} maxRounds={}", sessionId, maxRounds);

        return Mono.fromCallable(() -> decodeImage(request.imageBase64()))
            .flatMap(image -> intakeService.prepare(request.caseContext(), request.intake(), image))
            .map(context -> orchestrator.startSession(sessionId, context, maxRounds, panelSize))
            .flatMap(session -> orchestrator.runDeliberation(sessionId, panelFactory.createPanel(session.getPanelSize())))
            .map(ResponseEntity::ok)
            .onErrorResume(SessionNotFoundException.class,
                           e -> Mono.just(ResponseEntity.notFound().<DeliberationResult>build()))
            .onErrorResume(DeliberationInProgressException.class, e -> {
                log.warn("Deliberation already running. sessionId={}", sessionId);
                return Mono.just(ResponseEntity.status(HttpStatus.CONFLICT).<DeliberationResult>build());
            })
            .onErrorResume(e -> e instanceof IllegalArgumentException || e instanceof DeliberationException, e -> {
                log.warn("Deliberation rejected. sessionId={} reason={}", sessionId, e.getMessage());
                return Mono.just(ResponseEntity.badRequest().<DeliberationResult>build());
            })
            .doOnError(e -> log.error("Deliberation endpoint error. sessionId={}", sessionId, e));
    }

    @GetMapping("/{sessionId}")
    public Mono<ResponseEntity<DeliberationResult>> result(@PathVariable String sessionId) {
        return Mono.justOrEmpty(orchestrator.result(sessionId))
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping("/{sessionId}/final-decision")
    public Mono<ResponseEntity<Decision>> finalDecision(@PathVariable String sessionId) {
        return Mono.justOrEmpty(orchestrator.getFinalDecision(sessionId))
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping("/{sessionId}/patient-summary")
    public Mono<ResponseEntity<PatientSummary>> patientSummary(@PathVariable String sessionId) {
        return Mono.justOrEmpty(orchestrator.getFinalDecision(sessionId))
            .flatMap(decision -> summaryService.summarise(sessionId, decision))
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @PostMapping("/{sessionId}/abort")
    public Mono<ResponseEntity<Void>> abort(@PathVariable String sessionId,
                                            @RequestParam(defaultValue = "requested by client") String reason) {
        return Mono.fromRunnable(() -> orchestrator.abort(sessionId, reason))
            .then(Mono.just(ResponseEntity.status(HttpStatus.ACCEPTED).<Void>build()))
            .onErrorResume(SessionNotFoundException.class, e -> Mono.just(ResponseEntity.notFound().<Void>build()));
    }

    @DeleteMapping("/{sessionId}")
    public Mono<ResponseEntity<Void>> discard(@PathVariable String sessionId) {
        log.info("Session discard requested. sessionId={}", sessionId);
        sessionStore.remove(sessionId);
        return Mono.just(ResponseEntity.noContent().<Void>build());
    }

    @PostMapping("/emergency-check")
    public Mono<ResponseEntity<EmergencyCheckResponse>> emergencyCheck(@RequestBody EmergencyCheckRequest request) {
        List<String> matched = EmergencyKeywordDetector.detect(request.text());
        return Mono.just(ResponseEntity.ok(new EmergencyCheckResponse(!matched.isEmpty(), matched)));
    }

    private static byte[] decodeImage(String imageBase64) {
        return imageBase64 == null || imageBase64.isBlank() ? new byte[0] : Base64.getDecoder().decode(imageBase64);
    }
}
