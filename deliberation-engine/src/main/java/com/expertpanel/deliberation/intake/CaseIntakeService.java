package com.expertpanel.deliberation.intake;

import com.expertpanel.common.model.CaseContext;
import com.expertpanel.common.model.ImagingFinding;
import com.expertpanel.deliberation.imaging.ImagingFindingExtractor;
import com.expertpanel.deliberation.imaging.ImagingTool;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Produces the {@link CaseContext} a session starts from: a caller-supplied context is used
 * as is, otherwise intake answers are assembled. An image, when present, is captioned and
 * replaces the imaging finding.
 */
@Service
public class CaseIntakeService {

    private final CaseContextAssembler assembler;
    private final ImagingTool imagingTool;

    public CaseIntakeService(CaseContextAssembler assembler, ImagingTool imagingTool) {
        this.assembler = assembler;
        this.imagingTool = imagingTool;
    }

    public Mono<CaseContext> prepare(CaseContext provided, IntakeAnswers intake, byte[] image) {
        if (provided == null && intake == null) {
            return Mono.error(new IllegalArgumentException("either caseContext or intake must be supplied"));
        }
        Mono<ImagingFinding> finding = image == null || image.length == 0
            ? Mono.just(provided != null ? provided.imagingFinding() : ImagingFinding.none())
            : imagingTool.caption(image).map(ImagingFindingExtractor::extract);

        return finding.map(f -> provided != null
            ? provided.withImagingFinding(f)
            : assembler.assemble(intake, f));
    }
}
