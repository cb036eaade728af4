package com.expertpanel.deliberation.expert;

import com.expertpanel.deliberation.generation.GenerationBackend;
import com.expertpanel.deliberation.recovery.ResponseRecovery;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the default panel of model-backed experts, identified {@code expert_1..expert_n}.
 */
@Component
public class ExpertPanelFactory {

    private final GenerationBackend expertBackend;
    private final ResponseRecovery recovery;

    public ExpertPanelFactory(@Qualifier("expertGenerationBackend") GenerationBackend expertBackend,
                              ResponseRecovery recovery) {
        this.expertBackend = expertBackend;
        this.recovery = recovery;
    }

    public List<ExpertAgent> createPanel(int size) {
        List<ExpertAgent> panel = new ArrayList<>(size);
        for (int i = 1; i <= size; i++) {
            panel.add(new LlmExpertAgent(expertId(i), expertBackend, recovery));
        }
        return panel;
    }

    public static String expertId(int position) {
        return "expert_" + position;
    }
}
