package com.expertpanel.deliberation.imaging;

import com.expertpanel.common.model.ImagingFinding;

import java.util.List;
import java.util.Locale;

/**
 * Derives an {@link ImagingFinding} from a caption: known anatomy and finding terms become
 * entities, the first sentence becomes the impression.
 */
public final class ImagingFindingExtractor {

    static final List<String> ENTITY_TERMS = List.of(
        "lung", "heart", "chest", "rib", "pleural effusion", "consolidation", "opacity", "infiltrate",
        "nodule", "nodular", "mass", "cardiomegaly", "pneumothorax", "edema", "atelectasis",
        "fracture", "dislocation", "soft tissue", "brain", "abdomen", "liver", "kidney", "bone");

    private ImagingFindingExtractor() {}

    public static ImagingFinding extract(String caption) {
        if (caption == null || caption.isBlank()) return ImagingFinding.none();
        String text = caption.strip();
        String lower = text.toLowerCase(Locale.ROOT);

        List<String> entities = ENTITY_TERMS.stream().filter(lower::contains).toList();

        int end = text.indexOf(". ");
        String impression = end < 0 ? text : text.substring(0, end + 1);

        return new ImagingFinding(text, entities, impression);
    }
}
