package com.expertpanel.deliberation.imaging;

import java.util.Arrays;
import java.util.List;

/** Generic captions used when no captioning service is reachable. */
final class DemoCaptions {

    static final List<String> CAPTIONS = List.of(
        "Chest X-ray demonstrates clear lung fields with no acute cardiopulmonary abnormalities. Heart size appears normal.",
        "Chest radiograph shows patchy consolidation in the right lower lobe, suggestive of an infiltrate. No pleural effusion.",
        "Frontal chest image shows mild cardiomegaly with no focal consolidation or pneumothorax.",
        "Radiograph demonstrates no acute fracture or dislocation. Soft tissues are unremarkable.",
        "Image shows a small nodular opacity in the left upper lung field. Clinical correlation is recommended.");

    private DemoCaptions() {}

    /** Same image always maps to the same caption. */
    static String forImage(byte[] image) {
        int index = image == null ? 0 : Math.floorMod(Arrays.hashCode(image), CAPTIONS.size());
        return CAPTIONS.get(index);
    }
}
