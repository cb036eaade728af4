package com.expertpanel.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Text finding produced from an uploaded image by the captioning tool.
 *
 * <p>{@code entities} are the anatomical or finding keywords recognised in the caption;
 * {@code impression} is the caption's leading sentence.
 */
public record ImagingFinding(
    @JsonProperty("description") String description,
    @JsonProperty("entities")    List<String> entities,
    @JsonProperty("impression")  String impression
) {
    public ImagingFinding {
        description = description == null ? "" : description;
        entities    = entities == null ? List.of() : List.copyOf(entities);
        impression  = impression == null ? "" : impression;
    }

    /** Finding used when no image was supplied. */
    public static ImagingFinding none() {
        return new ImagingFinding("", List.of(), "");
    }

    public boolean isEmpty() {
        return description.isBlank() && entities.isEmpty() && impression.isBlank();
    }
}
