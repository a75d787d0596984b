package com.phillippitts.speakerverify.presentation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Response of {@code GET /models}: the configured catalog and the model currently served.
 */
public record ModelsResponse(
        @JsonProperty("current_model") String currentModel,
        @JsonProperty("available_models") List<ModelInfo> models
) {

    public record ModelInfo(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("language") String language,
            @JsonProperty("description") String description
    ) {
    }
}
