package com.phillippitts.speakerverify.presentation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * JSON body of {@code POST /config}. Absent fields are left unchanged.
 */
public record ConfigUpdateRequest(
        @JsonProperty("threshold") Double threshold,
        @JsonProperty("model_id") String modelId,
        @JsonProperty("device") String device
) {
}
