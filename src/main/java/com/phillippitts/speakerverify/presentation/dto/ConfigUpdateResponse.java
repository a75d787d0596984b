package com.phillippitts.speakerverify.presentation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ConfigUpdateResponse(
        @JsonProperty("success") boolean success,
        @JsonProperty("model_reloaded") boolean modelReloaded,
        @JsonProperty("config") ConfigResponse config
) {
}
