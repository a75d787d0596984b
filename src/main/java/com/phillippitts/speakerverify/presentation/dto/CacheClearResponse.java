package com.phillippitts.speakerverify.presentation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CacheClearResponse(
        @JsonProperty("success") boolean success,
        @JsonProperty("removed") int removed
) {
}
