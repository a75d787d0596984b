package com.phillippitts.speakerverify.presentation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record CompareEmbeddingsRequest(
        @JsonProperty("embedding1") List<Double> embedding1,
        @JsonProperty("embedding2") List<Double> embedding2,
        @JsonProperty("threshold") Double threshold
) {
}
