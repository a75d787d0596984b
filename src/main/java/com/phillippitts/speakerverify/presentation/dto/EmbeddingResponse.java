package com.phillippitts.speakerverify.presentation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.phillippitts.speakerverify.domain.Embedding;

public record EmbeddingResponse(
        @JsonProperty("success") boolean success,
        @JsonProperty("embedding") double[] embedding,
        @JsonProperty("dimension") int dimension
) {

    public static EmbeddingResponse from(Embedding embedding) {
        return new EmbeddingResponse(true, embedding.values(), embedding.dimension());
    }
}
