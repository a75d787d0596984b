package com.phillippitts.speakerverify.presentation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.phillippitts.speakerverify.domain.VerificationResult;

/**
 * Response of {@code POST /compare_embeddings}. {@code similarity} and {@code score} carry the same
 * value; older clients read {@code similarity}.
 */
public record CompareEmbeddingsResponse(
        @JsonProperty("success") boolean success,
        @JsonProperty("similarity") double similarity,
        @JsonProperty("score") double score,
        @JsonProperty("is_same_speaker") boolean isSameSpeaker,
        @JsonProperty("threshold") double threshold,
        @JsonProperty("confidence") String confidence
) {

    public static CompareEmbeddingsResponse from(VerificationResult result) {
        return new CompareEmbeddingsResponse(true, result.score(), result.score(), result.isSame(),
                result.threshold(), result.confidence().wireName());
    }
}
