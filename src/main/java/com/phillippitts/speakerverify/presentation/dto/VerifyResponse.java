package com.phillippitts.speakerverify.presentation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.phillippitts.speakerverify.domain.VerificationResult;

/**
 * Verification outcome as returned by {@code /verify} and inside batch results.
 */
public record VerifyResponse(
        @JsonProperty("success") boolean success,
        @JsonProperty("score") double score,
        @JsonProperty("is_same_speaker") boolean isSameSpeaker,
        @JsonProperty("threshold") double threshold,
        @JsonProperty("confidence") String confidence
) {

    public static VerifyResponse from(VerificationResult result) {
        return new VerifyResponse(true, result.score(), result.isSame(), result.threshold(),
                result.confidence().wireName());
    }
}
