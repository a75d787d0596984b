package com.phillippitts.speakerverify.presentation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * JSON body of {@code POST /verify_batch}. Reference and candidates are URLs or server paths.
 */
public record BatchVerifyRequest(
        @JsonProperty("reference") String reference,
        @JsonProperty("candidates") List<String> candidates,
        @JsonProperty("threshold") Double threshold
) {
}
