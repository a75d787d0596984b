package com.phillippitts.speakerverify.presentation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * JSON body of {@code POST /verify}: two URLs or two server paths, plus an optional threshold.
 */
public record VerifyRequest(
        @JsonProperty("audio1_url") String audio1Url,
        @JsonProperty("audio2_url") String audio2Url,
        @JsonProperty("audio1_path") String audio1Path,
        @JsonProperty("audio2_path") String audio2Path,
        @JsonProperty("threshold") Double threshold
) {
}
