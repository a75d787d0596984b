package com.phillippitts.speakerverify.presentation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Effective runtime configuration.
 */
public record ConfigResponse(
        @JsonProperty("model_id") String modelId,
        @JsonProperty("device") String device,
        @JsonProperty("threshold") double threshold,
        @JsonProperty("inclusive_threshold") boolean inclusiveThreshold,
        @JsonProperty("max_file_size") long maxFileSize,
        @JsonProperty("allowed_extensions") List<String> allowedExtensions
) {
}
