package com.phillippitts.speakerverify.presentation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * JSON body of {@code POST /extract_embedding}: a URL or a server path.
 */
public record ExtractEmbeddingRequest(
        @JsonProperty("audio_url") String audioUrl,
        @JsonProperty("audio_path") String audioPath
) {
}
