package com.phillippitts.speakerverify.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configurable audio validation limits.
 * Defaults: at least half a second of speech, at most 30 seconds, 50 MB per file.
 */
@ConfigurationProperties(prefix = "audio.validation")
@Validated
public class AudioValidationProperties {

    /** Minimum duration in milliseconds for a clip to carry a usable voiceprint. */
    @Positive(message = "Minimum duration must be positive")
    private int minDurationMs = 500;

    /** Maximum duration in milliseconds. */
    @Positive(message = "Maximum duration must be positive")
    private int maxDurationMs = 30_000;

    /** Maximum file size in bytes. */
    @Positive(message = "Maximum file size must be positive")
    private long maxFileSizeBytes = 50L * 1024 * 1024;

    public int getMinDurationMs() {
        return minDurationMs;
    }

    public void setMinDurationMs(int minDurationMs) {
        this.minDurationMs = minDurationMs;
    }

    public int getMaxDurationMs() {
        return maxDurationMs;
    }

    public void setMaxDurationMs(int maxDurationMs) {
        this.maxDurationMs = maxDurationMs;
    }

    public long getMaxFileSizeBytes() {
        return maxFileSizeBytes;
    }

    public void setMaxFileSizeBytes(long maxFileSizeBytes) {
        this.maxFileSizeBytes = maxFileSizeBytes;
    }
}
