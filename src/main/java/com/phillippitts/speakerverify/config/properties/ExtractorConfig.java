package com.phillippitts.speakerverify.config.properties;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Configuration for the process-backed embedding extractor.
 * Binds to properties prefixed with "extractor".
 *
 * <p>Example application.properties:
 * <pre>
 * extractor.command=python3,scripts/embedding_worker.py,--model,{model},--device,{device}
 * extractor.startup-timeout-ms=120000
 * extractor.extract-timeout-ms=30000
 * extractor.max-concurrent=1
 * extractor.acquire-timeout-ms=30000
 * extractor.max-line-bytes=1048576
 * </pre>
 *
 * @param command          worker argv; {@code {model}} and {@code {device}} are substituted at load time
 * @param startupTimeoutMs how long the worker may take to report ready (model load)
 * @param extractTimeoutMs deadline for a single extraction answer
 * @param maxConcurrent    requests allowed to talk to the worker at once
 * @param acquireTimeoutMs how long a request waits for a free slot
 * @param maxLineBytes     cap on a single response line from the worker
 */
@ConfigurationProperties(prefix = "extractor")
@Validated
public record ExtractorConfig(
        @NotEmpty(message = "Extractor command must not be empty")
        @DefaultValue({"python3", "scripts/embedding_worker.py", "--model", "{model}", "--device", "{device}"})
        List<String> command,

        @Positive(message = "Startup timeout must be positive")
        @DefaultValue("120000")
        long startupTimeoutMs,

        @Positive(message = "Extract timeout must be positive")
        @DefaultValue("30000")
        long extractTimeoutMs,

        @Positive(message = "Max concurrent must be positive")
        @DefaultValue("1")
        int maxConcurrent,

        @Positive(message = "Acquire timeout must be positive")
        @DefaultValue("30000")
        long acquireTimeoutMs,

        @Positive(message = "Max line bytes must be positive")
        @DefaultValue("1048576")
        int maxLineBytes
) {
    public ExtractorConfig {
        command = command == null ? List.of() : List.copyOf(command);
    }
}
