package com.phillippitts.speakerverify.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link ExtractionException} with contextual details about the failed call.
 *
 * <p><b>Usage:</b>
 * <pre>
 * throw ExtractionExceptionBuilder.create("Worker exited")
 *         .extractor("process")
 *         .exitCode(1)
 *         .durationMs(1500)
 *         .metadata("command", command)
 *         .metadata("stderr", stderrSnippet)
 *         .build();
 * </pre>
 *
 * <p>When {@link #timeoutMs(long)} is set the built exception is an {@link ExtractionTimeoutException}.
 */
public final class ExtractionExceptionBuilder {

    private final String message;
    private String extractorName;
    private Throwable cause;
    private Integer exitCode;
    private Long durationMs;
    private Long timeoutMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private ExtractionExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null)
     * @return new builder instance
     */
    public static ExtractionExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new ExtractionExceptionBuilder(message);
    }

    public ExtractionExceptionBuilder extractor(String extractorName) {
        this.extractorName = extractorName;
        return this;
    }

    public ExtractionExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public ExtractionExceptionBuilder exitCode(int exitCode) {
        this.exitCode = exitCode;
        return this;
    }

    public ExtractionExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Marks the failure as a deadline expiry.
     *
     * @param timeoutMs deadline that was exceeded
     * @return this builder for chaining
     */
    public ExtractionExceptionBuilder timeoutMs(long timeoutMs) {
        this.timeoutMs = timeoutMs;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message. Null keys or values are ignored.
     *
     * @param key metadata key
     * @param value metadata value
     * @return this builder for chaining
     */
    public ExtractionExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the exception. Message format:
     * <pre>
     * {message} (exitCode={code}, durationMs={ms}, {key1}={val1}, ...) (extractor: {name})
     * </pre>
     *
     * @return constructed exception
     */
    public ExtractionException build() {
        String detailedMessage = buildDetailedMessage();
        String extractor = extractorName != null ? extractorName : "unknown";

        if (timeoutMs != null) {
            ExtractionTimeoutException ex = new ExtractionTimeoutException(detailedMessage, extractor, timeoutMs);
            if (cause != null) {
                ex.initCause(cause);
            }
            return ex;
        }
        if (cause != null) {
            return new ExtractionException(detailedMessage, extractor, cause);
        }
        return new ExtractionException(detailedMessage, extractor);
    }

    private String buildDetailedMessage() {
        boolean hasDetails = exitCode != null || durationMs != null || !metadata.isEmpty();
        if (!hasDetails) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;

        if (exitCode != null) {
            sb.append("exitCode=").append(exitCode);
            first = false;
        }
        if (durationMs != null) {
            if (!first) {
                sb.append(", ");
            }
            sb.append("durationMs=").append(durationMs);
            first = false;
        }
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }
        return sb.append(')').toString();
    }
}
