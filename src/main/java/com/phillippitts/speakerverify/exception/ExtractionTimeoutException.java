package com.phillippitts.speakerverify.exception;

/**
 * Thrown when the extractor does not answer within its configured deadline.
 */
public class ExtractionTimeoutException extends ExtractionException {

    private final long timeoutMs;

    public ExtractionTimeoutException(String message, String extractorName, long timeoutMs) {
        super(message, extractorName);
        this.timeoutMs = timeoutMs;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    @Override
    public String getErrorCode() {
        return "EXTRACTION_TIMEOUT";
    }

    @Override
    public String getClientMessage() {
        return "Embedding extraction timed out";
    }
}
