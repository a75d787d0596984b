package com.phillippitts.speakerverify.exception;

/**
 * Thrown when the embedding extractor fails on a given audio file: unreadable or corrupt audio,
 * unsupported sample format, worker crash, or malformed worker output.
 */
public class ExtractionException extends SpeakerVerifyException {

    private final String extractorName;

    public ExtractionException(String message) {
        super(message);
        this.extractorName = "unknown";
    }

    public ExtractionException(String message, String extractorName) {
        super(message + " (extractor: " + extractorName + ")");
        this.extractorName = extractorName;
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
        this.extractorName = "unknown";
    }

    public ExtractionException(String message, String extractorName, Throwable cause) {
        super(message + " (extractor: " + extractorName + ")", cause);
        this.extractorName = extractorName;
    }

    public String getExtractorName() {
        return extractorName;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }

    @Override
    public String getErrorCode() {
        return "EXTRACTION_FAILED";
    }

    @Override
    public String getClientMessage() {
        return "Embedding extraction failed";
    }
}
