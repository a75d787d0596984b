package com.phillippitts.speakerverify.exception;

/**
 * Thrown when the embedding model cannot be made ready: loading exhausted its retry budget,
 * or a caller gave up waiting for another worker's load.
 *
 * <p>This is a transient service error. The coordinator accepts later load attempts.
 */
public class ModelUnavailableException extends SpeakerVerifyException {

    private final String modelId;
    private final int attempts;

    public ModelUnavailableException(String modelId, int attempts, String message, Throwable cause) {
        super("Model " + modelId + " unavailable after " + attempts + " attempt(s): " + message, cause);
        this.modelId = modelId;
        this.attempts = attempts;
    }

    public String getModelId() {
        return modelId;
    }

    public int getAttempts() {
        return attempts;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }

    @Override
    public String getErrorCode() {
        return "MODEL_UNAVAILABLE";
    }

    @Override
    public String getClientMessage() {
        return "Speaker verification model unavailable";
    }
}
