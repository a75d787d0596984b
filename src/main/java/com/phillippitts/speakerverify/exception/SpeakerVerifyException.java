package com.phillippitts.speakerverify.exception;

/**
 * Base exception for all speaker-verify application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class SpeakerVerifyException extends RuntimeException {

    public SpeakerVerifyException(String message) {
        super(message);
    }

    public SpeakerVerifyException(String message, Throwable cause) {
        super(message, cause);
    }

    public SpeakerVerifyException(Throwable cause) {
        super(cause);
    }

    /**
     * Whether a client may reasonably retry the same request later.
     * Input errors are not retryable; service-side failures are.
     *
     * @return true if the failure is transient
     */
    public boolean isRetryable() {
        return false;
    }

    /**
     * Stable machine-readable code reported to clients as {@code error_code}.
     *
     * @return error code
     */
    public String getErrorCode() {
        return "INTERNAL_ERROR";
    }

    /**
     * Message safe to show to API clients. Service-side failures override this to hide
     * internal details such as file paths or worker output.
     *
     * @return client-facing message
     */
    public String getClientMessage() {
        return getMessage();
    }
}
