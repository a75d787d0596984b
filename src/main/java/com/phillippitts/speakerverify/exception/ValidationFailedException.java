package com.phillippitts.speakerverify.exception;

/**
 * Thrown when a resolved audio file violates size, format or duration constraints.
 */
public class ValidationFailedException extends SpeakerVerifyException {

    private final long audioSize;
    private final String reason;

    public ValidationFailedException(String reason) {
        super("Invalid audio data: " + reason);
        this.audioSize = 0;
        this.reason = reason;
    }

    public ValidationFailedException(long audioSize, String reason) {
        super("Invalid audio data (" + audioSize + " bytes): " + reason);
        this.audioSize = audioSize;
        this.reason = reason;
    }

    public long getAudioSize() {
        return audioSize;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String getErrorCode() {
        return "VALIDATION_FAILED";
    }
}
