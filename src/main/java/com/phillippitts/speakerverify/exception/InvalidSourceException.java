package com.phillippitts.speakerverify.exception;

/**
 * Thrown when an audio source cannot be accepted: disallowed upload extension,
 * unsupported URL scheme, or a local path that does not exist or is not readable.
 */
public class InvalidSourceException extends InvalidRequestException {

    private final String source;
    private final String reason;

    public InvalidSourceException(String source, String reason) {
        super("Invalid audio source: " + reason);
        this.source = source;
        this.reason = reason;
    }

    public String getSource() {
        return source;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String getErrorCode() {
        return "INVALID_SOURCE";
    }
}
