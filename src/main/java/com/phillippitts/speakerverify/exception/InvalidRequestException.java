package com.phillippitts.speakerverify.exception;

/**
 * Thrown when a request is malformed: missing fields, wrong types, out-of-range values.
 * Always a client error.
 */
public class InvalidRequestException extends SpeakerVerifyException {

    public InvalidRequestException(String message) {
        super(message);
    }

    public InvalidRequestException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getErrorCode() {
        return "INVALID_REQUEST";
    }
}
