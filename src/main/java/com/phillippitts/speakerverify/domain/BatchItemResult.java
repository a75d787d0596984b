package com.phillippitts.speakerverify.domain;

/**
 * Per-candidate outcome of a batch verification: either a result or an error, never both.
 *
 * @param candidate    the candidate as submitted
 * @param result       verification result on success
 * @param errorCode    error type on failure
 * @param errorMessage client-facing error description on failure
 */
public record BatchItemResult(
        String candidate,
        VerificationResult result,
        String errorCode,
        String errorMessage
) {

    public static BatchItemResult success(String candidate, VerificationResult result) {
        return new BatchItemResult(candidate, result, null, null);
    }

    public static BatchItemResult failure(String candidate, String errorCode, String errorMessage) {
        return new BatchItemResult(candidate, null, errorCode, errorMessage);
    }

    public boolean succeeded() {
        return result != null;
    }
}
