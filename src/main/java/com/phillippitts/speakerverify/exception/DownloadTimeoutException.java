package com.phillippitts.speakerverify.exception;

/**
 * Thrown when a remote download exceeds its connect, read or total deadline.
 */
public class DownloadTimeoutException extends DownloadFailedException {

    private final long timeoutMs;

    public DownloadTimeoutException(String url, long timeoutMs, Throwable cause) {
        super(url, "timed out after " + timeoutMs + "ms", cause);
        this.timeoutMs = timeoutMs;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    @Override
    public String getErrorCode() {
        return "DOWNLOAD_TIMEOUT";
    }
}
