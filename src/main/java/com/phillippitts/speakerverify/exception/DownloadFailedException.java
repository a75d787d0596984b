package com.phillippitts.speakerverify.exception;

/**
 * Thrown when fetching remote audio fails: connection error, non-2xx status,
 * oversized body or local I/O while writing the download.
 *
 * <p>The URL kept here is already sanitized for logging (no query string).
 */
public class DownloadFailedException extends SpeakerVerifyException {

    private final String url;
    private final int statusCode;

    public DownloadFailedException(String url, String message) {
        this(url, message, -1, null);
    }

    public DownloadFailedException(String url, String message, int statusCode) {
        this(url, message, statusCode, null);
    }

    public DownloadFailedException(String url, String message, Throwable cause) {
        this(url, message, -1, cause);
    }

    private DownloadFailedException(String url, String message, int statusCode, Throwable cause) {
        super("Failed to download audio from " + url + ": " + message, cause);
        this.url = url;
        this.statusCode = statusCode;
    }

    public String getUrl() {
        return url;
    }

    /**
     * @return HTTP status returned by the remote server, or -1 if no response was received
     */
    public int getStatusCode() {
        return statusCode;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }

    @Override
    public String getErrorCode() {
        return "DOWNLOAD_FAILED";
    }
}
