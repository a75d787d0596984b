package com.phillippitts.speakerverify.service.audio;

import java.nio.file.Path;

/**
 * Fetches remote audio to a local file.
 */
public interface AudioDownloader {

    /**
     * Downloads {@code url} into {@code destination}, replacing any existing content.
     * On failure the destination may hold partial data; the caller discards it.
     *
     * @param url         absolute http/https URL
     * @param destination file to write
     * @throws com.phillippitts.speakerverify.exception.DownloadFailedException on non-2xx status,
     *         connection or I/O failure, or a body above the size cap
     * @throws com.phillippitts.speakerverify.exception.DownloadTimeoutException when a connect,
     *         read or total deadline expires
     */
    void download(String url, Path destination);
}
