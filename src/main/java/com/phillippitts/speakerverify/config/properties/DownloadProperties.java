package com.phillippitts.speakerverify.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * HTTP download limits for remote audio.
 */
@ConfigurationProperties(prefix = "audio.download")
@Validated
public class DownloadProperties {

    @Positive(message = "Connect timeout must be positive")
    private int connectTimeoutMs = 10_000;

    /** Socket read timeout between packets. */
    @Positive(message = "Read timeout must be positive")
    private int readTimeoutMs = 30_000;

    /** Deadline for the whole transfer. */
    @Positive(message = "Total timeout must be positive")
    private long totalTimeoutMs = 60_000;

    /** Largest body accepted before the download is aborted. */
    @Positive(message = "Max bytes must be positive")
    private long maxBytes = 50L * 1024 * 1024;

    @Positive(message = "Max connections must be positive")
    private int maxConnections = 20;

    public int getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public void setConnectTimeoutMs(int connectTimeoutMs) {
        this.connectTimeoutMs = connectTimeoutMs;
    }

    public int getReadTimeoutMs() {
        return readTimeoutMs;
    }

    public void setReadTimeoutMs(int readTimeoutMs) {
        this.readTimeoutMs = readTimeoutMs;
    }

    public long getTotalTimeoutMs() {
        return totalTimeoutMs;
    }

    public void setTotalTimeoutMs(long totalTimeoutMs) {
        this.totalTimeoutMs = totalTimeoutMs;
    }

    public long getMaxBytes() {
        return maxBytes;
    }

    public void setMaxBytes(long maxBytes) {
        this.maxBytes = maxBytes;
    }

    public int getMaxConnections() {
        return maxConnections;
    }

    public void setMaxConnections(int maxConnections) {
        this.maxConnections = maxConnections;
    }
}
