package com.phillippitts.speakerverify.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;

/**
 * Content cache for downloaded remote audio.
 *
 * <p>Example application.properties:
 * <pre>
 * audio.cache.dir=/var/cache/speaker-verify
 * audio.cache.ttl-minutes=0
 * audio.cache.eviction-interval-ms=300000
 * </pre>
 */
@ConfigurationProperties(prefix = "audio.cache")
@Validated
public class CacheProperties {

    @NotBlank(message = "Cache directory must not be blank")
    private String dir = Path.of(System.getProperty("java.io.tmpdir"), "speaker_verification", "cache").toString();

    /** Entries older than this are evicted when idle. 0 keeps entries until restart or explicit clear. */
    @PositiveOrZero(message = "TTL minutes must not be negative")
    private long ttlMinutes = 0;

    /** How often the eviction task runs when a TTL is configured. */
    @Positive(message = "Eviction interval must be positive")
    private long evictionIntervalMs = 300_000;

    public String getDir() {
        return dir;
    }

    public void setDir(String dir) {
        this.dir = dir;
    }

    public long getTtlMinutes() {
        return ttlMinutes;
    }

    public void setTtlMinutes(long ttlMinutes) {
        this.ttlMinutes = ttlMinutes;
    }

    public long getEvictionIntervalMs() {
        return evictionIntervalMs;
    }

    public void setEvictionIntervalMs(long evictionIntervalMs) {
        this.evictionIntervalMs = evictionIntervalMs;
    }
}
