package com.phillippitts.speakerverify.service.cache;

import com.phillippitts.speakerverify.config.properties.CacheProperties;
import com.phillippitts.speakerverify.exception.DownloadFailedException;
import com.phillippitts.speakerverify.service.audio.AudioDownloader;
import com.phillippitts.speakerverify.service.metrics.VerificationMetrics;
import com.phillippitts.speakerverify.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * Content-addressed cache of remote audio, keyed by the SHA-256 of the URL string.
 *
 * <p>An entry is the file {@code <key>.audio} in the cache directory; it counts as cached when it
 * is a non-empty regular file. Downloads land in a private {@code .part} file that is renamed into
 * place, so a half-written entry is never visible.
 *
 * <p><b>Single-flight:</b> concurrent lookups of the same missing key share one download. The
 * decision is made per key in {@link ConcurrentHashMap#putIfAbsent}; the transfer itself runs
 * outside any lock, on the thread that won the race.
 *
 * <p><b>Leases:</b> every {@link #getOrFetch(String)} returns a {@link CacheLease}. Eviction skips
 * keys with open leases, so an entry is never deleted while a request reads it.
 */
@Component
public class ContentCache {

    private static final Logger LOG = LogManager.getLogger(ContentCache.class);

    static final String ENTRY_SUFFIX = ".audio";
    static final String PART_SUFFIX = ".part";

    private final Path dir;
    private final AudioDownloader downloader;
    private final VerificationMetrics metrics;
    private final Clock clock;

    private final ConcurrentHashMap<String, CompletableFuture<Path>> inFlight = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Integer> leases = new ConcurrentHashMap<>();

    @Autowired
    public ContentCache(CacheProperties props, AudioDownloader downloader, VerificationMetrics metrics) {
        this(Paths.get(props.getDir()), downloader, metrics, Clock.systemUTC());
    }

    ContentCache(Path dir, AudioDownloader downloader, VerificationMetrics metrics, Clock clock) {
        this.dir = dir.toAbsolutePath().normalize();
        this.downloader = downloader;
        this.metrics = metrics;
        this.clock = clock;
        try {
            Files.createDirectories(this.dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create cache directory " + this.dir, e);
        }
    }

    /**
     * Deterministic cache key for a URL: lowercase hex SHA-256 of its UTF-8 bytes.
     */
    public static String keyFor(String url) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(url.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Returns the cached file for {@code url}, downloading it first if absent.
     *
     * @param url absolute http/https URL
     * @return lease on the cached file; close it when done reading
     * @throws DownloadFailedException if the download fails (the cache is left without an entry)
     */
    public CacheLease getOrFetch(String url) {
        String key = keyFor(url);
        acquireLease(key);
        boolean ok = false;
        try {
            Path entry = entryPath(key);
            if (isCached(entry)) {
                metrics.incrementCacheHit();
                LOG.debug("Cache hit for {}", LogSanitizer.redactUrl(url));
            } else {
                entry = fetchSingleFlight(key, url);
            }
            ok = true;
            return new CacheLease(entry, () -> releaseLease(key));
        } finally {
            if (!ok) {
                releaseLease(key);
            }
        }
    }

    private Path fetchSingleFlight(String key, String url) {
        CompletableFuture<Path> mine = new CompletableFuture<>();
        CompletableFuture<Path> existing = inFlight.putIfAbsent(key, mine);
        if (existing != null) {
            LOG.debug("Joining in-flight download of {}", LogSanitizer.redactUrl(url));
            return join(existing);
        }
        try {
            // another thread may have finished between our hit check and putIfAbsent
            Path entry = entryPath(key);
            if (isCached(entry)) {
                metrics.incrementCacheHit();
            } else {
                metrics.incrementCacheMiss();
                download(key, url, entry);
            }
            mine.complete(entry);
            return entry;
        } catch (RuntimeException e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(key, mine);
        }
    }

    private void download(String key, String url, Path entry) {
        Path part = dir.resolve(key + "." + UUID.randomUUID() + PART_SUFFIX);
        long start = System.nanoTime();
        boolean success = false;
        try {
            downloader.download(url, part);
            if (!isCached(part)) {
                throw new DownloadFailedException(LogSanitizer.redactUrl(url), "empty response body");
            }
            moveIntoPlace(part, entry);
            success = true;
        } catch (IOException e) {
            throw new DownloadFailedException(LogSanitizer.redactUrl(url), "cannot store download", e);
        } finally {
            metrics.recordDownload(System.nanoTime() - start, success);
            if (!success) {
                deleteQuietly(part);
            }
        }
    }

    private static void moveIntoPlace(Path part, Path entry) throws IOException {
        try {
            Files.move(part, entry, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(part, entry, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static Path join(CompletableFuture<Path> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw e;
        }
    }

    private void acquireLease(String key) {
        leases.merge(key, 1, Integer::sum);
    }

    private void releaseLease(String key) {
        leases.computeIfPresent(key, (k, n) -> n <= 1 ? null : n - 1);
    }

    int activeLeases(String key) {
        return leases.getOrDefault(key, 0);
    }

    /**
     * Deletes entries older than {@code ttl} that no request is reading.
     *
     * @param ttl maximum entry age
     * @return number of entries deleted
     */
    public int evictOlderThan(Duration ttl) {
        Instant cutoff = clock.instant().minus(ttl);
        return sweep(path -> lastModified(path).isBefore(cutoff));
    }

    /**
     * Deletes every entry no request is reading.
     *
     * @return number of entries deleted
     */
    public int clear() {
        int removed = sweep(path -> true);
        LOG.info("Cache cleared: {} entries removed", removed);
        return removed;
    }

    private int sweep(Predicate<Path> shouldEvict) {
        int removed = 0;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*" + ENTRY_SUFFIX)) {
            for (Path path : stream) {
                if (shouldEvict.test(path) && evictIfIdle(path)) {
                    removed++;
                }
            }
        } catch (IOException e) {
            LOG.warn("Cache sweep of {} failed: {}", dir, e.toString());
        }
        return removed;
    }

    /**
     * Deletes an entry unless it is leased. Runs inside {@code leases.compute} for the key, which
     * excludes a concurrent {@link #acquireLease(String)}.
     */
    private boolean evictIfIdle(Path path) {
        String name = path.getFileName().toString();
        String key = name.substring(0, name.length() - ENTRY_SUFFIX.length());
        boolean[] deleted = {false};
        leases.compute(key, (k, n) -> {
            if (n == null || n == 0) {
                deleted[0] = deleteQuietly(path);
                return null;
            }
            return n;
        });
        return deleted[0];
    }

    private Instant lastModified(Path path) {
        try {
            return Files.getLastModifiedTime(path).toInstant();
        } catch (IOException e) {
            return Instant.MAX;
        }
    }

    private static boolean isCached(Path path) {
        try {
            return Files.isRegularFile(path) && Files.size(path) > 0;
        } catch (IOException e) {
            return false;
        }
    }

    private static boolean deleteQuietly(Path path) {
        try {
            return Files.deleteIfExists(path);
        } catch (IOException e) {
            LOG.warn("Failed to delete cache file {}: {}", path, e.toString());
            return false;
        }
    }

    Path entryPath(String key) {
        return dir.resolve(key + ENTRY_SUFFIX);
    }

    public Path directory() {
        return dir;
    }

    /**
     * Open read lease on a cache entry.
     *
     * @param path      cached file
     * @param onRelease ends the lease; run exactly once by the owner
     */
    public record CacheLease(Path path, Runnable onRelease) {
    }
}
