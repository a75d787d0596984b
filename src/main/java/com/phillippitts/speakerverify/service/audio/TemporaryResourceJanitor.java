package com.phillippitts.speakerverify.service.audio;

import com.phillippitts.speakerverify.config.properties.AudioSourceProperties;
import com.phillippitts.speakerverify.config.properties.CacheProperties;
import com.phillippitts.speakerverify.domain.AudioSource;
import com.phillippitts.speakerverify.domain.ResolvedAudio;
import jakarta.annotation.PostConstruct;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Guarantees that resolver-owned temporary files do not outlive their request.
 *
 * <p>Requests open a {@link Scope} in try-with-resources and resolve every source through it.
 * Closing the scope closes each {@link ResolvedAudio} in reverse order: owned files are deleted,
 * cache leases are returned. This holds on success, on error, and for partially resolved
 * requests.
 *
 * <p>At start-up, files left behind by a crashed process (scratch uploads and abandoned
 * {@code .part} downloads) older than {@link #STALE_AFTER} are removed.
 */
@Component
public class TemporaryResourceJanitor {

    private static final Logger LOG = LogManager.getLogger(TemporaryResourceJanitor.class);

    static final Duration STALE_AFTER = Duration.ofHours(1);

    private final AudioSourceResolver resolver;
    private final Path scratchDir;
    private final Path cacheDir;
    private final Clock clock;

    @Autowired
    public TemporaryResourceJanitor(AudioSourceResolver resolver,
                                    AudioSourceProperties sourceProps,
                                    CacheProperties cacheProps) {
        this(resolver, Paths.get(sourceProps.getScratchDir()), Paths.get(cacheProps.getDir()), Clock.systemUTC());
    }

    TemporaryResourceJanitor(AudioSourceResolver resolver, Path scratchDir, Path cacheDir, Clock clock) {
        this.resolver = resolver;
        this.scratchDir = scratchDir;
        this.cacheDir = cacheDir;
        this.clock = clock;
    }

    /** Opens a cleanup scope for one request. */
    public Scope openScope() {
        return new Scope(resolver);
    }

    @PostConstruct
    void sweepStaleFiles() {
        Instant cutoff = clock.instant().minus(STALE_AFTER);
        int removed = deleteOlderThan(scratchDir, "*", cutoff) + deleteOlderThan(cacheDir, "*.part", cutoff);
        if (removed > 0) {
            LOG.info("Removed {} stale temporary audio files", removed);
        }
    }

    private static int deleteOlderThan(Path dir, String glob, Instant cutoff) {
        if (!Files.isDirectory(dir)) {
            return 0;
        }
        int removed = 0;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, glob)) {
            for (Path path : stream) {
                try {
                    if (Files.isRegularFile(path)
                            && Files.getLastModifiedTime(path).toInstant().isBefore(cutoff)
                            && Files.deleteIfExists(path)) {
                        removed++;
                    }
                } catch (IOException e) {
                    LOG.warn("Could not remove stale file {}: {}", path, e.toString());
                }
            }
        } catch (IOException e) {
            LOG.warn("Stale file sweep of {} failed: {}", dir, e.toString());
        }
        return removed;
    }

    /**
     * Request-scoped set of resolved audio. Not shared between threads except through
     * {@link #resolve(AudioSource)}, which is synchronized for batch fan-out.
     */
    public static final class Scope implements AutoCloseable {

        private final AudioSourceResolver resolver;
        private final Deque<ResolvedAudio> resources = new ArrayDeque<>();
        private boolean closed;

        Scope(AudioSourceResolver resolver) {
            this.resolver = resolver;
        }

        /**
         * Resolves a source and registers the result for cleanup.
         */
        public ResolvedAudio resolve(AudioSource source) {
            ResolvedAudio resolved = resolver.resolve(source);
            synchronized (this) {
                if (closed) {
                    resolved.close();
                    throw new IllegalStateException("Scope already closed");
                }
                resources.push(resolved);
            }
            return resolved;
        }

        synchronized int size() {
            return resources.size();
        }

        /** Closes every registered resource; never throws. */
        @Override
        public void close() {
            Deque<ResolvedAudio> toClose;
            synchronized (this) {
                if (closed) {
                    return;
                }
                closed = true;
                toClose = new ArrayDeque<>(resources);
                resources.clear();
            }
            for (ResolvedAudio audio : toClose) {
                audio.close();
            }
        }
    }
}
