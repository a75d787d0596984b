package com.phillippitts.speakerverify.domain;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A local audio file ready for extraction, plus who is responsible for it.
 *
 * <p>{@code owned=true}: the resolver created the file for this request and {@link #close()} deletes it.
 * {@code owned=false}: the file belongs to the caller or to the content cache; {@link #close()} only
 * runs the optional release hook (for cache entries, this ends the read lease that protects the entry
 * from eviction).
 *
 * <p>{@link #close()} is idempotent and never throws; failures are logged.
 */
public final class ResolvedAudio implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(ResolvedAudio.class);

    private final Path path;
    private final boolean owned;
    private final Runnable onRelease;
    private final AtomicBoolean closed = new AtomicBoolean();

    private ResolvedAudio(Path path, boolean owned, Runnable onRelease) {
        this.path = Objects.requireNonNull(path, "path");
        this.owned = owned;
        this.onRelease = onRelease;
    }

    /** A file created for this request; deleted on close. */
    public static ResolvedAudio owned(Path path) {
        return new ResolvedAudio(path, true, null);
    }

    /** A file the request must not delete. */
    public static ResolvedAudio borrowed(Path path) {
        return new ResolvedAudio(path, false, null);
    }

    /** A file the request must not delete, with a hook run once on close. */
    public static ResolvedAudio borrowed(Path path, Runnable onRelease) {
        return new ResolvedAudio(path, false, onRelease);
    }

    public Path path() {
        return path;
    }

    public boolean owned() {
        return owned;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (owned) {
            try {
                Files.deleteIfExists(path);
            } catch (IOException e) {
                LOG.warn("Failed to delete temporary audio {}: {}", path, e.toString());
            }
        }
        if (onRelease != null) {
            try {
                onRelease.run();
            } catch (RuntimeException e) {
                LOG.warn("Release hook failed for {}: {}", path, e.toString());
            }
        }
    }

    @Override
    public String toString() {
        return "ResolvedAudio[path=" + path + ", owned=" + owned + "]";
    }
}
