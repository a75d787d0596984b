package com.phillippitts.speakerverify.service.model;

import com.phillippitts.speakerverify.service.extractor.EmbeddingExtractor;
import com.phillippitts.speakerverify.service.extractor.ModelSpec;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A loaded extractor plus the bookkeeping that lets it be replaced while in use.
 *
 * <p>Requests take a lease before using the extractor. Once the coordinator retires the handle,
 * no new leases are granted and the extractor is closed when the last lease is returned.
 */
public final class ModelHandle {

    private static final Logger LOG = LogManager.getLogger(ModelHandle.class);

    private final EmbeddingExtractor extractor;
    private final ModelSpec spec;
    private final Instant loadedAt;
    private final AtomicInteger leases = new AtomicInteger();
    private final AtomicBoolean closed = new AtomicBoolean();
    private volatile boolean retired;

    ModelHandle(EmbeddingExtractor extractor, ModelSpec spec, Instant loadedAt) {
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.spec = Objects.requireNonNull(spec, "spec");
        this.loadedAt = Objects.requireNonNull(loadedAt, "loadedAt");
    }

    public EmbeddingExtractor extractor() {
        return extractor;
    }

    public ModelSpec spec() {
        return spec;
    }

    public Instant loadedAt() {
        return loadedAt;
    }

    public boolean isRetired() {
        return retired;
    }

    int activeLeases() {
        return leases.get();
    }

    /**
     * @return a lease, or {@code null} if the handle was retired concurrently
     */
    ModelLease tryLease() {
        leases.incrementAndGet();
        if (retired) {
            release();
            return null;
        }
        return new ModelLease(this);
    }

    void release() {
        if (leases.decrementAndGet() == 0 && retired) {
            closeExtractor();
        }
    }

    /**
     * Stops granting leases; the extractor closes now if idle, otherwise when the last lease ends.
     */
    void retire() {
        retired = true;
        if (leases.get() == 0) {
            closeExtractor();
        }
    }

    private void closeExtractor() {
        if (closed.compareAndSet(false, true)) {
            LOG.info("Closing retired extractor {}", extractor.name());
            try {
                extractor.close();
            } catch (RuntimeException e) {
                LOG.warn("Extractor {} failed to close cleanly: {}", extractor.name(), e.toString());
            }
        }
    }

    boolean isClosed() {
        return closed.get();
    }
}
