package com.phillippitts.speakerverify.testutil;

import com.phillippitts.speakerverify.domain.Embedding;
import com.phillippitts.speakerverify.exception.ExtractionException;
import com.phillippitts.speakerverify.exception.ExtractionTimeoutException;
import com.phillippitts.speakerverify.service.extractor.EmbeddingExtractor;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Test double for EmbeddingExtractor that derives a deterministic embedding from the file's bytes.
 *
 * <p>Identical files yield identical embeddings (score 1.0); different files almost surely differ.
 * {@code healthy} is public so tests can simulate a dead worker. Like the process-backed extractor, an
 * unhealthy instance refuses work, and a file whose name contains {@code hangOn} times out and takes
 * the worker down with it.
 */
public class FakeEmbeddingExtractor implements EmbeddingExtractor {

    public static final int DIMENSION = 16;

    private final String name;
    public volatile boolean healthy = true;
    public volatile String hangOn;
    /** When set, {@link #close()} waits for it, like a worker process that is slow to exit. */
    public volatile CountDownLatch closeGate;
    private final AtomicBoolean closed = new AtomicBoolean();
    private final AtomicInteger extractions = new AtomicInteger();

    public FakeEmbeddingExtractor(String name) {
        this.name = name;
    }

    @Override
    public Embedding extract(Path audioFile) {
        if (closed.get()) {
            throw new ExtractionException("Extractor closed", name);
        }
        if (!healthy) {
            throw new ExtractionException("Embedding worker is not running", name);
        }
        String marker = hangOn;
        if (marker != null && audioFile.getFileName().toString().contains(marker)) {
            healthy = false;
            throw new ExtractionTimeoutException("Embedding worker did not answer", name, 30_000);
        }
        extractions.incrementAndGet();
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(Files.readAllBytes(audioFile));
            double[] values = new double[DIMENSION];
            for (int i = 0; i < DIMENSION; i++) {
                values[i] = digest[i] + 0.5;
            }
            return Embedding.of(values).normalized();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }

    @Override
    public int dimension() {
        return DIMENSION;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public boolean isHealthy() {
        return healthy && !closed.get();
    }

    @Override
    public void close() {
        CountDownLatch gate = closeGate;
        if (gate != null) {
            try {
                gate.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        closed.set(true);
    }

    public boolean isClosed() {
        return closed.get();
    }

    public int extractions() {
        return extractions.get();
    }
}
