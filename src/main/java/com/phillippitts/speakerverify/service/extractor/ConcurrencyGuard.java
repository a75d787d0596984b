package com.phillippitts.speakerverify.service.extractor;

import com.phillippitts.speakerverify.exception.ExtractionException;

import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Bounds concurrent calls into an extractor with a semaphore and a wait deadline.
 *
 * <p><b>Usage Pattern:</b>
 * <pre>{@code
 * guard.acquire(); // blocks until a permit is available or the timeout expires
 * try {
 *     // ... talk to the model ...
 * } finally {
 *     guard.release();
 * }
 * }</pre>
 *
 * <p>Thread-safe.
 */
public final class ConcurrencyGuard {

    private final Semaphore semaphore;
    private final long timeoutMs;
    private final String extractorName;

    /**
     * @param permits       concurrent callers allowed
     * @param timeoutMs     maximum time to wait for a permit in milliseconds
     * @param extractorName name for error messages
     */
    public ConcurrencyGuard(int permits, long timeoutMs, String extractorName) {
        if (permits <= 0) {
            throw new IllegalArgumentException("permits must be positive");
        }
        this.semaphore = new Semaphore(permits, true);
        this.timeoutMs = timeoutMs;
        this.extractorName = extractorName;
    }

    /**
     * Acquires a permit, blocking up to the configured timeout.
     *
     * @throws ExtractionException if no permit becomes available in time or the thread is interrupted
     */
    public void acquire() {
        try {
            if (!semaphore.tryAcquire(timeoutMs, TimeUnit.MILLISECONDS)) {
                throw new ExtractionException(
                        extractorName + " concurrency limit reached after " + timeoutMs + "ms wait",
                        extractorName);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExtractionException(
                    extractorName + " interrupted while waiting for a free slot", extractorName, e);
        }
    }

    /** Releases a permit obtained by {@link #acquire()}. Call from a finally block. */
    public void release() {
        semaphore.release();
    }

    public int availablePermits() {
        return semaphore.availablePermits();
    }
}
