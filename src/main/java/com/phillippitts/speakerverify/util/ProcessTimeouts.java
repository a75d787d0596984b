package com.phillippitts.speakerverify.util;

import java.time.Duration;

/**
 * Standard timeout values for worker process and thread management.
 *
 * @see com.phillippitts.speakerverify.service.extractor.process.ProcessEmbeddingExtractor
 * @since 1.0
 */
public final class ProcessTimeouts {

    /**
     * Timeout for stream gobbler threads during cleanup. Gobblers are daemon threads,
     * so a thread that does not finish in time dies with the JVM.
     */
    public static final Duration GOBBLER_CLEANUP_TIMEOUT = Duration.ofMillis(100);

    /** Wait after {@link Process#destroy()} before escalating. */
    public static final Duration GRACEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    /** Wait after {@link Process#destroyForcibly()}. */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    private ProcessTimeouts() {
    }
}
