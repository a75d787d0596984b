package com.phillippitts.speakerverify.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for the verification service.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Request latency and outcome per endpoint</li>
 *   <li>Model load duration, attempts and failures</li>
 *   <li>Content cache hits, misses and downloads</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class VerificationMetrics {

    private static final String METRIC_PREFIX = "speakerverify";

    private final MeterRegistry registry;

    public VerificationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records handling time and outcome of one request.
     *
     * @param endpoint      logical endpoint (verify, verify_batch, extract_embedding, ...)
     * @param durationNanos duration in nanoseconds
     * @param outcome       "success" or an error code
     */
    public void recordRequest(String endpoint, long durationNanos, String outcome) {
        Timer.builder(METRIC_PREFIX + ".request.latency")
                .description("Time taken to handle a request")
                .tag("endpoint", endpoint)
                .tag("outcome", outcome)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Records a completed model load.
     *
     * @param modelId       loaded model
     * @param durationNanos time spent across all attempts, backoff included
     * @param success       whether the model ended up ready
     */
    public void recordModelLoad(String modelId, long durationNanos, boolean success) {
        Timer.builder(METRIC_PREFIX + ".model.load.latency")
                .description("Time taken to bring the model to ready")
                .tag("model", modelId)
                .tag("outcome", success ? "success" : "failure")
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /** Counts a single load attempt that failed and may be retried. */
    public void incrementModelLoadFailure(String modelId) {
        Counter.builder(METRIC_PREFIX + ".model.load.failure")
                .description("Number of failed model load attempts")
                .tag("model", modelId)
                .register(registry)
                .increment();
    }

    public void incrementCacheHit() {
        Counter.builder(METRIC_PREFIX + ".cache.hit")
                .description("Remote audio served from the content cache")
                .register(registry)
                .increment();
    }

    public void incrementCacheMiss() {
        Counter.builder(METRIC_PREFIX + ".cache.miss")
                .description("Remote audio that had to be downloaded")
                .register(registry)
                .increment();
    }

    /**
     * Records a download of remote audio.
     *
     * @param durationNanos transfer time
     * @param success       whether the file landed in the cache
     */
    public void recordDownload(long durationNanos, boolean success) {
        Timer.builder(METRIC_PREFIX + ".cache.download")
                .description("Time taken to download remote audio")
                .tag("outcome", success ? "success" : "failure")
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }
}
