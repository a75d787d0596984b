package com.phillippitts.speakerverify.service.metrics;

import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class VerificationMetricsTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final VerificationMetrics metrics = new VerificationMetrics(registry);

    @Test
    void recordsRequestLatencyPerEndpointAndOutcome() {
        metrics.recordRequest("verify", TimeUnit.MILLISECONDS.toNanos(120), "success");
        metrics.recordRequest("verify", TimeUnit.MILLISECONDS.toNanos(80), "success");
        metrics.recordRequest("verify", TimeUnit.MILLISECONDS.toNanos(5), "VALIDATION_FAILED");

        Timer ok = registry.find("speakerverify.request.latency")
                .tags("endpoint", "verify", "outcome", "success").timer();
        Timer failed = registry.find("speakerverify.request.latency")
                .tags("endpoint", "verify", "outcome", "VALIDATION_FAILED").timer();

        assertThat(ok).isNotNull();
        assertThat(ok.count()).isEqualTo(2);
        assertThat(ok.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(200.0);
        assertThat(failed).isNotNull();
        assertThat(failed.count()).isEqualTo(1);
    }

    @Test
    void recordsModelLoadOutcomeAndFailures() {
        metrics.incrementModelLoadFailure("m");
        metrics.incrementModelLoadFailure("m");
        metrics.recordModelLoad("m", 1_000_000, true);

        assertThat(registry.counter("speakerverify.model.load.failure", "model", "m").count()).isEqualTo(2.0);
        assertThat(registry.find("speakerverify.model.load.latency").tags("outcome", "success").timer())
                .isNotNull();
    }

    @Test
    void recordsCacheActivity() {
        metrics.incrementCacheHit();
        metrics.incrementCacheMiss();
        metrics.incrementCacheMiss();
        metrics.recordDownload(1_000, false);

        assertThat(registry.counter("speakerverify.cache.hit").count()).isEqualTo(1.0);
        assertThat(registry.counter("speakerverify.cache.miss").count()).isEqualTo(2.0);
        assertThat(registry.find("speakerverify.cache.download").tags("outcome", "failure").timer().count())
                .isEqualTo(1);
    }
}
