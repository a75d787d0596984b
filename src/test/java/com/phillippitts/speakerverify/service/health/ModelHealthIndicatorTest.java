package com.phillippitts.speakerverify.service.health;

import com.phillippitts.speakerverify.config.properties.ModelProperties;
import com.phillippitts.speakerverify.service.metrics.VerificationMetrics;
import com.phillippitts.speakerverify.service.model.ModelLifecycleCoordinator;
import com.phillippitts.speakerverify.testutil.FakeModelLoader;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModelHealthIndicatorTest {

    private final FakeModelLoader loader = new FakeModelLoader();
    private final ModelLifecycleCoordinator coordinator = new ModelLifecycleCoordinator(
            loader, props(), new VerificationMetrics(new SimpleMeterRegistry()));
    private final ModelHealthIndicator indicator = new ModelHealthIndicator(coordinator);

    private static ModelProperties props() {
        ModelProperties props = new ModelProperties();
        props.setModelId("model-x");
        props.getRetry().setMaxAttempts(1);
        return props;
    }

    @Test
    void unknownBeforeFirstLoad() {
        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UNKNOWN);
        assertThat(health.getDetails()).containsEntry("phase", "UNLOADED")
                .containsEntry("modelId", "model-x");
    }

    @Test
    void upWhenModelReady() {
        coordinator.ensureReady();

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("phase", "READY")
                .containsEntry("dimension", 16);
    }

    @Test
    void downWhenExtractorUnhealthy() {
        coordinator.ensureReady();
        loader.loaded().get(0).healthy = false;

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("reason", "extractor unhealthy");
    }

    @Test
    void downWithLastErrorAfterFailedLoad() {
        loader.failAlways();
        assertThatThrownBy(coordinator::ensureReady).isInstanceOf(RuntimeException.class);

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("phase", "FAILED").containsKey("lastError");
    }
}
