package com.phillippitts.speakerverify.service.health;

import com.phillippitts.speakerverify.service.model.ModelLifecycleCoordinator;
import com.phillippitts.speakerverify.service.model.ModelState;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the embedding model.
 *
 * <p>UP when the model is ready and its extractor healthy; DOWN when the last load failed or the
 * extractor stopped working; UNKNOWN while unloaded or loading. Exposed via /actuator/health.
 */
@Component
public class ModelHealthIndicator implements HealthIndicator {

    private final ModelLifecycleCoordinator coordinator;

    public ModelHealthIndicator(ModelLifecycleCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @Override
    public Health health() {
        ModelState state = coordinator.state();
        Health.Builder builder;
        switch (state.phase()) {
            case READY -> builder = state.handle().extractor().isHealthy()
                    ? Health.up()
                    : Health.down().withDetail("reason", "extractor unhealthy");
            case FAILED -> builder = Health.down();
            default -> builder = Health.unknown();
        }
        builder.withDetail("phase", state.phase().name())
                .withDetail("modelId", state.spec().modelId())
                .withDetail("device", state.spec().device())
                .withDetail("attempts", state.attempts())
                .withDetail("since", state.since().toString());
        if (state.error() != null) {
            builder.withDetail("lastError", state.error());
        }
        if (state.isReady()) {
            builder.withDetail("dimension", state.handle().extractor().dimension());
        }
        return builder.build();
    }
}
