package com.phillippitts.speakerverify.service.model;

import com.phillippitts.speakerverify.config.properties.ModelProperties;
import com.phillippitts.speakerverify.exception.ModelUnavailableException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Loads the model in the background so the first request does not pay for it.
 *
 * <p>Runs once after start-up when {@code model.eager-load=true}, and on demand when a health
 * check finds the model unloaded or failed. A failed load is logged and leaves the application
 * running; requests keep triggering new attempts.
 */
@Component
public class ModelWarmup {

    private static final Logger LOG = LogManager.getLogger(ModelWarmup.class);

    private final ModelLifecycleCoordinator coordinator;
    private final ModelProperties props;

    public ModelWarmup(ModelLifecycleCoordinator coordinator, ModelProperties props) {
        this.coordinator = coordinator;
        this.props = props;
    }

    @EventListener(ApplicationReadyEvent.class)
    @Async("modelLoadExecutor")
    public void onApplicationReady() {
        if (!props.isEagerLoad()) {
            LOG.info("Eager model load disabled; model {} loads on first request", props.getModelId());
            return;
        }
        load("startup");
    }

    /** Schedules a background load attempt. Returns immediately. */
    @Async("modelLoadExecutor")
    public void triggerLoad() {
        load("health-check");
    }

    private void load(String reason) {
        try {
            coordinator.ensureReady();
        } catch (ModelUnavailableException e) {
            LOG.error("Background model load ({}) failed: {}", reason, e.getMessage());
        }
    }
}
