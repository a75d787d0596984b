package com.phillippitts.speakerverify.presentation.controller;

import com.phillippitts.speakerverify.presentation.dto.HealthResponse;
import com.phillippitts.speakerverify.service.model.ModelLifecycleCoordinator;
import com.phillippitts.speakerverify.service.model.ModelState;
import com.phillippitts.speakerverify.service.model.ModelWarmup;
import com.phillippitts.speakerverify.service.stats.RequestStatsCollector;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Service health with model state, uptime and request statistics.
 *
 * <p>Always answers 200; {@code status} says whether the model can serve. When the model is
 * unloaded, failed, or its extractor stopped working, a background load is scheduled.
 */
@RestController
class HealthController {

    static final int RECENT_LIMIT = 20;

    private final ModelLifecycleCoordinator coordinator;
    private final ModelWarmup warmup;
    private final RequestStatsCollector stats;

    HealthController(ModelLifecycleCoordinator coordinator, ModelWarmup warmup, RequestStatsCollector stats) {
        this.coordinator = coordinator;
        this.warmup = warmup;
        this.stats = stats;
    }

    @GetMapping("/health")
    ResponseEntity<HealthResponse> health() {
        ModelState state = coordinator.state();
        boolean loaded = state.isReady() && state.handle().extractor().isHealthy();
        if (!loaded && state.phase() != ModelState.Phase.LOADING) {
            warmup.triggerLoad();
        }
        String status = switch (state.phase()) {
            case READY -> loaded ? "healthy" : "degraded";
            case LOADING, UNLOADED -> "loading";
            case FAILED -> "degraded";
        };
        List<HealthResponse.RecentRequest> recent = stats.recent(RECENT_LIMIT).stream()
                .map(HealthResponse.RecentRequest::from)
                .toList();
        RequestStatsCollector.Snapshot snapshot = stats.snapshot();
        return ResponseEntity.ok(new HealthResponse(
                status,
                state.spec().modelId(),
                state.spec().device(),
                loaded,
                state.phase().name(),
                state.attempts(),
                state.error(),
                snapshot.uptimeSeconds(),
                HealthResponse.Stats.from(snapshot),
                recent));
    }
}
