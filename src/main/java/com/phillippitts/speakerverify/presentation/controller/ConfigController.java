package com.phillippitts.speakerverify.presentation.controller;

import com.phillippitts.speakerverify.config.properties.AudioSourceProperties;
import com.phillippitts.speakerverify.config.properties.AudioValidationProperties;
import com.phillippitts.speakerverify.config.properties.ModelProperties;
import com.phillippitts.speakerverify.exception.InvalidRequestException;
import com.phillippitts.speakerverify.presentation.dto.ConfigResponse;
import com.phillippitts.speakerverify.presentation.dto.ConfigUpdateRequest;
import com.phillippitts.speakerverify.presentation.dto.ConfigUpdateResponse;
import com.phillippitts.speakerverify.presentation.dto.ModelsResponse;
import com.phillippitts.speakerverify.service.extractor.ModelSpec;
import com.phillippitts.speakerverify.service.model.ModelLifecycleCoordinator;
import com.phillippitts.speakerverify.service.verification.VerificationEngine.DecisionSettings;
import com.phillippitts.speakerverify.service.verification.VerificationSettings;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Runtime configuration and the model catalog.
 *
 * <p>{@code POST /config} with a different model id or device triggers a reload that completes
 * before the response; requests already running finish on the previous model. A new default
 * threshold takes effect once the reload, if any, has succeeded.
 */
@RestController
class ConfigController {

    private static final Logger LOG = LogManager.getLogger(ConfigController.class);

    private final VerificationSettings settings;
    private final ModelLifecycleCoordinator coordinator;
    private final ModelProperties modelProps;
    private final AudioSourceProperties sourceProps;
    private final AudioValidationProperties validationProps;

    ConfigController(VerificationSettings settings,
                     ModelLifecycleCoordinator coordinator,
                     ModelProperties modelProps,
                     AudioSourceProperties sourceProps,
                     AudioValidationProperties validationProps) {
        this.settings = settings;
        this.coordinator = coordinator;
        this.modelProps = modelProps;
        this.sourceProps = sourceProps;
        this.validationProps = validationProps;
    }

    @GetMapping("/config")
    ResponseEntity<ConfigResponse> getConfig() {
        return ResponseEntity.ok(currentConfig());
    }

    @PostMapping(value = "/config", consumes = MediaType.APPLICATION_JSON_VALUE)
    ResponseEntity<ConfigUpdateResponse> updateConfig(@RequestBody ConfigUpdateRequest request) {
        if (request.threshold() != null) {
            VerificationSettings.checkThreshold(request.threshold());
        }
        ModelSpec current = coordinator.targetSpec();
        ModelSpec requested = new ModelSpec(
                valueOrCurrent(request.modelId(), current.modelId(), "model_id"),
                valueOrCurrent(request.device(), current.device(), "device"));

        boolean reload = !requested.equals(current);
        if (reload) {
            LOG.info("Configuration change requests model {} on {}", requested.modelId(), requested.device());
            coordinator.reload(requested);
        }
        // only after a successful reload, so a failed update leaves the threshold untouched
        if (request.threshold() != null) {
            settings.updateThreshold(request.threshold());
        }
        return ResponseEntity.ok(new ConfigUpdateResponse(true, reload, currentConfig()));
    }

    @GetMapping("/models")
    ResponseEntity<ModelsResponse> models() {
        List<ModelsResponse.ModelInfo> models = modelProps.getAvailable().stream()
                .map(d -> new ModelsResponse.ModelInfo(d.getId(), d.getName(), d.getLanguage(), d.getDescription()))
                .toList();
        return ResponseEntity.ok(new ModelsResponse(coordinator.targetSpec().modelId(), models));
    }

    private ConfigResponse currentConfig() {
        ModelSpec spec = coordinator.targetSpec();
        DecisionSettings decision = settings.current();
        return new ConfigResponse(
                spec.modelId(),
                spec.device(),
                decision.threshold(),
                decision.inclusive(),
                validationProps.getMaxFileSizeBytes(),
                List.copyOf(sourceProps.getAllowedExtensions()));
    }

    private static String valueOrCurrent(String value, String current, String field) {
        if (value == null) {
            return current;
        }
        if (value.isBlank()) {
            throw new InvalidRequestException(field + " must not be blank");
        }
        return value.trim();
    }
}
