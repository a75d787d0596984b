package com.phillippitts.speakerverify.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration for the shared embedding model and its load/retry policy.
 *
 * <p>Example application.properties:
 * <pre>
 * model.model-id=iic/speech_campplus_sv_zh-cn_16k-common
 * model.device=cpu
 * model.eager-load=true
 * model.load-timeout-ms=120000
 * model.retry.max-attempts=3
 * model.retry.backoff=exponential
 * model.retry.initial-delay-ms=1000
 * model.retry.max-delay-ms=30000
 * model.retry.multiplier=2.0
 * </pre>
 */
@ConfigurationProperties(prefix = "model")
@Validated
public class ModelProperties {

    @NotBlank(message = "Model id must not be blank")
    private String modelId = "iic/speech_campplus_sv_zh-cn_16k-common";

    /** Inference device passed to the extractor (cpu, cuda, mps). */
    @NotBlank(message = "Device must not be blank")
    private String device = "cpu";

    /** Load the model in the background as soon as the application is ready. */
    private boolean eagerLoad = true;

    /** How long a request waits for another worker's model load before giving up. */
    @Positive(message = "Load timeout must be positive")
    private long loadTimeoutMs = 120_000;

    @Valid
    private Retry retry = new Retry();

    /** Models advertised by {@code GET /models}. */
    private List<Descriptor> available = new ArrayList<>();

    public String getModelId() {
        return modelId;
    }

    public void setModelId(String modelId) {
        this.modelId = modelId;
    }

    public String getDevice() {
        return device;
    }

    public void setDevice(String device) {
        this.device = device;
    }

    public boolean isEagerLoad() {
        return eagerLoad;
    }

    public void setEagerLoad(boolean eagerLoad) {
        this.eagerLoad = eagerLoad;
    }

    public long getLoadTimeoutMs() {
        return loadTimeoutMs;
    }

    public void setLoadTimeoutMs(long loadTimeoutMs) {
        this.loadTimeoutMs = loadTimeoutMs;
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    public List<Descriptor> getAvailable() {
        return available;
    }

    public void setAvailable(List<Descriptor> available) {
        this.available = available;
    }

    /** Backoff curve between load attempts. */
    public enum BackoffType { FIXED, LINEAR, EXPONENTIAL }

    /**
     * Load retry policy.
     */
    public static class Retry {
        @Positive(message = "Max attempts must be positive")
        private int maxAttempts = 3;

        private BackoffType backoff = BackoffType.EXPONENTIAL;

        @Positive(message = "Initial delay must be positive")
        private long initialDelayMs = 1_000;

        @Positive(message = "Max delay must be positive")
        private long maxDelayMs = 30_000;

        @Positive(message = "Multiplier must be positive")
        private double multiplier = 2.0;

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public BackoffType getBackoff() {
            return backoff;
        }

        public void setBackoff(BackoffType backoff) {
            this.backoff = backoff;
        }

        public long getInitialDelayMs() {
            return initialDelayMs;
        }

        public void setInitialDelayMs(long initialDelayMs) {
            this.initialDelayMs = initialDelayMs;
        }

        public long getMaxDelayMs() {
            return maxDelayMs;
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
        }

        public double getMultiplier() {
            return multiplier;
        }

        public void setMultiplier(double multiplier) {
            this.multiplier = multiplier;
        }
    }

    /**
     * Catalog entry for a selectable model.
     */
    public static class Descriptor {
        private String id;
        private String name;
        private String language;
        private String description;

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getLanguage() {
            return language;
        }

        public void setLanguage(String language) {
            this.language = language;
        }

        public String getDescription() {
            return description;
        }

        public void setDescription(String description) {
            this.description = description;
        }
    }
}
