package com.phillippitts.speakerverify.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Start-up defaults for the verification decision. The threshold can be changed at runtime
 * via {@code POST /config}; see {@link com.phillippitts.speakerverify.service.verification.VerificationSettings}.
 *
 * <p>Example application.properties:
 * <pre>
 * verification.threshold=0.5
 * verification.inclusive-threshold=false
 * verification.high-confidence-margin=0.2
 * </pre>
 */
@ConfigurationProperties(prefix = "verification")
@Validated
public class VerificationProperties {

    /** Cosine similarity above which two voices are the same speaker. */
    @DecimalMin(value = "-1.0", message = "Threshold must be >= -1.0")
    @DecimalMax(value = "1.0", message = "Threshold must be <= 1.0")
    private double threshold = 0.5;

    /** When true a score equal to the threshold also counts as a match (score >= threshold). */
    private boolean inclusiveThreshold = false;

    /** Distance from the threshold beyond which a decision is labelled high confidence. */
    @PositiveOrZero(message = "High confidence margin must not be negative")
    private double highConfidenceMargin = 0.2;

    public double getThreshold() {
        return threshold;
    }

    public void setThreshold(double threshold) {
        this.threshold = threshold;
    }

    public boolean isInclusiveThreshold() {
        return inclusiveThreshold;
    }

    public void setInclusiveThreshold(boolean inclusiveThreshold) {
        this.inclusiveThreshold = inclusiveThreshold;
    }

    public double getHighConfidenceMargin() {
        return highConfidenceMargin;
    }

    public void setHighConfidenceMargin(double highConfidenceMargin) {
        this.highConfidenceMargin = highConfidenceMargin;
    }
}
