package com.phillippitts.speakerverify.service.verification;

import com.phillippitts.speakerverify.config.properties.VerificationProperties;
import com.phillippitts.speakerverify.exception.InvalidRequestException;
import com.phillippitts.speakerverify.service.verification.VerificationEngine.DecisionSettings;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Runtime-adjustable decision settings. Starts from {@code verification.*} and is changed through
 * {@code POST /config}; readers always see a consistent snapshot.
 */
@Component
public class VerificationSettings {

    private static final Logger LOG = LogManager.getLogger(VerificationSettings.class);

    private final AtomicReference<DecisionSettings> current;

    public VerificationSettings(VerificationProperties props) {
        this.current = new AtomicReference<>(new DecisionSettings(
                props.getThreshold(), props.isInclusiveThreshold(), props.getHighConfidenceMargin()));
    }

    public DecisionSettings current() {
        return current.get();
    }

    /**
     * Settings for one request: the default threshold unless the request supplies its own.
     *
     * @param override per-request threshold, or null
     */
    public DecisionSettings forRequest(Double override) {
        DecisionSettings base = current.get();
        if (override == null) {
            return base;
        }
        return new DecisionSettings(checkThreshold(override), base.inclusive(), base.highConfidenceMargin());
    }

    /** Replaces the default threshold. */
    public void updateThreshold(double threshold) {
        double checked = checkThreshold(threshold);
        DecisionSettings previous = current.getAndUpdate(
                s -> new DecisionSettings(checked, s.inclusive(), s.highConfidenceMargin()));
        LOG.info("Default threshold changed: {} -> {}", previous.threshold(), checked);
    }

    /**
     * @throws InvalidRequestException if the value is not a finite number in {@code [-1, 1]}
     */
    public static double checkThreshold(double threshold) {
        if (!Double.isFinite(threshold) || threshold < -1.0 || threshold > 1.0) {
            throw new InvalidRequestException("threshold must be a number between -1 and 1, got " + threshold);
        }
        return threshold;
    }
}
