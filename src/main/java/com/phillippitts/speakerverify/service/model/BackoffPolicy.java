package com.phillippitts.speakerverify.service.model;

import com.phillippitts.speakerverify.config.properties.ModelProperties;
import com.phillippitts.speakerverify.config.properties.ModelProperties.BackoffType;

/**
 * Delay before the next model load attempt.
 *
 * <p>Delays never decrease with the attempt number and are capped at {@code maxDelayMs}.
 * <ul>
 *   <li>FIXED: {@code initial}</li>
 *   <li>LINEAR: {@code initial * attempt}</li>
 *   <li>EXPONENTIAL: {@code initial * multiplier^(attempt-1)}</li>
 * </ul>
 *
 * @param type         growth strategy
 * @param initialDelayMs delay after the first failure
 * @param maxDelayMs   upper bound for any delay
 * @param multiplier   growth factor for EXPONENTIAL (at least 1.0)
 */
public record BackoffPolicy(BackoffType type, long initialDelayMs, long maxDelayMs, double multiplier) {

    public BackoffPolicy {
        if (type == null) {
            throw new IllegalArgumentException("type must not be null");
        }
        if (initialDelayMs < 0 || maxDelayMs < initialDelayMs) {
            throw new IllegalArgumentException("Require 0 <= initialDelayMs <= maxDelayMs");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0");
        }
    }

    public static BackoffPolicy from(ModelProperties.Retry retry) {
        return new BackoffPolicy(retry.getBackoff(), retry.getInitialDelayMs(),
                retry.getMaxDelayMs(), retry.getMultiplier());
    }

    /**
     * @param failedAttempt 1-based number of the attempt that just failed
     * @return milliseconds to wait before the next attempt
     */
    public long delayMs(int failedAttempt) {
        int n = Math.max(1, failedAttempt);
        double delay = switch (type) {
            case FIXED -> initialDelayMs;
            case LINEAR -> (double) initialDelayMs * n;
            case EXPONENTIAL -> initialDelayMs * Math.pow(multiplier, n - 1);
        };
        return (long) Math.min(delay, maxDelayMs);
    }
}
