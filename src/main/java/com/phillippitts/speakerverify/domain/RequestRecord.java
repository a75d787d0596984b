package com.phillippitts.speakerverify.domain;

import java.time.Duration;
import java.time.Instant;

/**
 * One handled request, kept in a bounded history for observability.
 *
 * @param timestamp      when the request finished
 * @param endpoint       logical endpoint name (e.g. "verify")
 * @param duration       wall-clock handling time
 * @param success        whether the request succeeded
 * @param error          error code on failure, null on success
 * @param clientIdentity caller identity from the request context, or "anonymous"
 */
public record RequestRecord(
        Instant timestamp,
        String endpoint,
        Duration duration,
        boolean success,
        String error,
        String clientIdentity
) {
}
