package com.phillippitts.speakerverify.service.model;

import com.phillippitts.speakerverify.service.extractor.ModelSpec;

import java.time.Instant;

/**
 * Immutable snapshot of the coordinator's model state.
 *
 * @param phase    lifecycle phase
 * @param spec     model being served or loaded
 * @param handle   ready handle (READY only)
 * @param error    last load error message (LOADING after a failed attempt, FAILED)
 * @param attempts load attempts made in the current or last load cycle
 * @param since    when the phase was entered
 */
public record ModelState(Phase phase, ModelSpec spec, ModelHandle handle, String error, int attempts, Instant since) {

    public enum Phase { UNLOADED, LOADING, READY, FAILED }

    static ModelState unloaded(ModelSpec spec, Instant now) {
        return new ModelState(Phase.UNLOADED, spec, null, null, 0, now);
    }

    static ModelState loading(ModelSpec spec, int attempts, String error, Instant since) {
        return new ModelState(Phase.LOADING, spec, null, error, attempts, since);
    }

    static ModelState ready(ModelHandle handle, int attempts, Instant now) {
        return new ModelState(Phase.READY, handle.spec(), handle, null, attempts, now);
    }

    static ModelState failed(ModelSpec spec, String error, int attempts, Instant now) {
        return new ModelState(Phase.FAILED, spec, null, error, attempts, now);
    }

    public boolean isReady() {
        return phase == Phase.READY;
    }
}
