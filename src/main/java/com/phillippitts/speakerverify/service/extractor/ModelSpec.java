package com.phillippitts.speakerverify.service.extractor;

import java.util.Objects;

/**
 * Identifies which model to load and where to run it.
 *
 * @param modelId model identifier, e.g. {@code iic/speech_campplus_sv_zh-cn_16k-common}
 * @param device  inference device, e.g. {@code cpu} or {@code cuda:0}
 */
public record ModelSpec(String modelId, String device) {

    public ModelSpec {
        Objects.requireNonNull(modelId, "modelId");
        Objects.requireNonNull(device, "device");
        if (modelId.isBlank()) {
            throw new IllegalArgumentException("modelId must not be blank");
        }
        if (device.isBlank()) {
            throw new IllegalArgumentException("device must not be blank");
        }
    }
}
