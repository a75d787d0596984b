package com.phillippitts.speakerverify.service.model;

import com.phillippitts.speakerverify.service.extractor.EmbeddingExtractor;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Scoped permission to use a model's extractor. Use with try-with-resources; the handle it came
 * from is not closed while any lease is open.
 */
public final class ModelLease implements AutoCloseable {

    private final ModelHandle handle;
    private final AtomicBoolean released = new AtomicBoolean();

    ModelLease(ModelHandle handle) {
        this.handle = handle;
    }

    public EmbeddingExtractor extractor() {
        return handle.extractor();
    }

    public ModelHandle handle() {
        return handle;
    }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            handle.release();
        }
    }
}
