package com.phillippitts.speakerverify.service.extractor;

/**
 * Creates ready-to-use extractors. The only way the coordinator obtains a model.
 */
@FunctionalInterface
public interface ModelLoader {

    /**
     * Loads the model described by {@code spec}. Blocks until the model is ready.
     *
     * @param spec model to load
     * @return ready extractor, owned by the caller
     * @throws RuntimeException if the model cannot be loaded; the coordinator retries
     */
    EmbeddingExtractor load(ModelSpec spec);
}
