package com.phillippitts.speakerverify.service.extractor;

import com.phillippitts.speakerverify.domain.Embedding;

import java.nio.file.Path;

/**
 * Turns a local audio file into a speaker embedding.
 *
 * <p>Implementations wrap an expensive, already-loaded model. Instances are created by a
 * {@link ModelLoader} and owned by the model lifecycle coordinator, which decides when they are
 * closed. Resampling and channel mixing are the implementation's concern.
 *
 * <p>Implementations must be thread-safe: {@link #extract(Path)} is called from many request
 * threads at once.
 */
public interface EmbeddingExtractor extends AutoCloseable {

    /**
     * Extracts the embedding of the given audio file.
     *
     * @param audioFile absolute path to a validated local audio file
     * @return embedding with {@link #dimension()} components
     * @throws com.phillippitts.speakerverify.exception.ExtractionException if extraction fails
     * @throws com.phillippitts.speakerverify.exception.ExtractionTimeoutException if the answer does
     *         not arrive in time
     */
    Embedding extract(Path audioFile);

    /**
     * Embedding length produced by the loaded model. Fixed for the lifetime of this instance.
     */
    int dimension();

    /**
     * Name used in logs, metrics and error messages.
     */
    String name();

    /**
     * Whether this instance can still serve requests. An unhealthy extractor is replaced by the
     * coordinator on the next acquisition.
     */
    boolean isHealthy();

    /**
     * Releases native resources. Idempotent, never throws.
     */
    @Override
    void close();
}
