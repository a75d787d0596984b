/**
 * Embedding extraction seam: the {@link com.phillippitts.speakerverify.service.extractor.EmbeddingExtractor}
 * contract, model loading, and concurrency limiting.
 *
 * <p>The production implementation runs the model in a long-lived worker process; see
 * {@link com.phillippitts.speakerverify.service.extractor.process}.
 */
package com.phillippitts.speakerverify.service.extractor;
