/**
 * Process-backed embedding extractor.
 *
 * <p>The model runs inside a long-lived worker (typically a Python script) that speaks
 * line-delimited JSON on stdin/stdout. See {@link com.phillippitts.speakerverify.service.extractor.process.EmbeddingJsonParser}
 * for the message shapes.
 */
package com.phillippitts.speakerverify.service.extractor.process;
