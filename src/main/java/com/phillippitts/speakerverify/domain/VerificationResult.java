package com.phillippitts.speakerverify.domain;

import java.util.Objects;

/**
 * Outcome of comparing two embeddings. Derived per request, never stored.
 *
 * @param score      cosine similarity in [-1, 1]
 * @param threshold  decision threshold applied
 * @param isSame     whether the two voices are judged to be the same speaker
 * @param confidence confidence band
 */
public record VerificationResult(
        double score,
        double threshold,
        boolean isSame,
        ConfidenceBand confidence
) {
    public VerificationResult {
        Objects.requireNonNull(confidence, "confidence must not be null");
    }
}
