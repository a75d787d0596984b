package com.phillippitts.speakerverify.service.verification;

import com.phillippitts.speakerverify.domain.ConfidenceBand;
import com.phillippitts.speakerverify.domain.Embedding;
import com.phillippitts.speakerverify.domain.VerificationResult;
import org.springframework.stereotype.Component;

/**
 * Cosine-similarity decision between two embeddings.
 *
 * <p>Inputs are re-normalized before the dot product, so extractors that return slightly
 * denormalized vectors still score in {@code [-1, 1]}. A pair is the same speaker when
 * {@code score > threshold}, or {@code score >= threshold} in inclusive mode. The confidence band
 * is HIGH when the score is further than the margin from the threshold, MEDIUM otherwise.
 */
@Component
public class VerificationEngine {

    /**
     * Cosine similarity, clamped to {@code [-1, 1]}.
     *
     * @throws IllegalArgumentException on dimension mismatch or a zero vector
     */
    public double similarity(Embedding a, Embedding b) {
        if (a.dimension() != b.dimension()) {
            throw new IllegalArgumentException("Embedding dimensions differ: " + a.dimension() + " vs " + b.dimension());
        }
        double score = a.normalized().dot(b.normalized());
        return Math.max(-1.0, Math.min(1.0, score));
    }

    /**
     * @param a        first embedding
     * @param b        second embedding
     * @param settings threshold and decision options in force for this request
     * @return scored decision
     */
    public VerificationResult compare(Embedding a, Embedding b, DecisionSettings settings) {
        double score = similarity(a, b);
        double threshold = settings.threshold();
        boolean same = settings.inclusive() ? score >= threshold : score > threshold;
        ConfidenceBand band = Math.abs(score - threshold) > settings.highConfidenceMargin()
                ? ConfidenceBand.HIGH
                : ConfidenceBand.MEDIUM;
        return new VerificationResult(score, threshold, same, band);
    }

    /**
     * Decision options for one comparison.
     *
     * @param threshold            similarity threshold in {@code [-1, 1]}
     * @param inclusive            whether a score equal to the threshold counts as a match
     * @param highConfidenceMargin distance from the threshold beyond which confidence is HIGH
     */
    public record DecisionSettings(double threshold, boolean inclusive, double highConfidenceMargin) {
    }
}
