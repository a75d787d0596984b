package com.phillippitts.speakerverify.service.verification;

import com.phillippitts.speakerverify.config.logging.MdcFilter;
import com.phillippitts.speakerverify.domain.AudioSource;
import com.phillippitts.speakerverify.domain.BatchItemResult;
import com.phillippitts.speakerverify.domain.Embedding;
import com.phillippitts.speakerverify.domain.ResolvedAudio;
import com.phillippitts.speakerverify.domain.VerificationResult;
import com.phillippitts.speakerverify.exception.ExtractionException;
import com.phillippitts.speakerverify.exception.ExtractionTimeoutException;
import com.phillippitts.speakerverify.exception.InvalidRequestException;
import com.phillippitts.speakerverify.exception.InvalidSourceException;
import com.phillippitts.speakerverify.exception.SpeakerVerifyException;
import com.phillippitts.speakerverify.service.audio.TemporaryResourceJanitor;
import com.phillippitts.speakerverify.service.metrics.VerificationMetrics;
import com.phillippitts.speakerverify.service.model.ModelLease;
import com.phillippitts.speakerverify.service.model.ModelLifecycleCoordinator;
import com.phillippitts.speakerverify.service.stats.RequestStatsCollector;
import com.phillippitts.speakerverify.service.validation.AudioValidator;
import com.phillippitts.speakerverify.service.verification.VerificationEngine.DecisionSettings;
import com.phillippitts.speakerverify.util.LogSanitizer;
import com.phillippitts.speakerverify.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Request pipeline: resolve, validate, embed, compare.
 *
 * <p>Every operation runs inside a {@link TemporaryResourceJanitor.Scope}, so resolver-owned files
 * are deleted and cache leases returned on every exit path. The model is held through a
 * {@link ModelLease} for the duration of the extraction calls. Each operation is recorded in
 * {@link RequestStatsCollector} and Micrometer, whatever its outcome.
 */
@Service
public class SpeakerVerificationService {

    private static final Logger LOG = LogManager.getLogger(SpeakerVerificationService.class);

    private final TemporaryResourceJanitor janitor;
    private final AudioValidator validator;
    private final ModelLifecycleCoordinator coordinator;
    private final VerificationEngine engine;
    private final VerificationSettings settings;
    private final RequestStatsCollector stats;
    private final VerificationMetrics metrics;
    private final Executor verifyExecutor;

    public SpeakerVerificationService(TemporaryResourceJanitor janitor,
                                      AudioValidator validator,
                                      ModelLifecycleCoordinator coordinator,
                                      VerificationEngine engine,
                                      VerificationSettings settings,
                                      RequestStatsCollector stats,
                                      VerificationMetrics metrics,
                                      @Qualifier("verifyExecutor") Executor verifyExecutor) {
        this.janitor = janitor;
        this.validator = validator;
        this.coordinator = coordinator;
        this.engine = engine;
        this.settings = settings;
        this.stats = stats;
        this.metrics = metrics;
        this.verifyExecutor = verifyExecutor;
    }

    /**
     * Verifies whether two recordings come from the same speaker.
     *
     * @param audio1    first recording
     * @param audio2    second recording
     * @param threshold per-request threshold, or null for the configured default
     */
    public VerificationResult verify(AudioSource audio1, AudioSource audio2, Double threshold) {
        return observe("verify", () -> {
            DecisionSettings decision = settings.forRequest(threshold);
            try (TemporaryResourceJanitor.Scope scope = janitor.openScope()) {
                Path p1 = resolveAndValidate(scope, audio1);
                Path p2 = resolveAndValidate(scope, audio2);
                try (ModelLease lease = coordinator.acquire()) {
                    Embedding e1 = lease.extractor().extract(p1);
                    Embedding e2 = lease.extractor().extract(p2);
                    VerificationResult result = engine.compare(e1, e2, decision);
                    LOG.info("Verified {} vs {}: score={} same={}", audio1.describe(), audio2.describe(),
                            String.format("%.4f", result.score()), result.isSame());
                    return result;
                }
            }
        });
    }

    /**
     * Verifies each candidate against one reference recording.
     *
     * <p>The reference is embedded once. Candidates run in parallel on {@code verifyExecutor}; a
     * candidate that fails is reported in its slot without affecting the others. Results keep the
     * input order. If the worker goes down while the batch runs, the remaining candidates move to
     * the reloaded model.
     *
     * @param reference  reference recording
     * @param candidates candidate URLs or server paths
     * @param threshold  per-request threshold, or null
     * @throws InvalidRequestException if there are no candidates
     */
    public List<BatchItemResult> verifyBatch(AudioSource reference, List<String> candidates, Double threshold) {
        return observe("verify_batch", () -> {
            if (candidates == null || candidates.isEmpty()) {
                throw new InvalidRequestException("candidates must be a non-empty list");
            }
            DecisionSettings decision = settings.forRequest(threshold);
            try (TemporaryResourceJanitor.Scope scope = janitor.openScope()) {
                Path refPath = resolveAndValidate(scope, reference);
                try (ModelLease lease = coordinator.acquire()) {
                    Embedding ref = lease.extractor().extract(refPath);

                    List<CompletableFuture<BatchItemResult>> futures = new ArrayList<>(candidates.size());
                    for (String candidate : candidates) {
                        futures.add(CompletableFuture.supplyAsync(
                                () -> verifyCandidate(candidate, ref, decision, lease), verifyExecutor));
                    }
                    List<BatchItemResult> results = new ArrayList<>(futures.size());
                    for (CompletableFuture<BatchItemResult> f : futures) {
                        results.add(f.join());
                    }
                    long ok = results.stream().filter(BatchItemResult::succeeded).count();
                    LOG.info("Batch verification: {} candidates, {} succeeded", results.size(), ok);
                    return results;
                }
            }
        });
    }

    private BatchItemResult verifyCandidate(String candidate, Embedding ref, DecisionSettings decision, ModelLease lease) {
        try (TemporaryResourceJanitor.Scope scope = janitor.openScope()) {
            AudioSource source = candidateSource(candidate);
            Path path = resolveAndValidate(scope, source);
            Embedding embedding = extractCandidate(lease, path);
            return BatchItemResult.success(candidate, engine.compare(ref, embedding, decision));
        } catch (SpeakerVerifyException e) {
            LOG.info("Batch candidate {} failed: {}", LogSanitizer.redactUrl(candidate), e.getMessage());
            return BatchItemResult.failure(candidate, e.getErrorCode(), e.getClientMessage());
        } catch (RuntimeException e) {
            LOG.error("Unexpected failure for batch candidate {}", LogSanitizer.redactUrl(candidate), e);
            return BatchItemResult.failure(candidate, "INTERNAL_ERROR", "Internal error");
        }
    }

    /**
     * Extracts through the batch lease while its worker is healthy. A candidate that finds the worker
     * dead, or loses it to another candidate mid-call, gets one attempt on a fresh lease, which
     * reloads the model. A candidate whose own call timed out is not retried.
     */
    private Embedding extractCandidate(ModelLease batchLease, Path path) {
        if (batchLease.extractor().isHealthy()) {
            try {
                return batchLease.extractor().extract(path);
            } catch (ExtractionTimeoutException e) {
                throw e;
            } catch (ExtractionException e) {
                if (batchLease.extractor().isHealthy()) {
                    throw e;
                }
                LOG.warn("Extractor {} went down during batch: {}", batchLease.extractor().name(), e.getMessage());
            }
        }
        try (ModelLease fresh = coordinator.acquire()) {
            return fresh.extractor().extract(path);
        }
    }

    private static AudioSource candidateSource(String candidate) {
        try {
            return AudioSource.fromString(candidate);
        } catch (IllegalArgumentException e) {
            throw new InvalidSourceException(String.valueOf(candidate), e.getMessage());
        }
    }

    /**
     * Extracts the embedding of one recording.
     */
    public Embedding extract(AudioSource audio) {
        return observe("extract_embedding", () -> {
            try (TemporaryResourceJanitor.Scope scope = janitor.openScope()) {
                Path path = resolveAndValidate(scope, audio);
                try (ModelLease lease = coordinator.acquire()) {
                    return lease.extractor().extract(path);
                }
            }
        });
    }

    /**
     * Compares two embeddings supplied by the client. No model or audio involved.
     *
     * @throws InvalidRequestException on empty, non-finite, zero or mismatched vectors
     */
    public VerificationResult compareEmbeddings(List<? extends Number> embedding1,
                                                List<? extends Number> embedding2,
                                                Double threshold) {
        return observe("compare_embeddings", () -> {
            DecisionSettings decision = settings.forRequest(threshold);
            try {
                Embedding e1 = Embedding.of(embedding1);
                Embedding e2 = Embedding.of(embedding2);
                return engine.compare(e1, e2, decision);
            } catch (IllegalArgumentException e) {
                throw new InvalidRequestException("Invalid embedding: " + e.getMessage(), e);
            }
        });
    }

    private Path resolveAndValidate(TemporaryResourceJanitor.Scope scope, AudioSource source) {
        ResolvedAudio resolved = scope.resolve(source);
        validator.validate(resolved.path());
        return resolved.path();
    }

    private <T> T observe(String endpoint, Supplier<T> body) {
        long start = System.nanoTime();
        String client = ThreadContext.get(MdcFilter.CLIENT_ID);
        try {
            T result = body.get();
            long nanos = System.nanoTime() - start;
            stats.record(endpoint, TimeUtils.elapsedSince(start), true, null, client);
            metrics.recordRequest(endpoint, nanos, "success");
            return result;
        } catch (RuntimeException e) {
            String code = e instanceof SpeakerVerifyException sve ? sve.getErrorCode() : "INTERNAL_ERROR";
            long nanos = System.nanoTime() - start;
            stats.record(endpoint, TimeUtils.elapsedSince(start), false, code, client);
            metrics.recordRequest(endpoint, nanos, code);
            throw e;
        }
    }
}
