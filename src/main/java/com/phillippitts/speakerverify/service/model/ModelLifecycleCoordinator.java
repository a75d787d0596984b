package com.phillippitts.speakerverify.service.model;

import com.phillippitts.speakerverify.config.properties.ModelProperties;
import com.phillippitts.speakerverify.exception.ModelUnavailableException;
import com.phillippitts.speakerverify.service.extractor.EmbeddingExtractor;
import com.phillippitts.speakerverify.service.extractor.ModelLoader;
import com.phillippitts.speakerverify.service.extractor.ModelSpec;
import com.phillippitts.speakerverify.service.metrics.VerificationMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the single shared embedding model.
 *
 * <p>State machine: {@code UNLOADED -> LOADING -> READY}, {@code LOADING -> FAILED -> LOADING}.
 * The state is only reachable through {@link #ensureReady()}, {@link #acquire()} and
 * {@link #reload(ModelSpec)}.
 *
 * <p><b>Single loader:</b> at most one load runs process-wide. The caller that finds no load in
 * flight becomes the loader and runs the attempts on its own thread; every other caller waits on
 * the same future, bounded by {@code model.load-timeout-ms}. All waiters of a failed cycle observe
 * the same {@link ModelUnavailableException}.
 *
 * <p><b>Retry:</b> a failed attempt is followed by a {@link BackoffPolicy} delay until
 * {@code model.retry.max-attempts} is reached; then the state becomes FAILED. A later
 * {@link #ensureReady()} starts a new cycle.
 *
 * <p><b>Replacement:</b> a handle whose extractor reports unhealthy, or the handle replaced by a
 * reload, is retired. Requests holding a {@link ModelLease} finish on it; its extractor is closed
 * after the last lease is returned.
 *
 * <p>The READY fast path is a single volatile read.
 */
@Service
public class ModelLifecycleCoordinator implements DisposableBean {

    private static final Logger LOG = LogManager.getLogger(ModelLifecycleCoordinator.class);

    private final ModelLoader loader;
    private final BackoffPolicy backoff;
    private final Sleeper sleeper;
    private final Clock clock;
    private final VerificationMetrics metrics;
    private final int maxAttempts;
    private final long loadTimeoutMs;

    private final ReentrantLock lock = new ReentrantLock();
    private volatile ModelState state;

    // guarded by lock
    private CompletableFuture<ModelHandle> inFlight;
    private ModelSpec targetSpec;

    @Autowired
    public ModelLifecycleCoordinator(ModelLoader loader, ModelProperties props, VerificationMetrics metrics) {
        this(loader, props, BackoffPolicy.from(props.getRetry()), Sleeper.SYSTEM, Clock.systemUTC(), metrics);
    }

    ModelLifecycleCoordinator(ModelLoader loader,
                              ModelProperties props,
                              BackoffPolicy backoff,
                              Sleeper sleeper,
                              Clock clock,
                              VerificationMetrics metrics) {
        this.loader = Objects.requireNonNull(loader, "loader");
        this.backoff = Objects.requireNonNull(backoff, "backoff");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.maxAttempts = Math.max(1, props.getRetry().getMaxAttempts());
        this.loadTimeoutMs = props.getLoadTimeoutMs();
        this.targetSpec = new ModelSpec(props.getModelId(), props.getDevice());
        this.state = ModelState.unloaded(targetSpec, clock.instant());
    }

    /**
     * Returns the ready model handle, loading it first if needed.
     *
     * @return ready handle (may be retired by a concurrent reload; use {@link #acquire()} to use it)
     * @throws ModelUnavailableException if loading exhausted its attempts or the wait timed out
     */
    public ModelHandle ensureReady() {
        ModelState s = state;
        if (s.isReady() && s.handle().extractor().isHealthy()) {
            return s.handle();
        }

        CompletableFuture<ModelHandle> future;
        ModelSpec spec;
        boolean leader = false;
        ModelHandle stale = null;
        lock.lock();
        try {
            s = state;
            if (s.isReady()) {
                ModelHandle current = s.handle();
                if (current.extractor().isHealthy()) {
                    return current;
                }
                LOG.warn("Extractor {} is unhealthy; reloading model {}", current.extractor().name(), s.spec().modelId());
                stale = current;
            }
            if (inFlight == null) {
                inFlight = new CompletableFuture<>();
                leader = true;
                state = ModelState.loading(targetSpec, 0, null, clock.instant());
            }
            future = inFlight;
            spec = targetSpec;
        } finally {
            lock.unlock();
        }

        // closing an extractor can wait on its process; never under the lock
        retire(stale);
        if (leader) {
            runLoadCycle(future, spec);
        }
        return await(future, spec);
    }

    /**
     * Returns a lease on the ready model, loading it first if needed. Close the lease when done.
     *
     * @throws ModelUnavailableException if the model cannot be made ready
     */
    public ModelLease acquire() {
        while (true) {
            ModelHandle handle = ensureReady();
            ModelLease lease = handle.tryLease();
            if (lease != null) {
                return lease;
            }
            // retired between ensureReady and lease; the replacement is already loading or ready
        }
    }

    /**
     * Switches to another model (or reloads the current one) under the single-loader discipline.
     * Requests holding a lease on the previous handle finish on it.
     *
     * @param newSpec model to load
     * @return the new ready handle
     * @throws ModelUnavailableException if the new model cannot be loaded
     */
    public ModelHandle reload(ModelSpec newSpec) {
        Objects.requireNonNull(newSpec, "newSpec");
        while (true) {
            CompletableFuture<ModelHandle> future;
            boolean leader = false;
            ModelHandle previous = null;
            lock.lock();
            try {
                targetSpec = newSpec;
                if (inFlight == null) {
                    ModelState s = state;
                    previous = s.handle();
                    LOG.info("Reloading model: {} -> {} on {}", s.spec().modelId(), newSpec.modelId(), newSpec.device());
                    inFlight = new CompletableFuture<>();
                    leader = true;
                    state = ModelState.loading(newSpec, 0, null, clock.instant());
                }
                future = inFlight;
            } finally {
                lock.unlock();
            }

            retire(previous);
            if (leader) {
                runLoadCycle(future, newSpec);
                return await(future, newSpec);
            }
            // someone else is loading, possibly the previous spec: wait, then try again as loader
            ModelHandle handle = await(future, newSpec);
            if (handle.spec().equals(newSpec) && !handle.isRetired()) {
                return handle;
            }
        }
    }

    /** Current state snapshot. */
    public ModelState state() {
        return state;
    }

    /** Model the coordinator serves or will load next. */
    public ModelSpec targetSpec() {
        lock.lock();
        try {
            return targetSpec;
        } finally {
            lock.unlock();
        }
    }

    private void runLoadCycle(CompletableFuture<ModelHandle> future, ModelSpec spec) {
        long cycleStart = System.nanoTime();
        Instant since = clock.instant();
        RuntimeException lastError = null;
        int attempt = 0;
        try {
            while (attempt < maxAttempts) {
                attempt++;
                try {
                    LOG.info("Loading model {} on {} (attempt {}/{})", spec.modelId(), spec.device(), attempt, maxAttempts);
                    EmbeddingExtractor extractor = loader.load(spec);
                    ModelHandle handle = new ModelHandle(extractor, spec, clock.instant());
                    publishReady(future, handle, attempt);
                    metrics.recordModelLoad(spec.modelId(), System.nanoTime() - cycleStart, true);
                    LOG.info("Model {} ready (dimension={}) after {} attempt(s)",
                            spec.modelId(), extractor.dimension(), attempt);
                    return;
                } catch (RuntimeException e) {
                    lastError = e;
                    metrics.incrementModelLoadFailure(spec.modelId());
                    LOG.warn("Model load attempt {}/{} for {} failed: {}", attempt, maxAttempts, spec.modelId(), e.getMessage());
                    state = ModelState.loading(spec, attempt, e.getMessage(), since);
                }
                if (attempt < maxAttempts) {
                    long delay = backoff.delayMs(attempt);
                    LOG.debug("Retrying model load in {} ms", delay);
                    sleeper.sleep(delay);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            lastError = new IllegalStateException("interrupted during load backoff", e);
        } finally {
            if (!future.isDone()) {
                String reason = lastError != null ? lastError.getMessage() : "load aborted";
                ModelUnavailableException ex = new ModelUnavailableException(spec.modelId(), attempt, reason, lastError);
                publishFailed(future, spec, ex, attempt);
                metrics.recordModelLoad(spec.modelId(), System.nanoTime() - cycleStart, false);
                LOG.error("Model {} unavailable after {} attempt(s): {}", spec.modelId(), attempt, reason);
            }
        }
    }

    private void publishReady(CompletableFuture<ModelHandle> future, ModelHandle handle, int attempts) {
        lock.lock();
        try {
            state = ModelState.ready(handle, attempts, clock.instant());
            inFlight = null;
        } finally {
            lock.unlock();
        }
        future.complete(handle);
    }

    private void publishFailed(CompletableFuture<ModelHandle> future, ModelSpec spec,
                               ModelUnavailableException ex, int attempts) {
        lock.lock();
        try {
            state = ModelState.failed(spec, ex.getMessage(), attempts, clock.instant());
            inFlight = null;
        } finally {
            lock.unlock();
        }
        future.completeExceptionally(ex);
    }

    private ModelHandle await(CompletableFuture<ModelHandle> future, ModelSpec spec) {
        try {
            return future.get(loadTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ModelUnavailableException mue) {
                throw mue;
            }
            throw new ModelUnavailableException(spec.modelId(), state.attempts(), String.valueOf(cause), cause);
        } catch (TimeoutException e) {
            throw new ModelUnavailableException(spec.modelId(), state.attempts(),
                    "timed out after " + loadTimeoutMs + "ms waiting for model load", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ModelUnavailableException(spec.modelId(), state.attempts(),
                    "interrupted while waiting for model load", e);
        }
    }

    /**
     * Retires the current handle on shutdown. In-flight requests finish before the extractor closes.
     */
    @Override
    public void destroy() {
        ModelHandle last;
        lock.lock();
        try {
            last = state.handle();
            state = ModelState.unloaded(targetSpec, clock.instant());
        } finally {
            lock.unlock();
        }
        retire(last);
    }

    private static void retire(ModelHandle handle) {
        if (handle != null) {
            handle.retire();
        }
    }
}
