package com.phillippitts.speakerverify.service.extractor.process;

import com.phillippitts.speakerverify.config.properties.ExtractorConfig;
import com.phillippitts.speakerverify.domain.Embedding;
import com.phillippitts.speakerverify.exception.ExtractionException;
import com.phillippitts.speakerverify.exception.ExtractionExceptionBuilder;
import com.phillippitts.speakerverify.service.extractor.ConcurrencyGuard;
import com.phillippitts.speakerverify.service.extractor.EmbeddingExtractor;
import com.phillippitts.speakerverify.service.extractor.ModelSpec;
import com.phillippitts.speakerverify.service.extractor.process.EmbeddingJsonParser.Kind;
import com.phillippitts.speakerverify.service.extractor.process.EmbeddingJsonParser.WorkerReply;
import com.phillippitts.speakerverify.util.LogSanitizer;
import com.phillippitts.speakerverify.util.ProcessTimeouts;
import com.phillippitts.speakerverify.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Embedding extractor backed by a long-lived worker process that keeps the model in memory.
 *
 * <p>Responsibilities:
 * - Build the worker command line from {@link ExtractorConfig#command()} and the {@link ModelSpec}
 * - Wait for the worker's ready line and record the embedding dimension
 * - Send one request line per extraction and match answers by id
 * - Enforce startup and per-extraction deadlines, killing a worker that stops answering
 * - Keep a tail of stderr for error context
 *
 * <p>A worker that exits, or that misses a deadline, is reported unhealthy; the model lifecycle
 * coordinator replaces it on the next acquisition.
 */
public final class ProcessEmbeddingExtractor implements EmbeddingExtractor {

    private static final Logger LOG = LogManager.getLogger(ProcessEmbeddingExtractor.class);

    static final String NAME = "process";
    static final int STDERR_TAIL_CHARS = 2000;

    private final ProcessFactory processFactory;
    private final ExtractorConfig config;
    private final ModelSpec spec;
    private final ConcurrencyGuard guard;

    private final AtomicLong requestIds = new AtomicLong();
    private final ConcurrentNavigableMap<Long, CompletableFuture<WorkerReply>> pending =
            new ConcurrentSkipListMap<>();
    private final CompletableFuture<WorkerReply> ready = new CompletableFuture<>();
    private final StringBuilder stderrTail = new StringBuilder();
    private final Object writeLock = new Object();
    private final AtomicBoolean closed = new AtomicBoolean();

    private volatile Process process;
    private volatile Writer stdin;
    private volatile Thread outReader;
    private volatile Thread errGobbler;
    private volatile boolean healthy;
    private volatile int dimension;

    ProcessEmbeddingExtractor(ProcessFactory processFactory, ExtractorConfig config, ModelSpec spec) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
        this.config = Objects.requireNonNull(config, "config");
        this.spec = Objects.requireNonNull(spec, "spec");
        this.guard = new ConcurrencyGuard(config.maxConcurrent(), config.acquireTimeoutMs(), NAME);
    }

    /**
     * Starts the worker and blocks until it reports ready.
     *
     * @throws ExtractionException if the worker cannot be started, fails during startup, or does
     *         not report ready within {@link ExtractorConfig#startupTimeoutMs()}
     */
    void start() {
        List<String> command = buildCommand(config.command(), spec);
        long startTime = System.nanoTime();
        LOG.info("Starting embedding worker for model={} device={}", spec.modelId(), spec.device());

        try {
            Process p = processFactory.start(command, null);
            this.process = p;
            this.stdin = new BufferedWriter(new OutputStreamWriter(p.getOutputStream(), StandardCharsets.UTF_8));
            this.outReader = startDaemon(() -> readReplies(p.getInputStream()), "embedding-worker-out");
            this.errGobbler = startDaemon(() -> gobbleStderr(p.getErrorStream()), "embedding-worker-err");
        } catch (IOException e) {
            close();
            throw ExtractionExceptionBuilder.create("Failed to start embedding worker")
                    .extractor(NAME)
                    .cause(e)
                    .metadata("command", String.join(" ", command))
                    .build();
        }

        try {
            WorkerReply reply = ready.get(config.startupTimeoutMs(), TimeUnit.MILLISECONDS);
            if (reply.dimension() <= 0) {
                throw failure("Worker reported an invalid dimension: " + reply.dimension(), startTime, null);
            }
            this.dimension = reply.dimension();
            this.healthy = true;
            LOG.info("Embedding worker ready: model={} dimension={} in {} ms",
                    spec.modelId(), dimension, TimeUtils.elapsedMillis(startTime));
        } catch (TimeoutException e) {
            close();
            throw ExtractionExceptionBuilder.create("Embedding worker did not report ready")
                    .extractor(NAME)
                    .timeoutMs(config.startupTimeoutMs())
                    .durationMs(TimeUtils.elapsedMillis(startTime))
                    .metadata("model", spec.modelId())
                    .metadata("stderr", stderrSnippet())
                    .build();
        } catch (ExecutionException e) {
            close();
            Throwable cause = e.getCause();
            if (cause instanceof ExtractionException ee) {
                throw ee;
            }
            throw failure("Embedding worker failed during startup", startTime, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            close();
            throw failure("Interrupted while waiting for embedding worker", startTime, e);
        } catch (ExtractionException e) {
            close();
            throw e;
        }
    }

    @Override
    public Embedding extract(Path audioFile) {
        Objects.requireNonNull(audioFile, "audioFile");
        if (!healthy) {
            throw new ExtractionException("Embedding worker is not running", NAME);
        }

        guard.acquire();
        try {
            return requestEmbedding(audioFile);
        } finally {
            guard.release();
        }
    }

    private Embedding requestEmbedding(Path audioFile) {
        long id = requestIds.incrementAndGet();
        long startTime = System.nanoTime();
        CompletableFuture<WorkerReply> answer = new CompletableFuture<>();
        pending.put(id, answer);

        try {
            send(EmbeddingJsonParser.request(id, audioFile.toAbsolutePath().toString()));
        } catch (IOException e) {
            pending.remove(id);
            markUnhealthy("write failed: " + e.getMessage());
            throw failure("Failed to send request to embedding worker", startTime, e);
        }

        WorkerReply reply;
        try {
            reply = answer.get(config.extractTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            pending.remove(id);
            markUnhealthy("no answer within " + config.extractTimeoutMs() + "ms");
            destroyProcess(process);
            throw ExtractionExceptionBuilder.create("Embedding worker did not answer")
                    .extractor(NAME)
                    .timeoutMs(config.extractTimeoutMs())
                    .durationMs(TimeUtils.elapsedMillis(startTime))
                    .metadata("audio", audioFile.getFileName())
                    .build();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ExtractionException ee) {
                throw ee;
            }
            throw failure("Embedding worker failed", startTime, cause);
        } catch (InterruptedException e) {
            pending.remove(id);
            Thread.currentThread().interrupt();
            throw failure("Interrupted while waiting for embedding", startTime, e);
        }

        if (reply.kind() == Kind.ERROR) {
            throw ExtractionExceptionBuilder.create("Embedding worker rejected audio")
                    .extractor(NAME)
                    .durationMs(TimeUtils.elapsedMillis(startTime))
                    .metadata("audio", audioFile.getFileName())
                    .metadata("error", LogSanitizer.truncate(reply.error(), 500))
                    .build();
        }
        if (reply.embedding().length != dimension) {
            throw ExtractionExceptionBuilder.create("Embedding dimension mismatch")
                    .extractor(NAME)
                    .metadata("expected", dimension)
                    .metadata("actual", reply.embedding().length)
                    .build();
        }
        try {
            Embedding embedding = Embedding.of(reply.embedding()).normalized();
            LOG.debug("Extracted embedding from {} in {} ms", audioFile.getFileName(), TimeUtils.elapsedMillis(startTime));
            return embedding;
        } catch (IllegalArgumentException e) {
            throw failure("Embedding worker returned an unusable vector", startTime, e);
        }
    }

    private void send(String line) throws IOException {
        Writer w = this.stdin;
        if (w == null) {
            throw new IOException("worker stdin is closed");
        }
        synchronized (writeLock) {
            w.write(line);
            w.write('\n');
            w.flush();
        }
    }

    /**
     * Stdout reader: dispatches answers to waiting requests. Runs until the worker closes stdout.
     */
    private void readReplies(InputStream inputStream) {
        try (BufferedReader br = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
            String line;
            while ((line = br.readLine()) != null) {
                if (line.length() > config.maxLineBytes()) {
                    LOG.warn("Discarding {}-char worker line above {}B cap", line.length(), config.maxLineBytes());
                    continue;
                }
                WorkerReply reply = EmbeddingJsonParser.parse(line);
                if (reply == null) {
                    LOG.debug("worker: {}", LogSanitizer.truncate(line, 200));
                    continue;
                }
                dispatch(reply);
            }
        } catch (IOException e) {
            LOG.debug("Worker stdout reader stopped: {}", e.toString());
        }
        workerExited();
    }

    private void dispatch(WorkerReply reply) {
        switch (reply.kind()) {
            case READY -> ready.complete(reply);
            case NOT_READY -> ready.completeExceptionally(
                    new ExtractionException("Embedding worker failed to load model: " + reply.error(), NAME));
            case EMBEDDING, ERROR -> {
                CompletableFuture<WorkerReply> target = reply.id() == EmbeddingJsonParser.NO_ID
                        ? pollOldest()
                        : pending.remove(reply.id());
                if (target == null) {
                    LOG.warn("Worker answered unknown or expired request id={}", reply.id());
                } else {
                    target.complete(reply);
                }
            }
        }
    }

    private CompletableFuture<WorkerReply> pollOldest() {
        Map.Entry<Long, CompletableFuture<WorkerReply>> first = pending.pollFirstEntry();
        return first == null ? null : first.getValue();
    }

    private void workerExited() {
        boolean wasHealthy = healthy;
        healthy = false;
        Process p = this.process;
        ExtractionExceptionBuilder builder = ExtractionExceptionBuilder.create("Embedding worker exited")
                .extractor(NAME)
                .metadata("stderr", stderrSnippet());
        if (p != null && !p.isAlive()) {
            builder.exitCode(p.exitValue());
        }
        ExtractionException ex = builder.build();
        ready.completeExceptionally(ex);
        failPending(ex);
        if (wasHealthy && !closed.get()) {
            LOG.warn("Embedding worker for model={} exited unexpectedly", spec.modelId());
        }
    }

    private void gobbleStderr(InputStream inputStream) {
        try (BufferedReader br = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
            String line;
            while ((line = br.readLine()) != null) {
                LOG.debug("worker stderr: {}", LogSanitizer.truncate(line, 500));
                synchronized (stderrTail) {
                    if (!stderrTail.isEmpty()) {
                        stderrTail.append('\n');
                    }
                    stderrTail.append(line);
                    int excess = stderrTail.length() - STDERR_TAIL_CHARS;
                    if (excess > 0) {
                        stderrTail.delete(0, excess);
                    }
                }
            }
        } catch (IOException e) {
            LOG.debug("Worker stderr gobbler stopped: {}", e.toString());
        }
    }

    String stderrSnippet() {
        synchronized (stderrTail) {
            return stderrTail.toString();
        }
    }

    private void failPending(ExtractionException ex) {
        Map.Entry<Long, CompletableFuture<WorkerReply>> entry;
        while ((entry = pending.pollFirstEntry()) != null) {
            entry.getValue().completeExceptionally(ex);
        }
    }

    private void markUnhealthy(String reason) {
        if (healthy) {
            LOG.warn("Marking embedding worker unhealthy: {}", reason);
        }
        healthy = false;
    }

    private ExtractionException failure(String msg, long startTime, Throwable cause) {
        ExtractionExceptionBuilder builder = ExtractionExceptionBuilder.create(msg)
                .extractor(NAME)
                .durationMs(TimeUtils.elapsedMillis(startTime));
        if (cause != null) {
            builder.cause(cause);
        }
        return builder.build();
    }

    static List<String> buildCommand(List<String> template, ModelSpec spec) {
        List<String> cmd = new ArrayList<>(template.size());
        for (String arg : template) {
            cmd.add(arg.replace("{model}", spec.modelId()).replace("{device}", spec.device()));
        }
        return cmd;
    }

    private static Thread startDaemon(Runnable body, String name) {
        Thread thread = new Thread(body, name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public String name() {
        return NAME + ":" + spec.modelId();
    }

    @Override
    public boolean isHealthy() {
        Process p = this.process;
        return healthy && p != null && p.isAlive();
    }

    /**
     * Idempotent shutdown: closes stdin (the worker's cue to exit), then terminates the process and
     * fails any request still waiting.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        healthy = false;
        Writer w = this.stdin;
        this.stdin = null;
        if (w != null) {
            try {
                synchronized (writeLock) {
                    w.close();
                }
            } catch (IOException e) {
                LOG.debug("Closing worker stdin failed: {}", e.toString());
            }
        }
        Process p = this.process;
        if (p != null) {
            destroyProcess(p);
        }
        joinQuietly(outReader, ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
        joinQuietly(errGobbler, ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
        failPending(new ExtractionException("Embedding worker closed", NAME));
        LOG.info("Embedding worker for model={} closed", spec.modelId());
    }

    private static void destroyProcess(Process process) {
        if (process == null || !process.isAlive()) {
            return;
        }
        try {
            process.destroy();
            boolean exited = process.waitFor(ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT.toMillis(),
                    TimeUnit.MILLISECONDS);
            if (!exited && process.isAlive()) {
                process.destroyForcibly();
                process.waitFor(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                if (process.isAlive()) {
                    LOG.warn("Embedding worker still alive after destroyForcibly");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while destroying embedding worker");
        }
    }

    private static void joinQuietly(Thread thread, Duration timeout) {
        if (thread == null || thread == Thread.currentThread()) {
            return;
        }
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
