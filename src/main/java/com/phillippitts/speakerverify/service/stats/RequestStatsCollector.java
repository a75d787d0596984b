package com.phillippitts.speakerverify.service.stats;

import com.phillippitts.speakerverify.config.properties.StatsProperties;
import com.phillippitts.speakerverify.domain.RequestRecord;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Process-wide request statistics.
 *
 * <p>Counters are plain atomics. The request history is a fixed-size ring written with a single
 * {@code getAndIncrement} per record, so concurrent callers never block each other; when the ring
 * is full the oldest records are overwritten. Each slot carries the sequence number it was
 * written for, so a reader skips slots whose writer has claimed them but not yet stored.
 *
 * <p>{@link #record} never throws into the request path.
 */
@Component
public class RequestStatsCollector {

    private static final Logger LOG = LogManager.getLogger(RequestStatsCollector.class);

    private final Clock clock;
    private final Instant startedAt;
    private final AtomicLong total = new AtomicLong();
    private final AtomicLong succeeded = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong totalNanos = new AtomicLong();
    private final AtomicReferenceArray<Entry> ring;
    private final AtomicLong cursor = new AtomicLong();

    @Autowired
    public RequestStatsCollector(StatsProperties props) {
        this(props.getHistorySize(), Clock.systemUTC());
    }

    RequestStatsCollector(int historySize, Clock clock) {
        if (historySize <= 0) {
            throw new IllegalArgumentException("historySize must be positive");
        }
        this.clock = clock;
        this.startedAt = clock.instant();
        this.ring = new AtomicReferenceArray<>(historySize);
    }

    /**
     * Records one handled request.
     *
     * @param endpoint       logical endpoint name
     * @param duration       handling time
     * @param success        outcome
     * @param error          error code on failure
     * @param clientIdentity caller identity, or null for anonymous
     */
    public void record(String endpoint, Duration duration, boolean success, String error, String clientIdentity) {
        try {
            total.incrementAndGet();
            (success ? succeeded : failed).incrementAndGet();
            totalNanos.addAndGet(duration.toNanos());
            long seq = cursor.getAndIncrement();
            RequestRecord rec = new RequestRecord(clock.instant(), endpoint, duration, success,
                    success ? null : error, clientIdentity == null || clientIdentity.isBlank() ? "anonymous" : clientIdentity);
            ring.set(slot(seq), new Entry(seq, rec));
        } catch (RuntimeException e) {
            LOG.warn("Failed to record request stats for {}: {}", endpoint, e.toString());
        }
    }

    /** Current counter values. */
    public Snapshot snapshot() {
        long t = total.get();
        long s = succeeded.get();
        long f = failed.get();
        double rate = t == 0 ? 0.0 : (double) s / t;
        double avgMs = t == 0 ? 0.0 : totalNanos.get() / 1_000_000.0 / t;
        return new Snapshot(t, s, f, rate, avgMs, uptime().toSeconds());
    }

    /**
     * Most recent records, newest first. Records still being written by a concurrent caller are
     * left out.
     *
     * @param limit maximum number of records
     */
    public List<RequestRecord> recent(int limit) {
        long end = cursor.get();
        int n = (int) Math.min(Math.min(limit, ring.length()), end);
        List<RequestRecord> out = new ArrayList<>(Math.max(0, n));
        for (long i = end - 1; i >= end - n; i--) {
            Entry entry = ring.get(slot(i));
            if (entry != null && entry.seq() == i) {
                out.add(entry.record());
            }
        }
        return out;
    }

    private int slot(long seq) {
        return (int) Math.floorMod(seq, (long) ring.length());
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Duration uptime() {
        return Duration.between(startedAt, clock.instant());
    }

    /**
     * Point-in-time view of the counters.
     *
     * @param totalRequests     requests recorded
     * @param successRequests   successful requests
     * @param failedRequests    failed requests
     * @param successRate       success / total, 0 when nothing was recorded
     * @param avgResponseTimeMs mean handling time
     * @param uptimeSeconds     seconds since start
     */
    public record Snapshot(long totalRequests, long successRequests, long failedRequests,
                           double successRate, double avgResponseTimeMs, long uptimeSeconds) {
    }

    private record Entry(long seq, RequestRecord record) {
    }
}
