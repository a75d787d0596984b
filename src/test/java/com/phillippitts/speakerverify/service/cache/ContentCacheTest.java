package com.phillippitts.speakerverify.service.cache;

import com.phillippitts.speakerverify.exception.DownloadFailedException;
import com.phillippitts.speakerverify.service.audio.AudioDownloader;
import com.phillippitts.speakerverify.service.metrics.VerificationMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ContentCacheTest {

    private static final String URL = "https://audio.example.com/clip.wav?sig=abc";

    @TempDir
    Path dir;

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private ExecutorService pool;

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.shutdownNow();
        }
    }

    /**
     * Downloader that writes the URL as the body and counts calls.
     */
    private static final class CountingDownloader implements AudioDownloader {
        final AtomicInteger calls = new AtomicInteger();
        final long delayMs;
        volatile boolean fail;

        CountingDownloader(long delayMs) {
            this.delayMs = delayMs;
        }

        @Override
        public void download(String url, Path destination) {
            calls.incrementAndGet();
            try {
                Files.writeString(destination, "partial", StandardCharsets.UTF_8);
                if (delayMs > 0) {
                    Thread.sleep(delayMs);
                }
                if (fail) {
                    throw new DownloadFailedException(url, "HTTP 500", 500);
                }
                Files.writeString(destination, url, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
        }
    }

    private ContentCache cache(AudioDownloader downloader, Clock clock) {
        return new ContentCache(dir, downloader, new VerificationMetrics(registry), clock);
    }

    private List<Path> filesIn(Path directory) throws IOException {
        try (Stream<Path> s = Files.list(directory)) {
            return s.toList();
        }
    }

    @Test
    void keyIsHexSha256OfUrl() {
        String key = ContentCache.keyFor(URL);

        assertThat(key).hasSize(64).matches("[0-9a-f]+");
        assertThat(ContentCache.keyFor(URL)).isEqualTo(key);
        assertThat(ContentCache.keyFor(URL + "x")).isNotEqualTo(key);
    }

    @Test
    void downloadsOnMissAndServesHitFromDisk() throws IOException {
        CountingDownloader downloader = new CountingDownloader(0);
        ContentCache cache = cache(downloader, Clock.systemUTC());

        ContentCache.CacheLease first = cache.getOrFetch(URL);
        first.onRelease().run();
        ContentCache.CacheLease second = cache.getOrFetch(URL);
        second.onRelease().run();

        assertThat(downloader.calls).hasValue(1);
        assertThat(second.path()).isEqualTo(first.path());
        assertThat(first.path().getFileName().toString()).isEqualTo(ContentCache.keyFor(URL) + ".audio");
        assertThat(Files.readString(first.path())).isEqualTo(URL);
        assertThat(registry.counter("speakerverify.cache.miss").count()).isEqualTo(1.0);
        assertThat(registry.counter("speakerverify.cache.hit").count()).isEqualTo(1.0);
    }

    @Test
    void concurrentLookupsOfSameUrlDownloadOnce() throws Exception {
        CountingDownloader downloader = new CountingDownloader(300);
        ContentCache cache = cache(downloader, Clock.systemUTC());
        int threads = 8;
        pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);

        List<Future<ContentCache.CacheLease>> futures = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            futures.add(pool.submit(() -> {
                start.await();
                return cache.getOrFetch(URL);
            }));
        }
        start.countDown();

        Path expected = cache.entryPath(ContentCache.keyFor(URL));
        for (Future<ContentCache.CacheLease> f : futures) {
            assertThat(f.get(5, TimeUnit.SECONDS).path()).isEqualTo(expected);
        }
        assertThat(downloader.calls).hasValue(1);
        assertThat(cache.activeLeases(ContentCache.keyFor(URL))).isEqualTo(threads);
    }

    @Test
    void differentUrlsDownloadSeparately() {
        CountingDownloader downloader = new CountingDownloader(0);
        ContentCache cache = cache(downloader, Clock.systemUTC());

        Path a = cache.getOrFetch("http://host/a.wav").path();
        Path b = cache.getOrFetch("http://host/b.wav").path();

        assertThat(a).isNotEqualTo(b);
        assertThat(downloader.calls).hasValue(2);
    }

    @Test
    void failedDownloadLeavesNoEntryAndIsRetried() throws IOException {
        CountingDownloader downloader = new CountingDownloader(0);
        downloader.fail = true;
        ContentCache cache = cache(downloader, Clock.systemUTC());

        assertThatThrownBy(() -> cache.getOrFetch(URL)).isInstanceOf(DownloadFailedException.class);

        assertThat(filesIn(dir)).isEmpty();
        assertThat(cache.activeLeases(ContentCache.keyFor(URL))).isZero();

        downloader.fail = false;
        ContentCache.CacheLease lease = cache.getOrFetch(URL);

        assertThat(Files.readString(lease.path())).isEqualTo(URL);
        assertThat(downloader.calls).hasValue(2);
    }

    @Test
    void emptyBodyIsRejected() throws IOException {
        AudioDownloader empty = (url, destination) -> {
            try {
                Files.createFile(destination);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        };
        ContentCache cache = cache(empty, Clock.systemUTC());

        assertThatThrownBy(() -> cache.getOrFetch(URL))
                .isInstanceOf(DownloadFailedException.class)
                .hasMessageContaining("empty");
        assertThat(filesIn(dir)).isEmpty();
    }

    @Test
    void evictionSkipsLeasedEntries() {
        CountingDownloader downloader = new CountingDownloader(0);
        Clock later = Clock.offset(Clock.systemUTC(), Duration.ofHours(2));
        ContentCache cache = cache(downloader, later);

        ContentCache.CacheLease leased = cache.getOrFetch("http://host/leased.wav");
        ContentCache.CacheLease idle = cache.getOrFetch("http://host/idle.wav");
        idle.onRelease().run();

        int removed = cache.evictOlderThan(Duration.ofHours(1));

        assertThat(removed).isEqualTo(1);
        assertThat(leased.path()).exists();
        assertThat(idle.path()).doesNotExist();

        leased.onRelease().run();
        assertThat(cache.evictOlderThan(Duration.ofHours(1))).isEqualTo(1);
        assertThat(leased.path()).doesNotExist();
    }

    @Test
    void evictionKeepsFreshEntries() {
        ContentCache cache = cache(new CountingDownloader(0), Clock.systemUTC());
        cache.getOrFetch(URL).onRelease().run();

        assertThat(cache.evictOlderThan(Duration.ofHours(1))).isZero();
        assertThat(cache.entryPath(ContentCache.keyFor(URL))).exists();
    }

    @Test
    void clearRemovesIdleEntriesOnly() {
        ContentCache cache = cache(new CountingDownloader(0), Clock.systemUTC());
        cache.getOrFetch("http://host/1.wav").onRelease().run();
        cache.getOrFetch("http://host/2.wav").onRelease().run();
        ContentCache.CacheLease held = cache.getOrFetch("http://host/3.wav");

        assertThat(cache.clear()).isEqualTo(2);
        assertThat(held.path()).exists();
    }
}
