package com.phillippitts.speakerverify.service.audio;

import com.phillippitts.speakerverify.config.properties.AudioSourceProperties;
import com.phillippitts.speakerverify.domain.AudioSource;
import com.phillippitts.speakerverify.domain.ResolvedAudio;
import com.phillippitts.speakerverify.exception.InvalidSourceException;
import com.phillippitts.speakerverify.service.cache.ContentCache;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.ByteArrayResource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

class TemporaryResourceJanitorTest {

    @TempDir
    Path tmp;

    private AudioSourceResolver resolver;
    private Path scratch;
    private Path cacheDir;

    @BeforeEach
    void setUp() throws IOException {
        scratch = tmp.resolve("scratch");
        cacheDir = Files.createDirectories(tmp.resolve("cache"));
        AudioSourceProperties props = new AudioSourceProperties();
        props.setScratchDir(scratch.toString());
        resolver = new AudioSourceResolver(props, mock(ContentCache.class));
    }

    private TemporaryResourceJanitor janitor() {
        return new TemporaryResourceJanitor(resolver, scratch, cacheDir, Clock.systemUTC());
    }

    private static AudioSource upload(String name) {
        return new AudioSource.Upload(name, new ByteArrayResource(new byte[]{1, 2, 3}));
    }

    private long scratchFiles() throws IOException {
        try (Stream<Path> s = Files.list(scratch)) {
            return s.count();
        }
    }

    @Test
    void closingScopeDeletesEveryOwnedFile() throws IOException {
        TemporaryResourceJanitor.Scope scope = janitor().openScope();
        ResolvedAudio a = scope.resolve(upload("a.wav"));
        ResolvedAudio b = scope.resolve(upload("b.wav"));
        assertThat(scope.size()).isEqualTo(2);

        scope.close();

        assertThat(a.path()).doesNotExist();
        assertThat(b.path()).doesNotExist();
        assertThat(scratchFiles()).isZero();
    }

    @Test
    void partiallyResolvedRequestIsCleanedUpOnError() throws IOException {
        TemporaryResourceJanitor janitor = janitor();

        assertThatThrownBy(() -> {
            try (TemporaryResourceJanitor.Scope scope = janitor.openScope()) {
                scope.resolve(upload("first.wav"));
                scope.resolve(upload("second.exe"));
            }
        }).isInstanceOf(InvalidSourceException.class);

        assertThat(scratchFiles()).isZero();
    }

    @Test
    void closeIsIdempotent() {
        TemporaryResourceJanitor.Scope scope = janitor().openScope();
        scope.resolve(upload("a.wav"));

        scope.close();
        scope.close();

        assertThat(scope.size()).isZero();
    }

    @Test
    void resolveAfterCloseIsRejectedAndLeavesNothingBehind() throws IOException {
        TemporaryResourceJanitor.Scope scope = janitor().openScope();
        scope.close();

        assertThatThrownBy(() -> scope.resolve(upload("late.wav"))).isInstanceOf(IllegalStateException.class);
        assertThat(scratchFiles()).isZero();
    }

    @Test
    void startupSweepRemovesOnlyStaleLeftovers() throws IOException {
        Instant old = Instant.now().minus(Duration.ofHours(3));
        Path staleUpload = Files.write(scratch.resolve("old_upload.wav"), new byte[]{1});
        Files.setLastModifiedTime(staleUpload, FileTime.from(old));
        Path freshUpload = Files.write(scratch.resolve("fresh_upload.wav"), new byte[]{1});
        Path stalePart = Files.write(cacheDir.resolve("abc.123.part"), new byte[]{1});
        Files.setLastModifiedTime(stalePart, FileTime.from(old));
        Path staleEntry = Files.write(cacheDir.resolve("abc.audio"), new byte[]{1});
        Files.setLastModifiedTime(staleEntry, FileTime.from(old));

        janitor().sweepStaleFiles();

        assertThat(staleUpload).doesNotExist();
        assertThat(stalePart).doesNotExist();
        assertThat(freshUpload).exists();
        assertThat(staleEntry).as("cache entries are left to TTL eviction").exists();
    }
}
