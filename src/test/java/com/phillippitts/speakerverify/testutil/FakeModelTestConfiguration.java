package com.phillippitts.speakerverify.testutil;

import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.test.context.DynamicPropertyRegistry;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Replaces the worker-process model loader with {@link FakeModelLoader} (primary over the
 * production loader) so the full web stack runs without Python. Also points scratch and cache
 * directories at a throwaway location.
 */
@TestConfiguration
public class FakeModelTestConfiguration {

    public static final Path WORK_DIR = createWorkDir();

    private static Path createWorkDir() {
        try {
            return Files.createTempDirectory("speaker-verify-it");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** Registers directory properties; call from a {@code @DynamicPropertySource} method. */
    public static void registerDirectories(DynamicPropertyRegistry registry) {
        registry.add("audio.source.scratch-dir", () -> WORK_DIR.resolve("scratch").toString());
        registry.add("audio.cache.dir", () -> WORK_DIR.resolve("cache").toString());
    }

    @Bean
    @Primary
    FakeModelLoader fakeModelLoader() {
        return new FakeModelLoader();
    }
}
