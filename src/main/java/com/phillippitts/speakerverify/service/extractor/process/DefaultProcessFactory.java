package com.phillippitts.speakerverify.service.extractor.process;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * {@link ProcessFactory} backed by {@link ProcessBuilder}. Stdout carries the protocol, stderr the
 * worker's diagnostics, so the two are never merged.
 */
final class DefaultProcessFactory implements ProcessFactory {

    @Override
    public Process start(List<String> command, Path workingDir) throws IOException {
        ProcessBuilder pb = new ProcessBuilder(command);
        if (workingDir != null) {
            pb.directory(workingDir.toFile());
        }
        pb.redirectErrorStream(false);
        return pb.start();
    }
}
