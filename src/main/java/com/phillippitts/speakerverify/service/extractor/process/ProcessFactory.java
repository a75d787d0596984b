package com.phillippitts.speakerverify.service.extractor.process;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Abstraction over {@link ProcessBuilder} so the worker-backed extractor can be tested hermetically.
 *
 * <p>Production code uses {@link DefaultProcessFactory}. Tests supply a factory returning a fake
 * {@link Process} with scripted stdin/stdout behavior.
 */
interface ProcessFactory {
    /**
     * Starts a new process.
     *
     * @param command    full command line, with the executable as the first element
     * @param workingDir working directory for the process (may be null)
     * @return started {@link Process}
     * @throws IOException if the process cannot be started
     */
    Process start(List<String> command, Path workingDir) throws IOException;
}
