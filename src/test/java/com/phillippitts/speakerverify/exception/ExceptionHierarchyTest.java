package com.phillippitts.speakerverify.exception;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.SocketTimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionHierarchyTest {

    @Test
    void baseExceptionIsNonRetryableInternalError() {
        IOException cause = new IOException("disk full");
        SpeakerVerifyException ex = new SpeakerVerifyException("wrapper error", cause);

        assertThat(ex.getMessage()).isEqualTo("wrapper error");
        assertThat(ex.getCause()).isSameAs(cause);
        assertThat(ex.isRetryable()).isFalse();
        assertThat(ex.getErrorCode()).isEqualTo("INTERNAL_ERROR");
        assertThat(ex.getClientMessage()).isEqualTo("wrapper error");
    }

    @Test
    void invalidSourceIsAnInvalidRequest() {
        InvalidSourceException ex = new InvalidSourceException("notes.txt", "extension not allowed: txt");

        assertThat(ex).isInstanceOf(InvalidRequestException.class);
        assertThat(ex.getMessage()).isEqualTo("Invalid audio source: extension not allowed: txt");
        assertThat(ex.getSource()).isEqualTo("notes.txt");
        assertThat(ex.getReason()).isEqualTo("extension not allowed: txt");
        assertThat(ex.getErrorCode()).isEqualTo("INVALID_SOURCE");
        assertThat(ex.isRetryable()).isFalse();
    }

    @Test
    void validationFailureCarriesSizeAndReason() {
        ValidationFailedException ex = new ValidationFailedException(1024, "Missing data chunk in WAV file");

        assertThat(ex.getMessage()).isEqualTo("Invalid audio data (1024 bytes): Missing data chunk in WAV file");
        assertThat(ex.getAudioSize()).isEqualTo(1024);
        assertThat(ex.getReason()).isEqualTo("Missing data chunk in WAV file");
        assertThat(ex.getErrorCode()).isEqualTo("VALIDATION_FAILED");
    }

    @Test
    void downloadFailureKeepsUrlAndStatus() {
        DownloadFailedException ex = new DownloadFailedException("http://host/a.wav", "HTTP 503", 503);

        assertThat(ex.getMessage()).isEqualTo("Failed to download audio from http://host/a.wav: HTTP 503");
        assertThat(ex.getStatusCode()).isEqualTo(503);
        assertThat(ex.isRetryable()).isTrue();
        assertThat(new DownloadFailedException("http://host/a.wav", "empty body").getStatusCode()).isEqualTo(-1);
    }

    @Test
    void downloadTimeoutIsADownloadFailure() {
        SocketTimeoutException cause = new SocketTimeoutException("Read timed out");
        DownloadTimeoutException ex = new DownloadTimeoutException("http://host/a.wav", 5_000, cause);

        assertThat(ex).isInstanceOf(DownloadFailedException.class);
        assertThat(ex.getMessage()).contains("timed out after 5000ms");
        assertThat(ex.getTimeoutMs()).isEqualTo(5_000);
        assertThat(ex.getCause()).isSameAs(cause);
        assertThat(ex.getErrorCode()).isEqualTo("DOWNLOAD_TIMEOUT");
    }

    @Test
    void extractionExceptionNamesExtractor() {
        ExtractionException ex = new ExtractionException("worker crashed", "process");

        assertThat(ex.getMessage()).isEqualTo("worker crashed (extractor: process)");
        assertThat(ex.getExtractorName()).isEqualTo("process");
        assertThat(ex.isRetryable()).isTrue();
        assertThat(ex.getClientMessage()).isEqualTo("Embedding extraction failed");
        assertThat(new ExtractionException("no name").getExtractorName()).isEqualTo("unknown");
    }

    @Test
    void extractionTimeoutIsAnExtractionException() {
        ExtractionTimeoutException ex = new ExtractionTimeoutException("no answer", "process", 30_000);

        assertThat(ex).isInstanceOf(ExtractionException.class);
        assertThat(ex.getTimeoutMs()).isEqualTo(30_000);
        assertThat(ex.getErrorCode()).isEqualTo("EXTRACTION_TIMEOUT");
        assertThat(ex.getClientMessage()).isEqualTo("Embedding extraction timed out");
    }

    @Test
    void modelUnavailableDescribesAttempts() {
        ModelUnavailableException ex = new ModelUnavailableException("iic/model", 3, "worker exited", null);

        assertThat(ex.getMessage()).isEqualTo("Model iic/model unavailable after 3 attempt(s): worker exited");
        assertThat(ex.getModelId()).isEqualTo("iic/model");
        assertThat(ex.getAttempts()).isEqualTo(3);
        assertThat(ex.isRetryable()).isTrue();
        assertThat(ex.getErrorCode()).isEqualTo("MODEL_UNAVAILABLE");
    }

    @Test
    void builderAddsContextAndPicksTimeoutSubtype() {
        ExtractionException plain = ExtractionExceptionBuilder.create("Embedding worker exited")
                .extractor("process")
                .exitCode(137)
                .metadata("model", "iic/model")
                .build();
        ExtractionException timeout = ExtractionExceptionBuilder.create("Embedding worker did not answer")
                .extractor("process")
                .timeoutMs(200)
                .build();

        assertThat(plain).isNotInstanceOf(ExtractionTimeoutException.class);
        assertThat(plain.getMessage()).contains("exitCode=137").contains("model=iic/model").contains("(extractor: process)");
        assertThat(timeout).isInstanceOf(ExtractionTimeoutException.class);
        assertThat(((ExtractionTimeoutException) timeout).getTimeoutMs()).isEqualTo(200);
    }
}
