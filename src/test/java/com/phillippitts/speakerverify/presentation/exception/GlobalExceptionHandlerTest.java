package com.phillippitts.speakerverify.presentation.exception;

import com.phillippitts.speakerverify.exception.DownloadFailedException;
import com.phillippitts.speakerverify.exception.DownloadTimeoutException;
import com.phillippitts.speakerverify.exception.ExtractionException;
import com.phillippitts.speakerverify.exception.ExtractionTimeoutException;
import com.phillippitts.speakerverify.exception.InvalidRequestException;
import com.phillippitts.speakerverify.exception.InvalidSourceException;
import com.phillippitts.speakerverify.exception.ModelUnavailableException;
import com.phillippitts.speakerverify.exception.SpeakerVerifyException;
import com.phillippitts.speakerverify.exception.ValidationFailedException;
import com.phillippitts.speakerverify.presentation.exception.GlobalExceptionHandler.ApiError;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.net.SocketTimeoutException;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void verifiesInvalidRequestReturns400WithMessage() {
        ResponseEntity<ApiError> response = handler.handleClientError(
                new InvalidRequestException("threshold must be a number between -1 and 1, got 2.0"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        ApiError body = response.getBody();
        assertThat(body.success()).isFalse();
        assertThat(body.errorCode()).isEqualTo("INVALID_REQUEST");
        assertThat(body.message()).contains("threshold");
        assertThat(body.retryable()).isFalse();
    }

    @Test
    void verifiesInvalidSourceKeepsItsCode() {
        ResponseEntity<ApiError> response = handler.handleClientError(
                new InvalidSourceException("ftp://host/a.wav", "unsupported URL scheme: ftp"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().errorCode()).isEqualTo("INVALID_SOURCE");
        assertThat(response.getBody().message()).isEqualTo("Invalid audio source: unsupported URL scheme: ftp");
    }

    @Test
    void verifiesValidationFailureReturns400() {
        ResponseEntity<ApiError> response = handler.handleClientError(
                new ValidationFailedException(3200, "Audio too short: 100 ms (min 500 ms)"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().errorCode()).isEqualTo("VALIDATION_FAILED");
        assertThat(response.getBody().message()).contains("Audio too short");
    }

    @Test
    void verifiesDownloadFailureReturns502() {
        ResponseEntity<ApiError> response = handler.handleDownloadFailure(
                new DownloadFailedException("http://cdn.example/a.wav", "HTTP 404", 404));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_GATEWAY);
        assertThat(response.getBody().errorCode()).isEqualTo("DOWNLOAD_FAILED");
        assertThat(response.getBody().retryable()).isTrue();
        assertThat(response.getBody().message()).isEqualTo("Failed to download audio from http://cdn.example/a.wav: HTTP 404");
    }

    @Test
    void verifiesDownloadTimeoutReturns504() {
        ResponseEntity<ApiError> response = handler.handleDownloadFailure(
                new DownloadTimeoutException("http://cdn.example/a.wav", 5_000, new SocketTimeoutException()));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.GATEWAY_TIMEOUT);
        assertThat(response.getBody().errorCode()).isEqualTo("DOWNLOAD_TIMEOUT");
    }

    @Test
    void verifiesModelUnavailableReturns503AndRetryable() {
        ResponseEntity<ApiError> response = handler.handleModelUnavailable(new ModelUnavailableException(
                "iic/speech_campplus_sv_zh-cn_16k-common", 3, "worker exited", null));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().errorCode()).isEqualTo("MODEL_UNAVAILABLE");
        assertThat(response.getBody().retryable()).isTrue();
        assertThat(response.getBody().message()).isEqualTo("Speaker verification model unavailable");
    }

    @Test
    void verifiesExtractionFailureDoesNotExposeWorkerOutput() {
        ResponseEntity<ApiError> response = handler.handleExtractionFailure(new ExtractionException(
                "Embedding worker exited (stderr=/secret/internal/path/model.bin missing)", "process"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().errorCode()).isEqualTo("EXTRACTION_FAILED");
        assertThat(response.getBody().message()).doesNotContain("/secret/internal/path");
    }

    @Test
    void verifiesExtractionTimeoutReturns503() {
        ResponseEntity<ApiError> response = handler.handleExtractionFailure(
                new ExtractionTimeoutException("no answer", "process", 30_000));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().errorCode()).isEqualTo("EXTRACTION_TIMEOUT");
    }

    @Test
    void verifiesGenericApplicationErrorReturns500WithoutDetails() {
        ResponseEntity<ApiError> response = handler.handleApplicationError(
                new SpeakerVerifyException("cache directory /var/secret not writable"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().errorCode()).isEqualTo("INTERNAL_ERROR");
        assertThat(response.getBody().message()).doesNotContain("/var/secret");
    }

    @Test
    void verifiesMissingPartReturns400() {
        ResponseEntity<ApiError> response = handler.handleMalformedRequest(new MissingServletRequestPartException("audio2"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().errorCode()).isEqualTo("INVALID_REQUEST");
        assertThat(response.getBody().message()).contains("audio2");
    }

    @Test
    void verifiesUnsupportedMediaTypeReturns415() {
        ResponseEntity<ApiError> response = handler.handleUnsupportedMediaType(
                new HttpMediaTypeNotSupportedException(MediaType.TEXT_PLAIN, List.of(MediaType.APPLICATION_JSON)));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNSUPPORTED_MEDIA_TYPE);
    }

    @Test
    void verifiesOversizedUploadIsValidationFailure() {
        ResponseEntity<ApiError> response = handler.handleUploadTooLarge(new MaxUploadSizeExceededException(1024));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().errorCode()).isEqualTo("VALIDATION_FAILED");
    }

    @Test
    void verifiesFrameworkErrorsKeepTheirStatus() {
        ResponseEntity<ApiError> response = handler.handleUnexpected(new HttpRequestMethodNotSupportedException("PUT"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.METHOD_NOT_ALLOWED);
        assertThat(response.getBody().errorCode()).isEqualTo("INVALID_REQUEST");
    }

    @Test
    void verifiesUnexpectedExceptionReturns500() {
        ResponseEntity<ApiError> response = handler.handleUnexpected(new IllegalStateException("boom at /opt/app"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().message()).isEqualTo("An unexpected error occurred");
    }

    @Test
    void verifiesTimestampIsRecent() {
        Instant before = Instant.now().minusSeconds(1);

        ResponseEntity<ApiError> response = handler.handleClientError(new InvalidRequestException("bad"));

        assertThat(response.getBody().timestamp()).isBetween(before, Instant.now().plusSeconds(1));
    }
}
