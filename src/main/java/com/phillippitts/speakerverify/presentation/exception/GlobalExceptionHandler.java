package com.phillippitts.speakerverify.presentation.exception;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.phillippitts.speakerverify.exception.DownloadFailedException;
import com.phillippitts.speakerverify.exception.DownloadTimeoutException;
import com.phillippitts.speakerverify.exception.ExtractionException;
import com.phillippitts.speakerverify.exception.InvalidRequestException;
import com.phillippitts.speakerverify.exception.ModelUnavailableException;
import com.phillippitts.speakerverify.exception.SpeakerVerifyException;
import com.phillippitts.speakerverify.exception.ValidationFailedException;
import com.phillippitts.speakerverify.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.time.Instant;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Client errors echo the exception message; service-side errors only expose
 * {@link SpeakerVerifyException#getClientMessage()} so worker output and file paths stay in the logs.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Client error - bad input shape, unsupported source or failed validation (HTTP 400).
     */
    @ExceptionHandler({InvalidRequestException.class, ValidationFailedException.class})
    ResponseEntity<ApiError> handleClientError(SpeakerVerifyException ex) {
        LOG.warn("Rejected request: code={}, reason={}", ex.getErrorCode(), LogSanitizer.truncate(ex.getMessage(), 200));
        return build(HttpStatus.BAD_REQUEST, ex, ex.getMessage(), null);
    }

    /**
     * Upstream audio server answered badly or the fetch timed out (HTTP 502 / 504).
     */
    @ExceptionHandler(DownloadFailedException.class)
    ResponseEntity<ApiError> handleDownloadFailure(DownloadFailedException ex) {
        HttpStatus status = ex instanceof DownloadTimeoutException
                ? HttpStatus.GATEWAY_TIMEOUT
                : HttpStatus.BAD_GATEWAY;
        LOG.warn("Audio download failed: url={}, status={}, reason={}",
                LogSanitizer.redactUrl(ex.getUrl()), ex.getStatusCode(), ex.getMessage());
        return build(status, ex, ex.getClientMessage(), "Check that the audio URL is reachable");
    }

    /**
     * Model could not be loaded in time - retry possible (HTTP 503).
     */
    @ExceptionHandler(ModelUnavailableException.class)
    ResponseEntity<ApiError> handleModelUnavailable(ModelUnavailableException ex) {
        LOG.error("Model unavailable: {}", ex.getMessage());
        return build(HttpStatus.SERVICE_UNAVAILABLE, ex, ex.getClientMessage(), "Please retry in a few seconds");
    }

    /**
     * Transient extractor failure - retry possible (HTTP 503).
     */
    @ExceptionHandler(ExtractionException.class)
    ResponseEntity<ApiError> handleExtractionFailure(ExtractionException ex) {
        LOG.error("Embedding extraction failed: extractor={}", ex.getExtractorName(), ex);
        return build(HttpStatus.SERVICE_UNAVAILABLE, ex, ex.getClientMessage(), "Please retry in a few seconds");
    }

    /**
     * Any other application exception (HTTP 500).
     */
    @ExceptionHandler(SpeakerVerifyException.class)
    ResponseEntity<ApiError> handleApplicationError(SpeakerVerifyException ex) {
        LOG.error("Unhandled application error", ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, ex, "An unexpected error occurred",
                "Please contact support with request ID");
    }

    /**
     * Malformed or incomplete HTTP request (HTTP 400).
     */
    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MissingServletRequestPartException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class
    })
    ResponseEntity<ApiError> handleMalformedRequest(Exception ex) {
        LOG.warn("Malformed request: {}", LogSanitizer.truncate(ex.getMessage(), 200));
        String message = ex instanceof HttpMessageNotReadableException
                ? "Request body is missing or not valid JSON"
                : ex.getMessage();
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ApiError.of("INVALID_REQUEST", message, null, false));
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    ResponseEntity<ApiError> handleUnsupportedMediaType(HttpMediaTypeNotSupportedException ex) {
        return ResponseEntity.status(HttpStatus.UNSUPPORTED_MEDIA_TYPE)
                .body(ApiError.of("INVALID_REQUEST", ex.getMessage(),
                        "Use multipart/form-data for uploads or application/json", false));
    }

    /**
     * Upload larger than the multipart limit (HTTP 400).
     */
    @ExceptionHandler(MaxUploadSizeExceededException.class)
    ResponseEntity<ApiError> handleUploadTooLarge(MaxUploadSizeExceededException ex) {
        LOG.warn("Upload exceeds multipart limit: {}", ex.getMaxUploadSize());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ApiError.of("VALIDATION_FAILED", "Uploaded file is too large", null, false));
    }

    /**
     * Catch-all for unexpected errors (HTTP 500). Framework exceptions that already carry a
     * status (unknown route, wrong method) keep it.
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        if (ex instanceof ErrorResponse framework) {
            HttpStatusCode status = framework.getStatusCode();
            LOG.debug("Framework error {}: {}", status.value(), ex.getMessage());
            return ResponseEntity.status(status)
                    .body(ApiError.of(status.is4xxClientError() ? "INVALID_REQUEST" : "INTERNAL_ERROR",
                            framework.getBody().getDetail(), null, false));
        }
        LOG.error("Unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiError.of("INTERNAL_ERROR", "An unexpected error occurred",
                        "Please contact support with request ID", false));
    }

    private static ResponseEntity<ApiError> build(HttpStatus status, SpeakerVerifyException ex,
                                                  String message, String details) {
        return ResponseEntity.status(status)
                .body(ApiError.of(ex.getErrorCode(), message, details, ex.isRetryable()));
    }

    /**
     * Standardized error response for API clients.
     */
    record ApiError(
            @JsonProperty("success") boolean success,
            @JsonProperty("error_code") String errorCode,
            @JsonProperty("message") String message,
            @JsonProperty("details") String details,
            @JsonProperty("retryable") boolean retryable,
            @JsonProperty("timestamp") Instant timestamp
    ) {
        static ApiError of(String errorCode, String message, String details, boolean retryable) {
            return new ApiError(false, errorCode, message, details, retryable, Instant.now());
        }
    }
}
