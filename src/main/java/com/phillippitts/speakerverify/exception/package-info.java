/**
 * Application-specific exception hierarchy.
 *
 * <p>All exceptions extend {@link com.phillippitts.speakerverify.exception.SpeakerVerifyException}
 * and are translated to HTTP responses by
 * {@code com.phillippitts.speakerverify.presentation.exception.GlobalExceptionHandler}.
 *
 * <ul>
 *   <li>{@link com.phillippitts.speakerverify.exception.InvalidRequestException} and
 *       {@link com.phillippitts.speakerverify.exception.InvalidSourceException} - malformed input (400)</li>
 *   <li>{@link com.phillippitts.speakerverify.exception.ValidationFailedException} - audio violates
 *       size, format or duration limits (400)</li>
 *   <li>{@link com.phillippitts.speakerverify.exception.DownloadFailedException} - remote fetch failed
 *       (502, or 504 for {@link com.phillippitts.speakerverify.exception.DownloadTimeoutException})</li>
 *   <li>{@link com.phillippitts.speakerverify.exception.ModelUnavailableException} - model could not be
 *       loaded (503, retryable)</li>
 *   <li>{@link com.phillippitts.speakerverify.exception.ExtractionException} - extractor failure
 *       (503, retryable)</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.speakerverify.exception;
