/**
 * Translation of exceptions into HTTP error responses.
 *
 * <p>{@link com.phillippitts.speakerverify.presentation.exception.GlobalExceptionHandler} is the
 * single place that decides status codes. Every error body has the same shape:
 * {@code success=false}, {@code error_code}, {@code message}, {@code details},
 * {@code retryable} and {@code timestamp}.
 */
package com.phillippitts.speakerverify.presentation.exception;
