package com.scholary.whisper.gateway.api;

import com.scholary.whisper.gateway.whisper.InvalidAudioPathException;
import com.scholary.whisper.gateway.whisper.WhisperApplicationException;
import com.scholary.whisper.gateway.whisper.WhisperCallCancelledException;
import com.scholary.whisper.gateway.whisper.WhisperConnectionException;
import com.scholary.whisper.gateway.whisper.WhisperException;
import com.scholary.whisper.gateway.whisper.WhisperTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

/**
 * Turns exceptions into HTTP responses with an {@code {"error": "..."}} body.
 *
 * <p>Backend failures map to 5xx codes by cause: unreachable is 503, too slow is 504, and a
 * backend that answered with an error or garbage is 502. Bad input is 400.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler({MissingServletRequestPartException.class})
  public ResponseEntity<ErrorResponse> handleMissingFile(MissingServletRequestPartException ex) {
    LOGGER.warn("Rejected request without '{}' part", ex.getRequestPartName());
    return error(HttpStatus.BAD_REQUEST, "File not found in request");
  }

  @ExceptionHandler({MissingServletRequestParameterException.class})
  public ResponseEntity<ErrorResponse> handleMissingParameter(
      MissingServletRequestParameterException ex) {
    LOGGER.warn("Rejected request without '{}' parameter", ex.getParameterName());
    return error(HttpStatus.BAD_REQUEST, ex.getMessage());
  }

  @ExceptionHandler({IllegalArgumentException.class, InvalidAudioPathException.class})
  public ResponseEntity<ErrorResponse> handleBadRequest(RuntimeException ex) {
    LOGGER.warn("Rejected request: {}", ex.getMessage());
    return error(HttpStatus.BAD_REQUEST, ex.getMessage());
  }

  @ExceptionHandler(MaxUploadSizeExceededException.class)
  public ResponseEntity<ErrorResponse> handleUploadTooLarge(MaxUploadSizeExceededException ex) {
    LOGGER.warn("Rejected upload: {}", ex.getMessage());
    return error(HttpStatus.PAYLOAD_TOO_LARGE, "Uploaded file is too large");
  }

  @ExceptionHandler(WhisperApplicationException.class)
  public ResponseEntity<ErrorResponse> handleBackendError(WhisperApplicationException ex) {
    LOGGER.warn("Whisper backend reported an error: {}", ex.getMessage());
    return error(HttpStatus.BAD_GATEWAY, "Transcription failed: " + ex.getMessage());
  }

  @ExceptionHandler({WhisperConnectionException.class, WhisperCallCancelledException.class})
  public ResponseEntity<ErrorResponse> handleUnavailable(WhisperException ex) {
    LOGGER.error("Whisper backend unavailable: {}", ex.getMessage());
    return error(HttpStatus.SERVICE_UNAVAILABLE, "Transcription service unavailable");
  }

  @ExceptionHandler(TaskRejectedException.class)
  public ResponseEntity<ErrorResponse> handleQueueFull(TaskRejectedException ex) {
    LOGGER.warn("Async job rejected: {}", ex.getMessage());
    return error(HttpStatus.SERVICE_UNAVAILABLE, "Transcription queue is full, retry later");
  }

  @ExceptionHandler(WhisperTimeoutException.class)
  public ResponseEntity<ErrorResponse> handleTimeout(WhisperTimeoutException ex) {
    LOGGER.error("Whisper backend timed out: {}", ex.getMessage());
    return error(HttpStatus.GATEWAY_TIMEOUT, "Transcription service timed out");
  }

  /** Transport and protocol failures: the backend was reached but the exchange broke. */
  @ExceptionHandler(WhisperException.class)
  public ResponseEntity<ErrorResponse> handleBackendFailure(WhisperException ex) {
    LOGGER.error("Whisper call failed: kind={}", ex.kind(), ex);
    return error(HttpStatus.BAD_GATEWAY, "Error talking to transcription service");
  }

  /** Catch-all for unexpected errors. Spring MVC's own exceptions keep their default mapping. */
  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ErrorResponse> handleUnexpected(RuntimeException ex) {
    LOGGER.error("Unexpected error", ex);
    return error(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred");
  }

  private static ResponseEntity<ErrorResponse> error(HttpStatus status, String message) {
    return ResponseEntity.status(status).body(new ErrorResponse(message));
  }
}
