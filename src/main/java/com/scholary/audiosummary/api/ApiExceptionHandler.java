package com.scholary.audiosummary.api;

import com.scholary.audiosummary.error.AudioSummaryException;
import com.scholary.audiosummary.error.ErrorCode;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Maps the error taxonomy onto HTTP statuses with an {@link ErrorResponse} body. */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(AudioSummaryException.class)
  public ResponseEntity<ErrorResponse> handleAudioSummaryException(AudioSummaryException ex) {
    HttpStatus status = statusFor(ex.getErrorCode());
    if (status.is5xxServerError()) {
      LOGGER.error("Request failed: code={}, message={}", ex.getErrorCode(), ex.getMessage(), ex);
    } else {
      LOGGER.info("Request rejected: code={}, message={}", ex.getErrorCode(), ex.getMessage());
    }
    return build(status, ex.getErrorCode(), ex.getMessage());
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
    LOGGER.warn("Invalid argument provided: {}", ex.getMessage());
    return build(HttpStatus.BAD_REQUEST, ErrorCode.INVALID_ARGUMENT, ex.getMessage());
  }

  @ExceptionHandler(BindException.class)
  public ResponseEntity<ErrorResponse> handleValidation(BindException ex) {
    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .collect(Collectors.joining("; "));
    LOGGER.warn("Validation failed: {}", message);
    return build(HttpStatus.BAD_REQUEST, ErrorCode.INVALID_ARGUMENT, message);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
    LOGGER.warn("Unreadable request body: {}", ex.getMessage());
    return build(HttpStatus.BAD_REQUEST, ErrorCode.INVALID_ARGUMENT, "Malformed request body");
  }

  @ExceptionHandler(TaskRejectedException.class)
  public ResponseEntity<ErrorResponse> handleRejected(TaskRejectedException ex) {
    LOGGER.warn("Job executor saturated: {}", ex.getMessage());
    return build(
        HttpStatus.SERVICE_UNAVAILABLE, null, "Server is busy, try again later");
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ErrorResponse> handleRuntimeException(RuntimeException ex) {
    LOGGER.error("Unexpected error occurred", ex);
    return build(HttpStatus.INTERNAL_SERVER_ERROR, null, "An unexpected error occurred");
  }

  static HttpStatus statusFor(ErrorCode code) {
    switch (code) {
      case INVALID_ARGUMENT:
        return HttpStatus.BAD_REQUEST;
      case NOT_FOUND:
        return HttpStatus.NOT_FOUND;
      case CANCELLED:
        return HttpStatus.SERVICE_UNAVAILABLE;
      case SEGMENTATION_FAILED:
      case PROBE_FAILED:
      case CLIP_FAILED:
      case TRANSCRIPTION_FAILED:
      case SUMMARIZATION_FAILED:
      case SYNTHESIS_FAILED:
      case DOWNLOAD_FAILED:
        return HttpStatus.BAD_GATEWAY;
      case STORAGE_FAILED:
      default:
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }
  }

  private static ResponseEntity<ErrorResponse> build(
      HttpStatus status, ErrorCode code, String message) {
    return ResponseEntity.status(status).body(new ErrorResponse(code, message));
  }
}
