package com.scholary.audiosummary.error;

/** Thrown when a cache key has no stored episode or summary, or a stored object is missing. */
public class NotFoundException extends AudioSummaryException {

  public NotFoundException(String message) {
    super(ErrorCode.NOT_FOUND, message);
  }

  public NotFoundException(String message, Throwable cause) {
    super(ErrorCode.NOT_FOUND, message, cause);
  }
}
