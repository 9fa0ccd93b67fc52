package com.scholary.audiosummary.error;

/**
 * Base class for every failure the summary pipeline raises on purpose.
 *
 * <p>These are runtime exceptions: a failed segment, a failed backend call or a storage outage
 * aborts the whole run and there is nothing a caller further down the stack could do to recover.
 * The {@link ErrorCode} lets the HTTP layer and the progress stream report the failure class
 * without a chain of instanceof checks.
 */
public abstract class AudioSummaryException extends RuntimeException {

  private final ErrorCode errorCode;

  protected AudioSummaryException(ErrorCode errorCode, String message) {
    super(message);
    this.errorCode = errorCode;
  }

  protected AudioSummaryException(ErrorCode errorCode, String message, Throwable cause) {
    super(message, cause);
    this.errorCode = errorCode;
  }

  public ErrorCode getErrorCode() {
    return errorCode;
  }
}
