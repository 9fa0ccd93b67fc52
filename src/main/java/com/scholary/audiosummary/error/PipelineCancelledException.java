package com.scholary.audiosummary.error;

/**
 * Thrown when a run observes its cancellation signal.
 *
 * <p>Work already dispatched to a backend finishes on its own terms; this exception only stops new
 * work from being scheduled.
 */
public class PipelineCancelledException extends AudioSummaryException {

  public PipelineCancelledException(String message) {
    super(ErrorCode.CANCELLED, message);
  }

  public PipelineCancelledException(String message, Throwable cause) {
    super(ErrorCode.CANCELLED, message, cause);
  }
}
