package com.scholary.audiosummary.error;

/** Thrown when the summarization backend fails. */
public class SummarizationFailedException extends AudioSummaryException {

  public SummarizationFailedException(String message) {
    super(ErrorCode.SUMMARIZATION_FAILED, message);
  }

  public SummarizationFailedException(String message, Throwable cause) {
    super(ErrorCode.SUMMARIZATION_FAILED, message, cause);
  }
}
