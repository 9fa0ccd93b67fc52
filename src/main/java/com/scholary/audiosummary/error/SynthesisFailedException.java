package com.scholary.audiosummary.error;

/** Thrown when speech synthesis fails. */
public class SynthesisFailedException extends AudioSummaryException {

  public SynthesisFailedException(String message) {
    super(ErrorCode.SYNTHESIS_FAILED, message);
  }

  public SynthesisFailedException(String message, Throwable cause) {
    super(ErrorCode.SYNTHESIS_FAILED, message, cause);
  }
}
