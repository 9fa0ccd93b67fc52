package com.scholary.audiosummary.error;

/** Thrown when the transcription backend rejects or fails a request. */
public class TranscriptionFailedException extends AudioSummaryException {

  public TranscriptionFailedException(String message) {
    super(ErrorCode.TRANSCRIPTION_FAILED, message);
  }

  public TranscriptionFailedException(String message, Throwable cause) {
    super(ErrorCode.TRANSCRIPTION_FAILED, message, cause);
  }
}
