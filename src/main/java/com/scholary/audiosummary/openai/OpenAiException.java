package com.scholary.audiosummary.openai;

/**
 * Exception thrown when a call to the OpenAI API fails.
 *
 * <p>Callers translate it into the failure of whatever they were doing (transcription,
 * summarization or synthesis).
 */
public class OpenAiException extends RuntimeException {

  private final int statusCode;

  public OpenAiException(String message, int statusCode) {
    super(message);
    this.statusCode = statusCode;
  }

  public OpenAiException(String message, Throwable cause) {
    super(message, cause);
    this.statusCode = -1;
  }

  /** HTTP status of the failed call, or -1 if no response arrived. */
  public int getStatusCode() {
    return statusCode;
  }
}
