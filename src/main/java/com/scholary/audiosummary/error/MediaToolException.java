package com.scholary.audiosummary.error;

/** Failure of an external media tool invocation (ffprobe or ffmpeg). */
public abstract class MediaToolException extends AudioSummaryException {

  private final int exitCode;

  protected MediaToolException(ErrorCode errorCode, String message, int exitCode) {
    super(errorCode, message);
    this.exitCode = exitCode;
  }

  protected MediaToolException(ErrorCode errorCode, String message, Throwable cause) {
    super(errorCode, message, cause);
    this.exitCode = -1;
  }

  /** The process exit code, or -1 when the process never completed. */
  public int getExitCode() {
    return exitCode;
  }
}
