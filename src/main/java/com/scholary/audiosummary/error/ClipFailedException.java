package com.scholary.audiosummary.error;

public class ClipFailedException extends MediaToolException {

  public ClipFailedException(String message, int exitCode) {
    super(ErrorCode.CLIP_FAILED, message, exitCode);
  }

  public ClipFailedException(String message, Throwable cause) {
    super(ErrorCode.CLIP_FAILED, message, cause);
  }
}
