package com.scholary.audiosummary.error;

public class ProbeFailedException extends MediaToolException {

  public ProbeFailedException(String message, int exitCode) {
    super(ErrorCode.PROBE_FAILED, message, exitCode);
  }

  public ProbeFailedException(String message, Throwable cause) {
    super(ErrorCode.PROBE_FAILED, message, cause);
  }
}
