package com.scholary.audiosummary.error;

/** Thrown when the source audio cannot be fetched from its URL. */
public class DownloadFailedException extends AudioSummaryException {

  public DownloadFailedException(String message) {
    super(ErrorCode.DOWNLOAD_FAILED, message);
  }

  public DownloadFailedException(String message, Throwable cause) {
    super(ErrorCode.DOWNLOAD_FAILED, message, cause);
  }
}
