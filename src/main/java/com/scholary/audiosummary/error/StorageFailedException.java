package com.scholary.audiosummary.error;

/** Thrown when the object store or metadata store cannot complete an operation. */
public class StorageFailedException extends AudioSummaryException {

  public StorageFailedException(String message) {
    super(ErrorCode.STORAGE_FAILED, message);
  }

  public StorageFailedException(String message, Throwable cause) {
    super(ErrorCode.STORAGE_FAILED, message, cause);
  }
}
