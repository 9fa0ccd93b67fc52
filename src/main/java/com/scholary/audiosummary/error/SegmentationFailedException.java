package com.scholary.audiosummary.error;

/** Thrown when an oversized audio file could not be split into segments. */
public class SegmentationFailedException extends AudioSummaryException {

  public SegmentationFailedException(String message) {
    super(ErrorCode.SEGMENTATION_FAILED, message);
  }

  public SegmentationFailedException(String message, Throwable cause) {
    super(ErrorCode.SEGMENTATION_FAILED, message, cause);
  }
}
