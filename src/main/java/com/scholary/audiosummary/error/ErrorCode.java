package com.scholary.audiosummary.error;

/** Classifies a pipeline failure so callers can react without inspecting exception types. */
public enum ErrorCode {
  INVALID_ARGUMENT,
  NOT_FOUND,
  SEGMENTATION_FAILED,
  PROBE_FAILED,
  CLIP_FAILED,
  TRANSCRIPTION_FAILED,
  SUMMARIZATION_FAILED,
  SYNTHESIS_FAILED,
  STORAGE_FAILED,
  DOWNLOAD_FAILED,
  CANCELLED
}
