package com.scholary.audiosummary.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each event puts its fields into the MDC, logs one line, and clears the fields again so they
 * don't leak into unrelated log lines on the same thread. Run-scoped fields (run id, cache key)
 * are set once per run with {@link #setRunContext} and live until {@link #clearRunContext}.
 */
public class StructuredLogger {

  public static final String RUN_ID = "runId";
  public static final String CACHE_KEY = "cacheKey";
  public static final String JOB_ID = "jobId";

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log segment planning event. */
  public void logSegmentPlanned(int segmentIndex, double start, double length, double overlap) {
    try {
      MDC.put("event_type", "segment_planned");
      MDC.put("segment_index", String.valueOf(segmentIndex));
      MDC.put("start", String.valueOf(start));
      MDC.put("length", String.valueOf(length));
      MDC.put("overlapSeconds", String.valueOf(overlap));

      logger.debug(
          "Segment planned: index={}, start={}s, length={}s, overlap={}s",
          segmentIndex,
          start,
          length,
          overlap);
    } finally {
      clearEventFields();
    }
  }

  /** Log segment transcription started. */
  public void logSegmentStarted(int segmentIndex, int totalSegments) {
    try {
      MDC.put("event_type", "segment_started");
      MDC.put("segment_index", String.valueOf(segmentIndex));
      MDC.put("totalSegments", String.valueOf(totalSegments));

      logger.info("Transcribing segment {}/{}", segmentIndex + 1, totalSegments);
    } finally {
      clearEventFields();
    }
  }

  /** Log segment transcription finished. */
  public void logSegmentFinished(int segmentIndex, int totalSegments, long transcribeMs) {
    try {
      MDC.put("event_type", "segment_finished");
      MDC.put("segment_index", String.valueOf(segmentIndex));
      MDC.put("totalSegments", String.valueOf(totalSegments));
      MDC.put("transcribeMs", String.valueOf(transcribeMs));

      logger.debug(
          "Segment finished: index={}/{}, transcribe={}ms",
          segmentIndex + 1,
          totalSegments,
          transcribeMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log segment transcription failure. */
  public void logSegmentFailed(int segmentIndex, String errorType, String message) {
    try {
      MDC.put("event_type", "segment_failed");
      MDC.put("segment_index", String.valueOf(segmentIndex));
      MDC.put("errorType", errorType);

      logger.error("Segment failed: index={}, error={}, message={}", segmentIndex, errorType, message);
    } finally {
      clearEventFields();
    }
  }

  /** Log pipeline stage transition. */
  public void logStage(String stage, int progress, String message) {
    try {
      MDC.put("event_type", "pipeline_stage");
      MDC.put("stage", stage);
      MDC.put("progress", String.valueOf(progress));

      logger.info("Stage {} ({}%): {}", stage, progress, message);
    } finally {
      clearEventFields();
    }
  }

  /** Set run context in MDC. */
  public static void setRunContext(String runId, String cacheKey) {
    MDC.put(RUN_ID, runId);
    MDC.put(CACHE_KEY, cacheKey);
  }

  /** Clear run context from MDC. */
  public static void clearRunContext() {
    MDC.remove(RUN_ID);
    MDC.remove(CACHE_KEY);
  }

  /** Set async job context in MDC. */
  public static void setJobContext(String jobId) {
    MDC.put(JOB_ID, jobId);
  }

  public static void clearJobContext() {
    MDC.remove(JOB_ID);
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("segment_index");
    MDC.remove("start");
    MDC.remove("length");
    MDC.remove("overlapSeconds");
    MDC.remove("totalSegments");
    MDC.remove("transcribeMs");
    MDC.remove("errorType");
    MDC.remove("stage");
    MDC.remove("progress");
  }
}
