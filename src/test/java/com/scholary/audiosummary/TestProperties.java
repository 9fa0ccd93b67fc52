package com.scholary.audiosummary;

import com.scholary.audiosummary.config.PipelineProperties;
import java.nio.file.Path;

/** Pipeline settings for unit tests, production defaults unless a test needs otherwise. */
public final class TestProperties {

  public static final long DEFAULT_MAX_FILE_SIZE = 5L * 1024 * 1024;

  private TestProperties() {}

  public static PipelineProperties pipeline(Path tempDir) {
    return pipeline(tempDir, DEFAULT_MAX_FILE_SIZE, 10);
  }

  public static PipelineProperties pipeline(
      Path tempDir, long maxFileSizeBytes, int maxConcurrentCalls) {
    return new PipelineProperties(
        tempDir.toString(),
        2,
        10,
        new PipelineProperties.DownloadProperties(5, "audio-summary-test"),
        new PipelineProperties.TranscriptionProperties(
            maxFileSizeBytes, maxConcurrentCalls, 1.0, 60, 600, 0.9),
        new PipelineProperties.SummaryProperties(750, 50),
        new PipelineProperties.JobProperties(100, 10),
        new PipelineProperties.SseProperties(16, 1));
  }
}
