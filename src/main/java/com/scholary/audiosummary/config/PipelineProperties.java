package com.scholary.audiosummary.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the summary pipeline.
 *
 * <p>Controls scratch space, thread pools, segmenting limits, summary length and job retention.
 */
@ConfigurationProperties(prefix = "pipeline")
@Validated
public record PipelineProperties(
    @NotBlank String tempDir,
    @Positive int jobExecutorThreads,
    @Positive int jobExecutorQueueSize,
    @NotNull @Valid DownloadProperties download,
    @NotNull @Valid TranscriptionProperties transcription,
    @NotNull @Valid SummaryProperties summary,
    @NotNull @Valid JobProperties jobs,
    @NotNull @Valid SseProperties sse) {

  public record DownloadProperties(
      @Positive int connectTimeoutSeconds, @NotBlank String userAgent) {}

  /**
   * Segmenting and fan-out limits.
   *
   * <p>{@code maxFileSizeBytes} is the size above which a file is split before transcription. It
   * sits well under the backend's real upload limit.
   */
  public record TranscriptionProperties(
      @Positive long maxFileSizeBytes,
      @Positive int maxConcurrentCalls,
      @PositiveOrZero double overlapSeconds,
      @Positive int minChunkSeconds,
      @Positive int maxChunkSeconds,
      @Positive @DecimalMax("1.0") double safetyFactor) {}

  public record SummaryProperties(@Positive int targetWords, @PositiveOrZero int toleranceWords) {

    /** Word count above which one compression pass is issued. */
    public int compressionThreshold() {
      return targetWords + toleranceWords;
    }
  }

  public record JobProperties(@Positive long maxSize, @Positive long expireAfterMinutes) {}

  public record SseProperties(@Positive int queueCapacity, @Positive long timeoutMinutes) {}
}
