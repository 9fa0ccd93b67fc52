package com.scholary.audiosummary.pipeline;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One progress event. Transient: produced by the pipeline, handed to a {@link ProgressSink} and
 * never stored.
 *
 * <p>Optional fields are null when a stage has nothing to say about them and are left out of the
 * JSON form.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProcessingStatus(
    ProcessingStage stage,
    String message,
    int progress,
    String episodeId,
    Boolean wasCached,
    Integer transcriptWordCount,
    Integer summaryWordCount,
    String summaryText,
    String summaryAudioPath,
    @JsonProperty("isComplete") boolean complete,
    @JsonProperty("isError") boolean error,
    String errorMessage,
    Long processingDurationMs) {

  public static ProcessingStatus downloading(String episodeId, boolean wasCached) {
    String message = wasCached ? "Retrieving episode from cache..." : "Downloading episode...";
    return progress(ProcessingStage.DOWNLOADING, message, episodeId, wasCached);
  }

  public static ProcessingStatus downloaded(String episodeId, boolean wasCached) {
    String message = wasCached ? "Episode retrieved from cache" : "Episode downloaded";
    return progress(ProcessingStage.DOWNLOADED, message, episodeId, wasCached);
  }

  public static ProcessingStatus transcribing(String episodeId) {
    return progress(ProcessingStage.TRANSCRIBING, "Transcribing audio...", episodeId, null);
  }

  public static ProcessingStatus transcribed(String episodeId, int transcriptWordCount) {
    return new ProcessingStatus(
        ProcessingStage.TRANSCRIBED,
        "Transcription complete",
        ProcessingStage.TRANSCRIBED.progress(),
        episodeId,
        null,
        transcriptWordCount,
        null,
        null,
        null,
        false,
        false,
        null,
        null);
  }

  public static ProcessingStatus summarizing(String episodeId) {
    return progress(ProcessingStage.SUMMARIZING, "Summarizing transcript...", episodeId, null);
  }

  public static ProcessingStatus summarized(
      String episodeId, int transcriptWordCount, int summaryWordCount, String summaryText) {
    return new ProcessingStatus(
        ProcessingStage.SUMMARIZED,
        "Summary ready",
        ProcessingStage.SUMMARIZED.progress(),
        episodeId,
        null,
        transcriptWordCount,
        summaryWordCount,
        summaryText,
        null,
        false,
        false,
        null,
        null);
  }

  public static ProcessingStatus generatingSpeech(String episodeId) {
    return progress(
        ProcessingStage.GENERATING_SPEECH, "Generating summary audio...", episodeId, null);
  }

  public static ProcessingStatus complete(PipelineResult result) {
    return new ProcessingStatus(
        ProcessingStage.COMPLETE,
        result.summaryWasCached() ? "Summary retrieved from cache" : "Processing complete!",
        ProcessingStage.COMPLETE.progress(),
        result.cacheKey(),
        result.episodeWasCached(),
        result.transcriptWordCount(),
        result.summaryWordCount(),
        result.summaryText(),
        result.summaryAudioKey(),
        true,
        false,
        null,
        result.processingDurationMs());
  }

  public static ProcessingStatus error(String message, String errorMessage) {
    return new ProcessingStatus(
        ProcessingStage.ERROR,
        message,
        ProcessingStage.ERROR.progress(),
        null,
        null,
        null,
        null,
        null,
        null,
        false,
        true,
        errorMessage,
        null);
  }

  private static ProcessingStatus progress(
      ProcessingStage stage, String message, String episodeId, Boolean wasCached) {
    return new ProcessingStatus(
        stage,
        message,
        stage.progress(),
        episodeId,
        wasCached,
        null,
        null,
        null,
        null,
        false,
        false,
        null,
        null);
  }
}
