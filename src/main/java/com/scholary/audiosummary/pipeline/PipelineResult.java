package com.scholary.audiosummary.pipeline;

/**
 * Outcome of a successful run.
 *
 * @param cacheKey the key every artifact is stored under
 * @param summaryAudioKey object key of the summary audio, the run's artifact handle
 * @param summaryText the summary, trimmed for presentation
 * @param transcriptWordCount words in the transcript
 * @param summaryWordCount words in the summary
 * @param episodeWasCached whether the source audio came from the store rather than the network
 * @param summaryWasCached whether the whole run was served from a stored summary
 * @param processingDurationMs wall-clock time of the run
 */
public record PipelineResult(
    String cacheKey,
    String summaryAudioKey,
    String summaryText,
    int transcriptWordCount,
    int summaryWordCount,
    boolean episodeWasCached,
    boolean summaryWasCached,
    long processingDurationMs) {}
