package com.scholary.audiosummary.query;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;

/**
 * What is stored for one source. Summary fields are null until a summary exists.
 *
 * @param summaryAudioPath API path serving the summary audio, null without a summary
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EpisodeResult(
    String episodeId,
    String sourceUrl,
    boolean summaryAvailable,
    String summaryText,
    Integer transcriptWordCount,
    Integer summaryWordCount,
    Instant processedAt,
    String summaryAudioPath) {}
