package com.scholary.audiosummary.metadata;

import java.time.Instant;

/**
 * The artifacts of one successful pipeline run. Its presence is what makes a later run for the
 * same key a cache hit.
 */
public record SummaryRecord(
    String cacheKey,
    String transcriptKey,
    String summaryTextKey,
    String summaryAudioKey,
    int transcriptWordCount,
    int summaryWordCount,
    Instant processedAt) {}
