package com.scholary.audiosummary.metadata;

import java.time.Instant;

/**
 * A downloaded source episode. Written once, on first successful download.
 *
 * @param cacheKey the key derived from the source URL
 * @param sourceUrl the URL the audio was downloaded from
 * @param storageKey object key of the stored audio
 * @param sizeBytes size of the stored audio
 * @param downloadedAt when the download finished
 */
public record EpisodeRecord(
    String cacheKey, String sourceUrl, String storageKey, long sizeBytes, Instant downloadedAt) {}
