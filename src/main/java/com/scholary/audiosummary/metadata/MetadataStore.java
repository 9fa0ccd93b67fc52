package com.scholary.audiosummary.metadata;

import java.util.Optional;

/** Persistence for episode and summary records, keyed by cache key. */
public interface MetadataStore {

  Optional<EpisodeRecord> findEpisode(String cacheKey);

  void saveEpisode(EpisodeRecord episode);

  Optional<SummaryRecord> findSummary(String cacheKey);

  void saveSummary(SummaryRecord summary);

  default boolean episodeExists(String cacheKey) {
    return findEpisode(cacheKey).isPresent();
  }

  default boolean summaryExists(String cacheKey) {
    return findSummary(cacheKey).isPresent();
  }
}
