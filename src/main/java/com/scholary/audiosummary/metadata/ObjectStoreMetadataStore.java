package com.scholary.audiosummary.metadata;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.audiosummary.error.StorageFailedException;
import com.scholary.audiosummary.objectstore.ObjectStoreClient;
import java.io.IOException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Stores records as JSON documents next to the artifacts they describe.
 *
 * <p>The record is written after the artifacts it points at, so a record that exists always refers
 * to stored objects.
 */
@Component
public class ObjectStoreMetadataStore implements MetadataStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(ObjectStoreMetadataStore.class);
  private static final String JSON = "application/json";

  private final ObjectStoreClient objectStore;
  private final ObjectMapper objectMapper;

  public ObjectStoreMetadataStore(ObjectStoreClient objectStore, ObjectMapper objectMapper) {
    this.objectStore = objectStore;
    this.objectMapper = objectMapper;
  }

  @Override
  public Optional<EpisodeRecord> findEpisode(String cacheKey) {
    return read(ArtifactLayout.episodeRecord(cacheKey), EpisodeRecord.class);
  }

  @Override
  public void saveEpisode(EpisodeRecord episode) {
    write(ArtifactLayout.episodeRecord(episode.cacheKey()), episode);
    LOGGER.info("Saved episode record: cacheKey={}", episode.cacheKey());
  }

  @Override
  public Optional<SummaryRecord> findSummary(String cacheKey) {
    return read(ArtifactLayout.summaryRecord(cacheKey), SummaryRecord.class);
  }

  @Override
  public void saveSummary(SummaryRecord summary) {
    write(ArtifactLayout.summaryRecord(summary.cacheKey()), summary);
    LOGGER.info("Saved summary record: cacheKey={}", summary.cacheKey());
  }

  private <T> Optional<T> read(String key, Class<T> type) {
    if (!objectStore.exists(key)) {
      return Optional.empty();
    }
    try {
      return Optional.of(objectMapper.readValue(objectStore.getBytes(key), type));
    } catch (IOException e) {
      throw new StorageFailedException("Corrupt metadata document: " + key, e);
    }
  }

  private void write(String key, Object record) {
    byte[] json;
    try {
      json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(record);
    } catch (JsonProcessingException e) {
      throw new StorageFailedException("Failed to serialize metadata: " + key, e);
    }
    objectStore.putBytes(key, json, JSON);
  }
}
