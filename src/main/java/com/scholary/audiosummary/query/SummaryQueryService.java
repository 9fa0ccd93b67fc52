package com.scholary.audiosummary.query;

import com.scholary.audiosummary.cache.CacheKeyService;
import com.scholary.audiosummary.error.NotFoundException;
import com.scholary.audiosummary.metadata.EpisodeRecord;
import com.scholary.audiosummary.metadata.MetadataStore;
import com.scholary.audiosummary.metadata.SummaryRecord;
import com.scholary.audiosummary.objectstore.ObjectStoreClient;
import com.scholary.audiosummary.util.TextUtils;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Read-only lookups over stored artifacts.
 *
 * <p>Every method accepts a source URL or a cache key, so a client can ask about a URL without
 * knowing how keys are derived.
 */
@Service
public class SummaryQueryService {

  private static final Logger LOGGER = LoggerFactory.getLogger(SummaryQueryService.class);

  private final CacheKeyService cacheKeyService;
  private final MetadataStore metadataStore;
  private final ObjectStoreClient objectStore;

  public SummaryQueryService(
      CacheKeyService cacheKeyService, MetadataStore metadataStore, ObjectStoreClient objectStore) {
    this.cacheKeyService = cacheKeyService;
    this.metadataStore = metadataStore;
    this.objectStore = objectStore;
  }

  /**
   * Describe what is stored for a source.
   *
   * @throws NotFoundException if neither the episode nor its summary is stored
   */
  public EpisodeResult getResult(String episodeId) {
    String cacheKey = cacheKeyService.deriveKey(episodeId);
    Optional<EpisodeRecord> episode = metadataStore.findEpisode(cacheKey);
    Optional<SummaryRecord> summary = metadataStore.findSummary(cacheKey);
    if (episode.isEmpty() && summary.isEmpty()) {
      throw new NotFoundException("Episode not found: " + cacheKey);
    }
    String sourceUrl = episode.map(EpisodeRecord::sourceUrl).orElse(null);

    if (summary.isEmpty()) {
      return new EpisodeResult(cacheKey, sourceUrl, false, null, null, null, null, null);
    }

    SummaryRecord record = summary.get();
    String summaryText =
        new String(objectStore.getBytes(record.summaryTextKey()), StandardCharsets.UTF_8);
    LOGGER.debug("Loaded stored summary: cacheKey={}", cacheKey);
    return new EpisodeResult(
        cacheKey,
        sourceUrl,
        true,
        TextUtils.trimNonAlphanumeric(summaryText),
        record.transcriptWordCount(),
        record.summaryWordCount(),
        record.processedAt(),
        "/api/summaries/" + cacheKey + "/audio");
  }

  /**
   * Open the stored summary audio.
   *
   * @throws NotFoundException if no summary is stored for the source
   */
  public AudioContent openSummaryAudio(String episodeId) {
    String cacheKey = cacheKeyService.deriveKey(episodeId);
    SummaryRecord record =
        metadataStore
            .findSummary(cacheKey)
            .orElseThrow(() -> new NotFoundException("Summary not found: " + cacheKey));
    return open(record.summaryAudioKey(), cacheKey + "_summary.mp3");
  }

  /**
   * Open the stored episode audio.
   *
   * @throws NotFoundException if the episode was never downloaded
   */
  public AudioContent openEpisodeAudio(String episodeId) {
    String cacheKey = cacheKeyService.deriveKey(episodeId);
    String storageKey =
        metadataStore
            .findEpisode(cacheKey)
            .map(EpisodeRecord::storageKey)
            .orElseThrow(() -> new NotFoundException("Episode not found: " + cacheKey));
    return open(storageKey, cacheKey + ".mp3");
  }

  private AudioContent open(String storageKey, String fileName) {
    long length = objectStore.getObjectMetadata(storageKey).contentLength();
    return new AudioContent(fileName, length, objectStore.getObjectStream(storageKey));
  }
}
