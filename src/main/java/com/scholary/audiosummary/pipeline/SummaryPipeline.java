package com.scholary.audiosummary.pipeline;

import com.scholary.audiosummary.cache.CacheKeyService;
import com.scholary.audiosummary.capability.Capabilities;
import com.scholary.audiosummary.capability.CapabilityProvider;
import com.scholary.audiosummary.capability.ProviderOverrides;
import com.scholary.audiosummary.config.PipelineProperties;
import com.scholary.audiosummary.download.EpisodeDownloader;
import com.scholary.audiosummary.error.AudioSummaryException;
import com.scholary.audiosummary.error.ErrorCode;
import com.scholary.audiosummary.error.NotFoundException;
import com.scholary.audiosummary.error.StorageFailedException;
import com.scholary.audiosummary.error.SynthesisFailedException;
import com.scholary.audiosummary.logging.StructuredLogger;
import com.scholary.audiosummary.metadata.ArtifactLayout;
import com.scholary.audiosummary.metadata.EpisodeRecord;
import com.scholary.audiosummary.metadata.MetadataStore;
import com.scholary.audiosummary.metadata.SummaryRecord;
import com.scholary.audiosummary.objectstore.ObjectStoreClient;
import com.scholary.audiosummary.summary.TwoPassSummarizer;
import com.scholary.audiosummary.transcription.ChunkedTranscriptionService;
import com.scholary.audiosummary.transcription.ScratchDirectory;
import com.scholary.audiosummary.util.TextUtils;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs a source through download, transcription, summarization and speech synthesis.
 *
 * <p>Stages run strictly in order, and each stage's output is stored before the next one starts:
 *
 * <ol>
 *   <li>derive the cache key
 *   <li>summary cache: a stored {@link SummaryRecord} ends the run with a single {@code complete}
 *       event
 *   <li>fetch the episode from the store, or download it and store it
 *   <li>transcribe, store the transcript
 *   <li>summarize, store the summary text
 *   <li>synthesize speech, store the audio, then the summary record
 * </ol>
 *
 * <p>Any failure produces exactly one {@code error} event and is then rethrown. Artifacts stored
 * before the failure are kept. Transcript and summary text are not used as resume points, so a
 * retried run redoes transcription and summarization unless the summary record exists.
 *
 * <p>Concurrent runs for the same key share one execution through {@link InFlightRuns}; a joining
 * caller sees only the terminal event. If the owner is cancelled, a joiner that was not cancelled
 * claims the key and runs it itself.
 */
@Service
public class SummaryPipeline {

  private static final Logger LOGGER = LoggerFactory.getLogger(SummaryPipeline.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private static final String TEXT = "text/plain; charset=utf-8";
  private static final String AUDIO = "audio/mpeg";

  private final CacheKeyService cacheKeyService;
  private final MetadataStore metadataStore;
  private final ObjectStoreClient objectStore;
  private final EpisodeDownloader downloader;
  private final ChunkedTranscriptionService transcriptionService;
  private final TwoPassSummarizer summarizer;
  private final CapabilityProvider capabilityProvider;
  private final InFlightRuns inFlightRuns;
  private final Path tempDir;

  public SummaryPipeline(
      CacheKeyService cacheKeyService,
      MetadataStore metadataStore,
      ObjectStoreClient objectStore,
      EpisodeDownloader downloader,
      ChunkedTranscriptionService transcriptionService,
      TwoPassSummarizer summarizer,
      CapabilityProvider capabilityProvider,
      InFlightRuns inFlightRuns,
      PipelineProperties properties) {
    this.cacheKeyService = cacheKeyService;
    this.metadataStore = metadataStore;
    this.objectStore = objectStore;
    this.downloader = downloader;
    this.transcriptionService = transcriptionService;
    this.summarizer = summarizer;
    this.capabilityProvider = capabilityProvider;
    this.inFlightRuns = inFlightRuns;
    this.tempDir = Paths.get(properties.tempDir());
  }

  /**
   * Produce (or fetch) the spoken summary for a source.
   *
   * @param sourceIdentifier a source URL or an existing cache key
   * @param overrides per-request backend settings, {@link ProviderOverrides#NONE} for defaults
   * @param sink receives progress events in order
   * @param signal cooperative cancellation, checked at the start of every stage
   * @return the run's result; {@link PipelineResult#summaryAudioKey()} is the audio artifact
   * @throws IllegalArgumentException if the identifier is missing
   * @throws AudioSummaryException if any stage fails
   */
  public PipelineResult run(
      String sourceIdentifier,
      ProviderOverrides overrides,
      ProgressSink sink,
      CancellationSignal signal) {
    long startNanos = System.nanoTime();

    String cacheKey = stage(sink, () -> cacheKeyService.deriveKey(sourceIdentifier));

    String runId = UUID.randomUUID().toString();
    StructuredLogger.setRunContext(runId, cacheKey);
    try {
      while (true) {
        try (InFlightRuns.Claim claim = inFlightRuns.claim(cacheKey)) {
          if (claim.isOwner()) {
            return own(claim, sourceIdentifier, cacheKey, overrides, sink, signal, startNanos);
          }
          Optional<PipelineResult> joined = join(claim, sink, signal);
          if (joined.isPresent()) {
            return joined.get();
          }
        }
      }
    } finally {
      StructuredLogger.clearRunContext();
    }
  }

  private PipelineResult own(
      InFlightRuns.Claim claim,
      String sourceIdentifier,
      String cacheKey,
      ProviderOverrides overrides,
      ProgressSink sink,
      CancellationSignal signal,
      long startNanos) {
    LOGGER.info("Starting pipeline run: source={}", sourceIdentifier);
    StageOutcome<PipelineResult> outcome =
        StageOutcome.attempt(
            () -> execute(sourceIdentifier, cacheKey, overrides, sink, signal, startNanos));
    if (outcome.isSuccess()) {
      claim.complete(outcome.value());
      return outcome.value();
    }
    claim.fail(outcome.failure());
    throw outcome.failure();
  }

  private PipelineResult execute(
      String sourceIdentifier,
      String cacheKey,
      ProviderOverrides overrides,
      ProgressSink sink,
      CancellationSignal signal,
      long startNanos) {

    Optional<SummaryRecord> cached = stage(sink, () -> metadataStore.findSummary(cacheKey));
    if (cached.isPresent()) {
      PipelineResult result = stage(sink, () -> fromCache(cached.get(), startNanos));
      LOGGER.info("Summary cache hit: cacheKey={}", cacheKey);
      emit(sink, ProcessingStatus.complete(result));
      return result;
    }

    Capabilities capabilities = stage(sink, () -> capabilityProvider.resolve(overrides));

    ScratchDirectory scratch =
        stage(
            sink,
            () -> {
              try {
                return ScratchDirectory.create(tempDir, "run_");
              } catch (IOException e) {
                throw new StorageFailedException("Cannot create working directory", e);
              }
            });

    try (scratch) {
      // download
      boolean episodeCached =
          stage(
              sink,
              () -> {
                signal.throwIfCancelled("download");
                return metadataStore.episodeExists(cacheKey);
              });
      emitStage(sink, ProcessingStatus.downloading(cacheKey, episodeCached));
      Path episodeFile = scratch.path().resolve("episode.mp3");
      stage(
          sink,
          () -> {
            fetchEpisode(sourceIdentifier, cacheKey, episodeCached, episodeFile, signal);
            return episodeFile;
          });
      emitStage(sink, ProcessingStatus.downloaded(cacheKey, episodeCached));

      // transcribe
      stage(sink, () -> checkCancelled(signal, "transcription"));
      emitStage(sink, ProcessingStatus.transcribing(cacheKey));
      String transcript =
          stage(
              sink,
              () -> {
                String text =
                    transcriptionService.transcribe(
                        episodeFile, capabilities.transcription(), signal);
                objectStore.putBytes(
                    ArtifactLayout.transcript(cacheKey), text.getBytes(StandardCharsets.UTF_8), TEXT);
                return text;
              });
      int transcriptWords = TextUtils.countWords(transcript);
      emitStage(sink, ProcessingStatus.transcribed(cacheKey, transcriptWords));

      // summarize
      stage(sink, () -> checkCancelled(signal, "summarization"));
      emitStage(sink, ProcessingStatus.summarizing(cacheKey));
      String summary =
          stage(
              sink,
              () -> {
                String text =
                    summarizer.summarize(transcript, capabilities.summarization(), signal);
                objectStore.putBytes(
                    ArtifactLayout.summaryText(cacheKey), text.getBytes(StandardCharsets.UTF_8), TEXT);
                return text;
              });
      int summaryWords = TextUtils.countWords(summary);
      String presented = TextUtils.trimNonAlphanumeric(summary);
      emitStage(sink, ProcessingStatus.summarized(cacheKey, transcriptWords, summaryWords, presented));

      // synthesize and persist
      stage(sink, () -> checkCancelled(signal, "speech generation"));
      emitStage(sink, ProcessingStatus.generatingSpeech(cacheKey));
      Path speechFile = scratch.path().resolve("summary.mp3");
      stage(
          sink,
          () -> {
            synthesize(capabilities, summary, speechFile, signal);
            objectStore.putFile(ArtifactLayout.summaryAudio(cacheKey), speechFile, AUDIO);
            metadataStore.saveSummary(
                new SummaryRecord(
                    cacheKey,
                    ArtifactLayout.transcript(cacheKey),
                    ArtifactLayout.summaryText(cacheKey),
                    ArtifactLayout.summaryAudio(cacheKey),
                    transcriptWords,
                    summaryWords,
                    Instant.now()));
            return speechFile;
          });

      PipelineResult result =
          new PipelineResult(
              cacheKey,
              ArtifactLayout.summaryAudio(cacheKey),
              presented,
              transcriptWords,
              summaryWords,
              episodeCached,
              false,
              elapsedMs(startNanos));
      emitStage(sink, ProcessingStatus.complete(result));
      return result;
    }
  }

  private void fetchEpisode(
      String sourceIdentifier,
      String cacheKey,
      boolean episodeCached,
      Path target,
      CancellationSignal signal) {
    String storageKey = ArtifactLayout.episodeAudio(cacheKey);
    if (episodeCached) {
      LOGGER.info("Episode found in cache: cacheKey={}", cacheKey);
      objectStore.downloadToFile(storageKey, target);
      return;
    }
    if (!cacheKeyService.isUrl(sourceIdentifier)) {
      throw new NotFoundException("No cached episode for key " + cacheKey);
    }

    long bytes = downloader.download(sourceIdentifier, target, signal);
    signal.throwIfCancelled("storing the episode");
    objectStore.putFile(storageKey, target, AUDIO);
    metadataStore.saveEpisode(
        new EpisodeRecord(cacheKey, sourceIdentifier, storageKey, bytes, Instant.now()));
    LOGGER.info("Downloaded and cached episode: cacheKey={}, bytes={}", cacheKey, bytes);
  }

  private void synthesize(
      Capabilities capabilities, String summary, Path target, CancellationSignal signal) {
    try {
      capabilities.speechSynthesis().synthesize(summary, target, signal);
    } catch (AudioSummaryException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new SynthesisFailedException("Speech synthesis failed: " + e.getMessage(), e);
    }
    if (!Files.isRegularFile(target)) {
      throw new SynthesisFailedException("Speech synthesis produced no audio");
    }
  }

  private PipelineResult fromCache(SummaryRecord record, long startNanos) {
    String summaryText =
        new String(objectStore.getBytes(record.summaryTextKey()), StandardCharsets.UTF_8);
    return new PipelineResult(
        record.cacheKey(),
        record.summaryAudioKey(),
        TextUtils.trimNonAlphanumeric(summaryText),
        record.transcriptWordCount(),
        record.summaryWordCount(),
        true,
        true,
        elapsedMs(startNanos));
  }

  /**
   * Wait for the owner's run. Empty means the owner was cancelled while this caller still wants
   * the result, so the caller should claim the key again.
   */
  private Optional<PipelineResult> join(
      InFlightRuns.Claim claim, ProgressSink sink, CancellationSignal signal) {
    StageOutcome<PipelineResult> outcome = StageOutcome.attempt(() -> claim.await(signal));
    if (outcome.isSuccess()) {
      emit(sink, ProcessingStatus.complete(outcome.value()));
      return Optional.of(outcome.value());
    }
    if (isCancellation(outcome.failure()) && !signal.isCancelled()) {
      LOGGER.info("In-flight run was cancelled by its owner, claiming it again");
      return Optional.empty();
    }
    throw reportFailure(sink, outcome.failure());
  }

  /**
   * Run one step and unwrap its outcome. A failed step is reported once on the sink and its
   * exception rethrown unchanged.
   */
  private <T> T stage(ProgressSink sink, Supplier<T> step) {
    StageOutcome<T> outcome = StageOutcome.attempt(step);
    if (outcome.isSuccess()) {
      return outcome.value();
    }
    throw reportFailure(sink, outcome.failure());
  }

  private RuntimeException reportFailure(ProgressSink sink, RuntimeException failure) {
    if (isCancellation(failure)) {
      LOGGER.info("Processing was cancelled: {}", failure.getMessage());
      emit(sink, ProcessingStatus.error("Processing was cancelled", failure.getMessage()));
    } else {
      LOGGER.error("Error in processing pipeline: {}", failure.getMessage(), failure);
      emit(sink, ProcessingStatus.error("Processing failed", failure.getMessage()));
    }
    return failure;
  }

  private static boolean isCancellation(RuntimeException failure) {
    return failure instanceof AudioSummaryException
        && ((AudioSummaryException) failure).getErrorCode() == ErrorCode.CANCELLED;
  }

  private static Boolean checkCancelled(CancellationSignal signal, String activity) {
    signal.throwIfCancelled(activity);
    return Boolean.TRUE;
  }

  private void emitStage(ProgressSink sink, ProcessingStatus status) {
    STRUCTURED_LOGGER.logStage(status.stage().tag(), status.progress(), status.message());
    emit(sink, status);
  }

  private static void emit(ProgressSink sink, ProcessingStatus status) {
    try {
      sink.accept(status);
    } catch (RuntimeException e) {
      LOGGER.warn("Progress sink rejected {} event: {}", status.stage().tag(), e.getMessage());
    }
  }

  private static long elapsedMs(long startNanos) {
    return (System.nanoTime() - startNanos) / 1_000_000;
  }
}
