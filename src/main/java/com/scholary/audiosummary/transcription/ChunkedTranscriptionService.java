package com.scholary.audiosummary.transcription;

import com.scholary.audiosummary.capability.TranscriptionCapability;
import com.scholary.audiosummary.chunking.AudioSegment;
import com.scholary.audiosummary.chunking.AudioSegmenter;
import com.scholary.audiosummary.config.PipelineProperties;
import com.scholary.audiosummary.error.AudioSummaryException;
import com.scholary.audiosummary.error.PipelineCancelledException;
import com.scholary.audiosummary.error.TranscriptionFailedException;
import com.scholary.audiosummary.logging.StructuredLogger;
import com.scholary.audiosummary.pipeline.CancellationSignal;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Transcribes an audio file of any size against a backend with a per-call size limit.
 *
 * <p>Files at or under {@code maxFileSizeBytes} go to the backend in one call. Larger files are
 * split by {@link AudioSegmenter} into a private scratch directory and the segments are transcribed
 * in parallel:
 *
 * <ul>
 *   <li>a semaphore caps in-flight backend calls at {@code maxConcurrentCalls}
 *   <li>each result is written to its segment's slot in a pre-sized array, so the joined text is in
 *       segment order whatever order the calls finish in
 *   <li>the first failure aborts the whole file; segments not yet started are skipped, but every
 *       started task is awaited before the scratch directory is deleted. A full executor that
 *       rejects a segment counts as such a failure
 * </ul>
 */
@Service
public class ChunkedTranscriptionService {

  private static final Logger LOGGER = LoggerFactory.getLogger(ChunkedTranscriptionService.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);
  private static final String SCRATCH_PREFIX = "audio_chunks_";

  private final AudioSegmenter segmenter;
  private final Executor executor;
  private final Path tempDir;
  private final long maxFileSizeBytes;
  private final int maxConcurrentCalls;

  public ChunkedTranscriptionService(
      AudioSegmenter segmenter,
      PipelineProperties properties,
      @Qualifier("transcriptionExecutor") Executor executor) {
    this.segmenter = segmenter;
    this.executor = executor;
    this.tempDir = Paths.get(properties.tempDir());
    this.maxFileSizeBytes = properties.transcription().maxFileSizeBytes();
    this.maxConcurrentCalls = properties.transcription().maxConcurrentCalls();
  }

  /**
   * Transcribe a local audio file.
   *
   * @param audioFile the file to transcribe
   * @param capability the backend to call
   * @param signal checked before every backend call
   * @return the transcript, segment texts joined with a single space
   * @throws TranscriptionFailedException if any backend call fails
   * @throws com.scholary.audiosummary.error.SegmentationFailedException if splitting fails
   * @throws PipelineCancelledException if the signal fires before all work was scheduled
   */
  public String transcribe(
      Path audioFile, TranscriptionCapability capability, CancellationSignal signal) {
    long fileSize;
    try {
      fileSize = Files.size(audioFile);
    } catch (IOException e) {
      throw new TranscriptionFailedException("Cannot read audio file: " + audioFile, e);
    }

    if (fileSize <= maxFileSizeBytes) {
      LOGGER.info("Transcribing whole file: size={} bytes", fileSize);
      signal.throwIfCancelled("transcription");
      return callBackend(capability, audioFile, signal, "file " + audioFile.getFileName());
    }

    LOGGER.info(
        "File exceeds {} bytes ({} bytes), transcribing in segments", maxFileSizeBytes, fileSize);

    try (ScratchDirectory scratch = ScratchDirectory.create(tempDir, SCRATCH_PREFIX)) {
      List<AudioSegment> segments = segmenter.segment(audioFile, scratch.path(), signal);
      return transcribeSegments(segments, capability, signal);
    } catch (IOException e) {
      throw new TranscriptionFailedException("Cannot create scratch directory under " + tempDir, e);
    }
  }

  private String transcribeSegments(
      List<AudioSegment> segments, TranscriptionCapability capability, CancellationSignal signal) {
    int total = segments.size();
    String[] results = new String[total];
    Semaphore permits = new Semaphore(maxConcurrentCalls);
    AtomicReference<AudioSummaryException> firstFailure = new AtomicReference<>();

    List<CompletableFuture<Void>> tasks = new ArrayList<>(total);
    for (AudioSegment segment : segments) {
      try {
        tasks.add(
            CompletableFuture.runAsync(
                () -> {
                  try {
                    results[segment.index()] =
                        transcribeSegment(
                            segment, total, capability, signal, permits, firstFailure);
                  } catch (AudioSummaryException e) {
                    firstFailure.compareAndSet(null, e);
                  }
                },
                executor));
      } catch (RejectedExecutionException e) {
        // tasks already submitted still read from the scratch directory
        firstFailure.compareAndSet(
            null,
            new TranscriptionFailedException(
                "Transcription pool rejected segment " + segment.index(), e));
        break;
      }
    }

    // tasks record their own failures, so this only waits
    CompletableFuture.allOf(tasks.toArray(new CompletableFuture[0])).join();

    AudioSummaryException failure = firstFailure.get();
    if (failure != null) {
      LOGGER.error("Segmented transcription failed: {}", failure.getMessage());
      throw failure;
    }

    LOGGER.info("Transcribed {} segments", total);
    return String.join(" ", results);
  }

  private String transcribeSegment(
      AudioSegment segment,
      int total,
      TranscriptionCapability capability,
      CancellationSignal signal,
      Semaphore permits,
      AtomicReference<AudioSummaryException> firstFailure) {
    String label = "segment " + segment.index();
    if (firstFailure.get() != null) {
      throw new TranscriptionFailedException("Skipped " + label + " after an earlier failure");
    }
    signal.throwIfCancelled("transcribing " + label);

    try (PermitLease lease = PermitLease.acquire(permits)) {
      // the wait for a permit may have been long
      if (firstFailure.get() != null) {
        throw new TranscriptionFailedException("Skipped " + label + " after an earlier failure");
      }
      signal.throwIfCancelled("transcribing " + label);

      STRUCTURED_LOGGER.logSegmentStarted(segment.index(), total);
      long startNanos = System.nanoTime();
      String text = callBackend(capability, segment.path(), signal, label);
      STRUCTURED_LOGGER.logSegmentFinished(
          segment.index(), total, (System.nanoTime() - startNanos) / 1_000_000);
      return text;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new PipelineCancelledException("Interrupted waiting to transcribe " + label, e);
    } catch (AudioSummaryException e) {
      STRUCTURED_LOGGER.logSegmentFailed(
          segment.index(), e.getClass().getSimpleName(), e.getMessage());
      throw e;
    }
  }

  private String callBackend(
      TranscriptionCapability capability, Path file, CancellationSignal signal, String label) {
    String text;
    try {
      text = capability.transcribe(file, signal);
    } catch (AudioSummaryException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new TranscriptionFailedException(
          "Transcription of " + label + " failed: " + e.getMessage(), e);
    }
    return text == null ? "" : text;
  }
}
