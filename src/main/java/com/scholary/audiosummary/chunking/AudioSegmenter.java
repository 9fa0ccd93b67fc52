package com.scholary.audiosummary.chunking;

import com.scholary.audiosummary.config.PipelineProperties;
import com.scholary.audiosummary.error.MediaToolException;
import com.scholary.audiosummary.error.SegmentationFailedException;
import com.scholary.audiosummary.logging.StructuredLogger;
import com.scholary.audiosummary.pipeline.CancellationSignal;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Splits an audio file that is too large for the transcription backend into overlapping segments.
 *
 * <p>Segment length is chosen so each clip lands under the size limit:
 *
 * <pre>
 *   chunkSeconds = floor(limitBytes / fileSizeBytes * totalSeconds * safetyFactor)
 * </pre>
 *
 * <p>clamped to [minChunkSeconds, maxChunkSeconds]. The lower bound caps fan-out, the upper bound
 * caps the size of any single call. Segment {@code i > 0} starts {@code overlapSeconds} before
 * {@code i * chunkSeconds} and runs {@code chunkSeconds + overlapSeconds}. Overlapped words are
 * not de-duplicated when transcripts are joined.
 */
@Component
public class AudioSegmenter {

  private static final Logger LOGGER = LoggerFactory.getLogger(AudioSegmenter.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private final MediaToolkit mediaToolkit;
  private final PipelineProperties.TranscriptionProperties limits;

  public AudioSegmenter(MediaToolkit mediaToolkit, PipelineProperties properties) {
    this.mediaToolkit = mediaToolkit;
    this.limits = properties.transcription();
  }

  /**
   * Probe, plan and clip {@code source} into {@code scratchDir}.
   *
   * <p>Clips are named {@code chunk_000.mp3}, {@code chunk_001.mp3}, ... using the source file's
   * extension. The caller owns {@code scratchDir} and must delete it whatever the outcome.
   *
   * @return segments in index order
   * @throws SegmentationFailedException if probing or any clip fails
   */
  public List<AudioSegment> segment(Path source, Path scratchDir, CancellationSignal signal) {
    long fileSize;
    try {
      fileSize = Files.size(source);
    } catch (IOException e) {
      throw new SegmentationFailedException("Cannot read audio file size: " + source, e);
    }

    double totalDuration;
    try {
      totalDuration = mediaToolkit.probeDuration(source);
    } catch (MediaToolException e) {
      throw new SegmentationFailedException("Duration probe failed: " + e.getMessage(), e);
    }

    List<SegmentPlan> plans;
    try {
      plans = planSegments(totalDuration, fileSize, limits.maxFileSizeBytes());
    } catch (IllegalArgumentException e) {
      throw new SegmentationFailedException("Cannot plan segments: " + e.getMessage(), e);
    }

    LOGGER.info(
        "Splitting audio: file={}, size={} bytes, duration={}s, segments={}",
        source.getFileName(),
        fileSize,
        totalDuration,
        plans.size());

    String extension = extensionOf(source);
    List<AudioSegment> segments = new ArrayList<>(plans.size());
    for (SegmentPlan plan : plans) {
      signal.throwIfCancelled("clipping segment " + plan.index());

      Path target = scratchDir.resolve(String.format("chunk_%03d%s", plan.index(), extension));
      try {
        mediaToolkit.clip(source, plan.start(), plan.length(), target);
      } catch (MediaToolException e) {
        throw new SegmentationFailedException(
            "Failed to extract segment " + plan.index() + ": " + e.getMessage(), e);
      }
      segments.add(new AudioSegment(plan.index(), plan.start(), plan.length(), target));
    }

    return segments;
  }

  /**
   * Plan the cuts for a file without touching disk.
   *
   * @param totalDuration total audio length in seconds
   * @param fileSizeBytes size of the source file
   * @param limitBytes target maximum size per segment
   * @return plans in index order, covering [0, totalDuration]
   */
  public List<SegmentPlan> planSegments(double totalDuration, long fileSizeBytes, long limitBytes) {
    if (!(totalDuration > 0)) {
      throw new IllegalArgumentException("Total duration must be positive, got " + totalDuration);
    }
    if (fileSizeBytes <= 0 || limitBytes <= 0) {
      throw new IllegalArgumentException("File size and limit must be positive");
    }

    int chunkSeconds = chunkSeconds(totalDuration, fileSizeBytes, limitBytes);
    int count = (int) Math.ceil(totalDuration / chunkSeconds);
    double overlap = limits.overlapSeconds();

    List<SegmentPlan> plans = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      double segmentOverlap = i > 0 ? overlap : 0;
      double start = Math.max(0, (double) i * chunkSeconds - segmentOverlap);
      double length = chunkSeconds + segmentOverlap;
      plans.add(new SegmentPlan(i, start, length));
      STRUCTURED_LOGGER.logSegmentPlanned(i, start, length, segmentOverlap);
    }
    return plans;
  }

  /** Per-segment length in whole seconds, clamped to the configured bounds. */
  int chunkSeconds(double totalDuration, long fileSizeBytes, long limitBytes) {
    int raw =
        (int) ((double) limitBytes / fileSizeBytes * totalDuration * limits.safetyFactor());
    int clamped = Math.max(limits.minChunkSeconds(), Math.min(limits.maxChunkSeconds(), raw));
    LOGGER.debug("Chunk duration: raw={}s, clamped={}s", raw, clamped);
    return clamped;
  }

  private static String extensionOf(Path source) {
    String name = source.getFileName().toString();
    int dot = name.lastIndexOf('.');
    return dot > 0 ? name.substring(dot) : ".mp3";
  }
}
