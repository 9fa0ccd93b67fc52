package com.scholary.audiosummary.chunking;

import java.nio.file.Path;

/**
 * Duration probing and lossless clipping of audio files.
 *
 * <p>Implementations report failures as {@link com.scholary.audiosummary.error.ProbeFailedException}
 * and {@link com.scholary.audiosummary.error.ClipFailedException}.
 */
public interface MediaToolkit {

  /**
   * Probe the total duration of an audio file.
   *
   * @param audioFile the file to probe
   * @return the duration in seconds
   */
  double probeDuration(Path audioFile);

  /**
   * Copy {@code length} seconds starting at {@code start} into {@code target} without re-encoding.
   *
   * @param source the source audio file
   * @param start start offset in seconds
   * @param length clip length in seconds
   * @param target the file to write, overwritten if present
   */
  void clip(Path source, double start, double length, Path target);
}
