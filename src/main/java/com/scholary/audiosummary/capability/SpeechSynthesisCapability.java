package com.scholary.audiosummary.capability;

import com.scholary.audiosummary.pipeline.CancellationSignal;
import java.nio.file.Path;

/** Text-to-speech backend. */
@FunctionalInterface
public interface SpeechSynthesisCapability {

  /**
   * Render {@code text} as speech into {@code target}.
   *
   * @param text the text to speak
   * @param target the audio file to write, replaced if present
   * @param signal cancels the in-flight call when fired
   */
  void synthesize(String text, Path target, CancellationSignal signal);
}
