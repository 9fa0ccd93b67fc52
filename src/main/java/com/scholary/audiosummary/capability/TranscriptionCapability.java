package com.scholary.audiosummary.capability;

import com.scholary.audiosummary.pipeline.CancellationSignal;
import java.nio.file.Path;

/** Speech-to-text backend. Called once per whole file or once per segment. */
@FunctionalInterface
public interface TranscriptionCapability {

  /**
   * Transcribe one audio file.
   *
   * @param audioFile a file under the backend's size limit
   * @param signal cancels the in-flight call when fired
   * @return the transcript text
   */
  String transcribe(Path audioFile, CancellationSignal signal);
}
