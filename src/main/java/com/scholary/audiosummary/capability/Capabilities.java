package com.scholary.audiosummary.capability;

import java.util.Objects;

/** The three backends one pipeline run talks to, resolved together for that run. */
public record Capabilities(
    TranscriptionCapability transcription,
    SummarizationCapability summarization,
    SpeechSynthesisCapability speechSynthesis) {

  public Capabilities {
    Objects.requireNonNull(transcription, "transcription");
    Objects.requireNonNull(summarization, "summarization");
    Objects.requireNonNull(speechSynthesis, "speechSynthesis");
  }
}
