package com.scholary.audiosummary.pipeline;

import com.fasterxml.jackson.annotation.JsonValue;

/** Pipeline stages in the order they are reported, each with its wire tag and progress value. */
public enum ProcessingStage {
  DOWNLOADING("downloading", 10),
  DOWNLOADED("downloaded", 20),
  TRANSCRIBING("transcribing", 25),
  TRANSCRIBED("transcribed", 40),
  SUMMARIZING("summarizing", 50),
  SUMMARIZED("summarized", 70),
  GENERATING_SPEECH("generating-speech", 80),
  COMPLETE("complete", 100),
  ERROR("error", 0);

  private final String tag;
  private final int progress;

  ProcessingStage(String tag, int progress) {
    this.tag = tag;
    this.progress = progress;
  }

  @JsonValue
  public String tag() {
    return tag;
  }

  public int progress() {
    return progress;
  }

  public boolean isTerminal() {
    return this == COMPLETE || this == ERROR;
  }
}
