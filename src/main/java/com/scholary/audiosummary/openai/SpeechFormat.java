package com.scholary.audiosummary.openai;

import java.util.Locale;

/** Audio formats the speech endpoint can return. */
public enum SpeechFormat {
  MP3,
  OPUS,
  AAC,
  FLAC,
  WAV,
  PCM;

  /** Parse a configured format name; unknown or blank names fall back to MP3. */
  public static SpeechFormat from(String name) {
    if (name == null || name.isBlank()) {
      return MP3;
    }
    try {
      return valueOf(name.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      return MP3;
    }
  }

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
