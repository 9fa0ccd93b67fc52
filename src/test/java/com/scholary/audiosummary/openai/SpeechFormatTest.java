package com.scholary.audiosummary.openai;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class SpeechFormatTest {

  @Test
  void from_shouldParseKnownFormatsIgnoringCase() {
    assertThat(SpeechFormat.from("opus")).isEqualTo(SpeechFormat.OPUS);
    assertThat(SpeechFormat.from(" FLAC ")).isEqualTo(SpeechFormat.FLAC);
    assertThat(SpeechFormat.WAV.wireName()).isEqualTo("wav");
  }

  @Test
  void from_shouldFallBackToMp3() {
    assertThat(SpeechFormat.from(null)).isEqualTo(SpeechFormat.MP3);
    assertThat(SpeechFormat.from("")).isEqualTo(SpeechFormat.MP3);
    assertThat(SpeechFormat.from("ogg")).isEqualTo(SpeechFormat.MP3);
  }
}
