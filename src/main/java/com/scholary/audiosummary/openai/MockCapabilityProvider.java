package com.scholary.audiosummary.openai;

import com.scholary.audiosummary.capability.Capabilities;
import com.scholary.audiosummary.capability.CapabilityProvider;
import com.scholary.audiosummary.capability.ProviderOverrides;
import com.scholary.audiosummary.pipeline.CancellationSignal;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;

/**
 * Canned capabilities for local development: a fixed transcript, a fixed summary and a tiny silent
 * MP3. Overrides are ignored.
 */
public class MockCapabilityProvider implements CapabilityProvider {

  private static final Logger LOGGER = LoggerFactory.getLogger(MockCapabilityProvider.class);

  // ID3v2 header, one MPEG-1 Layer 3 frame header, then silence
  private static final byte[] SILENT_MP3 = {
    0x49, 0x44, 0x33, 0x03, 0x00, 0x00, 0x00, 0x00, 0x00, 0x00,
    (byte) 0xFF, (byte) 0xFB, (byte) 0x90, 0x00,
    0x00, 0x00, 0x00, 0x00, 0x00, 0x00, 0x00, 0x00, 0x00, 0x00,
    0x00, 0x00, 0x00, 0x00, 0x00, 0x00, 0x00, 0x00, 0x00, 0x00
  };

  private final String transcript;
  private final String summary;

  public MockCapabilityProvider() {
    this.transcript = load("mock/transcript.txt");
    this.summary = load("mock/summary.txt");
    LOGGER.info("Mock capability provider initialized - using canned responses");
  }

  @Override
  public Capabilities resolve(ProviderOverrides overrides) {
    return new Capabilities(this::transcribe, this::summarize, this::synthesize);
  }

  private String transcribe(Path audioFile, CancellationSignal signal) {
    signal.throwIfCancelled("mock transcription");
    LOGGER.info("[MOCK] Transcribing {}", audioFile.getFileName());
    return transcript;
  }

  private String summarize(
      String instructions, String prompt, int targetWords, CancellationSignal signal) {
    signal.throwIfCancelled("mock summarization");
    LOGGER.info("[MOCK] Summarizing {} characters", prompt.length());
    return summary;
  }

  private void synthesize(String text, Path target, CancellationSignal signal) {
    signal.throwIfCancelled("mock speech generation");
    try {
      Files.write(target, SILENT_MP3);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to write mock audio to " + target, e);
    }
    LOGGER.info("[MOCK] Wrote silent audio to {}", target.getFileName());
  }

  private static String load(String resource) {
    try (InputStream in = new ClassPathResource(resource).getInputStream()) {
      return new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
    } catch (IOException e) {
      throw new UncheckedIOException("Missing mock resource " + resource, e);
    }
  }
}
