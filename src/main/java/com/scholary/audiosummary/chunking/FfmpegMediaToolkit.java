package com.scholary.audiosummary.chunking;

import com.scholary.audiosummary.error.ClipFailedException;
import com.scholary.audiosummary.error.ProbeFailedException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@link MediaToolkit} backed by the ffprobe and ffmpeg command line tools.
 *
 * <p>Both tools run with {@code -v error}. Their combined output is written to a temporary file
 * while they run and read back once they exit; only its last {@value #MAX_OUTPUT_CHARS} characters
 * are kept for error messages. Clipping uses stream copy ({@code -acodec copy}): no re-encoding, so a clip is
 * byte-for-byte a slice of the source.
 */
@Component
public class FfmpegMediaToolkit implements MediaToolkit {

  private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegMediaToolkit.class);

  static final int MAX_OUTPUT_CHARS = 4000;

  private final FfmpegProperties properties;

  public FfmpegMediaToolkit(FfmpegProperties properties) {
    this.properties = properties;
  }

  @Override
  public double probeDuration(Path audioFile) {
    List<String> command =
        List.of(
            properties.ffprobePath(),
            "-v", "error",
            "-show_entries", "format=duration",
            "-of", "default=noprint_wrappers=1:nokey=1",
            audioFile.toString());

    ProcessResult result;
    try {
      result = run(command);
    } catch (IOException e) {
      throw new ProbeFailedException("Failed to run ffprobe on " + audioFile, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ProbeFailedException("ffprobe interrupted", e);
    }

    if (result.exitCode() != 0) {
      LOGGER.error("ffprobe failed: file={}, output={}", audioFile, result.output());
      throw new ProbeFailedException(
          "ffprobe failed with exit code " + result.exitCode() + ": " + result.output(),
          result.exitCode());
    }

    try {
      double seconds = Double.parseDouble(result.output().trim());
      LOGGER.debug("Probed duration: file={}, seconds={}", audioFile.getFileName(), seconds);
      return seconds;
    } catch (NumberFormatException e) {
      throw new ProbeFailedException(
          "Failed to parse duration from ffprobe output: " + result.output(), e);
    }
  }

  @Override
  public void clip(Path source, double start, double length, Path target) {
    List<String> command =
        List.of(
            properties.ffmpegPath(),
            "-v", "error",
            "-i", source.toString(),
            "-ss", String.format(Locale.ROOT, "%.3f", start),
            "-t", String.format(Locale.ROOT, "%.3f", length),
            "-acodec", "copy",
            "-y",
            target.toString());

    ProcessResult result;
    try {
      result = run(command);
    } catch (IOException e) {
      throw new ClipFailedException("Failed to run ffmpeg for " + target.getFileName(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ClipFailedException("ffmpeg interrupted", e);
    }

    if (result.exitCode() != 0) {
      LOGGER.error("ffmpeg clip failed: target={}, output={}", target, result.output());
      throw new ClipFailedException(
          "ffmpeg failed with exit code " + result.exitCode() + ": " + result.output(),
          result.exitCode());
    }
    if (!Files.exists(target)) {
      throw new ClipFailedException("ffmpeg produced no output file: " + target, result.exitCode());
    }
  }

  private ProcessResult run(List<String> command) throws IOException, InterruptedException {
    LOGGER.debug("Executing: {}", String.join(" ", command));

    // output goes to a file so a chatty tool can never block on a full pipe
    Path log = Files.createTempFile("ffmpeg-", ".log");
    try {
      ProcessBuilder pb = new ProcessBuilder(command);
      pb.redirectErrorStream(true);
      pb.redirectOutput(log.toFile());
      Process process = pb.start();

      if (!process.waitFor(properties.processTimeoutSeconds(), TimeUnit.SECONDS)) {
        process.destroyForcibly();
        throw new IOException(
            command.get(0) + " timed out after " + properties.processTimeoutSeconds() + "s");
      }

      String output = new String(Files.readAllBytes(log), StandardCharsets.UTF_8).trim();
      return new ProcessResult(process.exitValue(), tail(output));
    } finally {
      Files.deleteIfExists(log);
    }
  }

  /** Keep the end of long output, where the tools print the actual error. */
  private static String tail(String output) {
    if (output.length() <= MAX_OUTPUT_CHARS) {
      return output;
    }
    return "..." + output.substring(output.length() - MAX_OUTPUT_CHARS);
  }

  private record ProcessResult(int exitCode, String output) {}
}
