package com.scholary.audiosummary.download;

import com.scholary.audiosummary.config.PipelineProperties;
import com.scholary.audiosummary.error.DownloadFailedException;
import com.scholary.audiosummary.error.PipelineCancelledException;
import com.scholary.audiosummary.pipeline.CancellationSignal;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Downloads source audio over HTTP(S) with the JDK HttpClient.
 *
 * <p>The body is streamed straight to disk. A non-audio content type is logged but accepted, since
 * plenty of podcast hosts serve MP3s as {@code application/octet-stream}. Cancellation aborts the
 * exchange before headers arrive, or closes the body stream during the transfer.
 */
@Component
public class HttpEpisodeDownloader implements EpisodeDownloader {

  private static final Logger LOGGER = LoggerFactory.getLogger(HttpEpisodeDownloader.class);

  private final HttpClient httpClient;
  private final String userAgent;

  public HttpEpisodeDownloader(PipelineProperties properties) {
    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.download().connectTimeoutSeconds()))
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
    this.userAgent = properties.download().userAgent();
  }

  @Override
  public long download(String url, Path target, CancellationSignal signal) {
    LOGGER.info("Downloading audio: url={}", url);
    signal.throwIfCancelled("download");

    HttpRequest request;
    try {
      request =
          HttpRequest.newBuilder().uri(URI.create(url)).header("User-Agent", userAgent).GET().build();
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid source URL: " + url, e);
    }

    try {
      HttpResponse<InputStream> response = awaitHeaders(request, signal);
      if (response.statusCode() / 100 != 2) {
        response.body().close();
        throw new DownloadFailedException(
            String.format("Download failed with HTTP %d: %s", response.statusCode(), url));
      }

      response
          .headers()
          .firstValue("Content-Type")
          .filter(type -> !type.startsWith("audio/"))
          .ifPresent(type -> LOGGER.warn("Content type is {}, expected audio/*", type));

      long bytes;
      try (InputStream body = response.body();
          CancellationSignal.Registration registration = signal.onCancel(() -> close(body))) {
        bytes = Files.copy(body, target, StandardCopyOption.REPLACE_EXISTING);
      }
      signal.throwIfCancelled("finishing the download");

      LOGGER.info("Downloaded {} bytes to {}", bytes, target);
      return bytes;

    } catch (IOException e) {
      deletePartial(target);
      if (signal.isCancelled()) {
        throw new PipelineCancelledException("Download cancelled: " + url, e);
      }
      throw new DownloadFailedException("Error downloading audio from " + url, e);
    } catch (RuntimeException e) {
      deletePartial(target);
      throw e;
    }
  }

  private HttpResponse<InputStream> awaitHeaders(HttpRequest request, CancellationSignal signal)
      throws IOException {
    CompletableFuture<HttpResponse<InputStream>> future =
        httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofInputStream());
    try (CancellationSignal.Registration registration =
        signal.onCancel(() -> future.cancel(true))) {
      return future.get();
    } catch (CancellationException e) {
      throw new PipelineCancelledException("Download cancelled: " + request.uri(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      future.cancel(true);
      throw new PipelineCancelledException("Download interrupted: " + request.uri(), e);
    } catch (ExecutionException e) {
      if (e.getCause() instanceof IOException) {
        throw (IOException) e.getCause();
      }
      throw new DownloadFailedException("Error downloading audio from " + request.uri(), e.getCause());
    }
  }

  private static void close(InputStream body) {
    try {
      body.close();
    } catch (IOException e) {
      LOGGER.debug("Closing download stream after cancel failed: {}", e.getMessage());
    }
  }

  private static void deletePartial(Path target) {
    try {
      Files.deleteIfExists(target);
    } catch (IOException e) {
      LOGGER.warn("Failed to delete partial download {}: {}", target, e.getMessage());
    }
  }
}
