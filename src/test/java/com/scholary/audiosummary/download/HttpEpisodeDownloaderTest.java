package com.scholary.audiosummary.download;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.audiosummary.TestProperties;
import com.scholary.audiosummary.error.DownloadFailedException;
import com.scholary.audiosummary.error.ErrorCode;
import com.scholary.audiosummary.error.PipelineCancelledException;
import com.scholary.audiosummary.pipeline.CancellationSignal;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class HttpEpisodeDownloaderTest {

  @TempDir Path tempDir;

  private HttpServer server;
  private String baseUrl;
  private HttpEpisodeDownloader downloader;

  @BeforeEach
  void setUp() throws IOException {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.start();
    baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
    downloader = new HttpEpisodeDownloader(TestProperties.pipeline(tempDir));
  }

  @AfterEach
  void tearDown() {
    server.stop(0);
  }

  private void serve(String path, int status, String contentType, byte[] body) {
    server.createContext(
        path,
        exchange -> {
          exchange.getResponseHeaders().add("Content-Type", contentType);
          exchange.sendResponseHeaders(status, body.length == 0 ? -1 : body.length);
          try (OutputStream out = exchange.getResponseBody()) {
            out.write(body);
          }
        });
  }

  @Test
  void download_shouldStreamBodyToTarget() throws Exception {
    byte[] audio = new byte[64 * 1024];
    audio[100] = 42;
    serve("/ep1.mp3", 200, "audio/mpeg", audio);
    Path target = tempDir.resolve("ep1.mp3");

    long bytes = downloader.download(baseUrl + "/ep1.mp3", target, CancellationSignal.create());

    assertThat(bytes).isEqualTo(audio.length);
    assertThat(Files.readAllBytes(target)).isEqualTo(audio);
  }

  @Test
  void download_shouldAcceptNonAudioContentType() throws Exception {
    serve("/feed", 200, "application/octet-stream", new byte[] {1, 2, 3});
    Path target = tempDir.resolve("feed.mp3");

    assertThat(downloader.download(baseUrl + "/feed", target, CancellationSignal.create()))
        .isEqualTo(3);
  }

  @Test
  void download_shouldFailOnErrorStatusWithoutLeavingFile() {
    serve("/missing.mp3", 404, "text/plain", new byte[0]);
    Path target = tempDir.resolve("missing.mp3");

    assertThatThrownBy(
            () ->
                downloader.download(baseUrl + "/missing.mp3", target, CancellationSignal.create()))
        .isInstanceOf(DownloadFailedException.class)
        .hasMessageContaining("404")
        .satisfies(
            e ->
                assertThat(((DownloadFailedException) e).getErrorCode())
                    .isEqualTo(ErrorCode.DOWNLOAD_FAILED));
    assertThat(target).doesNotExist();
  }

  @Test
  void download_shouldNotStartWhenCancelled() {
    CancellationSignal signal = CancellationSignal.create();
    signal.cancel();

    assertThatThrownBy(() -> downloader.download(baseUrl + "/ep1.mp3", tempDir.resolve("x"), signal))
        .isInstanceOf(PipelineCancelledException.class);
  }

  @Test
  void download_shouldRejectMalformedUrl() {
    assertThatThrownBy(
            () ->
                downloader.download(
                    "http://bad host/ep.mp3", tempDir.resolve("x"), CancellationSignal.create()))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
