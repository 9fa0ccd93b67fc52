package com.scholary.audiosummary.openai;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.audiosummary.error.PipelineCancelledException;
import com.scholary.audiosummary.pipeline.CancellationSignal;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Exercises the client against an in-process HTTP server standing in for Azure OpenAI. */
class OpenAiClientTest {

  private static final String KEY = "test-key";

  @TempDir Path tempDir;

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final Map<String, String> requests = new ConcurrentHashMap<>();
  private HttpServer server;
  private OpenAiClient client;

  @BeforeEach
  void setUp() throws IOException {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.setExecutor(Executors.newCachedThreadPool());
    server.start();
    String endpoint = "http://127.0.0.1:" + server.getAddress().getPort() + "/";
    client =
        new OpenAiClient(
            HttpClient.newHttpClient(),
            objectMapper,
            endpoint,
            KEY,
            "2024-06-01",
            Duration.ofSeconds(10));
  }

  @AfterEach
  void tearDown() {
    server.stop(0);
  }

  private void respond(String path, int status, String contentType, byte[] body) {
    server.createContext(
        path,
        exchange -> {
          requests.put(path, describe(exchange));
          exchange.getResponseHeaders().add("Content-Type", contentType);
          exchange.sendResponseHeaders(status, body.length);
          try (OutputStream out = exchange.getResponseBody()) {
            out.write(body);
          }
        });
  }

  private static String describe(HttpExchange exchange) throws IOException {
    String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.ISO_8859_1);
    return exchange.getRequestHeaders().getFirst("api-key")
        + "|"
        + exchange.getRequestURI().getQuery()
        + "|"
        + body;
  }

  @Test
  void transcribe_shouldUploadFileAndReturnText() throws Exception {
    String path = "/openai/deployments/whisper/audio/transcriptions";
    respond(path, 200, "application/json", "{\"text\":\"hello there\"}".getBytes(StandardCharsets.UTF_8));
    Path audio = Files.write(tempDir.resolve("chunk_000.mp3"), "AUDIO".getBytes(StandardCharsets.UTF_8));

    String text = client.transcribe("whisper", audio, CancellationSignal.create());

    assertThat(text).isEqualTo("hello there");
    String request = requests.get(path);
    assertThat(request).startsWith(KEY + "|api-version=2024-06-01|");
    assertThat(request).contains("filename=\"chunk_000.mp3\"").contains("AUDIO");
  }

  @Test
  void chat_shouldSendSystemAndUserMessages() throws Exception {
    String path = "/openai/deployments/gpt-4o/chat/completions";
    respond(
        path,
        200,
        "application/json",
        "{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"a summary\"}}]}"
            .getBytes(StandardCharsets.UTF_8));

    String content = client.chat("gpt-4o", "be brief", "the transcript", CancellationSignal.create());

    assertThat(content).isEqualTo("a summary");
    String body = requests.get(path).split("\\|", 3)[2];
    JsonNode messages = objectMapper.readTree(body).path("messages");
    assertThat(messages.get(0).path("role").asText()).isEqualTo("system");
    assertThat(messages.get(0).path("content").asText()).isEqualTo("be brief");
    assertThat(messages.get(1).path("content").asText()).isEqualTo("the transcript");
  }

  @Test
  void speech_shouldWriteReturnedAudio() throws Exception {
    String path = "/openai/deployments/tts/audio/speech";
    byte[] audio = {1, 2, 3, 4, 5};
    respond(path, 200, "audio/mpeg", audio);
    Path target = tempDir.resolve("out/summary.mp3");

    client.speech("tts", "hi", "alloy", SpeechFormat.OPUS, 1.25, target, CancellationSignal.create());

    assertThat(Files.readAllBytes(target)).containsExactly(audio);
    JsonNode payload = objectMapper.readTree(requests.get(path).split("\\|", 3)[2]);
    assertThat(payload.path("response_format").asText()).isEqualTo("opus");
    assertThat(payload.path("speed").asDouble()).isEqualTo(1.25);
    assertThat(payload.path("voice").asText()).isEqualTo("alloy");
  }

  @Test
  void calls_shouldFailOnErrorStatus() {
    respond(
        "/openai/deployments/gpt-4o/chat/completions",
        429,
        "application/json",
        "{\"error\":\"rate limited\"}".getBytes(StandardCharsets.UTF_8));

    assertThatThrownBy(() -> client.chat("gpt-4o", "s", "u", CancellationSignal.create()))
        .isInstanceOf(OpenAiException.class)
        .hasMessageContaining("429")
        .satisfies(e -> assertThat(((OpenAiException) e).getStatusCode()).isEqualTo(429));
  }

  @Test
  void calls_shouldAbortWhenSignalFires() throws Exception {
    CountDownLatch received = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    server.createContext(
        "/openai/deployments/gpt-4o/chat/completions",
        exchange -> {
          received.countDown();
          try {
            release.await(10, TimeUnit.SECONDS);
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
          }
          exchange.sendResponseHeaders(500, -1);
          exchange.close();
        });
    CancellationSignal signal = CancellationSignal.create();
    Thread canceller =
        new Thread(
            () -> {
              try {
                received.await(10, TimeUnit.SECONDS);
              } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
              }
              signal.cancel();
            });
    canceller.start();

    try {
      assertThatThrownBy(() -> client.chat("gpt-4o", "s", "u", signal))
          .isInstanceOf(PipelineCancelledException.class);
    } finally {
      release.countDown();
      canceller.join(5000);
    }
  }
}
