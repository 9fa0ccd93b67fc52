package com.scholary.audiosummary.openai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scholary.audiosummary.error.PipelineCancelledException;
import com.scholary.audiosummary.pipeline.CancellationSignal;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublisher;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for the Azure OpenAI REST API.
 *
 * <p>One instance talks to one endpoint with one key. Requests go to {@code
 * {endpoint}/openai/deployments/{deployment}/...?api-version=...} with the key in the {@code
 * api-key} header. Every call is sent with {@code sendAsync} and cancelled through the run's
 * {@link CancellationSignal}.
 */
public class OpenAiClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(OpenAiClient.class);

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final String endpoint;
  private final String apiKey;
  private final String apiVersion;
  private final Duration readTimeout;

  public OpenAiClient(
      HttpClient httpClient,
      ObjectMapper objectMapper,
      String endpoint,
      String apiKey,
      String apiVersion,
      Duration readTimeout) {
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.endpoint = endpoint.endsWith("/") ? endpoint.substring(0, endpoint.length() - 1) : endpoint;
    this.apiKey = apiKey;
    this.apiVersion = apiVersion;
    this.readTimeout = readTimeout;
  }

  /**
   * Transcribe an audio file with a Whisper deployment.
   *
   * @return the transcript text
   */
  public String transcribe(String deployment, Path audioFile, CancellationSignal signal) {
    LOGGER.info("Transcribing file: {}", audioFile.getFileName());

    String boundary = UUID.randomUUID().toString();
    BodyPublisher body;
    try {
      body = multipartBody(audioFile, boundary);
    } catch (IOException e) {
      throw new OpenAiException("Failed to read audio file " + audioFile, e);
    }

    HttpRequest request =
        requestBuilder(deployment, "audio/transcriptions")
            .header("Content-Type", "multipart/form-data; boundary=" + boundary)
            .POST(body)
            .build();

    HttpResponse<String> response = send(request, HttpResponse.BodyHandlers.ofString(), signal);
    checkStatus(response.statusCode(), response.body(), "transcription");

    String text = readTree(response.body()).path("text").asText("");
    LOGGER.info("Transcription completed: {} characters", text.length());
    return text;
  }

  /**
   * Run a chat completion with one system and one user message.
   *
   * @return the first choice's message content
   */
  public String chat(
      String deployment, String systemPrompt, String userPrompt, CancellationSignal signal) {
    ObjectNode payload = objectMapper.createObjectNode();
    ArrayNode messages = payload.putArray("messages");
    messages.addObject().put("role", "system").put("content", systemPrompt);
    messages.addObject().put("role", "user").put("content", userPrompt);
    payload.put("temperature", 1.0);

    HttpRequest request =
        requestBuilder(deployment, "chat/completions")
            .header("Content-Type", "application/json")
            .POST(BodyPublishers.ofString(write(payload)))
            .build();

    HttpResponse<String> response = send(request, HttpResponse.BodyHandlers.ofString(), signal);
    checkStatus(response.statusCode(), response.body(), "chat completion");

    JsonNode content = readTree(response.body()).path("choices").path(0).path("message").path("content");
    if (content.isMissingNode() || content.isNull()) {
      throw new OpenAiException("Chat completion returned no content", response.statusCode());
    }
    return content.asText();
  }

  /** Synthesize speech for {@code text} into {@code target}. */
  public void speech(
      String deployment,
      String text,
      String voice,
      SpeechFormat format,
      double speed,
      Path target,
      CancellationSignal signal) {
    LOGGER.info(
        "Generating speech: chars={}, voice={}, format={}, speed={}",
        text.length(),
        voice,
        format.wireName(),
        speed);

    ObjectNode payload = objectMapper.createObjectNode();
    payload.put("model", deployment);
    payload.put("input", text);
    payload.put("voice", voice);
    payload.put("response_format", format.wireName());
    payload.put("speed", speed);

    HttpRequest request =
        requestBuilder(deployment, "audio/speech")
            .header("Content-Type", "application/json")
            .POST(BodyPublishers.ofString(write(payload)))
            .build();

    HttpResponse<byte[]> response = send(request, HttpResponse.BodyHandlers.ofByteArray(), signal);
    checkStatus(
        response.statusCode(), new String(response.body(), StandardCharsets.UTF_8), "speech");

    try {
      Path parent = target.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      Path partial = Files.createTempFile(parent, "speech-", ".part");
      Files.write(partial, response.body());
      Files.move(partial, target, StandardCopyOption.REPLACE_EXISTING);
    } catch (IOException e) {
      throw new OpenAiException("Failed to write speech audio to " + target, e);
    }
    LOGGER.info("Speech saved: file={}, bytes={}", target.getFileName(), response.body().length);
  }

  private HttpRequest.Builder requestBuilder(String deployment, String operation) {
    String url =
        String.format(
            "%s/openai/deployments/%s/%s?api-version=%s",
            endpoint,
            URLEncoder.encode(deployment, StandardCharsets.UTF_8),
            operation,
            URLEncoder.encode(apiVersion, StandardCharsets.UTF_8));
    return HttpRequest.newBuilder().uri(URI.create(url)).timeout(readTimeout).header("api-key", apiKey);
  }

  private <T> HttpResponse<T> send(
      HttpRequest request, HttpResponse.BodyHandler<T> handler, CancellationSignal signal) {
    LOGGER.debug("Sending request to {}", request.uri());

    CompletableFuture<HttpResponse<T>> future = httpClient.sendAsync(request, handler);
    try (CancellationSignal.Registration registration =
        signal.onCancel(() -> future.cancel(true))) {
      return future.get();
    } catch (CancellationException e) {
      throw new PipelineCancelledException("Request cancelled: " + request.uri().getPath(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      future.cancel(true);
      throw new PipelineCancelledException("Request interrupted: " + request.uri().getPath(), e);
    } catch (ExecutionException e) {
      throw new OpenAiException(
          "Request to " + request.uri().getPath() + " failed: " + e.getCause().getMessage(),
          e.getCause());
    }
  }

  private static void checkStatus(int statusCode, String body, String operation) {
    if (statusCode / 100 != 2) {
      throw new OpenAiException(
          String.format("OpenAI %s returned status %d: %s", operation, statusCode, body),
          statusCode);
    }
  }

  private JsonNode readTree(String body) {
    try {
      return objectMapper.readTree(body);
    } catch (IOException e) {
      throw new OpenAiException("Unparseable OpenAI response", e);
    }
  }

  private String write(JsonNode payload) {
    try {
      return objectMapper.writeValueAsString(payload);
    } catch (IOException e) {
      throw new OpenAiException("Failed to serialize OpenAI request", e);
    }
  }

  /**
   * Build a multipart/form-data body with the audio file and a JSON response format.
   *
   * <p>Java's HttpClient has no multipart support, so the parts are assembled by hand:
   *
   * <pre>
   * --boundary
   * Content-Disposition: form-data; name="file"; filename="chunk_000.mp3"
   * Content-Type: audio/mpeg
   *
   * [binary data]
   * --boundary
   * Content-Disposition: form-data; name="response_format"
   *
   * json
   * --boundary--
   * </pre>
   */
  private static BodyPublisher multipartBody(Path audioFile, String boundary) throws IOException {
    String filename = audioFile.getFileName().toString();
    ByteArrayOutputStream body = new ByteArrayOutputStream();

    StringBuilder head = new StringBuilder();
    head.append("--").append(boundary).append("\r\n");
    head.append("Content-Disposition: form-data; name=\"file\"; filename=\"")
        .append(filename)
        .append("\"\r\n");
    head.append("Content-Type: audio/mpeg\r\n\r\n");
    body.write(head.toString().getBytes(StandardCharsets.UTF_8));

    body.write(Files.readAllBytes(audioFile));

    StringBuilder tail = new StringBuilder();
    tail.append("\r\n");
    tail.append("--").append(boundary).append("\r\n");
    tail.append("Content-Disposition: form-data; name=\"response_format\"\r\n\r\n");
    tail.append("json\r\n");
    tail.append("--").append(boundary).append("--\r\n");
    body.write(tail.toString().getBytes(StandardCharsets.UTF_8));

    return BodyPublishers.ofByteArray(body.toByteArray());
  }
}
