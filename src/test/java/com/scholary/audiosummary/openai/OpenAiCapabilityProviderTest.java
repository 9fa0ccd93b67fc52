package com.scholary.audiosummary.openai;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.audiosummary.capability.Capabilities;
import com.scholary.audiosummary.capability.ProviderOverrides;
import com.scholary.audiosummary.pipeline.CancellationSignal;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenAiCapabilityProviderTest {

  private HttpServer server;
  private String serverUrl;
  private final List<String> seen = new CopyOnWriteArrayList<>();

  @BeforeEach
  void setUp() throws IOException {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.createContext(
        "/",
        exchange -> {
          seen.add(
              exchange.getRequestURI().getPath()
                  + " key="
                  + exchange.getRequestHeaders().getFirst("api-key"));
          byte[] body =
              "{\"choices\":[{\"message\":{\"content\":\"ok\"}}]}".getBytes(StandardCharsets.UTF_8);
          exchange.sendResponseHeaders(200, body.length);
          try (OutputStream out = exchange.getResponseBody()) {
            out.write(body);
          }
        });
    server.start();
    serverUrl = "http://127.0.0.1:" + server.getAddress().getPort();
  }

  @AfterEach
  void tearDown() {
    server.stop(0);
  }

  private OpenAiCapabilityProvider provider(String endpoint, String apiKey) {
    OpenAiProperties properties =
        new OpenAiProperties(
            endpoint,
            apiKey,
            "2024-06-01",
            "whisper",
            "gpt-4o",
            "tts",
            "alloy",
            1.0,
            "mp3",
            5,
            10,
            false);
    return new OpenAiCapabilityProvider(properties, HttpClient.newHttpClient(), new ObjectMapper());
  }

  @Test
  void resolve_shouldUseConfiguredDefaults() {
    Capabilities capabilities = provider(serverUrl, "default-key").resolve(ProviderOverrides.NONE);

    capabilities.summarization().summarize("s", "p", 750, CancellationSignal.create());

    assertThat(seen).containsExactly("/openai/deployments/gpt-4o/chat/completions key=default-key");
  }

  @Test
  void resolve_shouldPreferRequestOverridesFieldByField() {
    ProviderOverrides overrides =
        new ProviderOverrides(serverUrl, "request-key", null, "gpt-4o-mini", " ", null, null);

    Capabilities capabilities =
        provider("http://unused.invalid", "default-key").resolve(overrides);
    capabilities.summarization().summarize("s", "p", 750, CancellationSignal.create());

    assertThat(seen)
        .containsExactly("/openai/deployments/gpt-4o-mini/chat/completions key=request-key");
  }

  @Test
  void resolve_shouldRequireEndpointAndKey() {
    assertThatThrownBy(() -> provider("", "").resolve(ProviderOverrides.NONE))
        .isInstanceOf(IllegalStateException.class);
  }
}
