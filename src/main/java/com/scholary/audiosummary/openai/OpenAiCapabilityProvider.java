package com.scholary.audiosummary.openai;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.audiosummary.capability.Capabilities;
import com.scholary.audiosummary.capability.CapabilityProvider;
import com.scholary.audiosummary.capability.ProviderOverrides;
import java.net.http.HttpClient;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves capabilities backed by Azure OpenAI, merging per-request overrides over the configured
 * defaults field by field.
 */
public class OpenAiCapabilityProvider implements CapabilityProvider {

  private static final Logger LOGGER = LoggerFactory.getLogger(OpenAiCapabilityProvider.class);

  private final OpenAiProperties properties;
  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;

  public OpenAiCapabilityProvider(
      OpenAiProperties properties, HttpClient httpClient, ObjectMapper objectMapper) {
    this.properties = properties;
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
  }

  @Override
  public Capabilities resolve(ProviderOverrides overrides) {
    ProviderOverrides o = overrides == null ? ProviderOverrides.NONE : overrides;

    String endpoint = ProviderOverrides.orDefault(o.endpoint(), properties.endpoint());
    String apiKey = ProviderOverrides.orDefault(o.apiKey(), properties.apiKey());
    if (endpoint == null || endpoint.isBlank() || apiKey == null || apiKey.isBlank()) {
      throw new IllegalStateException(
          "OpenAI endpoint and API key must be configured or supplied with the request");
    }

    String transcriptionDeployment =
        ProviderOverrides.orDefault(o.transcriptionDeployment(), properties.transcriptionDeployment());
    String chatDeployment = ProviderOverrides.orDefault(o.chatDeployment(), properties.chatDeployment());
    String speechDeployment =
        ProviderOverrides.orDefault(o.speechDeployment(), properties.speechDeployment());
    double speed = o.speechSpeed() != null ? o.speechSpeed() : properties.speechSpeed();
    SpeechFormat format =
        SpeechFormat.from(ProviderOverrides.orDefault(o.speechFormat(), properties.speechFormat()));
    String voice = properties.speechVoice();

    if (!o.isEmpty()) {
      LOGGER.info(
          "Using request overrides: endpoint={}, transcription={}, chat={}, speech={}, speed={}, format={}",
          endpoint,
          transcriptionDeployment,
          chatDeployment,
          speechDeployment,
          speed,
          format);
    }

    OpenAiClient client =
        new OpenAiClient(
            httpClient,
            objectMapper,
            endpoint,
            apiKey,
            properties.apiVersion(),
            Duration.ofSeconds(properties.readTimeoutSeconds()));

    return new Capabilities(
        (audioFile, signal) -> client.transcribe(transcriptionDeployment, audioFile, signal),
        (instructions, prompt, targetWords, signal) ->
            client.chat(chatDeployment, instructions, prompt, signal),
        (text, target, signal) ->
            client.speech(speechDeployment, text, voice, format, speed, target, signal));
  }
}
