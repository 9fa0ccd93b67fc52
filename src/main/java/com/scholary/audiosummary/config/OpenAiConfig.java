package com.scholary.audiosummary.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.audiosummary.capability.CapabilityProvider;
import com.scholary.audiosummary.openai.MockCapabilityProvider;
import com.scholary.audiosummary.openai.OpenAiCapabilityProvider;
import com.scholary.audiosummary.openai.OpenAiProperties;
import java.net.http.HttpClient;
import java.time.Duration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the capability backends.
 *
 * <p>{@code openai.mock=true} swaps the Azure OpenAI provider for canned responses.
 */
@Configuration
@EnableConfigurationProperties(OpenAiProperties.class)
public class OpenAiConfig {

  @Bean
  @ConditionalOnProperty(name = "openai.mock", havingValue = "false", matchIfMissing = true)
  public CapabilityProvider openAiCapabilityProvider(
      OpenAiProperties properties, ObjectMapper objectMapper) {
    HttpClient httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeoutSeconds()))
            .build();
    return new OpenAiCapabilityProvider(properties, httpClient, objectMapper);
  }

  @Bean
  @ConditionalOnProperty(name = "openai.mock", havingValue = "true")
  public CapabilityProvider mockCapabilityProvider() {
    return new MockCapabilityProvider();
  }
}
