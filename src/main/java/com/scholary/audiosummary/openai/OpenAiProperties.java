package com.scholary.audiosummary.openai;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the Azure OpenAI backends.
 *
 * <p>These control which deployments serve transcription, summarization and speech, and how long
 * calls may take. Endpoint and key may be left blank when every request supplies its own, or when
 * {@code mock} is on.
 */
@ConfigurationProperties(prefix = "openai")
@Validated
public record OpenAiProperties(
    String endpoint,
    String apiKey,
    @NotBlank String apiVersion,
    @NotBlank String transcriptionDeployment,
    @NotBlank String chatDeployment,
    @NotBlank String speechDeployment,
    @NotBlank String speechVoice,
    @Positive double speechSpeed,
    @NotBlank String speechFormat,
    @Positive int connectTimeoutSeconds,
    @Positive int readTimeoutSeconds,
    boolean mock) {}
