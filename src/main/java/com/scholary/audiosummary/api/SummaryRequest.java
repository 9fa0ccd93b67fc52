package com.scholary.audiosummary.api;

import com.scholary.audiosummary.capability.ProviderOverrides;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;

/**
 * Request to summarize one audio source.
 *
 * <p>Everything except {@code url} is optional and overrides the configured backend settings for
 * this request only.
 */
public record SummaryRequest(
    @Schema(description = "Source URL, or the episode id of an already downloaded episode")
        @NotBlank(message = "url is required")
        String url,
    String endpoint,
    String apiKey,
    String transcriptionDeployment,
    String chatDeployment,
    String speechDeployment,
    @DecimalMin("0.25") @DecimalMax("4.0") Double speechSpeed,
    @Schema(description = "mp3, opus, aac, flac, wav or pcm") String speechFormat) {

  public ProviderOverrides toOverrides() {
    return new ProviderOverrides(
        endpoint,
        apiKey,
        transcriptionDeployment,
        chatDeployment,
        speechDeployment,
        speechSpeed,
        speechFormat);
  }
}
