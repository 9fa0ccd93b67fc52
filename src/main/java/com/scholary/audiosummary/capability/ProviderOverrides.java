package com.scholary.audiosummary.capability;

/**
 * Per-request backend settings. Any null or blank field falls back to the configured default.
 *
 * @param endpoint base URL of the backend
 * @param apiKey API key for the backend
 * @param transcriptionDeployment deployment (model) used for speech-to-text
 * @param chatDeployment deployment used for summarization
 * @param speechDeployment deployment used for text-to-speech
 * @param speechSpeed speed ratio for synthesized speech
 * @param speechFormat audio format for synthesized speech
 */
public record ProviderOverrides(
    String endpoint,
    String apiKey,
    String transcriptionDeployment,
    String chatDeployment,
    String speechDeployment,
    Double speechSpeed,
    String speechFormat) {

  public static final ProviderOverrides NONE =
      new ProviderOverrides(null, null, null, null, null, null, null);

  /** Return {@code value} unless it is null or blank, in which case return {@code fallback}. */
  public static String orDefault(String value, String fallback) {
    return value == null || value.isBlank() ? fallback : value;
  }

  public boolean isEmpty() {
    return isBlank(endpoint)
        && isBlank(apiKey)
        && isBlank(transcriptionDeployment)
        && isBlank(chatDeployment)
        && isBlank(speechDeployment)
        && speechSpeed == null
        && isBlank(speechFormat);
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
