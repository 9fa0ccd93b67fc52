package com.scholary.audiosummary.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.HexFormat;
import org.junit.jupiter.api.Test;

class CacheKeyServiceTest {

  private final CacheKeyService service = new CacheKeyService();

  @Test
  void deriveKey_shouldUseFirst32HexCharsOfSha256ForUrls() throws Exception {
    String url = "https://example.com/ep1.mp3";
    byte[] digest =
        MessageDigest.getInstance("SHA-256").digest(url.getBytes(StandardCharsets.UTF_8));
    String expected = HexFormat.of().formatHex(digest).substring(0, 32);

    String key = service.deriveKey(url);

    assertThat(key).isEqualTo(expected);
    assertThat(key).matches("[0-9a-f]{32}");
  }

  @Test
  void deriveKey_shouldBeDeterministic() {
    assertThat(service.deriveKey("http://example.com/a.mp3"))
        .isEqualTo(service.deriveKey("http://example.com/a.mp3"));
  }

  @Test
  void deriveKey_shouldNotNormalizeUrls() {
    assertThat(service.deriveKey("https://x/a")).isNotEqualTo(service.deriveKey("https://x/a/"));
  }

  @Test
  void deriveKey_shouldMatchSchemeCaseInsensitively() {
    String key = service.deriveKey("HTTPS://Example.com/Episode.mp3");

    assertThat(key).hasSize(32).isNotEqualTo("HTTPS://Example.com/Episode.mp3");
  }

  @Test
  void deriveKey_shouldReturnNonUrlIdentifierUnchanged() {
    assertThat(service.deriveKey("3f2a9c0d1e")).isEqualTo("3f2a9c0d1e");
    assertThat(service.deriveKey("ftp://example.com/a.mp3")).isEqualTo("ftp://example.com/a.mp3");
  }

  @Test
  void deriveKey_shouldRejectBlankIdentifier() {
    assertThatThrownBy(() -> service.deriveKey(null)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> service.deriveKey("   "))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void isUrl_shouldRecognizeHttpAndHttps() {
    assertThat(service.isUrl("http://a")).isTrue();
    assertThat(service.isUrl("Https://a")).isTrue();
    assertThat(service.isUrl("episodes/abc")).isFalse();
  }
}
