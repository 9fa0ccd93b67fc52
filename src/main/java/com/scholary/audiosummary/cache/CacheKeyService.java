package com.scholary.audiosummary.cache;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Derives the cache key that addresses every stored artifact of a source.
 *
 * <p>URLs (http or https, scheme matched case-insensitively) are hashed: the key is the first 32
 * lowercase hex characters of the SHA-256 digest of the exact URL string. Nothing is normalized,
 * so {@code https://x/a} and {@code https://x/a/} are different sources. Anything that is not a URL
 * is taken to be a key that was already derived and is returned unchanged.
 */
@Component
public class CacheKeyService {

  private static final Logger LOGGER = LoggerFactory.getLogger(CacheKeyService.class);

  static final int KEY_LENGTH = 32;

  /**
   * Derive the cache key for a source identifier.
   *
   * @param identifier a source URL or an existing cache key
   * @return the cache key
   * @throws IllegalArgumentException if the identifier is null or blank
   */
  public String deriveKey(String identifier) {
    if (identifier == null || identifier.isBlank()) {
      throw new IllegalArgumentException("Source identifier cannot be null or empty");
    }

    if (!isUrl(identifier)) {
      LOGGER.debug("Using identifier as cache key: {}", identifier);
      return identifier;
    }

    String key = HexFormat.of().formatHex(sha256(identifier)).substring(0, KEY_LENGTH);
    LOGGER.debug("Derived cache key {} for url={}", key, identifier);
    return key;
  }

  /** Whether the identifier is treated as a URL rather than a pre-derived key. */
  public boolean isUrl(String identifier) {
    String lower = identifier.toLowerCase(Locale.ROOT);
    return lower.startsWith("http://") || lower.startsWith("https://");
  }

  private static byte[] sha256(String value) {
    try {
      return MessageDigest.getInstance("SHA-256").digest(value.getBytes(StandardCharsets.UTF_8));
    } catch (NoSuchAlgorithmException e) {
      // every JRE ships SHA-256
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
