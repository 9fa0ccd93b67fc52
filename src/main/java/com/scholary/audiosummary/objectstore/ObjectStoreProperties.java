package com.scholary.audiosummary.objectstore;

import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for object storage.
 *
 * <p>These map to the "objectstore.*" keys in application.yml. {@code type=local} stores objects
 * under {@code localBasePath}; {@code type=s3} uses the endpoint, credentials and bucket.
 */
@ConfigurationProperties(prefix = "objectstore")
@Validated
public record ObjectStoreProperties(
    @NotNull StoreType type,
    String localBasePath,
    String endpoint,
    String accessKey,
    String secretKey,
    String bucket,
    String region,
    boolean pathStyleAccess) {

  public enum StoreType {
    LOCAL,
    S3
  }
}
