package com.scholary.audiosummary.config;

import com.scholary.audiosummary.objectstore.LocalFileObjectStoreClient;
import com.scholary.audiosummary.objectstore.ObjectStoreClient;
import com.scholary.audiosummary.objectstore.ObjectStoreProperties;
import com.scholary.audiosummary.objectstore.S3ObjectStoreClient;
import java.nio.file.Paths;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for object storage.
 *
 * <p>This wires up the ObjectStoreClient bean using properties from application.yml. The store
 * type picks the filesystem or the S3 implementation.
 */
@Configuration
@EnableConfigurationProperties(ObjectStoreProperties.class)
public class ObjectStoreConfig {

  @Bean
  public ObjectStoreClient objectStoreClient(ObjectStoreProperties properties) {
    if (properties.type() == ObjectStoreProperties.StoreType.S3) {
      return new S3ObjectStoreClient(properties);
    }
    if (properties.localBasePath() == null || properties.localBasePath().isBlank()) {
      throw new IllegalArgumentException("objectstore.localBasePath is required for the local store");
    }
    return new LocalFileObjectStoreClient(Paths.get(properties.localBasePath()));
  }
}
