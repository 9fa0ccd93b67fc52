package com.scholary.audiosummary.objectstore;

import com.scholary.audiosummary.error.NotFoundException;
import com.scholary.audiosummary.error.StorageFailedException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Object store on the local filesystem, for development and tests.
 *
 * <p>Keys map to paths under the base directory. Writes go to a temporary sibling first and are
 * moved into place, so readers never see a half-written object.
 */
public class LocalFileObjectStoreClient implements ObjectStoreClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(LocalFileObjectStoreClient.class);

  private final Path basePath;

  public LocalFileObjectStoreClient(Path basePath) {
    this.basePath = basePath.toAbsolutePath().normalize();
    try {
      Files.createDirectories(this.basePath);
    } catch (IOException e) {
      throw new StorageFailedException("Failed to create storage directory: " + basePath, e);
    }
    LOGGER.info("Using local object store at {}", this.basePath);
  }

  @Override
  public InputStream getObjectStream(String key) {
    Path path = resolve(key);
    try {
      return Files.newInputStream(path);
    } catch (NoSuchFileException e) {
      throw new NotFoundException("Object not found: key=" + key, e);
    } catch (IOException e) {
      throw new StorageFailedException("Failed to read object: key=" + key, e);
    }
  }

  @Override
  public void putObject(String key, InputStream data, long contentLength, String contentType) {
    Path path = resolve(key);
    Path partial = null;
    try {
      Files.createDirectories(path.getParent());
      partial = Files.createTempFile(path.getParent(), ".upload-", ".part");
      long written = Files.copy(data, partial, StandardCopyOption.REPLACE_EXISTING);
      Files.move(
          partial, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      LOGGER.debug("Stored object: key={}, bytes={}", key, written);
    } catch (IOException e) {
      deleteQuietly(partial);
      throw new StorageFailedException("Failed to store object: key=" + key, e);
    }
  }

  @Override
  public ObjectMetadata getObjectMetadata(String key) {
    Path path = resolve(key);
    try {
      return new ObjectMetadata(Files.size(path), Files.probeContentType(path));
    } catch (NoSuchFileException e) {
      throw new NotFoundException("Object not found: key=" + key, e);
    } catch (IOException e) {
      throw new StorageFailedException("Failed to read object metadata: key=" + key, e);
    }
  }

  @Override
  public boolean exists(String key) {
    return Files.isRegularFile(resolve(key));
  }

  @Override
  public void delete(String key) {
    try {
      Files.deleteIfExists(resolve(key));
    } catch (IOException e) {
      throw new StorageFailedException("Failed to delete object: key=" + key, e);
    }
  }

  private Path resolve(String key) {
    if (key == null || key.isBlank()) {
      throw new IllegalArgumentException("Object key cannot be empty");
    }
    Path path = basePath.resolve(key).normalize();
    if (!path.startsWith(basePath) || path.equals(basePath)) {
      throw new IllegalArgumentException("Object key escapes the store: " + key);
    }
    return path;
  }

  private static void deleteQuietly(Path path) {
    if (path == null) {
      return;
    }
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      LOGGER.warn("Failed to delete partial upload {}: {}", path, e.getMessage());
    }
  }
}
