package com.scholary.audiosummary.objectstore;

import com.scholary.audiosummary.error.NotFoundException;
import com.scholary.audiosummary.error.StorageFailedException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Abstraction for object storage operations.
 *
 * <p>All artifacts live in one store under slash-separated keys ({@code episodes/abc.mp3}). The
 * pipeline and metadata store only see this interface; S3 (or MinIO) and the local filesystem are
 * interchangeable behind it.
 *
 * <p>A missing object is reported as {@link NotFoundException}; every other failure as {@link
 * StorageFailedException}.
 */
public interface ObjectStoreClient {

  /**
   * Retrieve an object as a stream. The caller closes it.
   *
   * @param key the object key
   * @return an input stream for reading the object
   * @throws NotFoundException if the object doesn't exist
   */
  InputStream getObjectStream(String key);

  /**
   * Store an object from a stream, replacing any existing object with the same key.
   *
   * @param key the object key
   * @param data the object data
   * @param contentLength the size of the object in bytes
   * @param contentType the MIME type of the object
   */
  void putObject(String key, InputStream data, long contentLength, String contentType);

  /**
   * Get object metadata without downloading the content.
   *
   * @throws NotFoundException if the object doesn't exist
   */
  ObjectMetadata getObjectMetadata(String key);

  boolean exists(String key);

  /** Delete an object. Deleting a missing object is not an error. */
  void delete(String key);

  default void putBytes(String key, byte[] data, String contentType) {
    putObject(key, new ByteArrayInputStream(data), data.length, contentType);
  }

  default void putFile(String key, Path file, String contentType) {
    try (InputStream in = Files.newInputStream(file)) {
      putObject(key, in, Files.size(file), contentType);
    } catch (IOException e) {
      throw new StorageFailedException("Failed to read upload source: " + file, e);
    }
  }

  default byte[] getBytes(String key) {
    try (InputStream in = getObjectStream(key)) {
      return in.readAllBytes();
    } catch (IOException e) {
      throw new StorageFailedException("Failed to read object: key=" + key, e);
    }
  }

  /** Copy an object to a local file, creating parent directories as needed. */
  default void downloadToFile(String key, Path target) {
    try (InputStream in = getObjectStream(key)) {
      Path parent = target.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
    } catch (IOException e) {
      throw new StorageFailedException("Failed to download object: key=" + key, e);
    }
  }

  /** Object metadata returned by getObjectMetadata. */
  record ObjectMetadata(long contentLength, String contentType) {}
}
