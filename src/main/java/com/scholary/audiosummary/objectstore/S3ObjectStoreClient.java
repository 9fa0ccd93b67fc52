package com.scholary.audiosummary.objectstore;

import com.scholary.audiosummary.error.NotFoundException;
import com.scholary.audiosummary.error.StorageFailedException;
import java.io.InputStream;
import java.net.URI;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

/**
 * S3/MinIO implementation of ObjectStoreClient.
 *
 * <p>This uses AWS SDK v2, which works with both real S3 and S3-compatible services like MinIO. All
 * objects go to the one configured bucket, created at startup if it is missing. The SDK retries
 * transient failures itself; anything that still fails surfaces as {@link StorageFailedException}.
 */
public class S3ObjectStoreClient implements ObjectStoreClient, AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(S3ObjectStoreClient.class);

  private final S3Client s3Client;
  private final String bucket;

  public S3ObjectStoreClient(ObjectStoreProperties properties) {
    if (isBlank(properties.bucket())) {
      throw new IllegalArgumentException("objectstore.bucket is required for the s3 store");
    }
    LOGGER.info(
        "Initializing S3 client: endpoint={}, bucket={}, pathStyleAccess={}",
        properties.endpoint(),
        properties.bucket(),
        properties.pathStyleAccess());

    Region region = isBlank(properties.region()) ? Region.US_EAST_1 : Region.of(properties.region());

    S3ClientBuilder builder =
        S3Client.builder().region(region).forcePathStyle(properties.pathStyleAccess());
    if (!isBlank(properties.accessKey())) {
      builder.credentialsProvider(
          StaticCredentialsProvider.create(
              AwsBasicCredentials.create(properties.accessKey(), properties.secretKey())));
    }
    if (!isBlank(properties.endpoint())) {
      builder.endpointOverride(URI.create(properties.endpoint()));
    }

    this.s3Client = builder.build();
    this.bucket = properties.bucket();
    ensureBucket();

    LOGGER.info("S3 client initialized successfully");
  }

  @Override
  public InputStream getObjectStream(String key) {
    LOGGER.debug("Fetching object: bucket={}, key={}", bucket, key);

    try {
      return s3Client.getObject(GetObjectRequest.builder().bucket(bucket).key(key).build());

    } catch (NoSuchKeyException e) {
      throw new NotFoundException(
          String.format("Object not found: bucket=%s, key=%s", bucket, key), e);

    } catch (S3Exception e) {
      String message =
          String.format(
              "Failed to retrieve object: bucket=%s, key=%s, statusCode=%s",
              bucket, key, e.statusCode());
      LOGGER.error(message, e);
      throw new StorageFailedException(message, e);

    } catch (RuntimeException e) {
      String message =
          String.format("Unexpected error retrieving object: bucket=%s, key=%s", bucket, key);
      LOGGER.error(message, e);
      throw new StorageFailedException(message, e);
    }
  }

  @Override
  public void putObject(String key, InputStream data, long contentLength, String contentType) {
    LOGGER.debug(
        "Uploading object: bucket={}, key={}, contentLength={}, contentType={}",
        bucket,
        key,
        contentLength,
        contentType);

    try {
      PutObjectRequest request =
          PutObjectRequest.builder()
              .bucket(bucket)
              .key(key)
              .contentType(contentType)
              .contentLength(contentLength)
              .build();

      s3Client.putObject(request, RequestBody.fromInputStream(data, contentLength));

      LOGGER.info("Uploaded object: bucket={}, key={}, bytes={}", bucket, key, contentLength);

    } catch (S3Exception e) {
      String message =
          String.format(
              "Failed to upload object: bucket=%s, key=%s, statusCode=%s",
              bucket, key, e.statusCode());
      LOGGER.error(message, e);
      throw new StorageFailedException(message, e);

    } catch (RuntimeException e) {
      String message =
          String.format("Unexpected error uploading object: bucket=%s, key=%s", bucket, key);
      LOGGER.error(message, e);
      throw new StorageFailedException(message, e);
    }
  }

  @Override
  public ObjectMetadata getObjectMetadata(String key) {
    try {
      HeadObjectResponse response = head(key);
      return new ObjectMetadata(response.contentLength(), response.contentType());

    } catch (NoSuchKeyException e) {
      throw new NotFoundException(
          String.format("Object not found: bucket=%s, key=%s", bucket, key), e);

    } catch (S3Exception e) {
      if (e.statusCode() == 404) {
        throw new NotFoundException(
            String.format("Object not found: bucket=%s, key=%s", bucket, key), e);
      }
      String message =
          String.format(
              "Failed to get metadata: bucket=%s, key=%s, statusCode=%s",
              bucket, key, e.statusCode());
      LOGGER.error(message, e);
      throw new StorageFailedException(message, e);
    }
  }

  @Override
  public boolean exists(String key) {
    try {
      head(key);
      return true;

    } catch (NoSuchKeyException e) {
      return false;

    } catch (S3Exception e) {
      // HEAD responses carry no body, so a missing key can arrive as a bare 404
      if (e.statusCode() == 404) {
        return false;
      }
      String message =
          String.format(
              "Failed to check object: bucket=%s, key=%s, statusCode=%s",
              bucket, key, e.statusCode());
      LOGGER.error(message, e);
      throw new StorageFailedException(message, e);
    }
  }

  @Override
  public void delete(String key) {
    try {
      s3Client.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(key).build());
      LOGGER.info("Deleted object: bucket={}, key={}", bucket, key);

    } catch (S3Exception e) {
      String message =
          String.format(
              "Failed to delete object: bucket=%s, key=%s, statusCode=%s",
              bucket, key, e.statusCode());
      LOGGER.error(message, e);
      throw new StorageFailedException(message, e);
    }
  }

  private HeadObjectResponse head(String key) {
    return s3Client.headObject(HeadObjectRequest.builder().bucket(bucket).key(key).build());
  }

  private void ensureBucket() {
    try {
      s3Client.headBucket(HeadBucketRequest.builder().bucket(bucket).build());
    } catch (NoSuchBucketException e) {
      LOGGER.info("Bucket {} does not exist, creating it", bucket);
      s3Client.createBucket(CreateBucketRequest.builder().bucket(bucket).build());
    } catch (S3Exception e) {
      if (e.statusCode() != 404) {
        throw new StorageFailedException("Cannot access bucket " + bucket, e);
      }
      LOGGER.info("Bucket {} does not exist, creating it", bucket);
      s3Client.createBucket(CreateBucketRequest.builder().bucket(bucket).build());
    }
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  /** Release the SDK's connections and threads. */
  @Override
  public void close() {
    LOGGER.info("Closing S3 client");
    s3Client.close();
  }
}
