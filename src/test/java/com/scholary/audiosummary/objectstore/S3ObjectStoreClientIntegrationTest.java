package com.scholary.audiosummary.objectstore;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.audiosummary.error.NotFoundException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.wait.strategy.HttpWaitStrategy;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * Runs the S3 store against MinIO.
 *
 * <p>Skipped when Docker is not available.
 */
@Testcontainers(disabledWithoutDocker = true)
class S3ObjectStoreClientIntegrationTest {

  private static final String ACCESS_KEY = "minioadmin";
  private static final String SECRET_KEY = "minioadmin";

  @Container
  static GenericContainer<?> minio =
      new GenericContainer<>("minio/minio:latest")
          .withExposedPorts(9000)
          .withEnv("MINIO_ROOT_USER", ACCESS_KEY)
          .withEnv("MINIO_ROOT_PASSWORD", SECRET_KEY)
          .withCommand("server /data")
          .waitingFor(new HttpWaitStrategy().forPath("/minio/health/ready").forPort(9000));

  private static S3ObjectStoreClient store;

  @TempDir Path tempDir;

  @BeforeAll
  static void setUp() {
    String endpoint = String.format("http://%s:%d", minio.getHost(), minio.getMappedPort(9000));
    store =
        new S3ObjectStoreClient(
            new ObjectStoreProperties(
                ObjectStoreProperties.StoreType.S3,
                null,
                endpoint,
                ACCESS_KEY,
                SECRET_KEY,
                "audio-summary-test",
                "us-east-1",
                true));
  }

  @AfterAll
  static void tearDown() {
    if (store != null) {
      store.close();
    }
  }

  @Test
  void putAndGet_shouldRoundTripObject() {
    store.putBytes(
        "transcripts/k_summary.txt", "summary text".getBytes(StandardCharsets.UTF_8), "text/plain");

    assertThat(store.exists("transcripts/k_summary.txt")).isTrue();
    assertThat(new String(store.getBytes("transcripts/k_summary.txt"), StandardCharsets.UTF_8))
        .isEqualTo("summary text");
    assertThat(store.getObjectMetadata("transcripts/k_summary.txt").contentLength()).isEqualTo(12);
  }

  @Test
  void putFile_shouldUploadAndDownload() throws Exception {
    Path source = Files.write(tempDir.resolve("ep.mp3"), new byte[256 * 1024]);
    store.putFile("episodes/k.mp3", source, "audio/mpeg");

    Path target = tempDir.resolve("copy.mp3");
    store.downloadToFile("episodes/k.mp3", target);

    assertThat(Files.size(target)).isEqualTo(256 * 1024);
  }

  @Test
  void missingObject_shouldRaiseNotFound() {
    assertThat(store.exists("episodes/missing.mp3")).isFalse();
    assertThatThrownBy(() -> store.getBytes("episodes/missing.mp3"))
        .isInstanceOf(NotFoundException.class);
    assertThatThrownBy(() -> store.getObjectMetadata("episodes/missing.mp3"))
        .isInstanceOf(NotFoundException.class);
  }

  @Test
  void delete_shouldRemoveObject() {
    store.putBytes("a/b.txt", new byte[] {1}, "text/plain");

    store.delete("a/b.txt");

    assertThat(store.exists("a/b.txt")).isFalse();
  }
}
