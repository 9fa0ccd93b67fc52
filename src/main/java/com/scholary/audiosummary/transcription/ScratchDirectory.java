package com.scholary.audiosummary.transcription;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A uniquely named working directory that is deleted, with everything in it, when closed.
 *
 * <p>Use in try-with-resources. Deletion failures are logged, never thrown, so they cannot mask the
 * exception that ended the block.
 */
public final class ScratchDirectory implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(ScratchDirectory.class);

  private final Path path;

  private ScratchDirectory(Path path) {
    this.path = path;
  }

  /**
   * Create a new directory under {@code root} named {@code prefix} plus a random suffix.
   *
   * @throws IOException if the directory cannot be created
   */
  public static ScratchDirectory create(Path root, String prefix) throws IOException {
    Files.createDirectories(root);
    Path dir = Files.createTempDirectory(root, prefix);
    LOGGER.debug("Created scratch directory {}", dir);
    return new ScratchDirectory(dir);
  }

  public Path path() {
    return path;
  }

  @Override
  public void close() {
    if (!Files.exists(path)) {
      return;
    }
    List<Path> entries;
    try (Stream<Path> walk = Files.walk(path)) {
      entries = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
    } catch (IOException e) {
      LOGGER.warn("Failed to list scratch directory {}: {}", path, e.getMessage());
      return;
    }
    for (Path entry : entries) {
      try {
        Files.deleteIfExists(entry);
      } catch (IOException e) {
        LOGGER.warn("Failed to delete {}: {}", entry, e.getMessage());
      }
    }
    LOGGER.debug("Deleted scratch directory {}", path);
  }
}
