package ca.gc.cra.trail.application.port.store;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;

/**
 * Reference to one persisted record file.
 *
 * @param fileName file name ({@code <uuid>.json})
 * @param path current location
 * @param createdAt creation time used for ordering and retention
 * @since 0.1.0
 */
public record RecordHandle(String fileName, Path path, Instant createdAt) {
  public RecordHandle {
    Objects.requireNonNull(fileName, "fileName");
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(createdAt, "createdAt");
  }
}
