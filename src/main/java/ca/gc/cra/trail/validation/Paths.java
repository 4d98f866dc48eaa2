package ca.gc.cra.trail.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation utilities for TRAIL CLI flows.
 * <p><strong>Why:</strong> Prompt, response, and record files named on the command line are resolved to their
 * real path before use so diagnostics name the file that was actually read.</p>
 * <p><strong>Thread-safety:</strong> Stateless methods; concurrency limited by underlying filesystem semantics.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates that a path names an existing, readable regular file.
   *
   * @param label logical name for diagnostics (e.g., {@code record})
   * @param path candidate file
   * @return canonical path of the file
   * @throws IllegalArgumentException when the file is missing, not regular, or unreadable
   */
  public static Path requireReadableFile(String label, Path path) {
    if (path == null) {
      throw new IllegalArgumentException(label + " path must not be null");
    }
    try {
      Path real = path.toRealPath();
      if (!Files.isRegularFile(real)) {
        throw new IllegalArgumentException(label + " must be a regular file: " + path);
      }
      if (!Files.isReadable(real)) {
        throw new IllegalArgumentException(label + " is not readable: " + path);
      }
      return real;
    } catch (IOException ex) {
      throw new IllegalArgumentException(label + " does not exist: " + path, ex);
    }
  }
}
