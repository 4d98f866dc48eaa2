package ca.gc.cra.trail.infrastructure.temp;

import ca.gc.cra.trail.infrastructure.fs.OwnerOnlyFiles;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Temporary file readable only by its owner that is deleted when the scope ends.
 * <p><strong>Why:</strong> Prompts handed to external tools may still hold data the tool needs but nobody else
 * should read.</p>
 * <p><strong>Restriction:</strong> created {@code rw-------} on POSIX systems and re-restricted after writing;
 * elsewhere the ACL is reduced to one owner entry. If the restriction fails a warning is logged and the file is
 * still used.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; confine to the creating scope.</p>
 *
 * @since 0.1.0
 */
public final class ScopedTempFile implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ScopedTempFile.class);
  private static final String SUFFIX = ".tmp";

  private final Path path;
  private final boolean restricted;
  private boolean closed;

  private ScopedTempFile(Path path, boolean restricted) {
    this.path = path;
    this.restricted = restricted;
  }

  /**
   * Creates a restricted temporary file holding {@code content}.
   *
   * @param directory parent directory, or {@code null} for the system temp directory
   * @param prefix file name prefix
   * @param content UTF-8 content, or {@code null} for an empty file
   * @return scoped file; close it to delete the file
   * @throws IOException when the file cannot be created or written
   */
  public static ScopedTempFile create(Path directory, String prefix, String content) throws IOException {
    return create(directory, prefix, content, OwnerOnlyFiles::restrictFile);
  }

  static ScopedTempFile create(Path directory, String prefix, String content, Restriction restriction)
      throws IOException {
    Objects.requireNonNull(restriction, "restriction");
    String safePrefix = prefix == null || prefix.isBlank() ? "trail-" : prefix;
    Path file = directory == null
        ? Files.createTempFile(safePrefix, SUFFIX, OwnerOnlyFiles.fileAttributes())
        : Files.createTempFile(directory, safePrefix, SUFFIX, OwnerOnlyFiles.fileAttributes());
    try {
      boolean restricted = restrict(file, restriction);
      if (content != null) {
        Files.writeString(file, content, StandardCharsets.UTF_8);
      }
      return new ScopedTempFile(file, restricted);
    } catch (IOException | RuntimeException ex) {
      try {
        Files.deleteIfExists(file);
      } catch (IOException deleteEx) {
        ex.addSuppressed(deleteEx);
      }
      throw ex;
    }
  }

  /**
   * Runs {@code work} with a scoped temporary file holding {@code content}; the file is deleted afterwards on
   * every path.
   *
   * @param content UTF-8 content
   * @param work work receiving the file path
   * @param <T> result type
   * @param <E> checked failure type of the work
   * @return result of the work
   * @throws IOException when the file cannot be created, written, or deleted
   * @throws E when the work fails
   */
  public static <T, E extends Exception> T withScopedTempFile(String content, ScopedWork<T, E> work)
      throws IOException, E {
    Objects.requireNonNull(work, "work");
    try (ScopedTempFile file = create(null, "trail-", content)) {
      return work.run(file.path());
    }
  }

  /** Location of the file. */
  public Path path() {
    return path;
  }

  /**
   * Whether owner-only permissions were applied.
   *
   * @return {@code false} when the restriction failed and a warning was logged
   */
  public boolean restricted() {
    return restricted;
  }

  /**
   * Deletes the file. Idempotent.
   *
   * @throws IOException when the file exists but cannot be deleted
   */
  @Override
  public void close() throws IOException {
    if (closed) {
      return;
    }
    closed = true;
    Files.deleteIfExists(path);
  }

  private static boolean restrict(Path file, Restriction restriction) {
    try {
      restriction.apply(file);
      return true;
    } catch (IOException | UnsupportedOperationException | SecurityException ex) {
      log.warn("SECURITY WARNING: could not restrict temporary file {} to its owner ({}); other local users may "
          + "be able to read it until it is deleted", file, ex.toString());
      return false;
    }
  }

  /** Applies owner-only permissions to a freshly created file. */
  @FunctionalInterface
  interface Restriction {
    void apply(Path file) throws IOException;
  }

  /**
   * Work executed against a scoped temporary file.
   *
   * @param <T> result type
   * @param <E> checked failure type
   */
  @FunctionalInterface
  public interface ScopedWork<T, E extends Exception> {
    T run(Path file) throws E;
  }
}
