package ca.gc.cra.trail.infrastructure.sink;

import ca.gc.cra.trail.application.port.sink.LogEvent;
import ca.gc.cra.trail.application.port.sink.LogSinkPort;
import ca.gc.cra.trail.application.port.sink.TransportException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Objects;

/**
 * Appends audit events to local files, one serialized record per line.
 * <p>Events for group {@code G} and stream {@code S} land in {@code <dir>/<G>/<S>.log} with unsafe characters
 * replaced. Each call is forced to disk before it returns, which is this sink's acknowledgement.</p>
 * <p>Synchronized to avoid interleaved lines when several threads share one adapter.</p>
 *
 * @since 0.1.0
 */
public final class FileLogSinkAdapter implements LogSinkPort {
  private final Path outputDirectory;

  /**
   * Creates a file-backed sink.
   *
   * @param outputDirectory root directory for log files
   * @throws NullPointerException if {@code outputDirectory} is {@code null}
   */
  public FileLogSinkAdapter(Path outputDirectory) {
    this.outputDirectory = Objects.requireNonNull(outputDirectory, "outputDirectory");
  }

  @Override
  public synchronized void put(String logGroup, String logStream, List<LogEvent> events)
      throws TransportException {
    Objects.requireNonNull(events, "events");
    Path dir = outputDirectory.resolve(sanitize(logGroup));
    Path file = dir.resolve(sanitize(logStream) + ".log");
    StringBuilder lines = new StringBuilder();
    for (LogEvent event : events) {
      lines.append(event.message().replace('\n', ' ')).append('\n');
    }
    try {
      Files.createDirectories(dir);
      try (FileChannel channel = FileChannel.open(file,
          StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
        channel.write(ByteBuffer.wrap(lines.toString().getBytes(StandardCharsets.UTF_8)));
        channel.force(true);
      }
    } catch (IOException ex) {
      throw new TransportException("Unable to append to " + file + ": " + ex.getMessage(), ex);
    }
  }

  static String sanitize(String name) {
    Objects.requireNonNull(name, "name");
    String trimmed = name.strip().replaceFirst("^/+", "");
    StringBuilder sb = new StringBuilder(Math.max(16, trimmed.length()));
    for (int i = 0; i < trimmed.length(); i++) {
      char c = trimmed.charAt(i);
      if (Character.isLetterOrDigit(c) || c == '-' || c == '_' || c == '.') {
        sb.append(c);
      } else {
        sb.append('_');
      }
    }
    if (sb.length() == 0 || sb.toString().equals(".") || sb.toString().equals("..")) {
      return "x";
    }
    return sb.toString();
  }
}
