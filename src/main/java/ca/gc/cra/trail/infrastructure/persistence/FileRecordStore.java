package ca.gc.cra.trail.infrastructure.persistence;

import ca.gc.cra.trail.application.audit.AuditJson;
import ca.gc.cra.trail.application.port.ClockPort;
import ca.gc.cra.trail.application.port.store.PurgeReport;
import ca.gc.cra.trail.application.port.store.RecordHandle;
import ca.gc.cra.trail.application.port.store.RecordStorePort;
import ca.gc.cra.trail.domain.audit.AuditRecord;
import ca.gc.cra.trail.domain.trace.TraceId;
import ca.gc.cra.trail.infrastructure.fs.OwnerOnlyFiles;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> File-system {@link RecordStorePort}: pending records in the store root, delivered records
 * in {@code processed/}.
 * <p><strong>Why:</strong> One JSON file per record keeps records immutable and lets delivery move them with an
 * atomic rename.</p>
 * <p><strong>Thread-safety:</strong> {@link #persist(AuditRecord)} is called under the chain lease; the remaining
 * operations tolerate concurrent renames by treating vanished files as already handled.</p>
 *
 * @since 0.1.0
 */
public final class FileRecordStore implements RecordStorePort {
  private static final Logger log = LoggerFactory.getLogger(FileRecordStore.class);
  static final String PROCESSED_DIR = "processed";
  private static final String RECORD_SUFFIX = ".json";
  private static final Comparator<RecordHandle> OLDEST_FIRST =
      Comparator.comparing(RecordHandle::createdAt).thenComparing(RecordHandle::fileName);

  private final Path pendingDir;
  private final Path processedDir;
  private final ClockPort clock;

  /**
   * Opens (creating when missing) a record store.
   *
   * @param root store directory
   * @param clock clock used for retention ages
   * @throws IOException when the directories cannot be created
   */
  public FileRecordStore(Path root, ClockPort clock) throws IOException {
    this.pendingDir = OwnerOnlyFiles.createPrivateDirectories(Objects.requireNonNull(root, "root"));
    this.processedDir = OwnerOnlyFiles.createPrivateDirectories(root.resolve(PROCESSED_DIR));
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /** Store root holding the pending records. */
  public Path root() {
    return pendingDir;
  }

  @Override
  public RecordHandle persist(AuditRecord record) throws IOException {
    Objects.requireNonNull(record, "record");
    String fileName = TraceId.parse(record.traceId()).fileName();
    Path target = pendingDir.resolve(fileName);
    if (exists(fileName)) {
      throw new FileAlreadyExistsException(target.toString(), null, "audit records are write-once");
    }
    Path temp = Files.createTempFile(pendingDir, ".trail-", ".part", OwnerOnlyFiles.fileAttributes());
    try {
      Files.write(temp, AuditJson.write(record).getBytes(StandardCharsets.UTF_8));
      OwnerOnlyFiles.restrictFile(temp);
      Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
    } finally {
      Files.deleteIfExists(temp);
    }
    log.debug("Persisted audit record {}", target);
    return handle(target);
  }

  @Override
  public List<RecordHandle> listPending() throws IOException {
    return list(pendingDir);
  }

  @Override
  public List<RecordHandle> listProcessed() throws IOException {
    return list(processedDir);
  }

  @Override
  public Optional<String> read(RecordHandle handle) throws IOException {
    Objects.requireNonNull(handle, "handle");
    try {
      return Optional.of(Files.readString(handle.path(), StandardCharsets.UTF_8));
    } catch (NoSuchFileException ex) {
      return Optional.empty();
    }
  }

  @Override
  public void moveToProcessed(RecordHandle handle) throws IOException {
    Objects.requireNonNull(handle, "handle");
    Path target = processedDir.resolve(handle.fileName());
    try {
      Files.move(pendingDir.resolve(handle.fileName()), target, StandardCopyOption.ATOMIC_MOVE);
    } catch (NoSuchFileException ex) {
      if (!Files.exists(target)) {
        throw ex;
      }
      log.debug("Record {} already moved to processed", handle.fileName());
    }
  }

  @Override
  public PurgeReport purgeProcessedOlderThan(Duration retention, boolean preview) throws IOException {
    Objects.requireNonNull(retention, "retention");
    if (retention.isNegative()) {
      throw new IllegalArgumentException("retention must not be negative");
    }
    Instant now = clock.now();
    List<String> expired = new ArrayList<>();
    List<String> deleted = new ArrayList<>();
    for (RecordHandle handle : listProcessed()) {
      if (Duration.between(handle.createdAt(), now).compareTo(retention) <= 0) {
        continue;
      }
      expired.add(handle.fileName());
      if (preview) {
        continue;
      }
      try {
        if (Files.deleteIfExists(handle.path())) {
          deleted.add(handle.fileName());
        }
      } catch (IOException ex) {
        log.warn("Unable to delete expired record {}: {}", handle.path(), ex.getMessage());
      }
    }
    if (!expired.isEmpty()) {
      log.info("Retention {} ({}): {} expired, {} deleted",
          retention, preview ? "preview" : "apply", expired.size(), deleted.size());
    }
    return new PurgeReport(preview, expired, deleted);
  }

  @Override
  public boolean exists(String fileName) {
    Objects.requireNonNull(fileName, "fileName");
    return Files.exists(pendingDir.resolve(fileName)) || Files.exists(processedDir.resolve(fileName));
  }

  private List<RecordHandle> list(Path dir) throws IOException {
    List<RecordHandle> handles = new ArrayList<>();
    try (Stream<Path> entries = Files.list(dir)) {
      for (Path path : (Iterable<Path>) entries::iterator) {
        String name = path.getFileName().toString();
        if (!name.endsWith(RECORD_SUFFIX) || name.startsWith(".") || !Files.isRegularFile(path)) {
          continue;
        }
        try {
          handles.add(handle(path));
        } catch (NoSuchFileException ex) {
          log.debug("Record {} vanished while listing", path);
        }
      }
    }
    handles.sort(OLDEST_FIRST);
    return handles;
  }

  private static RecordHandle handle(Path path) throws IOException {
    Instant created = Files.getLastModifiedTime(path).toInstant();
    return new RecordHandle(path.getFileName().toString(), path, created);
  }
}
