package ca.gc.cra.trail.application.port.store;

import ca.gc.cra.trail.domain.audit.AuditRecord;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * <strong>What:</strong> Durable, append-only storage of audit records with a pending and a processed area.
 * <p><strong>Invariants:</strong>
 * <ul>
 *   <li>Each record is one immutable file named from its trace id; persisting over an existing file fails.</li>
 *   <li>{@link #moveToProcessed(RecordHandle)} is a rename, so a record is never visible in both areas or in
 *       neither.</li>
 *   <li>{@link #purgeProcessedOlderThan(Duration, boolean)} only deletes from the processed area, by creation
 *       time.</li>
 * </ul>
 *
 * @since 0.1.0
 */
public interface RecordStorePort {
  /**
   * Persists a record into the pending area.
   *
   * @param record record to write
   * @return handle to the new file
   * @throws IOException when the file cannot be written or already exists
   */
  RecordHandle persist(AuditRecord record) throws IOException;

  /**
   * Lists pending records, oldest first.
   *
   * @return pending handles in insertion order
   * @throws IOException when the pending area cannot be listed
   */
  List<RecordHandle> listPending() throws IOException;

  /**
   * Lists processed records, oldest first.
   *
   * @return processed handles
   * @throws IOException when the processed area cannot be listed
   */
  List<RecordHandle> listProcessed() throws IOException;

  /**
   * Reads the serialized record.
   *
   * @param handle record handle
   * @return JSON text, or empty when the file vanished
   * @throws IOException when the file exists but cannot be read
   */
  Optional<String> read(RecordHandle handle) throws IOException;

  /**
   * Moves a pending record to the processed area. Succeeds silently if it already moved.
   *
   * @param handle pending record
   * @throws IOException when the rename fails
   */
  void moveToProcessed(RecordHandle handle) throws IOException;

  /**
   * Deletes (or, in preview, lists) processed records older than {@code retention}.
   *
   * @param retention retention window
   * @param preview when {@code true}, nothing is deleted
   * @return purge report
   * @throws IOException when the processed area cannot be listed
   */
  PurgeReport purgeProcessedOlderThan(Duration retention, boolean preview) throws IOException;

  /**
   * Checks whether a record file exists in either area.
   *
   * @param fileName record file name
   * @return {@code true} when pending or processed
   */
  boolean exists(String fileName);
}
