package ca.gc.cra.trail.application.port.store;

import ca.gc.cra.trail.domain.audit.IntegrityException;
import java.io.IOException;

/**
 * Exclusive hold on the chain state for the duration of one record creation.
 *
 * <p>Protocol: read {@link #lastHash()}, build the record, {@link #prepare(String, String)} with its hash and file
 * name, persist the file, then {@link #commit(String)}. A lease closed after {@code prepare} but before
 * {@code commit} leaves the intent behind; the next acquisition rolls it forward when the file exists and back
 * otherwise.</p>
 *
 * @since 0.1.0
 */
public interface ChainLease extends AutoCloseable {
  /**
   * Returns the hash the next record must reference.
   *
   * @return last committed hash, or {@code null} for an empty chain
   */
  String lastHash();

  /**
   * Returns the number of committed records.
   *
   * @return chain length
   */
  long sequence();

  /**
   * Durably records the intent to append a record.
   *
   * @param recordHash hash of the record about to be persisted
   * @param fileName file name the record will be persisted under
   * @throws IOException when the state cannot be written
   * @throws IntegrityException when the lease is no longer usable
   */
  void prepare(String recordHash, String fileName) throws IOException, IntegrityException;

  /**
   * Advances the chain to the prepared record.
   *
   * @param recordHash hash passed to {@link #prepare(String, String)}
   * @throws IOException when the state cannot be written
   * @throws IntegrityException when the hash differs from the prepared one or the state changed under the lock
   */
  void commit(String recordHash) throws IOException, IntegrityException;

  /**
   * Releases the lock.
   *
   * @throws IOException when the lock cannot be released
   */
  @Override
  void close() throws IOException;
}
