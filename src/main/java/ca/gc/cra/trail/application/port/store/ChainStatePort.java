package ca.gc.cra.trail.application.port.store;

import ca.gc.cra.trail.domain.audit.IntegrityException;
import java.io.IOException;

/**
 * Persistent, mutually exclusive chain state ({@code last_hash}) shared by every process that writes records to
 * one store.
 *
 * @since 0.1.0
 */
public interface ChainStatePort {
  /**
   * Blocks until the chain lock is held and returns the lease.
   *
   * @return exclusive lease; must be closed
   * @throws IOException when the lock or state file cannot be accessed
   * @throws IntegrityException when the chain is halted or its state is unreadable
   */
  ChainLease acquire() throws IOException, IntegrityException;

  /**
   * Reports whether record creation is halted.
   *
   * @return {@code true} when a halt marker is present
   */
  boolean halted();

  /**
   * Returns the recorded halt reason.
   *
   * @return reason text, or {@code null} when not halted
   * @throws IOException when the marker cannot be read
   */
  String haltReason() throws IOException;

  /**
   * Clears a halt after the chain was verified and re-anchors the state on the verified tail.
   *
   * @param tailHash hash of the verified chain tail, or {@code null} for an empty store
   * @param sequence number of records in the verified chain
   * @throws IOException when the state cannot be written
   */
  void resetAfterVerification(String tailHash, long sequence) throws IOException;
}
