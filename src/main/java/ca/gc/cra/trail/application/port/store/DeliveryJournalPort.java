package ca.gc.cra.trail.application.port.store;

import java.io.IOException;
import java.util.Set;

/**
 * Durable set of record hashes the sink has acknowledged but that may not have been moved to processed yet.
 *
 * @since 0.1.0
 */
public interface DeliveryJournalPort {
  /**
   * Checks whether a record was acknowledged.
   *
   * @param recordHash record hash
   * @return {@code true} when journaled
   * @throws IOException when the journal cannot be read
   */
  boolean contains(String recordHash) throws IOException;

  /**
   * Journals an acknowledgement. Must be durable before returning.
   *
   * @param recordHash acknowledged record hash
   * @throws IOException when the entry cannot be written
   */
  void append(String recordHash) throws IOException;

  /**
   * Drops every entry not in {@code stillPending}.
   *
   * @param stillPending hashes of records that are still in the pending area
   * @throws IOException when the journal cannot be rewritten
   */
  void retainOnly(Set<String> stillPending) throws IOException;
}
