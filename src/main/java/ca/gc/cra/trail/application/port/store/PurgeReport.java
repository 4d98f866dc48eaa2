package ca.gc.cra.trail.application.port.store;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of a retention sweep over the processed area.
 *
 * @param preview whether deletions were only simulated
 * @param expired processed records older than the retention window, oldest first
 * @param deleted records actually deleted (empty in preview)
 * @since 0.1.0
 */
public record PurgeReport(boolean preview, List<String> expired, List<String> deleted) {
  public PurgeReport {
    expired = List.copyOf(Objects.requireNonNull(expired, "expired"));
    deleted = List.copyOf(Objects.requireNonNull(deleted, "deleted"));
  }

  /**
   * Returns the number of records that would be deleted.
   *
   * @return expired count
   */
  public int wouldDelete() {
    return expired.size();
  }
}
