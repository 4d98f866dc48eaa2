package ca.gc.cra.trail.domain.delivery;

import java.util.List;
import java.util.Objects;

/**
 * Summary of an upload run.
 *
 * @param preview whether the run was a dry run
 * @param outcomes per-record outcomes in processing order
 * @param purged processed records deleted by retention
 * @param wouldPurge processed records past retention (deleted or, in preview, to be deleted)
 * @since 0.1.0
 */
public record DeliveryReport(boolean preview, List<DeliveryOutcome> outcomes, int purged, int wouldPurge) {
  public DeliveryReport {
    outcomes = List.copyOf(Objects.requireNonNull(outcomes, "outcomes"));
    if (purged < 0 || wouldPurge < 0) {
      throw new IllegalArgumentException("purge counts must be >= 0");
    }
  }

  public int succeeded() {
    return count(DeliveryOutcome.Status.DELIVERED);
  }

  public int failed() {
    return count(DeliveryOutcome.Status.FAILED);
  }

  public int skipped() {
    return count(DeliveryOutcome.Status.SKIPPED);
  }

  public int wouldDeliver() {
    return count(DeliveryOutcome.Status.WOULD_DELIVER);
  }

  /** Whether any record failed. */
  public boolean hasFailures() {
    return failed() > 0;
  }

  private int count(DeliveryOutcome.Status status) {
    return (int) outcomes.stream().filter(o -> o.status() == status).count();
  }
}
