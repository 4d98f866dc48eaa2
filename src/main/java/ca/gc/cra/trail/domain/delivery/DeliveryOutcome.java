package ca.gc.cra.trail.domain.delivery;

import java.util.Objects;

/**
 * Result for one pending record of an upload run.
 *
 * @param fileName record file name
 * @param status outcome
 * @param attempts submissions made (0 for skipped and preview outcomes)
 * @param reason failure or skip reason, or {@code null}
 * @since 0.1.0
 */
public record DeliveryOutcome(String fileName, Status status, int attempts, String reason) {
  /** Skip reason for a record the sink acknowledged before an interrupted move. */
  public static final String ALREADY_ACKNOWLEDGED = "already-acknowledged";
  /** Skip reason for records left after the sink rejected the credentials. */
  public static final String SINK_UNAUTHORIZED = "sink-unauthorized";
  /** Skip reason when another upload holds the delivery lock. */
  public static final String DELIVERY_IN_PROGRESS = "delivery-in-progress";
  /** Skip reason for a record moved or deleted while the batch ran. */
  public static final String VANISHED = "vanished";

  public DeliveryOutcome {
    Objects.requireNonNull(fileName, "fileName");
    Objects.requireNonNull(status, "status");
  }

  /** Outcome kinds. */
  public enum Status {
    DELIVERED,
    FAILED,
    SKIPPED,
    WOULD_DELIVER
  }
}
