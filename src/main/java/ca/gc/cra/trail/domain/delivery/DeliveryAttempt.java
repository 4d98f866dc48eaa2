package ca.gc.cra.trail.domain.delivery;

import java.util.Objects;

/**
 * <strong>What:</strong> State of delivering one record.
 * <p><strong>Transitions:</strong> {@code Attempting -> Succeeded} on acknowledgement;
 * {@code Attempting -> Backoff} on throttling while under the attempt cap, else {@code Failed};
 * {@code Attempting -> Failed} on any other error; {@code Backoff -> Attempting} once the deadline passed.
 * {@code Succeeded} and {@code Failed} are terminal.</p>
 *
 * @since 0.1.0
 */
public sealed interface DeliveryAttempt {
  /**
   * Attempts made so far, including the current one.
   *
   * @return 1-based attempt number
   */
  int attemptNumber();

  /**
   * Whether the attempt reached a terminal state.
   *
   * @return {@code true} for succeeded or failed
   */
  default boolean terminal() {
    return this instanceof Succeeded || this instanceof Failed;
  }

  /**
   * Starts delivery of a record.
   *
   * @return first attempt
   */
  static Attempting start() {
    return new Attempting(1);
  }

  /** Submission in progress. */
  record Attempting(int attemptNumber) implements DeliveryAttempt {
    public Attempting {
      if (attemptNumber < 1) {
        throw new IllegalArgumentException("attemptNumber must be >= 1");
      }
    }

    public Succeeded acknowledged() {
      return new Succeeded(attemptNumber);
    }

    public DeliveryAttempt throttled(RetryPolicy policy, long nowMillis) {
      Objects.requireNonNull(policy, "policy");
      if (!policy.allowsRetryAfter(attemptNumber)) {
        return new Failed(attemptNumber, "throttled after " + attemptNumber + " attempt(s)");
      }
      return new Backoff(attemptNumber, nowMillis + policy.backoffMillis(attemptNumber));
    }

    public Failed failed(String reason) {
      return new Failed(attemptNumber, reason);
    }
  }

  /** Waiting before the next submission. */
  record Backoff(int attemptNumber, long deadlineMillis) implements DeliveryAttempt {
    public Attempting resume() {
      return new Attempting(attemptNumber + 1);
    }

    public long remainingMillis(long nowMillis) {
      return Math.max(0L, deadlineMillis - nowMillis);
    }
  }

  /** Sink acknowledged the record. */
  record Succeeded(int attemptNumber) implements DeliveryAttempt {}

  /** Delivery gave up. */
  record Failed(int attemptNumber, String reason) implements DeliveryAttempt {
    public Failed {
      Objects.requireNonNull(reason, "reason");
    }
  }
}
