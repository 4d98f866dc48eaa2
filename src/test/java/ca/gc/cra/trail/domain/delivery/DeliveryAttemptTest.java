package ca.gc.cra.trail.domain.delivery;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.trail.domain.delivery.DeliveryAttempt.Attempting;
import ca.gc.cra.trail.domain.delivery.DeliveryAttempt.Backoff;
import ca.gc.cra.trail.domain.delivery.DeliveryAttempt.Failed;
import org.junit.jupiter.api.Test;

class DeliveryAttemptTest {
  private static final RetryPolicy POLICY = new RetryPolicy(3, 1_000L);

  @Test
  void throttlingWalksThroughBackoffUntilCap() {
    Attempting first = DeliveryAttempt.start();

    Backoff afterFirst = assertInstanceOf(Backoff.class, first.throttled(POLICY, 10_000L));
    assertEquals(12_000L, afterFirst.deadlineMillis());
    assertEquals(500L, afterFirst.remainingMillis(11_500L));
    assertEquals(0L, afterFirst.remainingMillis(20_000L));

    Attempting second = afterFirst.resume();
    assertEquals(2, second.attemptNumber());
    Backoff afterSecond = assertInstanceOf(Backoff.class, second.throttled(POLICY, 12_000L));
    assertEquals(16_000L, afterSecond.deadlineMillis());

    Failed capped = assertInstanceOf(Failed.class, afterSecond.resume().throttled(POLICY, 16_000L));
    assertEquals(3, capped.attemptNumber());
    assertEquals("throttled after 3 attempt(s)", capped.reason());
    assertTrue(capped.terminal());
  }

  @Test
  void acknowledgementAndFailureAreTerminal() {
    Attempting attempt = DeliveryAttempt.start();

    assertFalse(attempt.terminal());
    assertTrue(attempt.acknowledged().terminal());
    assertTrue(attempt.failed("boom").terminal());
    assertFalse(new Backoff(1, 0L).terminal());
  }
}
