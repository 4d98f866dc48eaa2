package ca.gc.cra.trail.domain.delivery;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class RetryPolicyTest {

  @Test
  void backoffDoublesPerAttempt() {
    RetryPolicy policy = new RetryPolicy(3, 1_000L);

    assertEquals(2_000L, policy.backoffMillis(1));
    assertEquals(4_000L, policy.backoffMillis(2));
    assertEquals(8_000L, policy.backoffMillis(3));
  }

  @Test
  void capCountsTotalSubmissions() {
    RetryPolicy policy = RetryPolicy.DEFAULT;

    assertTrue(policy.allowsRetryAfter(1));
    assertTrue(policy.allowsRetryAfter(2));
    assertFalse(policy.allowsRetryAfter(3));
  }

  @Test
  void outOfRangeSettingsAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(0, 1_000L));
    assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(11, 1_000L));
    assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(3, -1L));
    assertThrows(IllegalArgumentException.class, () -> RetryPolicy.DEFAULT.backoffMillis(0));
  }
}
