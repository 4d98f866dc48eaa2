package ca.gc.cra.trail.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void logNamesAllowCloudWatchCharacters() {
    assertEquals("/trail/audit#2", Strings.requireLogName("logGroup", " /trail/audit#2 "));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireLogName("logGroup", "with space"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireLogName("logGroup", "x".repeat(513)));
  }

  @Test
  void blankAndControlCharactersAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("model", "  "));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("model", "a\u0007b"));
  }

  @Test
  void topicsAreRestricted() {
    assertEquals("trail.audit", Strings.sanitizeTopic("topic", "trail.audit"));
    assertThrows(IllegalArgumentException.class, () -> Strings.sanitizeTopic("topic", "trail/audit"));
  }
}
