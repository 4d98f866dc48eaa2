package ca.gc.cra.trail.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RedactionConfigTest {

  @Test
  void defaultsAreLocalOnly() {
    RedactionConfig config = RedactionConfig.fromMap(Map.of());

    assertEquals("ja", config.language());
    assertFalse(config.remote());
    assertFalse(config.usesRemoteService());
    assertEquals(0.7, config.confidenceThreshold());
    assertEquals(Duration.ofSeconds(10), config.classifierTimeout());
  }

  @Test
  void analysisAloneEnablesRemoteCalls() {
    RedactionConfig config = RedactionConfig.fromMap(Map.of("analysis", "yes", "language", "EN"));

    assertEquals("en", config.language());
    assertTrue(config.usesRemoteService());
  }

  @Test
  void invalidValuesAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> RedactionConfig.fromMap(Map.of("remote", "maybe")));
    assertThrows(IllegalArgumentException.class,
        () -> RedactionConfig.fromMap(Map.of("confidenceThreshold", "1.5")));
    assertThrows(IllegalArgumentException.class, () -> RedactionConfig.fromMap(Map.of("language", "japanese")));
    assertThrows(IllegalArgumentException.class,
        () -> RedactionConfig.fromMap(Map.of("classifierTimeoutMillis", "10")));
  }
}
