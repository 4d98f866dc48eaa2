package ca.gc.cra.trail.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class DefaultsForModeTest {

  @Test
  void recordDefaultsUseLocalJapaneseRedaction() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("record");

    assertEquals("ja", defaults.get("language"));
    assertEquals("false", defaults.get("remote"));
    assertEquals("0.7", defaults.get("confidenceThreshold"));
    assertEquals("none", defaults.get("metricsExporter"));
    assertTrue(defaults.containsKey("storeDir"));
    assertFalse(defaults.containsKey("sink"));
  }

  @Test
  void uploadDefaultsIncludeDeliveryAndRetention() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("UPLOAD-ALL");

    assertEquals("CLOUDWATCH", defaults.get("sink"));
    assertEquals("/trail/audit", defaults.get("logGroup"));
    assertTrue(defaults.get("logStream").startsWith("audit-"));
    assertEquals("3", defaults.get("maxAttempts"));
    assertEquals("7d", defaults.get("retention"));
    assertEquals("200", defaults.get("pacingMillis"));
    assertEquals("false", defaults.get("dryRun"));
  }

  @Test
  void sendDefaultsOmitRetention() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("send");

    assertEquals("1000", defaults.get("backoffUnitMillis"));
    assertFalse(defaults.containsKey("retention"));
  }

  @Test
  void defaultsAreImmutable() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("verify");

    assertEquals("false", defaults.get("clearHalt"));
    assertThrows(UnsupportedOperationException.class, () -> defaults.put("clearHalt", "true"));
  }

  @Test
  void unsupportedCommandIsRejected() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> DefaultsForMode.asFlatMap("trace-id"));
    assertTrue(ex.getMessage().contains("Unsupported command"));
  }
}
