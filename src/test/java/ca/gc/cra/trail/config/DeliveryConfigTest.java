package ca.gc.cra.trail.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.trail.application.delivery.DeliverySettings;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class DeliveryConfigTest {

  @Test
  void defaultsProduceCloudWatchSettings() {
    DeliveryConfig config = DeliveryConfig.fromMap(Map.of());

    assertEquals(SinkMode.CLOUDWATCH, config.sink());
    assertEquals(DeliveryConfig.DEFAULT_LOG_GROUP, config.logGroup());
    assertEquals(DefaultsForMode.asFlatMap("send").get("logStream"), config.logStream());
    assertTrue(config.logStream().startsWith("audit-"), config.logStream());
    assertEquals(DeliveryConfig.DEFAULT_RETENTION, config.retention());
    assertEquals(3, config.retryPolicy().maxAttempts());
    assertEquals(1_000L, config.retryPolicy().backoffUnitMillis());
    assertEquals(200L, config.pacingMillis());
    assertEquals(Duration.ofSeconds(10), config.sinkTimeout());
    assertEquals(Optional.empty(), config.region());
  }

  @Test
  void retentionAcceptsShortAndIsoForms() {
    assertEquals(Duration.ofDays(7), retention("7d"));
    assertEquals(Duration.ofHours(12), retention("12h"));
    assertEquals(Duration.ofMinutes(30), retention("30M"));
    assertEquals(Duration.ofDays(7), retention("P7D"));
    assertEquals(Duration.ofHours(36), retention("pt36h"));
    assertEquals(Duration.ZERO, retention("0s"));
  }

  @Test
  void invalidOrNegativeRetentionIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> retention("a week"));
    assertThrows(IllegalArgumentException.class, () -> retention("7w"));
    assertThrows(IllegalArgumentException.class, () -> retention("-PT1H"));
  }

  @Test
  void kafkaSinkNormalizesBootstrap() {
    DeliveryConfig config = DeliveryConfig.fromMap(Map.of(
        "sink", "kafka",
        "kafkaBootstrap", " broker-1:9092 , broker-2:9093"));

    assertEquals(SinkMode.KAFKA, config.sink());
    assertEquals(Optional.of("broker-1:9092,broker-2:9093"), config.kafkaBootstrap());
  }

  @Test
  void sinkRequirementsAreEnforced() {
    assertThrows(IllegalArgumentException.class, () -> DeliveryConfig.fromMap(Map.of("sink", "KAFKA")));
    assertThrows(IllegalArgumentException.class, () -> DeliveryConfig.fromMap(Map.of("sink", "FILE")));
    assertThrows(IllegalArgumentException.class,
        () -> DeliveryConfig.fromMap(Map.of("sink", "KAFKA", "kafkaBootstrap", "no-port")));
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> DeliveryConfig.fromMap(Map.of("sink", "syslog")));
    assertTrue(ex.getMessage().startsWith("Unknown sink"));
  }

  @Test
  void fileSinkResolvesAbsoluteDirectory() {
    DeliveryConfig config = DeliveryConfig.fromMap(Map.of("sink", "file", "fileSinkDir", "out/../sink"));

    Path dir = config.fileSinkDir().orElseThrow();
    assertTrue(dir.isAbsolute());
    assertEquals("sink", dir.getFileName().toString());
  }

  @Test
  void numericRangesAreEnforced() {
    assertThrows(IllegalArgumentException.class, () -> DeliveryConfig.fromMap(Map.of("maxAttempts", "0")));
    assertThrows(IllegalArgumentException.class, () -> DeliveryConfig.fromMap(Map.of("maxAttempts", "11")));
    assertThrows(IllegalArgumentException.class, () -> DeliveryConfig.fromMap(Map.of("pacingMillis", "-1")));
    assertThrows(IllegalArgumentException.class, () -> DeliveryConfig.fromMap(Map.of("backoffUnitMillis", "soon")));
    assertThrows(IllegalArgumentException.class, () -> DeliveryConfig.fromMap(Map.of("sinkTimeoutMillis", "50")));
  }

  @Test
  void logNamesAreValidated() {
    assertThrows(IllegalArgumentException.class,
        () -> DeliveryConfig.fromMap(Map.of("logGroup", "bad group")));
  }

  @Test
  void settingsCarryDestinationAndPolicy() {
    Map<String, String> args = new HashMap<>();
    args.put("logGroup", "/team/audit");
    args.put("logStream", "audit-ws-7");
    args.put("maxAttempts", "5");
    args.put("backoffUnitMillis", "250");
    args.put("retention", "1d");
    args.put("pacingMillis", "0");

    DeliverySettings settings = DeliveryConfig.fromMap(args).toSettings();

    assertEquals("/team/audit", settings.logGroup());
    assertEquals("audit-ws-7", settings.logStream());
    assertEquals(5, settings.retryPolicy().maxAttempts());
    assertEquals(250L, settings.retryPolicy().backoffUnitMillis());
    assertEquals(Duration.ofDays(1), settings.retention());
    assertEquals(0L, settings.pacingMillis());
  }

  private static Duration retention(String raw) {
    return DeliveryConfig.fromMap(Map.of("retention", raw)).retention();
  }
}
