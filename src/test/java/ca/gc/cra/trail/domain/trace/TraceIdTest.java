package ca.gc.cra.trail.domain.trace;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class TraceIdTest {

  @Test
  void textFormCarriesUuidAndUtcTimestamp() {
    TraceId id = TraceId.newId(Instant.parse("2026-03-04T05:06:07.890Z"));

    String text = id.toString();

    assertTrue(text.endsWith(":2026-03-04T05:06:07Z"), text);
    assertEquals(4, UUID.fromString(text.substring(0, text.indexOf(':'))).version());
  }

  @Test
  void parseRecoversTimestamp() {
    TraceId id = TraceId.newId(Instant.parse("2026-01-02T03:04:05Z"));

    TraceId parsed = TraceId.parse(id.toString());

    assertEquals(id, parsed);
    assertEquals(Instant.parse("2026-01-02T03:04:05Z"), parsed.createdAt());
  }

  @Test
  void idsSortByCreationTime() {
    TraceId later = TraceId.newId(Instant.parse("2026-01-02T03:04:06Z"));
    TraceId earlier = TraceId.newId(Instant.parse("2026-01-02T03:04:05Z"));
    List<TraceId> ids = new ArrayList<>(List.of(later, earlier));

    Collections.sort(ids);

    assertEquals(List.of(earlier, later), ids);
  }

  @Test
  void idsGeneratedInTheSameSecondAreDistinct() {
    Instant now = Instant.parse("2026-01-02T03:04:05Z");
    Set<String> names = new HashSet<>();
    for (int i = 0; i < 1_000; i++) {
      names.add(TraceId.newId(now).fileName());
    }
    assertEquals(1_000, names.size());
  }

  @Test
  void fileNameDerivesFromUuid() {
    TraceId id = TraceId.newId();

    assertEquals(id.uniqueId() + ".json", id.fileName());
    assertNotEquals(id.toString(), id.fileName());
  }

  @Test
  void malformedValuesAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> TraceId.parse(null));
    assertThrows(IllegalArgumentException.class, () -> TraceId.parse("no-separator"));
    assertThrows(IllegalArgumentException.class,
        () -> TraceId.parse(UUID.randomUUID() + ":yesterday"));
    assertThrows(IllegalArgumentException.class, () -> TraceId.parse("not-a-uuid:2026-01-02T03:04:05Z"));
  }
}
