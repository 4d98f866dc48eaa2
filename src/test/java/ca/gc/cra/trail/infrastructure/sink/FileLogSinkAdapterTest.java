package ca.gc.cra.trail.infrastructure.sink;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ca.gc.cra.trail.application.port.sink.LogEvent;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileLogSinkAdapterTest {
  private static final String HASH = "e".repeat(64);

  @TempDir Path outputDir;

  @Test
  void appendsOneLinePerEvent() throws Exception {
    FileLogSinkAdapter sink = new FileLogSinkAdapter(outputDir);

    sink.put("/trail/audit", "host-1", List.of(new LogEvent(1L, "{\"n\":1}", HASH)));
    sink.put("/trail/audit", "host-1", List.of(new LogEvent(2L, "{\"n\":\n2}", HASH)));

    Path file = outputDir.resolve("trail_audit").resolve("host-1.log");
    assertEquals(List.of("{\"n\":1}", "{\"n\": 2}"), Files.readAllLines(file, StandardCharsets.UTF_8));
  }

  @Test
  void namesAreSanitized() {
    assertEquals("trail_audit", FileLogSinkAdapter.sanitize("/trail/audit"));
    assertEquals("x", FileLogSinkAdapter.sanitize(".."));
    assertEquals("a_b", FileLogSinkAdapter.sanitize("a b"));
  }
}
