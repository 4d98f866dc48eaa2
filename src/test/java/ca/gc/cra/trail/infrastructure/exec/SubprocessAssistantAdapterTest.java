package ca.gc.cra.trail.infrastructure.exec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.trail.application.port.assistant.AssistantPort.Reply;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

class SubprocessAssistantAdapterTest {

  @Test
  void placeholderIsSubstitutedOrAppended() {
    SubprocessAssistantAdapter withToken = new SubprocessAssistantAdapter(
        List.of("tool", "--input={prompt_file}", "-v"), Duration.ofSeconds(1));
    SubprocessAssistantAdapter withoutToken =
        new SubprocessAssistantAdapter(List.of("tool", "-v"), Duration.ofSeconds(1));

    assertEquals(List.of("tool", "--input=/tmp/p.tmp", "-v"), withToken.resolve("/tmp/p.tmp"));
    assertEquals(List.of("tool", "-v", "/tmp/p.tmp"), withoutToken.resolve("/tmp/p.tmp"));
  }

  @Test
  void emptyCommandIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> new SubprocessAssistantAdapter(List.of(), Duration.ofSeconds(1)));
    assertThrows(IllegalArgumentException.class,
        () -> new SubprocessAssistantAdapter(List.of("cat"), Duration.ZERO));
  }

  @Test
  @EnabledOnOs({OS.LINUX, OS.MAC})
  void replyIsToolOutput() throws Exception {
    SubprocessAssistantAdapter adapter = new SubprocessAssistantAdapter(List.of("cat"), Duration.ofSeconds(10));

    Reply reply = adapter.invoke("masked [MASKED_EMAIL] prompt");

    assertEquals("masked [MASKED_EMAIL] prompt", reply.output());
    assertEquals("success", reply.status());
    assertTrue(reply.succeeded());
  }

  @Test
  @EnabledOnOs({OS.LINUX, OS.MAC})
  void promptFileIsGoneAfterwards() throws Exception {
    SubprocessAssistantAdapter adapter = new SubprocessAssistantAdapter(
        List.of("sh", "-c", "echo $0", "{prompt_file}"), Duration.ofSeconds(10));

    Reply reply = adapter.invoke("anything");

    Path promptFile = Path.of(reply.output().strip());
    assertTrue(promptFile.getFileName().toString().startsWith("trail-prompt-"));
    assertFalse(Files.exists(promptFile));
  }

  @Test
  @EnabledOnOs({OS.LINUX, OS.MAC})
  void nonZeroExitIsReported() throws Exception {
    SubprocessAssistantAdapter adapter =
        new SubprocessAssistantAdapter(List.of("sh", "-c", "echo partial; exit 3"), Duration.ofSeconds(10));

    Reply reply = adapter.invoke("x");

    assertEquals("exit_3", reply.status());
    assertEquals(3, reply.exitCode());
    assertEquals("partial", reply.output().strip());
  }

  @Test
  @EnabledOnOs({OS.LINUX, OS.MAC})
  void invalidUtf8OutputIsReplacedNotFatal() throws Exception {
    SubprocessAssistantAdapter adapter = new SubprocessAssistantAdapter(
        List.of("sh", "-c", "printf '\\377\\376ok'", "{prompt_file}"), Duration.ofSeconds(10));

    Reply reply = adapter.invoke("x");

    assertEquals("\uFFFD\uFFFDok", reply.output());
    assertEquals("success", reply.status());
  }

  @Test
  @EnabledOnOs({OS.LINUX, OS.MAC})
  void slowToolTimesOut() throws Exception {
    SubprocessAssistantAdapter adapter =
        new SubprocessAssistantAdapter(List.of("sh", "-c", "sleep 30", "{prompt_file}"), Duration.ofMillis(300));

    Reply reply = adapter.invoke("x");

    assertEquals("timeout", reply.status());
    assertFalse(reply.succeeded());
  }
}
