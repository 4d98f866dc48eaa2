package ca.gc.cra.trail.application.port.assistant;

import java.io.IOException;
import java.util.Objects;

/**
 * Boundary to the wrapped AI assistant. TRAIL treats it as an opaque tool that receives a prompt and returns text.
 *
 * @since 0.1.0
 */
public interface AssistantPort {
  /**
   * Invokes the assistant.
   *
   * @param prompt prompt text handed to the tool
   * @return reply with its status
   * @throws IOException when the tool cannot be started or its output read
   * @throws InterruptedException when interrupted while waiting for the tool
   */
  Reply invoke(String prompt) throws IOException, InterruptedException;

  /**
   * Assistant reply.
   *
   * @param output captured output, possibly empty
   * @param status {@code success}, {@code exit_<code>} or {@code timeout}
   * @param exitCode process exit code, or {@code -1} after a timeout
   */
  record Reply(String output, String status, int exitCode) {
    public Reply {
      Objects.requireNonNull(output, "output");
      Objects.requireNonNull(status, "status");
    }

    public boolean succeeded() {
      return exitCode == 0;
    }
  }
}
