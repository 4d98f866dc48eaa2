package ca.gc.cra.trail.infrastructure.exec;

import ca.gc.cra.trail.application.port.assistant.AssistantPort;
import ca.gc.cra.trail.infrastructure.temp.ScopedTempFile;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Runs the AI assistant as a subprocess.
 * <p><strong>Protocol:</strong> the prompt is written to a scoped owner-only temp file whose path replaces every
 * {@code {prompt_file}} token of the command (or is appended when no token is present). Standard output, captured
 * through a second scoped temp file, is the reply (decoded as UTF-8, invalid bytes replaced); standard error goes
 * to the terminal.</p>
 * <p><strong>Bounds:</strong> a process still running after the timeout is destroyed and reported with status
 * {@code timeout}. Both temp files are deleted on every path.</p>
 *
 * @since 0.1.0
 */
public final class SubprocessAssistantAdapter implements AssistantPort {
  private static final Logger log = LoggerFactory.getLogger(SubprocessAssistantAdapter.class);
  public static final String PROMPT_PLACEHOLDER = "{prompt_file}";

  private final List<String> commandTemplate;
  private final Duration timeout;

  /**
   * Creates an adapter.
   *
   * @param commandTemplate program and arguments
   * @param timeout maximum run time
   */
  public SubprocessAssistantAdapter(List<String> commandTemplate, Duration timeout) {
    Objects.requireNonNull(commandTemplate, "commandTemplate");
    if (commandTemplate.isEmpty() || commandTemplate.get(0).isBlank()) {
      throw new IllegalArgumentException("command must not be empty");
    }
    this.commandTemplate = List.copyOf(commandTemplate);
    this.timeout = Objects.requireNonNull(timeout, "timeout");
    if (timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("timeout must be positive");
    }
  }

  @Override
  public Reply invoke(String prompt) throws IOException, InterruptedException {
    Objects.requireNonNull(prompt, "prompt");
    try (ScopedTempFile promptFile = ScopedTempFile.create(null, "trail-prompt-", prompt);
        ScopedTempFile outputFile = ScopedTempFile.create(null, "trail-reply-", null)) {
      List<String> command = resolve(promptFile.path().toString());
      ProcessBuilder builder = new ProcessBuilder(command)
          .redirectOutput(outputFile.path().toFile())
          .redirectError(ProcessBuilder.Redirect.INHERIT);
      log.debug("Starting assistant {}", command.get(0));
      Process process = builder.start();
      process.getOutputStream().close();
      if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
        process.destroyForcibly();
        process.waitFor(5, TimeUnit.SECONDS);
        log.warn("Assistant did not finish within {} ms and was stopped", timeout.toMillis());
        return new Reply(readOutput(outputFile.path()), "timeout", -1);
      }
      int exit = process.exitValue();
      String output = readOutput(outputFile.path());
      if (exit != 0) {
        log.warn("Assistant exited with status {}", exit);
      }
      return new Reply(output, exit == 0 ? "success" : "exit_" + exit, exit);
    }
  }

  /** Malformed UTF-8 is replaced with U+FFFD so that a reply is always recorded. */
  private static String readOutput(Path output) throws IOException {
    return new String(Files.readAllBytes(output), StandardCharsets.UTF_8);
  }

  List<String> resolve(String promptPath) {
    List<String> command = new ArrayList<>(commandTemplate.size() + 1);
    boolean substituted = false;
    for (String arg : commandTemplate) {
      if (arg.contains(PROMPT_PLACEHOLDER)) {
        command.add(arg.replace(PROMPT_PLACEHOLDER, promptPath));
        substituted = true;
      } else {
        command.add(arg);
      }
    }
    if (!substituted) {
      command.add(promptPath);
    }
    return command;
  }
}
