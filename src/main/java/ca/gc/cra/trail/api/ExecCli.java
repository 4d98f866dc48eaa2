package ca.gc.cra.trail.api;

import ca.gc.cra.trail.application.audit.AuditTrailService;
import ca.gc.cra.trail.application.audit.AuditTrailService.AppendResult;
import ca.gc.cra.trail.application.audit.AuditTrailService.RedactedPrompt;
import ca.gc.cra.trail.application.port.assistant.AssistantPort;
import ca.gc.cra.trail.config.CompositionRoot;
import ca.gc.cra.trail.config.RedactionConfig;
import ca.gc.cra.trail.config.SetupException;
import ca.gc.cra.trail.config.StoreConfig;
import ca.gc.cra.trail.domain.audit.IntegrityException;
import ca.gc.cra.trail.domain.audit.RequestFields;
import ca.gc.cra.trail.domain.audit.ResponseFields;
import ca.gc.cra.trail.domain.trace.TraceId;
import ca.gc.cra.trail.logging.Logs;
import ca.gc.cra.trail.logging.LoggingConfigurator;
import ca.gc.cra.trail.validation.Numbers;
import java.io.IOException;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs an AI assistant as a subprocess on the masked prompt and records the exchange.
 *
 * <p>The masked prompt is handed over in an owner-only temp file substituted for {@code {prompt_file}}; the
 * raw prompt never leaves the process. The assistant's stdout is echoed and recorded as the response.</p>
 *
 * @since 0.1.0
 */
public final class ExecCli {
  private static final Logger log = LoggerFactory.getLogger(ExecCli.class);
  private static final long MAX_TIMEOUT_MILLIS = 3_600_000L;
  private static final String SUMMARY_USAGE =
      "usage: exec (prompt=TEXT|promptFile=PATH) [traceId=ID] [options] -- PROGRAM [ARGS...]";
  private static final String HELP_TEXT = """
      TRAIL exec

      Usage:
        exec (prompt=TEXT|promptFile=PATH) [options] -- PROGRAM [ARGS...]
        exec (prompt=TEXT|promptFile=PATH) command="PROGRAM ARGS" [options]

      The masked prompt is written to a temporary file readable only by the current user. An argument equal
      to {prompt_file} is replaced by that file's path; without one, the path is appended.

      Options:
        traceId=ID                  Correlation id from trace-id (default: new id)
        execTimeoutMillis=N         Subprocess timeout (default 600000)
        language, remote, analysis, region, method, model, storeDir, keyDir, config as for record
        --verbose                   Enable DEBUG logging
        --help                      Show this message

      Exit status is 0 when the assistant succeeded and the record was written.
      """;

  private ExecCli() {}

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for exec CLI");
    }

    String prompt;
    TraceId traceId;
    Map<String, String> kv;
    try {
      if (!input.unknownFlags(Set.of()).isEmpty()) {
        throw new IllegalArgumentException("unknown flag(s): " + input.unknownFlags(Set.of()));
      }
      kv = CliArgsParser.toMap(input.keyValueArgs());
      prompt = ConfigCliUtils.readText(kv, "prompt", "promptFile");
      String rawTraceId = kv.remove("traceId");
      traceId = rawTraceId == null ? TraceId.newId() : TraceId.parse(rawTraceId);
      if (!input.trailingArgs().isEmpty()) {
        kv.put("command", String.join(" ", input.trailingArgs()));
      }
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read prompt file: {}", ex.getMessage());
      return ExitCode.IO_ERROR;
    }

    Map<String, String> effective;
    StoreConfig storeConfig;
    RedactionConfig redactionConfig;
    List<String> command;
    Duration timeout;
    try {
      effective = ConfigCliUtils.effectiveConfig("exec", kv, log);
      storeConfig = StoreConfig.fromMap(effective);
      redactionConfig = RedactionConfig.fromMap(effective);
      command = input.trailingArgs().isEmpty()
          ? Arrays.asList(effective.get("command").trim().split("\\s+"))
          : input.trailingArgs();
      timeout = Duration.ofMillis(Numbers.requireRange(
          "execTimeoutMillis", parseLong(effective.get("execTimeoutMillis")), 1_000L, MAX_TIMEOUT_MILLIS));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid exec configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Unable to read configuration: {}", ex.getMessage());
      return ExitCode.IO_ERROR;
    }

    try (CompositionRoot root = new CompositionRoot(storeConfig)) {
      AuditTrailService service = root.auditTrailService(redactionConfig);
      RedactedPrompt redacted =
          service.redact(prompt, redactionConfig.language(), redactionConfig.remote());
      log.info("Running assistant {} for trace {}", command.get(0), traceId);
      AssistantPort.Reply reply = root.assistant(command, timeout).invoke(redacted.result().maskedText());
      CliPrinter.printBlock(reply.output());

      String model = effective.getOrDefault("model", "").trim();
      AppendResult result = service.append(
          traceId,
          new RequestFields(
              effective.getOrDefault("method", "exec").trim(),
              model.isEmpty() ? null : model,
              prompt,
              redacted.result(),
              redacted.analysis()),
          new ResponseFields(reply.status(), reply.output()));
      log.info("Recorded {} as {}", traceId, result.handle().path());
      if (!reply.succeeded()) {
        log.warn("Assistant finished with status {}", reply.status());
        return ExitCode.RUNTIME_FAILURE;
      }
      return ExitCode.SUCCESS;
    } catch (SetupException ex) {
      log.error("{}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IntegrityException ex) {
      log.error("Record not created: {}", ex.getMessage());
      return ExitCode.INTEGRITY_FAILURE;
    } catch (IOException ex) {
      log.error("Exec I/O failure: {}", Logs.describe(ex));
      return ExitCode.IO_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Exec interrupted; no record written");
      return ExitCode.INTERRUPTED;
    } catch (IllegalArgumentException ex) {
      log.error("Exec configuration error: {}", Logs.scrub(ex.getMessage()));
      return ExitCode.CONFIG_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in exec: {}", Logs.describe(ex));
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static long parseLong(String raw) {
    try {
      return Long.parseLong(raw == null ? "" : raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("execTimeoutMillis must be an integer", ex);
    }
  }
}
