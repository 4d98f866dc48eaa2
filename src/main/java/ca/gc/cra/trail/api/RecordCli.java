package ca.gc.cra.trail.api;

import ca.gc.cra.trail.application.audit.AuditTrailService;
import ca.gc.cra.trail.application.audit.AuditTrailService.AppendResult;
import ca.gc.cra.trail.application.audit.AuditTrailService.Exchange;
import ca.gc.cra.trail.config.CompositionRoot;
import ca.gc.cra.trail.config.RedactionConfig;
import ca.gc.cra.trail.config.SetupException;
import ca.gc.cra.trail.config.StoreConfig;
import ca.gc.cra.trail.domain.audit.IntegrityException;
import ca.gc.cra.trail.domain.trace.TraceId;
import ca.gc.cra.trail.logging.Logs;
import ca.gc.cra.trail.logging.LoggingConfigurator;
import java.io.IOException;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Records one prompt/response exchange: masks the prompt, builds and signs the record, and persists it.
 *
 * @since 0.1.0
 */
public final class RecordCli {
  private static final Logger log = LoggerFactory.getLogger(RecordCli.class);
  private static final String SUMMARY_USAGE =
      "usage: record (prompt=TEXT|promptFile=PATH) (response=TEXT|responseFile=PATH) [traceId=ID] "
          + "[language=ja] [remote=false] [analysis=false] [method=cli] [model=NAME] [status=success] "
          + "[config=PATH]";
  private static final String HELP_TEXT = """
      TRAIL record

      Usage:
        record (prompt=TEXT|promptFile=PATH) (response=TEXT|responseFile=PATH) [options]

      Options:
        traceId=ID                  Correlation id from trace-id (default: new id)
        language=CODE               Prompt language, ISO 639-1 (default ja)
        remote=true|false           Consult the remote PII classifier (default false)
        analysis=true|false         Run sentiment, key phrase and entity analysis (default false)
        region=REGION               AWS region for the classifier
        confidenceThreshold=0..1    Minimum classifier score (default 0.7)
        method=LABEL                Assistant label stored in the record (default cli)
        model=NAME                  Model name stored in the record
        status=LABEL                Response status (default success)
        storeDir=PATH               Record store (default ~/.trail/logs)
        keyDir=PATH                 Signing keys (default ~/.trail/keys)
        config=PATH                 YAML configuration (record and common sections)
        --verbose                   Enable DEBUG logging
        --help                      Show this message

      Prints the trace id and the path of the pending record file.
      """;

  private RecordCli() {}

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for record CLI");
    }

    String prompt;
    String response;
    TraceId traceId;
    Map<String, String> kv;
    try {
      if (!input.unknownFlags(Set.of()).isEmpty()) {
        throw new IllegalArgumentException("unknown flag(s): " + input.unknownFlags(Set.of()));
      }
      kv = CliArgsParser.toMap(input.keyValueArgs());
      prompt = ConfigCliUtils.readText(kv, "prompt", "promptFile");
      response = ConfigCliUtils.readText(kv, "response", "responseFile");
      String rawTraceId = kv.remove("traceId");
      traceId = rawTraceId == null ? TraceId.newId() : TraceId.parse(rawTraceId);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read prompt or response file: {}", ex.getMessage());
      return ExitCode.IO_ERROR;
    }

    Map<String, String> effective;
    StoreConfig storeConfig;
    RedactionConfig redactionConfig;
    try {
      effective = ConfigCliUtils.effectiveConfig("record", kv, log);
      storeConfig = StoreConfig.fromMap(effective);
      redactionConfig = RedactionConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid record configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Unable to read configuration: {}", ex.getMessage());
      return ExitCode.IO_ERROR;
    }

    try (CompositionRoot root = new CompositionRoot(storeConfig)) {
      AuditTrailService service = root.auditTrailService(redactionConfig);
      String model = effective.getOrDefault("model", "").trim();
      AppendResult result = service.record(new Exchange(
          traceId,
          effective.getOrDefault("method", "cli").trim(),
          model.isEmpty() ? null : model,
          prompt,
          response,
          effective.getOrDefault("status", "success").trim(),
          redactionConfig.language(),
          redactionConfig.remote()));
      CliPrinter.printLines(traceId.toString(), result.handle().path().toString());
      return ExitCode.SUCCESS;
    } catch (SetupException ex) {
      log.error("{}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IntegrityException ex) {
      log.error("Record not created: {}", ex.getMessage());
      return ExitCode.INTEGRITY_FAILURE;
    } catch (IOException ex) {
      log.error("Record store I/O failure: {}", Logs.describe(ex));
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Record configuration error: {}", Logs.scrub(ex.getMessage()));
      return ExitCode.CONFIG_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure while recording: {}", Logs.describe(ex));
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
