package ca.gc.cra.trail.api;

import ca.gc.cra.trail.domain.trace.TraceId;
import ca.gc.cra.trail.logging.LoggingConfigurator;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prints a fresh trace id ({@code uuid:timestamp}) on stdout.
 *
 * @since 0.1.0
 */
public final class TraceIdCli {
  private static final Logger log = LoggerFactory.getLogger(TraceIdCli.class);
  private static final String HELP_TEXT = """
      TRAIL trace-id

      Usage:
        trace-id

      Prints a new identifier of the form <uuid-v4>:<yyyy-MM-ddTHH:mm:ssZ>. Identifiers sort by their
      timestamp part; pass the value to record or exec with traceId=... to correlate a call.
      """;

  private TraceIdCli() {}

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }
    if (input.keyValueArgs().length > 0 || !input.unknownFlags(Set.of()).isEmpty()) {
      log.error("trace-id takes no arguments");
      CliPrinter.println("usage: trace-id");
      return ExitCode.INVALID_ARGS;
    }
    TraceId id = TraceId.newId();
    log.debug("Generated trace id {}", id);
    CliPrinter.println(id.toString());
    return ExitCode.SUCCESS;
  }
}
