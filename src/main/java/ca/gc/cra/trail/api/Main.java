package ca.gc.cra.trail.api;

import ca.gc.cra.trail.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * TRAIL CLI dispatcher that routes to subcommands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE =
      "usage: trail <trace-id|record|exec|send|upload-all|verify|keygen> [options]";
  private static final String HELP_TEXT = """
      TRAIL audit trail for AI assistant interactions

      Usage:
        trail <command> [options]

      Commands:
        trace-id    Print a new trace id
        record      Mask, sign and store one prompt/response exchange
        exec        Run an assistant on the masked prompt and record the exchange
        send        Deliver one record file to the log sink
        upload-all  Deliver pending records, archive them, purge expired ones (--dry-run to preview)
        verify      Check hashes, signatures and chain linkage (--clear-halt to resume after a halt)
        keygen      Generate the signing key pair (--force to replace)

      Global flags:
        --help      Show this message (or <command> --help)
        --verbose   Enable DEBUG logging before dispatching to the command
      """;

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Dispatches a subcommand and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments (first token is the subcommand)
   * @return exit code reported by the delegated command
   */
  static ExitCode run(String[] args) {
    if (args == null || args.length == 0) {
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    int commandIndex = 0;
    while (commandIndex < args.length && isGlobalFlag(args[commandIndex])) {
      commandIndex++;
    }
    if (commandIndex == args.length) {
      CliInput input = CliInput.parse(args);
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    CliInput globals = CliInput.parse(Arrays.copyOfRange(args, 0, commandIndex));
    if (globals.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (globals.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }

    String command = args[commandIndex].trim().toLowerCase(Locale.ROOT);
    String[] delegateArgs = Arrays.copyOfRange(args, commandIndex + 1, args.length);

    return switch (command) {
      case "trace-id" -> TraceIdCli.run(delegateArgs);
      case "record" -> RecordCli.run(delegateArgs);
      case "exec" -> ExecCli.run(delegateArgs);
      case "send" -> SendCli.run(delegateArgs);
      case "upload-all" -> UploadAllCli.run(delegateArgs);
      case "verify" -> VerifyCli.run(delegateArgs);
      case "keygen" -> KeygenCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }

  private static boolean isGlobalFlag(String arg) {
    return arg != null && arg.startsWith("-") && !arg.equals("--");
  }
}
