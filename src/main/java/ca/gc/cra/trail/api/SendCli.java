package ca.gc.cra.trail.api;

import ca.gc.cra.trail.config.CompositionRoot;
import ca.gc.cra.trail.config.DeliveryConfig;
import ca.gc.cra.trail.config.StoreConfig;
import ca.gc.cra.trail.domain.delivery.DeliveryOutcome;
import ca.gc.cra.trail.logging.Logs;
import ca.gc.cra.trail.logging.LoggingConfigurator;
import ca.gc.cra.trail.validation.Paths;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Delivers one serialized record file to the configured sink. Exit status 0 means the sink acknowledged it.
 *
 * @since 0.1.0
 */
public final class SendCli {
  private static final Logger log = LoggerFactory.getLogger(SendCli.class);
  private static final String SUMMARY_USAGE =
      "usage: send file=PATH [sink=CLOUDWATCH|KAFKA|FILE] [logGroup=NAME] [logStream=NAME] [region=REGION] "
          + "[kafkaBootstrap=HOST:PORT] [fileSinkDir=PATH] [config=PATH]";
  private static final String HELP_TEXT = """
      TRAIL send

      Usage:
        send file=PATH [options]

      Options:
        sink=CLOUDWATCH|KAFKA|FILE  Delivery target (default CLOUDWATCH)
        logGroup=NAME               Log group, or Kafka topic base (default /trail/audit)
        logStream=NAME              Log stream (default audit-<host>)
        region=REGION               AWS region for CloudWatch Logs
        kafkaBootstrap=HOST:PORT    Required when sink=KAFKA
        fileSinkDir=PATH            Required when sink=FILE
        maxAttempts=N               Submissions allowed under throttling (default 3)
        backoffUnitMillis=N         Backoff unit; attempt k waits 2^k units (default 1000)
        sinkTimeoutMillis=N         Bound on each sink call (default 10000)
        config=PATH                 YAML configuration (send and common sections)
        --verbose                   Enable DEBUG logging
        --help                      Show this message

      The file is not moved; use upload-all to deliver and archive the pending store.
      """;

  private SendCli() {}

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for send CLI");
    }

    Map<String, String> kv;
    Path file;
    try {
      if (!input.unknownFlags(Set.of()).isEmpty()) {
        throw new IllegalArgumentException("unknown flag(s): " + input.unknownFlags(Set.of()));
      }
      kv = CliArgsParser.toMap(input.keyValueArgs());
      String rawFile = kv.remove("file");
      if (rawFile == null) {
        throw new IllegalArgumentException("file=PATH is required");
      }
      file = Paths.requireReadableFile("file", Path.of(rawFile));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    StoreConfig storeConfig;
    DeliveryConfig deliveryConfig;
    try {
      Map<String, String> effective = ConfigCliUtils.effectiveConfig("send", kv, log);
      storeConfig = StoreConfig.fromMap(effective);
      deliveryConfig = DeliveryConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid send configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Unable to read configuration: {}", ex.getMessage());
      return ExitCode.IO_ERROR;
    }

    try (CompositionRoot root = new CompositionRoot(storeConfig)) {
      DeliveryOutcome outcome = root.recordSender(deliveryConfig).send(file);
      CliPrinter.println(UploadAllCli.describe(outcome));
      if (outcome.status() != DeliveryOutcome.Status.DELIVERED) {
        log.error("Record {} not delivered: {}", outcome.fileName(), outcome.reason());
        return ExitCode.DELIVERY_FAILURE;
      }
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Unable to read record {}: {}", file, Logs.describe(ex));
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Cannot send {}: {}", file, Logs.scrub(ex.getMessage()));
      return ExitCode.INVALID_ARGS;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Send interrupted; record left in place");
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in send: {}", Logs.describe(ex));
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
