package ca.gc.cra.trail.api;

import ca.gc.cra.trail.config.CompositionRoot;
import ca.gc.cra.trail.config.DeliveryConfig;
import ca.gc.cra.trail.config.StoreConfig;
import ca.gc.cra.trail.domain.delivery.DeliveryOutcome;
import ca.gc.cra.trail.domain.delivery.DeliveryReport;
import ca.gc.cra.trail.logging.Logs;
import ca.gc.cra.trail.logging.LoggingConfigurator;
import java.io.IOException;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Delivers every pending record oldest first, archives acknowledged ones, and purges expired processed records.
 *
 * @since 0.1.0
 */
public final class UploadAllCli {
  private static final Logger log = LoggerFactory.getLogger(UploadAllCli.class);
  private static final Set<String> FLAGS = Set.of("--dry-run");
  private static final String SUMMARY_USAGE =
      "usage: upload-all [--dry-run] [sink=CLOUDWATCH|KAFKA|FILE] [retention=7d] [pacingMillis=200] "
          + "[storeDir=PATH] [config=PATH]";
  private static final String HELP_TEXT = """
      TRAIL upload-all

      Usage:
        upload-all [--dry-run] [options]

      Options:
        --dry-run                   Report what would be delivered and purged; change nothing
        retention=DURATION          Processed record lifetime: 7d, 12h, 30m, 45s or ISO-8601 (default 7d)
        pacingMillis=N              Pause after each delivered record (default 200)
        sink, logGroup, logStream, region, kafkaBootstrap, fileSinkDir, maxAttempts,
        backoffUnitMillis, sinkTimeoutMillis as for send
        storeDir=PATH               Record store (default ~/.trail/logs)
        config=PATH                 YAML configuration (upload-all and common sections)
        --verbose                   Enable DEBUG logging
        --help                      Show this message

      Exit status 6 when any record failed; throttling that recovered is only a warning.
      """;

  private UploadAllCli() {}

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for upload-all CLI");
    }

    Map<String, String> kv;
    try {
      if (!input.unknownFlags(FLAGS).isEmpty()) {
        throw new IllegalArgumentException("unknown flag(s): " + input.unknownFlags(FLAGS));
      }
      kv = CliArgsParser.toMap(input.keyValueArgs());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    boolean preview;
    StoreConfig storeConfig;
    DeliveryConfig deliveryConfig;
    try {
      Map<String, String> effective = ConfigCliUtils.effectiveConfig("upload-all", kv, log);
      preview = input.hasFlag("--dry-run") || ConfigCliUtils.parseBoolean(effective, "dryRun");
      storeConfig = StoreConfig.fromMap(effective);
      deliveryConfig = DeliveryConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid upload configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Unable to read configuration: {}", ex.getMessage());
      return ExitCode.IO_ERROR;
    }

    try (CompositionRoot root = new CompositionRoot(storeConfig)) {
      log.info("Starting {} to {} {}/{}", preview ? "upload preview" : "upload",
          deliveryConfig.sink(), deliveryConfig.logGroup(), deliveryConfig.logStream());
      DeliveryReport report = root.deliveryEngine(deliveryConfig).deliverAll(preview);
      printReport(report);
      if (report.hasFailures()) {
        log.error("{} record(s) failed; they remain pending for the next run", report.failed());
        return ExitCode.DELIVERY_FAILURE;
      }
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Upload I/O failure: {}", Logs.describe(ex));
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Upload configuration error: {}", Logs.scrub(ex.getMessage()));
      return ExitCode.CONFIG_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Upload interrupted; undelivered records stay pending");
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in upload: {}", Logs.describe(ex));
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  static String describe(DeliveryOutcome outcome) {
    StringBuilder sb = new StringBuilder();
    sb.append(outcome.fileName()).append(' ').append(outcome.status());
    if (outcome.attempts() > 0) {
      sb.append(" attempts=").append(outcome.attempts());
    }
    if (outcome.reason() != null) {
      sb.append(" reason=").append(outcome.reason());
    }
    return sb.toString();
  }

  private static void printReport(DeliveryReport report) {
    for (DeliveryOutcome outcome : report.outcomes()) {
      CliPrinter.println(describe(outcome));
    }
    if (report.preview()) {
      CliPrinter.println("Dry run: would deliver=" + report.wouldDeliver()
          + " skipped=" + report.skipped()
          + " would purge=" + report.wouldPurge());
    } else {
      CliPrinter.println("Upload complete: delivered=" + report.succeeded()
          + " failed=" + report.failed()
          + " skipped=" + report.skipped()
          + " purged=" + report.purged());
    }
  }
}
