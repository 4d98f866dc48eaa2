package ca.gc.cra.trail.api;

import ca.gc.cra.trail.application.audit.ChainVerifier.StoredRecord;
import ca.gc.cra.trail.application.port.store.RecordHandle;
import ca.gc.cra.trail.config.CompositionRoot;
import ca.gc.cra.trail.config.SetupException;
import ca.gc.cra.trail.config.StoreConfig;
import ca.gc.cra.trail.domain.audit.ChainReport;
import ca.gc.cra.trail.infrastructure.persistence.FileChainState;
import ca.gc.cra.trail.infrastructure.persistence.FileRecordStore;
import ca.gc.cra.trail.logging.Logs;
import ca.gc.cra.trail.logging.LoggingConfigurator;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Verifies every stored record (pending and processed): record hash, signature, and chain linkage.
 *
 * <p>With {@code --clear-halt}, a chain that verifies cleanly is re-anchored on its tail and the halt marker is
 * removed so record creation can resume.</p>
 *
 * @since 0.1.0
 */
public final class VerifyCli {
  private static final Logger log = LoggerFactory.getLogger(VerifyCli.class);
  private static final Set<String> FLAGS = Set.of("--clear-halt");
  private static final String SUMMARY_USAGE = "usage: verify [--clear-halt] [storeDir=PATH] [keyDir=PATH] [config=PATH]";
  private static final String HELP_TEXT = """
      TRAIL verify

      Usage:
        verify [--clear-halt] [options]

      Options:
        --clear-halt                Re-anchor chain state on the verified tail and resume record creation
        storeDir=PATH               Record store (default ~/.trail/logs)
        keyDir=PATH                 Directory holding audit_public_key.pem (default ~/.trail/keys)
        config=PATH                 YAML configuration (verify and common sections)
        --verbose                   Enable DEBUG logging
        --help                      Show this message

      Records whose predecessor was purged by retention start a new segment; a store with more than one
      segment, a fork, or a bad hash or signature fails verification with exit status 7.
      """;

  private VerifyCli() {}

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for verify CLI");
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

    boolean clearHalt;
    StoreConfig storeConfig;
    try {
      Map<String, String> effective = ConfigCliUtils.effectiveConfig("verify", kv, log);
      clearHalt = input.hasFlag("--clear-halt") || ConfigCliUtils.parseBoolean(effective, "clearHalt");
      storeConfig = StoreConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid verify configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Unable to read configuration: {}", ex.getMessage());
      return ExitCode.IO_ERROR;
    }

    try (CompositionRoot root = new CompositionRoot(storeConfig)) {
      FileRecordStore store = root.recordStore();
      List<StoredRecord> records = new ArrayList<>();
      collect(store, store.listPending(), records);
      collect(store, store.listProcessed(), records);
      ChainReport report = root.chainVerifier().verify(records);
      printReport(report);

      FileChainState chainState = root.chainState();
      if (!report.valid()) {
        log.error("Chain verification failed with {} issue(s)", report.issues().size());
        return ExitCode.INTEGRITY_FAILURE;
      }
      if (chainState.halted()) {
        if (!clearHalt) {
          CliPrinter.println("Record creation is halted: " + chainState.haltReason());
          CliPrinter.println("Chain verified; re-run with --clear-halt to resume record creation.");
          return ExitCode.INTEGRITY_FAILURE;
        }
        chainState.resetAfterVerification(report.tailHash(), report.records());
        log.warn("Halt cleared; chain state re-anchored on {}", report.tailHash());
        CliPrinter.println("Halt cleared.");
      } else if (clearHalt) {
        chainState.resetAfterVerification(report.tailHash(), report.records());
        CliPrinter.println("Chain state re-anchored.");
      }
      return ExitCode.SUCCESS;
    } catch (SetupException ex) {
      log.error("{}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Verify I/O failure: {}", Logs.describe(ex));
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in verify: {}", Logs.describe(ex));
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static void collect(FileRecordStore store, List<RecordHandle> handles, List<StoredRecord> target)
      throws IOException {
    for (RecordHandle handle : handles) {
      Optional<String> json = store.read(handle);
      if (json.isPresent()) {
        target.add(new StoredRecord(store.root().relativize(handle.path()).toString(), json.get()));
      } else {
        log.debug("Record {} vanished during verification", handle.fileName());
      }
    }
  }

  private static void printReport(ChainReport report) {
    CliPrinter.println("Records  : " + report.records());
    CliPrinter.println("Verified : " + report.verified());
    CliPrinter.println("Anchors  : " + report.anchors());
    CliPrinter.println("Tail     : " + (report.tailHash() == null ? "<none>" : report.tailHash()));
    for (ChainReport.Issue issue : report.issues()) {
      CliPrinter.println(" " + issue.kind() + " " + issue.fileName() + ": " + issue.detail());
    }
    CliPrinter.println(report.valid() ? "Chain OK" : "Chain INVALID");
  }
}
