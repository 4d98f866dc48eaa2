package ca.gc.cra.trail.api;

import ca.gc.cra.trail.config.SetupException;
import ca.gc.cra.trail.config.StoreConfig;
import ca.gc.cra.trail.infrastructure.crypto.PemKeyStore;
import ca.gc.cra.trail.logging.Logs;
import ca.gc.cra.trail.logging.LoggingConfigurator;
import java.io.IOException;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Generates the RSA-2048 signing key pair. Existing keys are kept unless {@code --force} is given.
 *
 * @since 0.1.0
 */
public final class KeygenCli {
  private static final Logger log = LoggerFactory.getLogger(KeygenCli.class);
  private static final Set<String> FLAGS = Set.of("--force");
  private static final String SUMMARY_USAGE = "usage: keygen [--force] [keyDir=PATH] [config=PATH]";
  private static final String HELP_TEXT = """
      TRAIL keygen

      Usage:
        keygen [--force] [keyDir=PATH]

      Writes audit_private_key.pem (PKCS#8, owner-only) and audit_public_key.pem (X.509) to keyDir
      (default ~/.trail/keys). Replacing keys starts a new verification domain: records signed with the old
      key only verify against the old public key.
      """;

  private KeygenCli() {}

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
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

    boolean force;
    StoreConfig storeConfig;
    try {
      Map<String, String> effective = ConfigCliUtils.effectiveConfig("keygen", kv, log);
      force = input.hasFlag("--force") || ConfigCliUtils.parseBoolean(effective, "force");
      storeConfig = StoreConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid keygen configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Unable to read configuration: {}", ex.getMessage());
      return ExitCode.IO_ERROR;
    }

    PemKeyStore keyStore = new PemKeyStore(storeConfig.keyDir());
    try {
      keyStore.generate(force);
      if (force) {
        log.warn("Signing keys replaced in {}", storeConfig.keyDir());
      }
      CliPrinter.printLines(keyStore.privateKeyPath().toString(), keyStore.publicKeyPath().toString());
      return ExitCode.SUCCESS;
    } catch (SetupException ex) {
      log.error("{}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Unable to write keys: {}", Logs.describe(ex));
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in keygen: {}", Logs.describe(ex));
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
