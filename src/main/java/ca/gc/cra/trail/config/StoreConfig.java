package ca.gc.cra.trail.config;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Locations of the record store and the signing keys.
 *
 * @param storeDir record store root ({@code processed/} and {@code .chain/} live underneath)
 * @param keyDir directory holding the PEM key pair
 * @since 0.1.0
 */
public record StoreConfig(Path storeDir, Path keyDir) {
  public StoreConfig {
    Objects.requireNonNull(storeDir, "storeDir");
    Objects.requireNonNull(keyDir, "keyDir");
  }

  /**
   * Builds the configuration from flattened settings.
   *
   * @param args effective configuration
   * @return store configuration
   * @throws IllegalArgumentException when a path is invalid
   */
  public static StoreConfig fromMap(Map<String, String> args) {
    Objects.requireNonNull(args, "args");
    Path home = Path.of(System.getProperty("user.home", "."), ".trail");
    return new StoreConfig(
        ConfigValues.path(args, "storeDir", home.resolve("logs")),
        ConfigValues.path(args, "keyDir", home.resolve("keys")));
  }
}
