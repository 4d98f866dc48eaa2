package ca.gc.cra.trail.config;

import ca.gc.cra.trail.validation.Numbers;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Typed lookups over flattened configuration maps.
 */
final class ConfigValues {
  private static final Pattern SHORT_DURATION = Pattern.compile("(\\d{1,9})\\s*([dhms])");

  private ConfigValues() {}

  static Optional<String> optional(Map<String, String> args, String key) {
    String value = args.get(key);
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(value.trim());
  }

  static boolean bool(Map<String, String> args, String key, boolean defaultValue) {
    Optional<String> value = optional(args, key);
    if (value.isEmpty()) {
      return defaultValue;
    }
    return switch (value.get().toLowerCase(Locale.ROOT)) {
      case "true", "yes", "1" -> true;
      case "false", "no", "0" -> false;
      default -> throw new IllegalArgumentException(key + " must be true or false");
    };
  }

  static long number(Map<String, String> args, String key, long defaultValue, long min, long max) {
    Optional<String> value = optional(args, key);
    if (value.isEmpty()) {
      return defaultValue;
    }
    try {
      return Numbers.requireRange(key, Long.parseLong(value.get()), min, max);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer", ex);
    }
  }

  static double decimal(Map<String, String> args, String key, double defaultValue, double min, double max) {
    Optional<String> value = optional(args, key);
    if (value.isEmpty()) {
      return defaultValue;
    }
    try {
      return Numbers.requireRange(key, Double.parseDouble(value.get()), min, max);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be a number", ex);
    }
  }

  static Path path(Map<String, String> args, String key, Path defaultValue) {
    Optional<String> value = optional(args, key);
    if (value.isEmpty()) {
      return defaultValue;
    }
    String raw = value.get();
    if (raw.equals("~") || raw.startsWith("~/")) {
      raw = System.getProperty("user.home", ".") + raw.substring(1);
    }
    try {
      return Path.of(raw).toAbsolutePath().normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(key + " is not a valid path: " + value.get(), ex);
    }
  }

  /**
   * Parses {@code <n>d|h|m|s} or an ISO-8601 duration such as {@code P7D}.
   *
   * @param key key for diagnostics
   * @param raw text to parse
   * @return non-negative duration
   */
  static Duration duration(String key, String raw) {
    String text = raw.trim();
    Matcher matcher = SHORT_DURATION.matcher(text.toLowerCase(Locale.ROOT));
    if (matcher.matches()) {
      long amount = Long.parseLong(matcher.group(1));
      return switch (matcher.group(2)) {
        case "d" -> Duration.ofDays(amount);
        case "h" -> Duration.ofHours(amount);
        case "m" -> Duration.ofMinutes(amount);
        default -> Duration.ofSeconds(amount);
      };
    }
    try {
      Duration parsed = Duration.parse(text.toUpperCase(Locale.ROOT));
      if (parsed.isNegative()) {
        throw new IllegalArgumentException(key + " must not be negative");
      }
      return parsed;
    } catch (DateTimeParseException ex) {
      throw new IllegalArgumentException(key + " must look like 7d, 12h, 30m, 45s or an ISO-8601 duration", ex);
    }
  }
}
