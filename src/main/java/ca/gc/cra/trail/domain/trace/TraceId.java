package ca.gc.cra.trail.domain.trace;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.UUID;

/**
 * Identifier shared by every artifact of one prompt/response exchange.
 *
 * <p>Rendered as {@code <uuid>:<yyyy-MM-ddTHH:mm:ssZ>}. The UUID part is a random (version 4) UUID drawn from
 * {@link java.security.SecureRandom} through {@link UUID#randomUUID()}; the timestamp is UTC truncated to whole
 * seconds so the textual form of the timestamp sorts in creation order.</p>
 *
 * @param uniqueId random UUID component; also names the persisted record file
 * @param createdAt UTC creation instant truncated to seconds
 * @since 0.1.0
 */
public record TraceId(UUID uniqueId, Instant createdAt) implements Comparable<TraceId> {
  /** Formatter for the timestamp component. */
  public static final DateTimeFormatter TIMESTAMP_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'").withZone(ZoneOffset.UTC);

  /**
   * Validates components.
   *
   * @throws NullPointerException if a component is {@code null}
   * @throws IllegalArgumentException if {@code uniqueId} is not a version 4 UUID or {@code createdAt} carries
   *     sub-second precision
   */
  public TraceId {
    Objects.requireNonNull(uniqueId, "uniqueId");
    Objects.requireNonNull(createdAt, "createdAt");
    if (uniqueId.version() != 4 || uniqueId.variant() != 2) {
      throw new IllegalArgumentException("uniqueId must be a random (version 4) UUID");
    }
    if (createdAt.getNano() != 0) {
      throw new IllegalArgumentException("createdAt must be truncated to seconds");
    }
  }

  /**
   * Creates a new identifier using the system clock.
   *
   * @return new trace identifier
   */
  public static TraceId newId() {
    return newId(Instant.now());
  }

  /**
   * Creates a new identifier stamped with the supplied wall-clock reading.
   *
   * @param now current instant; truncated to seconds
   * @return new trace identifier
   */
  public static TraceId newId(Instant now) {
    Objects.requireNonNull(now, "now");
    return new TraceId(UUID.randomUUID(), now.truncatedTo(ChronoUnit.SECONDS));
  }

  /**
   * Parses the external {@code <uuid>:<timestamp>} form.
   *
   * @param value textual trace id
   * @return parsed identifier
   * @throws IllegalArgumentException when the value is malformed
   */
  public static TraceId parse(String value) {
    if (value == null) {
      throw new IllegalArgumentException("trace id must not be null");
    }
    String trimmed = value.trim();
    int idx = trimmed.indexOf(':');
    if (idx <= 0 || idx == trimmed.length() - 1) {
      throw new IllegalArgumentException("trace id must use <uuid>:<timestamp> format");
    }
    try {
      UUID uuid = UUID.fromString(trimmed.substring(0, idx));
      Instant created = Instant.from(TIMESTAMP_FORMAT.parse(trimmed.substring(idx + 1)));
      return new TraceId(uuid, created);
    } catch (DateTimeParseException ex) {
      throw new IllegalArgumentException("trace id timestamp is not yyyy-MM-ddTHH:mm:ssZ: " + trimmed, ex);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("invalid trace id: " + trimmed, ex);
    }
  }

  /**
   * Returns the UTC timestamp component as text.
   *
   * @return timestamp formatted as {@code yyyy-MM-ddTHH:mm:ssZ}
   */
  public String timestamp() {
    return TIMESTAMP_FORMAT.format(createdAt);
  }

  /**
   * Returns the record file name derived from the unique component.
   *
   * @return {@code <uuid>.json}
   */
  public String fileName() {
    return uniqueId + ".json";
  }

  @Override
  public int compareTo(TraceId other) {
    int byTime = createdAt.compareTo(other.createdAt);
    return byTime != 0 ? byTime : uniqueId.toString().compareTo(other.uniqueId.toString());
  }

  @Override
  public String toString() {
    return uniqueId + ":" + timestamp();
  }
}
