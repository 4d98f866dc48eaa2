package ca.gc.cra.trail.logging;

import ca.gc.cra.trail.domain.redaction.PiiPattern;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Logging hygiene helpers that keep prompt content and credentials out of operator logs.
 * <p><strong>Why:</strong> Exception messages from remote services can echo request text or access keys back to
 * the caller; those messages are scrubbed before they reach a log line or an audit record.</p>
 * <p><strong>Thread-safety:</strong> Stateless utilities safe for concurrent use.</p>
 *
 * @implNote Decoding uses {@link CodingErrorAction#IGNORE} to avoid exceptions when truncating mid-codepoint.
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";
  private static final String REDACTED_PLACEHOLDER = "[REDACTED]";
  private static final int MAX_SCRUBBED_BYTES = 512;
  private static final Pattern ACCESS_KEY = Pattern.compile("(?<![A-Z0-9])(?:AKIA|ASIA)[A-Z0-9]{16}(?![A-Z0-9])");
  private static final Pattern SECRET_ASSIGNMENT = Pattern.compile(
      "(?i)(secret|password|token|credential)s?\\s*[=:]\\s*\\S+");

  private Logs() {
    // Utility
  }

  /**
   * Truncates a string to the requested UTF-8 byte length, appending the original length metadata.
   *
   * @param value string to truncate; {@code null} results in {@code "<null>"}
   * @param maxBytes maximum number of bytes to retain; must be positive
   * @return truncated string when the input exceeds {@code maxBytes}; otherwise the original value
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    if (bytes.length <= maxBytes) {
      return value;
    }
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.IGNORE)
        .onUnmappableCharacter(CodingErrorAction.IGNORE);
    try {
      CharBuffer buffer = decoder.decode(ByteBuffer.wrap(bytes, 0, maxBytes));
      return buffer + "... (truncated, " + maxBytes + " of " + bytes.length + ")";
    } catch (CharacterCodingException ex) {
      String utf16Safe = new String(bytes, 0, maxBytes, StandardCharsets.UTF_8);
      return utf16Safe + "... (truncated)";
    }
  }

  /**
   * Masks PII, access key ids, and secret assignments inside a free-form message, then bounds its size.
   *
   * @param message exception or diagnostic message; {@code null} yields {@code "<null>"}
   * @return scrubbed message safe for logs and audit metadata
   */
  public static String scrub(String message) {
    if (message == null) {
      return NULL_PLACEHOLDER;
    }
    String scrubbed = message;
    for (PiiPattern rule : PiiPattern.values()) {
      scrubbed = rule.pattern().matcher(scrubbed)
          .replaceAll(Matcher.quoteReplacement(PiiPattern.placeholder(rule.category())));
    }
    scrubbed = ACCESS_KEY.matcher(scrubbed).replaceAll(REDACTED_PLACEHOLDER);
    scrubbed = SECRET_ASSIGNMENT.matcher(scrubbed).replaceAll("$1=" + Matcher.quoteReplacement(REDACTED_PLACEHOLDER));
    return truncate(scrubbed, MAX_SCRUBBED_BYTES);
  }

  /**
   * Scrubs the message of a throwable, falling back to its class name.
   *
   * @param error failure to describe
   * @return scrubbed description
   */
  public static String describe(Throwable error) {
    if (error == null) {
      return NULL_PLACEHOLDER;
    }
    String message = error.getMessage();
    String name = error.getClass().getSimpleName();
    return message == null || message.isBlank() ? name : name + ": " + scrub(message);
  }
}
