package ca.gc.cra.trail.domain.redaction;

import java.util.regex.Pattern;

/**
 * Deterministic local detection rules, declared in priority order.
 *
 * <p>Boundaries are expressed as ASCII lookarounds instead of {@code \b} so that identifiers embedded in
 * Japanese text (no spaces between words) are still found. The order is used as the tie breaker when two rules
 * match spans of the same length.</p>
 *
 * @since 0.1.0
 */
public enum PiiPattern {
  EMAIL("(?<![A-Za-z0-9._%+-])[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}(?![A-Za-z0-9])"),
  PHONE_INTL("\\+81[-\\s]?\\d{1,4}[-\\s]?\\d{1,4}[-\\s]?\\d{4}" + PiiPattern.END),
  CREDIT_CARD(PiiPattern.START + "\\d{4}[-\\s]?\\d{4}[-\\s]?\\d{4}[-\\s]?\\d{4}" + PiiPattern.END),
  MY_NUMBER(PiiPattern.START + "\\d{4}-?\\d{4}-?\\d{4}" + PiiPattern.END),
  PHONE_JP(PiiPattern.START + "0\\d{1,4}-?\\d{1,4}-?\\d{4}" + PiiPattern.END),
  SSN(PiiPattern.START + "\\d{3}-\\d{2}-\\d{4}" + PiiPattern.END),
  ZIP_CODE_JP(PiiPattern.START + "\\d{3}-?\\d{4}" + PiiPattern.END),
  IPV4(PiiPattern.START + "(?:25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)(?:\\.(?:25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)){3}"
      + PiiPattern.END);

  private static final String START = "(?<![A-Za-z0-9])";
  private static final String END = "(?![A-Za-z0-9])";

  private final Pattern pattern;

  PiiPattern(String regex) {
    this.pattern = Pattern.compile(regex);
  }

  /**
   * Returns the compiled rule.
   *
   * @return thread-safe compiled pattern
   */
  public Pattern pattern() {
    return pattern;
  }

  /**
   * Returns the category label written into findings and placeholders.
   *
   * @return category name such as {@code EMAIL}
   */
  public String category() {
    return name();
  }

  /**
   * Builds the placeholder token that replaces a finding of the given category.
   *
   * @param category finding category, local or remote
   * @return placeholder such as {@code [MASKED_EMAIL]}
   */
  public static String placeholder(String category) {
    return "[MASKED_" + category + "]";
  }
}
