package ca.gc.cra.trail.application.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 helpers producing lowercase hex digests.
 *
 * @since 0.1.0
 */
public final class Digests {
  private static final HexFormat HEX = HexFormat.of();

  private Digests() {
    // Utility
  }

  /**
   * Hashes the UTF-8 encoding of a string.
   *
   * @param value text to hash; {@code null} is treated as empty
   * @return 64 character lowercase hex digest
   */
  public static String sha256Hex(String value) {
    return sha256Hex((value == null ? "" : value).getBytes(StandardCharsets.UTF_8));
  }

  /**
   * Hashes raw bytes.
   *
   * @param bytes bytes to hash
   * @return 64 character lowercase hex digest
   */
  public static String sha256Hex(byte[] bytes) {
    return HEX.formatHex(newSha256().digest(bytes));
  }

  /**
   * Checks that a value looks like a SHA-256 hex digest.
   *
   * @param value candidate digest
   * @return {@code true} for 64 lowercase hex characters
   */
  public static boolean isSha256Hex(String value) {
    if (value == null || value.length() != 64) {
      return false;
    }
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (!((c >= '0' && c <= '9') || (c >= 'a' && c <= 'f'))) {
        return false;
      }
    }
    return true;
  }

  private static MessageDigest newSha256() {
    try {
      return MessageDigest.getInstance("SHA-256");
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 not available", ex);
    }
  }
}
