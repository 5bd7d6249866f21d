package dev.bulletin.document;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 helpers for source fingerprints and content-derived document identities.
 */
public final class ContentHasher {

  /** Separates hashed fields so that {@code ("ab", "c")} and {@code ("a", "bc")} differ. */
  private static final char FIELD_SEPARATOR = '\u001F';

  private ContentHasher() {
    // utility class
  }

  /**
   * Hex SHA-256 of raw bytes, used as the fingerprint of a knowledge-base source file.
   *
   * @param content the bytes to hash
   * @return lowercase hex digest
   */
  public static String sha256(byte[] content) {
    return HexFormat.of().formatHex(digest().digest(content));
  }

  /**
   * Hex SHA-256 over several text fields joined with a unit separator.
   *
   * @param fields the field values, in a fixed order
   * @return lowercase hex digest
   */
  public static String sha256Fields(String... fields) {
    return sha256(String.join(String.valueOf(FIELD_SEPARATOR), fields)
        .getBytes(StandardCharsets.UTF_8));
  }

  private static MessageDigest digest() {
    try {
      return MessageDigest.getInstance("SHA-256");
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 algorithm not available", e);
    }
  }
}
