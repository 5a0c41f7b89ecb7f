package com.consullo.workbench.state;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.regex.Pattern;
import org.apache.commons.lang3.Validate;

/**
 * Stable identifier of a project used to partition every persisted record.
 *
 * <p>The value is the first four bytes of the SHA-256 digest of the normalized project path, rendered as eight
 * lower-case hex characters. It is derived once when a project is opened and stored in {@link ProjectState};
 * everything downstream reads the stored key.
 *
 * @param value eight lower-case hex characters
 * @since 1.0
 */
public record ProjectKey(String value) {

  private static final Pattern FORMAT = Pattern.compile("[0-9a-f]{8}");

  public ProjectKey {
    Validate.notNull(value, "value must not be null");
    Validate.isTrue(FORMAT.matcher(value).matches(), "project key must be 8 lower-case hex chars: %s", value);
  }

  /**
   * Derives the key of a filesystem path.
   *
   * @param path project path
   * @return derived key
   */
  public static ProjectKey derive(final String path) {
    Validate.notBlank(path, "path must not be blank");
    final String normalized = Path.of(path).normalize().toString();
    try {
      final MessageDigest digest = MessageDigest.getInstance("SHA-256");
      final byte[] hash = digest.digest(normalized.getBytes(StandardCharsets.UTF_8));
      return new ProjectKey(HexFormat.of().formatHex(hash, 0, 4));
    } catch (final NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 is not available", e);
    }
  }

  @Override
  public String toString() {
    return value;
  }
}
