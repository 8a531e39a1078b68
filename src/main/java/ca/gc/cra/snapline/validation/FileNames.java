package ca.gc.cra.snapline.validation;

import java.util.Objects;

/**
 * <strong>What:</strong> File-name hygiene for snapshot artifacts.
 * <p><strong>Why:</strong> Snapshot names come from test code (method names, user-chosen labels) and must map to
 * portable file names on every platform.</p>
 * <p><strong>Thread-safety:</strong> Stateless utilities safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class FileNames {
  private FileNames() {
    // Utility
  }

  /**
   * Replaces every character outside {@code [A-Za-z0-9._-]} with {@code _}.
   *
   * @param name candidate name; must not be {@code null}
   * @return sanitized name; {@code "x"} when the input is empty
   */
  public static String sanitize(String name) {
    Objects.requireNonNull(name, "name");
    StringBuilder sb = new StringBuilder(Math.max(16, name.length()));
    for (int i = 0; i < name.length(); i++) {
      char c = name.charAt(i);
      if (isAsciiLetterOrDigit(c) || c == '-' || c == '_' || c == '.') {
        sb.append(c);
      } else {
        sb.append('_');
      }
    }
    if (sb.length() == 0) {
      sb.append('x');
    }
    return sb.toString();
  }

  /**
   * Like {@link #sanitize(String)}, but also replaces {@code -} so the result never contains a sequence suffix
   * separator.
   *
   * @param name candidate name; must not be {@code null}
   * @return sanitized name restricted to {@code [A-Za-z0-9._]}
   */
  public static String sanitizeStem(String name) {
    return sanitize(name).replace('-', '_');
  }

  private static boolean isAsciiLetterOrDigit(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
  }
}
