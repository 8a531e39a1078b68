package ca.gc.cra.snapline.domain.snapshot;

import java.util.Objects;

/**
 * Parsed snapshot artifact: a diagnostic header plus the body that comparisons look at.
 *
 * @param metadata diagnostic header
 * @param body normalized snapshot body
 * @since 0.1.0
 */
public record SnapshotFile(SnapshotMetadata metadata, String body) {

  /**
   * Normalizes the body on construction.
   */
  public SnapshotFile {
    Objects.requireNonNull(metadata, "metadata");
    body = normalizeBody(Objects.requireNonNull(body, "body"));
  }

  /**
   * Converts {@code \r\n} line endings to {@code \n} and strips trailing line breaks.
   *
   * @param text raw body text
   * @return normalized text
   */
  public static String normalizeBody(String text) {
    String normalized = text.indexOf('\r') >= 0 ? text.replace("\r\n", "\n") : text;
    int end = normalized.length();
    while (end > 0 && normalized.charAt(end - 1) == '\n') {
      end--;
    }
    return normalized.substring(0, end);
  }

  /**
   * Tests whether this file's body equals {@code rendered} after normalization.
   *
   * @param rendered freshly rendered text
   * @return {@code true} when the bodies match
   */
  public boolean contentMatches(String rendered) {
    return body.equals(normalizeBody(rendered));
  }
}
