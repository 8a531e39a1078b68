package ca.gc.cra.snapline.application.format;

import java.util.Locale;

/**
 * Closed set of textual snapshot formats.
 *
 * @since 0.1.0
 */
public enum SnapshotFormat {
  /** Pretty-printed JSON; struct and enum type names are dropped. */
  JSON,
  /** Block-style YAML; struct and enum type names are dropped. */
  YAML,
  /** RON-style typed text; struct names and enum variant tags are kept. */
  RON;

  /**
   * Parses a format name case-insensitively.
   *
   * @param value format name such as {@code "yaml"}
   * @return matching format
   * @throws IllegalArgumentException when the name is unknown
   */
  public static SnapshotFormat fromString(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("snapshot format must not be blank");
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unknown snapshot format: " + value, ex);
    }
  }
}
