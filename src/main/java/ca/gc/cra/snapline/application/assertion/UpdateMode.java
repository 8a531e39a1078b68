package ca.gc.cra.snapline.application.assertion;

import java.util.Locale;

/**
 * Run-wide toggle deciding what a mismatch does.
 *
 * @since 0.1.0
 */
public enum UpdateMode {
  /** Mismatches fail and write a pending snapshot next to the baseline. */
  OFF,
  /** Mismatches overwrite the baseline and report {@link AssertionOutcome.Updated}. */
  ON;

  /**
   * Parses the spellings accepted from configuration.
   *
   * @param value {@code off/no/false/0} or {@code on/always/yes/true/1/overwrite}, case-insensitive
   * @return matching mode
   * @throws IllegalArgumentException for any other value
   */
  public static UpdateMode parse(String value) {
    if (value == null) {
      throw new IllegalArgumentException("update mode must not be null");
    }
    return switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "off", "no", "false", "0" -> OFF;
      case "on", "always", "yes", "true", "1", "overwrite" -> ON;
      default -> throw new IllegalArgumentException("Unknown update mode: " + value);
    };
  }
}
