package ca.gc.cra.snapline.config;

import ca.gc.cra.snapline.application.assertion.UpdateMode;
import ca.gc.cra.snapline.validation.Strings;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Effective run-wide settings of the snapshot harness.
 *
 * @param update what a mismatch does
 * @param workspaceRoot root that relative source paths and snapshot directories resolve against
 * @param verbose raise library logging to DEBUG
 * @since 0.1.0
 */
public record SnapshotSettings(UpdateMode update, Path workspaceRoot, boolean verbose) {

  public SnapshotSettings {
    Objects.requireNonNull(update, "update");
    Objects.requireNonNull(workspaceRoot, "workspaceRoot");
  }

  /**
   * Returns the embedded defaults: update off, current working directory, quiet logging.
   *
   * @return default settings
   */
  public static SnapshotSettings defaults() {
    return fromMap(SettingsDefaults.asFlatMap());
  }

  /**
   * Builds settings from a flat key/value map using the keys {@code update}, {@code workspace} and
   * {@code verbose}. Missing keys fall back to {@link SettingsDefaults}.
   *
   * @param values flattened settings
   * @return parsed settings
   * @throws IllegalArgumentException when a value cannot be parsed
   */
  public static SnapshotSettings fromMap(Map<String, String> values) {
    Objects.requireNonNull(values, "values");
    Map<String, String> defaults = SettingsDefaults.asFlatMap();
    String update = valueOrDefault(values, defaults, SettingsDefaults.UPDATE);
    String workspace = valueOrDefault(values, defaults, SettingsDefaults.WORKSPACE);
    String verbose = valueOrDefault(values, defaults, SettingsDefaults.VERBOSE);
    return new SnapshotSettings(
        UpdateMode.parse(update),
        Path.of(workspace).toAbsolutePath().normalize(),
        parseBoolean(SettingsDefaults.VERBOSE, verbose));
  }

  private static String valueOrDefault(
      Map<String, String> values, Map<String, String> defaults, String key) {
    String value = Strings.trimToNull(values.get(key));
    return value != null ? value : defaults.get(key);
  }

  private static boolean parseBoolean(String key, String value) {
    return switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "true", "yes", "on", "1" -> true;
      case "false", "no", "off", "0" -> false;
      default -> throw new IllegalArgumentException(key + " must be a boolean, got '" + value + "'");
    };
  }
}
