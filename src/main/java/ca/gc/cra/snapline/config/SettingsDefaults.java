package ca.gc.cra.snapline.config;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Flattened embedded defaults; the single source of truth for which setting keys exist.
 */
public final class SettingsDefaults {
  public static final String UPDATE = "update";
  public static final String WORKSPACE = "workspace";
  public static final String VERBOSE = "verbose";

  private SettingsDefaults() {}

  /**
   * Returns the default value for every known key.
   *
   * @return unmodifiable map in declaration order
   */
  public static Map<String, String> asFlatMap() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put(UPDATE, "off");
    map.put(WORKSPACE, Path.of("").toAbsolutePath().toString());
    map.put(VERBOSE, "false");
    return Map.copyOf(map);
  }

  static boolean isKnownKey(String key) {
    return UPDATE.equals(key) || WORKSPACE.equals(key) || VERBOSE.equals(key);
  }
}
