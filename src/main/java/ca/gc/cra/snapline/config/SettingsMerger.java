package ca.gc.cra.snapline.config;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges settings sources with precedence system properties &gt; environment &gt; YAML &gt; defaults.
 */
public final class SettingsMerger {
  static final String ENV_PREFIX = "SNAPLINE_";
  static final String PROPERTY_PREFIX = "snapline.";

  private SettingsMerger() {}

  /**
   * Builds the effective flat settings map.
   *
   * @param defaults embedded defaults
   * @param yaml optional YAML-derived settings
   * @param environment process environment (only {@code SNAPLINE_*} entries are read)
   * @param systemProperties JVM properties (only {@code snapline.*} entries are read)
   * @param warn invoked for unknown YAML keys and for overrides of YAML values; may be {@code null}
   * @return unmodifiable merged map keyed by {@code update}, {@code workspace} and {@code verbose}
   */
  public static Map<String, String> buildEffectiveSettings(
      Map<String, String> defaults,
      Optional<Map<String, String>> yaml,
      Map<String, String> environment,
      Map<String, String> systemProperties,
      Consumer<String> warn) {
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);

    for (Map.Entry<String, String> entry : yamlCopy.entrySet()) {
      if (!SettingsDefaults.isKnownKey(entry.getKey())) {
        if (warn != null) {
          warn.accept("Ignoring unknown YAML settings key: " + entry.getKey());
        }
        continue;
      }
      putIfPresent(merged, entry.getKey(), entry.getValue());
    }
    overlay(merged, yamlCopy, fromEnvironment(environment), "environment", warn);
    overlay(merged, yamlCopy, fromSystemProperties(systemProperties), "system property", warn);
    return Map.copyOf(merged);
  }

  /**
   * Runs the full resolution chain against the live process: locate and load YAML, read environment and
   * system properties, merge and parse.
   *
   * @param warn receives merge warnings; may be {@code null}
   * @return effective settings
   * @throws IllegalArgumentException when a source holds an invalid value or the YAML file cannot be read
   */
  public static SnapshotSettings resolve(Consumer<String> warn) {
    Map<String, String> properties = new LinkedHashMap<>();
    System.getProperties().stringPropertyNames()
        .forEach(name -> properties.put(name, System.getProperty(name)));
    Map<String, String> environment = System.getenv();
    Path file = YamlSettingsLoader.locate(properties, Path.of(""));
    Optional<Map<String, String>> yaml;
    try {
      yaml = YamlSettingsLoader.load(file);
    } catch (IOException ex) {
      throw new IllegalArgumentException("Failed to read settings file " + file, ex);
    }
    return SnapshotSettings.fromMap(buildEffectiveSettings(
        SettingsDefaults.asFlatMap(), yaml, environment, properties, warn));
  }

  static Map<String, String> fromEnvironment(Map<String, String> environment) {
    Map<String, String> out = new LinkedHashMap<>();
    if (environment == null) {
      return out;
    }
    putIfPresent(out, SettingsDefaults.UPDATE, environment.get(ENV_PREFIX + "UPDATE"));
    putIfPresent(out, SettingsDefaults.WORKSPACE, environment.get(ENV_PREFIX + "WORKSPACE"));
    putIfPresent(out, SettingsDefaults.VERBOSE, environment.get(ENV_PREFIX + "VERBOSE"));
    return out;
  }

  static Map<String, String> fromSystemProperties(Map<String, String> properties) {
    Map<String, String> out = new LinkedHashMap<>();
    if (properties == null) {
      return out;
    }
    putIfPresent(out, SettingsDefaults.UPDATE, properties.get(PROPERTY_PREFIX + SettingsDefaults.UPDATE));
    putIfPresent(out, SettingsDefaults.WORKSPACE, properties.get(PROPERTY_PREFIX + SettingsDefaults.WORKSPACE));
    putIfPresent(out, SettingsDefaults.VERBOSE, properties.get(PROPERTY_PREFIX + SettingsDefaults.VERBOSE));
    return out;
  }

  private static void overlay(
      Map<String, String> merged,
      Map<String, String> yaml,
      Map<String, String> layer,
      String source,
      Consumer<String> warn) {
    for (Map.Entry<String, String> entry : layer.entrySet()) {
      if (yaml.containsKey(entry.getKey()) && warn != null) {
        warn.accept(source + " overrides YAML for key: " + entry.getKey());
      }
      merged.put(entry.getKey(), entry.getValue());
    }
  }

  private static void putIfPresent(Map<String, String> target, String key, String value) {
    if (value != null && !value.isBlank()) {
      target.put(key, value.trim());
    }
  }
}
