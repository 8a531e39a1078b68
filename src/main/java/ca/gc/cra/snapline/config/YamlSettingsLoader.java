package ca.gc.cra.snapline.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads harness settings from a YAML document and flattens nested sections into dotted keys.
 *
 * <p>Keys may be written at the top level or under a {@code snapline:} section; the section prefix is dropped so
 * both {@code update: always} and {@code snapline: {update: always}} yield {@code update=always}.</p>
 */
public final class YamlSettingsLoader {
  /** File looked up in the working directory when no explicit path is configured. */
  public static final String DEFAULT_FILE_NAME = "snapline.yaml";
  /** System property naming an explicit settings file. */
  public static final String CONFIG_PROPERTY = "snapline.config";

  private static final String SECTION = "snapline";

  private YamlSettingsLoader() {}

  /**
   * Loads YAML from {@code path}.
   *
   * @param path location of the settings file
   * @return flat map, or empty when the file does not exist
   * @throws IOException when the file exists but cannot be read
   * @throws IllegalArgumentException when the YAML structure is invalid
   */
  public static Optional<Map<String, String>> load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      Object document = new Yaml().load(reader);
      if (document == null) {
        return Optional.of(Map.of());
      }
      Map<String, String> flattened = new LinkedHashMap<>();
      flatten(asMap(document, "root"), "", flattened);
      return Optional.of(Map.copyOf(flattened));
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML settings at " + path, ex);
    }
  }

  /**
   * Picks the settings file: the {@code snapline.config} property when set, otherwise {@code snapline.yaml} in
   * {@code workingDirectory}.
   *
   * @param systemProperties JVM properties snapshot
   * @param workingDirectory directory searched for the default file
   * @return path that {@link #load(Path)} should read
   */
  public static Path locate(Map<String, String> systemProperties, Path workingDirectory) {
    String explicit = systemProperties.get(CONFIG_PROPERTY);
    if (explicit != null && !explicit.isBlank()) {
      return Path.of(explicit.trim());
    }
    return workingDirectory.resolve(DEFAULT_FILE_NAME);
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(context + " section contains non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private static void flatten(Map<String, Object> source, String prefix, Map<String, String> target) {
    for (Map.Entry<String, Object> entry : source.entrySet()) {
      String key = entry.getKey().trim();
      if (key.isEmpty()) {
        throw new IllegalArgumentException("YAML contains blank keys");
      }
      Object value = entry.getValue();
      if (prefix.isEmpty() && SECTION.equals(key) && value instanceof Map<?, ?> section) {
        flatten(asMap(section, SECTION), "", target);
        continue;
      }
      String composite = prefix.isEmpty() ? key : prefix + '.' + key;
      if (value == null) {
        target.put(composite, "");
      } else if (value instanceof Map<?, ?> nested) {
        flatten(asMap(nested, composite), composite, target);
      } else if (value instanceof Iterable<?>) {
        throw new IllegalArgumentException("YAML arrays are not supported for key " + composite);
      } else {
        // SnakeYAML reads bare on/off as booleans; toString keeps them parseable as update modes
        target.put(composite, value.toString());
      }
    }
  }
}
