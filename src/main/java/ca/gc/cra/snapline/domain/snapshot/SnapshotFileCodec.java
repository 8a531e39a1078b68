package ca.gc.cra.snapline.domain.snapshot;

import java.util.Map;
import java.util.Objects;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads and writes the on-disk snapshot layout.
 *
 * <pre>
 * ---
 * source: src/test/java/com/acme/UserTest.java
 * line: 42
 * expression: user
 * ---
 * &lt;body&gt;
 * </pre>
 *
 * <p>The header is a YAML mapping. Text without a leading {@code ---} line is read entirely as body.</p>
 *
 * @since 0.1.0
 */
public final class SnapshotFileCodec {
  private static final String DELIMITER = "---";

  private SnapshotFileCodec() {}

  /**
   * Serializes a snapshot file.
   *
   * @param file snapshot to write
   * @return file text ending with a single newline
   */
  public static String format(SnapshotFile file) {
    Objects.requireNonNull(file, "file");
    StringBuilder out = new StringBuilder();
    out.append(DELIMITER).append('\n');
    Map<String, Object> header = file.metadata().asMap();
    if (!header.isEmpty()) {
      out.append(headerYaml().dump(header));
    }
    out.append(DELIMITER).append('\n');
    out.append(file.body()).append('\n');
    return out.toString();
  }

  /**
   * Parses snapshot file text.
   *
   * @param text raw file content
   * @return parsed file
   * @throws IllegalArgumentException when the header block is not valid YAML
   */
  public static SnapshotFile parse(String text) {
    Objects.requireNonNull(text, "text");
    String normalized = text.replace("\r\n", "\n");
    String opening = DELIMITER + "\n";
    if (!normalized.startsWith(opening)) {
      return new SnapshotFile(SnapshotMetadata.EMPTY, normalized);
    }
    String rest = normalized.substring(opening.length());
    String header;
    String body;
    if (rest.startsWith(opening) || rest.equals(DELIMITER)) {
      header = "";
      body = rest.length() > opening.length() ? rest.substring(opening.length()) : "";
    } else {
      int close = rest.indexOf("\n" + opening);
      if (close >= 0) {
        header = rest.substring(0, close);
        body = rest.substring(close + opening.length() + 1);
      } else if (rest.endsWith("\n" + DELIMITER)) {
        header = rest.substring(0, rest.length() - DELIMITER.length() - 1);
        body = "";
      } else {
        return new SnapshotFile(SnapshotMetadata.EMPTY, normalized);
      }
    }
    return new SnapshotFile(parseHeader(header), body);
  }

  private static SnapshotMetadata parseHeader(String header) {
    if (header.isBlank()) {
      return SnapshotMetadata.EMPTY;
    }
    Object document;
    try {
      document = new Yaml().load(header);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Malformed snapshot header", ex);
    }
    if (!(document instanceof Map<?, ?> map)) {
      return SnapshotMetadata.EMPTY;
    }
    return new SnapshotMetadata(
        text(map.get("source")),
        map.get("line") instanceof Number n ? n.intValue() : 0,
        text(map.get("expression")),
        text(map.get("name")),
        text(map.get("format")));
  }

  private static String text(Object value) {
    return value == null ? null : value.toString();
  }

  private static Yaml headerYaml() {
    DumperOptions options = new DumperOptions();
    options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
    options.setLineBreak(DumperOptions.LineBreak.UNIX);
    options.setWidth(Integer.MAX_VALUE);
    options.setSplitLines(false);
    return new Yaml(options);
  }
}
