package ca.gc.cra.snapline.domain.snapshot;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Diagnostic header stored above a snapshot body. Never participates in comparison.
 *
 * @param source source file of the assertion, relative to the workspace root when possible
 * @param line assertion line, or {@code 0} when unknown
 * @param expression source expression that produced the value; may be {@code null}
 * @param name explicit snapshot name; may be {@code null}
 * @param format rendering format name; may be {@code null}
 * @since 0.1.0
 */
public record SnapshotMetadata(String source, int line, String expression, String name, String format) {

  /** Metadata with no fields set. */
  public static final SnapshotMetadata EMPTY = new SnapshotMetadata(null, 0, null, null, null);

  /**
   * Returns the populated fields in header order.
   *
   * @return ordered map of header keys to values
   */
  public Map<String, Object> asMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    if (source != null) {
      map.put("source", source);
    }
    if (line > 0) {
      map.put("line", line);
    }
    if (expression != null) {
      map.put("expression", expression);
    }
    if (name != null) {
      map.put("name", name);
    }
    if (format != null) {
      map.put("format", format);
    }
    return map;
  }
}
