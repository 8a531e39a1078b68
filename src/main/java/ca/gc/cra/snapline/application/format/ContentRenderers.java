package ca.gc.cra.snapline.application.format;

import java.util.Objects;

/**
 * Maps each {@link SnapshotFormat} to its renderer.
 *
 * @since 0.1.0
 */
public final class ContentRenderers {
  private static final ContentRenderer JSON = new JsonContentRenderer();
  private static final ContentRenderer YAML = new YamlContentRenderer();
  private static final ContentRenderer RON = new RonContentRenderer();

  private ContentRenderers() {}

  /**
   * Returns the shared renderer for {@code format}.
   *
   * @param format requested format; must not be {@code null}
   * @return stateless, thread-safe renderer
   */
  public static ContentRenderer forFormat(SnapshotFormat format) {
    Objects.requireNonNull(format, "format");
    return switch (format) {
      case JSON -> JSON;
      case YAML -> YAML;
      case RON -> RON;
    };
  }
}
