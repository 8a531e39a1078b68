package ca.gc.cra.snapline.application.format;

import ca.gc.cra.snapline.domain.content.Content;

/**
 * Renders a content tree to snapshot text.
 *
 * <p>Implementations are pure and deterministic: equal trees always yield byte-identical text, lines end with
 * {@code \n} and the result carries no trailing newline.</p>
 *
 * @since 0.1.0
 */
public interface ContentRenderer {

  /**
   * Returns the format this renderer produces.
   *
   * @return format tag
   */
  SnapshotFormat format();

  /**
   * Renders {@code tree}.
   *
   * @param tree content to render; must not be {@code null}
   * @return rendered text
   * @throws SerializationException when the tree cannot be expressed in this format
   */
  String render(Content tree);
}
