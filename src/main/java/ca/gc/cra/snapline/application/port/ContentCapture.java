package ca.gc.cra.snapline.application.port;

import ca.gc.cra.snapline.domain.content.Content;

/**
 * Turns a native value into a {@link Content} tree.
 *
 * <p>Implementations must fail with {@link ca.gc.cra.snapline.application.format.SerializationException} rather
 * than silently drop data when a value's shape cannot be represented.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface ContentCapture {

  /**
   * Captures {@code value}.
   *
   * @param value value to capture; may be {@code null}
   * @return content tree
   */
  Content capture(Object value);
}
