package ca.gc.cra.snapline.domain.content;

/**
 * Implemented by types that describe their own snapshot shape.
 *
 * <p>This is how structs get their field order: the implementation lists fields explicitly, for example
 * {@code Content.struct("User").field("id", id).field("name", name).build()}.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface Capturable {

  /**
   * Returns the structural representation of this value.
   *
   * @return content tree; must not be {@code null}
   */
  Content toContent();
}
