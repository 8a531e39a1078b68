package ca.gc.cra.snapline.domain.content;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable location of a node inside a {@link Content} tree, expressed as the steps taken from the root.
 *
 * <p>Enum payloads do not add a step: they share the path of their enum node.</p>
 *
 * @since 0.1.0
 */
public final class ContentPath {
  private static final ContentPath ROOT = new ContentPath(List.of());

  private final List<PathElement> elements;

  private ContentPath(List<PathElement> elements) {
    this.elements = elements;
  }

  /**
   * Returns the path of the tree root.
   *
   * @return empty path
   */
  public static ContentPath root() {
    return ROOT;
  }

  /**
   * Builds a path from explicit elements.
   *
   * @param elements steps from the root; must not be {@code null}
   * @return path instance
   */
  public static ContentPath of(PathElement... elements) {
    return new ContentPath(List.of(elements));
  }

  /**
   * Returns a new path one step deeper.
   *
   * @param element child step
   * @return extended path; this instance is unchanged
   */
  public ContentPath child(PathElement element) {
    Objects.requireNonNull(element, "element");
    List<PathElement> next = new ArrayList<>(elements.size() + 1);
    next.addAll(elements);
    next.add(element);
    return new ContentPath(List.copyOf(next));
  }

  public List<PathElement> elements() {
    return elements;
  }

  public int depth() {
    return elements.size();
  }

  public PathElement get(int index) {
    return elements.get(index);
  }

  public boolean isRoot() {
    return elements.isEmpty();
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof ContentPath that && elements.equals(that.elements);
  }

  @Override
  public int hashCode() {
    return elements.hashCode();
  }

  @Override
  public String toString() {
    if (elements.isEmpty()) {
      return ".";
    }
    StringBuilder sb = new StringBuilder();
    for (PathElement element : elements) {
      sb.append('.').append(element);
    }
    return sb.toString();
  }
}
