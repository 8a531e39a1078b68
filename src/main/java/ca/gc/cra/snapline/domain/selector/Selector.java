package ca.gc.cra.snapline.domain.selector;

import ca.gc.cra.snapline.domain.content.Content;
import ca.gc.cra.snapline.domain.content.ContentPath;
import ca.gc.cra.snapline.domain.content.PathElement;
import java.util.List;
import java.util.Objects;

/**
 * Compiled path expression that locates nodes inside a content tree.
 *
 * <p>Selectors are always anchored at the root. {@code *} consumes exactly one step, {@code **} consumes
 * zero or more steps, so {@code **.id} matches an {@code id} field at any depth including the top level.</p>
 *
 * @since 0.1.0
 */
public final class Selector {
  private final List<Segment> segments;

  Selector(List<Segment> segments) {
    this.segments = List.copyOf(segments);
  }

  /**
   * Compiles a selector expression such as {@code .user.**.password} or {@code .items[0].id}.
   *
   * @param expression selector text; must not be {@code null}
   * @return compiled selector
   * @throws SelectorParseException when the expression is malformed
   */
  public static Selector parse(String expression) {
    return SelectorParser.parse(expression);
  }

  /**
   * Creates a selector from already-built segments.
   *
   * @param segments segments in match order; must not be empty
   * @return selector
   */
  public static Selector of(Segment... segments) {
    if (segments.length == 0) {
      throw new IllegalArgumentException("selector requires at least one segment");
    }
    return new Selector(List.of(segments));
  }

  public List<Segment> segments() {
    return segments;
  }

  /**
   * Tests whether this selector addresses the node at {@code path}.
   *
   * @param path location of the candidate node
   * @return {@code true} when every segment lines up with the path
   */
  public boolean matches(ContentPath path) {
    Objects.requireNonNull(path, "path");
    int n = segments.size();
    int m = path.depth();
    // reachable[j]: the first i segments can consume exactly the first j path elements
    boolean[] reachable = new boolean[m + 1];
    reachable[0] = true;
    for (int i = 0; i < n; i++) {
      Segment segment = segments.get(i);
      boolean[] next = new boolean[m + 1];
      if (segment instanceof Segment.DeepWildcard) {
        boolean any = false;
        for (int j = 0; j <= m; j++) {
          any |= reachable[j];
          next[j] = any;
        }
      } else {
        for (int j = 0; j < m; j++) {
          if (reachable[j] && accepts(segment, path.get(j))) {
            next[j + 1] = true;
          }
        }
      }
      reachable = next;
    }
    return reachable[m];
  }

  private static boolean accepts(Segment segment, PathElement element) {
    if (segment instanceof Segment.Wildcard) {
      return true;
    }
    if (segment instanceof Segment.Key key) {
      if (element instanceof PathElement.Field field) {
        return field.name().equals(key.name());
      }
      return element instanceof PathElement.Key mapKey
          && mapKey.key() instanceof Content.StringValue s
          && s.value().equals(key.name());
    }
    if (segment instanceof Segment.Index index) {
      if (element instanceof PathElement.Index idx) {
        return idx.index() == index.index();
      }
      return element instanceof PathElement.Key mapKey
          && mapKey.key() instanceof Content.IntValue i
          && i.value() == index.index();
    }
    return false;
  }

  static boolean isPlainIdentifier(String name) {
    if (name.isEmpty() || SelectorParser.isAsciiDigit(name.charAt(0)) || name.startsWith("-")) {
      return false;
    }
    for (int i = 0; i < name.length(); i++) {
      if (!SelectorParser.isIdentifierChar(name.charAt(i))) {
        return false;
      }
    }
    return true;
  }

  static String quote(String name) {
    StringBuilder sb = new StringBuilder(name.length() + 2).append('"');
    for (int i = 0; i < name.length(); i++) {
      char c = name.charAt(i);
      if (c == '"' || c == '\\') {
        sb.append('\\');
      }
      sb.append(c);
    }
    return sb.append('"').toString();
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof Selector that && segments.equals(that.segments);
  }

  @Override
  public int hashCode() {
    return segments.hashCode();
  }

  /**
   * Returns the canonical dotted form, which parses back to an equal selector.
   *
   * @return selector text with a leading dot
   */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (Segment segment : segments) {
      sb.append('.').append(segment);
    }
    return sb.toString();
  }
}
