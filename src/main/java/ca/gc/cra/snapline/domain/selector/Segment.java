package ca.gc.cra.snapline.domain.selector;

import java.util.Objects;

/**
 * One step of a compiled {@link Selector}.
 *
 * @since 0.1.0
 */
public sealed interface Segment
    permits Segment.Key, Segment.Index, Segment.Wildcard, Segment.DeepWildcard {

  /** Matches every child at a single depth. */
  Wildcard WILDCARD = new Wildcard();

  /** Matches the current node and every descendant. */
  DeepWildcard DEEP_WILDCARD = new DeepWildcard();

  /**
   * Exact map key or struct field name.
   *
   * @param name key to match
   */
  record Key(String name) implements Segment {
    public Key {
      Objects.requireNonNull(name, "name");
    }

    @Override
    public String toString() {
      return Selector.isPlainIdentifier(name) ? name : Selector.quote(name);
    }
  }

  /**
   * Exact sequence index (or integer map key).
   *
   * @param index non-negative position
   */
  record Index(int index) implements Segment {
    public Index {
      if (index < 0) {
        throw new IllegalArgumentException("index must not be negative");
      }
    }

    @Override
    public String toString() {
      return Integer.toString(index);
    }
  }

  /** Single-depth wildcard ({@code *}). */
  record Wildcard() implements Segment {
    @Override
    public String toString() {
      return "*";
    }
  }

  /** Recursive wildcard ({@code **}). */
  record DeepWildcard() implements Segment {
    @Override
    public String toString() {
      return "**";
    }
  }
}
