package ca.gc.cra.snapline.domain.content;

import java.util.Objects;

/**
 * One step from a parent node to a child node inside a {@link Content} tree.
 *
 * @since 0.1.0
 */
public sealed interface PathElement permits PathElement.Key, PathElement.Field, PathElement.Index {

  /**
   * Map entry addressed by its key.
   *
   * @param key map key content
   */
  record Key(Content key) implements PathElement {
    public Key {
      Objects.requireNonNull(key, "key");
    }

    @Override
    public String toString() {
      if (key instanceof Content.StringValue s) {
        return s.value();
      }
      return "[" + key + "]";
    }
  }

  /**
   * Struct field addressed by name.
   *
   * @param name field name
   */
  record Field(String name) implements PathElement {
    public Field {
      Objects.requireNonNull(name, "name");
    }

    @Override
    public String toString() {
      return name;
    }
  }

  /**
   * Sequence element addressed by position.
   *
   * @param index zero-based position
   */
  record Index(int index) implements PathElement {
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
}
