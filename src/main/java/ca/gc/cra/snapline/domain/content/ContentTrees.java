package ca.gc.cra.snapline.domain.content;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Path-based navigation and copy-on-write replacement over {@link Content} trees.
 *
 * <p>Neither operation mutates its input. Replacement rebuilds only the containers on the path to the
 * replaced node; every other subtree is shared with the original.</p>
 *
 * @since 0.1.0
 */
public final class ContentTrees {

  private ContentTrees() {}

  /**
   * Returns the node at {@code path}.
   *
   * @param tree root node; must not be {@code null}
   * @param path location to resolve; must not be {@code null}
   * @return node when every step resolves, otherwise empty
   */
  public static Optional<Content> lookup(Content tree, ContentPath path) {
    Objects.requireNonNull(tree, "tree");
    Objects.requireNonNull(path, "path");
    Content current = tree;
    for (PathElement element : path.elements()) {
      current = child(unwrapEnum(current), element);
      if (current == null) {
        return Optional.empty();
      }
    }
    return Optional.of(current);
  }

  /**
   * Returns a copy of {@code tree} with the node at {@code path} replaced by {@code value}.
   *
   * @param tree root node; must not be {@code null}
   * @param path location of the node to replace; the root path replaces the whole tree
   * @param value replacement node; must not be {@code null}
   * @return new tree, or {@code tree} itself when the path does not resolve
   */
  public static Content replaceAt(Content tree, ContentPath path, Content value) {
    Objects.requireNonNull(tree, "tree");
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(value, "value");
    return replace(tree, path.elements(), 0, value);
  }

  private static Content replace(Content node, List<PathElement> path, int depth, Content value) {
    if (depth == path.size()) {
      return value;
    }
    if (node instanceof Content.EnumValue e && !e.isUnit()) {
      Content payload = replace(e.payload(), path, depth, value);
      return payload == e.payload() ? node : new Content.EnumValue(e.typeName(), e.variant(), payload);
    }
    PathElement element = path.get(depth);
    if (node instanceof Content.SeqValue seq && element instanceof PathElement.Index idx) {
      if (idx.index() >= seq.items().size()) {
        return node;
      }
      Content original = seq.items().get(idx.index());
      Content updated = replace(original, path, depth + 1, value);
      if (updated == original) {
        return node;
      }
      List<Content> items = new ArrayList<>(seq.items());
      items.set(idx.index(), updated);
      return new Content.SeqValue(items);
    }
    if (node instanceof Content.MapValue map && element instanceof PathElement.Key key) {
      List<Content.Entry> entries = new ArrayList<>(map.entries());
      boolean changed = false;
      for (int i = 0; i < entries.size(); i++) {
        Content.Entry entry = entries.get(i);
        if (entry.key().equals(key.key())) {
          Content updated = replace(entry.value(), path, depth + 1, value);
          if (updated != entry.value()) {
            entries.set(i, new Content.Entry(entry.key(), updated));
            changed = true;
          }
        }
      }
      return changed ? new Content.MapValue(entries) : node;
    }
    if (node instanceof Content.StructValue struct && element instanceof PathElement.Field field) {
      List<Content.Field> fields = new ArrayList<>(struct.fields());
      boolean changed = false;
      for (int i = 0; i < fields.size(); i++) {
        Content.Field f = fields.get(i);
        if (f.name().equals(field.name())) {
          Content updated = replace(f.value(), path, depth + 1, value);
          if (updated != f.value()) {
            fields.set(i, new Content.Field(f.name(), updated));
            changed = true;
          }
        }
      }
      return changed ? new Content.StructValue(struct.name(), fields) : node;
    }
    return node;
  }

  private static Content unwrapEnum(Content node) {
    Content current = node;
    while (current instanceof Content.EnumValue e && !e.isUnit()) {
      current = e.payload();
    }
    return current;
  }

  private static Content child(Content node, PathElement element) {
    if (node instanceof Content.SeqValue seq && element instanceof PathElement.Index idx) {
      return idx.index() < seq.items().size() ? seq.items().get(idx.index()) : null;
    }
    if (node instanceof Content.MapValue map && element instanceof PathElement.Key key) {
      for (Content.Entry entry : map.entries()) {
        if (entry.key().equals(key.key())) {
          return entry.value();
        }
      }
      return null;
    }
    if (node instanceof Content.StructValue struct && element instanceof PathElement.Field field) {
      for (Content.Field f : struct.fields()) {
        if (f.name().equals(field.name())) {
          return f.value();
        }
      }
    }
    return null;
  }
}
