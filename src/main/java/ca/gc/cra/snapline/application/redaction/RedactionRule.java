package ca.gc.cra.snapline.application.redaction;

import ca.gc.cra.snapline.domain.content.Content;
import ca.gc.cra.snapline.domain.selector.Selector;
import java.util.Objects;

/**
 * Pairs a selector with the primitive value that replaces every node it matches.
 *
 * @param selector compiled selector
 * @param replacement bool, integer, float or string content
 * @since 0.1.0
 */
public record RedactionRule(Selector selector, Content replacement) {

  /**
   * Validates the rule.
   *
   * @throws IllegalArgumentException when the replacement is not a primitive
   */
  public RedactionRule {
    Objects.requireNonNull(selector, "selector");
    Objects.requireNonNull(replacement, "replacement");
    if (!replacement.isPrimitive()) {
      throw new IllegalArgumentException(
          "redaction replacement must be a bool, integer, float or string, got " + replacement.kind());
    }
  }

  /**
   * Parses {@code selector} and converts {@code replacement} into a rule.
   *
   * @param selector selector expression, e.g. {@code ".user.password"}
   * @param replacement {@link String}, {@link Boolean}, integral {@link Number}, floating {@link Number} or a
   *     primitive {@link Content}
   * @return compiled rule
   * @throws ca.gc.cra.snapline.domain.selector.SelectorParseException when the selector is malformed
   * @throws IllegalArgumentException when the replacement is not a primitive value
   */
  public static RedactionRule of(String selector, Object replacement) {
    return new RedactionRule(Selector.parse(selector), toContent(replacement));
  }

  private static Content toContent(Object replacement) {
    if (replacement instanceof Content content) {
      return content;
    }
    if (replacement instanceof String s) {
      return Content.of(s);
    }
    if (replacement instanceof Boolean b) {
      return Content.of(b.booleanValue());
    }
    if (replacement instanceof Double || replacement instanceof Float) {
      return Content.of(((Number) replacement).doubleValue());
    }
    if (replacement instanceof Long || replacement instanceof Integer
        || replacement instanceof Short || replacement instanceof Byte) {
      return Content.of(((Number) replacement).longValue());
    }
    if (replacement instanceof Character c) {
      return Content.of(String.valueOf(c));
    }
    throw new IllegalArgumentException("unsupported redaction replacement: "
        + (replacement == null ? "null" : replacement.getClass().getName()));
  }
}
