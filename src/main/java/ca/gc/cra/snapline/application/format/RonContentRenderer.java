package ca.gc.cra.snapline.application.format;

import ca.gc.cra.snapline.domain.content.Content;
import java.util.Objects;

/**
 * Renders content as RON-style typed text.
 *
 * <p>Unlike JSON and YAML this format keeps type identity: structs print as {@code Name(field: value)} and enum
 * variants print their tag ({@code Active} or {@code Suspended("reason")}). Containers span multiple lines with
 * two-space indentation and trailing commas so that adding an element changes exactly one line.</p>
 *
 * @since 0.1.0
 */
public final class RonContentRenderer implements ContentRenderer {
  private static final String INDENT = "  ";

  @Override
  public SnapshotFormat format() {
    return SnapshotFormat.RON;
  }

  @Override
  public String render(Content tree) {
    Objects.requireNonNull(tree, "tree");
    StringBuilder out = new StringBuilder();
    write(out, tree, 0);
    return out.toString();
  }

  private void write(StringBuilder out, Content node, int depth) {
    if (node instanceof Content.NilValue) {
      out.append("None");
    } else if (node instanceof Content.BoolValue b) {
      out.append(b.value());
    } else if (node instanceof Content.IntValue i) {
      out.append(i.value());
    } else if (node instanceof Content.FloatValue f) {
      out.append(formatFloat(f.value()));
    } else if (node instanceof Content.StringValue s) {
      appendQuoted(out, s.value());
    } else if (node instanceof Content.BytesValue bytes) {
      writeBytes(out, bytes, depth);
    } else if (node instanceof Content.SeqValue seq) {
      if (seq.items().isEmpty()) {
        out.append("[]");
        return;
      }
      out.append("[\n");
      for (Content item : seq.items()) {
        indent(out, depth + 1);
        write(out, item, depth + 1);
        out.append(",\n");
      }
      indent(out, depth);
      out.append(']');
    } else if (node instanceof Content.MapValue map) {
      if (map.entries().isEmpty()) {
        out.append("{}");
        return;
      }
      out.append("{\n");
      for (Content.Entry entry : map.entries()) {
        indent(out, depth + 1);
        write(out, entry.key(), depth + 1);
        out.append(": ");
        write(out, entry.value(), depth + 1);
        out.append(",\n");
      }
      indent(out, depth);
      out.append('}');
    } else if (node instanceof Content.StructValue struct) {
      out.append(struct.name());
      if (struct.fields().isEmpty()) {
        out.append("()");
        return;
      }
      out.append("(\n");
      for (Content.Field field : struct.fields()) {
        indent(out, depth + 1);
        out.append(field.name()).append(": ");
        write(out, field.value(), depth + 1);
        out.append(",\n");
      }
      indent(out, depth);
      out.append(')');
    } else if (node instanceof Content.EnumValue e) {
      out.append(e.variant());
      if (!e.isUnit()) {
        out.append('(');
        write(out, e.payload(), depth);
        out.append(')');
      }
    }
  }

  private void writeBytes(StringBuilder out, Content.BytesValue bytes, int depth) {
    if (bytes.length() == 0) {
      out.append("[]");
      return;
    }
    out.append("[\n");
    for (int i = 0; i < bytes.length(); i++) {
      indent(out, depth + 1);
      out.append(bytes.byteAt(i) & 0xff).append(",\n");
    }
    indent(out, depth);
    out.append(']');
  }

  static String formatFloat(double value) {
    if (Double.isNaN(value)) {
      return "NaN";
    }
    if (Double.isInfinite(value)) {
      return value > 0 ? "inf" : "-inf";
    }
    // Double.toString always carries a '.' or an exponent, so floats never read back as integers
    return Double.toString(value);
  }

  static void appendQuoted(StringBuilder out, String value) {
    out.append('"');
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '"' -> out.append("\\\"");
        case '\\' -> out.append("\\\\");
        case '\n' -> out.append("\\n");
        case '\r' -> out.append("\\r");
        case '\t' -> out.append("\\t");
        case '\0' -> out.append("\\0");
        default -> {
          if (Character.isISOControl(c)) {
            out.append("\\u{").append(Integer.toHexString(c)).append('}');
          } else {
            out.append(c);
          }
        }
      }
    }
    out.append('"');
  }

  private static void indent(StringBuilder out, int depth) {
    for (int i = 0; i < depth; i++) {
      out.append(INDENT);
    }
  }
}
