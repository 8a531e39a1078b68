package ca.gc.cra.snapline.application.format;

import ca.gc.cra.snapline.domain.content.Content;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import java.io.IOException;
import java.io.StringWriter;
import java.util.Objects;

/**
 * Renders content as pretty-printed JSON using Jackson's streaming generator.
 *
 * <p>Structs become objects, unit enum variants become strings, enum variants with a payload become
 * {@code {"Variant": payload}} and bytes become arrays of unsigned numbers. Map keys must be scalars or unit
 * variants. Non-finite floats are written as strings.</p>
 *
 * @since 0.1.0
 */
public final class JsonContentRenderer implements ContentRenderer {
  private final JsonFactory factory = new JsonFactory();

  @Override
  public SnapshotFormat format() {
    return SnapshotFormat.JSON;
  }

  @Override
  public String render(Content tree) {
    Objects.requireNonNull(tree, "tree");
    StringWriter out = new StringWriter();
    try (JsonGenerator gen = factory.createGenerator(out)) {
      gen.setPrettyPrinter(new SnapshotPrettyPrinter());
      write(gen, tree);
    } catch (IOException ex) {
      throw new SerializationException("Failed to render JSON snapshot: " + ex.getMessage(), ex);
    }
    return out.toString();
  }

  private void write(JsonGenerator gen, Content node) throws IOException {
    if (node instanceof Content.NilValue) {
      gen.writeNull();
    } else if (node instanceof Content.BoolValue b) {
      gen.writeBoolean(b.value());
    } else if (node instanceof Content.IntValue i) {
      gen.writeNumber(i.value());
    } else if (node instanceof Content.FloatValue f) {
      if (Double.isFinite(f.value())) {
        gen.writeNumber(f.value());
      } else {
        gen.writeString(Double.toString(f.value()));
      }
    } else if (node instanceof Content.StringValue s) {
      gen.writeString(s.value());
    } else if (node instanceof Content.BytesValue bytes) {
      gen.writeStartArray();
      for (int i = 0; i < bytes.length(); i++) {
        gen.writeNumber(bytes.byteAt(i) & 0xff);
      }
      gen.writeEndArray();
    } else if (node instanceof Content.SeqValue seq) {
      gen.writeStartArray();
      for (Content item : seq.items()) {
        write(gen, item);
      }
      gen.writeEndArray();
    } else if (node instanceof Content.MapValue map) {
      gen.writeStartObject();
      for (Content.Entry entry : map.entries()) {
        gen.writeFieldName(keyText(entry.key()));
        write(gen, entry.value());
      }
      gen.writeEndObject();
    } else if (node instanceof Content.StructValue struct) {
      gen.writeStartObject();
      for (Content.Field field : struct.fields()) {
        gen.writeFieldName(field.name());
        write(gen, field.value());
      }
      gen.writeEndObject();
    } else if (node instanceof Content.EnumValue e) {
      if (e.isUnit()) {
        gen.writeString(e.variant());
      } else {
        gen.writeStartObject();
        gen.writeFieldName(e.variant());
        write(gen, e.payload());
        gen.writeEndObject();
      }
    }
  }

  private static String keyText(Content key) {
    if (key instanceof Content.StringValue s) {
      return s.value();
    }
    if (key instanceof Content.IntValue i) {
      return Long.toString(i.value());
    }
    if (key instanceof Content.BoolValue b) {
      return Boolean.toString(b.value());
    }
    if (key instanceof Content.FloatValue f) {
      return Double.toString(f.value());
    }
    if (key instanceof Content.EnumValue e && e.isUnit()) {
      return e.variant();
    }
    throw new SerializationException("JSON object keys must be scalars, got " + key.kind());
  }

  /** Two-space indentation, {@code "key": value} spacing and {@code []}/{@code {}} for empty containers. */
  static final class SnapshotPrettyPrinter extends DefaultPrettyPrinter {
    private static final long serialVersionUID = 1L;

    SnapshotPrettyPrinter() {
      DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
      indentObjectsWith(indenter);
      indentArraysWith(indenter);
    }

    private SnapshotPrettyPrinter(SnapshotPrettyPrinter base) {
      super(base);
    }

    @Override
    public DefaultPrettyPrinter createInstance() {
      return new SnapshotPrettyPrinter(this);
    }

    @Override
    public void writeObjectFieldValueSeparator(JsonGenerator g) throws IOException {
      g.writeRaw(": ");
    }

    @Override
    public void writeEndObject(JsonGenerator g, int nrOfEntries) throws IOException {
      if (!_objectIndenter.isInline()) {
        --_nesting;
      }
      if (nrOfEntries > 0) {
        _objectIndenter.writeIndentation(g, _nesting);
      }
      g.writeRaw('}');
    }

    @Override
    public void writeEndArray(JsonGenerator g, int nrOfValues) throws IOException {
      if (!_arrayIndenter.isInline()) {
        --_nesting;
      }
      if (nrOfValues > 0) {
        _arrayIndenter.writeIndentation(g, _nesting);
      }
      g.writeRaw(']');
    }
  }
}
