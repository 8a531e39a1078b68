package ca.gc.cra.snapline.domain.content;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Format-agnostic structural representation of a captured value.
 * <p><strong>Why:</strong> Lets redaction and every renderer work on one tree shape regardless of the
 * Java type that produced it.</p>
 * <p><strong>Role:</strong> Domain value model shared by capture, redaction and serialization.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Model scalars, byte strings, sequences, ordered maps, named structs and enum variants.</li>
 *   <li>Preserve insertion order of map entries and struct fields exactly as supplied.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> All variants are immutable and safe to share across threads.</p>
 * <p><strong>Performance:</strong> Containers copy their children once on construction.</p>
 * <p><strong>Observability:</strong> {@link Object#toString()} mirrors the record components for debugging.</p>
 *
 * @implNote Structural equality follows record semantics; two equal trees render identically in every format.
 * @since 0.1.0
 */
public sealed interface Content
    permits Content.NilValue,
        Content.BoolValue,
        Content.IntValue,
        Content.FloatValue,
        Content.StringValue,
        Content.BytesValue,
        Content.SeqValue,
        Content.MapValue,
        Content.StructValue,
        Content.EnumValue {

  /** Shared nil instance. */
  NilValue NIL = new NilValue();

  /**
   * Returns {@code true} for bool, integer, float and string variants.
   *
   * @return whether this node is a primitive scalar usable as a redaction replacement
   */
  default boolean isPrimitive() {
    return this instanceof BoolValue
        || this instanceof IntValue
        || this instanceof FloatValue
        || this instanceof StringValue;
  }

  /**
   * Returns a short variant label used in diagnostics.
   *
   * @return lower-case kind name (e.g., {@code "map"})
   */
  default String kind() {
    if (this instanceof NilValue) {
      return "nil";
    } else if (this instanceof BoolValue) {
      return "bool";
    } else if (this instanceof IntValue) {
      return "integer";
    } else if (this instanceof FloatValue) {
      return "float";
    } else if (this instanceof StringValue) {
      return "string";
    } else if (this instanceof BytesValue) {
      return "bytes";
    } else if (this instanceof SeqValue) {
      return "sequence";
    } else if (this instanceof MapValue) {
      return "map";
    } else if (this instanceof StructValue) {
      return "struct";
    }
    return "enum";
  }

  static Content nil() {
    return NIL;
  }

  static Content of(boolean value) {
    return new BoolValue(value);
  }

  static Content of(long value) {
    return new IntValue(value);
  }

  static Content of(double value) {
    return new FloatValue(value);
  }

  static Content of(String value) {
    return value == null ? NIL : new StringValue(value);
  }

  static Content bytes(byte[] value) {
    return value == null ? NIL : new BytesValue(value);
  }

  static Content seq(Content... items) {
    return new SeqValue(Arrays.asList(items));
  }

  static Content seq(List<? extends Content> items) {
    return new SeqValue(List.copyOf(items));
  }

  /**
   * Starts an insertion-ordered map.
   *
   * @return map builder
   */
  static MapBuilder map() {
    return new MapBuilder();
  }

  /**
   * Starts a struct with an explicit field order.
   *
   * @param name struct type name; may be empty for anonymous structs
   * @return struct builder
   */
  static StructBuilder struct(String name) {
    return new StructBuilder(name);
  }

  /**
   * Creates a unit enum variant.
   *
   * @param typeName enum type name
   * @param variant variant name
   * @return enum node without payload
   */
  static Content unitVariant(String typeName, String variant) {
    return new EnumValue(typeName, variant, null);
  }

  /**
   * Creates an enum variant carrying a payload.
   *
   * @param typeName enum type name
   * @param variant variant name
   * @param payload variant payload; must not be {@code null}
   * @return enum node with payload
   */
  static Content variant(String typeName, String variant, Content payload) {
    return new EnumValue(typeName, variant, Objects.requireNonNull(payload, "payload"));
  }

  /** Absence of a value. */
  record NilValue() implements Content {}

  /** Boolean scalar. */
  record BoolValue(boolean value) implements Content {}

  /** Signed 64-bit integer scalar. */
  record IntValue(long value) implements Content {}

  /** Double precision scalar. */
  record FloatValue(double value) implements Content {}

  /** Text scalar. */
  record StringValue(String value) implements Content {
    public StringValue {
      Objects.requireNonNull(value, "value");
    }
  }

  /**
   * Opaque byte string with value semantics.
   *
   * @param value byte content; copied on construction and on access
   */
  record BytesValue(byte[] value) implements Content {
    public BytesValue {
      value = Objects.requireNonNull(value, "value").clone();
    }

    @Override
    public byte[] value() {
      return value.clone();
    }

    /**
     * Returns the byte at {@code index} without copying the array.
     *
     * @param index zero-based offset
     * @return byte value
     */
    public byte byteAt(int index) {
      return value[index];
    }

    public int length() {
      return value.length;
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof BytesValue that && Arrays.equals(value, that.value);
    }

    @Override
    public int hashCode() {
      return Arrays.hashCode(value);
    }

    @Override
    public String toString() {
      return "BytesValue[value=" + Arrays.toString(value) + "]";
    }
  }

  /** Ordered list of children. */
  record SeqValue(List<Content> items) implements Content {
    public SeqValue {
      items = List.copyOf(items);
    }
  }

  /**
   * Ordered map; entries keep insertion order and are never re-sorted.
   *
   * @param entries key/value pairs in insertion order
   */
  record MapValue(List<Entry> entries) implements Content {
    public MapValue {
      entries = List.copyOf(entries);
    }
  }

  /**
   * Map entry with arbitrary content keys.
   *
   * @param key entry key
   * @param value entry value
   */
  record Entry(Content key, Content value) {
    public Entry {
      Objects.requireNonNull(key, "key");
      Objects.requireNonNull(value, "value");
    }
  }

  /**
   * Named structure with caller-supplied field order.
   *
   * @param name struct type name
   * @param fields fields in declaration order
   */
  record StructValue(String name, List<Field> fields) implements Content {
    public StructValue {
      Objects.requireNonNull(name, "name");
      fields = List.copyOf(fields);
    }
  }

  /**
   * Struct field.
   *
   * @param name field name
   * @param value field value
   */
  record Field(String name, Content value) {
    public Field {
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(value, "value");
    }
  }

  /**
   * Enum variant, optionally carrying a payload.
   *
   * @param typeName enum type name
   * @param variant variant name
   * @param payload payload or {@code null} for unit variants
   */
  record EnumValue(String typeName, String variant, Content payload) implements Content {
    public EnumValue {
      Objects.requireNonNull(typeName, "typeName");
      Objects.requireNonNull(variant, "variant");
    }

    public boolean isUnit() {
      return payload == null;
    }
  }

  /** Builder for {@link MapValue}. */
  final class MapBuilder {
    private final List<Entry> entries = new ArrayList<>();

    private MapBuilder() {}

    public MapBuilder put(String key, Content value) {
      return put(Content.of(key), value);
    }

    public MapBuilder put(String key, String value) {
      return put(Content.of(key), Content.of(value));
    }

    public MapBuilder put(String key, long value) {
      return put(Content.of(key), Content.of(value));
    }

    public MapBuilder put(Content key, Content value) {
      entries.add(new Entry(key, value));
      return this;
    }

    public MapValue build() {
      return new MapValue(entries);
    }
  }

  /** Builder for {@link StructValue}. */
  final class StructBuilder {
    private final String name;
    private final List<Field> fields = new ArrayList<>();

    private StructBuilder(String name) {
      this.name = Objects.requireNonNull(name, "name");
    }

    public StructBuilder field(String fieldName, Content value) {
      fields.add(new Field(fieldName, value));
      return this;
    }

    public StructBuilder field(String fieldName, String value) {
      return field(fieldName, Content.of(value));
    }

    public StructBuilder field(String fieldName, long value) {
      return field(fieldName, Content.of(value));
    }

    public StructBuilder field(String fieldName, boolean value) {
      return field(fieldName, Content.of(value));
    }

    public StructValue build() {
      return new StructValue(name, fields);
    }
  }
}
