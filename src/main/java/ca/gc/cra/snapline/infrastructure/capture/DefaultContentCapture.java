package ca.gc.cra.snapline.infrastructure.capture;

import ca.gc.cra.snapline.application.format.SerializationException;
import ca.gc.cra.snapline.application.port.ContentCapture;
import ca.gc.cra.snapline.domain.content.Capturable;
import ca.gc.cra.snapline.domain.content.Content;
import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * <strong>What:</strong> Captures JDK value types, {@link Capturable} objects and registered types as
 * {@link Content}.
 * <p><strong>Why:</strong> Snapshot output must not depend on hash iteration order or on reflective field
 * discovery, so every supported shape maps to content explicitly.</p>
 * <p><strong>Role:</strong> Default adapter behind the {@link ContentCapture} port.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Map scalars, strings, byte arrays, arrays, collections, maps, optionals and enums.</li>
 *   <li>Sort unordered sets and maps by natural order so captures are deterministic.</li>
 *   <li>Reject unsupported types and reference cycles with {@link SerializationException}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable after {@link Builder#build()}; each capture call uses its own
 * cycle-tracking state.</p>
 *
 * @since 0.1.0
 */
public final class DefaultContentCapture implements ContentCapture {
  @SuppressWarnings({"unchecked", "rawtypes"})
  private static final Comparator<Comparable> NATURAL_NULLS_FIRST =
      (a, b) -> a == null ? (b == null ? 0 : -1) : (b == null ? 1 : a.compareTo(b));

  private final Map<Class<?>, Function<Object, ?>> adapters;

  private DefaultContentCapture(Map<Class<?>, Function<Object, ?>> adapters) {
    this.adapters = Collections.unmodifiableMap(new LinkedHashMap<>(adapters));
  }

  /**
   * Returns a capture with no custom adapters.
   *
   * @return default capture
   */
  public static DefaultContentCapture create() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public Content capture(Object value) {
    return capture(value, Collections.newSetFromMap(new IdentityHashMap<>()));
  }

  private Content capture(Object value, Set<Object> inProgress) {
    if (value == null) {
      return Content.nil();
    }
    if (value instanceof Content content) {
      return content;
    }
    Function<Object, ?> adapter = adapterFor(value.getClass());
    if (adapter != null) {
      return nested(value, inProgress, () -> capture(adapter.apply(value), inProgress));
    }
    if (value instanceof Capturable capturable) {
      Content content = capturable.toContent();
      if (content == null) {
        throw new SerializationException(value.getClass().getName() + ".toContent() returned null");
      }
      return content;
    }
    if (value instanceof Optional<?> optional) {
      return optional.isPresent() ? capture(optional.get(), inProgress) : Content.nil();
    }
    if (value instanceof Boolean b) {
      return Content.of(b.booleanValue());
    }
    if (value instanceof Byte || value instanceof Short || value instanceof Integer || value instanceof Long) {
      return Content.of(((Number) value).longValue());
    }
    if (value instanceof BigInteger big) {
      if (big.bitLength() > 63) {
        throw new SerializationException("Integer " + big + " does not fit in 64 bits");
      }
      return Content.of(big.longValue());
    }
    if (value instanceof BigDecimal decimal) {
      return Content.of(exactDouble(decimal));
    }
    if (value instanceof Float || value instanceof Double) {
      return Content.of(((Number) value).doubleValue());
    }
    if (value instanceof CharSequence || value instanceof Character) {
      return Content.of(value.toString());
    }
    if (value instanceof Enum<?> constant) {
      return Content.unitVariant(constant.getDeclaringClass().getSimpleName(), constant.name());
    }
    if (value instanceof byte[] bytes) {
      return Content.bytes(bytes);
    }
    if (value.getClass().isArray()) {
      return nested(value, inProgress, () -> captureArray(value, inProgress));
    }
    if (value instanceof Map<?, ?> map) {
      return nested(value, inProgress, () -> captureMap(map, inProgress));
    }
    if (value instanceof Collection<?> collection) {
      return nested(value, inProgress, () -> captureCollection(collection, inProgress));
    }
    throw new SerializationException("Cannot capture value of type " + value.getClass().getName()
        + "; implement Capturable or register an adapter");
  }

  // Only decimals whose shortest double rendering reads back as the same number are accepted.
  private static double exactDouble(BigDecimal decimal) {
    double d = decimal.doubleValue();
    if (Double.isInfinite(d) || BigDecimal.valueOf(d).compareTo(decimal) != 0) {
      throw new SerializationException("Decimal " + decimal.toPlainString() + " cannot be represented as a double");
    }
    return d;
  }

  private Content nested(Object container, Set<Object> inProgress, Supplier<Content> body) {
    if (!inProgress.add(container)) {
      throw new SerializationException("Reference cycle through " + container.getClass().getName());
    }
    try {
      return body.get();
    } finally {
      inProgress.remove(container);
    }
  }

  private Content captureArray(Object array, Set<Object> inProgress) {
    int length = Array.getLength(array);
    List<Content> items = new ArrayList<>(length);
    for (int i = 0; i < length; i++) {
      items.add(capture(Array.get(array, i), inProgress));
    }
    return Content.seq(items);
  }

  private Content captureCollection(Collection<?> collection, Set<Object> inProgress) {
    Collection<?> ordered = collection;
    if (collection instanceof Set<?> set && !isOrdered(set)) {
      ordered = sorted(new ArrayList<>(set), "set element");
    }
    List<Content> items = new ArrayList<>(ordered.size());
    for (Object item : ordered) {
      items.add(capture(item, inProgress));
    }
    return Content.seq(items);
  }

  private Content captureMap(Map<?, ?> map, Set<Object> inProgress) {
    List<?> keys = new ArrayList<>(map.keySet());
    if (!isOrdered(map)) {
      keys = sorted(keys, "map key");
    }
    Content.MapBuilder builder = Content.map();
    for (Object key : keys) {
      builder.put(capture(key, inProgress), capture(map.get(key), inProgress));
    }
    return builder.build();
  }

  private static boolean isOrdered(Set<?> set) {
    return set instanceof SortedSet<?> || set instanceof LinkedHashSet<?> || set instanceof EnumSet<?>;
  }

  private static boolean isOrdered(Map<?, ?> map) {
    return map instanceof SortedMap<?, ?> || map instanceof LinkedHashMap<?, ?> || map instanceof EnumMap<?, ?>;
  }

  @SuppressWarnings({"unchecked", "rawtypes"})
  private static List<?> sorted(List<?> values, String what) {
    for (Object value : values) {
      if (value != null && !(value instanceof Comparable)) {
        throw new SerializationException("Unordered " + what + " of type " + value.getClass().getName()
            + " is not Comparable; use an ordered collection");
      }
    }
    List<Comparable> copy = new ArrayList<>((List<Comparable>) values);
    try {
      copy.sort(NATURAL_NULLS_FIRST);
    } catch (ClassCastException ex) {
      throw new SerializationException("Unordered " + what + "s of mixed types cannot be sorted", ex);
    }
    return copy;
  }

  private Function<Object, ?> adapterFor(Class<?> type) {
    Function<Object, ?> exact = adapters.get(type);
    if (exact != null) {
      return exact;
    }
    for (Map.Entry<Class<?>, Function<Object, ?>> entry : adapters.entrySet()) {
      if (entry.getKey().isAssignableFrom(type)) {
        return entry.getValue();
      }
    }
    return null;
  }

  /** Registers per-type adapters; the first registration assignable from a value's class wins. */
  public static final class Builder {
    private final Map<Class<?>, Function<Object, ?>> adapters = new LinkedHashMap<>();

    private Builder() {}

    /**
     * Maps values of {@code type} to another capturable value (typically a {@link Content} or a map).
     *
     * @param type adapted type; subclasses match too
     * @param adapter conversion applied before capture; its result is captured recursively
     * @param <T> adapted type
     * @return this builder
     */
    public <T> Builder adapter(Class<T> type, Function<? super T, ?> adapter) {
      Objects.requireNonNull(type, "type");
      Objects.requireNonNull(adapter, "adapter");
      adapters.put(type, value -> adapter.apply(type.cast(value)));
      return this;
    }

    public DefaultContentCapture build() {
      return new DefaultContentCapture(adapters);
    }
  }
}
