package ca.gc.cra.snapline.application.format;

import ca.gc.cra.snapline.domain.content.Content;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

/**
 * Renders content as block-style YAML through SnakeYAML.
 *
 * <p>The tree is first lowered to plain maps, lists and scalars (structs and enums collapse exactly as in the
 * JSON renderer), then dumped in block style. SnakeYAML decides quoting from the scalar grammar, so only values
 * that would otherwise read back differently (e.g. {@code "true"}, {@code "42"}) get quoted.</p>
 *
 * @since 0.1.0
 */
public final class YamlContentRenderer implements ContentRenderer {

  @Override
  public SnapshotFormat format() {
    return SnapshotFormat.YAML;
  }

  @Override
  public String render(Content tree) {
    Objects.requireNonNull(tree, "tree");
    // Yaml instances are not thread-safe
    String text = new Yaml(options()).dump(lower(tree));
    return text.endsWith("\n") ? text.substring(0, text.length() - 1) : text;
  }

  static DumperOptions options() {
    DumperOptions options = new DumperOptions();
    options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
    options.setIndent(2);
    options.setIndicatorIndent(2);
    options.setIndentWithIndicator(true);
    options.setLineBreak(DumperOptions.LineBreak.UNIX);
    options.setWidth(Integer.MAX_VALUE);
    options.setSplitLines(false);
    options.setAllowUnicode(true);
    return options;
  }

  private static Object lower(Content node) {
    if (node instanceof Content.NilValue) {
      return null;
    } else if (node instanceof Content.BoolValue b) {
      return b.value();
    } else if (node instanceof Content.IntValue i) {
      return i.value();
    } else if (node instanceof Content.FloatValue f) {
      return f.value();
    } else if (node instanceof Content.StringValue s) {
      return s.value();
    } else if (node instanceof Content.BytesValue bytes) {
      List<Object> list = new ArrayList<>(bytes.length());
      for (int i = 0; i < bytes.length(); i++) {
        list.add(bytes.byteAt(i) & 0xff);
      }
      return list;
    } else if (node instanceof Content.SeqValue seq) {
      List<Object> list = new ArrayList<>(seq.items().size());
      for (Content item : seq.items()) {
        list.add(lower(item));
      }
      return list;
    } else if (node instanceof Content.MapValue map) {
      Map<Object, Object> out = new LinkedHashMap<>();
      for (Content.Entry entry : map.entries()) {
        Object key = lower(entry.key());
        if (out.containsKey(key)) {
          throw new SerializationException("YAML mappings cannot hold duplicate key " + key);
        }
        out.put(key, lower(entry.value()));
      }
      return out;
    } else if (node instanceof Content.StructValue struct) {
      Map<Object, Object> out = new LinkedHashMap<>();
      for (Content.Field field : struct.fields()) {
        if (out.containsKey(field.name())) {
          throw new SerializationException(
              "Struct " + struct.name() + " declares field " + field.name() + " twice");
        }
        out.put(field.name(), lower(field.value()));
      }
      return out;
    }
    Content.EnumValue e = (Content.EnumValue) node;
    if (e.isUnit()) {
      return e.variant();
    }
    Map<Object, Object> out = new LinkedHashMap<>();
    out.put(e.variant(), lower(e.payload()));
    return out;
  }
}
