package ca.gc.cra.snapline.application.redaction;

import ca.gc.cra.snapline.domain.content.Content;
import ca.gc.cra.snapline.domain.content.ContentPath;
import ca.gc.cra.snapline.domain.content.ContentTrees;
import ca.gc.cra.snapline.domain.content.PathElement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Applies ordered redaction rules to a content tree.
 * <p><strong>Why:</strong> Volatile values (ids, timestamps, secrets) must be replaced before rendering so that
 * baselines stay stable across runs.</p>
 * <p><strong>Role:</strong> Application service invoked by the assertion coordinator between capture and rendering.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Visit every node and find the last declared rule whose selector matches the node path.</li>
 *   <li>Swap matched nodes for the rule replacement through {@link ContentTrees#replaceAt} without descending
 *   into them.</li>
 *   <li>Build a new tree, sharing untouched subtrees with the input.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 * <p><strong>Performance:</strong> O(nodes x rules x selector length).</p>
 * <p><strong>Observability:</strong> Logs at DEBUG how many nodes each call replaced and which rules matched nothing.</p>
 *
 * @since 0.1.0
 */
public final class Redactor {
  private static final Logger log = LoggerFactory.getLogger(Redactor.class);

  /**
   * Returns a redacted copy of {@code tree}.
   *
   * @param tree input tree; never mutated
   * @param rules rules in declaration order; later matches win over earlier ones for the same node
   * @return redacted tree, or {@code tree} itself when nothing matched
   */
  public Content apply(Content tree, List<RedactionRule> rules) {
    Objects.requireNonNull(tree, "tree");
    Objects.requireNonNull(rules, "rules");
    if (rules.isEmpty()) {
      return tree;
    }
    int[] hits = new int[rules.size()];
    List<Match> matches = new ArrayList<>();
    collect(tree, ContentPath.root(), rules, hits, matches);

    Content result = tree;
    for (Match match : matches) {
      result = ContentTrees.replaceAt(result, match.path(), match.replacement());
    }
    if (log.isDebugEnabled()) {
      for (int i = 0; i < hits.length; i++) {
        if (hits[i] == 0) {
          log.debug("Redaction selector {} matched no nodes", rules.get(i).selector());
        }
      }
      log.debug("Redacted {} node(s) using {} rule(s)", matches.size(), rules.size());
    }
    return result;
  }

  private void collect(
      Content node, ContentPath path, List<RedactionRule> rules, int[] hits, List<Match> matches) {
    int winner = -1;
    for (int i = 0; i < rules.size(); i++) {
      if (rules.get(i).selector().matches(path)) {
        winner = i;
      }
    }
    if (winner >= 0) {
      hits[winner]++;
      matches.add(new Match(path, rules.get(winner).replacement()));
      return;
    }
    if (node instanceof Content.SeqValue seq) {
      for (int i = 0; i < seq.items().size(); i++) {
        collect(seq.items().get(i), path.child(new PathElement.Index(i)), rules, hits, matches);
      }
    } else if (node instanceof Content.MapValue map) {
      for (Content.Entry entry : map.entries()) {
        collect(entry.value(), path.child(new PathElement.Key(entry.key())), rules, hits, matches);
      }
    } else if (node instanceof Content.StructValue struct) {
      for (Content.Field field : struct.fields()) {
        collect(field.value(), path.child(new PathElement.Field(field.name())), rules, hits, matches);
      }
    } else if (node instanceof Content.EnumValue e && !e.isUnit()) {
      // payload shares the enum's path
      collect(e.payload(), path, rules, hits, matches);
    }
  }

  private record Match(ContentPath path, Content replacement) {}
}
