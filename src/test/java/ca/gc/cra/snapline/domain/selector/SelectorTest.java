package ca.gc.cra.snapline.domain.selector;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.snapline.domain.content.Content;
import ca.gc.cra.snapline.domain.content.ContentPath;
import ca.gc.cra.snapline.domain.content.PathElement;
import org.junit.jupiter.api.Test;

class SelectorTest {

  private static ContentPath fields(String... names) {
    ContentPath path = ContentPath.root();
    for (String name : names) {
      path = path.child(new PathElement.Field(name));
    }
    return path;
  }

  @Test
  void exactPathMatchesOnlyThatNode() {
    Selector selector = Selector.parse(".user.password");

    assertTrue(selector.matches(fields("user", "password")));
    assertFalse(selector.matches(fields("user")));
    assertFalse(selector.matches(fields("user", "password", "hash")));
  }

  @Test
  void keySegmentMatchesStringMapKeysAndIndexMatchesIntegerKeys() {
    ContentPath stringKey = ContentPath.of(new PathElement.Key(Content.of("token")));
    ContentPath intKey = ContentPath.of(new PathElement.Key(Content.of(3)));

    assertTrue(Selector.parse(".token").matches(stringKey));
    assertTrue(Selector.parse(".3").matches(intKey));
    assertFalse(Selector.parse(".3").matches(stringKey));
  }

  @Test
  void wildcardConsumesExactlyOneStep() {
    Selector selector = Selector.parse(".items.*.id");

    assertTrue(selector.matches(ContentPath.of(new PathElement.Field("items"), new PathElement.Index(4),
        new PathElement.Field("id"))));
    assertFalse(selector.matches(fields("items", "id")));
  }

  @Test
  void deepWildcardMatchesAnyDepthIncludingZero() {
    Selector selector = Selector.parse(".**.id");

    assertTrue(selector.matches(fields("id")));
    assertTrue(selector.matches(fields("a", "b", "c", "id")));
    assertFalse(selector.matches(fields("a", "idx")));
  }

  @Test
  void trailingDeepWildcardMatchesSubtreeRoot() {
    Selector selector = Selector.parse(".meta.**");

    assertTrue(selector.matches(fields("meta")));
    assertTrue(selector.matches(fields("meta", "x", "y")));
    assertFalse(selector.matches(fields("other")));
  }

  @Test
  void ofRequiresSegments() {
    assertThrows(IllegalArgumentException.class, () -> Selector.of());
  }
}
