package ca.gc.cra.snapline.domain.snapshot;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class SnapshotFileCodecTest {

  @Test
  void formatWritesHeaderBodyAndSingleTrailingNewline() {
    SnapshotFile file = new SnapshotFile(
        new SnapshotMetadata("src/test/java/com/acme/UserTest.java", 42, null, null, "json"),
        "{\n  \"id\": 1\n}\n\n");

    assertEquals("""
        ---
        source: src/test/java/com/acme/UserTest.java
        line: 42
        format: json
        ---
        {
          "id": 1
        }
        """, SnapshotFileCodec.format(file));
  }

  @Test
  void parseReadsHeaderAndBody() {
    SnapshotFile file = SnapshotFileCodec.parse("""
        ---
        source: src/test/java/com/acme/UserTest.java
        line: 42
        expression: user
        ---
        name: Alice
        """);

    assertEquals("src/test/java/com/acme/UserTest.java", file.metadata().source());
    assertEquals(42, file.metadata().line());
    assertEquals("user", file.metadata().expression());
    assertEquals("name: Alice", file.body());
  }

  @Test
  void textWithoutHeaderIsAllBody() {
    SnapshotFile file = SnapshotFileCodec.parse("plain text\nsecond line\n");

    assertEquals(SnapshotMetadata.EMPTY, file.metadata());
    assertEquals("plain text\nsecond line", file.body());
  }

  @Test
  void emptyHeaderRoundTrips() {
    SnapshotFile original = new SnapshotFile(SnapshotMetadata.EMPTY, "body");

    String text = SnapshotFileCodec.format(original);

    assertEquals("---\n---\nbody\n", text);
    assertEquals(original, SnapshotFileCodec.parse(text));
  }

  @Test
  void crlfLineEndingsAreNormalized() {
    SnapshotFile file = SnapshotFileCodec.parse("---\r\nline: 3\r\n---\r\na\r\nb\r\n");

    assertEquals(3, file.metadata().line());
    assertEquals("a\nb", file.body());
    assertTrue(file.contentMatches("a\nb\n"));
  }

  @Test
  void malformedHeaderIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> SnapshotFileCodec.parse("---\nsource: [unclosed\n---\nbody\n"));
  }
}
