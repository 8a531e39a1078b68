package ca.gc.cra.snapline.application.diff;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

class LineDiffTest {

  @Test
  void identicalTextHasNoChanges() {
    LineDiff diff = LineDiff.between("a\nb", "a\nb");

    assertFalse(diff.hasChanges());
    assertEquals("--- old snapshot\n+++ new results\n", diff.toUnified());
  }

  @Test
  void singleLineChangeProducesOneHunkWithContext() {
    LineDiff diff = LineDiff.between("a\nb\nc", "a\nB\nc");

    assertEquals(1, diff.additions());
    assertEquals(1, diff.deletions());
    assertEquals("""
        --- old snapshot
        +++ new results
        @@ -1,3 +1,3 @@
         a
        -b
        +B
         c
        """, diff.toUnified());
  }

  @Test
  void missingBaselineShowsEverythingAsAdded() {
    LineDiff diff = LineDiff.between("", "x\ny");

    assertEquals(2, diff.additions());
    assertEquals(0, diff.deletions());
    assertEquals("""
        --- old snapshot
        +++ new results
        @@ -0,0 +1,2 @@
        +x
        +y
        """, diff.toUnified());
  }

  @Test
  void distantChangesProduceSeparateHunks() {
    String expected = "1\n2\n3\n4\n5\n6\n7\n8\n9\n10\n11\n12";
    String actual = "one\n2\n3\n4\n5\n6\n7\n8\n9\n10\n11\ntwelve";

    String unified = LineDiff.between(expected, actual).toUnified();

    assertTrue(unified.contains("@@ -1,4 +1,4 @@\n-1\n+one\n 2\n 3\n 4\n"));
    assertTrue(unified.contains("@@ -9,4 +9,4 @@\n 9\n 10\n 11\n-12\n+twelve\n"));
  }

  @Test
  void editScriptKeepsLineNumbers() {
    List<DiffLine> lines = LineDiff.between("a\nb", "a\nc\nb").lines();

    assertEquals(List.of(
        new DiffLine(DiffLine.Op.EQUAL, 1, 1, "a"),
        new DiffLine(DiffLine.Op.INSERT, 0, 2, "c"),
        new DiffLine(DiffLine.Op.EQUAL, 2, 3, "b")), lines);
  }

  @Test
  void interleavedEditsKeepLongestCommonSubsequence() {
    List<DiffLine.Op> ops = LineDiff.between("a\nb\nc\nd\ne", "b\nx\nd\ne\ny").lines().stream()
        .map(DiffLine::op)
        .collect(Collectors.toList());

    assertEquals(List.of(
        DiffLine.Op.DELETE, DiffLine.Op.EQUAL, DiffLine.Op.DELETE, DiffLine.Op.INSERT,
        DiffLine.Op.EQUAL, DiffLine.Op.EQUAL, DiffLine.Op.INSERT), ops);
  }

  @Test
  void repeatedLinesAlignOnLongestMatch() {
    LineDiff diff = LineDiff.between("p\nq\np\nq\np", "q\np\nq");

    assertEquals(0, diff.additions());
    assertEquals(2, diff.deletions());
  }

  @Test
  void largeRewriteStaysWithinMemory() {
    int size = 40_000;
    String expected = IntStream.range(0, size).mapToObj(i -> "old-" + i).collect(Collectors.joining("\n"));
    String actual = IntStream.range(0, size).mapToObj(i -> "new-" + i).collect(Collectors.joining("\n"));

    LineDiff diff = LineDiff.between(expected, actual);

    assertEquals(size, diff.additions());
    assertEquals(size, diff.deletions());
  }

  @Test
  void largeInputWithSharedLinesAligns() {
    int size = 5_000;
    String expected = IntStream.range(0, size).mapToObj(i -> i % 2 == 0 ? "{" : "old-" + i)
        .collect(Collectors.joining("\n"));
    String actual = IntStream.range(0, size).mapToObj(i -> i % 2 == 0 ? "{" : "new-" + i)
        .collect(Collectors.joining("\n"));

    LineDiff diff = LineDiff.between(expected, actual);

    assertEquals(size / 2, diff.additions());
    assertEquals(size / 2, diff.deletions());
    assertEquals(size + size / 2, diff.lines().size());
  }
}
