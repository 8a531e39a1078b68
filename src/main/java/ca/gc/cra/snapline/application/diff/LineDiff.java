package ca.gc.cra.snapline.application.diff;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.IntPredicate;

/**
 * Line-based diff between an accepted snapshot and a fresh rendering.
 *
 * <p>The edit script comes from a longest common subsequence over the lines that remain after trimming the
 * common prefix and suffix. Lines present on one side only are dropped before the linear-space (Hirschberg)
 * alignment, so memory stays proportional to the input. {@link #toUnified()} prints the script as a unified diff
 * with three lines of context.</p>
 *
 * @since 0.1.0
 */
public final class LineDiff {
  static final int CONTEXT = 3;

  private final List<DiffLine> lines;
  private final int additions;
  private final int deletions;

  private LineDiff(List<DiffLine> lines) {
    this.lines = List.copyOf(lines);
    int add = 0;
    int del = 0;
    for (DiffLine line : lines) {
      if (line.op() == DiffLine.Op.INSERT) {
        add++;
      } else if (line.op() == DiffLine.Op.DELETE) {
        del++;
      }
    }
    this.additions = add;
    this.deletions = del;
  }

  /**
   * Computes the diff from {@code expected} to {@code actual}.
   *
   * @param expected previously accepted text; empty when no baseline exists
   * @param actual freshly rendered text
   * @return edit script
   */
  public static LineDiff between(String expected, String actual) {
    Objects.requireNonNull(expected, "expected");
    Objects.requireNonNull(actual, "actual");
    List<String> a = splitLines(expected);
    List<String> b = splitLines(actual);

    int prefix = 0;
    while (prefix < a.size() && prefix < b.size() && a.get(prefix).equals(b.get(prefix))) {
      prefix++;
    }
    int suffix = 0;
    while (suffix < a.size() - prefix && suffix < b.size() - prefix
        && a.get(a.size() - 1 - suffix).equals(b.get(b.size() - 1 - suffix))) {
      suffix++;
    }

    List<DiffLine> script = new ArrayList<>(a.size() + b.size());
    for (int i = 0; i < prefix; i++) {
      script.add(new DiffLine(DiffLine.Op.EQUAL, i + 1, i + 1, a.get(i)));
    }
    middle(a.subList(prefix, a.size() - suffix), b.subList(prefix, b.size() - suffix), prefix, script);
    for (int k = suffix; k > 0; k--) {
      int ai = a.size() - k;
      int bi = b.size() - k;
      script.add(new DiffLine(DiffLine.Op.EQUAL, ai + 1, bi + 1, a.get(ai)));
    }
    return new LineDiff(script);
  }

  private static void middle(List<String> a, List<String> b, int offset, List<DiffLine> script) {
    int n = a.size();
    int m = b.size();
    int[] matchOf = match(a, b);
    int i = 0;
    int j = 0;
    while (i < n || j < m) {
      if (i < n && matchOf[i] < 0) {
        script.add(new DiffLine(DiffLine.Op.DELETE, offset + i + 1, 0, a.get(i)));
        i++;
      } else if (j < m && (i == n || j < matchOf[i])) {
        script.add(new DiffLine(DiffLine.Op.INSERT, 0, offset + j + 1, b.get(j)));
        j++;
      } else {
        script.add(new DiffLine(DiffLine.Op.EQUAL, offset + i + 1, offset + j + 1, a.get(i)));
        i++;
        j++;
      }
    }
  }

  // matchOf[i] is the index in b paired with a[i] by the LCS, or -1.
  private static int[] match(List<String> a, List<String> b) {
    Map<String, Integer> ids = new HashMap<>();
    int[] idsA = new int[a.size()];
    int[] idsB = new int[b.size()];
    for (int i = 0; i < idsA.length; i++) {
      idsA[i] = ids.computeIfAbsent(a.get(i), key -> ids.size());
    }
    int sharedBound = ids.size();
    boolean[] inB = new boolean[sharedBound];
    for (int j = 0; j < idsB.length; j++) {
      idsB[j] = ids.computeIfAbsent(b.get(j), key -> ids.size());
      if (idsB[j] < sharedBound) {
        inB[idsB[j]] = true;
      }
    }

    // Lines present on one side only can never be part of the LCS.
    int[] keptA = keep(idsA, id -> inB[id]);
    int[] keptB = keep(idsB, id -> id < sharedBound);
    int[] x = select(idsA, keptA);
    int[] y = select(idsB, keptB);

    int[] matchOf = new int[a.size()];
    Arrays.fill(matchOf, -1);
    int[] coreMatch = new int[x.length];
    Arrays.fill(coreMatch, -1);
    align(x, 0, x.length, y, 0, y.length, coreMatch);
    for (int k = 0; k < coreMatch.length; k++) {
      if (coreMatch[k] >= 0) {
        matchOf[keptA[k]] = keptB[coreMatch[k]];
      }
    }
    return matchOf;
  }

  private static int[] keep(int[] ids, IntPredicate shared) {
    int[] kept = new int[ids.length];
    int count = 0;
    for (int i = 0; i < ids.length; i++) {
      if (shared.test(ids[i])) {
        kept[count++] = i;
      }
    }
    return Arrays.copyOf(kept, count);
  }

  private static int[] select(int[] ids, int[] positions) {
    int[] out = new int[positions.length];
    for (int k = 0; k < positions.length; k++) {
      out[k] = ids[positions[k]];
    }
    return out;
  }

  // Hirschberg: LCS alignment of x[xlo..xhi) and y[ylo..yhi) in linear space.
  private static void align(int[] x, int xlo, int xhi, int[] y, int ylo, int yhi, int[] matchOf) {
    while (xlo < xhi && ylo < yhi && x[xlo] == y[ylo]) {
      matchOf[xlo++] = ylo++;
    }
    while (xlo < xhi && ylo < yhi && x[xhi - 1] == y[yhi - 1]) {
      matchOf[--xhi] = --yhi;
    }
    if (xlo == xhi || ylo == yhi) {
      return;
    }
    if (xhi - xlo == 1) {
      for (int j = ylo; j < yhi; j++) {
        if (x[xlo] == y[j]) {
          matchOf[xlo] = j;
          return;
        }
      }
      return;
    }
    int mid = (xlo + xhi) >>> 1;
    int[] forward = forwardRow(x, xlo, mid, y, ylo, yhi);
    int[] backward = backwardRow(x, mid, xhi, y, ylo, yhi);
    int split = 0;
    int best = -1;
    for (int k = 0; k <= yhi - ylo; k++) {
      int score = forward[k] + backward[k];
      if (score > best) {
        best = score;
        split = k;
      }
    }
    align(x, xlo, mid, y, ylo, ylo + split, matchOf);
    align(x, mid, xhi, y, ylo + split, yhi, matchOf);
  }

  // row[k] = LCS length of x[xlo..xhi) and y[ylo..ylo+k)
  private static int[] forwardRow(int[] x, int xlo, int xhi, int[] y, int ylo, int yhi) {
    int len = yhi - ylo;
    int[] prev = new int[len + 1];
    int[] cur = new int[len + 1];
    for (int i = xlo; i < xhi; i++) {
      cur[0] = 0;
      for (int k = 1; k <= len; k++) {
        cur[k] = x[i] == y[ylo + k - 1] ? prev[k - 1] + 1 : Math.max(prev[k], cur[k - 1]);
      }
      int[] swap = prev;
      prev = cur;
      cur = swap;
    }
    return prev;
  }

  // row[k] = LCS length of x[xlo..xhi) and y[ylo+k..yhi)
  private static int[] backwardRow(int[] x, int xlo, int xhi, int[] y, int ylo, int yhi) {
    int len = yhi - ylo;
    int[] prev = new int[len + 1];
    int[] cur = new int[len + 1];
    for (int i = xhi - 1; i >= xlo; i--) {
      cur[len] = 0;
      for (int k = len - 1; k >= 0; k--) {
        cur[k] = x[i] == y[ylo + k] ? prev[k + 1] + 1 : Math.max(prev[k], cur[k + 1]);
      }
      int[] swap = prev;
      prev = cur;
      cur = swap;
    }
    return prev;
  }

  static List<String> splitLines(String text) {
    if (text.isEmpty()) {
      return List.of();
    }
    return List.of(text.split("\n", -1));
  }

  public List<DiffLine> lines() {
    return lines;
  }

  public int additions() {
    return additions;
  }

  public int deletions() {
    return deletions;
  }

  public boolean hasChanges() {
    return additions > 0 || deletions > 0;
  }

  /**
   * Renders the edit script as a unified diff.
   *
   * @return diff text; only the header when there are no changes
   */
  public String toUnified() {
    StringBuilder out = new StringBuilder();
    out.append("--- old snapshot\n");
    out.append("+++ new results\n");
    int index = 0;
    while (index < lines.size()) {
      int firstChange = nextChange(index);
      if (firstChange < 0) {
        break;
      }
      int start = Math.max(index, firstChange - CONTEXT);
      int end = hunkEnd(firstChange);
      appendHunk(out, start, end);
      index = end;
    }
    return out.toString();
  }

  private int nextChange(int from) {
    for (int i = from; i < lines.size(); i++) {
      if (lines.get(i).op() != DiffLine.Op.EQUAL) {
        return i;
      }
    }
    return -1;
  }

  // Exclusive end of the hunk starting at firstChange; hunks separated by <= 2*CONTEXT equal lines merge.
  private int hunkEnd(int firstChange) {
    int lastChange = firstChange;
    int i = firstChange + 1;
    while (i < lines.size()) {
      if (lines.get(i).op() != DiffLine.Op.EQUAL) {
        lastChange = i;
      } else if (i - lastChange > 2 * CONTEXT) {
        break;
      }
      i++;
    }
    return Math.min(lines.size(), lastChange + CONTEXT + 1);
  }

  private void appendHunk(StringBuilder out, int start, int end) {
    int oldStart = 0;
    int newStart = 0;
    int oldCount = 0;
    int newCount = 0;
    for (int i = start; i < end; i++) {
      DiffLine line = lines.get(i);
      if (line.op() != DiffLine.Op.INSERT) {
        if (oldCount == 0) {
          oldStart = line.oldLine();
        }
        oldCount++;
      }
      if (line.op() != DiffLine.Op.DELETE) {
        if (newCount == 0) {
          newStart = line.newLine();
        }
        newCount++;
      }
    }
    if (oldCount == 0) {
      oldStart = precedingOldLine(start);
    }
    if (newCount == 0) {
      newStart = precedingNewLine(start);
    }
    out.append("@@ -").append(oldStart).append(',').append(oldCount)
        .append(" +").append(newStart).append(',').append(newCount).append(" @@\n");
    for (int i = start; i < end; i++) {
      DiffLine line = lines.get(i);
      out.append(line.op().marker()).append(line.text()).append('\n');
    }
  }

  private int precedingOldLine(int index) {
    for (int i = index - 1; i >= 0; i--) {
      if (lines.get(i).oldLine() > 0) {
        return lines.get(i).oldLine();
      }
    }
    return 0;
  }

  private int precedingNewLine(int index) {
    for (int i = index - 1; i >= 0; i--) {
      if (lines.get(i).newLine() > 0) {
        return lines.get(i).newLine();
      }
    }
    return 0;
  }
}
