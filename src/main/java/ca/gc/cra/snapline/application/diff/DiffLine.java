package ca.gc.cra.snapline.application.diff;

import java.util.Objects;

/**
 * One line of an edit script.
 *
 * @param op edit operation
 * @param oldLine 1-based line number in the old text, or 0 for insertions
 * @param newLine 1-based line number in the new text, or 0 for deletions
 * @param text line content without terminator
 * @since 0.1.0
 */
public record DiffLine(Op op, int oldLine, int newLine, String text) {

  /** Edit operation for a single line. */
  public enum Op {
    EQUAL(' '),
    DELETE('-'),
    INSERT('+');

    private final char marker;

    Op(char marker) {
      this.marker = marker;
    }

    public char marker() {
      return marker;
    }
  }

  public DiffLine {
    Objects.requireNonNull(op, "op");
    Objects.requireNonNull(text, "text");
  }
}
