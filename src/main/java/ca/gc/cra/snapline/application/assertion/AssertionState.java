package ca.gc.cra.snapline.application.assertion;

/**
 * Lifecycle of a single snapshot assertion. {@link #PASSED}, {@link #FAILED} and {@link #UPDATED} are terminal.
 *
 * @since 0.1.0
 */
public enum AssertionState {
  START,
  RENDERED,
  COMPARED,
  PASSED,
  FAILED,
  UPDATED;

  public boolean isTerminal() {
    return this == PASSED || this == FAILED || this == UPDATED;
  }
}
