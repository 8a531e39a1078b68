package ca.gc.cra.snapline.domain.selector;

/**
 * Raised when a selector expression cannot be compiled.
 *
 * @since 0.1.0
 */
public final class SelectorParseException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  private final String expression;
  private final int position;
  private final String reason;

  /**
   * Creates a parse failure.
   *
   * @param expression original selector text
   * @param position zero-based character offset of the failure
   * @param reason short description of what went wrong
   */
  public SelectorParseException(String expression, int position, String reason) {
    super(reason + " at position " + position + " in selector '" + expression + "'");
    this.expression = expression;
    this.position = position;
    this.reason = reason;
  }

  public String expression() {
    return expression;
  }

  public int position() {
    return position;
  }

  public String reason() {
    return reason;
  }
}
