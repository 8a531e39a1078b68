package ca.gc.cra.snapline.application.format;

/**
 * Raised when a value cannot be represented as content or in the requested format.
 *
 * @since 0.1.0
 */
public class SerializationException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public SerializationException(String reason) {
    super(reason);
  }

  public SerializationException(String reason, Throwable cause) {
    super(reason, cause);
  }
}
