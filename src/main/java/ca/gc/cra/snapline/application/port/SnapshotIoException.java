package ca.gc.cra.snapline.application.port;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Filesystem failure while reading or writing a snapshot artifact.
 *
 * @since 0.1.0
 */
public final class SnapshotIoException extends UncheckedIOException {
  private static final long serialVersionUID = 1L;

  private final transient Path path;

  /**
   * Wraps an I/O failure with the path being accessed.
   *
   * @param message short description of the failed operation
   * @param path file being read or written
   * @param cause underlying failure
   */
  public SnapshotIoException(String message, Path path, IOException cause) {
    super(message + ": " + path, Objects.requireNonNull(cause, "cause"));
    this.path = path;
  }

  public Path path() {
    return path;
  }
}
