package ca.gc.cra.snapline.domain.snapshot;

import ca.gc.cra.snapline.validation.FileNames;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Identifies exactly one snapshot slot.
 *
 * <p>The caller supplies the location details (file, line, module, optional name); the assertion coordinator
 * assigns {@link #sequence()} when the same slot is asserted more than once in one naming scope.</p>
 *
 * @param root logical workspace root that snapshot directories are resolved against
 * @param modulePath dotted module or class path of the asserting code, e.g. {@code com.acme.UserTest}
 * @param sourceFile source file of the assertion, relative to {@code root} or absolute
 * @param line assertion line (1-based), or {@code 0} when unknown
 * @param name explicit snapshot name, or {@code null} to derive one from the line
 * @param sequence disambiguation sequence, starting at 1
 * @since 0.1.0
 */
public record SnapshotIdentity(
    Path root, String modulePath, String sourceFile, int line, String name, int sequence) {

  /** Separates the file stem from the sequence number; stems never contain it. */
  public static final char SEQUENCE_SEPARATOR = '-';

  /**
   * Validates identity invariants.
   *
   * @throws IllegalArgumentException when required parts are blank or out of range
   */
  public SnapshotIdentity {
    Objects.requireNonNull(root, "root");
    Objects.requireNonNull(modulePath, "modulePath");
    Objects.requireNonNull(sourceFile, "sourceFile");
    if (modulePath.isBlank()) {
      throw new IllegalArgumentException("modulePath must not be blank");
    }
    if (sourceFile.isBlank()) {
      throw new IllegalArgumentException("sourceFile must not be blank");
    }
    if (line < 0) {
      throw new IllegalArgumentException("line must not be negative");
    }
    if (name != null && name.isBlank()) {
      throw new IllegalArgumentException("name must not be blank when present");
    }
    if (sequence < 1) {
      throw new IllegalArgumentException("sequence must be at least 1");
    }
  }

  /**
   * Creates an identity with sequence 1.
   *
   * @param root workspace root
   * @param modulePath dotted module path
   * @param sourceFile source file
   * @param line assertion line
   * @param name explicit name or {@code null}
   * @return identity
   */
  public static SnapshotIdentity of(Path root, String modulePath, String sourceFile, int line, String name) {
    return new SnapshotIdentity(root, modulePath, sourceFile, line, name, 1);
  }

  /**
   * Returns a copy carrying {@code sequence}.
   *
   * @param sequence disambiguation sequence
   * @return identity with the new sequence
   */
  public SnapshotIdentity withSequence(int sequence) {
    return new SnapshotIdentity(root, modulePath, sourceFile, line, name, sequence);
  }

  /**
   * Returns the last segment of {@link #modulePath()}.
   *
   * @return module short name, e.g. {@code UserTest}
   */
  public String moduleName() {
    int dot = modulePath.lastIndexOf('.');
    return dot < 0 ? modulePath : modulePath.substring(dot + 1);
  }

  /**
   * Returns the explicit name, or {@code line_<n>} when none was given.
   *
   * @return snapshot base name before sequence suffixing
   */
  public String baseName() {
    return name != null ? name : "line_" + line;
  }

  /**
   * Returns the directory holding the asserting source file, resolved against {@link #root()}.
   *
   * @return absolute, normalized source directory
   */
  public Path sourceDirectory() {
    Path source = Path.of(sourceFile);
    Path resolved = source.isAbsolute() ? source : root.resolve(source);
    Path parent = resolved.toAbsolutePath().normalize().getParent();
    return parent == null ? root.toAbsolutePath().normalize() : parent;
  }

  /**
   * Returns the sanitized {@code <module>__<name>} file stem, without sequence or extension.
   *
   * @return file stem restricted to {@code [A-Za-z0-9._]}
   */
  public String fileStem() {
    return FileNames.sanitizeStem(moduleName()) + "__" + FileNames.sanitizeStem(baseName());
  }

  /**
   * Returns {@link #fileStem()} with the {@code -<sequence>} suffix when the sequence is above 1.
   *
   * @return file name without extension
   */
  public String fileName() {
    return sequence > 1 ? fileStem() + SEQUENCE_SEPARATOR + sequence : fileStem();
  }

  /**
   * Returns the key that groups identities competing for the same file; the sequence is excluded.
   *
   * <p>The key is built from the sanitized stem, so names that sanitize alike share one sequence.</p>
   *
   * @return grouping key
   */
  public String slotKey() {
    return sourceDirectory() + "|" + fileStem();
  }

  /**
   * Renders a short human-readable label for logs and failure messages.
   *
   * @return label such as {@code com.acme.UserTest::login (UserTest.java:42)}
   */
  public String describe() {
    String suffix = sequence > 1 ? "-" + sequence : "";
    return modulePath + "::" + baseName() + suffix + " (" + sourceFile + ":" + line + ")";
  }
}
