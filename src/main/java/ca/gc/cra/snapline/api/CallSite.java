package ca.gc.cra.snapline.api;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Source location of the code that issued a snapshot assertion.
 *
 * @param className binary name of the calling class
 * @param fileName source file name reported by the stack frame; may be {@code null}
 * @param line line number, or {@code 0} when unavailable
 */
record CallSite(String className, String fileName, int line) {
  private static final Set<String> API_CLASSES = Set.of(
      CallSite.class.getName(), SnapshotAsserter.class.getName(), Snapshots.class.getName());
  private static final List<String> SOURCE_ROOTS = List.of("src/test/java", "src/main/java");

  CallSite {
    Objects.requireNonNull(className, "className");
    line = Math.max(line, 0);
  }

  /**
   * Returns the first frame outside this package's entry points.
   *
   * @return caller location
   */
  static CallSite capture() {
    return StackWalker.getInstance()
        .walk(frames -> frames
            .filter(frame -> !API_CLASSES.contains(frame.getClassName()))
            .findFirst())
        .map(frame -> new CallSite(frame.getClassName(), frame.getFileName(), frame.getLineNumber()))
        .orElseThrow(() -> new IllegalStateException("No caller frame outside the snapshot API"));
  }

  /**
   * Returns the top-level class name, dropping nested class suffixes.
   *
   * @return dotted class name
   */
  String topLevelClassName() {
    int nested = className.indexOf('$');
    return nested < 0 ? className : className.substring(0, nested);
  }

  /**
   * Guesses the source path of the calling class relative to {@code root}.
   *
   * <p>Maven layouts are probed in order ({@code src/test/java}, then {@code src/main/java}); when neither holds
   * the file the test root is assumed.</p>
   *
   * @param root workspace root
   * @return forward-slash relative path such as {@code src/test/java/com/acme/UserTest.java}
   */
  String sourcePath(Path root) {
    String topLevel = topLevelClassName();
    int dot = topLevel.lastIndexOf('.');
    String packagePath = dot < 0 ? "" : topLevel.substring(0, dot).replace('.', '/') + "/";
    String file = fileName != null ? fileName : topLevel.substring(dot + 1) + ".java";
    String relative = packagePath + file;
    for (String sourceRoot : SOURCE_ROOTS) {
      if (Files.exists(root.resolve(sourceRoot).resolve(relative))) {
        return sourceRoot + "/" + relative;
      }
    }
    return SOURCE_ROOTS.get(0) + "/" + relative;
  }
}
