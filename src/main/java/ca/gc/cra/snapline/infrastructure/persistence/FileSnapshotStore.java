package ca.gc.cra.snapline.infrastructure.persistence;

import ca.gc.cra.snapline.application.port.SnapshotIoException;
import ca.gc.cra.snapline.application.port.SnapshotStore;
import ca.gc.cra.snapline.domain.snapshot.SnapshotFile;
import ca.gc.cra.snapline.domain.snapshot.SnapshotFileCodec;
import ca.gc.cra.snapline.domain.snapshot.SnapshotIdentity;
import ca.gc.cra.snapline.domain.snapshot.SnapshotLocation;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Filesystem-backed {@link SnapshotStore}.
 * <p><strong>Why:</strong> Baselines live next to the code that asserts them so they are reviewed and versioned
 * together.</p>
 * <p><strong>Role:</strong> Persistence adapter behind the snapshot store port.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Resolve {@code <root>/<source dir>/snapshots/<module>__<name>[-<seq>].snap}; {@code -} only ever
 *   introduces the sequence.</li>
 *   <li>Read baselines as UTF-8; a missing file means "no baseline".</li>
 *   <li>Write through a temp file in the target directory followed by an atomic rename.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; concurrent writes to distinct paths are independent. Two writers
 * targeting the same path race, and the last rename wins with a complete file.</p>
 * <p><strong>Performance:</strong> One read per assertion; writes only on mismatch.</p>
 * <p><strong>Observability:</strong> DEBUG for reads, INFO for baseline writes, DEBUG for pending writes.</p>
 *
 * @implNote Falls back to a non-atomic replace when the filesystem rejects {@link StandardCopyOption#ATOMIC_MOVE};
 * the temp file still guarantees readers never see partial content on common local filesystems.
 * @since 0.1.0
 */
public final class FileSnapshotStore implements SnapshotStore {
  private static final Logger log = LoggerFactory.getLogger(FileSnapshotStore.class);

  /** Directory created next to each asserting source file. */
  public static final String SNAPSHOT_DIRECTORY = "snapshots";

  @Override
  public SnapshotLocation resolve(SnapshotIdentity identity) {
    Objects.requireNonNull(identity, "identity");
    Path directory = identity.sourceDirectory().resolve(SNAPSHOT_DIRECTORY);
    String fileName = identity.fileName() + SnapshotLocation.BASELINE_SUFFIX;
    SnapshotLocation location = SnapshotLocation.forBaseline(directory.resolve(fileName));
    log.debug("Resolved snapshot {} -> {}", identity.describe(), location.baseline());
    return location;
  }

  @Override
  public Optional<SnapshotFile> loadBaseline(SnapshotLocation location) {
    Objects.requireNonNull(location, "location");
    Path path = location.baseline();
    String text;
    try {
      text = Files.readString(path, StandardCharsets.UTF_8);
    } catch (NoSuchFileException ex) {
      log.debug("No baseline at {}", path);
      return Optional.empty();
    } catch (IOException ex) {
      throw new SnapshotIoException("Failed to read snapshot baseline", path, ex);
    }
    try {
      return Optional.of(SnapshotFileCodec.parse(text));
    } catch (IllegalArgumentException ex) {
      throw new SnapshotIoException("Unreadable snapshot header", path, new IOException(ex.getMessage(), ex));
    }
  }

  @Override
  public void writePending(SnapshotLocation location, SnapshotFile file) {
    Objects.requireNonNull(location, "location");
    writeAtomically(location.pending(), SnapshotFileCodec.format(Objects.requireNonNull(file, "file")));
    log.debug("Wrote pending snapshot {}", location.pending());
  }

  @Override
  public void writeBaseline(SnapshotLocation location, SnapshotFile file) {
    Objects.requireNonNull(location, "location");
    writeAtomically(location.baseline(), SnapshotFileCodec.format(Objects.requireNonNull(file, "file")));
    log.info("Updated snapshot baseline {}", location.baseline());
  }

  static void writeAtomically(Path target, String content) {
    Path directory = target.toAbsolutePath().getParent();
    Path temp = null;
    try {
      Files.createDirectories(directory);
      temp = Files.createTempFile(directory, "." + target.getFileName(), ".tmp");
      try (Writer writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
        writer.write(content);
      }
      try {
        Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException ex) {
        log.debug("Atomic move unsupported for {}; falling back to replace", target);
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
      }
      temp = null;
    } catch (IOException ex) {
      SnapshotIoException failure = new SnapshotIoException("Failed to write snapshot", target, ex);
      if (temp != null) {
        try {
          Files.deleteIfExists(temp);
        } catch (IOException cleanup) {
          failure.addSuppressed(cleanup);
        }
      }
      throw failure;
    }
  }
}
