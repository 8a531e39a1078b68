package ca.gc.cra.snapline.application.port;

import ca.gc.cra.snapline.domain.snapshot.SnapshotFile;
import ca.gc.cra.snapline.domain.snapshot.SnapshotIdentity;
import ca.gc.cra.snapline.domain.snapshot.SnapshotLocation;
import java.util.Optional;

/**
 * <strong>What:</strong> Port for resolving, reading and persisting snapshot artifacts.
 * <p><strong>Why:</strong> Keeps the assertion coordinator independent of the filesystem layout.</p>
 * <p><strong>Role:</strong> Application port implemented by persistence adapters.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Map identities to baseline and pending paths deterministically.</li>
 *   <li>Load baselines, treating absence as "no prior baseline".</li>
 *   <li>Write pending artifacts and baselines atomically; never delete pending artifacts implicitly.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate concurrent calls for distinct identities.</p>
 * <p><strong>Performance:</strong> One read per assertion; at most one write.</p>
 * <p><strong>Observability:</strong> Implementations log resolved paths and writes at DEBUG/INFO.</p>
 *
 * @since 0.1.0
 */
public interface SnapshotStore {

  /**
   * Resolves where the snapshot for {@code identity} lives.
   *
   * @param identity snapshot identity including its sequence
   * @return baseline and pending paths
   */
  SnapshotLocation resolve(SnapshotIdentity identity);

  /**
   * Loads the accepted baseline.
   *
   * @param location resolved location
   * @return parsed baseline, or empty when no baseline file exists
   * @throws SnapshotIoException when the file exists but cannot be read
   */
  Optional<SnapshotFile> loadBaseline(SnapshotLocation location);

  /**
   * Atomically writes (or overwrites) the pending artifact; the baseline is left untouched.
   *
   * @param location resolved location
   * @param file proposed snapshot
   * @throws SnapshotIoException when the write fails
   */
  void writePending(SnapshotLocation location, SnapshotFile file);

  /**
   * Atomically overwrites the baseline.
   *
   * @param location resolved location
   * @param file snapshot to accept
   * @throws SnapshotIoException when the write fails
   */
  void writeBaseline(SnapshotLocation location, SnapshotFile file);

  /**
   * Compares a baseline body with fresh output. Headers never participate.
   *
   * @param baseline accepted snapshot, or empty when none exists
   * @param rendered freshly rendered text
   * @return {@link Comparison#EQUAL} only when a baseline exists and its body matches
   */
  default Comparison compare(Optional<SnapshotFile> baseline, String rendered) {
    return baseline.isPresent() && baseline.get().contentMatches(rendered)
        ? Comparison.EQUAL
        : Comparison.DIFFERENT;
  }

  /** Result of comparing a baseline with fresh output. */
  enum Comparison {
    EQUAL,
    DIFFERENT
  }
}
