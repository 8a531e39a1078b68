package ca.gc.cra.snapline.domain.snapshot;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Resolved on-disk paths for one snapshot identity.
 *
 * @param baseline accepted snapshot file ({@code .snap})
 * @param pending proposed snapshot written on mismatch ({@code .snap.new})
 * @since 0.1.0
 */
public record SnapshotLocation(Path baseline, Path pending) {
  /** Suffix of accepted snapshots. */
  public static final String BASELINE_SUFFIX = ".snap";
  /** Suffix appended to the baseline name for pending snapshots. */
  public static final String PENDING_SUFFIX = ".new";

  public SnapshotLocation {
    Objects.requireNonNull(baseline, "baseline");
    Objects.requireNonNull(pending, "pending");
  }

  /**
   * Derives the location from a baseline path.
   *
   * @param baseline baseline path ending in {@code .snap}
   * @return location whose pending path is {@code <baseline>.new}
   */
  public static SnapshotLocation forBaseline(Path baseline) {
    Objects.requireNonNull(baseline, "baseline");
    return new SnapshotLocation(baseline, baseline.resolveSibling(baseline.getFileName() + PENDING_SUFFIX));
  }
}
