package ca.gc.cra.snapline.application.assertion;

import ca.gc.cra.snapline.domain.snapshot.SnapshotIdentity;
import ca.gc.cra.snapline.domain.snapshot.SnapshotLocation;
import java.util.Objects;

/**
 * Terminal result of a snapshot assertion.
 *
 * @since 0.1.0
 */
public sealed interface AssertionOutcome
    permits AssertionOutcome.Passed, AssertionOutcome.Failed, AssertionOutcome.Updated {

  SnapshotIdentity identity();

  SnapshotLocation location();

  AssertionState state();

  /**
   * Rendered output matched the baseline.
   *
   * @param identity sequenced identity
   * @param location resolved paths
   */
  record Passed(SnapshotIdentity identity, SnapshotLocation location) implements AssertionOutcome {
    @Override
    public AssertionState state() {
      return AssertionState.PASSED;
    }
  }

  /**
   * Rendered output differed from (or had no) baseline; a pending snapshot was written.
   *
   * @param identity sequenced identity
   * @param expression source expression of the asserted value; may be {@code null}
   * @param location resolved paths; {@link SnapshotLocation#pending()} holds the new rendering
   * @param diff unified line diff from the baseline body to the new rendering
   * @param baselineExisted {@code false} when this was the first run for the identity
   */
  record Failed(
      SnapshotIdentity identity,
      String expression,
      SnapshotLocation location,
      String diff,
      boolean baselineExisted) implements AssertionOutcome {

    public Failed {
      Objects.requireNonNull(identity, "identity");
      Objects.requireNonNull(location, "location");
      Objects.requireNonNull(diff, "diff");
    }

    @Override
    public AssertionState state() {
      return AssertionState.FAILED;
    }

    /**
     * Builds the message shown to the test author.
     *
     * @return multi-line failure description including the diff
     */
    public String message() {
      StringBuilder sb = new StringBuilder();
      if (baselineExisted) {
        sb.append("Snapshot ").append(identity.describe()).append(" does not match ")
            .append(location.baseline()).append('\n');
      } else {
        sb.append("Snapshot ").append(identity.describe()).append(" has no baseline at ")
            .append(location.baseline()).append('\n');
      }
      if (expression != null) {
        sb.append("expression: ").append(expression).append('\n');
      }
      sb.append("pending: ").append(location.pending()).append('\n');
      sb.append(diff);
      return sb.toString();
    }
  }

  /**
   * Update mode was on and the baseline was overwritten with the new rendering.
   *
   * @param identity sequenced identity
   * @param location resolved paths
   */
  record Updated(SnapshotIdentity identity, SnapshotLocation location) implements AssertionOutcome {
    @Override
    public AssertionState state() {
      return AssertionState.UPDATED;
    }
  }
}
