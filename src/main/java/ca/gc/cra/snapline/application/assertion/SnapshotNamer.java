package ca.gc.cra.snapline.application.assertion;

import ca.gc.cra.snapline.domain.snapshot.SnapshotIdentity;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Assigns increasing sequence numbers to identities that share a snapshot slot.
 *
 * <p>The first assertion of a slot gets sequence 1 (file {@code module__name.snap}), the second gets 2
 * ({@code module__name-2.snap}) and so on. Counters live as long as this instance or until {@link #reset()}.</p>
 *
 * @since 0.1.0
 */
public final class SnapshotNamer {
  private final ConcurrentMap<String, AtomicInteger> counters = new ConcurrentHashMap<>();

  /**
   * Returns {@code identity} carrying the next sequence for its slot.
   *
   * @param identity identity as supplied by the call site
   * @return sequenced identity
   */
  public SnapshotIdentity assign(SnapshotIdentity identity) {
    Objects.requireNonNull(identity, "identity");
    int sequence = counters.computeIfAbsent(identity.slotKey(), key -> new AtomicInteger())
        .incrementAndGet();
    return identity.withSequence(sequence);
  }

  /** Forgets every counter; the next assertion of any slot gets sequence 1 again. */
  public void reset() {
    counters.clear();
  }
}
