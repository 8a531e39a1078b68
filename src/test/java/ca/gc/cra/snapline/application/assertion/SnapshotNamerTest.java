package ca.gc.cra.snapline.application.assertion;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ca.gc.cra.snapline.domain.snapshot.SnapshotIdentity;
import java.nio.file.Path;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class SnapshotNamerTest {
  private static final Path ROOT = Path.of("/workspace");

  @Test
  void sequencesIncreasePerSlot() {
    SnapshotNamer namer = new SnapshotNamer();
    SnapshotIdentity a = SnapshotIdentity.of(ROOT, "m.T", "T.java", 1, "a");
    SnapshotIdentity b = SnapshotIdentity.of(ROOT, "m.T", "T.java", 1, "b");

    assertEquals(1, namer.assign(a).sequence());
    assertEquals(2, namer.assign(a).sequence());
    assertEquals(1, namer.assign(b).sequence());
    assertEquals(3, namer.assign(a).sequence());
  }

  @Test
  void resetStartsOver() {
    SnapshotNamer namer = new SnapshotNamer();
    SnapshotIdentity a = SnapshotIdentity.of(ROOT, "m.T", "T.java", 1, "a");
    namer.assign(a);

    namer.reset();

    assertEquals(1, namer.assign(a).sequence());
  }

  @Test
  void concurrentAssignmentsNeverRepeat() throws InterruptedException {
    SnapshotNamer namer = new SnapshotNamer();
    SnapshotIdentity a = SnapshotIdentity.of(ROOT, "m.T", "T.java", 1, "a");
    Set<Integer> seen = ConcurrentHashMap.newKeySet();
    ExecutorService pool = Executors.newFixedThreadPool(4);

    for (int i = 0; i < 200; i++) {
      pool.execute(() -> seen.add(namer.assign(a).sequence()));
    }
    pool.shutdown();
    pool.awaitTermination(10, TimeUnit.SECONDS);

    assertEquals(200, seen.size());
  }
}
