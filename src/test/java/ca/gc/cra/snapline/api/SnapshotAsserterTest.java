package ca.gc.cra.snapline.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.snapline.application.assertion.AssertionOutcome;
import ca.gc.cra.snapline.application.assertion.SnapshotAssertion;
import ca.gc.cra.snapline.application.assertion.UpdateMode;
import ca.gc.cra.snapline.application.redaction.RedactionRule;
import ca.gc.cra.snapline.config.SnapshotSettings;
import ca.gc.cra.snapline.domain.snapshot.SnapshotFile;
import ca.gc.cra.snapline.domain.snapshot.SnapshotFileCodec;
import ca.gc.cra.snapline.infrastructure.capture.DefaultContentCapture;
import ca.gc.cra.snapline.infrastructure.persistence.FileSnapshotStore;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SnapshotAsserterTest {

  @TempDir Path workspace;

  private SnapshotAsserter asserter(UpdateMode mode, String name) {
    SnapshotAssertion assertion = new SnapshotAssertion(new FileSnapshotStore(), DefaultContentCapture.create());
    return SnapshotAsserter.create(assertion, new SnapshotSettings(mode, workspace, false), null, name);
  }

  private Path snapshotDir() {
    return workspace.resolve("src/test/java/ca/gc/cra/snapline/api/snapshots");
  }

  @Test
  void failedAssertionThrowsWithDiff() {
    AssertionError error = assertThrows(AssertionError.class,
        () -> asserter(UpdateMode.OFF, "greeting").assertText("hello"));

    assertTrue(error.getMessage().contains("has no baseline"));
    assertTrue(error.getMessage().contains("+hello"));
    assertTrue(Files.exists(snapshotDir().resolve("SnapshotAsserterTest__greeting.snap.new")));
  }

  @Test
  void updateModeRecordsCallSiteInHeader() throws IOException {
    Map<String, Object> user = new LinkedHashMap<>();
    user.put("name", "Alice");
    user.put("token", "abc123");

    AssertionOutcome outcome = asserter(UpdateMode.ON, "user")
        .assertJson(user, RedactionRule.of(".token", "[token]"));

    assertInstanceOf(AssertionOutcome.Updated.class, outcome);
    assertEquals(snapshotDir().resolve("SnapshotAsserterTest__user.snap"), outcome.location().baseline());
    SnapshotFile stored = SnapshotFileCodec.parse(Files.readString(outcome.location().baseline()));
    assertEquals("{\n  \"name\": \"Alice\",\n  \"token\": \"[token]\"\n}", stored.body());
    assertEquals("src/test/java/ca/gc/cra/snapline/api/SnapshotAsserterTest.java", stored.metadata().source());
    assertTrue(stored.metadata().line() > 0);
  }

  @Test
  void unnamedAssertionsAreNamedAfterTheirLine() {
    AssertionOutcome outcome = asserter(UpdateMode.ON, null).assertDebug(42);

    String fileName = outcome.location().baseline().getFileName().toString();
    assertTrue(fileName.startsWith("SnapshotAsserterTest__line_"), fileName);
  }

  @Test
  void namedViewSharesSequenceScope() {
    SnapshotAsserter base = asserter(UpdateMode.ON, null);

    AssertionOutcome first = base.named("shared").assertRon(1);
    AssertionOutcome second = base.named("shared").assertRon(2);

    assertEquals("SnapshotAsserterTest__shared.snap", first.location().baseline().getFileName().toString());
    assertEquals("SnapshotAsserterTest__shared-2.snap", second.location().baseline().getFileName().toString());
    assertFalse(Files.exists(second.location().pending()));
  }

  @Test
  void describedViewRecordsExpression() throws IOException {
    AssertionOutcome outcome = asserter(UpdateMode.ON, "described").described("user.profile()").assertYaml(1);

    SnapshotFile stored = SnapshotFileCodec.parse(Files.readString(outcome.location().baseline()));
    assertEquals("user.profile()", stored.metadata().expression());
    assertEquals("described", stored.metadata().name());

    AssertionError error = assertThrows(AssertionError.class,
        () -> asserter(UpdateMode.OFF, "changed").named("described").described("user.profile()").assertYaml(2));
    assertTrue(error.getMessage().contains("expression: user.profile()"), error.getMessage());
  }

  @Test
  void blankNameIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> asserter(UpdateMode.OFF, null).named(" "));
    assertThrows(IllegalArgumentException.class, () -> asserter(UpdateMode.OFF, null).described(""));
  }
}
