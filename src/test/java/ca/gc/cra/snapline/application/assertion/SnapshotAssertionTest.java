package ca.gc.cra.snapline.application.assertion;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.snapline.application.format.SerializationException;
import ca.gc.cra.snapline.application.format.SnapshotFormat;
import ca.gc.cra.snapline.application.redaction.RedactionRule;
import ca.gc.cra.snapline.domain.content.Content;
import ca.gc.cra.snapline.domain.selector.SelectorParseException;
import ca.gc.cra.snapline.domain.snapshot.SnapshotFile;
import ca.gc.cra.snapline.domain.snapshot.SnapshotFileCodec;
import ca.gc.cra.snapline.domain.snapshot.SnapshotIdentity;
import ca.gc.cra.snapline.infrastructure.capture.DefaultContentCapture;
import ca.gc.cra.snapline.infrastructure.persistence.FileSnapshotStore;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class SnapshotAssertionTest {
  private static final String SOURCE = "src/test/java/com/acme/UserTest.java";

  @TempDir Path workspace;

  private SnapshotAssertion assertion;

  @BeforeEach
  void setUp() {
    assertion = new SnapshotAssertion(new FileSnapshotStore(), DefaultContentCapture.create());
  }

  private SnapshotIdentity identity(String name) {
    return SnapshotIdentity.of(workspace, "com.acme.UserTest", SOURCE, 12, name);
  }

  private static Content user(String name) {
    return Content.struct("User").field("name", name).field("password", "hunter2").build();
  }

  private Path snapshotDir() {
    return workspace.resolve("src/test/java/com/acme/snapshots");
  }

  @Test
  void firstRunFailsAndWritesPendingOnly() throws IOException {
    AssertionOutcome outcome = assertion.check(identity("profile"), user("Alice"), List.of(),
        SnapshotFormat.JSON, UpdateMode.OFF);

    AssertionOutcome.Failed failed = assertInstanceOf(AssertionOutcome.Failed.class, outcome);
    assertEquals(AssertionState.FAILED, failed.state());
    assertTrue(failed.state().isTerminal());
    assertFalse(failed.baselineExisted());
    assertEquals(snapshotDir().resolve("UserTest__profile.snap"), failed.location().baseline());
    assertFalse(Files.exists(failed.location().baseline()));
    assertTrue(Files.exists(failed.location().pending()));
    assertTrue(failed.diff().contains("+  \"name\": \"Alice\","));
    assertTrue(failed.message().contains("has no baseline"));
  }

  @Test
  void malformedSelectorFailsBeforeAnyFileIsTouched() {
    assertThrows(SelectorParseException.class, () -> assertion.check(identity("profile"), user("Alice"),
        List.of(RedactionRule.of(".name.\"unterminated", "x")), SnapshotFormat.JSON, UpdateMode.ON));

    assertFalse(Files.exists(snapshotDir()));
    assertFalse(Files.exists(workspace.resolve("src")));
  }

  @Test
  void updateModeWritesBaselineThenPasses() throws IOException {
    AssertionOutcome updated = assertion.check(identity("profile"), user("Alice"),
        List.of(RedactionRule.of(".password", "[REDACTED]")), SnapshotFormat.JSON, UpdateMode.ON);

    assertInstanceOf(AssertionOutcome.Updated.class, updated);
    SnapshotFile stored = SnapshotFileCodec.parse(Files.readString(updated.location().baseline()));
    assertEquals("""
        {
          "name": "Alice",
          "password": "[REDACTED]"
        }""", stored.body());
    assertEquals(SOURCE, stored.metadata().source());
    assertEquals(12, stored.metadata().line());
    assertEquals("json", stored.metadata().format());
    assertFalse(Files.exists(updated.location().pending()));

    assertion.resetNaming();
    AssertionOutcome again = assertion.check(identity("profile"), user("Alice"),
        List.of(RedactionRule.of(".password", "[REDACTED]")), SnapshotFormat.JSON, UpdateMode.OFF);
    assertInstanceOf(AssertionOutcome.Passed.class, again);
  }

  @Test
  void mismatchKeepsBaselineAndReportsDiff() throws IOException {
    assertion.check(identity("profile"), user("Alice"), List.of(), SnapshotFormat.YAML, UpdateMode.ON);
    assertion.resetNaming();

    AssertionOutcome outcome =
        assertion.check(identity("profile"), user("Bob"), List.of(), SnapshotFormat.YAML, UpdateMode.OFF);

    AssertionOutcome.Failed failed = assertInstanceOf(AssertionOutcome.Failed.class, outcome);
    assertTrue(failed.baselineExisted());
    assertTrue(failed.diff().contains("-name: Alice\n+name: Bob\n"));
    assertEquals("name: Alice\npassword: hunter2",
        SnapshotFileCodec.parse(Files.readString(failed.location().baseline())).body());
    assertEquals("name: Bob\npassword: hunter2",
        SnapshotFileCodec.parse(Files.readString(failed.location().pending())).body());
  }

  @Test
  void passLeavesStalePendingUntouched() throws IOException {
    assertion.check(identity("profile"), user("Alice"), List.of(), SnapshotFormat.RON, UpdateMode.ON);
    assertion.resetNaming();
    assertion.check(identity("profile"), user("Bob"), List.of(), SnapshotFormat.RON, UpdateMode.OFF);
    assertion.resetNaming();
    Path pending = snapshotDir().resolve("UserTest__profile.snap.new");
    String before = Files.readString(pending);

    AssertionOutcome outcome =
        assertion.check(identity("profile"), user("Alice"), List.of(), SnapshotFormat.RON, UpdateMode.OFF);

    assertInstanceOf(AssertionOutcome.Passed.class, outcome);
    assertEquals(before, Files.readString(pending));
  }

  @Test
  void repeatedIdentityGetsSequenceSuffix() {
    AssertionOutcome first = assertion.check(identity("profile"), user("A"), List.of(),
        SnapshotFormat.JSON, UpdateMode.ON);
    AssertionOutcome second = assertion.check(identity("profile"), user("B"), List.of(),
        SnapshotFormat.JSON, UpdateMode.ON);

    assertEquals("UserTest__profile.snap", first.location().baseline().getFileName().toString());
    assertEquals("UserTest__profile-2.snap", second.location().baseline().getFileName().toString());
    assertEquals(2, second.identity().sequence());
  }

  @Test
  void unnamedSnapshotIsNamedAfterLine() {
    AssertionOutcome outcome = assertion.checkText(identity(null), null, "hello", UpdateMode.ON);

    assertEquals("UserTest__line_12.snap", outcome.location().baseline().getFileName().toString());
  }

  @Test
  void debugSnapshotRecordsToString() throws IOException {
    AssertionOutcome outcome = assertion.check(
        AssertionRequest.ofDebug(identity("debug"), "List.of(1, 2)", List.of(1, 2)), UpdateMode.ON);

    SnapshotFile stored = SnapshotFileCodec.parse(Files.readString(outcome.location().baseline()));
    assertEquals("[1, 2]", stored.body());
    assertEquals("debug", stored.metadata().format());
    assertEquals("List.of(1, 2)", stored.metadata().expression());
  }

  @Test
  void serializationFailureHappensBeforeAnyIo() {
    assertThrows(SerializationException.class, () -> assertion.check(identity("bad"), new Object(),
        List.of(), SnapshotFormat.JSON, UpdateMode.ON));

    assertFalse(Files.exists(snapshotDir()));
  }

  @Test
  void mismatchIsLoggedWithPendingPath() {
    Logger logger = (Logger) LoggerFactory.getLogger(SnapshotAssertion.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);

    AssertionOutcome outcome;
    try {
      outcome = assertion.checkText(identity("log"), null, "text", UpdateMode.OFF);
    } finally {
      logger.detachAppender(appender);
      appender.stop();
    }

    String pending = outcome.location().pending().toString();
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getFormattedMessage().contains(pending)
            && event.getLevel() == ch.qos.logback.classic.Level.WARN));
  }
}
