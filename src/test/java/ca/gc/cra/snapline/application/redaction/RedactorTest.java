package ca.gc.cra.snapline.application.redaction;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.snapline.domain.content.Content;
import ca.gc.cra.snapline.domain.selector.SelectorParseException;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class RedactorTest {
  private final Redactor redactor = new Redactor();

  private static Content user() {
    return Content.struct("User")
        .field("name", "Alice")
        .field("password", "hunter2")
        .field("sessions", Content.seq(
            Content.struct("Session").field("id", "s-1").field("ip", "10.0.0.1").build(),
            Content.struct("Session").field("id", "s-2").field("ip", "10.0.0.2").build()))
        .build();
  }

  @Test
  void replacesExactPath() {
    Content redacted = redactor.apply(user(), List.of(RedactionRule.of(".password", "[REDACTED]")));

    Content.StructValue struct = (Content.StructValue) redacted;
    assertEquals(Content.of("Alice"), struct.fields().get(0).value());
    assertEquals(Content.of("[REDACTED]"), struct.fields().get(1).value());
  }

  @Test
  void wildcardRedactsEveryElement() {
    Content redacted = redactor.apply(user(), List.of(RedactionRule.of(".sessions.*.ip", "[ip]")));

    Content expectedSessions = Content.seq(
        Content.struct("Session").field("id", "s-1").field("ip", "[ip]").build(),
        Content.struct("Session").field("id", "s-2").field("ip", "[ip]").build());
    assertEquals(expectedSessions, ((Content.StructValue) redacted).fields().get(2).value());
  }

  @Test
  void deepWildcardReachesAnyDepth() {
    Content redacted = redactor.apply(user(), List.of(RedactionRule.of(".**.id", 0)));

    Content sessions = ((Content.StructValue) redacted).fields().get(2).value();
    for (Content session : ((Content.SeqValue) sessions).items()) {
      assertEquals(Content.of(0), ((Content.StructValue) session).fields().get(0).value());
    }
  }

  @Test
  void noRulesReturnsSameTree() {
    Content tree = user();

    assertSame(tree, redactor.apply(tree, List.of()));
  }

  @Test
  void unmatchedSelectorLeavesTreeUntouched() {
    Content tree = user();

    assertSame(tree, redactor.apply(tree, List.of(RedactionRule.of(".missing.field", "x"))));
  }

  @Test
  void laterRuleWinsForSameNode() {
    Content redacted = redactor.apply(user(), List.of(
        RedactionRule.of(".password", "first"),
        RedactionRule.of(".**.password", "second")));

    assertEquals(Content.of("second"), ((Content.StructValue) redacted).fields().get(1).value());
  }

  @Test
  void matchedContainerIsReplacedWholesale() {
    Content redacted = redactor.apply(user(), List.of(
        RedactionRule.of(".sessions", "[sessions]"),
        RedactionRule.of(".sessions.*.id", "never")));

    assertEquals(Content.of("[sessions]"), ((Content.StructValue) redacted).fields().get(2).value());
  }

  @Test
  void enumPayloadSharesTheEnumPath() {
    Content tree = Content.map()
        .put("status", Content.variant("Status", "Locked", Content.map().put("until", "2024-01-01").build()))
        .build();

    Content redacted = redactor.apply(tree, List.of(RedactionRule.of(".status.until", "[date]")));

    assertEquals(Content.map()
        .put("status", Content.variant("Status", "Locked", Content.map().put("until", "[date]").build()))
        .build(), redacted);
  }

  @Test
  void singleWildcardStopsAtOneLevelWhileDeepWildcardDescends() {
    Content tree = Content.seq(Content.map()
        .put("id", 1)
        .put("user", Content.map().put("id", 2).build())
        .build());

    Content shallow = redactor.apply(tree, List.of(RedactionRule.of("*.id", 0)));
    Content deep = redactor.apply(tree, List.of(RedactionRule.of("**.id", 0)));

    assertEquals(Content.seq(Content.map()
        .put("id", 0)
        .put("user", Content.map().put("id", 2).build())
        .build()), shallow);
    assertEquals(Content.seq(Content.map()
        .put("id", 0)
        .put("user", Content.map().put("id", 0).build())
        .build()), deep);
  }

  @Test
  void deepWildcardReachesIdNestedUnderUser() {
    Content tree = Content.map().put("user", Content.map().put("id", 1).build()).build();

    Content redacted = redactor.apply(tree, List.of(RedactionRule.of("**.id", "[id]")));

    assertEquals(Content.map().put("user", Content.map().put("id", "[id]").build()).build(), redacted);
  }

  @Test
  void redactionIsIdempotent() {
    List<RedactionRule> rules = List.of(RedactionRule.of(".**.ip", "[ip]"), RedactionRule.of(".password", true));

    Content once = redactor.apply(user(), rules);

    assertEquals(once, redactor.apply(once, rules));
  }

  @Test
  void inputTreeIsNeverMutated() {
    Content tree = user();
    Content copy = user();

    redactor.apply(tree, List.of(RedactionRule.of(".**", "x")));

    assertEquals(copy, tree);
  }

  @Test
  void ruleRejectsMalformedSelectorAndNonPrimitiveReplacement() {
    assertThrows(SelectorParseException.class, () -> RedactionRule.of(".a..b", "x"));
    assertThrows(IllegalArgumentException.class, () -> RedactionRule.of(".a", Content.seq()));
    assertThrows(IllegalArgumentException.class, () -> RedactionRule.of(".a", new Object()));
  }

  @Test
  void logsSelectorsThatMatchNothing() {
    Logger logger = (Logger) LoggerFactory.getLogger(Redactor.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    Level originalLevel = logger.getLevel();
    logger.setLevel(Level.DEBUG);
    appender.start();
    logger.addAppender(appender);

    try {
      redactor.apply(user(), List.of(RedactionRule.of(".nothing", "x"), RedactionRule.of(".name", "x")));
    } finally {
      logger.detachAppender(appender);
      logger.setLevel(originalLevel);
      appender.stop();
    }

    List<String> messages = appender.list.stream().map(ILoggingEvent::getFormattedMessage).toList();
    assertTrue(messages.contains("Redaction selector .nothing matched no nodes"));
    assertTrue(messages.contains("Redacted 1 node(s) using 2 rule(s)"));
  }
}
