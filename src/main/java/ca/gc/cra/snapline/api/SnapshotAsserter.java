package ca.gc.cra.snapline.api;

import ca.gc.cra.snapline.application.assertion.AssertionOutcome;
import ca.gc.cra.snapline.application.assertion.AssertionRequest;
import ca.gc.cra.snapline.application.assertion.SnapshotAssertion;
import ca.gc.cra.snapline.application.format.SnapshotFormat;
import ca.gc.cra.snapline.application.redaction.RedactionRule;
import ca.gc.cra.snapline.config.SnapshotSettings;
import ca.gc.cra.snapline.domain.snapshot.SnapshotIdentity;
import ca.gc.cra.snapline.validation.Strings;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Issues snapshot assertions bound to one module and, optionally, a default snapshot name.
 *
 * <p>Every assertion method returns the {@link AssertionOutcome} when it passed or updated the baseline and throws
 * {@link AssertionError} carrying the diff when it failed. Repeated assertions under the same name get sequence
 * suffixes ({@code name}, {@code name-2}, ...) within the naming scope of the underlying coordinator.</p>
 *
 * <p>Not thread-safe as a whole; the naming scope tolerates concurrent use but assertion order then decides the
 * sequence numbers.</p>
 *
 * @since 0.1.0
 */
public final class SnapshotAsserter {
  private final SnapshotAssertion assertion;
  private final SnapshotSettings settings;
  private final String modulePath;
  private final String name;
  private final String expression;

  SnapshotAsserter(
      SnapshotAssertion assertion, SnapshotSettings settings, String modulePath, String name, String expression) {
    this.assertion = Objects.requireNonNull(assertion, "assertion");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.modulePath = modulePath;
    this.name = name;
    this.expression = expression;
  }

  /**
   * Creates an asserter with its own naming scope.
   *
   * @param assertion coordinator; its namer defines the naming scope
   * @param settings effective settings
   * @param modulePath module path recorded in file names, or {@code null} to use the calling class
   * @param defaultName default snapshot name, or {@code null} to name snapshots after the calling line
   * @return asserter
   */
  public static SnapshotAsserter create(
      SnapshotAssertion assertion, SnapshotSettings settings, String modulePath, String defaultName) {
    return new SnapshotAsserter(assertion, settings, modulePath, defaultName, null);
  }

  /**
   * Returns an asserter sharing this one's naming scope but using {@code snapshotName}.
   *
   * @param snapshotName explicit snapshot name
   * @return named view
   */
  public SnapshotAsserter named(String snapshotName) {
    return new SnapshotAsserter(
        assertion, settings, modulePath, Strings.requireNonBlank("snapshot name", snapshotName), expression);
  }

  /**
   * Returns an asserter sharing this one's naming scope that records {@code description} as the asserted
   * expression, both in the snapshot header and in failure messages.
   *
   * @param description source text or label of the asserted value
   * @return described view
   */
  public SnapshotAsserter described(String description) {
    return new SnapshotAsserter(
        assertion, settings, modulePath, name, Strings.requireNonBlank("expression", description));
  }

  public AssertionOutcome assertJson(Object value, RedactionRule... rules) {
    return assertValue(value, SnapshotFormat.JSON, rules);
  }

  public AssertionOutcome assertYaml(Object value, RedactionRule... rules) {
    return assertValue(value, SnapshotFormat.YAML, rules);
  }

  public AssertionOutcome assertRon(Object value, RedactionRule... rules) {
    return assertValue(value, SnapshotFormat.RON, rules);
  }

  /**
   * Compares {@code text} verbatim with the baseline.
   *
   * @param text text to compare
   * @return outcome when the snapshot passed or was updated
   * @throws AssertionError when the snapshot failed
   */
  public AssertionOutcome assertText(String text) {
    return run(identity -> AssertionRequest.ofText(identity, expression, text));
  }

  /**
   * Compares {@code String.valueOf(value)} with the baseline.
   *
   * @param value value whose string form is recorded
   * @return outcome when the snapshot passed or was updated
   * @throws AssertionError when the snapshot failed
   */
  public AssertionOutcome assertDebug(Object value) {
    return run(identity -> AssertionRequest.ofDebug(identity, expression, value));
  }

  private AssertionOutcome assertValue(Object value, SnapshotFormat format, RedactionRule[] rules) {
    List<RedactionRule> ruleList = rules == null ? List.of() : List.of(rules);
    return run(identity -> AssertionRequest.ofValue(identity, expression, value, format, ruleList));
  }

  private AssertionOutcome run(Function<SnapshotIdentity, AssertionRequest> request) {
    CallSite site = CallSite.capture();
    SnapshotIdentity identity = SnapshotIdentity.of(
        settings.workspaceRoot(),
        modulePath != null ? modulePath : site.topLevelClassName(),
        site.sourcePath(settings.workspaceRoot()),
        site.line(),
        name);
    AssertionOutcome outcome = assertion.check(request.apply(identity), settings.update());
    if (outcome instanceof AssertionOutcome.Failed failed) {
      throw new AssertionError(failed.message());
    }
    return outcome;
  }
}
