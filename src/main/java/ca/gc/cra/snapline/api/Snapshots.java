package ca.gc.cra.snapline.api;

import ca.gc.cra.snapline.application.assertion.AssertionOutcome;
import ca.gc.cra.snapline.application.assertion.SnapshotAssertion;
import ca.gc.cra.snapline.application.assertion.SnapshotNamer;
import ca.gc.cra.snapline.application.redaction.RedactionRule;
import ca.gc.cra.snapline.config.SettingsMerger;
import ca.gc.cra.snapline.config.SnapshotSettings;
import ca.gc.cra.snapline.infrastructure.capture.DefaultContentCapture;
import ca.gc.cra.snapline.infrastructure.persistence.FileSnapshotStore;
import ca.gc.cra.snapline.logging.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Static entry points for snapshot assertions.
 * <p><strong>Why:</strong> Lets any test assert a snapshot in one line without wiring a coordinator.</p>
 * <p><strong>Role:</strong> Outermost harness; loads settings once per JVM and threads the update mode into every
 * call.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Resolve settings from {@code snapline.yaml}, {@code SNAPLINE_*} and {@code snapline.*} on first use.</li>
 *   <li>Derive module, source file and line from the calling frame.</li>
 *   <li>Convert failed outcomes into {@link AssertionError}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Safe; naming sequences are shared process-wide.</p>
 *
 * @since 0.1.0
 */
public final class Snapshots {
  private static final Logger log = LoggerFactory.getLogger(Snapshots.class);

  private Snapshots() {}

  /**
   * Renders {@code value} as JSON and compares it with the baseline.
   *
   * @param name snapshot name, or {@code null} to name it after the calling line
   * @param value value to capture
   * @param rules redaction rules applied before rendering
   * @return outcome when the snapshot passed or was updated
   * @throws AssertionError when the snapshot failed
   */
  public static AssertionOutcome assertJson(String name, Object value, RedactionRule... rules) {
    return asserter(name).assertJson(value, rules);
  }

  /**
   * Renders {@code value} as block YAML and compares it with the baseline.
   *
   * @param name snapshot name or {@code null}
   * @param value value to capture
   * @param rules redaction rules
   * @return outcome when the snapshot passed or was updated
   * @throws AssertionError when the snapshot failed
   */
  public static AssertionOutcome assertYaml(String name, Object value, RedactionRule... rules) {
    return asserter(name).assertYaml(value, rules);
  }

  /**
   * Renders {@code value} in the typed RON-style format and compares it with the baseline.
   *
   * @param name snapshot name or {@code null}
   * @param value value to capture
   * @param rules redaction rules
   * @return outcome when the snapshot passed or was updated
   * @throws AssertionError when the snapshot failed
   */
  public static AssertionOutcome assertRon(String name, Object value, RedactionRule... rules) {
    return asserter(name).assertRon(value, rules);
  }

  public static AssertionOutcome assertText(String name, String text) {
    return asserter(name).assertText(text);
  }

  public static AssertionOutcome assertDebug(String name, Object value) {
    return asserter(name).assertDebug(value);
  }

  /**
   * Returns the settings the facade runs with.
   *
   * @return effective settings
   */
  public static SnapshotSettings settings() {
    return Holder.SETTINGS;
  }

  private static SnapshotAsserter asserter(String name) {
    return new SnapshotAsserter(Holder.ASSERTION, Holder.SETTINGS, null, name, null);
  }

  private static final class Holder {
    static final SnapshotSettings SETTINGS = load();
    static final SnapshotAssertion ASSERTION = new SnapshotAssertion(
        new FileSnapshotStore(), DefaultContentCapture.create(), new SnapshotNamer());

    private static SnapshotSettings load() {
      SnapshotSettings settings = SettingsMerger.resolve(log::warn);
      if (settings.verbose()) {
        LoggingConfigurator.enableVerboseLogging();
      }
      log.debug("Snapshot settings: update={}, workspace={}", settings.update(), settings.workspaceRoot());
      return settings;
    }
  }
}
