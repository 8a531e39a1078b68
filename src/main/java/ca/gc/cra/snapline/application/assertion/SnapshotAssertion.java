package ca.gc.cra.snapline.application.assertion;

import ca.gc.cra.snapline.application.diff.LineDiff;
import ca.gc.cra.snapline.application.format.ContentRenderers;
import ca.gc.cra.snapline.application.format.SnapshotFormat;
import ca.gc.cra.snapline.application.port.ContentCapture;
import ca.gc.cra.snapline.application.port.SnapshotStore;
import ca.gc.cra.snapline.application.redaction.RedactionRule;
import ca.gc.cra.snapline.application.redaction.Redactor;
import ca.gc.cra.snapline.domain.content.Content;
import ca.gc.cra.snapline.domain.snapshot.SnapshotFile;
import ca.gc.cra.snapline.domain.snapshot.SnapshotIdentity;
import ca.gc.cra.snapline.domain.snapshot.SnapshotLocation;
import ca.gc.cra.snapline.domain.snapshot.SnapshotMetadata;
import ca.gc.cra.snapline.logging.Logs;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Coordinates one snapshot assertion from captured value to terminal outcome.
 * <p><strong>Why:</strong> Keeps capture, redaction, rendering, persistence and diffing behind a single
 * call that never throws on mismatch.</p>
 * <p><strong>Role:</strong> Application service driven by the call-site API.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Walk {@link AssertionState#START} to {@link AssertionState#RENDERED} to {@link AssertionState#COMPARED}
 *   and end in exactly one terminal state.</li>
 *   <li>Assign naming sequences through its {@link SnapshotNamer}.</li>
 *   <li>On mismatch write either a pending artifact or, in update mode, the baseline.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use when the store is; the namer is the only shared
 * mutable state.</p>
 * <p><strong>Observability:</strong> DEBUG per state transition with the snapshot label in MDC key
 * {@code snapshot}; INFO on baseline updates; WARN on mismatches with the pending path.</p>
 *
 * @since 0.1.0
 */
public final class SnapshotAssertion {
  private static final Logger log = LoggerFactory.getLogger(SnapshotAssertion.class);
  private static final String MDC_KEY = "snapshot";

  private final SnapshotStore store;
  private final ContentCapture capture;
  private final Redactor redactor;
  private final SnapshotNamer namer;

  /**
   * Creates a coordinator with its own naming scope.
   *
   * @param store snapshot persistence
   * @param capture value capture
   */
  public SnapshotAssertion(SnapshotStore store, ContentCapture capture) {
    this(store, capture, new SnapshotNamer());
  }

  /**
   * Creates a coordinator sharing {@code namer} with other coordinators.
   *
   * @param store snapshot persistence
   * @param capture value capture
   * @param namer naming sequence scope
   */
  public SnapshotAssertion(SnapshotStore store, ContentCapture capture, SnapshotNamer namer) {
    this.store = Objects.requireNonNull(store, "store");
    this.capture = Objects.requireNonNull(capture, "capture");
    this.namer = Objects.requireNonNull(namer, "namer");
    this.redactor = new Redactor();
  }

  /**
   * Asserts a structured value.
   *
   * @param identity identity before sequencing
   * @param value value to capture
   * @param rules redaction rules
   * @param format rendering format
   * @param mode update mode
   * @return terminal outcome
   */
  public AssertionOutcome check(
      SnapshotIdentity identity, Object value, List<RedactionRule> rules, SnapshotFormat format, UpdateMode mode) {
    return check(AssertionRequest.ofValue(identity, null, value, format, rules), mode);
  }

  /**
   * Asserts pre-rendered text.
   *
   * @param identity identity before sequencing
   * @param expression expression text or {@code null}
   * @param text text to compare
   * @param mode update mode
   * @return terminal outcome
   */
  public AssertionOutcome checkText(SnapshotIdentity identity, String expression, String text, UpdateMode mode) {
    return check(AssertionRequest.ofText(identity, expression, text), mode);
  }

  /**
   * Runs {@code request} to a terminal outcome.
   *
   * @param request assertion request
   * @param mode update mode
   * @return {@link AssertionOutcome.Passed}, {@link AssertionOutcome.Failed} or {@link AssertionOutcome.Updated}
   * @throws ca.gc.cra.snapline.application.format.SerializationException when the value cannot be captured or
   *     rendered; nothing is written in that case
   * @throws ca.gc.cra.snapline.application.port.SnapshotIoException when reading or writing snapshot files fails
   */
  public AssertionOutcome check(AssertionRequest request, UpdateMode mode) {
    Objects.requireNonNull(request, "request");
    Objects.requireNonNull(mode, "mode");
    String rendered = render(request);
    SnapshotIdentity identity = namer.assign(request.identity());

    String previous = MDC.get(MDC_KEY);
    try {
      MDC.put(MDC_KEY, identity.describe());
      log.debug("{} rendered {} as {}: {}", AssertionState.RENDERED, identity.describe(), request.kind(),
          Logs.body(rendered));
      return compare(identity, request, rendered, mode);
    } finally {
      if (previous == null) {
        MDC.remove(MDC_KEY);
      } else {
        MDC.put(MDC_KEY, previous);
      }
    }
  }

  /** Forgets naming sequences of this coordinator's scope. */
  public void resetNaming() {
    namer.reset();
  }

  private String render(AssertionRequest request) {
    if (request.isText()) {
      return request.text();
    }
    Content tree = capture.capture(request.value());
    Content redacted = redactor.apply(tree, request.rules());
    return ContentRenderers.forFormat(request.format()).render(redacted);
  }

  private AssertionOutcome compare(
      SnapshotIdentity identity, AssertionRequest request, String rendered, UpdateMode mode) {
    SnapshotLocation location = store.resolve(identity);
    Optional<SnapshotFile> baseline = store.loadBaseline(location);
    SnapshotStore.Comparison comparison = store.compare(baseline, rendered);
    log.debug("{} {} against {}: {}", AssertionState.COMPARED, identity.describe(), location.baseline(),
        comparison);

    if (comparison == SnapshotStore.Comparison.EQUAL) {
      return new AssertionOutcome.Passed(identity, location);
    }
    SnapshotFile candidate = new SnapshotFile(metadata(identity, request), rendered);
    if (mode == UpdateMode.ON) {
      store.writeBaseline(location, candidate);
      return new AssertionOutcome.Updated(identity, location);
    }
    store.writePending(location, candidate);
    String expected = baseline.map(SnapshotFile::body).orElse("");
    String diff = LineDiff.between(expected, candidate.body()).toUnified();
    log.warn("Snapshot {} mismatch; pending snapshot written to {}", identity.describe(), location.pending());
    return new AssertionOutcome.Failed(
        identity, request.expression(), location, diff, baseline.isPresent());
  }

  private static SnapshotMetadata metadata(SnapshotIdentity identity, AssertionRequest request) {
    return new SnapshotMetadata(
        identity.sourceFile(), identity.line(), request.expression(), identity.name(), request.kind());
  }
}
