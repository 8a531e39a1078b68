package ca.gc.cra.snapline.application.assertion;

import ca.gc.cra.snapline.application.format.SnapshotFormat;
import ca.gc.cra.snapline.application.redaction.RedactionRule;
import ca.gc.cra.snapline.domain.snapshot.SnapshotIdentity;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * One snapshot assertion as issued by a call site.
 *
 * <p>Exactly one of two shapes: a structured value rendered with {@link #format()} (after capture and
 * redaction), or pre-rendered text compared verbatim ({@link #format()} is {@code null}).</p>
 *
 * @param identity snapshot identity before sequencing
 * @param expression source expression of the value, for diagnostics; may be {@code null}
 * @param value value to capture; ignored for text requests
 * @param text pre-rendered text; {@code null} for structured requests
 * @param rules redaction rules applied in order; empty for text requests
 * @param format rendering format; {@code null} for text requests
 * @param kind label recorded in the snapshot header, e.g. {@code json} or {@code debug}
 * @since 0.1.0
 */
public record AssertionRequest(
    SnapshotIdentity identity,
    String expression,
    Object value,
    String text,
    List<RedactionRule> rules,
    SnapshotFormat format,
    String kind) {

  public AssertionRequest {
    Objects.requireNonNull(identity, "identity");
    Objects.requireNonNull(kind, "kind");
    rules = rules == null ? List.of() : List.copyOf(rules);
    if ((format == null) == (text == null)) {
      throw new IllegalArgumentException("request must carry either a format or pre-rendered text");
    }
    if (text != null && !rules.isEmpty()) {
      throw new IllegalArgumentException("redaction rules do not apply to text snapshots");
    }
  }

  /**
   * Structured snapshot of {@code value}.
   *
   * @param identity identity
   * @param expression expression text or {@code null}
   * @param value value to capture
   * @param format rendering format
   * @param rules redaction rules
   * @return request
   */
  public static AssertionRequest ofValue(
      SnapshotIdentity identity,
      String expression,
      Object value,
      SnapshotFormat format,
      List<RedactionRule> rules) {
    Objects.requireNonNull(format, "format");
    return new AssertionRequest(
        identity, expression, value, null, rules, format, format.name().toLowerCase(Locale.ROOT));
  }

  /**
   * Raw text snapshot; skips capture, redaction and rendering.
   *
   * @param identity identity
   * @param expression expression text or {@code null}
   * @param text text to compare
   * @return request
   */
  public static AssertionRequest ofText(SnapshotIdentity identity, String expression, String text) {
    Objects.requireNonNull(text, "text");
    return new AssertionRequest(identity, expression, null, text, List.of(), null, "text");
  }

  /**
   * Debug snapshot; compares {@link String#valueOf(Object)} of {@code value}.
   *
   * @param identity identity
   * @param expression expression text or {@code null}
   * @param value value whose {@code toString} is recorded
   * @return request
   */
  public static AssertionRequest ofDebug(SnapshotIdentity identity, String expression, Object value) {
    return new AssertionRequest(
        identity, expression, null, String.valueOf(value), List.of(), null, "debug");
  }

  public boolean isText() {
    return text != null;
  }
}
