/**
 * Call-site entry points: the static {@link ca.gc.cra.snapline.api.Snapshots} facade and the bound
 * {@link ca.gc.cra.snapline.api.SnapshotAsserter}.
 * <p><strong>Role:</strong> Driving adapter; resolves settings, derives call-site identity, turns failures into
 * {@link java.lang.AssertionError}.</p>
 */
package ca.gc.cra.snapline.api;
