/**
 * Snapshot use cases: redaction, rendering, diffing and the assertion coordinator.
 * <p><strong>Role:</strong> Application layer between the call-site API and persistence adapters.</p>
 * <p><strong>Concurrency:</strong> Invocation-scoped; the naming sequence is the only shared mutable state.</p>
 */
package ca.gc.cra.snapline.application;
