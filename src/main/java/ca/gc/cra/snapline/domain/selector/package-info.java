/**
 * Selector expressions addressing content tree nodes for redaction.
 * <p><strong>Concurrency:</strong> Parsed selectors are immutable.</p>
 */
package ca.gc.cra.snapline.domain.selector;
