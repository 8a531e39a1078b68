/**
 * Snapshot identity, on-disk artifact model and the header/body codec.
 */
package ca.gc.cra.snapline.domain.snapshot;
