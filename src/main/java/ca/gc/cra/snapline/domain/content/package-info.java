/**
 * Format-agnostic content tree and copy-on-write navigation over it.
 */
package ca.gc.cra.snapline.domain.content;
