/**
 * Adapters implementing application ports against the filesystem and JDK value types.
 */
package ca.gc.cra.snapline.infrastructure;
