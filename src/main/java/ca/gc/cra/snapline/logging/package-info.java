/**
 * Logging helpers and runtime verbosity control for Logback.
 */
package ca.gc.cra.snapline.logging;
