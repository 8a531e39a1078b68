/**
 * Ports consumed by the assertion coordinator.
 */
package ca.gc.cra.snapline.application.port;
