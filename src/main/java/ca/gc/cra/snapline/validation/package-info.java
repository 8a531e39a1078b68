/**
 * Shared argument validation helpers.
 */
package ca.gc.cra.snapline.validation;
