/**
 * Harness settings: defaults, YAML file, environment and system properties.
 * <p><strong>Role:</strong> Bootstrap layer; the core never reads configuration itself.</p>
 * <p><strong>Concurrency:</strong> Settings are immutable records; safe to share.</p>
 */
package ca.gc.cra.snapline.config;
