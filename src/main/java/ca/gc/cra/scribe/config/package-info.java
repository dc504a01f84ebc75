/**
 * Programmatic builders, YAML loading and the composition root that assemble logging pipelines.
 *
 * @since 0.1.0
 */
package ca.gc.cra.scribe.config;
