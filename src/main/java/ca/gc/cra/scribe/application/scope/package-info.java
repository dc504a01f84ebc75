/**
 * Per-thread stack of logging scopes whose merged properties are attached to every entry.
 *
 * @since 0.1.0
 */
package ca.gc.cra.scribe.application.scope;
